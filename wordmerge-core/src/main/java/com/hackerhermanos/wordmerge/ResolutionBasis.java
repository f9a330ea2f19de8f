package com.hackerhermanos.wordmerge;

/**
 * How a file's charset was decided.
 */
public enum ResolutionBasis {

	/** Zero-length file, nothing to decode. */
	EMPTY_FILE,

	/** File larger than the detection ceiling, assumed legacy without sampling. */
	SIZE_CEILING,

	/** Statistical guess that validated against the sample. */
	DETECTED,

	/** UTF-8 byte order mark. */
	BYTE_ORDER_MARK,

	/** Byte-level heuristic on the sample. */
	HEURISTIC,

	/** Charset forced by the caller. */
	FORCED,

	/** First charset of a try-sequence that validated. */
	SEQUENCE,

	/** Nothing validated. */
	FALLBACK

}
