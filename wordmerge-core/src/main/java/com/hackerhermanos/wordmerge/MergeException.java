package com.hackerhermanos.wordmerge;

import org.jspecify.annotations.Nullable;

/**
 * Unchecked failure of a merge run, tagged with the {@link ErrorKind} that caused it.
 */
public class MergeException extends RuntimeException {

	private final ErrorKind kind;

	public MergeException(ErrorKind kind, String message) {
		super(message);
		this.kind = kind;
	}

	public MergeException(ErrorKind kind, String message, @Nullable Throwable cause) {
		super(message, cause);
		this.kind = kind;
	}

	public ErrorKind kind() {
		return kind;
	}

	@Override
	public String getMessage() {
		return kind.name().toLowerCase().replace('_', ' ') + " error: " + super.getMessage();
	}

}
