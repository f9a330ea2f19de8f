package com.hackerhermanos.wordmerge;

import java.util.Optional;

/**
 * One row of the detection decision table.
 */
@FunctionalInterface
interface EncodingRule {

	Optional<EncodingProfile> apply(DetectionSample sample);

}
