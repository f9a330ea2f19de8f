/**
 * Wordmerge core package: encoding-aware ingestion, batched deduplication and
 * checkpointed merge runs.
 *
 * <p>
 * This package is null-marked, meaning all reference types are non-null by default unless
 * explicitly annotated with @Nullable.
 */
@NullMarked
package com.hackerhermanos.wordmerge;

import org.jspecify.annotations.NullMarked;
