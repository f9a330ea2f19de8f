package com.hackerhermanos.wordmerge;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("FileOrderOptimizer Tests")
class FileOrderOptimizerTest {

	private static final long MIB = 1024L * 1024;

	@TempDir
	Path tempDir;

	@Test
	@DisplayName("Should emit large, medium and small buckets in that order")
	void shouldOrderBuckets() {
		FileDescriptor small = new FileDescriptor(Path.of("small"), 10 * MIB);
		FileDescriptor tiny = new FileDescriptor(Path.of("tiny"), 1);
		FileDescriptor medium = new FileDescriptor(Path.of("medium"), 500 * MIB);
		FileDescriptor large = new FileDescriptor(Path.of("large"), 2000 * MIB);

		List<FileDescriptor> ordered = FileOrderOptimizer.optimize(List.of(tiny, small, medium, large));

		assertThat(ordered).containsExactly(large, medium, small, tiny);
	}

	@Test
	@DisplayName("Should treat the bucket limits as exclusive upper bounds")
	void shouldUseExclusiveLimits() {
		FileDescriptor atSmallLimit = new FileDescriptor(Path.of("a"), FileOrderOptimizer.SMALL_LIMIT);
		FileDescriptor belowSmallLimit = new FileDescriptor(Path.of("b"), FileOrderOptimizer.SMALL_LIMIT - 1);
		FileDescriptor atMediumLimit = new FileDescriptor(Path.of("c"), FileOrderOptimizer.MEDIUM_LIMIT);

		List<FileDescriptor> ordered = FileOrderOptimizer
			.optimize(List.of(belowSmallLimit, atSmallLimit, atMediumLimit));

		assertThat(ordered).containsExactly(atMediumLimit, atSmallLimit, belowSmallLimit);
	}

	@Test
	@DisplayName("Should return an empty list for no files")
	void shouldHandleEmptyInput() {
		assertThat(FileOrderOptimizer.optimize(List.of())).isEmpty();
	}

	@Test
	@DisplayName("Should collect sizes and report missing files")
	void shouldCollectMetadata() throws IOException {
		Path present = tempDir.resolve("present.txt");
		Files.writeString(present, "abc\n");
		Path missing = tempDir.resolve("missing.txt");
		ErrorLog errorLog = new ErrorLog(tempDir.resolve("error.log"));

		List<FileDescriptor> descriptors = FileOrderOptimizer.collectMetadata(List.of(present, missing), errorLog);

		assertThat(descriptors).containsExactly(new FileDescriptor(present, 4));
		assertThat(Files.readString(errorLog.file())).contains("Input file not found, skipping: " + missing);
	}

}
