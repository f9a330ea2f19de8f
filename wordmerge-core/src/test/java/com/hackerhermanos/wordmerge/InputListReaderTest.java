package com.hackerhermanos.wordmerge;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

@DisplayName("InputListReader Tests")
class InputListReaderTest {

	@TempDir
	Path tempDir;

	@Test
	@DisplayName("Should read one path per line, skipping blanks")
	void shouldReadPaths() throws IOException {
		Path list = tempDir.resolve("list.txt");
		Files.writeString(list, "/data/a.txt\n\n  /data/b.txt  \n\n");

		assertThat(InputListReader.read(list)).containsExactly(Path.of("/data/a.txt"), Path.of("/data/b.txt"));
	}

	@Test
	@DisplayName("Should report a missing list as a configuration error")
	void shouldFailForMissingList() {
		assertThatThrownBy(() -> InputListReader.read(tempDir.resolve("missing.txt")))
			.isInstanceOfSatisfying(MergeException.class,
					e -> assertThat(e.kind()).isEqualTo(ErrorKind.CONFIGURATION))
			.hasMessageContaining("Input file list not found");
	}

}
