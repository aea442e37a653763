package com.upsearch.source;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileSourceFetcherTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldReadArchiveFromDirectory() throws IOException {
        Files.write(tempDir.resolve("00_All_Records.zip"), new byte[] {1, 2, 3});
        FileSourceFetcher fetcher = new FileSourceFetcher(tempDir);

        assertThat(fetcher.fetch("00_All_Records.zip")).containsExactly(1, 2, 3);
    }

    @Test
    void shouldFailForMissingFile() {
        FileSourceFetcher fetcher = new FileSourceFetcher(tempDir);

        assertThatThrownBy(() -> fetcher.fetch("nope.zip"))
            .isInstanceOf(FetchFailedException.class)
            .hasMessageContaining("nope.zip")
            .hasCauseInstanceOf(IOException.class);
    }
}
