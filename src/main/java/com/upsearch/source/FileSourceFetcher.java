package com.upsearch.source;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads source archives from a local directory, for offline runs against
 * previously downloaded dumps.
 */
public class FileSourceFetcher implements SourceFetcher {

    private static final Logger log = LoggerFactory.getLogger(FileSourceFetcher.class);

    private final Path baseDirectory;

    public FileSourceFetcher(Path baseDirectory) {
        this.baseDirectory = baseDirectory;
    }

    @Override
    public byte[] fetch(String location) {
        Path path = baseDirectory.resolve(location);
        try {
            byte[] bytes = Files.readAllBytes(path);
            log.info("Read {} bytes from {}", bytes.length, path);
            return bytes;
        } catch (IOException e) {
            throw new FetchFailedException(location, "Cannot read archive " + path + ": " + e.getMessage(), e);
        }
    }

    public Path getBaseDirectory() {
        return baseDirectory;
    }
}
