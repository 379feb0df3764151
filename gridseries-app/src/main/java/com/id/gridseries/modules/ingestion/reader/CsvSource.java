package com.id.gridseries.modules.ingestion.reader;

import com.id.gridseries.modules.ingestion.exception.SourceNotFoundException;
import com.id.gridseries.modules.ingestion.exception.SourceReadException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * A CSV file with one header line. Each {@link #open()} starts a fresh pass over the same lines.
 */
public class CsvSource {

    private static final int READ_BUFFER_SIZE = 64 * 1024;

    private final Path path;
    private final int chunkSize;

    public CsvSource(Path path, int chunkSize) {
        if (path == null) {
            throw new IllegalArgumentException("Source path cannot be null");
        }
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be greater than zero");
        }
        this.path = path;
        this.chunkSize = chunkSize;
    }

    public CsvChunkReader open() {
        if (!Files.exists(path) || Files.isDirectory(path)) {
            throw new SourceNotFoundException(path);
        }
        try {
            // InputStreamReader replaces malformed input instead of failing the whole job
            BufferedReader reader = new BufferedReader(
                    new InputStreamReader(Files.newInputStream(path), StandardCharsets.UTF_8),
                    READ_BUFFER_SIZE);
            return new CsvChunkReader(path, reader, chunkSize);
        } catch (NoSuchFileException e) {
            throw new SourceNotFoundException(path);
        } catch (IOException e) {
            throw new SourceReadException(path, e);
        }
    }
}
