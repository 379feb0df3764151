package com.id.gridseries.modules.ingestion.reader;

import com.id.gridseries.modules.ingestion.exception.SourceReadException;
import com.id.gridseries.modules.ingestion.util.CsvLines;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Sequential, single-threaded reader handing out bounded chunks of data lines.
 */
@Slf4j
public class CsvChunkReader implements Closeable {

    private static final int INITIAL_CAPACITY = 1024;

    private final Path path;
    private final BufferedReader reader;
    private final int chunkSize;

    private String header;
    private char separator = ',';
    private boolean headerRead = false;
    private boolean eof = false;
    private long fileLine = 0;
    private long linesRead = 0;
    private long nextChunkIndex = 0;

    CsvChunkReader(Path path, BufferedReader reader, int chunkSize) {
        this.path = path;
        this.reader = reader;
        this.chunkSize = chunkSize;
    }

    public String header() {
        ensureHeader();
        return header;
    }

    public char separator() {
        ensureHeader();
        return separator;
    }

    /**
     * Data lines handed out so far, blank lines excluded.
     */
    public long linesRead() {
        return linesRead;
    }

    /**
     * @return the next chunk, or {@code null} once the file is exhausted
     */
    public LineChunk nextChunk() {
        ensureHeader();
        if (eof) {
            return null;
        }
        // capacity grows with the lines actually read, never up front to chunkSize
        List<String> lines = new ArrayList<>(Math.min(chunkSize, INITIAL_CAPACITY));
        long[] numbers = new long[Math.min(chunkSize, INITIAL_CAPACITY)];
        try {
            String line;
            while (lines.size() < chunkSize && (line = reader.readLine()) != null) {
                fileLine++;
                if (line.isBlank()) {
                    continue;
                }
                if (lines.size() == numbers.length) {
                    numbers = Arrays.copyOf(numbers, (int) Math.min(chunkSize, numbers.length * 2L));
                }
                numbers[lines.size()] = fileLine;
                lines.add(line);
            }
            if (lines.size() < chunkSize) {
                eof = true;
            }
        } catch (IOException e) {
            throw new SourceReadException(path, e);
        }
        if (lines.isEmpty()) {
            return null;
        }
        linesRead += lines.size();
        long[] lineNumbers = lines.size() == numbers.length ? numbers : Arrays.copyOf(numbers, lines.size());
        return new LineChunk(nextChunkIndex++, lines, lineNumbers);
    }

    private void ensureHeader() {
        if (headerRead) {
            return;
        }
        headerRead = true;
        try {
            String line = reader.readLine();
            if (line == null) {
                log.warn("Source {} is empty", path);
                eof = true;
                header = "";
                return;
            }
            fileLine++;
            header = CsvLines.stripBom(line);
            separator = CsvLines.detectSeparator(header, ',');
            log.debug("Source {} header='{}', separator='{}'", path, header, separator);
        } catch (IOException e) {
            throw new SourceReadException(path, e);
        }
    }

    @Override
    public void close() {
        try {
            reader.close();
        } catch (IOException e) {
            log.warn("Failed closing source {}", path, e);
        }
    }
}
