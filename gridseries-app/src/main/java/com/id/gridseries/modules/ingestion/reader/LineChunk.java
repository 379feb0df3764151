package com.id.gridseries.modules.ingestion.reader;

import java.util.List;

/**
 * A contiguous run of non-blank data lines. {@code lineNumbers[i]} is the 1-based file line of {@code lines[i]}.
 */
public record LineChunk(long index, List<String> lines, long[] lineNumbers) {

    public long firstLine() {
        return lineNumbers.length == 0 ? 0 : lineNumbers[0];
    }

    public long lastLine() {
        return lineNumbers.length == 0 ? 0 : lineNumbers[lineNumbers.length - 1];
    }

    public int size() {
        return lines.size();
    }
}
