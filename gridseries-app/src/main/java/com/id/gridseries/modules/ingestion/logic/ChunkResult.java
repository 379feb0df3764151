package com.id.gridseries.modules.ingestion.logic;

import com.id.gridseries.model.Sample;
import com.id.gridseries.modules.ingestion.exception.LineParseException;

import java.util.List;

/**
 * Outcome of one chunk. {@code firstError} is null when every line parsed.
 */
public record ChunkResult(long index, List<Sample> samples, long skipped, LineParseException firstError) {
}
