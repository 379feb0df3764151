package com.id.gridseries.modules.ingestion.logic;

public record TransformStats(long chunks, long rowsParsed, long rowsSkipped) {
}
