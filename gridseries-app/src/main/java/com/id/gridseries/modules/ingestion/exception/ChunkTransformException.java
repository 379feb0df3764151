package com.id.gridseries.modules.ingestion.exception;

import com.id.gridseries.modules.ingestion.model.enums.IngestionStage;
import lombok.Getter;

/**
 * A worker failed on a whole chunk, as opposed to a single unparsable line.
 */
@Getter
public class ChunkTransformException extends IngestionException {

    private final long chunkIndex;
    private final long firstLine;
    private final long lastLine;

    public ChunkTransformException(long chunkIndex, long firstLine, long lastLine, Throwable cause) {
        super(IngestionStage.TRANSFORM,
                "Chunk %d (lines %d-%d) failed: %s".formatted(chunkIndex, firstLine, lastLine, cause.getMessage()),
                cause);
        this.chunkIndex = chunkIndex;
        this.firstLine = firstLine;
        this.lastLine = lastLine;
    }
}
