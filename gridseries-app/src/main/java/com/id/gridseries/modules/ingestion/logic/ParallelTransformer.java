package com.id.gridseries.modules.ingestion.logic;

import com.id.gridseries.model.Sample;
import com.id.gridseries.modules.ingestion.exception.ChunkTransformException;
import com.id.gridseries.modules.ingestion.exception.IngestionAbortedException;
import com.id.gridseries.modules.ingestion.exception.LineParseException;
import com.id.gridseries.modules.ingestion.progress.IngestionProgress;
import com.id.gridseries.modules.ingestion.progress.IngestionProgressListener;
import com.id.gridseries.modules.ingestion.reader.CsvChunkReader;
import com.id.gridseries.modules.ingestion.reader.LineChunk;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Fans chunks of raw lines out to a fixed pool of workers and hands the parsed samples to a sink
 * in source order.
 * <p>
 * The reader and the sink run on the calling thread. Workers only parse; a chunk's samples are
 * released to the sink once every earlier chunk has been released, whatever order the workers
 * finish in. At most {@code 2 * workerCount} chunks are held in memory.
 */
@Slf4j
public class ParallelTransformer {

    private final SampleLineParser parser;
    private final int workerCount;
    private final IngestionProgressListener progressListener;

    public ParallelTransformer(SampleLineParser parser, int workerCount, IngestionProgressListener progressListener) {
        if (workerCount <= 0) {
            throw new IllegalArgumentException("Worker count must be greater than zero");
        }
        this.parser = parser;
        this.workerCount = workerCount;
        this.progressListener = progressListener == null ? IngestionProgressListener.NONE : progressListener;
    }

    private record PendingChunk(LineChunk chunk, Future<ChunkResult> result) {
    }

    public TransformStats transform(CsvChunkReader reader, Consumer<List<Sample>> sink) {
        ExecutorService executor = new ThreadPoolExecutor(
                workerCount,
                workerCount,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                new CustomizableThreadFactory("ingest-worker-"));

        int maxInFlight = workerCount * 2;
        Deque<PendingChunk> inFlight = new ArrayDeque<>(maxInFlight);
        long started = System.nanoTime();
        long chunks = 0;
        long parsed = 0;
        long skipped = 0;

        try {
            LineChunk chunk;
            while ((chunk = reader.nextChunk()) != null) {
                LineChunk submitted = chunk;
                inFlight.addLast(new PendingChunk(submitted, executor.submit(() -> transformChunk(submitted))));

                if (inFlight.size() >= maxInFlight) {
                    ChunkResult result = awaitHead(inFlight);
                    sink.accept(result.samples());
                    chunks++;
                    parsed += result.samples().size();
                    skipped += result.skipped();
                    report(chunks, parsed, skipped, started);
                }
            }
            while (!inFlight.isEmpty()) {
                ChunkResult result = awaitHead(inFlight);
                sink.accept(result.samples());
                chunks++;
                parsed += result.samples().size();
                skipped += result.skipped();
                report(chunks, parsed, skipped, started);
            }
        } finally {
            inFlight.forEach(pending -> pending.result().cancel(true));
            executor.shutdownNow();
        }

        return new TransformStats(chunks, parsed, skipped);
    }

    private ChunkResult transformChunk(LineChunk chunk) {
        List<String> lines = chunk.lines();
        long[] lineNumbers = chunk.lineNumbers();
        List<Sample> samples = new ArrayList<>(chunk.size());
        long skipped = 0;
        LineParseException firstError = null;
        for (int i = 0; i < chunk.size(); i++) {
            try {
                samples.add(parser.parse(lines.get(i), lineNumbers[i]));
            } catch (LineParseException e) {
                skipped++;
                if (firstError == null) {
                    firstError = e;
                }
            }
        }
        return new ChunkResult(chunk.index(), samples, skipped, firstError);
    }

    private ChunkResult awaitHead(Deque<PendingChunk> inFlight) {
        PendingChunk head = inFlight.removeFirst();
        try {
            ChunkResult result = head.result().get();
            if (result.firstError() != null) {
                log.debug("Chunk {} skipped {} line(s), first: {}",
                        result.index(), result.skipped(), result.firstError().getMessage());
            }
            return result;
        } catch (ExecutionException e) {
            LineChunk chunk = head.chunk();
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ChunkTransformException(chunk.index(), chunk.firstLine(), chunk.lastLine(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IngestionAbortedException("Interrupted while waiting for chunk " + head.chunk().index(), e);
        }
    }

    private void report(long chunks, long parsed, long skipped, long startedNanos) {
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startedNanos);
        progressListener.onProgress(new IngestionProgress(chunks, parsed + skipped, skipped, elapsed));
    }
}
