package com.id.gridseries.modules.ingestion.service;

import com.id.gridseries.config.AppConfig;
import com.id.gridseries.modules.datasets.service.DatasetRegistry;
import com.id.gridseries.modules.ingestion.exception.IngestionException;
import com.id.gridseries.modules.ingestion.logic.ParallelTransformer;
import com.id.gridseries.modules.ingestion.logic.SampleLineParser;
import com.id.gridseries.modules.ingestion.logic.SkipPolicy;
import com.id.gridseries.modules.ingestion.logic.TransformStats;
import com.id.gridseries.modules.ingestion.model.IngestionJob;
import com.id.gridseries.modules.ingestion.model.IngestionRequest;
import com.id.gridseries.modules.ingestion.model.IngestionSummary;
import com.id.gridseries.modules.ingestion.model.enums.IngestionMode;
import com.id.gridseries.modules.ingestion.progress.IngestionProgressListener;
import com.id.gridseries.modules.ingestion.progress.LoggingProgressListener;
import com.id.gridseries.modules.ingestion.reader.CsvChunkReader;
import com.id.gridseries.modules.ingestion.reader.CsvSource;
import com.id.gridseries.modules.store.SampleStore;
import com.id.gridseries.modules.store.SampleStoreSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;

/**
 * Runs ingestion jobs: read, transform in parallel, bulk load, all inside one store transaction.
 */
@Service
@Slf4j
public class IngestionService {

    private final AppConfig appConfig;
    private final DatasetRegistry datasetRegistry;
    private final SampleStore sampleStore;

    public IngestionService(AppConfig appConfig, DatasetRegistry datasetRegistry, SampleStore sampleStore) {
        this.appConfig = appConfig;
        this.datasetRegistry = datasetRegistry;
        this.sampleStore = sampleStore;
    }

    public IngestionSummary ingest(IngestionRequest request) {
        IngestionJob job = resolveJob(request);
        return ingest(job, new LoggingProgressListener(job.getDatasetName(), appConfig.getIngestionProgressIntervalRows()));
    }

    public IngestionJob resolveJob(IngestionRequest req) {
        if (req == null) {
            throw new IllegalArgumentException("Request cannot be null");
        }
        Path sourcePath = resolveSourcePath(req.getSourcePath());
        if (datasetRegistry.find(req.getDatasetName()).isEmpty()) {
            throw new IllegalArgumentException("Unknown dataset '%s'".formatted(req.getDatasetName()));
        }

        int workers = appConfig.resolveWorkerCount(req.getWorkerCount());
        if (workers <= 0) {
            throw new IllegalArgumentException("Worker count must be greater than zero");
        }
        int chunkSize = Optional.ofNullable(req.getChunkSize()).orElse(appConfig.getIngestionChunkSize());
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be greater than zero");
        }
        if (chunkSize > appConfig.getIngestionMaxChunkSize()) {
            throw new IllegalArgumentException("Chunk size %d exceeds the maximum of %d"
                    .formatted(chunkSize, appConfig.getIngestionMaxChunkSize()));
        }
        double threshold = Optional.ofNullable(req.getSkipThreshold()).orElse(appConfig.getIngestionSkipThreshold());
        if (Double.isNaN(threshold) || threshold < 0 || threshold > 1) {
            throw new IllegalArgumentException("Skip threshold must be within [0, 1], got " + threshold);
        }

        ZoneId zone;
        try {
            zone = ZoneId.of(Optional.ofNullable(req.getSourceZone()).orElse(appConfig.getIngestionSourceZone()));
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Invalid source zone '%s'".formatted(req.getSourceZone()), e);
        }

        return IngestionJob.builder()
                .sourcePath(sourcePath)
                .datasetName(req.getDatasetName())
                .mode(Optional.ofNullable(req.getMode()).orElse(appConfig.getIngestionMode()))
                .workerCount(workers)
                .skipThreshold(threshold)
                .chunkSize(chunkSize)
                .timestampFormat(Optional.ofNullable(req.getTimestampFormat()).orElse(appConfig.getIngestionTimestampFormat()))
                .sourceZone(zone)
                .build();
    }

    /**
     * Resolves a request path against the configured source folder. Absolute paths and {@code ..}
     * segments are accepted only while the normalized result stays inside that folder.
     */
    Path resolveSourcePath(String requested) {
        if (requested == null || requested.isBlank()) {
            throw new IllegalArgumentException("Source path cannot be empty");
        }
        Path baseDir = Path.of(appConfig.getIngestionSourceDir()).toAbsolutePath().normalize();
        Path fullPath;
        try {
            fullPath = baseDir.resolve(requested.trim()).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException("Invalid source path '%s'".formatted(requested), e);
        }
        if (!fullPath.startsWith(baseDir) || fullPath.equals(baseDir)) {
            throw new IllegalArgumentException("Source path '%s' is outside the source folder".formatted(requested));
        }
        return fullPath;
    }

    public IngestionSummary ingest(IngestionJob job, IngestionProgressListener progressListener) {
        log.info("Ingesting {} into '{}' (mode={}, workers={}, chunkSize={}, skipThreshold={})",
                job.getSourcePath(), job.getDatasetName(), job.getMode(), job.getWorkerCount(),
                job.getChunkSize(), job.getSkipThreshold());

        Instant start = Instant.now();
        SkipPolicy skipPolicy = new SkipPolicy(job.getSkipThreshold());
        CsvSource source = new CsvSource(job.getSourcePath(), job.getChunkSize());

        try (CsvChunkReader reader = source.open();
             SampleStoreSession session = sampleStore.openSession(job.getDatasetName())) {

            session.ensureSchema();
            if (job.getMode() == IngestionMode.REPLACE) {
                session.truncate();
            }

            SampleLineParser parser = new SampleLineParser(reader.separator(), job.getTimestampFormat(), job.getSourceZone());
            ParallelTransformer transformer = new ParallelTransformer(parser, job.getWorkerCount(), progressListener);
            TransformStats stats = transformer.transform(reader, session::append);
            long loaded = session.endLoad();

            long rowsRead = reader.linesRead();
            skipPolicy.check(stats.rowsSkipped(), rowsRead);
            session.commit();

            Duration elapsed = Duration.between(start, Instant.now());
            IngestionSummary summary = IngestionSummary.builder()
                    .datasetName(job.getDatasetName())
                    .mode(job.getMode())
                    .rowsRead(rowsRead)
                    .rowsSkipped(stats.rowsSkipped())
                    .rowsLoaded(loaded)
                    .chunks(stats.chunks())
                    .workerCount(job.getWorkerCount())
                    .elapsedMillis(elapsed.toMillis())
                    .build();

            log.info("Ingestion into '{}' complete: {} read, {} skipped, {} loaded in {} ms ({} rows/s)",
                    summary.getDatasetName(),
                    "%,d".formatted(summary.getRowsRead()),
                    "%,d".formatted(summary.getRowsSkipped()),
                    "%,d".formatted(summary.getRowsLoaded()),
                    summary.getElapsedMillis(),
                    "%,.2f".formatted(summary.getRowsPerSecond()));
            return summary;
        } catch (IngestionException e) {
            log.error("Ingestion into '{}' failed at stage {}: {}", job.getDatasetName(), e.getStage(), e.getMessage());
            throw e;
        }
    }
}
