package com.id.gridseries.modules.ingestion.runner;

import com.id.gridseries.modules.ingestion.model.IngestionRequest;
import com.id.gridseries.modules.ingestion.model.IngestionSummary;
import com.id.gridseries.modules.ingestion.model.enums.IngestionMode;
import com.id.gridseries.modules.ingestion.service.IngestionService;
import com.id.gridseries.modules.ingestion.util.CsvTimestampParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * Runs one ingestion job at startup when {@code --ingest.source} is given, e.g.
 * {@code --ingest.source=Sollfrequenz.csv --ingest.dataset=swissgrid_frequency_data --ingest.mode=replace}.
 * The source is resolved against {@code gridseries.ingestion.source-dir}. A failed job fails the startup.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class IngestionCommandRunner implements ApplicationRunner {

    static final String OPT_SOURCE = "ingest.source";
    static final String OPT_DATASET = "ingest.dataset";
    static final String OPT_MODE = "ingest.mode";
    static final String OPT_WORKERS = "ingest.workers";
    static final String OPT_SKIP_THRESHOLD = "ingest.skip-threshold";
    static final String OPT_CHUNK_SIZE = "ingest.chunk-size";
    static final String OPT_TIMESTAMP_FORMAT = "ingest.timestamp-format";
    static final String OPT_ZONE = "ingest.zone";

    private final IngestionService ingestionService;

    @Override
    public void run(ApplicationArguments args) {
        if (!args.containsOption(OPT_SOURCE)) {
            return;
        }
        IngestionRequest req = IngestionRequest.builder()
                .sourcePath(option(args, OPT_SOURCE, Function.identity()))
                .datasetName(option(args, OPT_DATASET, Function.identity()))
                .mode(option(args, OPT_MODE, v -> IngestionMode.valueOf(v.trim().toUpperCase(Locale.ROOT))))
                .workerCount(option(args, OPT_WORKERS, Integer::valueOf))
                .skipThreshold(option(args, OPT_SKIP_THRESHOLD, Double::valueOf))
                .chunkSize(option(args, OPT_CHUNK_SIZE, Integer::valueOf))
                .timestampFormat(option(args, OPT_TIMESTAMP_FORMAT, CsvTimestampParser::resolveFormat))
                .sourceZone(option(args, OPT_ZONE, Function.identity()))
                .build();

        IngestionSummary summary = ingestionService.ingest(req);
        log.info("Command line ingestion finished: {}", summary);
    }

    private static <T> T option(ApplicationArguments args, String name, Function<String, T> convert) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        String raw = values.get(values.size() - 1);
        if (raw.isBlank()) {
            return null;
        }
        try {
            return convert.apply(raw);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid value '%s' for --%s".formatted(raw, name), e);
        }
    }
}
