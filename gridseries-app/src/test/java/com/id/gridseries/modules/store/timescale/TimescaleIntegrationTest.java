package com.id.gridseries.modules.store.timescale;

import com.id.gridseries.model.TimeSeriesPoint;
import com.id.gridseries.modules.ingestion.exception.IngestionAbortedException;
import com.id.gridseries.modules.ingestion.model.IngestionRequest;
import com.id.gridseries.modules.ingestion.model.IngestionSummary;
import com.id.gridseries.modules.ingestion.model.enums.IngestionMode;
import com.id.gridseries.modules.ingestion.service.IngestionService;
import com.id.gridseries.modules.query.exception.DatasetNotFoundException;
import com.id.gridseries.modules.query.service.TimeSeriesQueryService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class TimescaleIntegrationTest {

    private static final String SWISSGRID = "swissgrid_frequency_data";
    private static final Instant BASE = Instant.parse("2021-05-02T10:00:00Z");
    private static final DateTimeFormatter SWISSGRID_FORMAT =
            DateTimeFormatter.ofPattern("dd.MM.yy HH:mm:ss").withZone(ZoneOffset.UTC);

    @Container
    static final PostgreSQLContainer<?> timescale = new PostgreSQLContainer<>(
            DockerImageName.parse("timescale/timescaledb:latest-pg16").asCompatibleSubstituteFor("postgres"));

    @DynamicPropertySource
    static void datasourceProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", timescale::getJdbcUrl);
        registry.add("spring.datasource.username", timescale::getUsername);
        registry.add("spring.datasource.password", timescale::getPassword);
        registry.add("gridseries.ingestion.source-dir", () -> sourceDir.toString());
    }

    @TempDir
    static Path sourceDir;

    @Autowired
    IngestionService ingestionService;
    @Autowired
    TimeSeriesQueryService queryService;
    @Autowired
    JdbcTemplate jdbcTemplate;

    private Path swissgridExport(String name, int rows, int badLines) throws IOException {
        StringBuilder sb = new StringBuilder("Datum Zeit;A:f_soll_aktiv [Hz]\n");
        for (int i = 0; i < rows; i++) {
            Instant ts = BASE.plusSeconds(30L * i);
            sb.append("\"So. ").append(SWISSGRID_FORMAT.format(ts)).append("\";").append(i % 2 == 0 ? "50,000" : "50,020").append('\n');
        }
        for (int i = 0; i < badLines; i++) {
            sb.append("\"So. xx.05.21 10:00:00\";50,000\n");
        }
        Path file = sourceDir.resolve(name);
        Files.writeString(file, sb.toString());
        return file;
    }

    @Test
    void ingestThenQuery() throws IOException {
        Path file = swissgridExport("Sollfrequenz.csv", 240, 0);

        IngestionSummary summary = ingestionService.ingest(IngestionRequest.builder()
                .sourcePath(file.toString())
                .datasetName(SWISSGRID)
                .mode(IngestionMode.REPLACE)
                .build());
        assertEquals(240, summary.getRowsLoaded());

        // replace twice leaves the same content
        ingestionService.ingest(IngestionRequest.builder()
                .sourcePath(file.toString())
                .datasetName(SWISSGRID)
                .mode(IngestionMode.REPLACE)
                .build());
        assertEquals(240L, jdbcTemplate.queryForObject("SELECT count(*) FROM " + SWISSGRID, Long.class));

        List<TimeSeriesPoint> native30s = queryService.aggregated(SWISSGRID,
                "2021-05-02T10:00:00Z", "2021-05-02T10:01:00Z", "1s");
        assertEquals(3, native30s.size());
        assertEquals(BASE, native30s.get(0).getTimestamp());
        assertEquals(50.0, native30s.get(0).getFrequency(), 1e-9);
        assertEquals(50.02, native30s.get(1).getFrequency(), 1e-9);

        List<TimeSeriesPoint> perMinute = queryService.aggregated(SWISSGRID,
                "2021-05-02T10:00:00Z", "2021-05-02T10:59:59Z", "1m");
        assertEquals(60, perMinute.size());
        assertEquals(50.01, perMinute.get(0).getFrequency(), 1e-9);

        assertEquals(3, queryService.raw(SWISSGRID, "2021-05-02T10:00:00Z", "2021-05-02T10:01:00Z").size());
        assertTrue(queryService.raw(SWISSGRID, "2022-01-01T00:00:00Z", "2022-01-01T01:00:00Z").isEmpty());
    }

    @Test
    void abortedReplaceKeepsPreviousData() throws IOException {
        ingestionService.ingest(IngestionRequest.builder()
                .sourcePath(swissgridExport("good.csv", 100, 0).toString())
                .datasetName(SWISSGRID)
                .build());

        Path bad = swissgridExport("bad.csv", 20, 10);
        assertThrows(IngestionAbortedException.class, () -> ingestionService.ingest(IngestionRequest.builder()
                .sourcePath(bad.toString())
                .datasetName(SWISSGRID)
                .mode(IngestionMode.REPLACE)
                .skipThreshold(0.1)
                .build()));

        assertEquals(100L, jdbcTemplate.queryForObject("SELECT count(*) FROM " + SWISSGRID, Long.class));
    }

    @Test
    void registeredButNeverLoadedDatasetIsNotFound() {
        jdbcTemplate.execute("DROP TABLE IF EXISTS stresstest_frequency_data");
        assertThrows(DatasetNotFoundException.class, () -> queryService.raw("stresstest_frequency_data",
                "2021-05-02T10:00:00Z", "2021-05-02T11:00:00Z"));
    }
}
