package com.id.gridseries.modules.store.timescale;

import com.id.gridseries.config.AppConfig;
import com.id.gridseries.model.TimeSeriesPoint;
import com.id.gridseries.modules.ingestion.exception.LoadFailedException;
import com.id.gridseries.modules.query.exception.DatasetNotFoundException;
import com.id.gridseries.modules.store.SampleStore;
import com.id.gridseries.modules.store.SampleStoreSession;
import com.id.gridseries.modules.store.SqlIdentifiers;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.function.Supplier;

/**
 * {@link SampleStore} on PostgreSQL with the TimescaleDB extension.
 * Writes use a dedicated connection per session; reads go through the pooled {@link JdbcTemplate}.
 */
@Repository
@Slf4j
public class TimescaleSampleStore implements SampleStore {

    static final String UNDEFINED_TABLE = "42P01";

    private final DataSource dataSource;
    private final JdbcTemplate jdbcTemplate;
    private final AppConfig appConfig;

    public TimescaleSampleStore(DataSource dataSource, JdbcTemplate jdbcTemplate, AppConfig appConfig) {
        this.dataSource = dataSource;
        this.jdbcTemplate = jdbcTemplate;
        this.appConfig = appConfig;
    }

    @Override
    public SampleStoreSession openSession(String datasetName) {
        String table = SqlIdentifiers.requireValid(datasetName);
        Connection connection = null;
        try {
            connection = dataSource.getConnection();
            connection.setAutoCommit(false);
            return new TimescaleLoadSession(connection, table, appConfig.isStoreCreateHypertable());
        } catch (SQLException e) {
            if (connection != null) {
                try {
                    connection.close();
                } catch (SQLException closeEx) {
                    e.addSuppressed(closeEx);
                }
            }
            throw new LoadFailedException("Opening a session on '%s' failed".formatted(table), e);
        }
    }

    @Override
    public List<TimeSeriesPoint> aggregate(String datasetName, Instant start, Instant end, Duration step) {
        String table = SqlIdentifiers.requireValid(datasetName);
        String sql = """
                SELECT time_bucket(CAST(? AS DOUBLE PRECISION) * INTERVAL '1 millisecond', timestamp) AS bucket, AVG(frequency) AS frequency
                FROM %s
                WHERE timestamp >= ? AND timestamp <= ?
                GROUP BY bucket
                ORDER BY bucket""".formatted(table);
        return translateMissingTable(datasetName, () -> jdbcTemplate.query(sql,
                pointMapper("bucket"),
                step.toMillis(), toOffset(start), toOffset(end)));
    }

    @Override
    public List<TimeSeriesPoint> fetch(String datasetName, Instant start, Instant end) {
        String table = SqlIdentifiers.requireValid(datasetName);
        String sql = """
                SELECT timestamp, frequency
                FROM %s
                WHERE timestamp >= ? AND timestamp <= ?
                ORDER BY timestamp""".formatted(table);
        return translateMissingTable(datasetName, () -> jdbcTemplate.query(sql,
                pointMapper("timestamp"),
                toOffset(start), toOffset(end)));
    }

    private static RowMapper<TimeSeriesPoint> pointMapper(String timestampColumn) {
        return (rs, rowNum) -> TimeSeriesPoint.builder()
                .timestamp(rs.getObject(timestampColumn, OffsetDateTime.class).toInstant())
                .frequency(rs.getDouble("frequency"))
                .build();
    }

    private static OffsetDateTime toOffset(Instant instant) {
        return instant.atOffset(ZoneOffset.UTC);
    }

    private <T> T translateMissingTable(String datasetName, Supplier<T> query) {
        try {
            return query.get();
        } catch (BadSqlGrammarException e) {
            SQLException sqlEx = e.getSQLException();
            if (sqlEx != null && UNDEFINED_TABLE.equals(sqlEx.getSQLState())) {
                log.debug("Table of dataset '{}' does not exist", datasetName);
                throw new DatasetNotFoundException(datasetName, e);
            }
            throw e;
        }
    }
}
