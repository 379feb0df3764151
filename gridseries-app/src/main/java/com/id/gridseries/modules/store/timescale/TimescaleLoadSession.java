package com.id.gridseries.modules.store.timescale;

import com.id.gridseries.model.Sample;
import com.id.gridseries.modules.ingestion.exception.LoadFailedException;
import com.id.gridseries.modules.store.SampleStoreSession;
import lombok.extern.slf4j.Slf4j;
import org.postgresql.PGConnection;
import org.postgresql.copy.CopyIn;

import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * Single-transaction write session. Rows go through {@code COPY ... FROM STDIN}, never per-row inserts.
 * <p>
 * {@link #truncate()} takes an ACCESS EXCLUSIVE lock on the table that is held until the session commits or
 * rolls back, so reads of the dataset block for the duration of a replace instead of seeing the previous rows.
 * Append sessions do not block readers.
 */
@Slf4j
public class TimescaleLoadSession implements SampleStoreSession {

    private final Connection connection;
    private final String table;
    private final boolean createHypertable;

    private CopyIn copyIn;
    private long rowsLoaded = 0;
    private boolean committed = false;
    private boolean closed = false;

    TimescaleLoadSession(Connection connection, String table, boolean createHypertable) {
        this.connection = connection;
        this.table = table;
        this.createHypertable = createHypertable;
    }

    @Override
    public String getDatasetName() {
        return table;
    }

    @Override
    public void ensureSchema() {
        String createTableSql = """
                CREATE TABLE IF NOT EXISTS %s (
                    timestamp TIMESTAMPTZ NOT NULL PRIMARY KEY,
                    frequency DOUBLE PRECISION NOT NULL
                )""".formatted(table);
        try (Statement st = connection.createStatement()) {
            st.execute(createTableSql);
        } catch (SQLException e) {
            throw new LoadFailedException("Creating table '%s' failed".formatted(table), e);
        }
        if (!createHypertable) {
            return;
        }
        try (PreparedStatement ps = connection.prepareStatement(
                "SELECT create_hypertable(?::regclass, 'timestamp', if_not_exists => TRUE)")) {
            ps.setString(1, table);
            ps.execute();
        } catch (SQLException e) {
            throw new LoadFailedException("Converting '%s' to a hypertable failed".formatted(table), e);
        }
        log.debug("Schema of '{}' is ready", table);
    }

    @Override
    public void truncate() {
        try (Statement st = connection.createStatement()) {
            st.execute("TRUNCATE TABLE " + table);
            log.info("Truncated '{}' (pending commit)", table);
        } catch (SQLException e) {
            throw new LoadFailedException("Truncating '%s' failed".formatted(table), e);
        }
    }

    @Override
    public void append(List<Sample> batch) {
        if (batch.isEmpty()) {
            return;
        }
        StringBuilder sb = new StringBuilder(batch.size() * 32);
        for (Sample sample : batch) {
            sb.append(sample.timestamp()).append(',').append(sample.value()).append('\n');
        }
        byte[] bytes = sb.toString().getBytes(StandardCharsets.UTF_8);
        try {
            if (copyIn == null) {
                copyIn = connection.unwrap(PGConnection.class)
                        .getCopyAPI()
                        .copyIn("COPY %s (timestamp, frequency) FROM STDIN WITH (FORMAT csv)".formatted(table));
            }
            copyIn.writeToCopy(bytes, 0, bytes.length);
        } catch (SQLException e) {
            throw new LoadFailedException("Bulk load into '%s' failed".formatted(table), e);
        }
    }

    @Override
    public long endLoad() {
        if (copyIn == null) {
            return rowsLoaded;
        }
        try {
            rowsLoaded += copyIn.endCopy();
            copyIn = null;
            return rowsLoaded;
        } catch (SQLException e) {
            throw new LoadFailedException("Bulk load into '%s' failed".formatted(table), e);
        }
    }

    @Override
    public void commit() {
        if (copyIn != null) {
            throw new IllegalStateException("Bulk load still open, call endLoad() first");
        }
        try {
            connection.commit();
            committed = true;
        } catch (SQLException e) {
            throw new LoadFailedException("Commit on '%s' failed".formatted(table), e);
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            if (copyIn != null && copyIn.isActive()) {
                copyIn.cancelCopy();
            }
        } catch (SQLException e) {
            log.warn("Cancelling COPY on '{}' failed", table, e);
        }
        try {
            if (!committed) {
                connection.rollback();
                log.warn("Session on '{}' rolled back", table);
            }
        } catch (SQLException e) {
            log.warn("Rollback on '{}' failed", table, e);
        }
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Closing connection of '{}' failed", table, e);
        }
    }
}
