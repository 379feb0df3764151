package com.id.gridseries.modules.store.timescale;

import com.id.gridseries.config.AppConfig;
import com.id.gridseries.modules.ingestion.exception.LoadFailedException;
import com.id.gridseries.modules.query.exception.DatasetNotFoundException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TimescaleSampleStoreTest {

    private static final Instant START = Instant.parse("2021-05-02T10:00:00Z");
    private static final Instant END = Instant.parse("2021-05-02T11:00:00Z");

    @Mock
    private DataSource dataSource;
    @Mock
    private JdbcTemplate jdbcTemplate;
    @Mock
    private AppConfig appConfig;

    private TimescaleSampleStore store() {
        return new TimescaleSampleStore(dataSource, jdbcTemplate, appConfig);
    }

    @SuppressWarnings("unchecked")
    @Test
    void aggregateBindsStepAndUtcBounds() {
        when(jdbcTemplate.query(anyString(), any(RowMapper.class), any(), any(), any())).thenReturn(List.of());

        assertTrue(store().aggregate("swissgrid_frequency_data", START, END, Duration.ofMinutes(15)).isEmpty());

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<Object> params = ArgumentCaptor.forClass(Object.class);
        verify(jdbcTemplate).query(sql.capture(), any(RowMapper.class), params.capture(), params.capture(), params.capture());
        assertTrue(sql.getValue().contains("time_bucket("));
        assertTrue(sql.getValue().contains("FROM swissgrid_frequency_data"));
        assertTrue(sql.getValue().contains("AVG(frequency)"));
        assertEquals(900_000L, params.getAllValues().get(0));
        assertEquals(OffsetDateTime.parse("2021-05-02T10:00:00Z"), params.getAllValues().get(1));
        assertEquals(OffsetDateTime.parse("2021-05-02T11:00:00Z"), params.getAllValues().get(2));
    }

    @SuppressWarnings("unchecked")
    @Test
    void missingTableIsDatasetNotFound() {
        when(jdbcTemplate.query(anyString(), any(RowMapper.class), any(), any())).thenThrow(new BadSqlGrammarException(
                "query", "SELECT ...", new SQLException("relation \"volume_frequency_data\" does not exist", "42P01")));

        DatasetNotFoundException e = assertThrows(DatasetNotFoundException.class,
                () -> store().fetch("volume_frequency_data", START, END));
        assertEquals("volume_frequency_data", e.getDatasetName());
    }

    @SuppressWarnings("unchecked")
    @Test
    void otherGrammarErrorsPropagate() {
        when(jdbcTemplate.query(anyString(), any(RowMapper.class), any(), any())).thenThrow(new BadSqlGrammarException(
                "query", "SELECT ...", new SQLException("column \"frequency\" does not exist", "42703")));

        assertThrows(BadSqlGrammarException.class, () -> store().fetch("volume_frequency_data", START, END));
    }

    @Test
    void rejectsUnsafeTableNames() {
        assertThrows(IllegalArgumentException.class,
                () -> store().fetch("data; DROP TABLE x", START, END));
        assertThrows(IllegalArgumentException.class,
                () -> store().openSession("Volume"));
        verifyNoInteractions(jdbcTemplate, dataSource);
    }

    @Test
    void connectionFailureIsLoadFailure() throws SQLException {
        when(dataSource.getConnection()).thenThrow(new SQLException("Connection refused", "08001"));

        LoadFailedException e = assertThrows(LoadFailedException.class,
                () -> store().openSession("volume_frequency_data"));
        assertTrue(e.getMessage().contains("08001"));
    }
}
