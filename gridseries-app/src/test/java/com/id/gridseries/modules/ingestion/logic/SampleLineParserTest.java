package com.id.gridseries.modules.ingestion.logic;

import com.id.gridseries.model.Sample;
import com.id.gridseries.modules.ingestion.exception.LineParseException;
import com.id.gridseries.modules.ingestion.model.enums.CsvTimestampFormat;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class SampleLineParserTest {

    private final SampleLineParser commaParser = new SampleLineParser(',', CsvTimestampFormat.AUTO, ZoneOffset.UTC);
    private final SampleLineParser semicolonParser = new SampleLineParser(';', CsvTimestampFormat.AUTO, ZoneOffset.UTC);

    @Test
    void parsesIsoLine() throws LineParseException {
        Sample sample = commaParser.parse("2021-05-02T10:00:00Z,49.987", 2);
        assertEquals(Instant.parse("2021-05-02T10:00:00Z"), sample.timestamp());
        assertEquals(49.987, sample.value(), 1e-9);
    }

    @Test
    void parsesSwissgridLineWithDecimalComma() throws LineParseException {
        Sample sample = semicolonParser.parse("\"Sa. 01.05.21 00:00:30\";49,98", 3);
        assertEquals(Instant.parse("2021-05-01T00:00:30Z"), sample.timestamp());
        assertEquals(49.98, sample.value(), 1e-9);
    }

    @Test
    void reportsFieldAndLineOnFailure() {
        LineParseException tooFew = assertThrows(LineParseException.class, () -> commaParser.parse("2021-05-02T10:00:00Z", 7));
        assertEquals(7, tooFew.getLineNumber());
        assertEquals(SampleLineParser.VALUE_FIELD, tooFew.getField());

        LineParseException badTs = assertThrows(LineParseException.class, () -> commaParser.parse("yesterday,50", 8));
        assertEquals(SampleLineParser.TIMESTAMP_FIELD, badTs.getField());

        LineParseException badValue = assertThrows(LineParseException.class, () -> commaParser.parse("2021-05-02T10:00:00Z,abc", 9));
        assertEquals(SampleLineParser.VALUE_FIELD, badValue.getField());
        assertTrue(badValue.getMessage().contains("Line 9"));

        assertThrows(LineParseException.class, () -> commaParser.parse("2021-05-02T10:00:00Z,NaN", 10));
        assertThrows(LineParseException.class, () -> commaParser.parse("2021-05-02T10:00:00Z,", 11));
    }
}
