package com.id.gridseries.modules.ingestion.logic;

import com.id.gridseries.model.Sample;
import com.id.gridseries.modules.ingestion.exception.LineParseException;
import com.id.gridseries.modules.ingestion.model.enums.CsvTimestampFormat;
import com.id.gridseries.modules.ingestion.util.CsvLines;
import com.id.gridseries.modules.ingestion.util.CsvTimestampParser;

import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;

/**
 * Parses {@code timestamp<sep>value} lines. Immutable, shared by all workers of a job.
 */
public class SampleLineParser {

    static final String TIMESTAMP_FIELD = "timestamp";
    static final String VALUE_FIELD = "value";

    private final char separator;
    private final CsvTimestampFormat timestampFormat;
    private final ZoneId zone;

    public SampleLineParser(char separator, CsvTimestampFormat timestampFormat, ZoneId zone) {
        this.separator = separator;
        this.timestampFormat = Objects.requireNonNull(timestampFormat, "timestampFormat");
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    public Sample parse(String line, long lineNumber) throws LineParseException {
        List<String> fields = CsvLines.split(line, separator);
        if (fields.size() < 2) {
            throw new LineParseException(lineNumber, VALUE_FIELD, "expected 2 fields, found " + fields.size());
        }

        String rawTs = fields.get(0);
        Instant ts = CsvTimestampParser.parse(rawTs, timestampFormat, zone)
                .orElseThrow(() -> new LineParseException(lineNumber, TIMESTAMP_FIELD, "cannot parse '" + rawTs + "'"));

        String rawValue = fields.get(1);
        if (separator != ',') {
            // decimal comma, e.g. "49,98" in ';' separated exports
            rawValue = rawValue.replace(',', '.');
        }
        double value;
        try {
            value = Double.parseDouble(rawValue);
        } catch (NumberFormatException e) {
            throw new LineParseException(lineNumber, VALUE_FIELD, "not a number '" + fields.get(1) + "'");
        }
        if (!Double.isFinite(value)) {
            throw new LineParseException(lineNumber, VALUE_FIELD, "not finite '" + fields.get(1) + "'");
        }
        return Sample.of(ts, value);
    }
}
