package com.id.gridseries.modules.ingestion.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvLinesTest {

    @Test
    void detectsSeparatorFromHeader() {
        assertEquals(';', CsvLines.detectSeparator("Datum Zeit;A:f_soll_aktiv [Hz]", ','));
        assertEquals(',', CsvLines.detectSeparator("timestamp,frequency", ';'));
        assertEquals(',', CsvLines.detectSeparator("\"a;b\",c", ';'));
        assertEquals(';', CsvLines.detectSeparator("single", ';'));
    }

    @Test
    void splitHandlesQuotesAndWhitespace() {
        assertEquals(List.of("Sa. 01.05.21 00:00:30", "50"), CsvLines.split("\"Sa. 01.05.21 00:00:30\" ; 50", ';'));
        assertEquals(List.of("a,b", "say \"hi\""), CsvLines.split("\"a,b\",\"say \"\"hi\"\"\"", ','));
        assertEquals(List.of("only"), CsvLines.split("only", ','));
    }

    @Test
    void stripBom() {
        assertEquals("header", CsvLines.stripBom("\uFEFFheader"));
        assertEquals("header", CsvLines.stripBom("header"));
        assertNull(CsvLines.stripBom(null));
    }
}
