package com.id.gridseries.modules.ingestion.util;

import java.util.ArrayList;
import java.util.List;

public final class CsvLines {

    private CsvLines() {
    }

    public static String stripBom(String s) {
        if (s == null) return null;
        if (!s.isEmpty() && s.charAt(0) == '\uFEFF') {
            return s.substring(1);
        }
        return s;
    }

    /**
     * Picks ';' or ',' by counting unquoted occurrences in the header line.
     */
    public static char detectSeparator(String line, char fallback) {
        if (line == null) {
            return fallback;
        }
        int commas = 0;
        int semicolons = 0;
        boolean inQuotes = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '"') {
                inQuotes = !inQuotes;
            } else if (!inQuotes) {
                if (c == ',') {
                    commas++;
                } else if (c == ';') {
                    semicolons++;
                }
            }
        }
        if (semicolons > commas) {
            return ';';
        }
        if (commas > semicolons) {
            return ',';
        }
        return fallback;
    }

    // Quoted fields may contain the separator; "" inside quotes is an escaped quote
    public static List<String> split(String line, char separator) {
        if (line == null) return List.of();
        List<String> fields = new ArrayList<>(2);
        StringBuilder cur = new StringBuilder();
        boolean inQuotes = false;
        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (ch == '"') {
                if (inQuotes && i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    cur.append('"');
                    i++;
                } else {
                    inQuotes = !inQuotes;
                }
            } else if (ch == separator && !inQuotes) {
                fields.add(cur.toString().trim());
                cur.setLength(0);
            } else {
                cur.append(ch);
            }
        }
        fields.add(cur.toString().trim());
        return fields;
    }
}
