package com.id.gridseries.modules.store;

import java.util.regex.Pattern;

/**
 * Dataset names end up as table names inside SQL text, so only plain lower-case identifiers pass.
 */
public final class SqlIdentifiers {

    private static final Pattern IDENTIFIER = Pattern.compile("[a-z_][a-z0-9_]{0,62}");

    private SqlIdentifiers() {
    }

    public static boolean isValid(String name) {
        return name != null && IDENTIFIER.matcher(name).matches();
    }

    public static String requireValid(String name) {
        if (!isValid(name)) {
            throw new IllegalArgumentException("Invalid dataset name: '" + name + "'");
        }
        return name;
    }
}
