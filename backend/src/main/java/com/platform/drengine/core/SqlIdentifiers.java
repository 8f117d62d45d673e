package com.platform.drengine.core;

import com.platform.drengine.error.ValidationException;

import java.util.regex.Pattern;

/**
 * Guards identifiers that are interpolated into SQL text (schema, table and column names).
 */
public final class SqlIdentifiers {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z0-9_]+");

    private SqlIdentifiers() {
    }

    public static String require(String identifier) {
        if (identifier == null || !IDENTIFIER.matcher(identifier).matches()) {
            throw new ValidationException("identifier", identifier, "Not a valid SQL identifier: " + identifier);
        }
        return identifier;
    }

    /**
     * Backtick-quoted, optionally schema qualified name.
     */
    public static String qualified(String schema, String table) {
        if (schema == null || schema.isBlank()) {
            return "`" + require(table) + "`";
        }
        return "`" + require(schema) + "`.`" + require(table) + "`";
    }
}
