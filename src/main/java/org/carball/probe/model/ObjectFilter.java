package org.carball.probe.model;

import org.carball.probe.resolve.IdentifierMap;
import org.carball.probe.resolve.IdentifierResolver;

import java.util.Locale;
import java.util.Objects;

/**
 * A server-side filter the caller expects the engine to have applied: rows whose
 * {@code column} equals {@code value}. Comparison is trimmed and case-insensitive, and numeric
 * identifiers compare by value, so {@code 1.0} matches {@code 1}.
 */
public record ObjectFilter(String column, String value) {

    public ObjectFilter {
        Objects.requireNonNull(column, "column");
        Objects.requireNonNull(value, "value");
    }

    public static ObjectFilter of(String column, Object value) {
        return new ObjectFilter(column, String.valueOf(value));
    }

    public boolean matches(ResultRow row) {
        Object actual = IdentifierResolver.lookup(row, column).orElse(null);
        return actual != null && normalize(actual).equals(normalize(value));
    }

    private static String normalize(Object text) {
        return IdentifierMap.idKey(text).toLowerCase(Locale.ROOT);
    }
}
