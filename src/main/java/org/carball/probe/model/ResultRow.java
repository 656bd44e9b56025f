package org.carball.probe.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One row of a query result: an insertion-ordered mapping from column name to value.
 * Values are scalars (strings, numbers, booleans) or null.
 */
@EqualsAndHashCode
@ToString
public final class ResultRow {

    private final LinkedHashMap<String, Object> values;

    public ResultRow() {
        this.values = new LinkedHashMap<>();
    }

    private ResultRow(Map<String, ?> values) {
        this.values = new LinkedHashMap<>(values);
    }

    public static ResultRow of(Map<String, ?> values) {
        return new ResultRow(values);
    }

    public static ResultRow of(Object... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected key/value pairs, got " + keysAndValues.length + " arguments");
        }
        ResultRow row = new ResultRow();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            row.put(String.valueOf(keysAndValues[i]), keysAndValues[i + 1]);
        }
        return row;
    }

    public Object get(String column) {
        return values.get(column);
    }

    public boolean containsKey(String column) {
        return values.containsKey(column);
    }

    public ResultRow put(String column, Object value) {
        values.put(column, value);
        return this;
    }

    public Object remove(String column) {
        return values.remove(column);
    }

    /**
     * Renames a column in place, keeping its position in the row.
     */
    public void rename(String from, String to) {
        if (!values.containsKey(from) || from.equals(to)) {
            return;
        }
        LinkedHashMap<String, Object> reordered = new LinkedHashMap<>();
        values.forEach((key, value) -> reordered.put(key.equals(from) ? to : key, value));
        values.clear();
        values.putAll(reordered);
    }

    public List<String> columns() {
        return List.copyOf(values.keySet());
    }

    public int size() {
        return values.size();
    }

    @JsonValue
    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    public ResultRow copy() {
        return new ResultRow(values);
    }
}
