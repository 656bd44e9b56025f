package org.carball.probe.engine;

import org.carball.probe.model.ResultRow;

import java.util.List;

/**
 * Raw rows returned by an engine query surface, before identifier resolution.
 */
public record RowSet(List<String> columns, List<ResultRow> rows, boolean truncated) {

    public static RowSet of(List<String> columns, List<ResultRow> rows) {
        return new RowSet(columns, rows, false);
    }
}
