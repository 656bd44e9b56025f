package org.carball.probe.engine;

import lombok.extern.slf4j.Slf4j;
import org.carball.probe.config.ProbeSettings;
import org.carball.probe.model.ResultRow;

import java.sql.*;
import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Runs introspection (DAX / DMV) queries over the JDBC connection of a {@link ModelConnection}
 * and classifies driver errors into {@link ErrorKind}s.
 */
@Slf4j
public class JdbcIntrospectionClient implements IntrospectionClient {

    // Messages the engine uses when a deployment mode refuses a DMV or INFO function
    private static final Pattern BLOCKED_MESSAGE = Pattern.compile(
            "not supported|is not allowed|not permitted|blocked|permission|access denied|"
                    + "cannot be used in this context|restricted",
            Pattern.CASE_INSENSITIVE
    );

    private static final String CONNECTION_STATE_CLASS = "08";

    private final ModelConnection connection;
    private final ProbeSettings settings;

    public JdbcIntrospectionClient(ModelConnection connection, ProbeSettings settings) {
        this.connection = connection;
        this.settings = settings;
    }

    @Override
    public Outcome<RowSet> query(String queryText, int maxRows) {
        int limit = effectiveLimit(maxRows);

        try {
            Connection conn = connection.getConnection();
            try (Statement stmt = conn.createStatement()) {
                stmt.setQueryTimeout(settings.getCommandTimeoutSeconds());
                try (ResultSet rs = stmt.executeQuery(queryText)) {
                    return Outcome.success(readRows(rs, limit));
                }
            }
        } catch (SQLException e) {
            ErrorKind kind = classify(e);
            log.debug("Introspection query failed ({}): {}", kind, e.getMessage());
            return Outcome.failure(kind, e.getMessage(), e);
        }
    }

    @Override
    public Outcome<Boolean> clearEngineCache() {
        String command = settings.getClearCacheCommand();
        if (command == null || command.isBlank()) {
            return IntrospectionClient.super.clearEngineCache();
        }

        try (Statement stmt = connection.getConnection().createStatement()) {
            stmt.setQueryTimeout(settings.getCommandTimeoutSeconds());
            stmt.execute(command);
            log.debug("Engine cache cleared");
            return Outcome.success(Boolean.TRUE);
        } catch (SQLException e) {
            return Outcome.failure(classify(e), e.getMessage(), e);
        }
    }

    /**
     * Maps a driver exception onto the failure taxonomy.
     */
    static ErrorKind classify(SQLException e) {
        if (e instanceof SQLNonTransientConnectionException
                || e instanceof SQLTransientConnectionException
                || e instanceof SQLRecoverableException) {
            return ErrorKind.CONNECTION_LOST;
        }
        String sqlState = e.getSQLState();
        if (sqlState != null && sqlState.startsWith(CONNECTION_STATE_CLASS)) {
            return ErrorKind.CONNECTION_LOST;
        }
        if (e instanceof SQLFeatureNotSupportedException) {
            return ErrorKind.BLOCKED_INTERFACE;
        }
        String message = e.getMessage();
        if (message != null && BLOCKED_MESSAGE.matcher(message).find()) {
            return ErrorKind.BLOCKED_INTERFACE;
        }
        return ErrorKind.QUERY_ERROR;
    }

    private int effectiveLimit(int maxRows) {
        int safety = settings.getSafetyMaxRows();
        return maxRows > 0 ? Math.min(maxRows, safety) : safety;
    }

    private RowSet readRows(ResultSet rs, int limit) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        List<String> columns = new ArrayList<>();
        for (int i = 1; i <= meta.getColumnCount(); i++) {
            columns.add(meta.getColumnLabel(i));
        }

        List<ResultRow> rows = new ArrayList<>();
        boolean truncated = false;
        while (rs.next()) {
            if (rows.size() >= limit) {
                truncated = true;
                break;
            }
            ResultRow row = new ResultRow();
            for (int i = 0; i < columns.size(); i++) {
                row.put(columns.get(i), toScalar(rs.getObject(i + 1)));
            }
            rows.add(row);
        }

        if (truncated) {
            log.debug("Result truncated at {} rows", limit);
        }
        return new RowSet(columns, rows, truncated);
    }

    private static Object toScalar(Object value) {
        if (value == null || value instanceof Number || value instanceof Boolean || value instanceof String) {
            return value;
        }
        if (value instanceof Timestamp timestamp) {
            return timestamp.toLocalDateTime().toString();
        }
        if (value instanceof Temporal || value instanceof java.util.Date) {
            return value.toString();
        }
        return String.valueOf(value);
    }
}
