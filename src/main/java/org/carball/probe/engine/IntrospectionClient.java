package org.carball.probe.engine;

/**
 * The engine's declarative query surface: DAX and DMV queries returning rows.
 * Some deployments refuse part of it, which is reported as {@link ErrorKind#BLOCKED_INTERFACE}.
 */
public interface IntrospectionClient {

    /**
     * Runs a query and reads at most {@code maxRows} rows (0 for the configured safety cap).
     */
    Outcome<RowSet> query(String queryText, int maxRows);

    /**
     * Drops the engine's own result caches so the next query runs cold.
     */
    default Outcome<Boolean> clearEngineCache() {
        return Outcome.failure(ErrorKind.UNSUPPORTED, "Engine cache clearing is not configured");
    }
}
