package org.carball.probe.engine;

/**
 * The engine's imperative object-model surface. Slower per call than introspection but
 * not subject to its blocking; answers metadata queries only.
 */
public interface ObjectModelClient {

    Outcome<RowSet> query(String queryText, int maxRows);
}
