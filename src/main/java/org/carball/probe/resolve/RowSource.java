package org.carball.probe.resolve;

import org.carball.probe.model.QueryRequest;
import org.carball.probe.model.QueryResult;

/**
 * Anything that can answer a query with rows, used by the resolver to enumerate model objects.
 */
@FunctionalInterface
public interface RowSource {

    QueryResult fetch(QueryRequest request);
}
