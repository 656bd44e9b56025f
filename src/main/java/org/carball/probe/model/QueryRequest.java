package org.carball.probe.model;

/**
 * An immutable request to run one query against the model.
 *
 * @param text        query text, never blank
 * @param maxRows     row-limit hint, 0 for the engine default
 * @param bypassCache skip both cache lookup and cache store
 * @param filter      server-side filter the caller expects, or null
 */
public record QueryRequest(String text, int maxRows, boolean bypassCache, ObjectFilter filter) {

    public QueryRequest {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Query text must not be empty");
        }
        if (maxRows < 0) {
            throw new IllegalArgumentException("maxRows must not be negative: " + maxRows);
        }
    }

    public QueryRequest(String text, int maxRows, boolean bypassCache) {
        this(text, maxRows, bypassCache, null);
    }

    public static QueryRequest of(String text) {
        return new QueryRequest(text, 0, false, null);
    }

    public QueryRequest withBypassCache(boolean bypass) {
        return new QueryRequest(text, maxRows, bypass, filter);
    }

    public QueryRequest withFilter(ObjectFilter newFilter) {
        return new QueryRequest(text, maxRows, bypassCache, newFilter);
    }

    public QueryRequest withText(String newText) {
        return new QueryRequest(newText, maxRows, bypassCache, filter);
    }
}
