package org.carball.probe.execution;

import lombok.extern.slf4j.Slf4j;
import org.carball.probe.cache.CacheKey;
import org.carball.probe.cache.CacheStats;
import org.carball.probe.cache.ResultCache;
import org.carball.probe.config.ProbeSettings;
import org.carball.probe.dispatch.FallbackDispatcher;
import org.carball.probe.engine.ConnectionLostException;
import org.carball.probe.engine.ErrorKind;
import org.carball.probe.engine.MetadataKind;
import org.carball.probe.engine.MetadataQuery;
import org.carball.probe.engine.ModelConnection;
import org.carball.probe.engine.Outcome;
import org.carball.probe.model.ObjectFilter;
import org.carball.probe.model.QueryRequest;
import org.carball.probe.model.QueryResult;
import org.carball.probe.model.ResultRow;
import org.carball.probe.model.SourceInterface;
import org.carball.probe.resolve.IdentifierKind;
import org.carball.probe.resolve.IdentifierResolver;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single entry point for read-only queries: result cache, then fallback dispatch, then
 * identifier resolution, then cache store. Engine access is serialised on the connection's
 * operation lock; the cache is consulted without it.
 */
@Slf4j
public class QueryExecutor {

    private static final List<MetadataKind> SEARCHABLE =
            List.of(MetadataKind.TABLES, MetadataKind.COLUMNS, MetadataKind.MEASURES);

    private final ModelConnection connection;
    private final FallbackDispatcher dispatcher;
    private final IdentifierResolver resolver;
    private final ResultCache cache;
    private final ProbeSettings settings;
    private final QueryErrorAdvisor advisor = new QueryErrorAdvisor();
    private final List<QueryHistoryListener> historyListeners = new CopyOnWriteArrayList<>();

    public QueryExecutor(ModelConnection connection, FallbackDispatcher dispatcher, IdentifierResolver resolver,
                         ResultCache cache, ProbeSettings settings) {
        this.connection = connection;
        this.dispatcher = dispatcher;
        this.resolver = resolver;
        this.cache = cache;
        this.settings = settings;
    }

    /**
     * Executes a query. Failed queries are returned as unsuccessful results with suggestions.
     *
     * @throws ConnectionLostException if the engine connection drops
     */
    public QueryResult execute(QueryRequest request) {
        long start = System.nanoTime();
        QueryRequest prepared = request.withText(QueryText.prepare(request.text(), request.maxRows()));
        CacheKey key = CacheKey.of(prepared);

        // Step 1: cache
        if (request.bypassCache()) {
            cache.recordBypass();
        } else {
            Optional<ResultCache.Hit> hit = cache.get(key);
            if (hit.isPresent()) {
                QueryResult cached = hit.get().result().toBuilder()
                        .source(SourceInterface.CACHE)
                        .cacheHit(true)
                        .cacheAgeSeconds(hit.get().age().toMillis() / 1000.0)
                        .elapsedMs(elapsedMs(start))
                        .build();
                log.debug("Cache hit for query: {}", key.normalizedText());
                notifyListeners(cached);
                return cached;
            }
        }

        // Step 2: dispatch and resolve under the connection lock
        QueryResult result;
        ReentrantLock lock = connection.operationLock();
        lock.lock();
        try {
            result = dispatcher.execute(prepared);
            if (result.isSuccess()) {
                resolver.resolve(result.getRows());
            }
        } catch (ConnectionLostException e) {
            log.error("Engine connection lost while executing query: {}", e.getMessage());
            connection.reconnect();
            throw e;
        } finally {
            lock.unlock();
        }

        // Step 3: store successful results only
        if (result.isSuccess()) {
            if (!request.bypassCache()) {
                cache.put(key, result);
            }
        } else {
            log.warn("Query failed ({}): {}", result.getErrorKind(), result.getError());
            result = result.toBuilder()
                    .suggestions(advisor.suggest(result.getErrorKind(), result.getError()))
                    .build();
        }

        result = result.toBuilder().elapsedMs(elapsedMs(start)).build();
        notifyListeners(result);
        return result;
    }

    public QueryResult execute(String text, int maxRows, boolean bypassCache) {
        return execute(new QueryRequest(text, maxRows, bypassCache));
    }

    /**
     * Runs an {@code INFO.<KIND>()} metadata query, optionally scoped to one table by name.
     * The table name is turned into its identifier through the resolver.
     */
    public QueryResult executeInfoQuery(MetadataKind kind, String tableName, Integer topN) {
        int limit = topN != null && topN > 0 ? topN : settings.getDefaultInfoLimit();
        ObjectFilter filter = null;

        if (tableName != null && !tableName.isBlank()) {
            if (!kind.isTableScoped()) {
                throw new IllegalArgumentException(kind + " cannot be scoped to a table");
            }
            Optional<String> tableId;
            ReentrantLock lock = connection.operationLock();
            lock.lock();
            try {
                tableId = resolver.idFor(IdentifierKind.TABLE, tableName);
            } finally {
                lock.unlock();
            }
            if (tableId.isEmpty()) {
                String error = "Table not found: " + tableName;
                log.warn("Cannot scope {} query: {}", kind, error);
                return QueryResult.failure(kind.infoFunction(), ErrorKind.QUERY_ERROR, error).toBuilder()
                        .suggestions(advisor.suggest(ErrorKind.QUERY_ERROR, error))
                        .build();
            }
            filter = ObjectFilter.of("TableID", tableId.get());
        }

        String text = MetadataQuery.toQueryText(kind, filter, limit);
        return execute(new QueryRequest(text, 0, false, filter));
    }

    /**
     * Reads the first rows of a table, trying the quoted, bare and bracketed reference forms
     * in that order. The accepted form is reported on the result.
     */
    public QueryResult executeTableQuery(String tableName, int maxRows) {
        if (tableName == null || tableName.isBlank()) {
            throw new IllegalArgumentException("Table name must not be blank");
        }
        int limit = maxRows > 0 ? maxRows : settings.getDefaultInfoLimit();
        List<String> references = List.of(
                "'" + tableName.replace("'", "''") + "'",
                tableName,
                "[" + tableName.replace("]", "]]") + "]");

        QueryResult last = null;
        for (String reference : references) {
            last = execute(QueryRequest.of("EVALUATE TOPN(" + limit + ", " + reference + ")"));
            if (last.isSuccess()) {
                log.debug("Table {} answered as {}", tableName, reference);
                return last.toBuilder().tableReference(reference).build();
            }
        }

        String error = "Could not query table '" + tableName + "' with any reference format";
        log.warn("{} (last error: {})", error, last.getError());
        return QueryResult.failure(last.getQuery(), ErrorKind.QUERY_ERROR, error).toBuilder()
                .source(last.getSource())
                .fallbackAttempted(last.isFallbackAttempted())
                .suggestions(List.of(
                        "Verify table '" + tableName + "' exists with INFO.TABLES()",
                        "Check case-sensitivity and special characters in the table name",
                        "Tried references: " + String.join(", ", references),
                        "Last error: " + last.getError()))
                .build();
    }

    /**
     * Finds tables, columns and measures whose name contains {@code pattern}, ignoring case.
     * Each kind is enumerated through the normal pipeline, so results are cached and work on
     * either query surface.
     */
    public QueryResult searchObjects(String pattern, Set<MetadataKind> kinds) {
        String needle = pattern == null ? "" : pattern.trim().toLowerCase(Locale.ROOT);
        QueryResult.QueryResultBuilder combined = QueryResult.builder()
                .success(true)
                .query("SEARCH " + (pattern == null ? "" : pattern))
                .columns(new ArrayList<>(List.of("Type", "Table", "Name")))
                .clientFiltered(true);
        List<ResultRow> matches = new ArrayList<>();

        for (MetadataKind kind : SEARCHABLE) {
            if (!kinds.contains(kind)) {
                continue;
            }
            QueryResult enumeration = execute(QueryRequest.of(MetadataQuery.toQueryText(kind, null, null)));
            if (enumeration.isFailure()) {
                return enumeration;
            }
            combined.source(enumeration.getSource());
            for (ResultRow row : enumeration.getRows()) {
                String name = text(row, kind == MetadataKind.COLUMNS ? "ExplicitName" : "Name", "Name");
                if (name == null || !name.toLowerCase(Locale.ROOT).contains(needle)) {
                    continue;
                }
                String table = kind == MetadataKind.TABLES ? null : text(row, "Table");
                matches.add(ResultRow.of("Type", typeLabel(kind), "Table", table, "Name", name));
            }
        }

        log.debug("Object search for '{}' matched {} objects", pattern, matches.size());
        return combined.rows(matches).build();
    }

    /**
     * Finds measures whose name and/or expression contains {@code text}, ignoring case.
     */
    public QueryResult searchMeasures(String text, boolean inName, boolean inExpression) {
        if (!inName && !inExpression) {
            throw new IllegalArgumentException("Search at least one of name or expression");
        }
        QueryResult enumeration = execute(QueryRequest.of(
                MetadataQuery.toQueryText(MetadataKind.MEASURES, null, null)));
        if (enumeration.isFailure()) {
            return enumeration;
        }

        String needle = text == null ? "" : text.trim().toLowerCase(Locale.ROOT);
        List<ResultRow> matches = new ArrayList<>();
        for (ResultRow row : enumeration.getRows()) {
            if ((inName && containsIgnoreCase(text(row, "Name"), needle))
                    || (inExpression && containsIgnoreCase(text(row, "Expression"), needle))) {
                matches.add(row.copy());
            }
        }
        return enumeration.toBuilder()
                .rows(matches)
                .clientFiltered(true)
                .build();
    }

    /**
     * Returns the definition of one measure, matched by table and measure name ignoring case.
     */
    public QueryResult measureDetails(String tableName, String measureName) {
        QueryResult enumeration = execute(QueryRequest.of(
                MetadataQuery.toQueryText(MetadataKind.MEASURES, null, null)));
        if (enumeration.isFailure()) {
            return enumeration;
        }

        List<ResultRow> matches = new ArrayList<>();
        for (ResultRow row : enumeration.getRows()) {
            if (equalsIgnoreCase(text(row, "Table"), tableName) && equalsIgnoreCase(text(row, "Name"), measureName)) {
                matches.add(row.copy());
            }
        }
        if (matches.isEmpty()) {
            String error = "Measure '" + measureName + "' not found in table '" + tableName + "'";
            log.warn(error);
            return QueryResult.failure(enumeration.getQuery(), ErrorKind.QUERY_ERROR, error).toBuilder()
                    .source(enumeration.getSource())
                    .suggestions(List.of(
                            "List the measures of '" + tableName + "' with INFO.MEASURES()",
                            "Check the spelling of the table and measure names"))
                    .build();
        }
        return enumeration.toBuilder()
                .rows(matches)
                .clientFiltered(true)
                .build();
    }

    /**
     * Asks the engine to drop its own caches so the next execution runs cold.
     */
    public Outcome<Boolean> clearEngineCache() {
        ReentrantLock lock = connection.operationLock();
        lock.lock();
        try {
            return dispatcher.clearEngineCache();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the cached result of one request, if any.
     */
    public boolean invalidate(QueryRequest request) {
        CacheKey key = CacheKey.of(QueryText.prepare(request.text(), request.maxRows()), request.maxRows());
        return cache.invalidate(key);
    }

    public int flushCache() {
        int removed = cache.clear();
        log.info("Flushed {} cached results", removed);
        return removed;
    }

    public CacheStats cacheStats() {
        return cache.stats();
    }

    public ModelConnection getConnection() {
        return connection;
    }

    public IdentifierResolver getResolver() {
        return resolver;
    }

    public void addHistoryListener(QueryHistoryListener listener) {
        historyListeners.add(listener);
    }

    private void notifyListeners(QueryResult result) {
        if (historyListeners.isEmpty()) {
            return;
        }
        QueryHistoryEntry entry = new QueryHistoryEntry(Instant.now(), result.getQuery(), result.isSuccess(),
                result.getSource(), result.getRowCount(), result.getElapsedMs(), result.isCacheHit(),
                result.getErrorKind());
        for (QueryHistoryListener listener : historyListeners) {
            listener.onQuery(entry);
        }
    }

    private static String text(ResultRow row, String... names) {
        return IdentifierResolver.lookup(row, names).map(String::valueOf).orElse(null);
    }

    private static boolean containsIgnoreCase(String value, String lowerNeedle) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(lowerNeedle);
    }

    private static boolean equalsIgnoreCase(String value, String expected) {
        return value != null && expected != null && value.trim().equalsIgnoreCase(expected.trim());
    }

    private static String typeLabel(MetadataKind kind) {
        switch (kind) {
            case TABLES:
                return "table";
            case COLUMNS:
                return "column";
            default:
                return "measure";
        }
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }
}
