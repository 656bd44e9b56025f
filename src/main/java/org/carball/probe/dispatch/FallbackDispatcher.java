package org.carball.probe.dispatch;

import lombok.extern.slf4j.Slf4j;
import org.carball.probe.engine.*;
import org.carball.probe.model.ObjectFilter;
import org.carball.probe.model.QueryRequest;
import org.carball.probe.model.QueryResult;
import org.carball.probe.model.SourceInterface;
import org.carball.probe.resolve.RowSource;

import java.util.ArrayList;
import java.util.Optional;

/**
 * Runs a request on the introspection surface and falls back to the object model when the
 * introspection surface refuses it. Attempts are strictly sequential.
 */
@Slf4j
public class FallbackDispatcher implements RowSource {

    static final String FALLBACK_NOTE = "fallback to object model was attempted";

    private final IntrospectionClient introspection;
    private final ObjectModelClient objectModel;

    public FallbackDispatcher(IntrospectionClient introspection, ObjectModelClient objectModel) {
        this.introspection = introspection;
        this.objectModel = objectModel;
    }

    @Override
    public QueryResult fetch(QueryRequest request) {
        return execute(request);
    }

    /**
     * Executes the request. Query errors come back as failed results; a dropped connection
     * is thrown as {@link ConnectionLostException}.
     */
    public QueryResult execute(QueryRequest request) {
        long start = System.nanoTime();

        QueryResult result = dispatch(request.text(), request.maxRows());

        ObjectFilter filter = request.filter();
        if (filter != null) {
            if (result.isSuccess()) {
                result = ClientSideFilter.apply(result, filter);
            }
            if (!result.isSuccess() && result.getErrorKind() == ErrorKind.QUERY_ERROR
                    || result.isSuccess() && result.getRows().isEmpty()) {
                result = retryUnfiltered(request, result);
            }
        }

        return result.toBuilder()
                .query(request.text())
                .elapsedMs(elapsedMs(start))
                .build();
    }

    /**
     * Asks the introspection surface to drop the engine caches.
     */
    public Outcome<Boolean> clearEngineCache() {
        return introspection.clearEngineCache();
    }

    private QueryResult dispatch(String text, int maxRows) {
        Outcome<RowSet> primary = introspection.query(text, maxRows);
        if (primary.isSuccess()) {
            return toResult(primary.value(), SourceInterface.INTROSPECTION, false);
        }
        failIfConnectionLost(primary);

        if (!primary.is(ErrorKind.BLOCKED_INTERFACE)) {
            log.debug("Introspection query failed ({}), not retrying: {}", primary.errorKind(), primary.message());
            return QueryResult.failure(text, primary.errorKind(), primary.message());
        }

        log.debug("Introspection interface blocked, trying object model: {}", primary.message());
        Outcome<RowSet> secondary = objectModel.query(text, maxRows);
        if (secondary.isSuccess()) {
            return toResult(secondary.value(), SourceInterface.OBJECT_MODEL, true);
        }
        failIfConnectionLost(secondary);

        log.debug("Object model could not answer either ({}): {}", secondary.errorKind(), secondary.message());
        return QueryResult.failure(text, primary.errorKind(),
                        primary.message() + " (" + FALLBACK_NOTE + ": " + secondary.message() + ")")
                .toBuilder()
                .fallbackAttempted(true)
                .build();
    }

    // Table-scoped metadata: when the filtered form fails or comes back empty, enumerate all and filter here
    private QueryResult retryUnfiltered(QueryRequest request, QueryResult filteredResult) {
        Optional<MetadataQuery> metadata = MetadataQuery.parse(request.text());
        if (metadata.isEmpty()) {
            return filteredResult;
        }

        String unfiltered = MetadataQuery.toQueryText(metadata.get().kind(), null, null);
        if (unfiltered.equals(request.text().trim())) {
            return filteredResult;
        }

        log.debug("Filtered metadata query returned nothing, retrying unfiltered: {}", unfiltered);
        QueryResult all = dispatch(unfiltered, 0);
        if (!all.isSuccess()) {
            return filteredResult;
        }

        Integer limit = metadata.get().topN();
        if (request.maxRows() > 0) {
            limit = limit == null ? request.maxRows() : Math.min(limit, request.maxRows());
        }
        QueryResult filtered = ClientSideFilter.apply(all, request.filter(), limit);
        return filtered.toBuilder()
                .clientFiltered(true)
                .build();
    }

    private static QueryResult toResult(RowSet rowSet, SourceInterface source, boolean fallbackAttempted) {
        return QueryResult.builder()
                .success(true)
                .columns(new ArrayList<>(rowSet.columns()))
                .rows(new ArrayList<>(rowSet.rows()))
                .truncated(rowSet.truncated())
                .source(source)
                .fallbackAttempted(fallbackAttempted)
                .build();
    }

    private static void failIfConnectionLost(Outcome<?> outcome) {
        if (outcome.is(ErrorKind.CONNECTION_LOST)) {
            throw new ConnectionLostException(outcome.message(), outcome.cause().orElse(null));
        }
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }
}
