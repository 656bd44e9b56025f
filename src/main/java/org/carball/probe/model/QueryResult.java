package org.carball.probe.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;
import org.carball.probe.engine.ErrorKind;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Result of one query: rows plus diagnostics about how the answer was obtained.
 */
@Data
@Builder(toBuilder = true)
public class QueryResult {

    @JsonProperty("success")
    private boolean success;

    @JsonProperty("query")
    private String query;

    @Builder.Default
    @JsonProperty("columns")
    private List<String> columns = new ArrayList<>();

    @Builder.Default
    @JsonProperty("rows")
    private List<ResultRow> rows = new ArrayList<>();

    @JsonProperty("source_interface")
    private SourceInterface source;

    @JsonProperty("elapsed_ms")
    private double elapsedMs;

    @JsonProperty("truncated")
    private boolean truncated;

    @JsonProperty("client_filtered")
    private boolean clientFiltered;

    @JsonProperty("fallback_attempted")
    private boolean fallbackAttempted;

    @JsonProperty("cache_hit")
    private boolean cacheHit;

    @JsonProperty("cache_age_seconds")
    private Double cacheAgeSeconds;

    /** Set by table queries: the reference form the engine accepted, e.g. {@code 'Sales'}. */
    @JsonProperty("table_reference_used")
    private String tableReference;

    @JsonProperty("error_kind")
    private ErrorKind errorKind;

    @JsonProperty("error")
    private String error;

    @Builder.Default
    @JsonProperty("suggestions")
    private List<String> suggestions = new ArrayList<>();

    public static QueryResult failure(String query, ErrorKind kind, String error) {
        return QueryResult.builder()
                .success(false)
                .query(query)
                .errorKind(kind)
                .error(error)
                .build();
    }

    @JsonProperty("row_count")
    public int getRowCount() {
        return rows == null ? 0 : rows.size();
    }

    @JsonIgnore
    public boolean isFailure() {
        return !success;
    }

    /**
     * Deep copy: the returned result shares no mutable state with this one.
     */
    public QueryResult copy() {
        return toBuilder()
                .columns(columns == null ? new ArrayList<>() : new ArrayList<>(columns))
                .rows(rows == null ? new ArrayList<>() : rows.stream()
                        .map(ResultRow::copy)
                        .collect(Collectors.toCollection(ArrayList::new)))
                .suggestions(suggestions == null ? new ArrayList<>() : new ArrayList<>(suggestions))
                .build();
    }
}
