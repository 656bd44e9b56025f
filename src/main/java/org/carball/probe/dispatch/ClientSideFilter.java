package org.carball.probe.dispatch;

import lombok.extern.slf4j.Slf4j;
import org.carball.probe.model.ObjectFilter;
import org.carball.probe.model.QueryResult;
import org.carball.probe.model.ResultRow;

import java.util.ArrayList;
import java.util.List;

/**
 * Second-pass filter for engines that silently ignore a server-side filter.
 */
@Slf4j
public final class ClientSideFilter {

    private ClientSideFilter() {
    }

    /**
     * Returns the result unchanged when every row already matches, otherwise a copy holding
     * only matching rows and flagged as client filtered.
     */
    public static QueryResult apply(QueryResult result, ObjectFilter filter) {
        return apply(result, filter, null);
    }

    /**
     * As {@link #apply(QueryResult, ObjectFilter)}, keeping at most {@code limit} matching rows.
     */
    public static QueryResult apply(QueryResult result, ObjectFilter filter, Integer limit) {
        if (filter == null || !result.isSuccess()) {
            return result;
        }

        boolean allMatch = result.getRows().stream().allMatch(filter::matches);
        if (allMatch && (limit == null || result.getRows().size() <= limit)) {
            return result;
        }

        List<ResultRow> kept = new ArrayList<>();
        for (ResultRow row : result.getRows()) {
            if (filter.matches(row)) {
                kept.add(row);
                if (limit != null && kept.size() >= limit) {
                    break;
                }
            }
        }

        log.debug("Applied client-side filter {} = {}: {} of {} rows kept",
                filter.column(), filter.value(), kept.size(), result.getRows().size());
        return result.toBuilder()
                .rows(kept)
                .clientFiltered(true)
                .build();
    }
}
