package org.carball.probe.execution;

import org.carball.probe.engine.ErrorKind;
import org.carball.probe.model.SourceInterface;

import java.time.Instant;

/**
 * One executed query, as reported to a {@link QueryHistoryListener}.
 */
public record QueryHistoryEntry(
        Instant executedAt,
        String query,
        boolean success,
        SourceInterface source,
        int rowCount,
        double elapsedMs,
        boolean cacheHit,
        ErrorKind errorKind) {
}
