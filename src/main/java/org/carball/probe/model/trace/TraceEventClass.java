package org.carball.probe.model.trace;

import java.util.Locale;

/**
 * Engine trace event classes the correlator understands. Everything else is {@link #UNKNOWN}.
 */
public enum TraceEventClass {
    QUERY_BEGIN("QueryBegin"),
    QUERY_END("QueryEnd"),
    COMMAND_END("CommandEnd"),
    SE_QUERY_END("VertiPaqSEQueryEnd"),
    SE_CACHE_MATCH("VertiPaqSEQueryCacheMatch"),
    SE_CACHE_MISS("VertiPaqSEQueryCacheMiss"),
    DIRECT_QUERY_END("DirectQueryEnd"),
    UNKNOWN("Unknown");

    private final String engineName;

    TraceEventClass(String engineName) {
        this.engineName = engineName;
    }

    public String getEngineName() {
        return engineName;
    }

    /** Events that mark the end of one query run. */
    public boolean isTerminator() {
        return this == QUERY_END || this == COMMAND_END;
    }

    /** Events whose duration counts as storage-engine time. */
    public boolean isStorageEngine() {
        return this == SE_QUERY_END || this == DIRECT_QUERY_END;
    }

    /**
     * Maps an engine class name such as {@code VertiPaqSEQueryEnd}, {@code query_end} or {@code SE_QUERY_END}.
     * Never throws; unrecognised names map to {@link #UNKNOWN}.
     */
    public static TraceEventClass fromName(String name) {
        if (name == null) {
            return UNKNOWN;
        }
        String compact = name.replace("_", "").replace(" ", "").replace("-", "").toLowerCase(Locale.ROOT);
        for (TraceEventClass eventClass : values()) {
            if (eventClass == UNKNOWN) {
                continue;
            }
            if (eventClass.engineName.toLowerCase(Locale.ROOT).equals(compact)
                    || eventClass.name().replace("_", "").toLowerCase(Locale.ROOT).equals(compact)) {
                return eventClass;
            }
        }
        return UNKNOWN;
    }
}
