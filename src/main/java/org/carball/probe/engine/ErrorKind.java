package org.carball.probe.engine;

/**
 * Failure classes reported by the engine query surfaces.
 */
public enum ErrorKind {

    /** The introspection interface refused this query; the object model may still answer it. */
    BLOCKED_INTERFACE,

    /** The query itself is wrong (syntax, missing object). Reported verbatim, never retried. */
    QUERY_ERROR,

    /** The engine connection dropped. Fatal for the in-flight operation. */
    CONNECTION_LOST,

    /** The surface cannot express this query at all. */
    UNSUPPORTED
}
