package org.carball.probe.trace;

/**
 * A live subscription to a trace source. Closing stops delivery and never throws.
 */
public interface TraceSubscription extends AutoCloseable {

    @Override
    void close();
}
