package org.carball.probe.profile;

/**
 * Thrown when the profiling thread is interrupted between or during runs.
 */
public class ProfilingCancelledException extends RuntimeException {

    public ProfilingCancelledException(String message) {
        super(message);
    }

    public ProfilingCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
