package org.conductor.core;

/**
 * The lifecycle state of a {@link Conductor}.
 */
public enum ConductorState {
    /**
     * Accepting registrations; {@link Conductor#start()} has not been called.
     */
    NEW,
    /**
     * The sequential startup loop is running.
     */
    STARTING,
    /**
     * Every registered service signalled readiness.
     */
    RUNNING,
    /**
     * A service failed or timed out during startup; shutdown is about to begin.
     */
    FAILED_STARTUP,
    /**
     * Shutdown requests have been delivered; waiting for acknowledgements.
     */
    STOPPING,
    /**
     * Shutdown processing has finished and the completion signal has fired.
     */
    STOPPED
}
