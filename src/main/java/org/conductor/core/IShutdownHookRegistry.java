package org.conductor.core;

/**
 * Where the {@link SignalBridge} installs its termination hook. The default implementation is
 * {@link RuntimeShutdownHookRegistry}, which the JVM runs on SIGTERM and SIGINT.
 */
public interface IShutdownHookRegistry {

    void addShutdownHook(Thread hook);

    /**
     * @param hook The previously added hook.
     * @return true if the hook was registered and has been removed.
     * @throws IllegalStateException if the JVM is already shutting down.
     */
    boolean removeShutdownHook(Thread hook);
}
