package org.conductor.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Translates process termination (SIGTERM, SIGINT) into a single call to {@link Conductor#stop()}.
 * <p>
 * The bridge only talks to the conductor through its public operations. The hook is removed
 * again once the conductor's completion signal fires, so a conductor that shut down on its own
 * leaves nothing behind.
 */
public final class SignalBridge {

    private static final Logger LOGGER = LoggerFactory.getLogger(SignalBridge.class);

    private final Conductor conductor;
    private final IShutdownHookRegistry registry;
    private final boolean verbose;
    private final AtomicBoolean triggered = new AtomicBoolean(false);
    private final Thread hook;

    SignalBridge(final Conductor conductor, final IShutdownHookRegistry registry, final boolean verbose) {
        this.conductor = conductor;
        this.registry = registry;
        this.verbose = verbose;
        this.hook = new Thread(() -> trigger("termination signal"), "conductor-signal-bridge");
    }

    void install() {
        registry.addShutdownHook(hook);
        conductor.getCompletionSignal().onFire(this::uninstall);
    }

    /**
     * Stops the conductor unless it has already completed shutdown or the bridge already fired.
     * Blocks until the conductor's shutdown has finished.
     *
     * @param cause What triggered the call, for the log.
     * @return true if this call invoked {@link Conductor#stop()}.
     */
    public boolean trigger(final String cause) {
        if (conductor.getCompletionSignal().isFired()) {
            LOGGER.debug("Ignoring {}: conductor has already stopped.", cause);
            return false;
        }
        if (!triggered.compareAndSet(false, true)) {
            return false;
        }
        if (verbose) {
            LOGGER.info("Caught {}, shutting down", cause);
        } else {
            LOGGER.debug("Caught {}, shutting down", cause);
        }
        conductor.stop();
        return true;
    }

    Thread getHook() {
        return hook;
    }

    private void uninstall() {
        try {
            registry.removeShutdownHook(hook);
        } catch (final IllegalStateException e) {
            // JVM is already shutting down, the hook is running or about to
            LOGGER.debug("Could not remove shutdown hook: {}", e.getMessage());
        }
    }
}
