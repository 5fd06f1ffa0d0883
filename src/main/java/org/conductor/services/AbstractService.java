package org.conductor.services;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.conductor.api.services.IService;
import org.conductor.api.signals.OneShot;
import org.conductor.api.signals.ShutdownContext;
import org.conductor.api.signals.Signal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * An abstract base class for services that honors the conductor handshake on a dedicated thread.
 * Subclasses fill in {@link #initialize()}, {@link #tick()} and {@link #cleanup(ShutdownContext)}.
 * <p>
 * Lifecycle of the service thread:
 * <ol>
 *   <li>{@link #initialize()} runs; the ready signal fires once it returns.</li>
 *   <li>{@link #tick()} runs every {@link #getTickInterval()} until a shutdown request arrives.</li>
 *   <li>{@link #cleanup(ShutdownContext)} runs with the request's deadline, then the stopped signal fires.</li>
 * </ol>
 * <strong>Error Handling:</strong> an exception from {@code initialize()} or {@code tick()} moves
 * the service to {@link State#ERROR}. Readiness is then never signalled (if it had not been yet),
 * but the thread keeps honoring the shutdown request so the conductor's shutdown is not held up.
 * Stack traces are logged at DEBUG level only.
 */
public abstract class AbstractService implements IService {

    /**
     * The state of the service thread.
     */
    public enum State {
        NEW,
        STARTING,
        RUNNING,
        STOPPING,
        STOPPED,
        ERROR
    }

    protected static final Duration DEFAULT_TICK_INTERVAL = Duration.ofSeconds(1);

    protected final Logger log = LoggerFactory.getLogger(this.getClass());
    protected final String serviceName;
    protected final Config options;
    private final AtomicReference<State> currentState = new AtomicReference<>(State.NEW);
    private Thread serviceThread;

    /**
     * Constructs an AbstractService with its configuration.
     *
     * @param name    The name of the service instance.
     * @param options The configuration for this service, may be null.
     */
    protected AbstractService(final String name, final Config options) {
        this.serviceName = name;
        this.options = options != null ? options : ConfigFactory.empty();
    }

    @Override
    public final void run(final Signal ready, final Signal stopped, final OneShot<ShutdownContext> shutdown) {
        if (!currentState.compareAndSet(State.NEW, State.STARTING)) {
            throw new IllegalStateException(String.format("Cannot run service '%s' as it is in state %s", serviceName, getCurrentState()));
        }
        serviceThread = new Thread(() -> runService(ready, stopped, shutdown));
        serviceThread.setName(serviceName);
        serviceThread.start();
    }

    public State getCurrentState() {
        return currentState.get();
    }

    public String getServiceName() {
        return serviceName;
    }

    private void runService(final Signal ready, final Signal stopped, final OneShot<ShutdownContext> shutdown) {
        try {
            initialize();
            currentState.set(State.RUNNING);
            logStarted();
            ready.fire();

            ShutdownContext context = awaitShutdown(shutdown);
            while (context == null) {
                tick();
                context = awaitShutdown(shutdown);
            }

            currentState.set(State.STOPPING);
            cleanup(context);
            currentState.set(State.STOPPED);
            log.debug("{} stopped", serviceName);
        } catch (final InterruptedException e) {
            log.debug("Service thread for {} interrupted, shutting down.", serviceName);
            currentState.set(State.STOPPED);
            Thread.currentThread().interrupt();
        } catch (final Exception e) {
            log.error("{} stopped with ERROR due to {}", serviceName, e.getClass().getSimpleName());
            log.debug("Exception details:", e);
            currentState.set(State.ERROR);
            drainShutdownRequest(shutdown);
        } finally {
            stopped.fire();
            log.debug("Service thread for {} has terminated.", serviceName);
        }
    }

    private ShutdownContext awaitShutdown(final OneShot<ShutdownContext> shutdown) throws InterruptedException {
        final Optional<ShutdownContext> request = shutdown.poll(getTickInterval());
        return request.orElse(null);
    }

    // Holds the stopped signal back until the conductor asks, a failed service still acknowledges its shutdown
    private void drainShutdownRequest(final OneShot<ShutdownContext> shutdown) {
        try {
            shutdown.take();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Template method for logging service startup. Services can override this to provide
     * detailed startup information.
     */
    protected void logStarted() {
        log.info("{} started", serviceName);
    }

    /**
     * Prepares the service. Readiness is signalled once this returns.
     *
     * @throws Exception if the service cannot be initialized; readiness is then never signalled.
     */
    protected void initialize() throws Exception {
    }

    /**
     * One unit of periodic work, called every {@link #getTickInterval()} while running.
     *
     * @throws Exception on a fatal error; the service moves to {@link State#ERROR}.
     */
    protected void tick() throws Exception {
    }

    /**
     * Releases resources. Should finish before {@link ShutdownContext#getDeadline()}.
     *
     * @param context The shutdown request.
     * @throws Exception on failure; the stopped signal still fires.
     */
    protected void cleanup(final ShutdownContext context) throws Exception {
    }

    protected Duration getTickInterval() {
        return DEFAULT_TICK_INTERVAL;
    }
}
