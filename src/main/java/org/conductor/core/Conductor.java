package org.conductor.core;

import org.conductor.api.services.IService;
import org.conductor.api.signals.ShutdownContext;
import org.conductor.api.signals.Signal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Starts a registered sequence of services one at a time and later shuts all of them down in
 * parallel within a deadline.
 * <p>
 * Startup is strictly sequential: service {@code i+1} is only run once service {@code i} has
 * signalled readiness, which encodes a dependency order without a dependency graph. If a service
 * throws from {@code run} or does not become ready within the start timeout, the remaining
 * services are never run and every service launched so far is shut down.
 * <p>
 * Shutdown delivers one shared {@link ShutdownContext} to every launched service and waits for
 * each stopped signal. {@link #stop()} may be called any number of times from any number of
 * threads; the completion signal fires exactly once.
 *
 * <pre>
 * Conductor conductor = new Conductor(ConductorOptions.builder().verbose(true).build());
 * conductor.service("database", database);
 * conductor.service("http", httpServer);
 * conductor.start().await();
 * </pre>
 */
public class Conductor {

    private static final Logger log = LoggerFactory.getLogger(Conductor.class);

    private final ConductorOptions options;
    private final List<ServiceRecord> services = new ArrayList<>();
    private final Signal completion = new Signal();
    // Fired as soon as shutdown begins, wakes a startup loop that is waiting for readiness
    private final Signal stopRequested = new Signal();
    private final AtomicBoolean stopping = new AtomicBoolean(false);
    private final AtomicReference<ConductorState> state = new AtomicReference<>(ConductorState.NEW);
    // Guards the started latch, the service list and the launch of each service against a concurrent stop
    private final Object lifecycleLock = new Object();
    private final SignalBridge signalBridge;
    private boolean started = false;
    // The record whose run is executing on the starting thread, guarded by lifecycleLock
    private ServiceRecord launching;
    private volatile Thread launchingThread;
    private volatile Throwable startupFailure;

    public Conductor() {
        this(ConductorOptions.defaults());
    }

    public Conductor(final ConductorOptions options) {
        this(options, new RuntimeShutdownHookRegistry());
    }

    /**
     * @param options      The options.
     * @param hookRegistry Where the termination hook is installed when signal hooking is enabled.
     */
    public Conductor(final ConductorOptions options, final IShutdownHookRegistry hookRegistry) {
        this.options = Objects.requireNonNull(options, "options");
        if (options.isHookSignals()) {
            this.signalBridge = new SignalBridge(this, hookRegistry, options.isVerbose());
            this.signalBridge.install();
        } else {
            this.signalBridge = null;
        }
    }

    /**
     * Registers a service to be started, in registration order, when {@link #start()} is called.
     *
     * @param name    Name used in logs. Uniqueness is not enforced.
     * @param service The service.
     * @throws IllegalStateException if {@link #start()} has already been called.
     */
    public void service(final String name, final IService service) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(service, "service");
        synchronized (lifecycleLock) {
            if (started) {
                throw new IllegalStateException("Cannot register service '" + name + "' after Conductor.start()");
            }
            services.add(new ServiceRecord(name, service));
        }
    }

    /**
     * Runs every registered service in order, waiting for each to become ready before running the
     * next. Returns once all services are ready, or once a failed startup has been fully shut down.
     *
     * @return The completion signal, fired when shutdown processing has finished.
     * @throws IllegalStateException if called more than once.
     */
    public Signal start() {
        synchronized (lifecycleLock) {
            if (started) {
                throw new IllegalStateException("Conductor.start() may only be called once");
            }
            started = true;
        }
        if (!state.compareAndSet(ConductorState.NEW, ConductorState.STARTING)) {
            lifecycle("Conductor was stopped before it started, no services will be run.");
            return completion;
        }

        lifecycle("Starting {} service(s)...", services.size());
        for (final ServiceRecord record : services) {
            Exception failure = null;
            synchronized (lifecycleLock) {
                if (stopping.get()) {
                    lifecycle("Shutdown requested, service '{}' will not be started", record.getName());
                    break;
                }
                lifecycle("Starting service: {}", record.getName());
                launching = record;
                launchingThread = Thread.currentThread();
                try {
                    record.launch();
                } catch (final Exception e) {
                    failure = e;
                } finally {
                    launching = null;
                    launchingThread = null;
                }
            }
            if (failure != null) {
                abortStartup(record, failure, "Service '{}' exited with: {}");
                break;
            }

            final boolean ready;
            try {
                ready = awaitReady(record);
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                abortStartup(record, e, "Interrupted while waiting for service '{}' to become ready: {}");
                break;
            }
            if (!ready) {
                if (stopping.get()) {
                    lifecycle("Shutdown requested while service '{}' was starting", record.getName());
                    break;
                }
                abortStartup(record,
                    new TimeoutException("no ready signal within " + options.getStartTimeout()),
                    "Service timed-out during startup '{}': {}");
                break;
            }
            lifecycle("{} .. ok", record.getName());
        }

        if (!stopping.get() && state.compareAndSet(ConductorState.STARTING, ConductorState.RUNNING)) {
            lifecycle("All {} service(s) started.", services.size());
        } else {
            awaitCompletion();
        }
        return completion;
    }

    /**
     * Asks every launched service to shut down and waits for their acknowledgements.
     * <p>
     * All services receive the same {@link ShutdownContext}, whose deadline is now plus the stop
     * timeout. When the stop deadline is enforced, waiting ends after the stop timeout plus the
     * grace period and services that have not acknowledged are logged; otherwise this waits for
     * every acknowledgement. Concurrent and repeated calls wait for the first call to finish,
     * except a call made from inside a service's {@code run} while another thread is stopping.
     * <p>
     * An interrupt pending on the calling thread does not cut the wait short; it is restored
     * once shutdown has completed.
     */
    public void stop() {
        if (!stopping.compareAndSet(false, true)) {
            if (Thread.currentThread() == launchingThread) {
                // The first stopper is blocked on the launch this call is part of
                log.debug("Shutdown already in progress, not waiting from inside a service's run");
                return;
            }
            awaitCompletion();
            return;
        }
        // Cleared so the waits below run to acknowledgement or the ceiling, restored once complete
        final boolean interrupted = Thread.interrupted();
        stopRequested.fire();

        final List<ServiceRecord> targets;
        synchronized (lifecycleLock) {
            // A service calling stop() from its own run is already running background work
            targets = services.stream()
                .filter(record -> record.isLaunched() || record == launching)
                .collect(Collectors.toList());
        }
        state.set(ConductorState.STOPPING);

        final ShutdownContext context = ShutdownContext.withTimeout(options.getStopTimeout());
        lifecycle("Stopping {} service(s), deadline {}", targets.size(), context.getDeadline());

        final CountDownLatch remaining = new CountDownLatch(targets.size());
        final List<Thread> waiters = new ArrayList<>(targets.size());
        try {
            for (final ServiceRecord record : targets) {
                if (!record.requestShutdown(context)) {
                    log.debug("Service '{}' already holds a shutdown request", record.getName());
                }
                final Thread waiter = new Thread(() -> awaitStopped(record, remaining),
                    "conductor-stop-" + record.getName());
                waiter.setDaemon(true);
                waiter.start();
                waiters.add(waiter);
            }
            awaitAllStopped(remaining, targets);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            problem("Interrupted while waiting for services to stop, shutting down");
        } finally {
            waiters.forEach(Thread::interrupt);
            state.set(ConductorState.STOPPED);
            completion.fire();
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
        lifecycle("Conductor stopped.");
    }

    public ConductorOptions getOptions() {
        return options;
    }

    public ConductorState getState() {
        return state.get();
    }

    /**
     * @return The exception or timeout that aborted startup, if any.
     */
    public Optional<Throwable> getStartupFailure() {
        return Optional.ofNullable(startupFailure);
    }

    public Signal getCompletionSignal() {
        return completion;
    }

    public List<ServiceRecord> getServices() {
        synchronized (lifecycleLock) {
            return Collections.unmodifiableList(new ArrayList<>(services));
        }
    }

    public Optional<SignalBridge> getSignalBridge() {
        return Optional.ofNullable(signalBridge);
    }

    private boolean awaitReady(final ServiceRecord record) throws InterruptedException {
        final CountDownLatch wake = new CountDownLatch(1);
        record.getReady().onFire(wake::countDown);
        stopRequested.onFire(wake::countDown);
        wake.await(options.getStartTimeout().toNanos(), TimeUnit.NANOSECONDS);
        return record.getReady().isFired();
    }

    private void abortStartup(final ServiceRecord record, final Throwable cause, final String message) {
        startupFailure = cause;
        state.compareAndSet(ConductorState.STARTING, ConductorState.FAILED_STARTUP);
        problem(message, record.getName(), cause.getMessage());
        log.debug("Exception details:", cause);
        stop();
    }

    private void awaitStopped(final ServiceRecord record, final CountDownLatch remaining) {
        try {
            record.getStopped().await();
            lifecycle("Service '{}' stopped", record.getName());
            remaining.countDown();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void awaitAllStopped(final CountDownLatch remaining, final List<ServiceRecord> targets)
            throws InterruptedException {
        if (!options.isEnforceStopDeadline()) {
            remaining.await();
            return;
        }
        final boolean allStopped = remaining.await(options.getStopCeiling().toNanos(), TimeUnit.NANOSECONDS);
        if (!allStopped) {
            final List<String> stragglers = targets.stream()
                .filter(record -> !record.getStopped().isFired())
                .map(ServiceRecord::getName)
                .collect(Collectors.toList());
            problem("Timeout exceeded waiting for services to stop, shutting down without: {}", stragglers);
        }
    }

    private void awaitCompletion() {
        try {
            completion.await();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Interrupted while waiting for conductor shutdown to complete");
        }
    }

    private void lifecycle(final String format, final Object... args) {
        if (options.isVerbose()) {
            log.info(format, args);
        } else {
            log.debug(format, args);
        }
    }

    private void problem(final String format, final Object... args) {
        if (options.isVerbose()) {
            log.warn(format, args);
        } else {
            log.debug(format, args);
        }
    }
}
