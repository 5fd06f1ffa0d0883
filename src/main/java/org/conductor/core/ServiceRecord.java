package org.conductor.core;

import org.conductor.api.services.IService;
import org.conductor.api.signals.OneShot;
import org.conductor.api.signals.ShutdownContext;
import org.conductor.api.signals.Signal;

import java.util.Objects;

/**
 * Per-service bookkeeping created at registration time: the service, its name and the three
 * one-shot channels lent to it. The channels are only reachable from the conductor and the
 * service they were handed to.
 */
public final class ServiceRecord {

    private final String name;
    private final IService service;
    private final Signal ready = new Signal();
    private final Signal stopped = new Signal();
    private final OneShot<ShutdownContext> shutdown = new OneShot<>();
    private volatile boolean launched = false;

    ServiceRecord(final String name, final IService service) {
        this.name = Objects.requireNonNull(name, "name");
        this.service = Objects.requireNonNull(service, "service");
    }

    public String getName() {
        return name;
    }

    public IService getService() {
        return service;
    }

    Signal getReady() {
        return ready;
    }

    Signal getStopped() {
        return stopped;
    }

    OneShot<ShutdownContext> getShutdown() {
        return shutdown;
    }

    /**
     * @return true once the service's {@code run} has returned without throwing.
     */
    public boolean isLaunched() {
        return launched;
    }

    void launch() throws Exception {
        service.run(ready, stopped, shutdown);
        launched = true;
    }

    boolean requestShutdown(final ShutdownContext context) {
        return shutdown.offer(context);
    }

    @Override
    public String toString() {
        return "ServiceRecord[" + name + ", launched=" + launched + ", ready=" + ready.isFired()
            + ", stopped=" + stopped.isFired() + "]";
    }
}
