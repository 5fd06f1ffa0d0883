package org.conductor.api.services;

import org.conductor.api.signals.OneShot;
import org.conductor.api.signals.ShutdownContext;
import org.conductor.api.signals.Signal;

/**
 * The contract every unit managed by the {@code Conductor} implements.
 * <p>
 * The conductor hands each service three channels that belong to it alone:
 * <ul>
 *   <li>{@code ready}: fired by the service once its initialization is complete.</li>
 *   <li>{@code stopped}: fired by the service once it has finished terminating.</li>
 *   <li>{@code shutdown}: written by the conductor with a {@link ShutdownContext} when the service
 *       must terminate. The service is expected to fire {@code stopped} before the deadline.</li>
 * </ul>
 * A service that never fires {@code ready} makes startup abort after the start timeout. A service
 * that never honors the shutdown request holds up the conductor's shutdown.
 */
@FunctionalInterface
public interface IService {

    /**
     * Kicks off the service. This method must return quickly: it typically launches background
     * work on its own thread and returns. Throwing aborts the startup of the whole conductor.
     *
     * @param ready    Fired by the service when it is ready.
     * @param stopped  Fired by the service when it has stopped.
     * @param shutdown Written by the conductor to request termination.
     * @throws Exception if the service cannot be started.
     */
    void run(Signal ready, Signal stopped, OneShot<ShutdownContext> shutdown) throws Exception;
}
