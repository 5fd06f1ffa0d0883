package org.conductor.services;

import com.typesafe.config.Config;
import org.conductor.api.signals.ShutdownContext;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A minimal service that emits a heartbeat log line at a fixed interval until it is shut down.
 *
 * <pre>
 * {
 *   name = "heartbeat"
 *   className = "org.conductor.services.HeartbeatService"
 *   options {
 *     interval = 1s      # time between heartbeats
 *     warmup = 0s        # simulated initialization time before readiness
 *   }
 * }
 * </pre>
 */
public class HeartbeatService extends AbstractService {

    private final Duration interval;
    private final Duration warmup;
    private final AtomicLong beats = new AtomicLong();

    public HeartbeatService(final String name, final Config options) {
        super(name, options);
        this.interval = this.options.hasPath("interval") ? this.options.getDuration("interval") : DEFAULT_TICK_INTERVAL;
        this.warmup = this.options.hasPath("warmup") ? this.options.getDuration("warmup") : Duration.ZERO;
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Heartbeat interval must be positive: " + interval);
        }
    }

    @Override
    protected void initialize() throws Exception {
        if (!warmup.isZero()) {
            Thread.sleep(warmup.toMillis());
        }
    }

    @Override
    protected void logStarted() {
        log.info("{} started (interval={})", serviceName, interval);
    }

    @Override
    protected void tick() {
        log.debug("{} heartbeat #{}", serviceName, beats.incrementAndGet());
    }

    @Override
    protected void cleanup(final ShutdownContext context) {
        log.info("{} stopping after {} heartbeat(s), {} ms before deadline", serviceName, beats.get(),
            context.getRemaining().toMillis());
    }

    @Override
    protected Duration getTickInterval() {
        return interval;
    }

    public long getBeats() {
        return beats.get();
    }
}
