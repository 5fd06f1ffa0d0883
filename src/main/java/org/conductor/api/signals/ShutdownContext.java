package org.conductor.api.signals;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * The deadline token handed to a service when the conductor asks it to shut down.
 * <p>
 * The deadline is advisory: a service is expected to finish its cleanup and fire its stopped
 * signal before {@link #getDeadline()}, but nothing forcibly terminates it when the deadline passes.
 */
public final class ShutdownContext {

    private final Instant deadline;
    private final Clock clock;

    private ShutdownContext(final Instant deadline, final Clock clock) {
        this.deadline = deadline;
        this.clock = clock;
    }

    /**
     * Creates a context whose deadline is now plus the given timeout.
     *
     * @param timeout Time the service is granted to stop.
     * @return The new context.
     */
    public static ShutdownContext withTimeout(final Duration timeout) {
        return withTimeout(timeout, Clock.systemUTC());
    }

    static ShutdownContext withTimeout(final Duration timeout, final Clock clock) {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("Shutdown timeout must not be negative: " + timeout);
        }
        return new ShutdownContext(clock.instant().plus(timeout), clock);
    }

    public Instant getDeadline() {
        return deadline;
    }

    /**
     * @return Time left until the deadline, {@link Duration#ZERO} once it has passed.
     */
    public Duration getRemaining() {
        final Duration remaining = Duration.between(clock.instant(), deadline);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public boolean isExpired() {
        return !clock.instant().isBefore(deadline);
    }

    /**
     * Sleeps until the deadline has passed. Returns immediately if it already has.
     *
     * @throws InterruptedException if the calling thread is interrupted while sleeping.
     */
    public void awaitDeadline() throws InterruptedException {
        while (!isExpired()) {
            TimeUnit.NANOSECONDS.sleep(Math.max(getRemaining().toNanos(), 1L));
        }
    }

    @Override
    public String toString() {
        return "ShutdownContext[deadline=" + deadline + "]";
    }
}
