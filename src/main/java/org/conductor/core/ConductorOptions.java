package org.conductor.core;

import com.typesafe.config.Config;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable configuration of a {@link Conductor}. Every field is defaulted independently and
 * validated when the options are built.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * conductor {
 *   options {
 *     start-timeout = 5s          # per-service wait for the ready signal
 *     stop-timeout = 5s           # deadline handed to services on shutdown
 *     verbose = false             # narrate lifecycle events at INFO/WARN instead of DEBUG
 *     hook-signals = false        # stop on JVM termination (SIGTERM/SIGINT)
 *     enforce-stop-deadline = true
 *     stop-grace-period = 1s      # extra wait past stop-timeout before giving up on stragglers
 *   }
 * }
 * </pre>
 */
public final class ConductorOptions {

    public static final Duration DEFAULT_START_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_STOP_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_STOP_GRACE_PERIOD = Duration.ofSeconds(1);

    private static final String START_TIMEOUT_KEY = "start-timeout";
    private static final String STOP_TIMEOUT_KEY = "stop-timeout";
    private static final String VERBOSE_KEY = "verbose";
    private static final String HOOK_SIGNALS_KEY = "hook-signals";
    private static final String ENFORCE_STOP_DEADLINE_KEY = "enforce-stop-deadline";
    private static final String STOP_GRACE_PERIOD_KEY = "stop-grace-period";

    private final Duration startTimeout;
    private final Duration stopTimeout;
    private final boolean verbose;
    private final boolean hookSignals;
    private final boolean enforceStopDeadline;
    private final Duration stopGracePeriod;

    private ConductorOptions(final Builder builder) {
        this.startTimeout = requirePositive(builder.startTimeout, "startTimeout");
        this.stopTimeout = requirePositive(builder.stopTimeout, "stopTimeout");
        this.verbose = builder.verbose;
        this.hookSignals = builder.hookSignals;
        this.enforceStopDeadline = builder.enforceStopDeadline;
        this.stopGracePeriod = Objects.requireNonNull(builder.stopGracePeriod, "stopGracePeriod");
        if (stopGracePeriod.isNegative()) {
            throw new IllegalArgumentException("stopGracePeriod must not be negative: " + stopGracePeriod);
        }
    }

    public static ConductorOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads options from a HOCON block. Keys that are absent keep their defaults.
     *
     * @param options The {@code conductor.options} block.
     * @return The parsed options.
     * @throws com.typesafe.config.ConfigException if a present key has the wrong type.
     * @throws IllegalArgumentException if a value is out of range.
     */
    public static ConductorOptions fromConfig(final Config options) {
        final Builder builder = builder();
        if (options.hasPath(START_TIMEOUT_KEY)) {
            builder.startTimeout(options.getDuration(START_TIMEOUT_KEY));
        }
        if (options.hasPath(STOP_TIMEOUT_KEY)) {
            builder.stopTimeout(options.getDuration(STOP_TIMEOUT_KEY));
        }
        if (options.hasPath(VERBOSE_KEY)) {
            builder.verbose(options.getBoolean(VERBOSE_KEY));
        }
        if (options.hasPath(HOOK_SIGNALS_KEY)) {
            builder.hookSignals(options.getBoolean(HOOK_SIGNALS_KEY));
        }
        if (options.hasPath(ENFORCE_STOP_DEADLINE_KEY)) {
            builder.enforceStopDeadline(options.getBoolean(ENFORCE_STOP_DEADLINE_KEY));
        }
        if (options.hasPath(STOP_GRACE_PERIOD_KEY)) {
            builder.stopGracePeriod(options.getDuration(STOP_GRACE_PERIOD_KEY));
        }
        return builder.build();
    }

    public Duration getStartTimeout() {
        return startTimeout;
    }

    public Duration getStopTimeout() {
        return stopTimeout;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isHookSignals() {
        return hookSignals;
    }

    public boolean isEnforceStopDeadline() {
        return enforceStopDeadline;
    }

    public Duration getStopGracePeriod() {
        return stopGracePeriod;
    }

    /**
     * @return The longest time {@link Conductor#stop()} waits for acknowledgements when the
     *         stop deadline is enforced.
     */
    public Duration getStopCeiling() {
        return stopTimeout.plus(stopGracePeriod);
    }

    /**
     * @return A builder pre-filled with these options.
     */
    public Builder toBuilder() {
        return builder()
            .startTimeout(startTimeout)
            .stopTimeout(stopTimeout)
            .verbose(verbose)
            .hookSignals(hookSignals)
            .enforceStopDeadline(enforceStopDeadline)
            .stopGracePeriod(stopGracePeriod);
    }

    private static Duration requirePositive(final Duration value, final String name) {
        Objects.requireNonNull(value, name);
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
        return value;
    }

    @Override
    public String toString() {
        return "ConductorOptions{startTimeout=" + startTimeout
            + ", stopTimeout=" + stopTimeout
            + ", verbose=" + verbose
            + ", hookSignals=" + hookSignals
            + ", enforceStopDeadline=" + enforceStopDeadline
            + ", stopGracePeriod=" + stopGracePeriod + "}";
    }

    public static final class Builder {
        private Duration startTimeout = DEFAULT_START_TIMEOUT;
        private Duration stopTimeout = DEFAULT_STOP_TIMEOUT;
        private boolean verbose = false;
        private boolean hookSignals = false;
        private boolean enforceStopDeadline = true;
        private Duration stopGracePeriod = DEFAULT_STOP_GRACE_PERIOD;

        private Builder() {
        }

        public Builder startTimeout(final Duration startTimeout) {
            this.startTimeout = startTimeout;
            return this;
        }

        public Builder stopTimeout(final Duration stopTimeout) {
            this.stopTimeout = stopTimeout;
            return this;
        }

        public Builder verbose(final boolean verbose) {
            this.verbose = verbose;
            return this;
        }

        public Builder hookSignals(final boolean hookSignals) {
            this.hookSignals = hookSignals;
            return this;
        }

        public Builder enforceStopDeadline(final boolean enforceStopDeadline) {
            this.enforceStopDeadline = enforceStopDeadline;
            return this;
        }

        public Builder stopGracePeriod(final Duration stopGracePeriod) {
            this.stopGracePeriod = stopGracePeriod;
            return this;
        }

        public ConductorOptions build() {
            return new ConductorOptions(this);
        }
    }
}
