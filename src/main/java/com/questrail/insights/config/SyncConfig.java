package com.questrail.insights.config;

import java.time.Duration;
import java.util.Objects;

/**
 * SyncConfig
 * -----------------------------------------------------------------------------
 * Operational configuration for the synchronization coordinator.
 *
 * <p>Only scheduling and resource concerns live here. Which keys are preserved
 * on failure and how push events correlate onto entities are fixed behavior of
 * the coordinator, not configuration.</p>
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>refreshInterval</b>: cadence of scheduled refresh cycles, measured
 *       start-to-start on the monotonic clock. A tick that fires while a cycle
 *       is still running is skipped.</li>
 *   <li><b>protectEnabled</b>: whether the video/sensor bulk pass and push
 *       subscription run. Ignored when no event client is configured.</li>
 *   <li><b>maxConcurrentFetches</b>: cap on fetch worker threads.
 *       {@code 0} means unbounded fan-out.</li>
 *   <li><b>shutdownGrace</b>: how long {@code stop()} waits for an in-flight
 *       cycle before abandoning it.</li>
 * </ul>
 */
public record SyncConfig(
        Duration refreshInterval,
        boolean protectEnabled,
        int maxConcurrentFetches,
        Duration shutdownGrace
) {
    public SyncConfig {
        Objects.requireNonNull(refreshInterval, "refreshInterval");
        Objects.requireNonNull(shutdownGrace, "shutdownGrace");

        if (refreshInterval.isNegative() || refreshInterval.isZero()) {
            throw new IllegalArgumentException("refreshInterval must be positive");
        }
        if (maxConcurrentFetches < 0) {
            throw new IllegalArgumentException("maxConcurrentFetches must be >= 0");
        }
        if (shutdownGrace.isNegative()) {
            throw new IllegalArgumentException("shutdownGrace must be non-negative");
        }
    }

    /**
     * <ul>
     *   <li>refreshInterval: 30s</li>
     *   <li>protectEnabled: true</li>
     *   <li>maxConcurrentFetches: 0 (unbounded)</li>
     *   <li>shutdownGrace: 5s</li>
     * </ul>
     */
    public static SyncConfig defaults() {
        return builder().build();
    }

    public boolean isFanOutBounded() {
        return maxConcurrentFetches > 0;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Duration refreshInterval = Duration.ofSeconds(30);
        private boolean protectEnabled = true;
        private int maxConcurrentFetches = 0;
        private Duration shutdownGrace = Duration.ofSeconds(5);

        public Builder withRefreshInterval(Duration refreshInterval) {
            this.refreshInterval = refreshInterval;
            return this;
        }

        public Builder withProtectEnabled(boolean protectEnabled) {
            this.protectEnabled = protectEnabled;
            return this;
        }

        public Builder withMaxConcurrentFetches(int maxConcurrentFetches) {
            this.maxConcurrentFetches = maxConcurrentFetches;
            return this;
        }

        public Builder withShutdownGrace(Duration shutdownGrace) {
            this.shutdownGrace = shutdownGrace;
            return this;
        }

        public SyncConfig build() {
            return new SyncConfig(refreshInterval, protectEnabled, maxConcurrentFetches, shutdownGrace);
        }
    }
}
