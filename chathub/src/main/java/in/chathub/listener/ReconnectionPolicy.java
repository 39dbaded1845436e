package in.chathub.listener;

import java.time.Duration;
import java.time.Instant;

/**
 * Exponential backoff for the database listener connection.
 *
 * The listener runs for the life of the process, so the policy never gives up:
 * the delay grows by {@code multiplier} per failure up to {@code maxDelay} and
 * snaps back to {@code initialDelay} after a successful connect.
 *
 * Usage:
 * <pre>
 * while (running) {
 *     try {
 *         connectAndListen();
 *     } catch (SQLException e) {
 *         Duration delay = policy.getNextDelay();
 *         policy.recordFailure();
 *         Thread.sleep(delay.toMillis());
 *     }
 * }
 * </pre>
 */
public class ReconnectionPolicy {

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;

    private int attemptCount = 0;
    private Duration currentDelay;
    private Instant lastFailureTime;

    private ReconnectionPolicy(Duration initialDelay, Duration maxDelay, double multiplier) {
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.currentDelay = initialDelay;
    }

    /**
     * Delay to wait before the next connect attempt.
     */
    public synchronized Duration getNextDelay() {
        return currentDelay;
    }

    /**
     * Record a failed connect (or a dropped connection) and grow the delay.
     */
    public synchronized void recordFailure() {
        attemptCount++;
        lastFailureTime = Instant.now();

        long newDelayMillis = (long) (currentDelay.toMillis() * multiplier);
        currentDelay = Duration.ofMillis(Math.min(newDelayMillis, maxDelay.toMillis()));
    }

    /**
     * Record a successful connect. Resets the delay and the failure count.
     */
    public synchronized void recordSuccess() {
        attemptCount = 0;
        currentDelay = initialDelay;
        lastFailureTime = null;
    }

    /**
     * Consecutive failures since the last success.
     */
    public synchronized int getAttemptCount() {
        return attemptCount;
    }

    public synchronized Instant getLastFailureTime() {
        return lastFailureTime;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Defaults for the Postgres listener: 1s doubling up to 30s.
     */
    public static ReconnectionPolicy forDatabaseListener() {
        return builder()
            .initialDelay(Duration.ofSeconds(1))
            .maxDelay(Duration.ofSeconds(30))
            .multiplier(2.0)
            .build();
    }

    public static class Builder {
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(30);
        private double multiplier = 2.0;

        public Builder initialDelay(Duration initialDelay) {
            if (initialDelay.isNegative() || initialDelay.isZero()) {
                throw new IllegalArgumentException("Initial delay must be positive");
            }
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            if (maxDelay.isNegative() || maxDelay.isZero()) {
                throw new IllegalArgumentException("Max delay must be positive");
            }
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder multiplier(double multiplier) {
            if (multiplier <= 1.0) {
                throw new IllegalArgumentException("Multiplier must be greater than 1.0");
            }
            this.multiplier = multiplier;
            return this;
        }

        public ReconnectionPolicy build() {
            if (initialDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException("Initial delay cannot exceed max delay");
            }
            return new ReconnectionPolicy(initialDelay, maxDelay, multiplier);
        }
    }
}
