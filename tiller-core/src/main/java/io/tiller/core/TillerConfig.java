package io.tiller.core;

import io.tiller.core.kube.WaitStrategy;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Properties;

/// Configuration options for the Tiller deployment environment.
///
/// Controls default wait behavior, apply mode and pool sizing. Use the {@link Builder}
/// for fluent configuration, {@link #fromProperties(Properties)} to read a properties
/// source, or construct directly with setters.
///
/// ### Default Values
/// - `timeout`: 5 minutes per wait call
/// - `waitStrategy`: {@link WaitStrategy#WATCHER}
/// - `serverSideApply`: `false`
/// - `threadPoolSize`: `0` (cached pool, grows with nested tiers)
/// - `tierWaitStrategy`: {@link WaitStrategy#WATCHER}
///
/// ### Property Keys
/// - `tiller.timeout` - ISO-8601 duration (`PT90S`) or whole seconds (`90`)
/// - `tiller.wait` - wait strategy wire value (`watcher`, `legacy`, `hookOnly`, `ordered`)
/// - `tiller.server-side-apply` - `true` or `false`
/// - `tiller.thread-pool-size` - non-negative integer
///
/// @implNote **Not thread-safe**. Configure before passing to {@link TillerFactory}
/// and do not modify after environment creation.
///
/// @see TillerFactory.Builder#config(TillerConfig)
public class TillerConfig {

    public static final String TIMEOUT_PROPERTY = "tiller.timeout";
    public static final String WAIT_PROPERTY = "tiller.wait";
    public static final String SERVER_SIDE_APPLY_PROPERTY = "tiller.server-side-apply";
    public static final String THREAD_POOL_SIZE_PROPERTY = "tiller.thread-pool-size";

    private Duration timeout = Duration.ofMinutes(5);
    private WaitStrategy waitStrategy = WaitStrategy.WATCHER;
    private boolean serverSideApply = false;
    private int threadPoolSize = 0;
    private WaitStrategy tierWaitStrategy = WaitStrategy.WATCHER;

    /// Creates a configuration with default values.
    public TillerConfig() {}

    /// Reads a configuration from properties; absent keys keep their defaults.
    ///
    /// @param properties source properties, not null
    /// @return a new configuration, never null
    /// @throws IllegalArgumentException if a present value cannot be parsed
    public static TillerConfig fromProperties(Properties properties) {
        TillerConfig config = new TillerConfig();
        String timeout = properties.getProperty(TIMEOUT_PROPERTY);
        if (timeout != null && !timeout.isBlank()) {
            config.setTimeout(parseDuration(timeout.strip()));
        }
        String wait = properties.getProperty(WAIT_PROPERTY);
        if (wait != null && !wait.isBlank()) {
            config.setWaitStrategy(WaitStrategy.fromValue(wait.strip()));
        }
        String serverSideApply = properties.getProperty(SERVER_SIDE_APPLY_PROPERTY);
        if (serverSideApply != null && !serverSideApply.isBlank()) {
            config.setServerSideApply(Boolean.parseBoolean(serverSideApply.strip()));
        }
        String poolSize = properties.getProperty(THREAD_POOL_SIZE_PROPERTY);
        if (poolSize != null && !poolSize.isBlank()) {
            try {
                config.setThreadPoolSize(Integer.parseInt(poolSize.strip()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                        "Invalid " + THREAD_POOL_SIZE_PROPERTY + ": " + poolSize, e);
            }
        }
        return config;
    }

    private static Duration parseDuration(String value) {
        try {
            if (value.chars().allMatch(Character::isDigit)) {
                return Duration.ofSeconds(Long.parseLong(value));
            }
            return Duration.parse(value);
        } catch (DateTimeParseException | NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + TIMEOUT_PROPERTY + ": " + value, e);
        }
    }

    /// @return bound of each individual wait call, never null
    public Duration getTimeout() {
        return timeout;
    }

    /// @param timeout positive duration, not null
    public void setTimeout(Duration timeout) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
        this.timeout = timeout;
    }

    /// @return default wait strategy of hook execution and deployment, never null
    public WaitStrategy getWaitStrategy() {
        return waitStrategy;
    }

    public void setWaitStrategy(WaitStrategy waitStrategy) {
        this.waitStrategy = waitStrategy;
    }

    public boolean isServerSideApply() {
        return serverSideApply;
    }

    public void setServerSideApply(boolean serverSideApply) {
        this.serverSideApply = serverSideApply;
    }

    /// Returns the size of the tier execution pool.
    ///
    /// @return fixed pool size, or `0` for a cached pool
    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    /// Sets the size of the tier execution pool.
    ///
    /// A fixed pool blocks one thread per nested chart level while that level runs
    /// its tiers. Ordered installs reject charts that need more threads than the pool
    /// has, see {@link io.tiller.core.dependency.OrderedInstaller#requiredThreads}.
    ///
    /// @param threadPoolSize non-negative size, `0` for a cached pool
    public void setThreadPoolSize(int threadPoolSize) {
        if (threadPoolSize < 0) {
            throw new IllegalArgumentException(
                    "threadPoolSize must not be negative: " + threadPoolSize);
        }
        this.threadPoolSize = threadPoolSize;
    }

    /// @return waiter used for tier readiness in ordered installs, never null
    public WaitStrategy getTierWaitStrategy() {
        return tierWaitStrategy;
    }

    public void setTierWaitStrategy(WaitStrategy tierWaitStrategy) {
        this.tierWaitStrategy = tierWaitStrategy;
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link TillerConfig}.
    ///
    /// @implNote The builder mutates a single config instance and returns it on
    /// {@link #build()}.
    public static class Builder {
        private final TillerConfig config = new TillerConfig();

        public Builder timeout(Duration timeout) {
            config.setTimeout(timeout);
            return this;
        }

        public Builder waitStrategy(WaitStrategy waitStrategy) {
            config.setWaitStrategy(waitStrategy);
            return this;
        }

        public Builder serverSideApply(boolean serverSideApply) {
            config.setServerSideApply(serverSideApply);
            return this;
        }

        public Builder threadPoolSize(int threadPoolSize) {
            config.setThreadPoolSize(threadPoolSize);
            return this;
        }

        public Builder tierWaitStrategy(WaitStrategy tierWaitStrategy) {
            config.setTierWaitStrategy(tierWaitStrategy);
            return this;
        }

        /// @return the configured instance, never null
        public TillerConfig build() {
            return config;
        }
    }
}
