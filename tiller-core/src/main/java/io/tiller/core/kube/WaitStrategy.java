package io.tiller.core.kube;

/// How an action blocks for resource readiness.
///
/// Only {@link #ORDERED} changes how resources are installed: it routes subchart
/// installation through the dependency scheduler. Every other value keeps the flat,
/// single-batch install.
public enum WaitStrategy {

    /// Watch resources with status watchers until ready.
    WATCHER("watcher"),

    /// Poll every resource at once until ready.
    LEGACY("legacy"),

    /// Only wait for hooks; installed resources are not awaited.
    HOOK_ONLY("hookOnly"),

    /// Install subcharts tier by tier in dependency order, waiting between tiers.
    ORDERED("ordered");

    private final String value;

    WaitStrategy(String value) {
        this.value = value;
    }

    /// @return the value used on the command line, never null
    public String value() {
        return value;
    }

    /// Resolves a strategy from its command-line value.
    ///
    /// @param value flag value such as `watcher` or `ordered`, not null
    /// @return the matching strategy, never null
    /// @throws IllegalArgumentException if the value names no strategy
    public static WaitStrategy fromValue(String value) {
        for (WaitStrategy strategy : values()) {
            if (strategy.value.equalsIgnoreCase(value)) {
                return strategy;
            }
        }
        throw new IllegalArgumentException(
                "unknown wait strategy '"
                        + value
                        + "', expected one of watcher, legacy, hookOnly, ordered");
    }

    @Override
    public String toString() {
        return value;
    }
}
