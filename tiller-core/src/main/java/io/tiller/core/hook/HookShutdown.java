package io.tiller.core.hook;

/// Deferred cleanup returned by {@link HookExecutor#execute}.
///
/// Callers run it once the release-finalization work that must happen between
/// readiness and teardown is done. Running it more than once repeats the deletions.
@FunctionalInterface
public interface HookShutdown {

    /// Cleanup that does nothing, returned when no hook resource is left to handle.
    HookShutdown NO_OP = () -> {};

    /// Performs the cleanup.
    ///
    /// @throws HookExecutionException on the first hard deletion failure, or with the
    ///     original failure once the failure-path cleanup has finished
    void run() throws HookExecutionException;
}
