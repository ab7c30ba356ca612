package io.tiller.core.release;

import java.time.Instant;
import java.util.Comparator;

/// Schema-independent view of a single hook.
///
/// Exposes the identity and policies of a hook together with the three LastRun
/// mutators used by the hook engine. Policies and events are compared by their wire
/// values (see {@link HookPolicy} and {@link HookEvents}).
///
/// @implNote Implementations are not thread-safe. The hook engine is the only writer
/// for the duration of one execution pass and runs hooks one at a time.
public interface HookAccessor {

    /// Execution order of hooks within one event: weight ascending, then name.
    ///
    /// Used with a stable sort, so hooks equal in both keys keep their relative order.
    Comparator<HookAccessor> EXECUTION_ORDER =
            Comparator.comparingInt(HookAccessor::weight).thenComparing(HookAccessor::name);

    String path();

    String manifest();

    String name();

    /// @return resource kind of the hook manifest (e.g. `Job`, `Pod`), never null
    String kind();

    int weight();

    boolean hasEvent(String event);

    boolean hasDeletePolicy(String policy);

    /// Sets the delete policies to `[before-hook-creation]` if none are declared.
    ///
    /// Idempotent: a hook that already has policies is left untouched.
    void setDefaultDeletePolicy();

    boolean hasOutputLogPolicy(String policy);

    /// Resets the last run to start now in phase {@link HookPhase#RUNNING}.
    void setLastRunStarted();

    void setLastRunPhase(HookPhase phase);

    /// Records the completion time of the last run as now.
    void setLastRunCompleted();

    /// Returns a copy of the current last-run state.
    ///
    /// @return last run snapshot, never null
    LastRun lastRun();

    /// Point-in-time copy of a hook's last run.
    ///
    /// @param startedAt when the hook resources were applied, may be null
    /// @param completedAt when the watch step returned, may be null
    /// @param phase phase at copy time, never null
    record LastRun(Instant startedAt, Instant completedAt, HookPhase phase) {}
}
