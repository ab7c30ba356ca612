package io.tiller.core.hook;

import io.tiller.core.release.HookAccessor;
import java.util.List;
import java.util.Objects;

/// Two-phase result of executing the hooks of one event.
///
/// Both variants carry a {@link HookShutdown}: the caller decides when the deferred
/// cleanup runs. {@link HookShutdown#NO_OP} is used when nothing was created that the
/// engine would remove.
///
/// ### Permitted Subtypes
/// - {@link Succeeded} - every hook of the event reached readiness
/// - {@link Failed} - a hook failed, later hooks never ran
public sealed interface HookOutcome {

    /// @return deferred cleanup, never null
    HookShutdown shutdown();

    /// All hooks ran and became ready.
    ///
    /// @param executed hooks in execution order, not null, may be empty
    /// @param shutdown deletes executed hooks in reverse order by the succeeded policy
    record Succeeded(List<HookAccessor> executed, HookShutdown shutdown) implements HookOutcome {
        public Succeeded {
            executed = List.copyOf(Objects.requireNonNull(executed, "executed must not be null"));
            Objects.requireNonNull(shutdown, "shutdown must not be null");
        }
    }

    /// Execution stopped at a failing hook.
    ///
    /// @param error failure naming the event and hook path, not null
    /// @param shutdown failure-path cleanup, or {@link HookShutdown#NO_OP}
    record Failed(HookExecutionException error, HookShutdown shutdown) implements HookOutcome {
        public Failed {
            Objects.requireNonNull(error, "error must not be null");
            Objects.requireNonNull(shutdown, "shutdown must not be null");
        }
    }
}
