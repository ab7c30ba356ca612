package io.tiller.core.release;

/// Schema-independent phase of a hook's last run.
///
/// Each release schema carries its own phase enum; accessors translate between
/// them by {@link #value()}.
public enum HookPhase {

    /// Not run yet, or the watch step exited without reaching a terminal phase.
    UNKNOWN("Unknown"),

    /// Resources created, readiness not yet observed.
    RUNNING("Running"),

    SUCCEEDED("Succeeded"),

    FAILED("Failed");

    private final String value;

    HookPhase(String value) {
        this.value = value;
    }

    /// Returns the wire value shared by all schema versions.
    ///
    /// @return phase name as persisted, never null
    public String value() {
        return value;
    }

    /// Resolves a phase from its wire value.
    ///
    /// @param value persisted phase name, may be null
    /// @return matching phase, or {@link #UNKNOWN} for null or unrecognised values
    public static HookPhase fromValue(String value) {
        for (HookPhase phase : values()) {
            if (phase.value.equals(value)) {
                return phase;
            }
        }
        return UNKNOWN;
    }
}
