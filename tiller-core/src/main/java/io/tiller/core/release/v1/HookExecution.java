package io.tiller.core.release.v1;

import java.time.Instant;

/// Last run of a v1 hook.
public class HookExecution {

    /// Phase of a v1 hook run.
    public enum Phase {
        UNKNOWN("Unknown"),
        RUNNING("Running"),
        SUCCEEDED("Succeeded"),
        FAILED("Failed");

        private final String value;

        Phase(String value) {
            this.value = value;
        }

        public String value() {
            return value;
        }

        public static Phase fromValue(String value) {
            for (Phase phase : values()) {
                if (phase.value.equals(value)) {
                    return phase;
                }
            }
            return UNKNOWN;
        }

        @Override
        public String toString() {
            return value;
        }
    }

    private Instant startedAt;
    private Instant completedAt;
    private Phase phase = Phase.UNKNOWN;

    public HookExecution() {}

    public HookExecution(Instant startedAt, Phase phase) {
        this.startedAt = startedAt;
        this.phase = phase;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(Instant completedAt) {
        this.completedAt = completedAt;
    }

    public Phase getPhase() {
        return phase;
    }

    public void setPhase(Phase phase) {
        this.phase = phase;
    }
}
