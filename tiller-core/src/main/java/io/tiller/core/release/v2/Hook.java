package io.tiller.core.release.v2;

import io.tiller.core.release.HookRecord;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/// A lifecycle hook of a v2 release.
///
/// Unlike v1, events and policies are sets: declaring the same policy twice has no
/// effect. The legacy `test-success` event is not part of this schema.
public class Hook implements HookRecord {

    public enum Event {
        PRE_INSTALL("pre-install"),
        POST_INSTALL("post-install"),
        PRE_DELETE("pre-delete"),
        POST_DELETE("post-delete"),
        PRE_UPGRADE("pre-upgrade"),
        POST_UPGRADE("post-upgrade"),
        PRE_ROLLBACK("pre-rollback"),
        POST_ROLLBACK("post-rollback"),
        TEST("test");

        private final String value;

        Event(String value) {
            this.value = value;
        }

        public String value() {
            return value;
        }
    }

    public enum DeletePolicy {
        BEFORE_HOOK_CREATION("before-hook-creation"),
        HOOK_SUCCEEDED("hook-succeeded"),
        HOOK_FAILED("hook-failed");

        private final String value;

        DeletePolicy(String value) {
            this.value = value;
        }

        public String value() {
            return value;
        }
    }

    public enum OutputLogPolicy {
        HOOK_SUCCEEDED("hook-succeeded"),
        HOOK_FAILED("hook-failed");

        private final String value;

        OutputLogPolicy(String value) {
            this.value = value;
        }

        public String value() {
            return value;
        }
    }

    private final String name;
    private final String kind;
    private final String path;
    private final String manifest;
    private final int weight;
    private final Set<Event> events;
    private final Set<DeletePolicy> deletePolicies;
    private final Set<OutputLogPolicy> outputLogPolicies;
    private HookExecution lastRun = new HookExecution();

    public Hook(
            String name,
            String kind,
            String path,
            String manifest,
            int weight,
            Collection<Event> events,
            Collection<DeletePolicy> deletePolicies,
            Collection<OutputLogPolicy> outputLogPolicies) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.path = path != null ? path : "";
        this.manifest = manifest != null ? manifest : "";
        this.weight = weight;
        this.events = Collections.unmodifiableSet(new LinkedHashSet<>(events));
        this.deletePolicies = new LinkedHashSet<>(deletePolicies);
        this.outputLogPolicies = Collections.unmodifiableSet(new LinkedHashSet<>(outputLogPolicies));
    }

    public String getName() {
        return name;
    }

    public String getKind() {
        return kind;
    }

    public String getPath() {
        return path;
    }

    public String getManifest() {
        return manifest;
    }

    public int getWeight() {
        return weight;
    }

    public Set<Event> getEvents() {
        return events;
    }

    /// Returns the live, mutable delete-policy set.
    ///
    /// @return delete policies in declaration order, never null
    public Set<DeletePolicy> getDeletePolicies() {
        return deletePolicies;
    }

    public Set<OutputLogPolicy> getOutputLogPolicies() {
        return outputLogPolicies;
    }

    public HookExecution getLastRun() {
        return lastRun;
    }

    public void setLastRun(HookExecution lastRun) {
        this.lastRun = lastRun;
    }
}
