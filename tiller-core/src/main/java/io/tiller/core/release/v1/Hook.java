package io.tiller.core.release.v1;

import io.tiller.core.release.HookRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// A lifecycle hook of a v1 release.
///
/// Identity and manifest are fixed at construction; delete policies and the last run
/// are mutated in place while the hook engine executes the hook.
///
/// @see io.tiller.core.release.ReleaseAccessors#forHook(Object)
public class Hook implements HookRecord {

    /// Events a v1 hook can fire on.
    public enum Event {
        PRE_INSTALL("pre-install"),
        POST_INSTALL("post-install"),
        PRE_DELETE("pre-delete"),
        POST_DELETE("post-delete"),
        PRE_UPGRADE("pre-upgrade"),
        POST_UPGRADE("post-upgrade"),
        PRE_ROLLBACK("pre-rollback"),
        POST_ROLLBACK("post-rollback"),
        TEST("test"),
        /// Legacy spelling of {@link #TEST}, still accepted in v1 manifests.
        TEST_SUCCESS("test-success");

        private final String value;

        Event(String value) {
            this.value = value;
        }

        public String value() {
            return value;
        }

        /// @throws IllegalArgumentException if the value names no v1 event
        public static Event fromValue(String value) {
            for (Event event : values()) {
                if (event.value.equals(value)) {
                    return event;
                }
            }
            throw new IllegalArgumentException("unknown hook event: " + value);
        }

        @Override
        public String toString() {
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

        /// @throws IllegalArgumentException if the value names no delete policy
        public static DeletePolicy fromValue(String value) {
            for (DeletePolicy policy : values()) {
                if (policy.value.equals(value)) {
                    return policy;
                }
            }
            throw new IllegalArgumentException("unknown hook delete policy: " + value);
        }

        @Override
        public String toString() {
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

        /// @throws IllegalArgumentException if the value names no output-log policy
        public static OutputLogPolicy fromValue(String value) {
            for (OutputLogPolicy policy : values()) {
                if (policy.value.equals(value)) {
                    return policy;
                }
            }
            throw new IllegalArgumentException("unknown hook output log policy: " + value);
        }

        @Override
        public String toString() {
            return value;
        }
    }

    private final String name;
    private final String kind;
    private final String path;
    private final String manifest;
    private final List<Event> events;
    private final int weight;
    private List<DeletePolicy> deletePolicies;
    private final List<OutputLogPolicy> outputLogPolicies;
    private HookExecution lastRun = new HookExecution();

    private Hook(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "Hook name required");
        this.kind = Objects.requireNonNull(builder.kind, "Hook kind required");
        this.path = builder.path;
        this.manifest = builder.manifest;
        this.events = List.copyOf(builder.events);
        this.weight = builder.weight;
        this.deletePolicies = new ArrayList<>(builder.deletePolicies);
        this.outputLogPolicies = List.copyOf(builder.outputLogPolicies);
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

    public List<Event> getEvents() {
        return events;
    }

    public int getWeight() {
        return weight;
    }

    public List<DeletePolicy> getDeletePolicies() {
        return deletePolicies;
    }

    public void setDeletePolicies(List<DeletePolicy> deletePolicies) {
        this.deletePolicies = new ArrayList<>(deletePolicies);
    }

    public List<OutputLogPolicy> getOutputLogPolicies() {
        return outputLogPolicies;
    }

    public HookExecution getLastRun() {
        return lastRun;
    }

    public void setLastRun(HookExecution lastRun) {
        this.lastRun = lastRun;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name;
        private String kind;
        private String path = "";
        private String manifest = "";
        private final List<Event> events = new ArrayList<>();
        private int weight;
        private final List<DeletePolicy> deletePolicies = new ArrayList<>();
        private final List<OutputLogPolicy> outputLogPolicies = new ArrayList<>();

        private Builder() {}

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder kind(String kind) {
            this.kind = kind;
            return this;
        }

        public Builder path(String path) {
            this.path = path;
            return this;
        }

        public Builder manifest(String manifest) {
            this.manifest = manifest;
            return this;
        }

        public Builder event(Event event) {
            this.events.add(event);
            return this;
        }

        public Builder events(List<Event> events) {
            this.events.addAll(events);
            return this;
        }

        public Builder weight(int weight) {
            this.weight = weight;
            return this;
        }

        public Builder deletePolicy(DeletePolicy policy) {
            this.deletePolicies.add(policy);
            return this;
        }

        public Builder outputLogPolicy(OutputLogPolicy policy) {
            this.outputLogPolicies.add(policy);
            return this;
        }

        public Hook build() {
            return new Hook(this);
        }
    }
}
