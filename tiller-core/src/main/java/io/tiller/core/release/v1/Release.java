package io.tiller.core.release.v1;

import io.tiller.core.chart.Chart;
import io.tiller.core.release.Releaser;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// A v1 release snapshot: one deployed revision of a chart.
///
/// v1 keeps its deployment information (status, notes, timestamps) flat on the
/// release. Instances are owned by the release store; actions receive a reference,
/// mutate hooks and manifest in place, and hand the snapshot back for persistence.
public class Release implements Releaser {

    /// Status of a v1 release.
    public enum Status {
        UNKNOWN("unknown"),
        DEPLOYED("deployed"),
        UNINSTALLED("uninstalled"),
        SUPERSEDED("superseded"),
        FAILED("failed"),
        UNINSTALLING("uninstalling"),
        PENDING_INSTALL("pending-install"),
        PENDING_UPGRADE("pending-upgrade"),
        PENDING_ROLLBACK("pending-rollback");

        private final String value;

        Status(String value) {
            this.value = value;
        }

        public String value() {
            return value;
        }

        @Override
        public String toString() {
            return value;
        }
    }

    private final String name;
    private final String namespace;
    private final int version;
    private final Chart chart;
    private final Map<String, String> labels;
    private final List<Hook> hooks;
    private String manifest;
    private String notes;
    private String description;
    private Status status;
    private Instant firstDeployed;
    private Instant lastDeployed;
    private String applyMethod;

    private Release(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "Release name required");
        this.namespace = Objects.requireNonNull(builder.namespace, "Release namespace required");
        this.version = builder.version;
        this.chart = builder.chart;
        this.labels = new HashMap<>(builder.labels);
        this.hooks = new ArrayList<>(builder.hooks);
        this.manifest = builder.manifest;
        this.notes = builder.notes;
        this.description = builder.description;
        this.status = builder.status;
        this.firstDeployed = builder.firstDeployed;
        this.lastDeployed = builder.lastDeployed;
        this.applyMethod = builder.applyMethod;
    }

    public String getName() {
        return name;
    }

    public String getNamespace() {
        return namespace;
    }

    public int getVersion() {
        return version;
    }

    public Chart getChart() {
        return chart;
    }

    public Map<String, String> getLabels() {
        return labels;
    }

    public List<Hook> getHooks() {
        return hooks;
    }

    public String getManifest() {
        return manifest;
    }

    public void setManifest(String manifest) {
        this.manifest = manifest;
    }

    public String getNotes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public Status getStatus() {
        return status;
    }

    public void setStatus(Status status) {
        this.status = status;
    }

    public Instant getFirstDeployed() {
        return firstDeployed;
    }

    public void setFirstDeployed(Instant firstDeployed) {
        this.firstDeployed = firstDeployed;
    }

    public Instant getLastDeployed() {
        return lastDeployed;
    }

    public void setLastDeployed(Instant lastDeployed) {
        this.lastDeployed = lastDeployed;
    }

    public String getApplyMethod() {
        return applyMethod;
    }

    public void setApplyMethod(String applyMethod) {
        this.applyMethod = applyMethod;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name;
        private String namespace = "default";
        private int version = 1;
        private Chart chart;
        private final Map<String, String> labels = new HashMap<>();
        private final List<Hook> hooks = new ArrayList<>();
        private String manifest = "";
        private String notes = "";
        private String description = "";
        private Status status = Status.UNKNOWN;
        private Instant firstDeployed;
        private Instant lastDeployed;
        private String applyMethod = "";

        private Builder() {}

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder namespace(String namespace) {
            this.namespace = namespace;
            return this;
        }

        public Builder version(int version) {
            this.version = version;
            return this;
        }

        public Builder chart(Chart chart) {
            this.chart = chart;
            return this;
        }

        public Builder label(String key, String value) {
            this.labels.put(key, value);
            return this;
        }

        public Builder hook(Hook hook) {
            this.hooks.add(hook);
            return this;
        }

        public Builder hooks(List<Hook> hooks) {
            this.hooks.addAll(hooks);
            return this;
        }

        public Builder manifest(String manifest) {
            this.manifest = manifest;
            return this;
        }

        public Builder notes(String notes) {
            this.notes = notes;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder status(Status status) {
            this.status = status;
            return this;
        }

        public Builder firstDeployed(Instant firstDeployed) {
            this.firstDeployed = firstDeployed;
            return this;
        }

        public Builder lastDeployed(Instant lastDeployed) {
            this.lastDeployed = lastDeployed;
            return this;
        }

        public Builder applyMethod(String applyMethod) {
            this.applyMethod = applyMethod;
            return this;
        }

        public Release build() {
            return new Release(this);
        }
    }
}
