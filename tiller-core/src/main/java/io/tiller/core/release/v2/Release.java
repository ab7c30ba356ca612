package io.tiller.core.release.v2;

import io.tiller.core.chart.Chart;
import io.tiller.core.release.Releaser;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// A v2 release snapshot.
///
/// Deployment information lives in a nested {@link Info} object rather than on the
/// release itself.
public class Release implements Releaser {

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
    }

    /// Deployment information of a v2 release.
    public static class Info {
        private Instant firstDeployed;
        private Instant lastDeployed;
        private Instant deleted;
        private String description = "";
        private Status status = Status.UNKNOWN;
        private String notes = "";

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

        public Instant getDeleted() {
            return deleted;
        }

        public void setDeleted(Instant deleted) {
            this.deleted = deleted;
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

        public String getNotes() {
            return notes;
        }

        public void setNotes(String notes) {
            this.notes = notes;
        }
    }

    private final String name;
    private final String namespace;
    private final int version;
    private final Chart chart;
    private final Info info;
    private final Map<String, String> labels = new HashMap<>();
    private final List<Hook> hooks = new ArrayList<>();
    private String manifest = "";
    private String applyMethod = "";

    public Release(String name, String namespace, int version, Chart chart, Info info) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.namespace = Objects.requireNonNull(namespace, "namespace must not be null");
        this.version = version;
        this.chart = chart;
        this.info = info != null ? info : new Info();
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

    public Info getInfo() {
        return info;
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

    public String getApplyMethod() {
        return applyMethod;
    }

    public void setApplyMethod(String applyMethod) {
        this.applyMethod = applyMethod;
    }
}
