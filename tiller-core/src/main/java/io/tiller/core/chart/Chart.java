package io.tiller.core.chart;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// Immutable installable unit: metadata, templates and direct subcharts.
///
/// Subcharts are charts themselves and may carry their own subcharts; each level
/// only knows its direct children.
///
/// ### Validation
/// The builder rejects two subcharts with the same name, since subcharts are
/// addressed by name in dependency declarations.
///
/// @implNote Immutable and thread-safe after construction.
///
/// @see ChartMetadata for dependency declarations
public final class Chart {

    private final ChartMetadata metadata;
    private final List<ChartTemplate> templates;
    private final List<Chart> subcharts;

    private Chart(Builder builder) {
        this.metadata = Objects.requireNonNull(builder.metadata, "Chart metadata required");
        this.templates = Collections.unmodifiableList(new ArrayList<>(builder.templates));
        this.subcharts = Collections.unmodifiableList(new ArrayList<>(builder.subcharts));

        Set<String> seen = new HashSet<>();
        for (Chart subchart : subcharts) {
            if (!seen.add(subchart.getName())) {
                throw new IllegalStateException(
                        "Chart '"
                                + metadata.name()
                                + "' contains subchart '"
                                + subchart.getName()
                                + "' more than once");
            }
        }
    }

    public String getName() {
        return metadata.name();
    }

    public ChartMetadata getMetadata() {
        return metadata;
    }

    /// @return the chart's own templates, excluding subcharts, never null
    public List<ChartTemplate> getTemplates() {
        return templates;
    }

    /// @return direct subcharts in declaration order, never null
    public List<Chart> getSubcharts() {
        return subcharts;
    }

    public boolean hasSubcharts() {
        return !subcharts.isEmpty();
    }

    public Optional<Chart> subchart(String name) {
        return subcharts.stream().filter(c -> c.getName().equals(name)).findFirst();
    }

    @Override
    public String toString() {
        return "Chart{" + metadata.name() + ":" + metadata.version() + "}";
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static final class Builder {
        private final String name;
        private String version = "";
        private final Map<String, String> annotations = new HashMap<>();
        private final List<ChartDependency> dependencies = new ArrayList<>();
        private final List<ChartTemplate> templates = new ArrayList<>();
        private final List<Chart> subcharts = new ArrayList<>();
        private ChartMetadata metadata;

        private Builder(String name) {
            this.name = name;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder annotation(String key, String value) {
            this.annotations.put(key, value);
            return this;
        }

        /// Declares the siblings this chart must wait for when installed as a subchart.
        public Builder dependsOn(String... siblings) {
            return annotation(ChartMetadata.DEPENDS_ON_ANNOTATION, String.join(",", siblings));
        }

        public Builder dependency(ChartDependency dependency) {
            this.dependencies.add(dependency);
            return this;
        }

        public Builder template(String name, String data) {
            this.templates.add(new ChartTemplate(name, data));
            return this;
        }

        /// Adds a subchart; it is declared as a dependency unless already declared.
        public Builder subchart(Chart subchart) {
            this.subcharts.add(subchart);
            return this;
        }

        /// Replaces name, version, annotations and dependencies at once.
        public Builder metadata(ChartMetadata metadata) {
            this.metadata = metadata;
            return this;
        }

        public Chart build() {
            if (metadata == null) {
                List<ChartDependency> declared = new ArrayList<>(dependencies);
                for (Chart subchart : subcharts) {
                    boolean present =
                            declared.stream().anyMatch(d -> d.name().equals(subchart.getName()));
                    if (!present) {
                        declared.add(ChartDependency.of(subchart.getName()));
                    }
                }
                metadata = new ChartMetadata(name, version, annotations, declared);
            }
            return new Chart(this);
        }
    }
}
