package io.tiller.core.chart;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// Descriptive metadata of a chart.
///
/// ### Ordering annotation
/// A subchart may list the siblings it depends on in its own annotations under
/// {@link #DEPENDS_ON_ANNOTATION}. Both a comma-separated list (`nginx, rabbitmq`)
/// and a bracketed list (`["nginx","rabbitmq"]`) are accepted.
///
/// @param name chart name, not null
/// @param version chart version, may be empty
/// @param annotations free-form annotations, never null
/// @param dependencies declared subchart dependencies, never null
public record ChartMetadata(
        String name,
        String version,
        Map<String, String> annotations,
        List<ChartDependency> dependencies) {

    /// Annotation holding the siblings a subchart must wait for.
    public static final String DEPENDS_ON_ANNOTATION = "tiller.sh/depends-on";

    public ChartMetadata {
        Objects.requireNonNull(name, "name must not be null");
        version = version != null ? version : "";
        annotations = annotations != null ? Map.copyOf(annotations) : Map.of();
        dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
    }

    /// Finds the dependency declaration for a subchart.
    ///
    /// @param subchart subchart name, not null
    /// @return the declaration, or empty if the subchart is not declared
    public Optional<ChartDependency> dependency(String subchart) {
        return dependencies.stream().filter(d -> d.name().equals(subchart)).findFirst();
    }

    /// Parses {@link #DEPENDS_ON_ANNOTATION}.
    ///
    /// @return sibling names in declaration order without duplicates, never null
    public Set<String> annotatedDependsOn() {
        Set<String> names = new LinkedHashSet<>();
        String raw = annotations.get(DEPENDS_ON_ANNOTATION);
        if (raw == null || raw.isBlank()) {
            return names;
        }
        String list = raw.strip();
        if (list.startsWith("[") && list.endsWith("]")) {
            list = list.substring(1, list.length() - 1);
        }
        for (String item : list.split(",")) {
            String name = item.strip();
            if (name.length() >= 2
                    && (name.startsWith("\"") && name.endsWith("\"")
                            || name.startsWith("'") && name.endsWith("'"))) {
                name = name.substring(1, name.length() - 1).strip();
            }
            if (!name.isEmpty()) {
                names.add(name);
            }
        }
        return names;
    }
}
