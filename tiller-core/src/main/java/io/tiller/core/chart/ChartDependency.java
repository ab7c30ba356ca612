package io.tiller.core.chart;

import java.util.List;
import java.util.Objects;

/// A dependency declaration in a chart's metadata.
///
/// @param name name of the subchart, not null
/// @param version version constraint, may be empty
/// @param repository repository URL, may be empty
/// @param dependsOn sibling subcharts that must be ready before this one installs, never null
public record ChartDependency(
        String name, String version, String repository, List<String> dependsOn) {

    public ChartDependency {
        Objects.requireNonNull(name, "name must not be null");
        version = version != null ? version : "";
        repository = repository != null ? repository : "";
        dependsOn = dependsOn != null ? List.copyOf(dependsOn) : List.of();
    }

    /// Creates a dependency without ordering constraints.
    public static ChartDependency of(String name) {
        return new ChartDependency(name, "", "", List.of());
    }

    /// Creates a dependency that installs after the given siblings.
    public static ChartDependency of(String name, String... dependsOn) {
        return new ChartDependency(name, "", "", List.of(dependsOn));
    }
}
