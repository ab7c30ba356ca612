package io.tiller.core.dependency;

import io.tiller.core.chart.Chart;
import java.util.Objects;
import java.util.Set;

/// A subchart in the dependency graph of its parent.
///
/// @param name subchart name, not null
/// @param chart the subchart, not null
/// @param dependsOn siblings that must be ready before this one installs, never null
public record DependencyNode(String name, Chart chart, Set<String> dependsOn) {

    public DependencyNode {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(chart, "chart must not be null");
        dependsOn = dependsOn != null ? Set.copyOf(dependsOn) : Set.of();
    }
}
