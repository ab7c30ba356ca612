package io.tiller.core.dependency;

import java.io.Serial;
import java.util.List;

/// Subchart dependencies that form a cycle.
public class DependencyCycleException extends DependencyGraphException {

    @Serial private static final long serialVersionUID = 1904583337061721648L;

    private final List<String> cycle;

    /// @param chartName chart whose subcharts form the cycle
    /// @param cycle participating subcharts, first name repeated at the end
    public DependencyCycleException(String chartName, List<String> cycle) {
        super(
                chartName,
                "dependency cycle detected in chart "
                        + chartName
                        + ": "
                        + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    /// @return cycle path, e.g. `[x, y, x]`
    public List<String> getCycle() {
        return cycle;
    }
}
