package io.tiller.core.dependency;

import io.tiller.core.chart.Chart;
import io.tiller.core.chart.ChartDependency;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/// Installation-order graph over the direct subcharts of one chart.
///
/// An edge `a -> b` means `a` must be ready before `b` installs. A subchart's
/// dependencies are the union of its own `tiller.sh/depends-on` annotation and the
/// `dependsOn` field of the parent's declaration for it.
///
/// ### Validation
/// {@link #forChart} rejects references to siblings that do not exist and any cycle,
/// so a constructed graph is always acyclic.
///
/// ### Scheduling
/// {@link #batches()} peels tiers off the graph: each tier holds the nodes whose
/// dependencies all sit in earlier tiers. Nodes with no edge in either direction are
/// kept out of the peeling and reported as isolated.
///
/// @implNote Immutable. A graph only covers one chart level; nested subcharts get
/// their own graph when their level is installed.
public final class DependencyGraph {

    private final String chartName;
    private final Map<String, DependencyNode> nodes;
    private final Map<String, Set<String>> dependents;

    private DependencyGraph(String chartName, Map<String, DependencyNode> nodes) {
        this.chartName = chartName;
        this.nodes = Collections.unmodifiableMap(nodes);

        Map<String, Set<String>> reverse = new HashMap<>();
        for (DependencyNode node : nodes.values()) {
            reverse.computeIfAbsent(node.name(), k -> new TreeSet<>());
            for (String dependency : node.dependsOn()) {
                reverse.computeIfAbsent(dependency, k -> new TreeSet<>()).add(node.name());
            }
        }
        this.dependents = reverse;
    }

    /// Builds and validates the graph of a chart's direct subcharts.
    ///
    /// @param chart owning chart, not null
    /// @return acyclic graph, never null, empty if the chart has no subcharts
    /// @throws DependencyGraphException if a dependency names an unknown sibling
    /// @throws DependencyCycleException if the dependencies form a cycle
    public static DependencyGraph forChart(Chart chart) throws DependencyGraphException {
        Map<String, DependencyNode> nodes = new LinkedHashMap<>();
        for (Chart subchart : chart.getSubcharts()) {
            Set<String> dependsOn = new LinkedHashSet<>(subchart.getMetadata().annotatedDependsOn());
            chart.getMetadata()
                    .dependency(subchart.getName())
                    .map(ChartDependency::dependsOn)
                    .ifPresent(dependsOn::addAll);
            nodes.put(subchart.getName(), new DependencyNode(subchart.getName(), subchart, dependsOn));
        }

        for (DependencyNode node : nodes.values()) {
            for (String dependency : new TreeSet<>(node.dependsOn())) {
                if (!nodes.containsKey(dependency)) {
                    throw new DependencyGraphException(
                            chart.getName(),
                            "subchart "
                                    + node.name()
                                    + " of chart "
                                    + chart.getName()
                                    + " depends on unknown subchart "
                                    + dependency);
                }
            }
        }

        DependencyGraph graph = new DependencyGraph(chart.getName(), nodes);
        Optional<List<String>> cycle = graph.findCycle();
        if (cycle.isPresent()) {
            throw new DependencyCycleException(chart.getName(), cycle.get());
        }
        return graph;
    }

    public String getChartName() {
        return chartName;
    }

    /// @return nodes in subchart declaration order, never null
    public List<DependencyNode> nodes() {
        return List.copyOf(nodes.values());
    }

    public Optional<DependencyNode> node(String name) {
        return Optional.ofNullable(nodes.get(name));
    }

    /// @return names of the siblings that depend on the given node, sorted, never null
    public Set<String> dependents(String name) {
        return Collections.unmodifiableSet(dependents.getOrDefault(name, Set.of()));
    }

    /// @return true if the node neither depends on nor is depended on by a sibling
    public boolean isIsolated(String name) {
        DependencyNode node = nodes.get(name);
        return node != null && node.dependsOn().isEmpty() && dependents(name).isEmpty();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /// Computes the installation schedule.
    ///
    /// @return tiers of connected nodes plus the isolated nodes, never null
    public InstallationBatch batches() {
        List<String> isolated = new ArrayList<>();
        Map<String, Integer> pending = new HashMap<>();
        for (DependencyNode node : nodes.values()) {
            if (isIsolated(node.name())) {
                isolated.add(node.name());
            } else {
                pending.put(node.name(), node.dependsOn().size());
            }
        }
        Collections.sort(isolated);

        List<List<String>> tiers = new ArrayList<>();
        TreeSet<String> ready = new TreeSet<>();
        pending.forEach(
                (name, count) -> {
                    if (count == 0) {
                        ready.add(name);
                    }
                });
        while (!ready.isEmpty()) {
            List<String> tier = new ArrayList<>(ready);
            tiers.add(tier);
            ready.clear();
            for (String name : tier) {
                pending.remove(name);
                for (String dependent : dependents(name)) {
                    int remaining = pending.merge(dependent, -1, Integer::sum);
                    if (remaining == 0) {
                        ready.add(dependent);
                    }
                }
            }
        }
        return new InstallationBatch(tiers, isolated);
    }

    private Optional<List<String>> findCycle() {
        Set<String> done = new HashSet<>();
        for (String start : new TreeSet<>(nodes.keySet())) {
            if (done.contains(start)) {
                continue;
            }
            Deque<String> path = new ArrayDeque<>();
            Optional<List<String>> cycle = visit(start, path, new HashSet<>(), done);
            if (cycle.isPresent()) {
                return cycle;
            }
        }
        return Optional.empty();
    }

    private Optional<List<String>> visit(
            String name, Deque<String> path, Set<String> onPath, Set<String> done) {
        path.addLast(name);
        onPath.add(name);
        for (String dependency : new TreeSet<>(nodes.get(name).dependsOn())) {
            if (onPath.contains(dependency)) {
                List<String> cycle = new ArrayList<>();
                boolean inCycle = false;
                for (String step : path) {
                    inCycle = inCycle || step.equals(dependency);
                    if (inCycle) {
                        cycle.add(step);
                    }
                }
                cycle.add(dependency);
                return Optional.of(cycle);
            }
            if (!done.contains(dependency)) {
                Optional<List<String>> cycle = visit(dependency, path, onPath, done);
                if (cycle.isPresent()) {
                    return cycle;
                }
            }
        }
        path.removeLast();
        onPath.remove(name);
        done.add(name);
        return Optional.empty();
    }
}
