package io.tiller.core.dependency;

import java.util.List;

/// Installation schedule of one chart level.
///
/// @param tiers subchart names per tier in installation order, each tier sorted,
///     never null
/// @param isolated subcharts without any dependency edge, sorted, never null; they are
///     installed in the final tier together with the chart's own resources
public record InstallationBatch(List<List<String>> tiers, List<String> isolated) {

    public InstallationBatch {
        tiers = tiers.stream().map(List::copyOf).toList();
        isolated = List.copyOf(isolated);
    }

    /// @return index of the final tier, equal to the number of dependency tiers
    public int finalTierIndex() {
        return tiers.size();
    }
}
