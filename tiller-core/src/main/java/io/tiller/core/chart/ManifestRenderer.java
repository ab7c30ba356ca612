package io.tiller.core.chart;

import java.util.ArrayList;
import java.util.List;

/// Renders the chart's own resource manifests.
///
/// Template evaluation is not part of this project; the deployer only needs the
/// rendered text of one chart level. Implementations must not include subcharts or
/// hook documents: subcharts are rendered through their own {@link Chart} and hooks
/// travel in the release snapshot.
@FunctionalInterface
public interface ManifestRenderer {

    /// Renders the manifests of a single chart level.
    ///
    /// @param chart chart to render, not null
    /// @return resource documents separated by `---`, never null, may be empty
    /// @throws RenderException if the chart cannot be rendered
    String render(Chart chart) throws RenderException;

    /// Returns a renderer that emits template content unchanged.
    ///
    /// Suitable for charts whose templates are already rendered documents.
    ///
    /// @return verbatim renderer, never null
    static ManifestRenderer verbatim() {
        return chart -> {
            List<String> documents = new ArrayList<>();
            for (ChartTemplate template : chart.getTemplates()) {
                documents.add(template.data());
            }
            return Manifests.join(documents);
        };
    }
}
