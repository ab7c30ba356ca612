package io.tiller.core.deploy;

import io.tiller.core.chart.Chart;
import io.tiller.core.chart.ManifestRenderer;
import io.tiller.core.chart.Manifests;
import io.tiller.core.chart.RenderException;
import io.tiller.core.dependency.InstallException;
import io.tiller.core.dependency.OrderedInstaller;
import io.tiller.core.kube.CreateOptions;
import io.tiller.core.kube.ResourceClient;
import io.tiller.core.kube.ResourceException;
import io.tiller.core.kube.ResourceList;
import io.tiller.core.kube.WaitStrategy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Installs the resources of a chart tree, choosing the install path from the wait
/// strategy.
///
/// ### Paths
/// - {@link WaitStrategy#ORDERED} - tiered install by {@link OrderedInstaller}, waiting
///   on every tier
/// - any other strategy - flat install: every subchart depth-first in declaration
///   order, then the chart itself, created in one call and awaited once (no wait for
///   {@link WaitStrategy#HOOK_ONLY})
///
/// The flat path ignores declared dependencies entirely.
public final class ChartDeployer {

    private static final Logger logger = Logger.getLogger(ChartDeployer.class.getName());

    private final ResourceClient client;
    private final ManifestRenderer renderer;
    private final OrderedInstaller orderedInstaller;

    public ChartDeployer(
            ResourceClient client, ManifestRenderer renderer, OrderedInstaller orderedInstaller) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
        this.orderedInstaller =
                Objects.requireNonNull(orderedInstaller, "orderedInstaller must not be null");
    }

    /// Installs a chart tree.
    ///
    /// @param chart chart to install, not null
    /// @param waitStrategy install path and readiness wait, not null
    /// @param timeout bound of each wait, not null
    /// @param serverSideApply create resources through server-side apply
    /// @return installed manifest text in installation order, never null
    /// @throws InstallException if rendering, creating or waiting fails
    public String deploy(
            Chart chart, WaitStrategy waitStrategy, Duration timeout, boolean serverSideApply)
            throws InstallException {
        Objects.requireNonNull(chart, "chart must not be null");
        Objects.requireNonNull(waitStrategy, "waitStrategy must not be null");
        if (waitStrategy == WaitStrategy.ORDERED) {
            return orderedInstaller.installOrdered(chart, true, timeout, serverSideApply);
        }
        return deployFlat(chart, waitStrategy, timeout, serverSideApply);
    }

    private String deployFlat(
            Chart chart, WaitStrategy waitStrategy, Duration timeout, boolean serverSideApply)
            throws InstallException {
        List<String> documents = new ArrayList<>();
        try {
            flatten(chart, documents);
        } catch (RenderException e) {
            throw new InstallException(
                    chart.getName(), "unable to render chart " + chart.getName(), e);
        }
        String manifest = Manifests.join(documents);
        if (manifest.isBlank()) {
            return manifest;
        }

        try {
            ResourceList resources = client.build(manifest, true);
            client.create(resources, CreateOptions.serverSideApply(serverSideApply));
            logger.info("Created " + resources.size() + " resource(s) for chart " + chart.getName());
            if (waitStrategy != WaitStrategy.HOOK_ONLY) {
                client.getWaiter(waitStrategy).waitUntilReady(resources, timeout);
            }
        } catch (ResourceException e) {
            throw new InstallException(
                    chart.getName(),
                    "unable to install chart " + chart.getName() + ": " + e.getMessage(),
                    e);
        }
        return manifest;
    }

    private void flatten(Chart chart, List<String> documents) throws RenderException {
        for (Chart subchart : chart.getSubcharts()) {
            flatten(subchart, documents);
        }
        documents.add(renderer.render(chart));
    }
}
