package io.tiller.core.dependency;

import io.tiller.core.chart.Chart;
import io.tiller.core.chart.ManifestRenderer;
import io.tiller.core.chart.Manifests;
import io.tiller.core.chart.RenderException;
import io.tiller.core.kube.CreateOptions;
import io.tiller.core.kube.ResourceClient;
import io.tiller.core.kube.ResourceException;
import io.tiller.core.kube.ResourceList;
import io.tiller.core.kube.WaitStrategy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.logging.Logger;

/// Installs a chart tier by tier, following the dependencies between its subcharts.
///
/// ### Per chart level
/// 1. Build the {@link DependencyGraph} of the direct subcharts and compute the
///    {@link InstallationBatch}
/// 2. For each tier, in order:
///    - prepare every node concurrently: a node that has subcharts of its own is
///      installed recursively, any other node is rendered
///    - create the rendered manifests of the tier in one call
///    - optionally wait until they are ready
/// 3. Install the final tier: isolated subcharts and the chart's own resources
///
/// A tier starts only after the previous tier has been created and, when waiting is
/// enabled, reported ready. The first failure cancels the tier's in-flight siblings
/// and aborts the install with a {@link TierInstallException}.
///
/// ### Validation
/// The dependency graphs of the whole chart tree are validated before the first
/// resource is created: a cycle at any level fails the install without any cluster
/// call.
///
/// @implNote Recursive installs run on the same {@link ExecutorService} as their
/// parent tier and block a pool thread while their own tiers run. A
/// {@link ThreadPoolExecutor} bounded below {@link #requiredThreads(Chart)} is
/// rejected before any cluster call instead of deadlocking; the default environment
/// uses a cached pool. Concurrent installs sharing a bounded pool add up their demand.
/// The executor is not shut down here.
public final class OrderedInstaller {

    private static final Logger logger = Logger.getLogger(OrderedInstaller.class.getName());

    private final ResourceClient client;
    private final ManifestRenderer renderer;
    private final ExecutorService executorService;
    private final WaitStrategy tierWaitStrategy;
    private final boolean serverSideApply;

    /// @param client cluster client, not null
    /// @param renderer renders one chart level, not null
    /// @param executorService runs the nodes of a tier, not null, owned by the caller
    /// @param tierWaitStrategy waiter used for tier readiness, not null
    /// @param serverSideApply default apply mode of tier creates
    public OrderedInstaller(
            ResourceClient client,
            ManifestRenderer renderer,
            ExecutorService executorService,
            WaitStrategy tierWaitStrategy,
            boolean serverSideApply) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
        this.executorService =
                Objects.requireNonNull(executorService, "executorService must not be null");
        this.tierWaitStrategy =
                Objects.requireNonNull(tierWaitStrategy, "tierWaitStrategy must not be null");
        this.serverSideApply = serverSideApply;
    }

    /// Installs a chart in dependency order with the default apply mode.
    ///
    /// @see #installOrdered(Chart, boolean, Duration, boolean)
    public String installOrdered(Chart chart, boolean wait, Duration timeout)
            throws InstallException {
        return installOrdered(chart, wait, timeout, serverSideApply);
    }

    /// Installs a chart in dependency order.
    ///
    /// @param chart chart to install, not null
    /// @param wait wait for each tier to become ready before starting the next
    /// @param timeout bound of each tier wait, not null
    /// @param serverSideApply create resources through server-side apply
    /// @return installed documents in installation order, the chart's own resources
    ///     last, never null
    /// @throws DependencyGraphException if any level of the chart tree declares an
    ///     unknown or cyclic dependency
    /// @throws InstallException if the executor is bounded below what the chart tree
    ///     needs, see {@link #requiredThreads(Chart)}
    /// @throws TierInstallException if rendering, creating or waiting fails for a tier
    public String installOrdered(
            Chart chart, boolean wait, Duration timeout, boolean serverSideApply)
            throws InstallException {
        Objects.requireNonNull(chart, "chart must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");
        validate(chart);
        checkPoolCapacity(chart);
        return install(chart, new Options(wait, timeout, serverSideApply));
    }

    /// Returns the number of pool threads an ordered install of the chart may hold at
    /// once.
    ///
    /// Every tier node occupies a thread; a node with subcharts keeps its thread while
    /// its own tiers run, on top of the threads those tiers need. The calling thread is
    /// not counted.
    ///
    /// @param chart validated chart, not null
    /// @return peak thread demand, `0` for a chart without subcharts
    /// @throws DependencyGraphException if any level of the chart tree is invalid
    public static int requiredThreads(Chart chart) throws DependencyGraphException {
        InstallationBatch batch = DependencyGraph.forChart(chart).batches();
        List<List<String>> tiers = new ArrayList<>(batch.tiers());
        tiers.add(batch.isolated());

        int peak = 0;
        for (List<String> tier : tiers) {
            int demand = 0;
            for (String name : tier) {
                Chart subchart = chart.subchart(name).orElseThrow();
                demand += subchart.hasSubcharts() ? 1 + requiredThreads(subchart) : 1;
            }
            peak = Math.max(peak, demand);
        }
        return peak;
    }

    private static void validate(Chart chart) throws DependencyGraphException {
        DependencyGraph.forChart(chart);
        for (Chart subchart : chart.getSubcharts()) {
            validate(subchart);
        }
    }

    private void checkPoolCapacity(Chart chart) throws InstallException {
        if (!(executorService instanceof ThreadPoolExecutor)) {
            return;
        }
        ThreadPoolExecutor pool = (ThreadPoolExecutor) executorService;
        // A queueing pool never grows past its core size.
        int capacity =
                pool.getQueue().remainingCapacity() == 0
                        ? pool.getMaximumPoolSize()
                        : pool.getCorePoolSize();
        int required = requiredThreads(chart);
        if (required > capacity) {
            throw new InstallException(
                    chart.getName(),
                    "unable to install chart "
                            + chart.getName()
                            + ": it needs up to "
                            + required
                            + " concurrent thread(s) but the executor is bounded to "
                            + capacity);
        }
    }

    private String install(Chart chart, Options options) throws InstallException {
        InstallationBatch batch = DependencyGraph.forChart(chart).batches();
        logger.info(
                "Installing chart "
                        + chart.getName()
                        + " in "
                        + (batch.tiers().size() + 1)
                        + " tier(s): "
                        + batch.tiers()
                        + " then "
                        + batch.isolated());

        List<String> installed = new ArrayList<>();
        for (int i = 0; i < batch.tiers().size(); i++) {
            installed.add(installTier(chart, i, batch.tiers().get(i), false, options));
        }
        installed.add(installTier(chart, batch.finalTierIndex(), batch.isolated(), true, options));
        return Manifests.join(installed);
    }

    private String installTier(
            Chart chart, int tierIndex, List<String> names, boolean withOwn, Options options)
            throws TierInstallException {
        checkInterrupted(chart, tierIndex);

        CompletionService<NodeManifest> completion =
                new ExecutorCompletionService<>(executorService);
        Map<Future<NodeManifest>, Integer> positions = new HashMap<>();
        for (String name : names) {
            Chart subchart =
                    chart.subchart(name)
                            .orElseThrow(
                                    () ->
                                            new IllegalStateException(
                                                    "Subchart not found: " + name));
            positions.put(completion.submit(() -> prepare(subchart, options)), positions.size());
        }

        // Joined in completion order so that the first failure cancels every sibling.
        NodeManifest[] prepared = new NodeManifest[names.size()];
        for (int i = 0; i < names.size(); i++) {
            try {
                Future<NodeManifest> done = completion.take();
                prepared[positions.get(done)] = done.get();
            } catch (ExecutionException e) {
                cancelAll(positions.keySet());
                throw new TierInstallException(chart.getName(), tierIndex, e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancelAll(positions.keySet());
                throw new TierInstallException(chart.getName(), tierIndex, e);
            }
        }

        List<String> toApply = new ArrayList<>();
        List<String> tierDocuments = new ArrayList<>();
        for (NodeManifest node : prepared) {
            tierDocuments.add(node.manifest());
            if (!node.applied()) {
                toApply.add(node.manifest());
            }
        }
        if (withOwn) {
            try {
                String own = renderer.render(chart);
                toApply.add(own);
                tierDocuments.add(own);
            } catch (RenderException e) {
                throw new TierInstallException(chart.getName(), tierIndex, e);
            }
        }

        checkInterrupted(chart, tierIndex);
        apply(chart, tierIndex, Manifests.join(toApply), options);
        return Manifests.join(tierDocuments);
    }

    /// Stops a nested install whose parent tier was cancelled between two blocking calls.
    private static void checkInterrupted(Chart chart, int tierIndex) throws TierInstallException {
        if (Thread.currentThread().isInterrupted()) {
            throw new TierInstallException(
                    chart.getName(), tierIndex, new InterruptedException("install cancelled"));
        }
    }

    private NodeManifest prepare(Chart subchart, Options options) throws Exception {
        if (subchart.hasSubcharts()) {
            return new NodeManifest(install(subchart, options), true);
        }
        return new NodeManifest(renderer.render(subchart), false);
    }

    private void apply(Chart chart, int tierIndex, String manifest, Options options)
            throws TierInstallException {
        if (manifest.isBlank()) {
            logger.fine("Tier " + tierIndex + " of chart " + chart.getName() + " has nothing to create");
            return;
        }
        try {
            ResourceList resources = client.build(manifest, true);
            client.create(resources, CreateOptions.serverSideApply(options.serverSideApply()));
            logger.info(
                    "Created "
                            + resources.size()
                            + " resource(s) for tier "
                            + tierIndex
                            + " of chart "
                            + chart.getName());
            if (options.waitEnabled()) {
                client.getWaiter(tierWaitStrategy).waitUntilReady(resources, options.timeout());
            }
        } catch (ResourceException e) {
            throw new TierInstallException(chart.getName(), tierIndex, e);
        }
    }

    private static void cancelAll(Collection<? extends Future<?>> futures) {
        for (Future<?> future : futures) {
            future.cancel(true);
        }
    }

    /// Rendered or installed manifest of one tier node.
    ///
    /// @param applied true if the node's resources were already created by a nested install
    private record NodeManifest(String manifest, boolean applied) {}

    private record Options(boolean waitEnabled, Duration timeout, boolean serverSideApply) {}
}
