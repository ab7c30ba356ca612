package io.tiller.core;

import io.tiller.core.chart.Chart;
import io.tiller.core.dependency.InstallException;
import io.tiller.core.dependency.OrderedInstaller;
import io.tiller.core.deploy.ChartDeployer;
import io.tiller.core.hook.HookExecutionException;
import io.tiller.core.hook.HookExecutor;
import io.tiller.core.kube.WaitStrategy;
import io.tiller.core.release.Releaser;
import io.tiller.core.storage.ReleaseStore;
import java.time.Duration;
import java.util.concurrent.ExecutorService;

/// Container holding the wired deployment components.
///
/// Implements {@link AutoCloseable} to shut down the tier execution pool.
///
/// @implNote All fields are final and set at construction time; safe for concurrent
/// reads. The contained components have their own thread-safety guarantees.
///
/// @apiNote Create instances via {@link TillerFactory#builder()} rather than direct
/// construction.
public final class TillerEnvironment implements AutoCloseable {

    private final TillerConfig config;
    private final HookExecutor hookExecutor;
    private final OrderedInstaller orderedInstaller;
    private final ChartDeployer chartDeployer;
    private final ReleaseStore releaseStore;
    private final ExecutorService executorService;

    public TillerEnvironment(
            TillerConfig config,
            HookExecutor hookExecutor,
            OrderedInstaller orderedInstaller,
            ChartDeployer chartDeployer,
            ReleaseStore releaseStore,
            ExecutorService executorService) {
        this.config = config;
        this.hookExecutor = hookExecutor;
        this.orderedInstaller = orderedInstaller;
        this.chartDeployer = chartDeployer;
        this.releaseStore = releaseStore;
        this.executorService = executorService;
    }

    public TillerConfig getConfig() {
        return config;
    }

    /// @return the hook engine, never null
    public HookExecutor getHookExecutor() {
        return hookExecutor;
    }

    public OrderedInstaller getOrderedInstaller() {
        return orderedInstaller;
    }

    /// @return deployer routing between the ordered and flat install paths, never null
    public ChartDeployer getChartDeployer() {
        return chartDeployer;
    }

    /// Defaults to {@link io.tiller.core.storage.InMemoryReleaseStore} when no store is
    /// registered via {@link TillerFactory.Builder}.
    ///
    /// @return the release store, never null
    public ReleaseStore getReleaseStore() {
        return releaseStore;
    }

    /// Runs the hooks of one event with the configured wait strategy, timeout and
    /// apply mode, then their cleanup.
    ///
    /// @see HookExecutor#executeAndCleanup(Releaser, String, WaitStrategy, Duration, boolean)
    public void runHooks(Releaser release, String event) throws HookExecutionException {
        hookExecutor.executeAndCleanup(
                release,
                event,
                config.getWaitStrategy(),
                config.getTimeout(),
                config.isServerSideApply());
    }

    /// Deploys a chart with the configured wait strategy, timeout and apply mode.
    ///
    /// @return installed documents, never null
    /// @see ChartDeployer#deploy(Chart, WaitStrategy, Duration, boolean)
    public String deploy(Chart chart) throws InstallException {
        return chartDeployer.deploy(
                chart, config.getWaitStrategy(), config.getTimeout(), config.isServerSideApply());
    }

    /// Shuts down the tier execution pool.
    ///
    /// @implNote Calls `ExecutorService.shutdown()` which does not block; running tiers
    /// finish, new tiers are rejected.
    @Override
    public void close() {
        executorService.shutdown();
    }
}
