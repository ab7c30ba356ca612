package io.tiller.core;

import io.tiller.core.chart.ManifestRenderer;
import io.tiller.core.deploy.ChartDeployer;
import io.tiller.core.dependency.OrderedInstaller;
import io.tiller.core.hook.HookExecutor;
import io.tiller.core.hook.ManifestMetadataReader;
import io.tiller.core.kube.LogSink;
import io.tiller.core.kube.ResourceClient;
import io.tiller.core.storage.InMemoryReleaseStore;
import io.tiller.core.storage.ReleaseStore;
import java.io.Writer;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/// Factory wiring {@link TillerEnvironment} instances.
///
/// The cluster client and the manifest metadata reader have no default: the core
/// ships neither a cluster client nor a YAML parser.
///
/// ### Usage
/// {@snippet :
/// try (TillerEnvironment env = TillerFactory.builder()
///         .config(TillerConfig.fromProperties(properties))
///         .resourceClient(client)
///         .metadataReader(new YamlManifestMetadataReader())
///         .build()) {
///     env.getChartDeployer().deploy(chart, WaitStrategy.ORDERED, timeout, false);
/// }
/// }
///
/// @see TillerEnvironment
/// @see TillerConfig
public final class TillerFactory {

    private TillerFactory() {
        // Utility class - prevent instantiation
    }

    /// Creates an executor service sized by the configuration.
    ///
    /// @param config configuration, not null
    /// @return cached pool for size `0`, fixed pool otherwise, never null
    public static ExecutorService createExecutorService(TillerConfig config) {
        return config.getThreadPoolSize() == 0
                ? Executors.newCachedThreadPool()
                : Executors.newFixedThreadPool(config.getThreadPoolSize());
    }

    /// @return a new builder, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link TillerEnvironment}.
    ///
    /// @implNote **Not thread-safe**. Intended for single-threaded configuration before
    /// calling {@link #build()}.
    public static class Builder {
        private TillerConfig config = new TillerConfig();
        private ResourceClient resourceClient;
        private ManifestMetadataReader metadataReader;
        private ManifestRenderer renderer = ManifestRenderer.verbatim();
        private ReleaseStore releaseStore;
        private LogSink logSink;
        private ExecutorService executorService;

        public Builder config(TillerConfig config) {
            this.config = config;
            return this;
        }

        /// Reads the configuration from properties.
        ///
        /// @see TillerConfig#fromProperties(Properties)
        public Builder loadProperties(Properties properties) {
            this.config = TillerConfig.fromProperties(properties);
            return this;
        }

        /// @param resourceClient cluster client, required
        public Builder resourceClient(ResourceClient resourceClient) {
            this.resourceClient = resourceClient;
            return this;
        }

        /// @param metadataReader hook manifest reader, required
        public Builder metadataReader(ManifestMetadataReader metadataReader) {
            this.metadataReader = metadataReader;
            return this;
        }

        /// @param renderer chart renderer, may be null for {@link ManifestRenderer#verbatim()}
        public Builder renderer(ManifestRenderer renderer) {
            this.renderer = renderer;
            return this;
        }

        /// @param releaseStore release store, may be null for an in-memory store
        public Builder releaseStore(ReleaseStore releaseStore) {
            this.releaseStore = releaseStore;
            return this;
        }

        /// @param logSink hook log destination, may be null to discard hook logs
        public Builder logSink(LogSink logSink) {
            this.logSink = logSink;
            return this;
        }

        /// @param executorService tier pool, may be null for a pool created from the config
        public Builder executorService(ExecutorService executorService) {
            this.executorService = executorService;
            return this;
        }

        /// Builds the environment.
        ///
        /// @apiNote **Side effects**: creates a thread pool if none was provided.
        ///
        /// @return the configured environment, never null
        /// @throws NullPointerException if the resource client or metadata reader is missing
        public TillerEnvironment build() {
            Objects.requireNonNull(resourceClient, "resourceClient is required");
            Objects.requireNonNull(metadataReader, "metadataReader is required");
            if (renderer == null) {
                renderer = ManifestRenderer.verbatim();
            }
            if (releaseStore == null) {
                releaseStore = new InMemoryReleaseStore();
            }
            if (logSink == null) {
                logSink = (namespace, pod, container) -> Writer.nullWriter();
            }
            if (executorService == null) {
                executorService = createExecutorService(config);
            }

            HookExecutor hookExecutor =
                    new HookExecutor(resourceClient, releaseStore, metadataReader, logSink);
            OrderedInstaller orderedInstaller =
                    new OrderedInstaller(
                            resourceClient,
                            renderer,
                            executorService,
                            config.getTierWaitStrategy(),
                            config.isServerSideApply());
            ChartDeployer chartDeployer =
                    new ChartDeployer(resourceClient, renderer, orderedInstaller);
            return new TillerEnvironment(
                    config,
                    hookExecutor,
                    orderedInstaller,
                    chartDeployer,
                    releaseStore,
                    executorService);
        }
    }
}
