package io.tiller.core.hook;

import io.tiller.core.kube.CreateOptions;
import io.tiller.core.kube.LogSink;
import io.tiller.core.kube.ResourceClient;
import io.tiller.core.kube.ResourceException;
import io.tiller.core.kube.ResourceList;
import io.tiller.core.kube.WaitStrategy;
import io.tiller.core.kube.Waiter;
import io.tiller.core.release.HookAccessor;
import io.tiller.core.release.HookPhase;
import io.tiller.core.release.HookPolicy;
import io.tiller.core.release.ReleaseAccessor;
import io.tiller.core.release.ReleaseAccessors;
import io.tiller.core.release.Releaser;
import io.tiller.core.release.UnsupportedSchemaException;
import io.tiller.core.storage.ReleaseStore;
import io.tiller.core.storage.StorageException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Executes the lifecycle hooks bound to one release event.
///
/// ### Execution Flow
/// 1. Select the hooks bound to the event and stable-sort them by
///    {@link HookAccessor#EXECUTION_ORDER}
/// 2. For each hook, in order:
///    - default its delete policies, delete a stale instance (`before-hook-creation`)
///    - build its manifest, mark it running and record the release
///    - create its resources and watch them until ready
/// 3. Stop at the first failure; later hooks never run
///
/// Hooks run strictly one after another on the calling thread. For the duration of
/// one call the executor is the only writer of the hooks' last-run state.
///
/// ### Deferred Cleanup
/// Deletion of hook resources by the `hook-succeeded` / `hook-failed` policies is not
/// performed by {@link #execute}. It is returned as the outcome's {@link HookShutdown}
/// so the caller can finalize the release first. {@link #executeAndCleanup} runs both
/// phases back to back.
///
/// ### Usage
/// {@snippet :
/// HookOutcome outcome = executor.execute(release, HookEvents.PRE_INSTALL,
///         WaitStrategy.WATCHER, Duration.ofMinutes(5), false);
/// if (outcome instanceof HookOutcome.Failed failed) {
///     failed.shutdown().run();
/// }
/// }
///
/// @see HookOutcome for the two-phase result
public final class HookExecutor {

    private static final Logger logger = Logger.getLogger(HookExecutor.class.getName());

    private final ResourceClient client;
    private final ReleaseStore releaseStore;
    private final HookResources resources;

    /// @param client cluster client, not null
    /// @param releaseStore store receiving in-progress snapshots, not null
    /// @param metadataReader reads hook namespaces for log output, not null
    /// @param logSink receives hook container logs, not null
    public HookExecutor(
            ResourceClient client,
            ReleaseStore releaseStore,
            ManifestMetadataReader metadataReader,
            LogSink logSink) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.releaseStore = Objects.requireNonNull(releaseStore, "releaseStore must not be null");
        this.resources = new HookResources(client, metadataReader, logSink);
    }

    /// Runs the hooks of one event and returns the deferred cleanup.
    ///
    /// Never throws for hook failures: they are reported as {@link HookOutcome.Failed}.
    ///
    /// @param release release snapshot owning the hooks, not null
    /// @param event event wire value (see {@link io.tiller.core.release.HookEvents}), not null
    /// @param waitStrategy strategy of the readiness and deletion waits, not null
    /// @param timeout bound of each individual wait, not null
    /// @param serverSideApply create hook resources through server-side apply
    /// @return the outcome, never null
    public HookOutcome execute(
            Releaser release,
            String event,
            WaitStrategy waitStrategy,
            Duration timeout,
            boolean serverSideApply) {
        Objects.requireNonNull(event, "event must not be null");
        Objects.requireNonNull(waitStrategy, "waitStrategy must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");

        ReleaseAccessor accessor;
        try {
            accessor = ReleaseAccessors.forRelease(release);
        } catch (UnsupportedSchemaException e) {
            return new HookOutcome.Failed(
                    new HookExecutionException(e.getMessage(), event, null, e), HookShutdown.NO_OP);
        }

        List<HookAccessor> hooks =
                accessor.hooks().stream()
                        .filter(hook -> hook.hasEvent(event))
                        .sorted(HookAccessor.EXECUTION_ORDER)
                        .toList();
        if (!hooks.isEmpty()) {
            logger.info(
                    "Executing "
                            + hooks.size()
                            + " "
                            + event
                            + " hook(s) for release "
                            + accessor.name());
        }

        Context context =
                new Context(release, accessor.namespace(), event, waitStrategy, timeout);
        for (int i = 0; i < hooks.size(); i++) {
            HookOutcome.Failed failed = executeHook(context, hooks, i, serverSideApply);
            if (failed != null) {
                return failed;
            }
        }
        return new HookOutcome.Succeeded(hooks, () -> cleanupSucceeded(context, hooks));
    }

    /// Runs the hooks of one event, then their cleanup.
    ///
    /// @throws HookExecutionException if a hook failed or the cleanup failed; a cleanup
    ///     failure takes precedence over the hook failure
    public void executeAndCleanup(
            Releaser release,
            String event,
            WaitStrategy waitStrategy,
            Duration timeout,
            boolean serverSideApply)
            throws HookExecutionException {
        HookOutcome outcome = execute(release, event, waitStrategy, timeout, serverSideApply);
        if (outcome instanceof HookOutcome.Failed failed) {
            failed.shutdown().run();
            throw failed.error();
        }
        outcome.shutdown().run();
    }

    /// @return the failed outcome, or null if the hook became ready
    private HookOutcome.Failed executeHook(
            Context context, List<HookAccessor> hooks, int index, boolean serverSideApply) {
        HookAccessor hook = hooks.get(index);
        String event = context.event();

        hook.setDefaultDeletePolicy();
        try {
            resources.deleteByPolicy(
                    hook,
                    HookPolicy.DELETE_BEFORE_HOOK_CREATION,
                    context.waitStrategy(),
                    context.timeout());
        } catch (HookExecutionException e) {
            return new HookOutcome.Failed(e, HookShutdown.NO_OP);
        }

        ResourceList built;
        try {
            built = client.build(hook.manifest(), true);
        } catch (ResourceException e) {
            return new HookOutcome.Failed(
                    new HookExecutionException(
                            "unable to build kubernetes object for "
                                    + event
                                    + " hook "
                                    + hook.path(),
                            event,
                            hook.path(),
                            e),
                    HookShutdown.NO_OP);
        }

        hook.setLastRunStarted();
        recordRelease(context.release());
        logger.info("Running " + event + " hook " + hook.path());

        try {
            try {
                client.create(built, CreateOptions.serverSideApply(serverSideApply));
            } catch (ResourceException e) {
                hook.setLastRunCompleted();
                hook.setLastRunPhase(HookPhase.FAILED);
                return new HookOutcome.Failed(hookFailed(event, hook, e), HookShutdown.NO_OP);
            }

            Waiter waiter;
            try {
                waiter = client.getWaiter(context.waitStrategy());
            } catch (ResourceException e) {
                hook.setLastRunCompleted();
                hook.setLastRunPhase(HookPhase.UNKNOWN);
                return new HookOutcome.Failed(
                        new HookExecutionException("unable to get waiter", event, hook.path(), e),
                        HookShutdown.NO_OP);
            }

            try {
                waiter.watchUntilReady(built, context.timeout());
            } catch (ResourceException e) {
                hook.setLastRunCompleted();
                hook.setLastRunPhase(HookPhase.FAILED);
                logger.warning("Hook " + event + " " + hook.path() + " failed: " + e.getMessage());
                outputLogsQuietly(context, hook, HookPolicy.OUTPUT_HOOK_FAILED);
                HookExecutionException error = hookFailed(event, hook, e);
                List<HookAccessor> succeeded = List.copyOf(hooks.subList(0, index));
                return new HookOutcome.Failed(
                        error, () -> cleanupFailed(context, hook, succeeded, error));
            }
        } catch (RuntimeException e) {
            // Create and watch normally end in Failed or Succeeded; anything else is Unknown.
            hook.setLastRunCompleted();
            hook.setLastRunPhase(HookPhase.UNKNOWN);
            return new HookOutcome.Failed(hookFailed(event, hook, e), HookShutdown.NO_OP);
        }

        hook.setLastRunCompleted();
        hook.setLastRunPhase(HookPhase.SUCCEEDED);
        return null;
    }

    private void cleanupFailed(
            Context context,
            HookAccessor failedHook,
            List<HookAccessor> succeeded,
            HookExecutionException error)
            throws HookExecutionException {
        try {
            resources.deleteByPolicy(
                    failedHook,
                    HookPolicy.DELETE_HOOK_FAILED,
                    context.waitStrategy(),
                    context.timeout());
        } catch (HookExecutionException e) {
            logger.warning(
                    "Error deleting the hook resource on hook failure: " + e.getMessage());
        }
        for (HookAccessor hook : succeeded) {
            resources.deleteByPolicy(
                    hook,
                    HookPolicy.DELETE_HOOK_SUCCEEDED,
                    context.waitStrategy(),
                    context.timeout());
        }
        throw error;
    }

    private void cleanupSucceeded(Context context, List<HookAccessor> executed)
            throws HookExecutionException {
        for (int i = executed.size() - 1; i >= 0; i--) {
            HookAccessor hook = executed.get(i);
            outputLogsQuietly(context, hook, HookPolicy.OUTPUT_HOOK_SUCCEEDED);
            resources.deleteByPolicy(
                    hook,
                    HookPolicy.DELETE_HOOK_SUCCEEDED,
                    context.waitStrategy(),
                    context.timeout());
        }
    }

    private void outputLogsQuietly(Context context, HookAccessor hook, String policy) {
        try {
            resources.outputLogsByPolicy(hook, context.releaseNamespace(), policy);
        } catch (HookExecutionException e) {
            logger.warning("Error outputting logs for hook " + hook.path() + ": " + e.getMessage());
        }
    }

    private void recordRelease(Releaser release) {
        try {
            releaseStore.update(release);
        } catch (StorageException e) {
            logger.warning("Failed to record release: " + e.getMessage());
        }
    }

    private static HookExecutionException hookFailed(
            String event, HookAccessor hook, Throwable cause) {
        return new HookExecutionException(
                "hook " + event + " " + hook.path() + " failed: " + cause.getMessage(),
                event,
                hook.path(),
                cause);
    }

    /// Per-call parameters shared by the hook loop and the deferred cleanups.
    private record Context(
            Releaser release,
            String releaseNamespace,
            String event,
            WaitStrategy waitStrategy,
            Duration timeout) {}
}
