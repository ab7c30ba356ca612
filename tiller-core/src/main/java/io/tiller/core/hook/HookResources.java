package io.tiller.core.hook;

import io.tiller.core.kube.DeletionPropagation;
import io.tiller.core.kube.LogSink;
import io.tiller.core.kube.PodList;
import io.tiller.core.kube.PodSelector;
import io.tiller.core.kube.ResourceClient;
import io.tiller.core.kube.ResourceException;
import io.tiller.core.kube.ResourceList;
import io.tiller.core.kube.WaitStrategy;
import io.tiller.core.release.HookAccessor;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/// Policy-driven side operations on the resources of a single hook: deletion and
/// container log output.
///
/// Stateless apart from its collaborators; {@link HookExecutor} owns the ordering.
final class HookResources {

    private static final Logger logger = Logger.getLogger(HookResources.class.getName());

    static final String CUSTOM_RESOURCE_DEFINITION = "CustomResourceDefinition";

    private final ResourceClient client;
    private final ManifestMetadataReader metadataReader;
    private final LogSink logSink;

    HookResources(ResourceClient client, ManifestMetadataReader metadataReader, LogSink logSink) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.metadataReader = Objects.requireNonNull(metadataReader, "metadataReader must not be null");
        this.logSink = Objects.requireNonNull(logSink, "logSink must not be null");
    }

    /// Deletes the hook's resources if the hook carries the given delete policy, then
    /// waits until they are gone.
    ///
    /// Resources of kind `CustomResourceDefinition` are never deleted: removing one
    /// garbage-collects every custom object of that type.
    ///
    /// @throws HookExecutionException if building, deleting or waiting fails
    void deleteByPolicy(HookAccessor hook, String policy, WaitStrategy waitStrategy, Duration timeout)
            throws HookExecutionException {
        if (CUSTOM_RESOURCE_DEFINITION.equals(hook.kind()) || !hook.hasDeletePolicy(policy)) {
            return;
        }

        ResourceList resources;
        try {
            resources = client.build(hook.manifest(), false);
        } catch (ResourceException e) {
            throw new HookExecutionException(
                    "unable to build kubernetes object for deleting hook " + hook.path(),
                    null,
                    hook.path(),
                    e);
        }

        List<ResourceException> errors = client.delete(resources, DeletionPropagation.BACKGROUND);
        if (!errors.isEmpty()) {
            HookExecutionException joined =
                    new HookExecutionException(
                            errors.stream()
                                    .map(Throwable::getMessage)
                                    .collect(Collectors.joining("; ")),
                            null,
                            hook.path());
            errors.forEach(joined::addSuppressed);
            throw joined;
        }

        try {
            client.getWaiter(waitStrategy).waitForDelete(resources, timeout);
        } catch (ResourceException e) {
            throw new HookExecutionException(e.getMessage(), null, hook.path(), e);
        }
        logger.fine("Deleted hook " + hook.name() + " by policy " + policy);
    }

    /// Copies the container logs of the hook's pods into the log sink if the hook
    /// carries the given output policy.
    ///
    /// Only `Job` and `Pod` hooks have pods to read; other kinds are skipped.
    ///
    /// @throws HookExecutionException if the namespace cannot be derived or the pods
    ///     or their logs cannot be read
    void outputLogsByPolicy(HookAccessor hook, String releaseNamespace, String policy)
            throws HookExecutionException {
        if (!hook.hasOutputLogPolicy(policy)) {
            return;
        }
        String namespace = deriveNamespace(hook, releaseNamespace);

        PodSelector selector;
        if ("Job".equals(hook.kind())) {
            selector = PodSelector.byLabel("job-name=" + hook.name());
        } else if ("Pod".equals(hook.kind())) {
            selector = PodSelector.byField("metadata.name=" + hook.name());
        } else {
            return;
        }

        try {
            PodList pods = client.getPodList(namespace, selector);
            client.outputContainerLogsForPodList(pods, namespace, logSink);
        } catch (ResourceException e) {
            throw new HookExecutionException(e.getMessage(), null, hook.path(), e);
        }
    }

    /// Resolves the namespace of the hook's resources.
    ///
    /// @return `metadata.namespace` of the hook manifest, else the release namespace
    /// @throws HookExecutionException if the hook manifest cannot be parsed
    String deriveNamespace(HookAccessor hook, String releaseNamespace)
            throws HookExecutionException {
        try {
            return metadataReader.readNamespace(hook.manifest()).orElse(releaseNamespace);
        } catch (ManifestParseException e) {
            throw new HookExecutionException(
                    "unable to parse metadata.namespace from kubernetes manifest for output logs hook "
                            + hook.path(),
                    null,
                    hook.path(),
                    e);
        }
    }
}
