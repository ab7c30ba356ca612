package io.tiller.core.kube;

import java.util.List;

/// Cluster API client used by the hook engine and the deployer.
///
/// Implementations own authentication, REST mapping and object conversion; this
/// project only sequences their calls. Every method is a single attempt: callers do
/// not retry, and implementations should not retry behind their back either.
public interface ResourceClient {

    /// Converts manifest text into resources.
    ///
    /// @param manifest one or more YAML documents, not null
    /// @param validate validate documents against the server schema
    /// @return built resources in document order, never null
    /// @throws ResourceException if the manifest cannot be parsed or mapped
    ResourceList build(String manifest, boolean validate) throws ResourceException;

    /// Creates resources in the cluster.
    ///
    /// @throws ResourceException if the server rejects any resource
    ResourceResult create(ResourceList resources, CreateOptions options) throws ResourceException;

    /// Deletes resources, continuing past individual failures.
    ///
    /// @return one error per resource that could not be deleted, never null, empty on success
    List<ResourceException> delete(ResourceList resources, DeletionPropagation propagation);

    /// Returns the waiter implementing a wait strategy.
    ///
    /// @throws ResourceException if the strategy is not supported by this client
    Waiter getWaiter(WaitStrategy strategy) throws ResourceException;

    PodList getPodList(String namespace, PodSelector selector) throws ResourceException;

    /// Copies the logs of every container of the given pods into the sink.
    void outputContainerLogsForPodList(PodList pods, String namespace, LogSink sink)
            throws ResourceException;
}
