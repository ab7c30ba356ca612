package io.tiller.core.kube;

import java.io.Writer;

/// Destination for container logs copied from hook pods.
@FunctionalInterface
public interface LogSink {

    /// Returns the writer receiving the logs of one container.
    ///
    /// @param namespace pod namespace, not null
    /// @param pod pod name, not null
    /// @param container container name, not null
    /// @return writer for the container's log stream, never null
    Writer writerFor(String namespace, String pod, String container);
}
