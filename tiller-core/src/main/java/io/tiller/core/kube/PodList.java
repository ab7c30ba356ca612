package io.tiller.core.kube;

import java.util.List;

/// Pods returned by {@link ResourceClient#getPodList}.
///
/// @param items pods, never null
public record PodList(List<Pod> items) {

    public PodList {
        items = items != null ? List.copyOf(items) : List.of();
    }

    /// @param name pod name, not null
    /// @param namespace pod namespace, not null
    /// @param containers container names in spec order, never null
    public record Pod(String name, String namespace, List<String> containers) {

        public Pod {
            containers = containers != null ? List.copyOf(containers) : List.of();
        }
    }
}
