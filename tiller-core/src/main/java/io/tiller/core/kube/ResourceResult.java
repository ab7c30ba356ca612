package io.tiller.core.kube;

import java.util.List;

/// Outcome of a create or delete call.
///
/// @param created resources newly created, never null
/// @param updated resources that already existed and were updated, never null
/// @param deleted resources removed, never null
public record ResourceResult(
        List<Resource> created, List<Resource> updated, List<Resource> deleted) {

    public ResourceResult {
        created = created != null ? List.copyOf(created) : List.of();
        updated = updated != null ? List.copyOf(updated) : List.of();
        deleted = deleted != null ? List.copyOf(deleted) : List.of();
    }

    public static ResourceResult created(ResourceList resources) {
        return new ResourceResult(resources.asList(), List.of(), List.of());
    }
}
