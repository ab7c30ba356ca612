package io.tiller.core.kube;

import java.util.Objects;

/// Identity of one cluster object built from a manifest document.
///
/// @param apiVersion API group and version, may be empty
/// @param kind object kind, not null
/// @param name object name, not null
/// @param namespace namespace, empty for cluster-scoped objects
public record Resource(String apiVersion, String kind, String name, String namespace) {

    public Resource {
        apiVersion = apiVersion != null ? apiVersion : "";
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(name, "name must not be null");
        namespace = namespace != null ? namespace : "";
    }

    @Override
    public String toString() {
        return namespace.isEmpty() ? kind + "/" + name : kind + "/" + namespace + "/" + name;
    }
}
