package io.tiller.core.kube;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/// Ordered, immutable set of resources produced by {@link ResourceClient#build}.
public final class ResourceList implements Iterable<Resource> {

    private static final ResourceList EMPTY = new ResourceList(List.of());

    private final List<Resource> resources;

    private ResourceList(List<Resource> resources) {
        this.resources = resources;
    }

    public static ResourceList of(List<Resource> resources) {
        return resources.isEmpty() ? EMPTY : new ResourceList(List.copyOf(resources));
    }

    public static ResourceList of(Resource... resources) {
        return of(List.of(resources));
    }

    public static ResourceList empty() {
        return EMPTY;
    }

    /// Returns a list holding this list's resources followed by the other's.
    public ResourceList append(ResourceList other) {
        if (other.isEmpty()) {
            return this;
        }
        List<Resource> combined = new ArrayList<>(resources);
        combined.addAll(other.resources);
        return new ResourceList(Collections.unmodifiableList(combined));
    }

    public List<Resource> asList() {
        return resources;
    }

    public int size() {
        return resources.size();
    }

    public boolean isEmpty() {
        return resources.isEmpty();
    }

    @Override
    public Iterator<Resource> iterator() {
        return resources.iterator();
    }

    @Override
    public String toString() {
        return resources.toString();
    }
}
