package io.tiller.core.storage;

import io.tiller.core.release.ReleaseAccessor;
import io.tiller.core.release.ReleaseAccessors;
import io.tiller.core.release.Releaser;
import io.tiller.core.release.UnsupportedSchemaException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/// In-memory release store (default implementation).
///
/// Thread-safe, no external dependencies.
///
/// ### Storage Structure
/// Nested maps: `namespace/name` -> revision -> snapshot, revisions sorted ascending.
///
/// @see ReleaseStore for contract
public final class InMemoryReleaseStore implements ReleaseStore {

    private final Map<String, NavigableMap<Integer, Releaser>> storage = new ConcurrentHashMap<>();

    @Override
    public void create(Releaser release) throws StorageException {
        ReleaseAccessor accessor = access(release);
        NavigableMap<Integer, Releaser> revisions =
                storage.computeIfAbsent(
                        key(accessor.namespace(), accessor.name()),
                        k -> new ConcurrentSkipListMap<>());
        if (revisions.putIfAbsent(accessor.version(), release) != null) {
            throw new StorageException(
                    "release "
                            + accessor.name()
                            + " revision "
                            + accessor.version()
                            + " already exists");
        }
    }

    @Override
    public void update(Releaser release) throws StorageException {
        ReleaseAccessor accessor = access(release);
        NavigableMap<Integer, Releaser> revisions =
                storage.get(key(accessor.namespace(), accessor.name()));
        if (revisions == null || revisions.replace(accessor.version(), release) == null) {
            throw new StorageException(
                    "release " + accessor.name() + " revision " + accessor.version() + " not found");
        }
    }

    @Override
    public Optional<Releaser> get(String namespace, String name, int version) {
        NavigableMap<Integer, Releaser> revisions = storage.get(key(namespace, name));
        return revisions == null ? Optional.empty() : Optional.ofNullable(revisions.get(version));
    }

    @Override
    public List<Releaser> history(String namespace, String name) {
        NavigableMap<Integer, Releaser> revisions = storage.get(key(namespace, name));
        return revisions == null ? List.of() : new ArrayList<>(revisions.values());
    }

    @Override
    public Optional<Releaser> last(String namespace, String name) {
        NavigableMap<Integer, Releaser> revisions = storage.get(key(namespace, name));
        if (revisions == null || revisions.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(revisions.lastEntry().getValue());
    }

    /// Clears all data (useful for testing).
    public void clear() {
        storage.clear();
    }

    private static ReleaseAccessor access(Releaser release) throws StorageException {
        Objects.requireNonNull(release, "release must not be null");
        try {
            return ReleaseAccessors.forRelease(release);
        } catch (UnsupportedSchemaException e) {
            throw new StorageException(e.getMessage(), e);
        }
    }

    private static String key(String namespace, String name) {
        Objects.requireNonNull(namespace, "namespace must not be null");
        Objects.requireNonNull(name, "name must not be null");
        return namespace + "/" + name;
    }
}
