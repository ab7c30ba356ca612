package io.tiller.core.storage;

import io.tiller.core.release.Releaser;
import java.util.List;
import java.util.Optional;

/// Persistence of release snapshots.
///
/// Snapshots are keyed by namespace, release name and revision. The store accepts
/// any supported schema version and never interprets hooks or manifests.
///
/// ### Ownership
/// Actions hand a snapshot to {@link #update} whenever its state must become visible
/// to other observers, for instance when a hook starts running. The store keeps the
/// reference it was given; it does not copy.
///
/// @see InMemoryReleaseStore for the default implementation
public interface ReleaseStore {

    /// Stores a new revision.
    ///
    /// @param release snapshot to store, not null
    /// @throws StorageException if the revision already exists or the schema is unsupported
    void create(Releaser release) throws StorageException;

    /// Replaces an existing revision.
    ///
    /// @param release snapshot to store, not null
    /// @throws StorageException if the revision does not exist or the schema is unsupported
    void update(Releaser release) throws StorageException;

    /// @return the revision, or empty if not stored
    Optional<Releaser> get(String namespace, String name, int version);

    /// @return every stored revision of a release, oldest first, never null
    List<Releaser> history(String namespace, String name);

    /// @return the highest stored revision of a release, or empty if none
    Optional<Releaser> last(String namespace, String name);
}
