package io.tiller.core.release;

import io.tiller.core.chart.Chart;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/// Schema-independent read view of a release snapshot.
///
/// Obtained through {@link ReleaseAccessors#forRelease(Object)}. The hook engine and
/// the deployer only ever see this contract, so a new schema version needs a new
/// accessor implementation and nothing else.
///
/// @see HookAccessor for the per-hook contract
public interface ReleaseAccessor {

    String name();

    String namespace();

    /// Returns the revision number of this snapshot.
    ///
    /// @return revision, starting at 1 and increasing by one per deployment
    int version();

    /// Returns accessors over the hooks bound to this release, in declaration order.
    ///
    /// Accessors are views: mutations made through them are applied to the
    /// underlying hook records of this release.
    ///
    /// @return hook accessors, never null, may be empty
    List<HookAccessor> hooks();

    /// @return concatenated resource documents in installation order, never null
    String manifest();

    String notes();

    Map<String, String> labels();

    /// @return the chart this release was installed from, may be null
    Chart chart();

    /// @return status wire value (e.g. `deployed`, `pending-install`), never null
    String status();

    /// @return `csa` for client-side apply, `ssa` for server-side apply, may be empty
    String applyMethod();

    /// @return time of the last deployment, may be null before the first deployment
    Instant deployedAt();
}
