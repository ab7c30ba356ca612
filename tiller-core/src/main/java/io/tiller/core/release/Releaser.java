package io.tiller.core.release;

/// Marker for concrete release schema types.
///
/// Implemented by {@link io.tiller.core.release.v1.Release} and
/// {@link io.tiller.core.release.v2.Release}. Code above the accessor layer never
/// inspects the concrete type; it obtains a {@link ReleaseAccessor} through
/// {@link ReleaseAccessors#forRelease(Object)}.
public interface Releaser {}
