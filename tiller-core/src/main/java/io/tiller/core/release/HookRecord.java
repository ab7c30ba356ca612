package io.tiller.core.release;

/// Marker for concrete hook schema types.
///
/// @see ReleaseAccessors#forHook(Object)
public interface HookRecord {}
