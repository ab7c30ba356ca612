package io.tiller.core.release;

/// Entry point of the accessor layer: maps concrete schema values onto the
/// {@link ReleaseAccessor} and {@link HookAccessor} contracts.
///
/// Dispatch is explicit over the closed set of known schema types. Anything else is
/// rejected with {@link UnsupportedSchemaException} instead of failing later inside
/// business logic.
///
/// ### Usage
/// {@snippet :
/// ReleaseAccessor release = ReleaseAccessors.forRelease(snapshot);
/// for (HookAccessor hook : release.hooks()) {
///     hook.setDefaultDeletePolicy();
/// }
/// }
public final class ReleaseAccessors {

    private ReleaseAccessors() {}

    /// Wraps a release snapshot of any supported schema version.
    ///
    /// @param release v1 or v2 release, may be null
    /// @return accessor viewing (not copying) the release, never null
    /// @throws UnsupportedSchemaException if the value is null or of an unknown type
    public static ReleaseAccessor forRelease(Object release) throws UnsupportedSchemaException {
        if (release instanceof io.tiller.core.release.v1.Release v1) {
            return new V1ReleaseAccessor(v1);
        }
        if (release instanceof io.tiller.core.release.v2.Release v2) {
            return new V2ReleaseAccessor(v2);
        }
        throw new UnsupportedSchemaException("unsupported release type: " + typeName(release));
    }

    /// Wraps a hook of any supported schema version.
    ///
    /// @param hook v1 or v2 hook, may be null
    /// @return accessor viewing (not copying) the hook, never null
    /// @throws UnsupportedSchemaException if the value is null or of an unknown type
    public static HookAccessor forHook(Object hook) throws UnsupportedSchemaException {
        if (hook instanceof io.tiller.core.release.v1.Hook v1) {
            return new V1HookAccessor(v1);
        }
        if (hook instanceof io.tiller.core.release.v2.Hook v2) {
            return new V2HookAccessor(v2);
        }
        throw new UnsupportedSchemaException("unsupported release hook type: " + typeName(hook));
    }

    private static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getName();
    }
}
