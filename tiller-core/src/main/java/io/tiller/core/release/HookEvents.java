package io.tiller.core.release;

/// Lifecycle event names hooks can bind to.
///
/// The hook engine matches events by these string values so that one engine serves
/// every schema version.
public final class HookEvents {

    private HookEvents() {}

    public static final String PRE_INSTALL = "pre-install";
    public static final String POST_INSTALL = "post-install";
    public static final String PRE_DELETE = "pre-delete";
    public static final String POST_DELETE = "post-delete";
    public static final String PRE_UPGRADE = "pre-upgrade";
    public static final String POST_UPGRADE = "post-upgrade";
    public static final String PRE_ROLLBACK = "pre-rollback";
    public static final String POST_ROLLBACK = "post-rollback";
    public static final String TEST = "test";
}
