package io.tiller.core.release;

/// Policy names shared by every release schema version.
///
/// Delete policies decide when the resource created by a hook is removed; output-log
/// policies decide when the container logs of that resource are copied to the caller.
public final class HookPolicy {

    private HookPolicy() {}

    /// Delete the previous instance of the hook resource before creating it again.
    public static final String DELETE_BEFORE_HOOK_CREATION = "before-hook-creation";

    /// Delete the hook resource once it has succeeded.
    public static final String DELETE_HOOK_SUCCEEDED = "hook-succeeded";

    /// Delete the hook resource once it has failed.
    public static final String DELETE_HOOK_FAILED = "hook-failed";

    /// Output logs when the hook has succeeded.
    public static final String OUTPUT_HOOK_SUCCEEDED = "hook-succeeded";

    /// Output logs when the hook has failed.
    public static final String OUTPUT_HOOK_FAILED = "hook-failed";
}
