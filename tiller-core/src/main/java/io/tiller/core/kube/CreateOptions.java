package io.tiller.core.kube;

/// Options of {@link ResourceClient#create}.
///
/// @param serverSideApply apply through the server-side apply API instead of a client-side create
/// @param forceConflicts take ownership of fields managed by other appliers (server-side apply only)
public record CreateOptions(boolean serverSideApply, boolean forceConflicts) {

    public static CreateOptions serverSideApply(boolean serverSideApply) {
        return new CreateOptions(serverSideApply, false);
    }
}
