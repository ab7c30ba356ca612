package io.tiller.core.kube;

import java.io.Serial;

/// Failure reported by the cluster client: a manifest that cannot be built, a rejected
/// create or delete, or a wait that timed out or observed a failed resource.
public class ResourceException extends Exception {

    @Serial private static final long serialVersionUID = 8817250937161270012L;

    public ResourceException(String message) {
        super(message);
    }

    public ResourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
