package io.tiller.core.release;

import java.io.Serial;

/// Thrown when a release or hook value does not belong to a known schema version.
///
/// @see ReleaseAccessors
public class UnsupportedSchemaException extends Exception {

    @Serial private static final long serialVersionUID = 3187442296150720415L;

    public UnsupportedSchemaException(String message) {
        super(message);
    }
}
