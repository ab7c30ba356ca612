package io.tiller.core.hook;

import java.io.Serial;

public class ManifestParseException extends Exception {

    @Serial private static final long serialVersionUID = -3391406012551786170L;

    public ManifestParseException(String message) {
        super(message);
    }

    public ManifestParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
