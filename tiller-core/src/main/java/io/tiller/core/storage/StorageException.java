package io.tiller.core.storage;

import java.io.Serial;

public class StorageException extends Exception {

    @Serial private static final long serialVersionUID = -1740271508870384377L;

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
