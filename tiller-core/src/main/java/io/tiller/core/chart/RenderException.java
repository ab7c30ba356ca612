package io.tiller.core.chart;

import java.io.Serial;

public class RenderException extends Exception {

    @Serial private static final long serialVersionUID = -2466185140771905318L;

    public RenderException(String message) {
        super(message);
    }

    public RenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
