package io.tiller.core.hook;

import java.io.Serial;

/// Failure of a hook execution pass.
///
/// Carries the event being executed and, when the failure belongs to one hook, the
/// path of that hook's template.
public class HookExecutionException extends Exception {

    @Serial private static final long serialVersionUID = 6028177160215391875L;

    private final String event;
    private final String hookPath;

    public HookExecutionException(String message, String event, String hookPath) {
        super(message);
        this.event = event;
        this.hookPath = hookPath;
    }

    public HookExecutionException(String message, String event, String hookPath, Throwable cause) {
        super(message, cause);
        this.event = event;
        this.hookPath = hookPath;
    }

    /// @return event whose hooks were executing, may be null for cleanup-only failures
    public String getEvent() {
        return event;
    }

    /// @return template path of the failing hook, may be null
    public String getHookPath() {
        return hookPath;
    }
}
