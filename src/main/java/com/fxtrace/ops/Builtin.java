package com.fxtrace.ops;

import com.fxtrace.api.Target;

/** Generic protocol functions the tracer records on its own. */
public enum Builtin implements Target {
    /** {@code getattr(obj, name)}, recorded when a deferred attribute materializes. */
    GETATTR("getattr");

    private final String displayName;

    Builtin(String displayName) {
        this.displayName = displayName;
    }

    @Override
    public String displayName() {
        return displayName;
    }
}
