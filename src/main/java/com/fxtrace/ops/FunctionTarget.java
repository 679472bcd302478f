package com.fxtrace.ops;

import com.fxtrace.api.Target;

import java.util.Objects;

/**
 * A free function known only by name, recorded by generic dispatch when the
 * operation is not a method of the traced value type.
 */
public record FunctionTarget(String name) implements Target {

    public FunctionTarget {
        Objects.requireNonNull(name, "name");
    }

    @Override
    public String displayName() {
        return name;
    }
}
