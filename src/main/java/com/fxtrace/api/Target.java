package com.fxtrace.api;

/**
 * A symbolic callable recorded as the target of a {@code call_function} node.
 *
 * Operators, builtins such as attribute lookup, and free functions routed
 * through generic dispatch all implement this. Method calls use a plain
 * {@code String} target instead.
 */
public interface Target {

    /**
     * Returns the name used when rendering the target and when seeding the
     * default name of a node that calls it.
     */
    String displayName();
}
