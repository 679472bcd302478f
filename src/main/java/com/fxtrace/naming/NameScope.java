package com.fxtrace.naming;

import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The named local bindings of one caller, as seen by the friendly-name
 * resolver.
 *
 * Traced code opens a scope on its tracer and binds the locals it wants nodes
 * named after:
 *
 * <pre>
 * try (NameScope scope = tracer.enterScope()) {
 *     Proxy hidden = x.field("linear").call(x);
 *     scope.bind("hidden", hidden);
 *     Proxy out = hidden.add(1);
 * }
 * </pre>
 *
 * Rebinding a name replaces its value. Scopes nest; only the innermost open
 * scope is consulted.
 */
public final class NameScope implements AutoCloseable {
    private final Deque<NameScope> stack;
    private final Map<String, Object> bindings = new LinkedHashMap<>();
    private boolean closed;

    private NameScope(Deque<NameScope> stack) {
        this.stack = stack;
    }

    /** Pushes a new scope onto {@code stack}; closing it pops it again. */
    public static NameScope open(Deque<NameScope> stack) {
        var scope = new NameScope(Objects.requireNonNull(stack, "stack"));
        stack.push(scope);
        return scope;
    }

    public NameScope bind(String name, Object value) {
        Objects.requireNonNull(name, "name");
        if (closed)
            throw new IllegalStateException("Scope is closed");
        bindings.put(name, value);
        return this;
    }

    public NameScope unbind(String name) {
        bindings.remove(name);
        return this;
    }

    public Map<String, Object> bindings() {
        return Collections.unmodifiableMap(bindings);
    }

    /**
     * Finds the name bound to exactly {@code value} (identity, not equality).
     * The shortest name wins; among equally short names the earliest binding.
     *
     * @return The name, or null if {@code value} is not bound.
     */
    public String nameOf(Object value) {
        String found = null;
        for (var e : bindings.entrySet()) {
            if (e.getValue() == value && (found == null || e.getKey().length() < found.length()))
                found = e.getKey();
        }
        return found;
    }

    /**
     * @throws IllegalStateException if a scope opened later is still open.
     */
    @Override
    public void close() {
        if (closed)
            return;
        if (stack.peek() != this)
            throw new IllegalStateException("Name scopes must be closed in reverse order of opening");
        stack.pop();
        closed = true;
    }
}
