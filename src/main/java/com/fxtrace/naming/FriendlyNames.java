package com.fxtrace.naming;

import com.fxtrace.api.Slice;
import com.fxtrace.api.Tuple;
import com.fxtrace.graph.Node;
import com.fxtrace.trace.Attribute;
import com.fxtrace.trace.Proxy;
import com.fxtrace.trace.TracerBase;
import com.fxtrace.trace.UnsupportedArgumentException;

import java.util.List;
import java.util.Map;

import lombok.extern.log4j.Log4j2;

/**
 * Best-effort renaming of recorded nodes after the caller's local names.
 *
 * Given the operands of an operation about to be recorded, each proxy among
 * them is looked up in the caller's {@link NameScope}; if bound, its node is
 * renamed to a graph-unique form of that name. Only node names change: never
 * graph structure, ordering or argument values. In particular a deferred
 * {@link Attribute} that has no node yet is skipped rather than materialized.
 */
@Log4j2
public final class FriendlyNames {
    private FriendlyNames() {
        // Utility class
    }

    /**
     * Runs the resolver against the immediate caller's scope, i.e. the
     * tracer's innermost open scope. Does nothing if naming is disabled or no
     * scope is open.
     */
    public static void assignFromCaller(Object args, TracerBase tracer) {
        if (!tracer.config().isFriendlyNames())
            return;
        assign(args, tracer.currentScope());
    }

    /**
     * Renames the node of every proxy in {@code args} that is bound in
     * {@code scope}.
     *
     * @throws UnsupportedArgumentException if a map in {@code args} has a
     *                                      non-string key.
     */
    public static void assign(Object args, NameScope scope) {
        if (scope == null) {
            log.trace("No name scope open, skipping friendly names");
            return;
        }
        visit(args, scope);
    }

    private static void visit(Object a, NameScope scope) {
        if (a instanceof Tuple t) {
            for (Object e : t)
                visit(e, scope);
        } else if (a instanceof List<?> l) {
            for (Object e : l)
                visit(e, scope);
        } else if (a instanceof Map<?, ?> m) {
            for (var e : m.entrySet()) {
                if (!(e.getKey() instanceof String))
                    throw new UnsupportedArgumentException("dictionaries with non-string keys: " + m);
                visit(e.getValue(), scope);
            }
        } else if (a instanceof Slice s) {
            visit(s.start(), scope);
            visit(s.stop(), scope);
            visit(s.step(), scope);
        } else if (a instanceof Proxy p) {
            if (p instanceof Attribute attr && !attr.isMaterialized())
                return;
            String found = scope.nameOf(p);
            Node node = p.node();
            if (found != null && !found.equals(node.name()))
                node.graph().renameNode(node, found);
        }
    }
}
