package com.fxtrace.trace;

import com.fxtrace.api.BaseTypes;
import com.fxtrace.api.Slice;
import com.fxtrace.api.Tuple;
import com.fxtrace.graph.Node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Lowers trace-time values into Argument values that can be stored in a node.
 *
 * <ul>
 * <li>{@link Tuple} and {@link List}: element-wise, keeping the sequence kind</li>
 * <li>{@link Slice}: component-wise</li>
 * <li>{@link Map}: value-wise; every key must be a String</li>
 * <li>{@link Proxy}: replaced by its backing node</li>
 * <li>base types, {@code null} and nodes: unchanged</li>
 * </ul>
 *
 * The only side effect is materializing the node of an {@link Attribute}.
 */
public final class ArgumentLowering {
    private ArgumentLowering() {
        // Utility class
    }

    /** Lowers {@code a}, recursing through this class only. */
    public static Object lower(Object a) {
        return lower(a, ArgumentLowering::lower);
    }

    /**
     * Lowers {@code a}, using {@code recurse} for nested elements so that a
     * tracer's own {@code createArg} override sees every level.
     *
     * @throws UnsupportedArgumentException for non-string map keys and
     *                                      unsupported leaf types.
     */
    public static Object lower(Object a, UnaryOperator<Object> recurse) {
        if (a instanceof Tuple t) {
            Object[] out = new Object[t.size()];
            for (int i = 0; i < out.length; i++)
                out[i] = recurse.apply(t.get(i));
            return Tuple.of(out);
        }
        if (a instanceof List<?> l) {
            List<Object> out = new ArrayList<>(l.size());
            for (Object e : l)
                out.add(recurse.apply(e));
            return Collections.unmodifiableList(out);
        }
        if (a instanceof Map<?, ?> m) {
            Map<String, Object> out = new LinkedHashMap<>();
            for (var e : m.entrySet()) {
                if (!(e.getKey() instanceof String key))
                    throw new UnsupportedArgumentException("dictionaries with non-string keys: " + m);
                out.put(key, recurse.apply(e.getValue()));
            }
            return Collections.unmodifiableMap(out);
        }
        if (a instanceof Slice s)
            return new Slice(recurse.apply(s.start()), recurse.apply(s.stop()), recurse.apply(s.step()));

        // base case: unwrap the proxy
        if (a instanceof Proxy p)
            return p.node();
        if (a == null || a instanceof Node || BaseTypes.isBaseType(a))
            return a;

        throw new UnsupportedArgumentException("argument of type: " + a.getClass().getName());
    }
}
