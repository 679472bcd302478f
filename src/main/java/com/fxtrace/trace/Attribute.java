package com.fxtrace.trace;

import com.fxtrace.api.NodeKind;
import com.fxtrace.api.Tuple;
import com.fxtrace.graph.Node;
import com.fxtrace.naming.FriendlyNames;
import com.fxtrace.ops.Builtin;

import java.util.Map;
import java.util.Objects;

/**
 * Deferred attribute access on a proxy.
 *
 * The backing {@code getattr} node is only recorded when something needs it,
 * since most attributes are immediately called: {@code x.field("foo").call(y)}
 * records a single {@code call_method foo(x, y)} node.
 */
public class Attribute extends Proxy {
    private final Proxy root;
    private final String attr;
    private Node node;

    public Attribute(Proxy root, String attr) {
        super(root.tracer());
        this.root = root;
        this.attr = Objects.requireNonNull(attr, "attr");
    }

    public Proxy root() {
        return root;
    }

    public String attr() {
        return attr;
    }

    /** Records {@code getattr(root, attr)} on first access; later calls return the same node. */
    @Override
    public Node node() {
        if (node == null)
            node = tracer.createProxy(NodeKind.CALL_FUNCTION, Builtin.GETATTR, Tuple.of(root, attr), Map.of()).node();
        return node;
    }

    public boolean isMaterialized() {
        return node != null;
    }

    /** Records {@code call_method attr(root, *args, **kwargs)} without materializing this attribute. */
    @Override
    public Proxy call(Tuple args, Map<String, ?> kwargs) {
        FriendlyNames.assignFromCaller(args, tracer);
        return tracer.createProxy(NodeKind.CALL_METHOD, attr, Tuple.prepend(root, args), kwargs);
    }

    @Override
    public String toString() {
        return "Attribute(" + root + "." + attr + ")";
    }
}
