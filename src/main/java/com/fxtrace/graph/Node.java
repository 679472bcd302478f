package com.fxtrace.graph;

import com.fxtrace.api.NodeKind;
import com.fxtrace.api.Tuple;

import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One recorded IR instruction.
 *
 * A node is created once by its {@link Graph} and never mutated afterwards,
 * with two exceptions owned by the graph: its {@link #name()} may be rewritten
 * through {@link Graph#renameNode(Node, String)}, and its user set grows as
 * later nodes reference it.
 *
 * Arguments are immutable and only ever hold Argument values: base-type
 * literals, {@code null}, other nodes, {@link Tuple}s, lists, string-keyed maps
 * and slices.
 *
 * Nodes compare by identity.
 */
public final class Node {
    private final Graph graph;
    private final NodeKind kind;
    private final Object target;
    private final Tuple args;
    private final Map<String, Object> kwargs;
    private final Type typeHint;
    private final Set<Node> users = new LinkedHashSet<>();
    private String name;

    Node(Graph graph, String name, NodeKind kind, Object target, Tuple args,
            Map<String, Object> kwargs, Type typeHint) {
        this.graph = graph;
        this.name = name;
        this.kind = kind;
        this.target = target;
        this.args = args;
        this.kwargs = kwargs;
        this.typeHint = typeHint;
    }

    /** The owning graph. Non-owning back reference. */
    public Graph graph() {
        return graph;
    }

    public String name() {
        return name;
    }

    void rename(String uniqueName) {
        this.name = uniqueName;
    }

    public NodeKind kind() {
        return kind;
    }

    /**
     * A {@link com.fxtrace.api.Target} for {@code call_function}, otherwise a
     * {@code String} (method name, attribute path or parameter name).
     */
    public Object target() {
        return target;
    }

    public Tuple args() {
        return args;
    }

    public Map<String, Object> kwargs() {
        return kwargs;
    }

    /** May be null. */
    public Type typeHint() {
        return typeHint;
    }

    /** Nodes whose arguments reference this node, in recording order. */
    public Set<Node> users() {
        return Collections.unmodifiableSet(users);
    }

    void addUser(Node user) {
        users.add(user);
    }

    /** Every node referenced by args then kwargs, in order, without duplicates. */
    public List<Node> allInputNodes() {
        Set<Node> seen = new LinkedHashSet<>();
        Graph.forEachNode(args, seen::add);
        Graph.forEachNode(kwargs, seen::add);
        return new ArrayList<>(seen);
    }

    @Override
    public String toString() {
        return name;
    }
}
