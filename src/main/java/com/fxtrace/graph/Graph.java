package com.fxtrace.graph;

import com.fxtrace.api.BaseTypes;
import com.fxtrace.api.NodeKind;
import com.fxtrace.api.Slice;
import com.fxtrace.api.Target;
import com.fxtrace.api.Tuple;

import java.lang.reflect.Type;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import lombok.extern.log4j.Log4j2;

/**
 * Graph store -- append-only ordered collection of recorded nodes.
 *
 * The graph owns its nodes and allocates a name for each that is unique
 * within it. Names are unique at all times: creation and renaming both go
 * through {@link #uniqueName(String)}, which reserves the returned name. Names
 * released by a rename stay reserved.
 *
 * Thread Safety:
 * Not thread-safe. Node append and rename are plain field updates; a graph
 * must only be recorded into by one tracer at a time. Distinct graphs share no
 * state.
 */
@Log4j2
public final class Graph {
    private static final Pattern ILLEGAL_CHARS = Pattern.compile("[^0-9a-zA-Z_]+");
    private static final Pattern NUMBERED = Pattern.compile("(.*)_(\\d+)$");
    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("([a-z0-9])([A-Z])");

    private final String graphName;
    private final List<Node> nodes = new ArrayList<>();
    private final Set<String> usedNames = new HashSet<>();

    public Graph() {
        this("graph");
    }

    public Graph(String graphName) {
        this.graphName = Objects.requireNonNull(graphName, "graphName");
    }

    public String name() {
        return graphName;
    }

    /**
     * Appends a new node.
     *
     * @param kind     The node kind.
     * @param target   The call target (see {@link Node#target()}).
     * @param args     Lowered positional arguments.
     * @param kwargs   Lowered keyword arguments.
     * @param name     Requested name, or null to derive one from the target.
     * @param typeHint Optional type annotation, may be null.
     * @return The created node, carrying a graph-unique name.
     * @throws IllegalArgumentException if an argument is not a lowered Argument
     *                                  value or references a node of another graph.
     */
    public Node createNode(NodeKind kind, Object target, Tuple args, Map<String, Object> kwargs,
            String name, Type typeHint) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(args, "args");
        Objects.requireNonNull(kwargs, "kwargs");
        Consumer<Node> sameGraph = n -> {
            if (n.graph() != this)
                throw new IllegalArgumentException("Argument node '" + n.name() + "' belongs to another graph");
        };
        forEachNode(args, sameGraph);
        forEachNode(kwargs, sameGraph);

        String candidate = name != null ? name : renderTarget(target);
        var node = new Node(this, uniqueName(candidate), kind, target, args,
                Collections.unmodifiableMap(new LinkedHashMap<>(kwargs)), typeHint);
        nodes.add(node);
        for (Node input : node.allInputNodes())
            input.addUser(node);
        log.debug("Recorded {} {} -> {}", kind.opName(), renderTarget(target), node.name());
        return node;
    }

    /** Records an input parameter. */
    public Node placeholder(String name, Type typeHint) {
        return createNode(NodeKind.PLACEHOLDER, name, Tuple.empty(), Map.of(), name, typeHint);
    }

    /** Records the value returned from the traced function. {@code result} must already be lowered. */
    public Node output(Object result) {
        return createNode(NodeKind.OUTPUT, "output", Tuple.of(result), Map.of(), "output", null);
    }

    /**
     * Returns a graph-unique identifier derived from {@code candidate} and
     * reserves it.
     *
     * Characters outside {@code [0-9a-zA-Z_]} collapse to {@code _}, a leading
     * digit gets a {@code _} prefix, and collisions are resolved by a numeric
     * suffix ({@code x}, {@code x_1}, {@code x_2}, ...).
     */
    public String uniqueName(String candidate) {
        String name = ILLEGAL_CHARS.matcher(candidate == null ? "" : candidate).replaceAll("_");
        if (name.isEmpty())
            name = "_";
        if (Character.isDigit(name.charAt(0)))
            name = "_" + name;
        while (usedNames.contains(name)) {
            Matcher m = NUMBERED.matcher(name);
            if (m.matches())
                name = m.group(1) + "_" + new BigInteger(m.group(2)).add(BigInteger.ONE);
            else
                name = name + "_1";
        }
        usedNames.add(name);
        return name;
    }

    /** Renames {@code node} to a uniquified form of {@code candidate}. */
    public void renameNode(Node node, String candidate) {
        if (node.graph() != this)
            throw new IllegalArgumentException("Node '" + node.name() + "' belongs to another graph");
        String old = node.name();
        node.rename(uniqueName(candidate));
        log.debug("Renamed node {} -> {}", old, node.name());
    }

    /**
     * Produces a display string for a call target, used to seed default names.
     *
     * {@link Target}s render as their display name. Strings have surrounding
     * double underscores stripped ({@code __call__} becomes {@code call}) and
     * CamelCase converted to snake_case.
     */
    public String renderTarget(Object target) {
        String op;
        if (target instanceof Target t)
            op = t.displayName();
        else
            op = String.valueOf(target);
        if (op.length() > 4 && op.startsWith("__") && op.endsWith("__"))
            op = op.substring(2, op.length() - 2);
        return CAMEL_BOUNDARY.matcher(op).replaceAll("$1_$2").toLowerCase(Locale.ROOT);
    }

    /** All nodes in recording order. */
    public List<Node> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Looks up a node by its current name.
     *
     * @return The node, or null if not found.
     */
    public Node node(String name) {
        for (Node n : nodes)
            if (n.name().equals(name))
                return n;
        return null;
    }

    /**
     * Visits every node referenced by a lowered argument structure.
     *
     * @throws IllegalArgumentException if a leaf is not an Argument value.
     */
    static void forEachNode(Object arg, Consumer<Node> visitor) {
        if (arg instanceof Node n) {
            visitor.accept(n);
        } else if (arg instanceof Tuple t) {
            for (Object e : t)
                forEachNode(e, visitor);
        } else if (arg instanceof List<?> l) {
            for (Object e : l)
                forEachNode(e, visitor);
        } else if (arg instanceof Map<?, ?> m) {
            for (Object v : m.values())
                forEachNode(v, visitor);
        } else if (arg instanceof Slice s) {
            forEachNode(s.start(), visitor);
            forEachNode(s.stop(), visitor);
            forEachNode(s.step(), visitor);
        } else if (arg != null && !BaseTypes.isBaseType(arg)) {
            throw new IllegalArgumentException("Not a lowered argument: " + arg.getClass().getName());
        }
    }

    @Override
    public String toString() {
        return "Graph(" + graphName + ", " + nodes.size() + " nodes)";
    }
}
