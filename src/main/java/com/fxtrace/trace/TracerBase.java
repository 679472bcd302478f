package com.fxtrace.trace;

import com.fxtrace.api.NodeKind;
import com.fxtrace.api.Tuple;
import com.fxtrace.config.MethodCatalog;
import com.fxtrace.config.TracerConfig;
import com.fxtrace.graph.Graph;
import com.fxtrace.graph.Node;
import com.fxtrace.naming.NameScope;

import java.lang.reflect.Type;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

/**
 * Mediates node creation for a trace.
 *
 * Proxies never touch the graph directly. Every operation they observe comes
 * through {@link #createProxy}, which lowers the operands, asks
 * {@link #createNode} for the node and wraps it in a fresh proxy.
 *
 * Extension points:
 * <ul>
 * <li>{@link #createNode}: trace-time policy, e.g. rejecting in-place operations</li>
 * <li>{@link #createArg}: lowering of trace-specific argument types</li>
 * <li>{@link #toBool} and {@link #iter}: bounded control-flow support</li>
 * <li>{@link #keys}: keyword-argument unpacking of a proxy</li>
 * </ul>
 *
 * A tracer is single-threaded. It also owns the stack of {@link NameScope}s the
 * friendly-name resolver reads caller bindings from.
 */
public class TracerBase {
    private final Graph graph;
    private final TracerConfig config;
    private final MethodCatalog methodCatalog;
    private final Deque<NameScope> scopes = new ArrayDeque<>();

    public TracerBase(Graph graph) {
        this(graph, TracerConfig.defaults());
    }

    public TracerBase(Graph graph, TracerConfig config) {
        this(graph, config, MethodCatalog.fromResource(config.getMethodCatalog()));
    }

    public TracerBase(Graph graph, TracerConfig config, MethodCatalog methodCatalog) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.config = Objects.requireNonNull(config, "config");
        this.methodCatalog = Objects.requireNonNull(methodCatalog, "methodCatalog");
    }

    public Graph graph() {
        return graph;
    }

    public TracerConfig config() {
        return config;
    }

    /** Methods of the traced value type, used by {@link Proxy#dispatch}. */
    public MethodCatalog methodCatalog() {
        return methodCatalog;
    }

    /**
     * Inserts a graph node given target, args, kwargs and name.
     *
     * Override to check, validate or modify the values used in node creation.
     * The default performs no extra validation.
     */
    public Node createNode(NodeKind kind, Object target, Tuple args, Map<String, Object> kwargs,
            String name, Type typeHint) {
        return graph.createNode(kind, target, args, kwargs, name, typeHint);
    }

    public Proxy proxy(Node node) {
        return new Proxy(node, this);
    }

    public Proxy createProxy(NodeKind kind, Object target, Tuple args, Map<String, ?> kwargs) {
        return createProxy(kind, target, args, kwargs, null, null);
    }

    public Proxy createProxy(NodeKind kind, Object target, Tuple args, Map<String, ?> kwargs, String name) {
        return createProxy(kind, target, args, kwargs, name, null);
    }

    /**
     * Lowers {@code args} and {@code kwargs}, records one node and returns it
     * wrapped in a proxy.
     *
     * For {@code placeholder} nodes {@code args} is empty unless it encodes a
     * default parameter value.
     *
     * @throws UnsupportedArgumentException if an argument cannot be lowered.
     * @throws IllegalStateException        if an overridden {@link #createArg}
     *                                      changed the shape of args or kwargs.
     */
    public Proxy createProxy(NodeKind kind, Object target, Tuple args, Map<String, ?> kwargs,
            String name, Type typeHint) {
        Object loweredArgs = createArg(args);
        Object loweredKwargs = createArg(kwargs);
        if (!(loweredArgs instanceof Tuple tuple))
            throw new IllegalStateException("Lowered args must be a Tuple, got " + describe(loweredArgs));
        if (!(loweredKwargs instanceof Map<?, ?> map))
            throw new IllegalStateException("Lowered kwargs must be a Map, got " + describe(loweredKwargs));
        return proxy(createNode(kind, target, tuple, checkStringKeys(map), name, typeHint));
    }

    /**
     * Lowers a value seen as an argument during symbolic evaluation into an
     * Argument that can be stored in the IR.
     *
     * Override to support trace-specific types, delegating to
     * {@code super.createArg} for everything else.
     */
    public Object createArg(Object a) {
        return ArgumentLowering.lower(a, this::createArg);
    }

    /**
     * Called when a proxy is converted to a boolean, such as when used in
     * control flow. The value is unknown, so the default fails.
     */
    public boolean toBool(Proxy obj) {
        throw new TraceError("symbolically traced variables cannot be used as inputs to control flow");
    }

    /**
     * Called when a proxy is iterated without a known length. The default
     * fails; use {@link Proxy#unpack(int)} for a fixed number of elements.
     */
    public Iterator<Proxy> iter(Proxy obj) {
        throw new TraceError("Proxy object cannot be iterated. "
                + "This can be attempted when used in a for loop or as a *args or **kwargs function argument.");
    }

    /** Called when {@code keys()} is requested on a proxy, as keyword-argument unpacking does. */
    public Object keys(Proxy obj) {
        return new Attribute(obj, "keys").call();
    }

    /** Records an input parameter of the traced function. */
    public Proxy placeholder(String name) {
        return placeholder(name, null);
    }

    public Proxy placeholder(String name, Type typeHint) {
        return createProxy(NodeKind.PLACEHOLDER, name, Tuple.empty(), Map.of(), name, typeHint);
    }

    /** Records the value returned from the traced function. */
    public Node output(Object result) {
        return createProxy(NodeKind.OUTPUT, "output", Tuple.of(result), Map.of(), "output").node();
    }

    // ── Name scopes ──────────────────────────────────────────────

    /**
     * Opens a scope for the caller's named bindings. Close it (try-with-resources)
     * when the caller returns.
     */
    public NameScope enterScope() {
        return NameScope.open(scopes);
    }

    /** The innermost open scope, or null if the caller opened none. */
    public NameScope currentScope() {
        return scopes.peek();
    }

    private static Map<String, Object> checkStringKeys(Map<?, ?> map) {
        for (Object k : map.keySet())
            if (!(k instanceof String))
                throw new IllegalStateException("Lowered kwargs must have String keys, got " + describe(k));
        @SuppressWarnings("unchecked")
        var kwargs = (Map<String, Object>) map;
        return kwargs;
    }

    private static String describe(Object o) {
        return o == null ? "null" : o.getClass().getName();
    }
}
