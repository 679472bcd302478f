package com.fxtrace.trace;

import com.fxtrace.api.NodeKind;
import com.fxtrace.api.Tuple;
import com.fxtrace.graph.Node;
import com.fxtrace.naming.FriendlyNames;
import com.fxtrace.ops.FunctionTarget;
import com.fxtrace.ops.Operator;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Stand-in for a real value during tracing.
 *
 * Instead of computing, every operation on a proxy is recorded into the graph
 * and answered with a new proxy for the recorded node. Each proxy wraps
 * exactly one node; several proxies may wrap the same node.
 *
 * Operators are methods ({@link #add}, {@link #lt}, {@link #neg}, ...) backed by
 * the {@link Operator} dispatch table. The {@code r}-prefixed variants
 * ({@link #radd}, ...) are used when the proxy is the right-hand operand; they
 * still record the operands left then right.
 *
 * Attribute access goes through {@link #field(String)} and records nothing
 * until the attribute is used.
 */
public class Proxy implements Iterable<Proxy> {
    /** Method target recorded when a proxy itself is called. */
    public static final String CALL_TARGET = "__call__";

    protected final TracerBase tracer;
    private final Node node;

    public Proxy(Node node, TracerBase tracer) {
        this.node = Objects.requireNonNull(node, "node");
        this.tracer = tracer != null ? tracer : new GraphAppendingTracer(node.graph());
    }

    /**
     * Wraps a raw node so that the overloaded operators append to its graph.
     */
    public Proxy(Node node) {
        this(node, null);
    }

    /** For variants that materialize their node lazily. */
    protected Proxy(TracerBase tracer) {
        this.node = null;
        this.tracer = Objects.requireNonNull(tracer, "tracer");
    }

    public Node node() {
        return node;
    }

    public TracerBase tracer() {
        return tracer;
    }

    /**
     * Deferred attribute access. Not added to the graph yet: if the attribute
     * is called, the call is recorded as a single method call.
     */
    public Attribute field(String name) {
        return new Attribute(this, name);
    }

    public Proxy call(Object... args) {
        return call(Tuple.of(args), Map.of());
    }

    /** Records a call of this value as {@code call_method __call__(self, *args, **kwargs)}. */
    public Proxy call(Tuple args, Map<String, ?> kwargs) {
        FriendlyNames.assignFromCaller(args, tracer);
        return tracer.createProxy(NodeKind.CALL_METHOD, CALL_TARGET, Tuple.prepend(this, args), kwargs);
    }

    /**
     * Fixed-arity structural unpack: returns {@code n} proxies for
     * {@code self[0]} .. {@code self[n-1]} without consulting the tracer.
     */
    public List<Proxy> unpack(int n) {
        if (n < 0)
            throw new IllegalArgumentException("Cannot unpack a negative number of values: " + n);
        List<Proxy> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++)
            out.add(getItem(i));
        return out;
    }

    /** Iteration of unknown length; delegates to {@link TracerBase#iter(Proxy)}. */
    @Override
    public Iterator<Proxy> iterator() {
        return tracer.iter(this);
    }

    /** Boolean coercion; delegates to {@link TracerBase#toBool(Proxy)}. */
    public boolean asBoolean() {
        return tracer.toBool(this);
    }

    public Object keys() {
        return tracer.keys(this);
    }

    /**
     * Records an operation routed through the value-level override protocol.
     *
     * Names found in the method catalog are recorded as {@code call_method}
     * with target {@code name}; anything else as {@code call_function} on a
     * {@link FunctionTarget}.
     *
     * @param name   Operation name, e.g. {@code "relu"}.
     * @param args   All operands, including this proxy where it takes part.
     * @param kwargs Keyword operands.
     */
    public Proxy dispatch(String name, Tuple args, Map<String, ?> kwargs) {
        FriendlyNames.assignFromCaller(args, tracer);
        FriendlyNames.assignFromCaller(kwargs, tracer);
        if (tracer.methodCatalog().isMethod(name))
            return tracer.createProxy(NodeKind.CALL_METHOD, name, args, kwargs);
        return tracer.createProxy(NodeKind.CALL_FUNCTION, new FunctionTarget(name), args, kwargs,
                tracer.graph().renderTarget(name));
    }

    /** Applies any operator from the dispatch table with this proxy as the leftmost operand. */
    public Proxy apply(Operator op, Object... rest) {
        Object[] operands = new Object[rest.length + 1];
        operands[0] = this;
        System.arraycopy(rest, 0, operands, 1, rest.length);
        return op.record(operands);
    }

    // ── Binary operators ─────────────────────────────────────────

    public Proxy add(Object rhs) {
        return Operator.ADD.record(this, rhs);
    }

    public Proxy sub(Object rhs) {
        return Operator.SUB.record(this, rhs);
    }

    public Proxy mul(Object rhs) {
        return Operator.MUL.record(this, rhs);
    }

    public Proxy floordiv(Object rhs) {
        return Operator.FLOORDIV.record(this, rhs);
    }

    public Proxy truediv(Object rhs) {
        return Operator.TRUEDIV.record(this, rhs);
    }

    public Proxy div(Object rhs) {
        return Operator.DIV.record(this, rhs);
    }

    public Proxy mod(Object rhs) {
        return Operator.MOD.record(this, rhs);
    }

    public Proxy pow(Object rhs) {
        return Operator.POW.record(this, rhs);
    }

    public Proxy lshift(Object rhs) {
        return Operator.LSHIFT.record(this, rhs);
    }

    public Proxy rshift(Object rhs) {
        return Operator.RSHIFT.record(this, rhs);
    }

    public Proxy and(Object rhs) {
        return Operator.AND.record(this, rhs);
    }

    public Proxy or(Object rhs) {
        return Operator.OR.record(this, rhs);
    }

    public Proxy xor(Object rhs) {
        return Operator.XOR.record(this, rhs);
    }

    public Proxy matmul(Object rhs) {
        return Operator.MATMUL.record(this, rhs);
    }

    public Proxy getItem(Object index) {
        return Operator.GETITEM.record(this, index);
    }

    // ── Comparisons ──────────────────────────────────────────────

    public Proxy eq(Object rhs) {
        return Operator.EQ.record(this, rhs);
    }

    public Proxy ne(Object rhs) {
        return Operator.NE.record(this, rhs);
    }

    public Proxy lt(Object rhs) {
        return Operator.LT.record(this, rhs);
    }

    public Proxy gt(Object rhs) {
        return Operator.GT.record(this, rhs);
    }

    public Proxy le(Object rhs) {
        return Operator.LE.record(this, rhs);
    }

    public Proxy ge(Object rhs) {
        return Operator.GE.record(this, rhs);
    }

    // ── Unary operators ──────────────────────────────────────────

    public Proxy neg() {
        return Operator.NEG.record(this);
    }

    public Proxy pos() {
        return Operator.POS.record(this);
    }

    public Proxy invert() {
        return Operator.INVERT.record(this);
    }

    // ── Reflected operators: this proxy is the right-hand operand ──

    public Proxy radd(Object lhs) {
        return Operator.ADD.recordReflected(this, lhs);
    }

    public Proxy rsub(Object lhs) {
        return Operator.SUB.recordReflected(this, lhs);
    }

    public Proxy rmul(Object lhs) {
        return Operator.MUL.recordReflected(this, lhs);
    }

    public Proxy rfloordiv(Object lhs) {
        return Operator.FLOORDIV.recordReflected(this, lhs);
    }

    public Proxy rtruediv(Object lhs) {
        return Operator.TRUEDIV.recordReflected(this, lhs);
    }

    public Proxy rdiv(Object lhs) {
        return Operator.DIV.recordReflected(this, lhs);
    }

    public Proxy rmod(Object lhs) {
        return Operator.MOD.recordReflected(this, lhs);
    }

    public Proxy rpow(Object lhs) {
        return Operator.POW.recordReflected(this, lhs);
    }

    public Proxy rlshift(Object lhs) {
        return Operator.LSHIFT.recordReflected(this, lhs);
    }

    public Proxy rrshift(Object lhs) {
        return Operator.RSHIFT.recordReflected(this, lhs);
    }

    public Proxy rand(Object lhs) {
        return Operator.AND.recordReflected(this, lhs);
    }

    public Proxy ror(Object lhs) {
        return Operator.OR.recordReflected(this, lhs);
    }

    public Proxy rxor(Object lhs) {
        return Operator.XOR.recordReflected(this, lhs);
    }

    public Proxy rmatmul(Object lhs) {
        return Operator.MATMUL.recordReflected(this, lhs);
    }

    @Override
    public String toString() {
        return "Proxy(" + node().name() + ")";
    }
}
