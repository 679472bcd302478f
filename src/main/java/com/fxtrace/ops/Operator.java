package com.fxtrace.ops;

import com.fxtrace.api.NodeKind;
import com.fxtrace.api.Target;
import com.fxtrace.api.Tuple;
import com.fxtrace.naming.FriendlyNames;
import com.fxtrace.trace.Proxy;
import com.fxtrace.trace.TracerBase;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Operator dispatch table.
 *
 * Each constant is an operator a proxy intercepts. Recording one runs the
 * friendly-name resolver over the operands, then records a
 * {@code call_function} node whose target is the operator and whose args are
 * the operands in surface order.
 *
 * Reflectable operators also have a right-hand form ({@link #recordReflected})
 * for when the proxy is the right operand, e.g. {@code 2 - x}.
 */
public enum Operator implements Target {
    // --- Binary arithmetic / bitwise ---
    ADD("add", "+", 2, true),
    SUB("sub", "-", 2, true),
    MUL("mul", "*", 2, true),
    FLOORDIV("floordiv", "//", 2, true),
    TRUEDIV("truediv", "/", 2, true),
    DIV("div", "/", 2, true),
    MOD("mod", "%", 2, true),
    POW("pow", "**", 2, true),
    LSHIFT("lshift", "<<", 2, true),
    RSHIFT("rshift", ">>", 2, true),
    AND("and_", "&", 2, true),
    OR("or_", "|", 2, true),
    XOR("xor", "^", 2, true),
    MATMUL("matmul", "@", 2, true),
    GETITEM("getitem", "[]", 2, false),

    // --- Comparison ---
    EQ("eq", "==", 2, false),
    NE("ne", "!=", 2, false),
    LT("lt", "<", 2, false),
    GT("gt", ">", 2, false),
    LE("le", "<=", 2, false),
    GE("ge", ">=", 2, false),

    // --- Unary ---
    POS("pos", "+", 1, false),
    NEG("neg", "-", 1, false),
    INVERT("invert", "~", 1, false);

    private static final Set<Operator> REFLECTABLE;

    static {
        var set = EnumSet.noneOf(Operator.class);
        for (Operator op : values())
            if (op.reflectable)
                set.add(op);
        REFLECTABLE = Collections.unmodifiableSet(set);
    }

    private final String displayName;
    private final String symbol;
    private final int arity;
    private final boolean reflectable;

    Operator(String displayName, String symbol, int arity, boolean reflectable) {
        this.displayName = displayName;
        this.symbol = symbol;
        this.arity = arity;
        this.reflectable = reflectable;
    }

    @Override
    public String displayName() {
        return displayName;
    }

    /** Surface syntax, e.g. {@code "+"}. */
    public String symbol() {
        return symbol;
    }

    public int arity() {
        return arity;
    }

    public boolean isReflectable() {
        return reflectable;
    }

    /** Operators that have a right-hand counterpart. */
    public static Set<Operator> reflectable() {
        return REFLECTABLE;
    }

    /**
     * Records this operator applied to {@code operands}, left to right.
     *
     * @throws IllegalArgumentException if the operand count does not match the
     *                                  arity or no operand is a proxy.
     */
    public Proxy record(Object... operands) {
        return recordWith(ownerOf(operands), operands);
    }

    private Proxy recordWith(TracerBase tracer, Object... operands) {
        if (operands.length != arity)
            throw new IllegalArgumentException(
                    displayName + " takes " + arity + " operand(s), got " + operands.length);
        Tuple args = Tuple.of(operands);
        FriendlyNames.assignFromCaller(args, tracer);
        return tracer.createProxy(NodeKind.CALL_FUNCTION, this, args, Map.of());
    }

    /**
     * Records the right-hand form: {@code self} is the right operand, so the
     * node's args are {@code (lhs, self)}. Always records through
     * {@code self}'s tracer, even when {@code lhs} is a proxy of another one.
     *
     * @throws UnsupportedOperationException if this operator is not reflectable.
     */
    public Proxy recordReflected(Proxy self, Object lhs) {
        if (!reflectable)
            throw new UnsupportedOperationException(displayName + " has no reflected form");
        return recordWith(self.tracer(), lhs, self);
    }

    private TracerBase ownerOf(Object[] operands) {
        for (Object o : operands)
            if (o instanceof Proxy p)
                return p.tracer();
        throw new IllegalArgumentException(displayName + " needs at least one Proxy operand");
    }

    public static Operator fromString(String text) {
        for (Operator op : values()) {
            if (op.displayName.equalsIgnoreCase(text) || op.name().equalsIgnoreCase(text)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown Operator: " + text);
    }
}
