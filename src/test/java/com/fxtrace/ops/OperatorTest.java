package com.fxtrace.ops;

import com.fxtrace.api.NodeKind;
import com.fxtrace.api.Slice;
import com.fxtrace.api.Tuple;
import com.fxtrace.graph.Graph;
import com.fxtrace.graph.Node;
import com.fxtrace.trace.Proxy;
import com.fxtrace.trace.TracerBase;
import org.junit.Before;
import org.junit.Test;

import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class OperatorTest {

    private Graph graph;
    private Proxy x;
    private Proxy y;

    @Before
    public void setUp() {
        graph = new Graph();
        TracerBase tracer = new TracerBase(graph);
        x = tracer.placeholder("x");
        y = tracer.placeholder("y");
    }

    @Test
    public void testBinaryOperatorRecordsSurfaceOrder() {
        Node n = x.sub(y).node();

        assertEquals(NodeKind.CALL_FUNCTION, n.kind());
        assertEquals(Operator.SUB, n.target());
        assertEquals(Tuple.of(x.node(), y.node()), n.args());
        assertTrue(n.kwargs().isEmpty());
        assertEquals("sub", n.name());
    }

    @Test
    public void testReflectedOperatorSwapsOperands() {
        // 10 - x
        Node n = x.rsub(10).node();

        assertEquals(Operator.SUB, n.target());
        assertEquals(Tuple.of(10, x.node()), n.args());
    }

    @Test
    public void testReflectedMatchesForwardForm() {
        Node forward = x.truediv(y).node();
        Node reflected = y.rtruediv(x).node();

        assertEquals(forward.target(), reflected.target());
        assertEquals(forward.args(), reflected.args());
    }

    @Test
    public void testReflectedFormRecordsThroughRightOperandTracer() {
        List<Object> seen = new ArrayList<>();
        TracerBase audited = new TracerBase(graph) {
            @Override
            public Node createNode(NodeKind kind, Object target, Tuple args, Map<String, Object> kwargs,
                    String name, Type typeHint) {
                seen.add(target);
                return super.createNode(kind, target, args, kwargs, name, typeHint);
            }
        };
        Proxy z = audited.proxy(graph.placeholder("z", null));

        Node n = z.rsub(x).node();

        assertEquals(List.of(Operator.SUB), seen);
        assertEquals(Tuple.of(x.node(), z.node()), n.args());
    }

    @Test
    public void testUnaryOperators() {
        assertEquals(Tuple.of(x.node()), x.neg().node().args());
        assertEquals(Operator.INVERT, x.invert().node().target());
        assertEquals(Operator.POS, x.pos().node().target());
    }

    @Test
    public void testComparisonsRecordNodes() {
        Node n = x.le(y).node();
        assertEquals(Operator.LE, n.target());
        assertEquals(Tuple.of(x.node(), y.node()), n.args());
        assertEquals(Operator.EQ, x.eq(0).node().target());
    }

    @Test
    public void testGetItemWithSlice() {
        Node n = x.getItem(Slice.of(1, y)).node();

        assertEquals(Operator.GETITEM, n.target());
        assertEquals(Tuple.of(x.node(), new Slice(1, y.node(), null)), n.args());
    }

    @Test
    public void testChainedExpression() {
        // (x + y) * 2
        Proxy r = x.add(y).mul(2);

        Node mul = r.node();
        Node add = (Node) mul.args().get(0);
        assertEquals(Operator.ADD, add.target());
        assertEquals(4, graph.size());
    }

    @Test
    public void testRepeatedOperatorsGetUniqueNames() {
        Node a = x.add(1).node();
        Node b = x.add(2).node();

        assertEquals("add", a.name());
        assertEquals("add_1", b.name());
    }

    @Test
    public void testApplyWithAnyOperator() {
        Node n = x.apply(Operator.XOR, y).node();
        assertEquals(Operator.XOR, n.target());
        assertEquals(Tuple.of(x.node(), y.node()), n.args());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testArityMismatch() {
        Operator.NEG.record(x, y);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNoProxyOperand() {
        Operator.ADD.record(1, 2);
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testNonReflectableOperator() {
        Operator.GETITEM.recordReflected(x, 1);
    }

    @Test
    public void testReflectableCatalog() {
        assertEquals(EnumSet.of(Operator.ADD, Operator.SUB, Operator.MUL, Operator.FLOORDIV, Operator.TRUEDIV,
                Operator.DIV, Operator.MOD, Operator.POW, Operator.LSHIFT, Operator.RSHIFT, Operator.AND,
                Operator.OR, Operator.XOR, Operator.MATMUL), Operator.reflectable());
        for (Operator op : Operator.values())
            assertEquals(op.isReflectable(), Operator.reflectable().contains(op));
    }

    @Test
    public void testFromString() {
        assertEquals(Operator.AND, Operator.fromString("and_"));
        assertEquals(Operator.MATMUL, Operator.fromString("MATMUL"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testFromStringUnknown() {
        Operator.fromString("spaceship");
    }
}
