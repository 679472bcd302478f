package com.fxtrace.trace;

import com.fxtrace.api.NodeKind;
import com.fxtrace.api.Tuple;
import com.fxtrace.graph.Graph;
import com.fxtrace.graph.Node;
import com.fxtrace.naming.NameScope;
import com.fxtrace.ops.Operator;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class TracerBaseTest {

    private Graph graph;
    private TracerBase tracer;

    @Before
    public void setUp() {
        graph = new Graph("mlp");
        tracer = new TracerBase(graph);
    }

    // 2 * (relu(x @ w) + x @ w)
    private Proxy forward(Proxy x, Proxy w) {
        try (NameScope scope = tracer.enterScope()) {
            scope.bind("x", x).bind("w", w);
            Proxy hidden = x.matmul(w);
            scope.bind("hidden", hidden);
            Proxy act = hidden.field("relu").call();
            scope.bind("act", act);
            return act.add(hidden).rmul(2);
        }
    }

    private static List<String> names(Graph g) {
        List<String> out = new ArrayList<>();
        for (Node n : g.nodes())
            out.add(n.name());
        return out;
    }

    @Test
    public void testTraceFunction() {
        Proxy x = tracer.placeholder("x");
        Proxy w = tracer.placeholder("w");
        Node out = tracer.output(forward(x, w));

        assertEquals(List.of("x", "w", "hidden", "act", "add", "mul", "output"), names(graph));

        Node mul = graph.node("mul");
        assertEquals(Operator.MUL, mul.target());
        assertEquals(2, mul.args().get(0));
        assertSame(graph.node("add"), mul.args().get(1));

        Node act = graph.node("act");
        assertEquals(NodeKind.CALL_METHOD, act.kind());
        assertEquals("relu", act.target());
        assertEquals(Tuple.of(graph.node("hidden")), act.args());

        assertEquals(Tuple.of(mul), out.args());
    }

    @Test
    public void testCreateProxyAppendsExactlyOneNode() {
        Proxy x = tracer.placeholder("x");
        int before = graph.size();

        Proxy p = tracer.createProxy(NodeKind.CALL_METHOD, "sum", Tuple.of(x), Map.of("dim", List.of(0, 1)), "total");

        assertEquals(before + 1, graph.size());
        assertEquals("total", p.node().name());
        assertEquals(Map.of("dim", List.of(0, 1)), p.node().kwargs());
    }

    @Test
    public void testTwoTracersOnSeparateGraphs() {
        Graph other = new Graph("other");
        TracerBase second = new TracerBase(other);

        Proxy a = tracer.placeholder("x");
        Proxy b = second.placeholder("x");
        a.neg();
        b.neg();

        assertEquals(List.of("x", "neg"), names(graph));
        assertEquals(List.of("x", "neg"), names(other));
    }

    @Test
    public void testPlaceholderWithDefaultValue() {
        Proxy p = tracer.createProxy(NodeKind.PLACEHOLDER, "bias", Tuple.of(0.5), Map.of(), "bias");
        assertEquals(Tuple.of(0.5), p.node().args());
    }
}
