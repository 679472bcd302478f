package com.fxtrace.util;

import com.fxtrace.api.Slice;
import com.fxtrace.api.Tuple;
import com.fxtrace.graph.Graph;
import com.fxtrace.graph.Node;

import java.util.List;
import java.util.Map;

/**
 * Diagnostic utility for inspecting a recorded graph.
 *
 * <p>
 * Renders one line per node in recording order, e.g.
 * {@code %add : call_function[target=add](args = (%x, 1), kwargs = {})}.
 * Node references print as {@code %name}.
 *
 * <p>
 * <b>Usage:</b> Intended for debugging sessions, logging errors and tests.
 */
public final class GraphExplain {
    private final Graph graph;

    public GraphExplain(Graph graph) {
        this.graph = graph;
    }

    /** Dumps every node of the graph. */
    public String dumpGraph() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("graph ").append(graph.name()).append(" (").append(graph.size()).append(" nodes):\n");
        for (Node n : graph.nodes())
            sb.append("    ").append(formatNode(n)).append('\n');
        return sb.toString();
    }

    /** Dumps detailed state of a single node. */
    public String explainNode(String nodeName) {
        Node node = graph.node(nodeName);
        if (node == null)
            throw new IllegalArgumentException("Unknown node: " + nodeName);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(node.name()).append('\n')
                .append("  Kind: ").append(node.kind().opName()).append('\n')
                .append("  Target: ").append(graph.renderTarget(node.target())).append('\n')
                .append("  Args: ").append(formatArg(node.args())).append('\n')
                .append("  Kwargs: ").append(formatArg(node.kwargs())).append('\n');
        if (node.typeHint() != null)
            sb.append("  Type: ").append(node.typeHint().getTypeName()).append('\n');
        sb.append("  Users (").append(node.users().size()).append("): ");
        int i = 0;
        for (Node user : node.users()) {
            if (i++ > 0)
                sb.append(", ");
            sb.append(user.name());
        }
        return sb.append('\n').toString();
    }

    public String formatNode(Node n) {
        StringBuilder sb = new StringBuilder(128);
        sb.append('%').append(n.name()).append(" : ").append(n.kind().opName())
                .append("[target=").append(graph.renderTarget(n.target())).append(']')
                .append("(args = ").append(formatArg(n.args()))
                .append(", kwargs = ").append(formatArg(n.kwargs())).append(')');
        return sb.toString();
    }

    /** Renders a lowered argument. */
    public static String formatArg(Object arg) {
        if (arg instanceof Node n)
            return "%" + n.name();
        if (arg instanceof Tuple t) {
            StringBuilder sb = new StringBuilder("(");
            for (int i = 0; i < t.size(); i++) {
                if (i > 0)
                    sb.append(", ");
                sb.append(formatArg(t.get(i)));
            }
            if (t.size() == 1)
                sb.append(',');
            return sb.append(')').toString();
        }
        if (arg instanceof List<?> l) {
            StringBuilder sb = new StringBuilder("[");
            for (int i = 0; i < l.size(); i++) {
                if (i > 0)
                    sb.append(", ");
                sb.append(formatArg(l.get(i)));
            }
            return sb.append(']').toString();
        }
        if (arg instanceof Map<?, ?> m) {
            StringBuilder sb = new StringBuilder("{");
            int i = 0;
            for (var e : m.entrySet()) {
                if (i++ > 0)
                    sb.append(", ");
                sb.append(e.getKey()).append(": ").append(formatArg(e.getValue()));
            }
            return sb.append('}').toString();
        }
        if (arg instanceof Slice s)
            return "slice(" + formatArg(s.start()) + ", " + formatArg(s.stop()) + ", " + formatArg(s.step()) + ")";
        if (arg instanceof String s)
            return "'" + s + "'";
        return String.valueOf(arg);
    }
}
