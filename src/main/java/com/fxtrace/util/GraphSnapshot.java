package com.fxtrace.util;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fxtrace.api.Slice;
import com.fxtrace.api.Tuple;
import com.fxtrace.graph.Graph;
import com.fxtrace.graph.Node;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Data;

/**
 * POJO representation of a recorded graph, for export to inspection and
 * replay tooling.
 *
 * Argument values map to JSON as follows: base scalars, strings and null
 * stay literal, lists become arrays, and every other kind is a single-key
 * tagged object: {@code {"node": "x"}}, {@code {"tuple": [...]}},
 * {@code {"slice": [start, stop, step]}}, {@code {"dict": {...}}},
 * {@code {"enum": "Type.NAME"}} and {@code {"class": "java.lang.Double"}}.
 * A JSON object inside {@code args} is therefore always a tag, never a user map
 * or a string literal.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class GraphSnapshot {
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private String name;
    private List<NodeDef> nodes;

    /** One recorded node. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class NodeDef {
        private String name, op, target, type;
        private List<Object> args;
        private Map<String, Object> kwargs;
        private List<String> users;
    }

    public static GraphSnapshot of(Graph graph) {
        GraphSnapshot snapshot = new GraphSnapshot();
        snapshot.setName(graph.name());
        List<NodeDef> defs = new ArrayList<>(graph.size());
        for (Node n : graph.nodes()) {
            NodeDef def = new NodeDef();
            def.setName(n.name());
            def.setOp(n.kind().opName());
            def.setTarget(graph.renderTarget(n.target()));
            if (n.typeHint() != null)
                def.setType(n.typeHint().getTypeName());
            List<Object> args = new ArrayList<>(n.args().size());
            for (Object a : n.args())
                args.add(toJsonValue(a));
            def.setArgs(args);
            Map<String, Object> kwargs = new LinkedHashMap<>();
            for (var e : n.kwargs().entrySet())
                kwargs.put(e.getKey(), toJsonValue(e.getValue()));
            def.setKwargs(kwargs);
            List<String> users = new ArrayList<>();
            for (Node u : n.users())
                users.add(u.name());
            def.setUsers(users);
            defs.add(def);
        }
        snapshot.setNodes(defs);
        return snapshot;
    }

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize graph " + name, e);
        }
    }

    public static GraphSnapshot fromJson(String json) {
        try {
            return MAPPER.readValue(json, GraphSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid graph snapshot", e);
        }
    }

    static Object toJsonValue(Object arg) {
        if (arg instanceof Node n)
            return Map.of("node", n.name());
        if (arg instanceof Tuple t) {
            List<Object> out = new ArrayList<>(t.size());
            for (Object e : t)
                out.add(toJsonValue(e));
            return Map.of("tuple", out);
        }
        if (arg instanceof List<?> l) {
            List<Object> out = new ArrayList<>(l.size());
            for (Object e : l)
                out.add(toJsonValue(e));
            return out;
        }
        if (arg instanceof Map<?, ?> m) {
            Map<String, Object> out = new LinkedHashMap<>();
            for (var e : m.entrySet())
                out.put((String) e.getKey(), toJsonValue(e.getValue()));
            return Map.of("dict", out);
        }
        if (arg instanceof Slice s) {
            List<Object> parts = new ArrayList<>(3);
            parts.add(toJsonValue(s.start()));
            parts.add(toJsonValue(s.stop()));
            parts.add(toJsonValue(s.step()));
            return Map.of("slice", parts);
        }
        if (arg instanceof Enum<?> e)
            return Map.of("enum", e.getDeclaringClass().getSimpleName() + "." + e.name());
        if (arg instanceof Class<?> c)
            return Map.of("class", c.getName());
        return arg;
    }
}
