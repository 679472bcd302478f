package com.fxtrace.util;

import com.fxtrace.api.Slice;
import com.fxtrace.api.Tuple;
import com.fxtrace.graph.Graph;
import com.fxtrace.trace.Proxy;
import com.fxtrace.trace.TracerBase;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

public class GraphSnapshotTest {

    private Graph graph;

    @Before
    public void setUp() {
        graph = new Graph("snap");
        TracerBase tracer = new TracerBase(graph);
        Proxy x = tracer.placeholder("x", Double.class);
        Proxy add = x.add(x);
        Proxy sliced = add.getItem(Slice.of(1, null));
        tracer.output(sliced);
    }

    @Test
    public void testSnapshotNodes() {
        GraphSnapshot snapshot = GraphSnapshot.of(graph);

        assertEquals("snap", snapshot.getName());
        assertEquals(4, snapshot.getNodes().size());

        GraphSnapshot.NodeDef x = snapshot.getNodes().get(0);
        assertEquals("placeholder", x.getOp());
        assertEquals("java.lang.Double", x.getType());
        assertEquals(List.of("add"), x.getUsers());

        GraphSnapshot.NodeDef add = snapshot.getNodes().get(1);
        assertEquals("call_function", add.getOp());
        assertEquals("add", add.getTarget());
        assertEquals(List.of(Map.of("node", "x"), Map.of("node", "x")), add.getArgs());

        GraphSnapshot.NodeDef getitem = snapshot.getNodes().get(2);
        assertEquals(List.of(Map.of("node", "add"), Map.of("slice", Arrays.asList(1, null, null))), getitem.getArgs());
    }

    @Test
    public void testJsonRoundTrip() {
        String json = GraphSnapshot.of(graph).toJson();
        assertTrue(json.contains("\"op\" : \"call_function\""));

        GraphSnapshot back = GraphSnapshot.fromJson(json);
        GraphSnapshot.NodeDef add = back.getNodes().get(1);
        assertEquals("add", add.getName());
        assertEquals("call_function", add.getOp());
        assertEquals(List.of(Map.of("node", "x"), Map.of("node", "x")), add.getArgs());
        assertEquals(List.of("getitem"), add.getUsers());
        assertEquals("output", back.getNodes().get(3).getName());
    }

    @Test
    public void testTupleKeptDistinctFromList() {
        assertEquals(Map.of("tuple", List.of(1, 2)), GraphSnapshot.toJsonValue(Tuple.of(1, 2)));
        assertEquals(List.of(1, 2), GraphSnapshot.toJsonValue(List.of(1, 2)));
    }

    @Test
    public void testLiteralsNeverCollideWithTags() {
        Graph g = new Graph("literals");
        TracerBase tracer = new TracerBase(g);
        Proxy x = tracer.placeholder("x");
        x.field("f").call("%x", Map.of("tuple", List.of(1)), Tuple.of(1));

        GraphSnapshot.NodeDef call = GraphSnapshot.of(g).getNodes().get(1);
        assertEquals(Map.of("node", "x"), call.getArgs().get(0));
        assertEquals("%x", call.getArgs().get(1));
        assertEquals(Map.of("dict", Map.of("tuple", List.of(1))), call.getArgs().get(2));
        assertEquals(Map.of("tuple", List.of(1)), call.getArgs().get(3));

        String json = GraphSnapshot.of(g).toJson();
        GraphSnapshot.NodeDef back = GraphSnapshot.fromJson(json).getNodes().get(1);
        assertEquals("%x", back.getArgs().get(1));
        assertNotEquals(back.getArgs().get(2), back.getArgs().get(3));
    }

    @Test
    public void testEnumAndClassAreTagged() {
        assertEquals(Map.of("enum", "TimeUnit.SECONDS"), GraphSnapshot.toJsonValue(TimeUnit.SECONDS));
        assertEquals(Map.of("class", "java.lang.Double"), GraphSnapshot.toJsonValue(Double.class));
        assertEquals("SECONDS", GraphSnapshot.toJsonValue("SECONDS"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidJson() {
        GraphSnapshot.fromJson("{not json");
    }
}
