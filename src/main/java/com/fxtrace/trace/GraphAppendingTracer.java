package com.fxtrace.trace;

import com.fxtrace.graph.Graph;

/**
 * Tracer used by a proxy created around a raw node without one, so that graph
 * transforms can use the overloaded operators to append to an existing graph.
 */
public class GraphAppendingTracer extends TracerBase {

    public GraphAppendingTracer(Graph graph) {
        super(graph);
    }
}
