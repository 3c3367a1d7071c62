package nl.bytesoflife.wirebom.trace;

import nl.bytesoflife.wirebom.graph.GraphEdge;
import nl.bytesoflife.wirebom.graph.GraphNode;

import java.util.List;

/**
 * Outcome of tracing from one fragment endpoint.
 */
public sealed interface TraceResult permits TraceResult.Found, TraceResult.NotFound {

    /**
     * @param path edges walked from the endpoint to the pin, excluding the starting fragment
     */
    record Found(GraphNode.ComponentPin pin, List<GraphEdge> path) implements TraceResult {
        public Found {
            path = List.copyOf(path);
        }
    }

    record NotFound(String fromNodeId) implements TraceResult {
    }
}
