package nl.bytesoflife.wirebom.trace;

import nl.bytesoflife.wirebom.graph.ConnectivityGraph;
import nl.bytesoflife.wirebom.graph.GraphEdge;
import nl.bytesoflife.wirebom.graph.GraphNode;
import nl.bytesoflife.wirebom.model.WireFragment;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds the component pin at each end of a fragment. Tracing passes through junctions,
 * wire endpoints, sheet splices and power ports and stops at the first component pin.
 */
public class ConnectionTracer {

    private final ConnectivityGraph graph;

    public ConnectionTracer(ConnectivityGraph graph) {
        this.graph = graph;
    }

    public FragmentTrace resolve(WireFragment fragment) {
        GraphEdge edge = graph.fragmentEdge(fragment.getId())
                .orElseThrow(() -> new IllegalArgumentException("Fragment not in graph: " + fragment.getId()));
        return new FragmentTrace(trace(edge.nodeA(), edge), trace(edge.nodeB(), edge));
    }

    /**
     * Traces from {@code startNodeId} without walking back over {@code arrivedVia}.
     */
    public TraceResult trace(String startNodeId, GraphEdge arrivedVia) {
        GraphNode start = graph.node(startNodeId);
        if (start instanceof GraphNode.ComponentPin pin) {
            return new TraceResult.Found(pin, List.of());
        }

        // direct hit: a neighbouring pin wins over any longer route
        for (GraphEdge edge : graph.edgesAt(startNodeId)) {
            if (arrivedVia != null && edge.id().equals(arrivedVia.id())) continue;
            if (graph.node(edge.other(startNodeId)) instanceof GraphNode.ComponentPin pin) {
                return new TraceResult.Found(pin, List.of(edge));
            }
        }

        Set<String> visitedEdges = new HashSet<>();
        Set<String> visitedNodes = new HashSet<>();
        Map<String, GraphEdge> reachedBy = new HashMap<>();
        Deque<String> worklist = new ArrayDeque<>();
        if (arrivedVia != null) {
            visitedEdges.add(arrivedVia.id());
        }
        visitedNodes.add(startNodeId);
        worklist.add(startNodeId);

        while (!worklist.isEmpty()) {
            String current = worklist.poll();
            for (GraphEdge edge : graph.edgesAt(current)) {
                if (!visitedEdges.add(edge.id())) continue;
                GraphNode next = graph.node(edge.other(current));
                if (isOpaque(next)) {
                    List<GraphEdge> path = pathTo(current, reachedBy);
                    path.add(edge);
                    return new TraceResult.Found((GraphNode.ComponentPin) next, path);
                }
                if (visitedNodes.add(next.id())) {
                    reachedBy.put(next.id(), edge);
                    worklist.add(next.id());
                }
            }
        }
        return new TraceResult.NotFound(startNodeId);
    }

    static boolean isOpaque(GraphNode node) {
        return switch (node.kind()) {
            case COMPONENT_PIN -> true;
            case JUNCTION, WIRE_ENDPOINT, SHEET_BOUNDARY_PIN, HIERARCHICAL_LABEL, POWER_PORT -> false;
        };
    }

    private static List<GraphEdge> pathTo(String nodeId, Map<String, GraphEdge> reachedBy) {
        List<GraphEdge> path = new ArrayList<>();
        String current = nodeId;
        GraphEdge edge;
        while ((edge = reachedBy.get(current)) != null) {
            path.add(edge);
            current = edge.other(current);
        }
        Collections.reverse(path);
        return path;
    }
}
