package nl.bytesoflife.wirebom.graph;

import nl.bytesoflife.wirebom.model.WireFragment;
import org.locationtech.jts.geom.Coordinate;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Nodes and edges of every loaded sheet. Read-only once built by
 * {@link ConnectivityGraphBuilder}; iteration order is insertion order.
 */
public class ConnectivityGraph {

    private final Map<String, GraphNode> nodes;
    private final Map<String, GraphEdge> edges;
    private final Map<String, List<GraphEdge>> adjacency;
    private final Map<String, GraphEdge> fragmentEdges;
    private final Map<String, GraphNode.ComponentPin> pinNodes;
    private final Map<String, PositionIndex> positionIndexes;
    private final List<WireFragment> fragments;

    ConnectivityGraph(Map<String, GraphNode> nodes, Map<String, GraphEdge> edges,
                      Map<String, List<GraphEdge>> adjacency, Map<String, GraphNode.ComponentPin> pinNodes,
                      Map<String, PositionIndex> positionIndexes, List<WireFragment> fragments) {
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        this.edges = Collections.unmodifiableMap(new LinkedHashMap<>(edges));
        Map<String, List<GraphEdge>> adjacencyCopy = new LinkedHashMap<>();
        adjacency.forEach((nodeId, list) -> adjacencyCopy.put(nodeId, List.copyOf(list)));
        this.adjacency = Collections.unmodifiableMap(adjacencyCopy);
        Map<String, GraphEdge> byFragment = new LinkedHashMap<>();
        for (GraphEdge edge : edges.values()) {
            if (edge.isFragment()) {
                byFragment.put(edge.fragment().getId(), edge);
            }
        }
        this.fragmentEdges = Collections.unmodifiableMap(byFragment);
        this.pinNodes = Collections.unmodifiableMap(new LinkedHashMap<>(pinNodes));
        this.positionIndexes = Collections.unmodifiableMap(new LinkedHashMap<>(positionIndexes));
        this.fragments = List.copyOf(fragments);
    }

    public GraphNode node(String nodeId) {
        GraphNode node = nodes.get(nodeId);
        if (node == null) {
            throw new IllegalArgumentException("Unknown node: " + nodeId);
        }
        return node;
    }

    public Collection<GraphNode> nodes() {
        return nodes.values();
    }

    public Collection<GraphEdge> edges() {
        return edges.values();
    }

    public Optional<GraphEdge> edge(String edgeId) {
        return Optional.ofNullable(edges.get(edgeId));
    }

    public List<GraphEdge> edgesAt(String nodeId) {
        return adjacency.getOrDefault(nodeId, List.of());
    }

    public int degree(String nodeId) {
        return edgesAt(nodeId).size();
    }

    public Optional<GraphEdge> fragmentEdge(String fragmentId) {
        return Optional.ofNullable(fragmentEdges.get(fragmentId));
    }

    public Optional<GraphNode> nodeAt(String sheetId, Coordinate position) {
        PositionIndex index = positionIndexes.get(sheetId);
        return index == null ? Optional.empty() : index.find(position);
    }

    public Optional<GraphNode.ComponentPin> pinNode(String sheetId, String ref, String pinNumber) {
        return Optional.ofNullable(pinNodes.get(ConnectivityGraphBuilder.pinKey(sheetId, ref, pinNumber)));
    }

    /**
     * Wire fragments in project order: root sheet first, then document order.
     */
    public List<WireFragment> fragments() {
        return fragments;
    }

    @Override
    public String toString() {
        return "ConnectivityGraph{nodes=" + nodes.size() + ", edges=" + edges.size() + "}";
    }
}
