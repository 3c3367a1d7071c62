package nl.bytesoflife.wirebom.graph;

import nl.bytesoflife.wirebom.model.WireFragment;

/**
 * Undirected edge. {@code fragment} is set only for {@link EdgeKind#FRAGMENT} edges.
 */
public record GraphEdge(String id, EdgeKind kind, String nodeA, String nodeB, WireFragment fragment) {

    public String other(String nodeId) {
        if (nodeA.equals(nodeId)) return nodeB;
        if (nodeB.equals(nodeId)) return nodeA;
        throw new IllegalArgumentException("Node " + nodeId + " is not an end of edge " + id);
    }

    public boolean isFragment() {
        return kind == EdgeKind.FRAGMENT;
    }
}
