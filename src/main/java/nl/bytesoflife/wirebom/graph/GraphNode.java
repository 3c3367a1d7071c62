package nl.bytesoflife.wirebom.graph;

import org.locationtech.jts.geom.Coordinate;

/**
 * A point of the connectivity graph. Ids are namespaced {@code sheet:kind:local} so equal
 * names on different sheets never collide.
 */
public sealed interface GraphNode permits GraphNode.ComponentPin, GraphNode.Junction,
        GraphNode.WireEndpoint, GraphNode.SheetBoundaryPin, GraphNode.HierarchicalLabel,
        GraphNode.PowerPort {

    String id();

    String sheetId();

    Coordinate position();

    NodeKind kind();

    record ComponentPin(String id, String sheetId, Coordinate position, String ref, String pinNumber)
            implements GraphNode {
        @Override
        public NodeKind kind() { return NodeKind.COMPONENT_PIN; }

        public String key() { return ref + "-" + pinNumber; }
    }

    record Junction(String id, String sheetId, Coordinate position) implements GraphNode {
        @Override
        public NodeKind kind() { return NodeKind.JUNCTION; }
    }

    record WireEndpoint(String id, String sheetId, Coordinate position) implements GraphNode {
        @Override
        public NodeKind kind() { return NodeKind.WIRE_ENDPOINT; }
    }

    /**
     * Parent-side end of a sheet splice.
     */
    record SheetBoundaryPin(String id, String sheetId, Coordinate position, String name, String childSheetId)
            implements GraphNode {
        @Override
        public NodeKind kind() { return NodeKind.SHEET_BOUNDARY_PIN; }
    }

    /**
     * Child-side end of a sheet splice.
     */
    record HierarchicalLabel(String id, String sheetId, Coordinate position, String name)
            implements GraphNode {
        @Override
        public NodeKind kind() { return NodeKind.HIERARCHICAL_LABEL; }
    }

    record PowerPort(String id, String sheetId, Coordinate position, String netName) implements GraphNode {
        @Override
        public NodeKind kind() { return NodeKind.POWER_PORT; }
    }
}
