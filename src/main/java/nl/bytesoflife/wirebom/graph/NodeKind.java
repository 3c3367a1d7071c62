package nl.bytesoflife.wirebom.graph;

public enum NodeKind {
    COMPONENT_PIN,
    JUNCTION,
    WIRE_ENDPOINT,
    SHEET_BOUNDARY_PIN,
    HIERARCHICAL_LABEL,
    POWER_PORT
}
