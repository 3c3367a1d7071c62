package nl.bytesoflife.wirebom.graph;

public enum EdgeKind {
    /** A drawn wire fragment. */
    FRAGMENT,
    /** Parent sheet pin to the child's hierarchical label of the same name. */
    SHEET_SPLICE,
    /** Two power ports with the same net name. */
    POWER_NET
}
