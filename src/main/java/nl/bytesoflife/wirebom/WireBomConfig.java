package nl.bytesoflife.wirebom;

/**
 * Immutable per-run settings, passed explicitly to every stage that needs them.
 */
public final class WireBomConfig {

    public static final double DEFAULT_LABEL_THRESHOLD = 10.0;
    public static final double DEFAULT_NODE_TOLERANCE = 0.1;

    private final double labelThreshold;
    private final double nodeTolerance;
    private final boolean strictMode;

    private WireBomConfig(double labelThreshold, double nodeTolerance, boolean strictMode) {
        if (!(labelThreshold > 0)) {
            throw new IllegalArgumentException("Label threshold must be positive: " + labelThreshold);
        }
        if (!(nodeTolerance > 0)) {
            throw new IllegalArgumentException("Node tolerance must be positive: " + nodeTolerance);
        }
        this.labelThreshold = labelThreshold;
        this.nodeTolerance = nodeTolerance;
        this.strictMode = strictMode;
    }

    public static WireBomConfig defaults() {
        return new WireBomConfig(DEFAULT_LABEL_THRESHOLD, DEFAULT_NODE_TOLERANCE, true);
    }

    public WireBomConfig withLabelThreshold(double labelThreshold) {
        return new WireBomConfig(labelThreshold, nodeTolerance, strictMode);
    }

    public WireBomConfig withNodeTolerance(double nodeTolerance) {
        return new WireBomConfig(labelThreshold, nodeTolerance, strictMode);
    }

    public WireBomConfig withStrictMode(boolean strictMode) {
        return new WireBomConfig(labelThreshold, nodeTolerance, strictMode);
    }

    /** Maximum label-to-wire distance, in schematic units. */
    public double getLabelThreshold() { return labelThreshold; }

    /** Distance under which two points are the same graph node. */
    public double getNodeTolerance() { return nodeTolerance; }

    public boolean isStrictMode() { return strictMode; }

    @Override
    public String toString() {
        return "WireBomConfig{labelThreshold=" + labelThreshold + ", nodeTolerance=" + nodeTolerance
                + ", strictMode=" + strictMode + "}";
    }
}
