package nl.bytesoflife.wirebom.graph;

import org.locationtech.jts.geom.Coordinate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Grid-bucketed lookup of the nodes of one sheet. The cell size equals the merge tolerance,
 * so any node within tolerance lies in the 3x3 cells around the query point.
 */
class PositionIndex {

    private final double tolerance;
    private final Map<Cell, List<GraphNode>> cells = new HashMap<>();

    PositionIndex(double tolerance) {
        this.tolerance = tolerance;
    }

    void add(GraphNode node) {
        cells.computeIfAbsent(cellOf(node.position()), k -> new ArrayList<>()).add(node);
    }

    /**
     * Nearest node within tolerance of {@code point}, if any.
     */
    Optional<GraphNode> find(Coordinate point) {
        Cell center = cellOf(point);
        GraphNode best = null;
        double bestDistance = Double.MAX_VALUE;
        for (long dx = -1; dx <= 1; dx++) {
            for (long dy = -1; dy <= 1; dy++) {
                List<GraphNode> bucket = cells.get(new Cell(center.x() + dx, center.y() + dy));
                if (bucket == null) continue;
                for (GraphNode node : bucket) {
                    double distance = node.position().distance(point);
                    if (distance <= tolerance && distance < bestDistance) {
                        best = node;
                        bestDistance = distance;
                    }
                }
            }
        }
        return Optional.ofNullable(best);
    }

    private Cell cellOf(Coordinate point) {
        return new Cell((long) Math.floor(point.x / tolerance), (long) Math.floor(point.y / tolerance));
    }

    private record Cell(long x, long y) {}
}
