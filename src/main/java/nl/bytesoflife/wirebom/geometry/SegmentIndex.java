package nl.bytesoflife.wirebom.geometry;

import nl.bytesoflife.wirebom.model.WireFragment;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.index.strtree.STRtree;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Spatial index over wire fragments for nearest-wire lookups.
 */
public class SegmentIndex {

    private final STRtree tree = new STRtree();
    private boolean built = false;

    public SegmentIndex(Collection<WireFragment> fragments) {
        for (WireFragment fragment : fragments) {
            insert(fragment);
        }
    }

    public void insert(WireFragment fragment) {
        tree.insert(new Envelope(fragment.getStart(), fragment.getEnd()), fragment);
    }

    /**
     * Fragments whose clamped distance to {@code point} is at most {@code maxDistance},
     * nearest first, ties ordered by fragment id.
     */
    @SuppressWarnings("unchecked")
    public List<Neighbor> queryWithin(Coordinate point, double maxDistance) {
        ensureBuilt();
        Envelope searchEnvelope = new Envelope(point);
        searchEnvelope.expandBy(maxDistance);
        List<WireFragment> candidates = (List<WireFragment>) tree.query(searchEnvelope);

        List<Neighbor> neighbors = new ArrayList<>();
        for (WireFragment fragment : candidates) {
            double distance = fragment.toSegment().distance(point);
            if (distance <= maxDistance) {
                neighbors.add(new Neighbor(fragment, distance));
            }
        }
        neighbors.sort(Comparator.comparingDouble(Neighbor::distance)
                .thenComparing(n -> n.fragment().getId()));
        return neighbors;
    }

    private void ensureBuilt() {
        if (!built) {
            tree.build();
            built = true;
        }
    }

    public record Neighbor(WireFragment fragment, double distance) {}
}
