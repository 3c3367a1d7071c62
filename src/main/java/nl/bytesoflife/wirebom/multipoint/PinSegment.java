package nl.bytesoflife.wirebom.multipoint;

import nl.bytesoflife.wirebom.graph.GraphNode;
import nl.bytesoflife.wirebom.model.CircuitId;
import nl.bytesoflife.wirebom.model.WireFragment;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The fragment chain leaving one pin of a multipoint group, up to the first junction.
 */
public record PinSegment(GraphNode.ComponentPin pin, List<WireFragment> fragments) {

    public PinSegment {
        fragments = List.copyOf(fragments);
    }

    /**
     * Circuit ids declared by single-id fragments of this segment, in walk order.
     */
    public List<String> labels() {
        Set<String> ids = new LinkedHashSet<>();
        for (WireFragment fragment : fragments) {
            if (fragment.getCircuitIds().size() == 1) {
                ids.add(fragment.getCircuitIds().get(0).text());
            }
        }
        return List.copyOf(ids);
    }

    public boolean isLabeled() {
        return !labels().isEmpty();
    }

    public long labeledFragmentCount() {
        return fragments.stream().filter(f -> f.getCircuitIds().size() == 1).count();
    }

    public boolean carries(CircuitId circuitId) {
        return labels().contains(circuitId.text());
    }
}
