package nl.bytesoflife.wirebom.multipoint;

import nl.bytesoflife.wirebom.graph.GraphNode;
import nl.bytesoflife.wirebom.model.WireFragment;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Three or more component pins joined through junctions and wire endpoints only.
 *
 * @param nodeIds   the non-pin nodes of the connecting region
 * @param fragments every fragment inside the region, including those ending on a pin
 * @param segments  one segment per pin, in the same order as {@code pins}
 */
public record MultipointGroup(List<GraphNode.ComponentPin> pins, List<String> nodeIds,
                              List<WireFragment> fragments, List<PinSegment> segments) {

    public MultipointGroup {
        pins = List.copyOf(pins);
        nodeIds = List.copyOf(nodeIds);
        fragments = List.copyOf(fragments);
        segments = List.copyOf(segments);
    }

    public int size() {
        return pins.size();
    }

    public String describe() {
        return pins.stream().map(GraphNode.ComponentPin::key).collect(Collectors.joining(", ", "[", "]"));
    }
}
