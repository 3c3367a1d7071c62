package nl.bytesoflife.wirebom.multipoint;

import nl.bytesoflife.wirebom.graph.ConnectivityGraph;
import nl.bytesoflife.wirebom.graph.EdgeKind;
import nl.bytesoflife.wirebom.graph.GraphEdge;
import nl.bytesoflife.wirebom.graph.GraphNode;
import nl.bytesoflife.wirebom.model.WireFragment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds regions of non-pin nodes that border three or more component pins. Regions follow
 * wires and sheet splices; power nets do not join regions.
 */
public class MultipointDetector {

    private static final Logger log = LoggerFactory.getLogger(MultipointDetector.class);

    private final ConnectivityGraph graph;

    public MultipointDetector(ConnectivityGraph graph) {
        this.graph = graph;
    }

    public List<MultipointGroup> detect() {
        List<MultipointGroup> groups = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        for (GraphNode node : graph.nodes()) {
            if (node instanceof GraphNode.ComponentPin || !seen.add(node.id())) continue;

            Set<String> region = new LinkedHashSet<>();
            Map<String, GraphNode.ComponentPin> pins = new LinkedHashMap<>();
            Map<String, WireFragment> fragments = new LinkedHashMap<>();
            Deque<String> worklist = new ArrayDeque<>();
            region.add(node.id());
            worklist.add(node.id());

            while (!worklist.isEmpty()) {
                String current = worklist.poll();
                for (GraphEdge edge : regionEdges(current)) {
                    if (edge.isFragment()) {
                        fragments.putIfAbsent(edge.fragment().getId(), edge.fragment());
                    }
                    GraphNode next = graph.node(edge.other(current));
                    if (next instanceof GraphNode.ComponentPin pin) {
                        pins.putIfAbsent(pin.id(), pin);
                    } else if (seen.add(next.id())) {
                        region.add(next.id());
                        worklist.add(next.id());
                    }
                }
            }

            if (pins.size() >= 3) {
                List<PinSegment> segments = new ArrayList<>();
                for (GraphNode.ComponentPin pin : pins.values()) {
                    segments.add(segmentOf(pin, region));
                }
                MultipointGroup group = new MultipointGroup(new ArrayList<>(pins.values()),
                        new ArrayList<>(region), new ArrayList<>(fragments.values()), segments);
                log.debug("Multipoint group {} with {} fragment(s)", group.describe(), fragments.size());
                groups.add(group);
            }
        }

        log.info("Detected {} multipoint group(s)", groups.size());
        return groups;
    }

    /**
     * Walks away from the pin through nodes joining exactly two edges. Stops at a pin,
     * a junction point or a dead end.
     */
    PinSegment segmentOf(GraphNode.ComponentPin pin, Set<String> region) {
        List<WireFragment> fragments = new ArrayList<>();
        Set<String> visitedEdges = new HashSet<>();

        for (GraphEdge first : regionEdges(pin.id())) {
            if (!region.contains(first.other(pin.id()))) continue;
            String previous = pin.id();
            GraphEdge edge = first;
            while (edge != null && visitedEdges.add(edge.id())) {
                if (edge.isFragment()) {
                    fragments.add(edge.fragment());
                }
                String current = edge.other(previous);
                List<GraphEdge> onward = regionEdges(current);
                if (graph.node(current) instanceof GraphNode.ComponentPin || onward.size() != 2) {
                    break;
                }
                GraphEdge arrived = edge;
                edge = onward.stream().filter(e -> !e.id().equals(arrived.id())).findFirst().orElse(null);
                previous = current;
            }
        }
        return new PinSegment(pin, fragments);
    }

    private List<GraphEdge> regionEdges(String nodeId) {
        return graph.edgesAt(nodeId).stream()
                .filter(e -> e.kind() != EdgeKind.POWER_NET)
                .toList();
    }
}
