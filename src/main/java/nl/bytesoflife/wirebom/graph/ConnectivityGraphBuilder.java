package nl.bytesoflife.wirebom.graph;

import nl.bytesoflife.wirebom.DiagnosticCollector;
import nl.bytesoflife.wirebom.WireBomConfig;
import nl.bytesoflife.wirebom.model.DiagnosticKind;
import nl.bytesoflife.wirebom.model.HierarchicalLabel;
import nl.bytesoflife.wirebom.model.Junction;
import nl.bytesoflife.wirebom.model.Pin;
import nl.bytesoflife.wirebom.model.PowerPin;
import nl.bytesoflife.wirebom.model.SchematicProject;
import nl.bytesoflife.wirebom.model.SchematicSheet;
import nl.bytesoflife.wirebom.model.SheetPin;
import nl.bytesoflife.wirebom.model.SheetSymbol;
import nl.bytesoflife.wirebom.model.WireFragment;
import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Builds one {@link ConnectivityGraph} across all sheets of a project.
 * <p>
 * Nodes are inserted in priority order (component pins, junctions, sheet pins, hierarchical
 * labels, power ports, wire endpoints); an element landing on an existing node of the same
 * sheet reuses it, so a pin is never replaced by a junction or a bare endpoint.
 */
public class ConnectivityGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(ConnectivityGraphBuilder.class);

    private final WireBomConfig config;
    private final DiagnosticCollector diagnostics;

    private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
    private final Map<String, GraphEdge> edges = new LinkedHashMap<>();
    private final Map<String, List<GraphEdge>> adjacency = new LinkedHashMap<>();
    private final Map<String, GraphNode.ComponentPin> pinNodes = new LinkedHashMap<>();
    private final Map<String, PositionIndex> positionIndexes = new LinkedHashMap<>();

    public ConnectivityGraphBuilder(WireBomConfig config, DiagnosticCollector diagnostics) {
        this.config = config;
        this.diagnostics = diagnostics;
    }

    public ConnectivityGraph build(SchematicProject project, List<Pin> pins, List<PowerPin> powerPins,
                                   List<WireFragment> fragments) {
        nodes.clear();
        edges.clear();
        adjacency.clear();
        pinNodes.clear();
        positionIndexes.clear();

        addComponentPins(pins);
        addJunctions(project);
        addSheetSplices(project);
        addPowerNets(powerPins);
        addFragments(fragments);

        ConnectivityGraph graph = new ConnectivityGraph(nodes, edges, adjacency, pinNodes,
                positionIndexes, fragments);
        log.info("Built connectivity graph: {} nodes, {} edges over {} sheet(s)",
                nodes.size(), edges.size(), project.getSheets().size());
        return graph;
    }

    private void addComponentPins(List<Pin> pins) {
        for (Pin pin : pins) {
            String key = pinKey(pin.sheetId(), pin.componentRef(), pin.number());
            if (pinNodes.containsKey(key)) {
                log.warn("Pin {} is placed more than once on sheet {}, keeping the first",
                        pin.key(), pin.sheetId());
                continue;
            }
            Optional<GraphNode> existing = index(pin.sheetId()).find(pin.position());
            if (existing.isPresent()) {
                log.warn("Pin {} coincides with {} on sheet {}, not connecting it",
                        pin.key(), existing.get().id(), pin.sheetId());
                continue;
            }
            GraphNode.ComponentPin node = new GraphNode.ComponentPin(
                    pin.sheetId() + ":pin:" + pin.key(), pin.sheetId(), pin.position(),
                    pin.componentRef(), pin.number());
            addNode(node);
            pinNodes.put(key, node);
        }
    }

    static String pinKey(String sheetId, String ref, String pinNumber) {
        return sheetId + ":" + ref + "-" + pinNumber;
    }

    private void addJunctions(SchematicProject project) {
        for (SchematicSheet sheet : project.getSheets()) {
            for (Junction junction : sheet.getJunctions()) {
                nodeAt(sheet.getId(), junction.position(),
                        position -> new GraphNode.Junction(junction.id(), sheet.getId(), position));
            }
        }
    }

    /**
     * One splice edge per parent sheet pin whose name matches a hierarchical label in the child.
     */
    private void addSheetSplices(SchematicProject project) {
        Map<String, List<GraphNode>> boundaryPins = new LinkedHashMap<>();
        for (SchematicSheet child : project.getChildren().values()) {
            SheetSymbol symbol = project.getParentSymbol(child.getId()).orElseThrow();
            List<GraphNode> sheetPins = new ArrayList<>();
            for (SheetPin pin : symbol.pins()) {
                String id = unique(symbol.sheetId() + ":sheetpin:" + child.getId() + "/" + pin.name(), nodes);
                sheetPins.add(nodeAt(symbol.sheetId(), pin.position(),
                        position -> new GraphNode.SheetBoundaryPin(id, symbol.sheetId(), position,
                                pin.name(), child.getId())));
            }
            boundaryPins.put(child.getId(), sheetPins);
        }

        Map<String, List<GraphNode>> childLabels = new LinkedHashMap<>();
        for (SchematicSheet child : project.getChildren().values()) {
            List<GraphNode> labels = new ArrayList<>();
            for (HierarchicalLabel label : child.getHierarchicalLabels()) {
                String id = unique(child.getId() + ":hlabel:" + label.name(), nodes);
                labels.add(nodeAt(child.getId(), label.position(),
                        position -> new GraphNode.HierarchicalLabel(id, child.getId(), position, label.name())));
            }
            childLabels.put(child.getId(), labels);
        }

        for (SchematicSheet child : project.getChildren().values()) {
            SheetSymbol symbol = project.getParentSymbol(child.getId()).orElseThrow();
            List<GraphNode> sheetPins = boundaryPins.get(child.getId());
            List<GraphNode> labels = childLabels.get(child.getId());
            List<String> labelNames = child.getHierarchicalLabels().stream()
                    .map(HierarchicalLabel::name).toList();
            Set<String> matchedNames = new LinkedHashSet<>();

            for (int i = 0; i < symbol.pins().size(); i++) {
                String name = symbol.pins().get(i).name();
                boolean matched = false;
                for (int j = 0; j < labelNames.size(); j++) {
                    if (!labelNames.get(j).equals(name)) continue;
                    String edgeId = unique("splice:" + child.getId() + ":" + name, edges);
                    addEdge(new GraphEdge(edgeId, EdgeKind.SHEET_SPLICE, sheetPins.get(i).id(),
                            labels.get(j).id(), null));
                    matched = true;
                }
                if (matched) {
                    matchedNames.add(name);
                } else {
                    diagnostics.report(DiagnosticKind.UNMATCHED_SHEET_PIN,
                            "Sheet pin '" + name + "' of sheet " + child.getName()
                                    + " has no hierarchical label in " + child.getFile(),
                            List.of(sheetPins.get(i).id()));
                }
            }
            for (int j = 0; j < labelNames.size(); j++) {
                if (!matchedNames.contains(labelNames.get(j))) {
                    diagnostics.report(DiagnosticKind.UNMATCHED_SHEET_PIN,
                            "Hierarchical label '" + labelNames.get(j) + "' in sheet " + child.getName()
                                    + " has no matching pin on its sheet symbol",
                            List.of(labels.get(j).id()));
                }
            }
        }

        if (!project.getRoot().getHierarchicalLabels().isEmpty()) {
            log.debug("Ignoring {} hierarchical label(s) on the root sheet",
                    project.getRoot().getHierarchicalLabels().size());
        }
    }

    /**
     * Power ports with the same net name form a clique, across sheets.
     */
    private void addPowerNets(List<PowerPin> powerPins) {
        Map<String, Set<String>> nets = new LinkedHashMap<>();
        for (PowerPin powerPin : powerPins) {
            String id = powerPin.sheetId() + ":power:" + powerPin.ref();
            GraphNode node = nodeAt(powerPin.sheetId(), powerPin.position(),
                    position -> new GraphNode.PowerPort(unique(id, nodes), powerPin.sheetId(), position,
                            powerPin.netName()));
            nets.computeIfAbsent(powerPin.netName(), k -> new LinkedHashSet<>()).add(node.id());
        }

        nets.forEach((net, members) -> {
            List<String> ids = new ArrayList<>(members);
            for (int i = 0; i < ids.size(); i++) {
                for (int j = i + 1; j < ids.size(); j++) {
                    addEdge(new GraphEdge("power:" + net + ":" + i + ":" + j, EdgeKind.POWER_NET,
                            ids.get(i), ids.get(j), null));
                }
            }
            log.debug("Power net {} joins {} port(s)", net, ids.size());
        });
    }

    private void addFragments(List<WireFragment> fragments) {
        for (WireFragment fragment : fragments) {
            String prefix = fragment.getSheetId() + ":endpoint:" + fragment.getLocalId();
            GraphNode start = nodeAt(fragment.getSheetId(), fragment.getStart(),
                    position -> new GraphNode.WireEndpoint(prefix + ":start", fragment.getSheetId(), position));
            GraphNode end = nodeAt(fragment.getSheetId(), fragment.getEnd(),
                    position -> new GraphNode.WireEndpoint(prefix + ":end", fragment.getSheetId(), position));
            addEdge(new GraphEdge(fragment.getId(), EdgeKind.FRAGMENT, start.id(), end.id(), fragment));
        }
    }

    // --- helpers ---

    private GraphNode nodeAt(String sheetId, Coordinate position, Function<Coordinate, GraphNode> factory) {
        Optional<GraphNode> existing = index(sheetId).find(position);
        if (existing.isPresent()) {
            return existing.get();
        }
        GraphNode node = factory.apply(new Coordinate(position));
        addNode(node);
        return node;
    }

    private void addNode(GraphNode node) {
        nodes.put(node.id(), node);
        index(node.sheetId()).add(node);
    }

    private void addEdge(GraphEdge edge) {
        edges.put(edge.id(), edge);
        adjacency.computeIfAbsent(edge.nodeA(), k -> new ArrayList<>()).add(edge);
        if (!edge.nodeB().equals(edge.nodeA())) {
            adjacency.computeIfAbsent(edge.nodeB(), k -> new ArrayList<>()).add(edge);
        }
    }

    private static String unique(String id, Map<String, ?> taken) {
        String candidate = id;
        int n = 2;
        while (taken.containsKey(candidate)) {
            candidate = id + "#" + n++;
        }
        return candidate;
    }

    private PositionIndex index(String sheetId) {
        return positionIndexes.computeIfAbsent(sheetId, k -> new PositionIndex(config.getNodeTolerance()));
    }
}
