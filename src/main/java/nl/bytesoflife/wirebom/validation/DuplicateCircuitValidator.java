package nl.bytesoflife.wirebom.validation;

import nl.bytesoflife.wirebom.DiagnosticCollector;
import nl.bytesoflife.wirebom.graph.ConnectivityGraph;
import nl.bytesoflife.wirebom.graph.GraphEdge;
import nl.bytesoflife.wirebom.model.CircuitId;
import nl.bytesoflife.wirebom.model.DiagnosticKind;
import nl.bytesoflife.wirebom.model.SchematicProject;
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
 * Flags circuit ids that label wires which are not connected to each other.
 * <p>
 * The same id on several fragments is fine when they are reachable from each other anywhere
 * in the graph, which is how a circuit is re-declared on both sides of a sheet boundary.
 * Reachability follows every edge kind and passes through every node.
 */
public class DuplicateCircuitValidator {

    private static final Logger log = LoggerFactory.getLogger(DuplicateCircuitValidator.class);

    private final ConnectivityGraph graph;
    private final DiagnosticCollector diagnostics;

    public DuplicateCircuitValidator(ConnectivityGraph graph, DiagnosticCollector diagnostics) {
        this.graph = graph;
        this.diagnostics = diagnostics;
    }

    public int validate(SchematicProject project) {
        Map<String, List<WireFragment>> byCircuit = new LinkedHashMap<>();
        for (WireFragment fragment : graph.fragments()) {
            for (CircuitId circuitId : fragment.getCircuitIds()) {
                byCircuit.computeIfAbsent(circuitId.text(), k -> new ArrayList<>()).add(fragment);
            }
        }

        int duplicates = 0;
        for (Map.Entry<String, List<WireFragment>> entry : byCircuit.entrySet()) {
            List<WireFragment> fragments = entry.getValue();
            if (fragments.size() < 2) continue;

            List<List<WireFragment>> groups = connectedGroups(fragments);
            if (groups.size() > 1) {
                duplicates++;
                report(project, entry.getKey(), fragments, groups.size());
            } else {
                log.debug("Circuit {} is declared on {} connected fragments", entry.getKey(), fragments.size());
            }
        }
        return duplicates;
    }

    /**
     * Partitions same-id fragments into groups that can reach each other.
     */
    List<List<WireFragment>> connectedGroups(List<WireFragment> fragments) {
        List<List<WireFragment>> groups = new ArrayList<>();
        Set<String> assigned = new HashSet<>();
        for (WireFragment fragment : fragments) {
            if (assigned.contains(fragment.getId())) continue;
            Set<String> reachable = reachableEdges(fragment);
            List<WireFragment> group = new ArrayList<>();
            for (WireFragment candidate : fragments) {
                if (!assigned.contains(candidate.getId()) && reachable.contains(candidate.getId())) {
                    group.add(candidate);
                    assigned.add(candidate.getId());
                }
            }
            groups.add(group);
        }
        return groups;
    }

    /**
     * Ids of every edge reachable from the fragment, the fragment's own edge included.
     * Fragment edge ids equal fragment ids.
     */
    private Set<String> reachableEdges(WireFragment fragment) {
        GraphEdge start = graph.fragmentEdge(fragment.getId()).orElseThrow();
        Set<String> visitedEdges = new HashSet<>();
        Set<String> visitedNodes = new HashSet<>();
        Deque<String> worklist = new ArrayDeque<>();
        visitedEdges.add(start.id());
        for (String end : List.of(start.nodeA(), start.nodeB())) {
            if (visitedNodes.add(end)) {
                worklist.add(end);
            }
        }

        while (!worklist.isEmpty()) {
            String current = worklist.poll();
            for (GraphEdge edge : graph.edgesAt(current)) {
                if (!visitedEdges.add(edge.id())) continue;
                String next = edge.other(current);
                if (visitedNodes.add(next)) {
                    worklist.add(next);
                }
            }
        }
        return visitedEdges;
    }

    private void report(SchematicProject project, String circuitId, List<WireFragment> fragments, int groupCount) {
        Set<String> sheetNames = new LinkedHashSet<>();
        List<String> implicated = new ArrayList<>();
        implicated.add(circuitId);
        for (WireFragment fragment : fragments) {
            sheetNames.add(project.sheetName(fragment.getSheetId()));
            implicated.add(fragment.getId());
        }
        diagnostics.report(DiagnosticKind.DUPLICATE_CIRCUIT,
                "Duplicate circuit id '" + circuitId + "' on " + groupCount
                        + " unconnected wire groups (sheets: " + String.join(", ", sheetNames) + ")",
                implicated);
    }
}
