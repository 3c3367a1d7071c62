package nl.bytesoflife.wirebom.trace;

import nl.bytesoflife.wirebom.ConnectionRecord;
import nl.bytesoflife.wirebom.Diagnostic;
import nl.bytesoflife.wirebom.DiagnosticCollector;
import nl.bytesoflife.wirebom.WireBomConfig;
import nl.bytesoflife.wirebom.graph.ConnectivityGraph;
import nl.bytesoflife.wirebom.graph.GraphEdge;
import nl.bytesoflife.wirebom.model.CircuitId;
import nl.bytesoflife.wirebom.model.DiagnosticKind;
import nl.bytesoflife.wirebom.model.WireFragment;
import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Produces one two-point {@link ConnectionRecord} per circuit id: the first fragment carrying
 * the id is traced to a pin at each end. Ids already handled as multipoint are skipped.
 */
public class ConnectionResolver {

    private static final Logger log = LoggerFactory.getLogger(ConnectionResolver.class);

    private final ConnectivityGraph graph;
    private final WireBomConfig config;
    private final DiagnosticCollector diagnostics;
    private final ConnectionTracer tracer;

    public ConnectionResolver(ConnectivityGraph graph, WireBomConfig config, DiagnosticCollector diagnostics) {
        this.graph = graph;
        this.config = config;
        this.diagnostics = diagnostics;
        this.tracer = new ConnectionTracer(graph);
    }

    public Result resolve(Set<String> consumedIds) {
        List<ConnectionRecord> records = new ArrayList<>();
        Set<String> coveredFragments = new LinkedHashSet<>();
        Set<String> handled = new HashSet<>(consumedIds);

        for (WireFragment fragment : graph.fragments()) {
            if (fragment.getCircuitIds().size() != 1) continue;
            CircuitId circuitId = fragment.getCircuitIds().get(0);
            if (handled.add(circuitId.text())) {
                resolveRecord(fragment, circuitId, records, coveredFragments);
            }
        }
        // pipe tokens not declared on any single-id fragment
        for (WireFragment fragment : graph.fragments()) {
            if (!fragment.isMultiCircuit()) continue;
            for (CircuitId circuitId : fragment.getCircuitIds()) {
                if (handled.add(circuitId.text())) {
                    resolveRecord(fragment, circuitId, records, coveredFragments);
                }
            }
        }

        log.info("Resolved {} two-point connection(s)", records.size());
        return new Result(records, coveredFragments);
    }

    private void resolveRecord(WireFragment fragment, CircuitId circuitId, List<ConnectionRecord> records,
                               Set<String> coveredFragments) {
        FragmentTrace trace = tracer.resolve(fragment);
        coveredFragments.add(fragment.getId());

        List<String> warnings = new ArrayList<>();
        checkEnd(trace.start(), fragment, circuitId, "start", fragment.getStart(), warnings);
        checkEnd(trace.end(), fragment, circuitId, "end", fragment.getEnd(), warnings);
        if (!warnings.isEmpty() && config.isStrictMode()) {
            return;
        }

        List<WireFragment> along = new ArrayList<>(fragmentsOf(pathOf(trace.start())));
        Collections.reverse(along);
        along.add(fragment);
        along.addAll(fragmentsOf(pathOf(trace.end())));
        along.forEach(f -> coveredFragments.add(f.getId()));

        records.add(new ConnectionRecord(circuitId.text(),
                refOf(trace.start()), pinOf(trace.start()),
                refOf(trace.end()), pinOf(trace.end()),
                notesAlong(along), !warnings.isEmpty(), warnings));
    }

    private void checkEnd(TraceResult result, WireFragment fragment, CircuitId circuitId, String side,
                          Coordinate point, List<String> warnings) {
        if (result instanceof TraceResult.NotFound) {
            Diagnostic diagnostic = diagnostics.report(DiagnosticKind.UNTERMINATED_WIRE,
                    String.format(Locale.US, "Circuit %s (wire %s on sheet %s) does not reach a component pin from its %s (%.2f, %.2f)",
                            circuitId, fragment.getId(), fragment.getSheetId(), side, point.x, point.y),
                    List.of(fragment.getId(), circuitId.text()));
            warnings.add(diagnostic.getMessage());
        }
    }

    /**
     * Notes of the given fragments in order, each note once.
     */
    public static List<String> notesAlong(Collection<WireFragment> fragments) {
        Set<String> notes = new LinkedHashSet<>();
        for (WireFragment fragment : fragments) {
            notes.addAll(fragment.getNotes());
        }
        return new ArrayList<>(notes);
    }

    private static List<GraphEdge> pathOf(TraceResult result) {
        return result instanceof TraceResult.Found found ? found.path() : List.of();
    }

    private static List<WireFragment> fragmentsOf(List<GraphEdge> path) {
        return path.stream().filter(GraphEdge::isFragment).map(GraphEdge::fragment).toList();
    }

    private static String refOf(TraceResult result) {
        return result instanceof TraceResult.Found found ? found.pin().ref() : ConnectionRecord.UNKNOWN;
    }

    private static String pinOf(TraceResult result) {
        return result instanceof TraceResult.Found found ? found.pin().pinNumber() : ConnectionRecord.UNKNOWN;
    }

    /**
     * Records plus the ids of every fragment that ended up on one of their paths.
     */
    public record Result(List<ConnectionRecord> records, Set<String> coveredFragmentIds) {
    }
}
