package nl.bytesoflife.wirebom.trace;

import nl.bytesoflife.wirebom.DiagnosticCollector;
import nl.bytesoflife.wirebom.GraphFixtures;
import nl.bytesoflife.wirebom.SchematicText;
import nl.bytesoflife.wirebom.WireBomConfig;
import nl.bytesoflife.wirebom.graph.ConnectivityGraph;
import nl.bytesoflife.wirebom.graph.EdgeKind;
import nl.bytesoflife.wirebom.graph.GraphEdge;
import nl.bytesoflife.wirebom.graph.GraphNode;
import nl.bytesoflife.wirebom.graph.NodeKind;
import nl.bytesoflife.wirebom.model.WireFragment;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionTracerTest {

    private final DiagnosticCollector diagnostics = new DiagnosticCollector(WireBomConfig.defaults());

    @Test
    void traceSingleWireBetweenTwoPins() {
        ConnectivityGraph graph = GraphFixtures.graphOf(SchematicText.sheet()
                .symbol("Test:Battery", "BT1", 20, 20)
                .symbol("Test:Lamp", "L1", 45.08, 25.08)
                .wire(20, 25.08, 40, 25.08)
                .label("P1A", 30, 23)
                .build(), diagnostics);

        FragmentTrace trace = new ConnectionTracer(graph).resolve(GraphFixtures.fragment(graph, "P1A"));

        assertTrue(trace.isComplete());
        TraceResult.Found start = assertInstanceOf(TraceResult.Found.class, trace.start());
        TraceResult.Found end = assertInstanceOf(TraceResult.Found.class, trace.end());
        assertEquals("BT1-1", start.pin().key());
        assertEquals("L1-1", end.pin().key());
        assertTrue(start.path().isEmpty());
    }

    @Test
    void traceFollowsUnlabeledContinuationWires() {
        ConnectivityGraph graph = GraphFixtures.graphOf(SchematicText.sheet()
                .symbol("Test:Terminal", "T1", 0, 0)
                .symbol("Test:Terminal", "T2", 40, 20)
                .wire(0, 0, 20, 0)
                .wire(20, 0, 20, 20)
                .wire(20, 20, 40, 20)
                .label("W5A", 10, 1)
                .build(), diagnostics);

        FragmentTrace trace = new ConnectionTracer(graph).resolve(GraphFixtures.fragment(graph, "W5A"));

        TraceResult.Found end = assertInstanceOf(TraceResult.Found.class, trace.end());
        assertEquals("T2-1", end.pin().key());
        assertEquals(2, end.path().size());
        assertEquals("root:wire:w2", end.path().get(0).id());
        assertEquals("root:wire:w3", end.path().get(1).id());
    }

    @Test
    void crossingWiresTraceIndependently() {
        ConnectivityGraph graph = GraphFixtures.graphOf(SchematicText.sheet()
                .symbol("Test:Terminal", "T1", 0, 0)
                .symbol("Test:Terminal", "T2", 10, 10)
                .symbol("Test:Terminal", "T3", 0, 10)
                .symbol("Test:Terminal", "T4", 10, 0)
                .wire(0, 0, 10, 10)
                .wire(0, 10, 10, 0)
                .label("X1A", 2, 1.5)
                .label("X2A", 8, 1.5)
                .build(), diagnostics);

        ConnectionTracer tracer = new ConnectionTracer(graph);
        FragmentTrace first = tracer.resolve(GraphFixtures.fragment(graph, "X1A"));
        FragmentTrace second = tracer.resolve(GraphFixtures.fragment(graph, "X2A"));

        assertEquals("T1-1", ((TraceResult.Found) first.start()).pin().key());
        assertEquals("T2-1", ((TraceResult.Found) first.end()).pin().key());
        assertEquals("T3-1", ((TraceResult.Found) second.start()).pin().key());
        assertEquals("T4-1", ((TraceResult.Found) second.end()).pin().key());
    }

    @Test
    void danglingEndIsNotFound() {
        ConnectivityGraph graph = GraphFixtures.graphOf(SchematicText.sheet()
                .symbol("Test:Terminal", "T1", 0, 0)
                .wire(0, 0, 20, 0)
                .label("P9A", 10, 1)
                .build(), diagnostics);

        WireFragment fragment = GraphFixtures.fragment(graph, "P9A");
        FragmentTrace trace = new ConnectionTracer(graph).resolve(fragment);

        assertFalse(trace.isComplete());
        assertInstanceOf(TraceResult.Found.class, trace.start());
        TraceResult.NotFound end = assertInstanceOf(TraceResult.NotFound.class, trace.end());
        assertEquals("root:endpoint:w1:end", end.fromNodeId());
    }

    @Test
    void traceCrossesPowerNets() {
        ConnectivityGraph graph = GraphFixtures.graphOf(SchematicText.sheet()
                .symbol("Test:Terminal", "T1", 0, 0)
                .symbol("Test:Terminal", "T2", 100, 0)
                .power("GND", "#PWR1", 20, 0)
                .power("GND", "#PWR2", 80, 0)
                .wire(0, 0, 20, 0)
                .wire(80, 0, 100, 0)
                .label("G1A", 10, 1)
                .build(), diagnostics);

        FragmentTrace trace = new ConnectionTracer(graph).resolve(GraphFixtures.fragment(graph, "G1A"));

        TraceResult.Found end = assertInstanceOf(TraceResult.Found.class, trace.end());
        assertEquals("T2-1", end.pin().key());
        assertEquals(EdgeKind.POWER_NET, end.path().get(0).kind());
        assertEquals("root:wire:w2", end.path().get(1).id());
    }

    @Test
    void directNeighbourPinWinsOverLongerRoute() {
        ConnectivityGraph graph = GraphFixtures.graphOf(SchematicText.sheet()
                .symbol("Test:Terminal", "T1", 0, 0)
                .symbol("Test:Terminal", "T2", 40, 0)
                .symbol("Test:Terminal", "T3", 20, 20)
                .wire(0, 0, 20, 0)
                .wire(20, 0, 20, 10)
                .wire(20, 10, 20, 20)
                .wire(20, 0, 40, 0)
                .junction(20, 0)
                .label("D1A", 10, 1)
                .build(), diagnostics);

        GraphEdge labelled = graph.fragmentEdge(GraphFixtures.fragment(graph, "D1A").getId()).orElseThrow();
        TraceResult result = new ConnectionTracer(graph).trace(labelled.nodeB(), labelled);

        TraceResult.Found found = assertInstanceOf(TraceResult.Found.class, result);
        assertEquals("T2-1", found.pin().key());
        assertEquals(1, found.path().size());
    }

    @Test
    void onlyComponentPinsAreOpaque() {
        for (NodeKind kind : EnumSet.allOf(NodeKind.class)) {
            boolean opaque = kind == NodeKind.COMPONENT_PIN;
            GraphNode node = switch (kind) {
                case COMPONENT_PIN -> new GraphNode.ComponentPin("p", "root", null, "R1", "1");
                case JUNCTION -> new GraphNode.Junction("j", "root", null);
                case WIRE_ENDPOINT -> new GraphNode.WireEndpoint("e", "root", null);
                case SHEET_BOUNDARY_PIN -> new GraphNode.SheetBoundaryPin("s", "root", null, "A", "child");
                case HIERARCHICAL_LABEL -> new GraphNode.HierarchicalLabel("h", "child", null, "A");
                case POWER_PORT -> new GraphNode.PowerPort("w", "root", null, "GND");
            };
            assertEquals(opaque, ConnectionTracer.isOpaque(node), kind.name());
        }
    }
}
