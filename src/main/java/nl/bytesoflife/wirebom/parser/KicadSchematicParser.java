package nl.bytesoflife.wirebom.parser;

import nl.bytesoflife.wirebom.model.*;
import nl.bytesoflife.wirebom.parser.SExpressionParser.ParseException;
import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Extracts typed elements from one KiCad {@code .kicad_sch} document.
 * Unknown elements and elements missing required parts are skipped; only a document
 * that is not a single {@code (kicad_sch ...)} list is rejected.
 */
public class KicadSchematicParser {

    private static final Logger log = LoggerFactory.getLogger(KicadSchematicParser.class);

    private static final String POWER_FLAG_VALUE = "PWR_FLAG";

    public SchematicSheet parse(String content, String sheetId, String sheetName, String file) {
        SExpressionParser sexprParser = new SExpressionParser();
        SNode.SList document = requireDocument(sexprParser.parse(content));
        return buildSheet(document, sheetId, sheetName, file);
    }

    private SNode.SList requireDocument(List<SNode> nodes) {
        if (nodes.size() != 1) {
            throw new ParseException("Expected exactly one top-level (kicad_sch ...) list, found " + nodes.size(), 0);
        }
        SNode.SList list = (SNode.SList) nodes.get(0);
        if (!"kicad_sch".equals(list.tag())) {
            throw new ParseException("Not a KiCad schematic: top-level list is '" + list.tag() + "'", 0);
        }
        return list;
    }

    private SchematicSheet buildSheet(SNode.SList document, String sheetId, String sheetName, String file) {
        Map<String, LibSymbol> libSymbols = document.child("lib_symbols")
                .map(this::parseLibSymbols)
                .orElseGet(LinkedHashMap::new);

        List<WireFragment> wires = new ArrayList<>();
        List<Label> labels = new ArrayList<>();
        List<Junction> junctions = new ArrayList<>();
        List<ComponentInstance> components = new ArrayList<>();
        List<PowerSymbol> powerSymbols = new ArrayList<>();
        List<SheetSymbol> sheetSymbols = new ArrayList<>();
        List<HierarchicalLabel> hierarchicalLabels = new ArrayList<>();

        int wireOrdinal = 0;
        int junctionOrdinal = 0;
        for (SNode node : document.children()) {
            if (!(node instanceof SNode.SList list)) continue;
            switch (list.tag()) {
                case "wire" -> parseWire(list, sheetId, ++wireOrdinal).ifPresent(wires::add);
                case "label" -> parseLabel(list, sheetId).ifPresent(labels::add);
                case "junction" -> parseJunction(list, sheetId, ++junctionOrdinal).ifPresent(junctions::add);
                case "symbol" -> parseSymbol(list, sheetId, libSymbols, components, powerSymbols);
                case "sheet" -> parseSheet(list, sheetId).ifPresent(sheetSymbols::add);
                case "hierarchical_label" -> parseHierarchicalLabel(list, sheetId).ifPresent(hierarchicalLabels::add);
                default -> {
                    // title block, text, bus entries, instances: not relevant to wiring
                }
            }
        }

        SchematicSheet sheet = new SchematicSheet(sheetId, sheetName, file, wires, labels, junctions,
                components, powerSymbols, sheetSymbols, hierarchicalLabels, libSymbols);
        log.debug("Parsed sheet {}: {}", sheetId, sheet);
        return sheet;
    }

    // --- lib_symbols ---

    private Map<String, LibSymbol> parseLibSymbols(SNode.SList list) {
        Map<String, LibSymbol> symbols = new LinkedHashMap<>();
        for (SNode.SList symbol : list.children("symbol")) {
            String libId = symbol.atom(1);
            if (libId.isEmpty()) continue;

            boolean power = symbol.child("power").isPresent();
            List<PinDefinition> pins = new ArrayList<>(parsePins(symbol, 0));
            for (SNode.SList unitSymbol : symbol.children("symbol")) {
                pins.addAll(parsePins(unitSymbol, unitOf(unitSymbol.atom(1))));
            }
            symbols.put(libId, new LibSymbol(libId, power, pins));
        }
        return symbols;
    }

    private List<PinDefinition> parsePins(SNode.SList symbol, int unit) {
        List<PinDefinition> pins = new ArrayList<>();
        for (SNode.SList pin : symbol.children("pin")) {
            String number = pin.child("number").map(n -> n.atom(1)).orElse("");
            String name = pin.child("name").map(n -> n.atom(1)).orElse("");
            Optional<double[]> at = pin.child("at").flatMap(KicadSchematicParser::parseAt);
            if (number.isEmpty() || at.isEmpty()) {
                log.debug("Skipping library pin without number or position in {}", symbol.atom(1));
                continue;
            }
            double[] xyz = at.get();
            pins.add(new PinDefinition(number, name, new Coordinate(xyz[0], xyz[1]), xyz[2], unit));
        }
        return pins;
    }

    /**
     * Unit number from a nested unit symbol name: "Battery_1_1" is unit 1, "Battery_0_1" is common.
     */
    static int unitOf(String unitSymbolName) {
        String[] parts = unitSymbolName.split("_");
        if (parts.length < 3) return 0;
        try {
            return Integer.parseInt(parts[parts.length - 2]);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    // --- wiring elements ---

    private Optional<WireFragment> parseWire(SNode.SList list, String sheetId, int ordinal) {
        List<SNode.SList> points = list.child("pts").map(pts -> pts.children("xy")).orElse(List.of());
        if (points.size() < 2) {
            log.debug("Skipping wire without two points on sheet {}", sheetId);
            return Optional.empty();
        }
        Optional<double[]> start = parseAt(points.get(0));
        Optional<double[]> end = parseAt(points.get(points.size() - 1));
        if (start.isEmpty() || end.isEmpty()) {
            log.debug("Skipping wire with unreadable points on sheet {}", sheetId);
            return Optional.empty();
        }
        String localId = uuidOf(list).orElse("wire-" + ordinal);
        return Optional.of(new WireFragment(sheetId, localId,
                new Coordinate(start.get()[0], start.get()[1]),
                new Coordinate(end.get()[0], end.get()[1])));
    }

    private Optional<Label> parseLabel(SNode.SList list, String sheetId) {
        String text = list.atom(1);
        Optional<double[]> at = list.child("at").flatMap(KicadSchematicParser::parseAt);
        if (text.isEmpty() || at.isEmpty()) {
            log.debug("Skipping label without text or position on sheet {}", sheetId);
            return Optional.empty();
        }
        return Optional.of(new Label(text, new Coordinate(at.get()[0], at.get()[1]), sheetId));
    }

    private Optional<Junction> parseJunction(SNode.SList list, String sheetId, int ordinal) {
        Optional<double[]> at = list.child("at").flatMap(KicadSchematicParser::parseAt);
        if (at.isEmpty()) {
            log.debug("Skipping junction without position on sheet {}", sheetId);
            return Optional.empty();
        }
        String localId = uuidOf(list).orElse("junction-" + ordinal);
        return Optional.of(new Junction(sheetId + ":junction:" + localId,
                new Coordinate(at.get()[0], at.get()[1]), sheetId));
    }

    private void parseSymbol(SNode.SList list, String sheetId, Map<String, LibSymbol> libSymbols,
                             List<ComponentInstance> components, List<PowerSymbol> powerSymbols) {
        String libId = list.child("lib_id").map(l -> l.atom(1)).orElse("");
        Optional<double[]> at = list.child("at").flatMap(KicadSchematicParser::parseAt);
        String ref = list.property("Reference").orElse("");
        if (libId.isEmpty() || at.isEmpty() || ref.isEmpty()) {
            log.debug("Skipping symbol without lib_id, position or reference on sheet {}", sheetId);
            return;
        }

        String mirror = list.child("mirror").map(m -> m.atom(1)).orElse("");
        int unit = list.child("unit").map(u -> parseInt(u.atom(1), 1)).orElse(1);
        String value = list.property("Value").orElse("");
        double[] xyz = at.get();
        ComponentInstance instance = new ComponentInstance(ref, libId, new Coordinate(xyz[0], xyz[1]),
                normalizeRotation(xyz[2]), "x".equals(mirror), "y".equals(mirror), unit, value, sheetId);

        LibSymbol definition = libSymbols.get(libId);
        boolean power = (definition != null && definition.power()) || libId.startsWith("power:");
        if (power) {
            if (POWER_FLAG_VALUE.equals(value) || value.isEmpty()) {
                log.debug("Ignoring power flag {} on sheet {}", ref, sheetId);
                return;
            }
            powerSymbols.add(new PowerSymbol(instance, value));
        } else if (ref.startsWith("#")) {
            log.debug("Ignoring virtual symbol {} on sheet {}", ref, sheetId);
        } else {
            components.add(instance);
        }
    }

    private Optional<SheetSymbol> parseSheet(SNode.SList list, String sheetId) {
        String uuid = uuidOf(list).orElse("");
        String name = list.property("Sheetname").or(() -> list.property("Sheet name")).orElse("");
        String file = list.property("Sheetfile").or(() -> list.property("Sheet file")).orElse("");
        if (file.isEmpty()) {
            log.debug("Skipping sheet symbol '{}' without a sheet file on sheet {}", name, sheetId);
            return Optional.empty();
        }

        List<SheetPin> pins = new ArrayList<>();
        for (SNode.SList pin : list.children("pin")) {
            String pinName = pin.atom(1);
            Optional<double[]> at = pin.child("at").flatMap(KicadSchematicParser::parseAt);
            if (pinName.isEmpty() || at.isEmpty()) continue;
            pins.add(new SheetPin(pinName, pin.atom(2), new Coordinate(at.get()[0], at.get()[1])));
        }
        return Optional.of(new SheetSymbol(uuid, name, file, pins, sheetId));
    }

    private Optional<HierarchicalLabel> parseHierarchicalLabel(SNode.SList list, String sheetId) {
        String name = list.atom(1);
        Optional<double[]> at = list.child("at").flatMap(KicadSchematicParser::parseAt);
        if (name.isEmpty() || at.isEmpty()) {
            log.debug("Skipping hierarchical label without name or position on sheet {}", sheetId);
            return Optional.empty();
        }
        String shape = list.child("shape").map(s -> s.atom(1)).orElse("");
        return Optional.of(new HierarchicalLabel(name, shape, new Coordinate(at.get()[0], at.get()[1]), sheetId));
    }

    // --- helpers ---

    /**
     * Reads {@code (at x y [angle])} or {@code (xy x y)}; the angle defaults to 0.
     */
    static Optional<double[]> parseAt(SNode.SList list) {
        try {
            double x = Double.parseDouble(list.atom(1));
            double y = Double.parseDouble(list.atom(2));
            String angle = list.atom(3);
            double a = angle.isEmpty() ? 0 : Double.parseDouble(angle);
            return Optional.of(new double[]{x, y, a});
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    static int normalizeRotation(double angle) {
        int rotation = (int) Math.round(angle / 90.0) * 90;
        rotation = ((rotation % 360) + 360) % 360;
        if (Math.abs(angle - Math.round(angle / 90.0) * 90.0) > 1e-6) {
            log.debug("Rotation {} is not a multiple of 90, using {}", angle, rotation);
        }
        return rotation;
    }

    private static Optional<String> uuidOf(SNode.SList list) {
        return list.child("uuid").map(u -> u.atom(1)).filter(s -> !s.isEmpty());
    }

    private static int parseInt(String value, int fallback) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
