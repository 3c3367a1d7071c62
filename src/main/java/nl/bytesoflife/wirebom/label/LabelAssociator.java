package nl.bytesoflife.wirebom.label;

import nl.bytesoflife.wirebom.DiagnosticCollector;
import nl.bytesoflife.wirebom.WireBomConfig;
import nl.bytesoflife.wirebom.geometry.SegmentIndex;
import nl.bytesoflife.wirebom.model.CircuitId;
import nl.bytesoflife.wirebom.model.DiagnosticKind;
import nl.bytesoflife.wirebom.model.Label;
import nl.bytesoflife.wirebom.model.WireFragment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Attaches each label to the nearest wire fragment on its own sheet. Text matching the
 * circuit-id grammar becomes a circuit id of the fragment, anything else becomes a note.
 * A label with {@code |} is split and every token is classified on its own.
 */
public class LabelAssociator {

    private static final Logger log = LoggerFactory.getLogger(LabelAssociator.class);

    /** Distances closer than this are treated as equal. */
    static final double TIE_EPSILON = 1e-9;

    private final WireBomConfig config;
    private final DiagnosticCollector diagnostics;

    public LabelAssociator(WireBomConfig config, DiagnosticCollector diagnostics) {
        this.config = config;
        this.diagnostics = diagnostics;
    }

    public void associate(List<WireFragment> fragments, List<Label> labels) {
        Map<String, List<WireFragment>> fragmentsBySheet = new LinkedHashMap<>();
        for (WireFragment fragment : fragments) {
            fragmentsBySheet.computeIfAbsent(fragment.getSheetId(), k -> new ArrayList<>()).add(fragment);
        }
        Map<String, SegmentIndex> indexes = new LinkedHashMap<>();
        fragmentsBySheet.forEach((sheetId, sheetFragments) -> indexes.put(sheetId, new SegmentIndex(sheetFragments)));

        boolean anyCircuitLabel = false;
        int assigned = 0;
        for (Label label : labels) {
            ParsedLabel parsed = ParsedLabel.of(label.text());
            if (parsed.isEmpty()) continue;
            anyCircuitLabel |= !parsed.circuitIds().isEmpty();

            SegmentIndex index = indexes.get(label.sheetId());
            List<SegmentIndex.Neighbor> neighbors = index == null
                    ? List.of()
                    : index.queryWithin(label.position(), config.getLabelThreshold());
            if (neighbors.isEmpty()) {
                diagnostics.report(DiagnosticKind.ORPHANED_LABEL,
                        String.format(Locale.US, "Label '%s' at (%.2f, %.2f) on sheet %s is not within %.2f of any wire",
                                label.text(), label.position().x, label.position().y, label.sheetId(),
                                config.getLabelThreshold()),
                        List.of(labelId(label)));
                continue;
            }

            WireFragment target = pickNearest(label, neighbors);
            if (apply(label, parsed, target)) {
                assigned++;
            }
        }

        if (!anyCircuitLabel) {
            diagnostics.report(DiagnosticKind.NO_CIRCUIT_LABELS,
                    "No label in the schematic matches the circuit id format (e.g. P1A, L-105-B)", List.of());
        }
        log.info("Associated {} of {} labels with {} wire fragments", assigned, labels.size(), fragments.size());
    }

    private WireFragment pickNearest(Label label, List<SegmentIndex.Neighbor> neighbors) {
        double best = neighbors.get(0).distance();
        List<WireFragment> tied = neighbors.stream()
                .filter(n -> n.distance() - best < TIE_EPSILON)
                .map(SegmentIndex.Neighbor::fragment)
                .sorted(Comparator.comparing(WireFragment::getId))
                .toList();
        WireFragment winner = tied.get(0);
        if (tied.size() > 1) {
            List<String> ids = new ArrayList<>();
            ids.add(labelId(label));
            tied.forEach(f -> ids.add(f.getId()));
            diagnostics.report(DiagnosticKind.EQUIDISTANT_LABEL,
                    String.format(Locale.US, "Label '%s' on sheet %s is equally close (%.3f) to %d wires, assigned to %s",
                            label.text(), label.sheetId(), best, tied.size(), winner.getId()),
                    ids);
        }
        return winner;
    }

    /**
     * Returns false when the label was rejected as ambiguous.
     */
    private boolean apply(Label label, ParsedLabel parsed, WireFragment target) {
        if (!parsed.circuitIds().isEmpty()) {
            if (target.hasCircuitId()) {
                diagnostics.report(DiagnosticKind.AMBIGUOUS_LABEL,
                        "Wire " + target.getId() + " already carries " + target.getCircuitIds()
                                + ", ignoring second circuit label '" + label.text() + "'",
                        List.of(target.getId(), labelId(label)));
                return false;
            }
            target.addCircuitIds(parsed.circuitIds());
            log.debug("Label '{}' -> {}", label.text(), target.getId());
        }
        for (String note : parsed.notes()) {
            target.addNote(note);
        }
        return true;
    }

    private static String labelId(Label label) {
        return label.sheetId() + ":label:" + label.text();
    }

    /**
     * Label text split into circuit ids and free-form notes.
     */
    record ParsedLabel(List<CircuitId> circuitIds, List<String> notes) {

        static ParsedLabel of(String text) {
            List<CircuitId> ids = new ArrayList<>();
            List<String> notes = new ArrayList<>();
            for (String token : text.split("\\|")) {
                String trimmed = token.trim();
                if (trimmed.isEmpty()) continue;
                CircuitId.parse(trimmed).ifPresentOrElse(ids::add, () -> notes.add(trimmed));
            }
            return new ParsedLabel(ids, notes);
        }

        boolean isEmpty() {
            return circuitIds.isEmpty() && notes.isEmpty();
        }
    }
}
