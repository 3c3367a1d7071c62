package nl.bytesoflife.wirebom;

import java.util.List;

/**
 * One physical wire: a circuit id running from one component pin to another.
 * {@code uncertain} records are best-effort output of permissive mode; {@code warnings}
 * holds the messages that made them so.
 */
public record ConnectionRecord(String circuitId, String fromComponent, String fromPin,
                               String toComponent, String toPin, List<String> notes,
                               boolean uncertain, List<String> warnings) {

    public static final String UNKNOWN = "UNKNOWN";

    public ConnectionRecord {
        notes = List.copyOf(notes);
        warnings = List.copyOf(warnings);
    }

    public ConnectionRecord(String circuitId, String fromComponent, String fromPin,
                            String toComponent, String toPin, List<String> notes) {
        this(circuitId, fromComponent, fromPin, toComponent, toPin, notes, false, List.of());
    }

    @Override
    public String toString() {
        return circuitId + ": " + fromComponent + "-" + fromPin + " -> " + toComponent + "-" + toPin
                + (notes.isEmpty() ? "" : " " + notes)
                + (uncertain ? " (uncertain)" : "");
    }
}
