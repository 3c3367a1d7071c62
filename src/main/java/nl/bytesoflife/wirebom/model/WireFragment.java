package nl.bytesoflife.wirebom.model;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.LineSegment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One drawn wire segment between two schematic points. Geometry is fixed at
 * extraction; circuit ids and notes are added during label association.
 */
public class WireFragment {

    private final String id;
    private final String localId;
    private final String sheetId;
    private final Coordinate start;
    private final Coordinate end;
    private final List<CircuitId> circuitIds = new ArrayList<>();
    private final List<String> notes = new ArrayList<>();

    public WireFragment(String sheetId, String localId, Coordinate start, Coordinate end) {
        this.id = sheetId + ":wire:" + localId;
        this.localId = localId;
        this.sheetId = sheetId;
        this.start = new Coordinate(start);
        this.end = new Coordinate(end);
    }

    /**
     * Copies the geometry of another fragment without its annotations.
     */
    public WireFragment(WireFragment other) {
        this(other.sheetId, other.localId, other.start, other.end);
    }

    public String getId() { return id; }
    public String getLocalId() { return localId; }
    public String getSheetId() { return sheetId; }
    public Coordinate getStart() { return new Coordinate(start); }
    public Coordinate getEnd() { return new Coordinate(end); }

    public LineSegment toSegment() {
        return new LineSegment(start, end);
    }

    public List<CircuitId> getCircuitIds() {
        return Collections.unmodifiableList(circuitIds);
    }

    public boolean hasCircuitId() {
        return !circuitIds.isEmpty();
    }

    /**
     * True when a pipe label gave this fragment more than one circuit id.
     */
    public boolean isMultiCircuit() {
        return circuitIds.size() > 1;
    }

    public void addCircuitIds(List<CircuitId> ids) {
        for (CircuitId circuitId : ids) {
            if (!circuitIds.contains(circuitId)) {
                circuitIds.add(circuitId);
            }
        }
    }

    public List<String> getNotes() {
        return Collections.unmodifiableList(notes);
    }

    public void addNote(String note) {
        notes.add(note);
    }

    @Override
    public String toString() {
        return "WireFragment{" + id + " (" + start.x + ", " + start.y + ")-(" + end.x + ", " + end.y + ")"
                + (circuitIds.isEmpty() ? "" : ", circuits=" + circuitIds) + "}";
    }
}
