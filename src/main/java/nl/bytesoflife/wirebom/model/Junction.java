package nl.bytesoflife.wirebom.model;

import org.locationtech.jts.geom.Coordinate;

/**
 * Explicit marker that every wire endpoint at {@code position} is one electrical point.
 */
public record Junction(String id, Coordinate position, String sheetId) {
}
