package nl.bytesoflife.wirebom.model;

import org.locationtech.jts.geom.Coordinate;

/**
 * Free-floating text placed near a wire. Consumed by label association.
 */
public record Label(String text, Coordinate position, String sheetId) {
}
