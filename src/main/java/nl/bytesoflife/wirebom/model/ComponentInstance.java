package nl.bytesoflife.wirebom.model;

import org.locationtech.jts.geom.Coordinate;

/**
 * A placed symbol. {@code rotation} is always one of 0, 90, 180 or 270.
 */
public record ComponentInstance(String ref, String libId, Coordinate position, int rotation,
                                boolean mirrorX, boolean mirrorY, int unit, String value,
                                String sheetId) {
}
