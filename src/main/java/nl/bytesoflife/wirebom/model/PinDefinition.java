package nl.bytesoflife.wirebom.model;

import org.locationtech.jts.geom.Coordinate;

/**
 * A pin of a library symbol, relative to the symbol origin. Unit 0 pins belong to every unit.
 */
public record PinDefinition(String number, String name, Coordinate position, double angle, int unit) {
}
