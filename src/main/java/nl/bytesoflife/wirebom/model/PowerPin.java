package nl.bytesoflife.wirebom.model;

import org.locationtech.jts.geom.Coordinate;

/**
 * The connection point of a power symbol at its absolute schematic position.
 */
public record PowerPin(String ref, String netName, Coordinate position, String sheetId) {
}
