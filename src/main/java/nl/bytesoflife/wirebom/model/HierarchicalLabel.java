package nl.bytesoflife.wirebom.model;

import org.locationtech.jts.geom.Coordinate;

/**
 * Child-side named connection point matching a parent sheet pin of the same name.
 */
public record HierarchicalLabel(String name, String shape, Coordinate position, String sheetId) {
}
