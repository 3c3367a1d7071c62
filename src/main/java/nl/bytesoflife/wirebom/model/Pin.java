package nl.bytesoflife.wirebom.model;

import org.locationtech.jts.geom.Coordinate;

/**
 * A component pin at its absolute schematic position.
 */
public record Pin(String componentRef, String number, Coordinate position, String sheetId) {

    public String key() {
        return componentRef + "-" + number;
    }
}
