package nl.bytesoflife.wirebom.model;

import org.locationtech.jts.geom.Coordinate;

public record SheetPin(String name, String direction, Coordinate position) {
}
