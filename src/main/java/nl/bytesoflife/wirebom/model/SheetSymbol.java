package nl.bytesoflife.wirebom.model;

import java.util.List;

/**
 * Parent-side reference to a sub-sheet, with its boundary pins.
 */
public record SheetSymbol(String uuid, String sheetName, String sheetFile, List<SheetPin> pins, String sheetId) {

    public SheetSymbol {
        pins = List.copyOf(pins);
    }
}
