package nl.bytesoflife.wirebom.model;

import java.util.List;

public record LibSymbol(String libId, boolean power, List<PinDefinition> pins) {

    public LibSymbol {
        pins = List.copyOf(pins);
    }
}
