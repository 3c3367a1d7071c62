package nl.bytesoflife.wirebom.geometry;

import nl.bytesoflife.wirebom.model.ComponentInstance;
import nl.bytesoflife.wirebom.model.LibSymbol;
import nl.bytesoflife.wirebom.model.Pin;
import nl.bytesoflife.wirebom.model.PinDefinition;
import org.locationtech.jts.geom.Coordinate;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Places library pins on the schematic: mirror, then rotate by the cardinal angle,
 * then translate by the instance position.
 */
public class PinResolver {

    private final SymbolLibrary library;

    public PinResolver(SymbolLibrary library) {
        this.library = library;
    }

    public static Coordinate resolve(PinDefinition definition, ComponentInstance instance) {
        double x = definition.position().x;
        double y = definition.position().y;
        if (instance.mirrorX()) x = -x;
        if (instance.mirrorY()) y = -y;

        double rx;
        double ry;
        switch (instance.rotation()) {
            case 90 -> {
                rx = -y;
                ry = x;
            }
            case 180 -> {
                rx = -x;
                ry = -y;
            }
            case 270 -> {
                rx = y;
                ry = -x;
            }
            default -> {
                rx = x;
                ry = y;
            }
        }
        return new Coordinate(instance.position().x + rx, instance.position().y + ry);
    }

    /**
     * Absolute pins of an instance, or empty when its lib id is not in the library.
     * Multi-unit symbols only contribute the common pins and the pins of the placed unit.
     */
    public Optional<List<Pin>> resolvePins(ComponentInstance instance) {
        Optional<LibSymbol> symbol = library.lookup(instance.libId());
        if (symbol.isEmpty()) {
            return Optional.empty();
        }
        List<Pin> pins = new ArrayList<>();
        for (PinDefinition definition : symbol.get().pins()) {
            if (definition.unit() != 0 && definition.unit() != instance.unit()) continue;
            pins.add(new Pin(instance.ref(), definition.number(), resolve(definition, instance),
                    instance.sheetId()));
        }
        return Optional.of(pins);
    }
}
