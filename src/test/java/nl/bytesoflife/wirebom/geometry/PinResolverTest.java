package nl.bytesoflife.wirebom.geometry;

import nl.bytesoflife.wirebom.model.ComponentInstance;
import nl.bytesoflife.wirebom.model.LibSymbol;
import nl.bytesoflife.wirebom.model.Pin;
import nl.bytesoflife.wirebom.model.PinDefinition;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.locationtech.jts.geom.Coordinate;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PinResolverTest {

    private static final double EPS = 1e-9;

    private static ComponentInstance instance(double x, double y, int rotation, boolean mirrorX, boolean mirrorY) {
        return new ComponentInstance("SW1", "Test:Switch", new Coordinate(x, y), rotation,
                mirrorX, mirrorY, 1, "Switch", "root");
    }

    private static PinDefinition pin(String number, double x, double y) {
        return new PinDefinition(number, "", new Coordinate(x, y), 0, 1);
    }

    @ParameterizedTest
    @CsvSource({
            "0,   6.35,  0",
            "90,  0,     6.35",
            "180, -6.35, 0",
            "270, 0,     -6.35"
    })
    void rotatesCardinalAngles(int rotation, double expectedX, double expectedY) {
        Coordinate resolved = PinResolver.resolve(pin("2", 6.35, 0), instance(0, 0, rotation, false, false));
        assertEquals(expectedX, resolved.x, EPS);
        assertEquals(expectedY, resolved.y, EPS);
    }

    @Test
    void translatesAfterRotation() {
        Coordinate resolved = PinResolver.resolve(pin("1", -6.35, 0), instance(100, 50, 90, false, false));
        assertEquals(100.0, resolved.x, EPS);
        assertEquals(43.65, resolved.y, EPS);
    }

    @Test
    void negativePinAtHalfTurn() {
        Coordinate resolved = PinResolver.resolve(pin("1", -6.35, 0), instance(10, 10, 180, false, false));
        assertEquals(16.35, resolved.x, EPS);
        assertEquals(10.0, resolved.y, EPS);
    }

    @Test
    void mirrorIsAppliedBeforeRotation() {
        // mirror x: (6.35, 2) -> (-6.35, 2), then 90 degrees -> (-2, -6.35)
        Coordinate mirrored = PinResolver.resolve(pin("1", 6.35, 2), instance(0, 0, 90, true, false));
        assertEquals(-2.0, mirrored.x, EPS);
        assertEquals(-6.35, mirrored.y, EPS);

        Coordinate mirroredY = PinResolver.resolve(pin("1", 6.35, 2), instance(0, 0, 0, false, true));
        assertEquals(6.35, mirroredY.x, EPS);
        assertEquals(-2.0, mirroredY.y, EPS);
    }

    @Test
    void resolvesOnlyCommonAndPlacedUnitPins() {
        SymbolLibrary library = new SymbolLibrary().register(new LibSymbol("Test:Dual", false, List.of(
                new PinDefinition("1", "A", new Coordinate(-5, 0), 0, 1),
                new PinDefinition("2", "B", new Coordinate(5, 0), 0, 2),
                new PinDefinition("3", "SHIELD", new Coordinate(0, 5), 0, 0))));
        ComponentInstance unitTwo = new ComponentInstance("K1", "Test:Dual", new Coordinate(10, 10), 0,
                false, false, 2, "Dual", "root");

        List<Pin> pins = new PinResolver(library).resolvePins(unitTwo).orElseThrow();
        assertEquals(List.of("2", "3"), pins.stream().map(Pin::number).toList());
        assertEquals("K1-2", pins.get(0).key());
        assertEquals(15.0, pins.get(0).position().x, EPS);
    }

    @Test
    void unknownLibraryIdResolvesToNothing() {
        PinResolver resolver = new PinResolver(new SymbolLibrary());
        assertTrue(resolver.resolvePins(instance(0, 0, 0, false, false)).isEmpty());
    }

    @Test
    void firstLibraryDefinitionWins() {
        SymbolLibrary library = new SymbolLibrary()
                .register(new LibSymbol("Test:Switch", false, List.of(pin("1", 1, 0))))
                .register(new LibSymbol("Test:Switch", false, List.of(pin("1", 2, 0), pin("2", 3, 0))));
        assertEquals(1, library.size());
        assertEquals(1, library.lookup("Test:Switch").orElseThrow().pins().size());
    }
}
