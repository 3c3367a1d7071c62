package nl.bytesoflife.wirebom.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class CircuitIdTest {

    @ParameterizedTest
    @ValueSource(strings = {"P1A", "L2B", "G1C", "P-1-A", "L-105-B", "L105B", "P1-A", "P-1A"})
    void acceptsCircuitIds(String text) {
        assertTrue(CircuitId.matches(text));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "p1a", "PA", "P1", "1A", "P1AB", "PP1A", "P--1-A", "GND", "L3B|L10A", "P 1 A"})
    void rejectsOtherText(String text) {
        assertFalse(CircuitId.matches(text));
    }

    @Test
    void parsesComponents() {
        CircuitId id = CircuitId.parse("L-105-B").orElseThrow();
        assertEquals("L", id.systemCode());
        assertEquals("105", id.circuitNumber());
        assertEquals("B", id.segmentLetter());
        assertEquals("L-105-B", id.toString());
    }

    @Test
    void parseTrimsWhitespace() {
        assertEquals("P4A", CircuitId.parse("  P4A ").orElseThrow().text());
        assertTrue(CircuitId.parse("nav light").isEmpty());
        assertTrue(CircuitId.parse(null).isEmpty());
    }

    @ParameterizedTest
    @ValueSource(strings = {" P1A", "P1A ", "\tL-105-B\n"})
    void matchesAgreesWithParseOnPaddedText(String text) {
        assertTrue(CircuitId.matches(text));
        assertTrue(CircuitId.parse(text).isPresent());
    }
}
