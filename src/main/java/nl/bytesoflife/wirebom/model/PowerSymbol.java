package nl.bytesoflife.wirebom.model;

/**
 * A power port (GND, +12V, ...). Every power symbol with the same net name is one net,
 * on every sheet.
 */
public record PowerSymbol(ComponentInstance instance, String netName) {
}
