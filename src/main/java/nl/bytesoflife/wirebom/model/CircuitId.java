package nl.bytesoflife.wirebom.model;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A wire circuit identifier such as {@code P1A} or {@code L-105-B}: one system letter,
 * the circuit number and one segment letter, optionally separated by dashes.
 */
public record CircuitId(String text, String systemCode, String circuitNumber, String segmentLetter) {

    private static final Pattern PATTERN = Pattern.compile("^([A-Z])-?(\\d+)-?([A-Z])$");

    public static boolean matches(String text) {
        return parse(text).isPresent();
    }

    public static Optional<CircuitId> parse(String text) {
        if (text == null) return Optional.empty();
        String trimmed = text.trim();
        Matcher m = PATTERN.matcher(trimmed);
        if (!m.matches()) {
            return Optional.empty();
        }
        return Optional.of(new CircuitId(trimmed, m.group(1), m.group(2), m.group(3)));
    }

    @Override
    public String toString() {
        return text;
    }
}
