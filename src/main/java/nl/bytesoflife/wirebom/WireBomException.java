package nl.bytesoflife.wirebom;

import java.util.List;

/**
 * Raised in strict mode when a run produced error diagnostics. No partial output is returned.
 */
public class WireBomException extends RuntimeException {

    private final List<Diagnostic> errors;

    public WireBomException(List<Diagnostic> errors) {
        super(buildMessage(errors));
        this.errors = List.copyOf(errors);
    }

    public List<Diagnostic> getErrors() {
        return errors;
    }

    private static String buildMessage(List<Diagnostic> errors) {
        StringBuilder sb = new StringBuilder();
        sb.append(errors.size()).append(" error(s) in schematic:");
        for (Diagnostic error : errors) {
            sb.append("\n  - ").append(error);
        }
        return sb.toString();
    }
}
