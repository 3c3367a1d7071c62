package nl.bytesoflife.wirebom;

import nl.bytesoflife.wirebom.model.DiagnosticKind;
import nl.bytesoflife.wirebom.model.Severity;

import java.util.List;

public class Diagnostic {

    private final Severity severity;
    private final DiagnosticKind kind;
    private final String message;
    private final List<String> implicatedIds;

    public Diagnostic(Severity severity, DiagnosticKind kind, String message, List<String> implicatedIds) {
        this.severity = severity;
        this.kind = kind;
        this.message = message;
        this.implicatedIds = List.copyOf(implicatedIds);
    }

    public Severity getSeverity() { return severity; }
    public DiagnosticKind getKind() { return kind; }
    public String getMessage() { return message; }

    /** Fragment, label, pin or sheet identifiers this diagnostic is about. */
    public List<String> getImplicatedIds() { return implicatedIds; }

    @Override
    public String toString() {
        return "[" + severity + "] " + kind + ": " + message;
    }
}
