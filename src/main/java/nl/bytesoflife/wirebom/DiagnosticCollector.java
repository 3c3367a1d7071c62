package nl.bytesoflife.wirebom;

import nl.bytesoflife.wirebom.model.DiagnosticKind;
import nl.bytesoflife.wirebom.model.Severity;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Accumulates diagnostics for one run. Severity follows the kind's category and the
 * configured mode.
 */
public class DiagnosticCollector {

    private final WireBomConfig config;
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final Set<String> implicated = new HashSet<>();

    public DiagnosticCollector(WireBomConfig config) {
        this.config = config;
    }

    public Diagnostic report(DiagnosticKind kind, String message, Collection<String> implicatedIds) {
        Diagnostic diagnostic = new Diagnostic(kind.severity(config.isStrictMode()), kind, message,
                new ArrayList<>(implicatedIds));
        diagnostics.add(diagnostic);
        implicated.addAll(implicatedIds);
        return diagnostic;
    }

    /**
     * True when some diagnostic already names the given id.
     */
    public boolean implicates(String id) {
        return implicated.contains(id);
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public List<Diagnostic> getErrors() {
        return diagnostics.stream()
                .filter(d -> d.getSeverity() == Severity.ERROR)
                .toList();
    }
}
