package nl.bytesoflife.wirebom;

import nl.bytesoflife.wirebom.model.DiagnosticKind;
import nl.bytesoflife.wirebom.model.Severity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class WireBomReport {

    private final List<ConnectionRecord> records = new ArrayList<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public void addRecord(ConnectionRecord record) {
        records.add(record);
    }

    public void addDiagnostic(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    public List<ConnectionRecord> getRecords() {
        return Collections.unmodifiableList(records);
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public List<Diagnostic> getDiagnostics(DiagnosticKind kind) {
        return diagnostics.stream()
                .filter(d -> d.getKind() == kind)
                .toList();
    }

    public List<Diagnostic> getErrors() {
        return diagnostics.stream()
                .filter(d -> d.getSeverity() == Severity.ERROR)
                .toList();
    }

    public List<Diagnostic> getWarnings() {
        return diagnostics.stream()
                .filter(d -> d.getSeverity() == Severity.WARNING)
                .toList();
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.getSeverity() == Severity.ERROR);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Wire BOM Report:\n");
        sb.append("  Records: ").append(records.size()).append("\n");
        for (ConnectionRecord r : records) {
            sb.append("  - ").append(r).append("\n");
        }
        sb.append("  Diagnostics: ").append(diagnostics.size())
          .append(" (").append(getErrors().size()).append(" errors, ")
          .append(getWarnings().size()).append(" warnings)\n");
        for (Diagnostic d : diagnostics) {
            sb.append("  - ").append(d).append("\n");
        }
        return sb.toString();
    }
}
