package nl.bytesoflife.wirebom;

import nl.bytesoflife.wirebom.geometry.PinResolver;
import nl.bytesoflife.wirebom.geometry.SymbolLibrary;
import nl.bytesoflife.wirebom.graph.ConnectivityGraph;
import nl.bytesoflife.wirebom.graph.ConnectivityGraphBuilder;
import nl.bytesoflife.wirebom.label.LabelAssociator;
import nl.bytesoflife.wirebom.model.CircuitId;
import nl.bytesoflife.wirebom.model.ComponentInstance;
import nl.bytesoflife.wirebom.model.DiagnosticKind;
import nl.bytesoflife.wirebom.model.Pin;
import nl.bytesoflife.wirebom.model.PowerPin;
import nl.bytesoflife.wirebom.model.PowerSymbol;
import nl.bytesoflife.wirebom.model.SchematicProject;
import nl.bytesoflife.wirebom.model.SchematicSheet;
import nl.bytesoflife.wirebom.model.SkippedSheet;
import nl.bytesoflife.wirebom.model.WireFragment;
import nl.bytesoflife.wirebom.multipoint.MultipointDetector;
import nl.bytesoflife.wirebom.multipoint.MultipointGroup;
import nl.bytesoflife.wirebom.multipoint.MultipointResolver;
import nl.bytesoflife.wirebom.parser.SchematicLoader;
import nl.bytesoflife.wirebom.trace.ConnectionResolver;
import nl.bytesoflife.wirebom.validation.DuplicateCircuitValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Runs the whole pipeline on a loaded project: pin geometry, label association, graph
 * construction, multipoint and two-point resolution, duplicate validation.
 * <p>
 * Every run works on fresh copies of the wire fragments and its own symbol library, so
 * running twice on the same project gives the same report.
 */
public class WireBomRunner {

    private static final Logger log = LoggerFactory.getLogger(WireBomRunner.class);

    private final WireBomConfig config;

    public WireBomRunner() {
        this(WireBomConfig.defaults());
    }

    public WireBomRunner(WireBomConfig config) {
        this.config = config;
    }

    public WireBomConfig getConfig() {
        return config;
    }

    public WireBomReport run(Path rootFile) throws IOException {
        return run(new SchematicLoader().load(rootFile));
    }

    /**
     * @throws WireBomException in strict mode, when any stage reported an error
     */
    public WireBomReport run(SchematicProject project) {
        DiagnosticCollector diagnostics = new DiagnosticCollector(config);

        for (SkippedSheet skipped : project.getSkippedSheets()) {
            String reason = skipped.reason() == SkippedSheet.Reason.DUPLICATE_INSTANCE
                    ? "instantiates " + skipped.sheetFile() + " a second time"
                    : "is nested below sheet " + skipped.referencedFrom() + " (only one level is supported)";
            diagnostics.report(DiagnosticKind.IGNORED_SHEET,
                    "Sheet '" + skipped.sheetName() + "' " + reason + "; ignored",
                    List.of(skipped.sheetName(), skipped.sheetFile()));
        }

        SymbolLibrary library = new SymbolLibrary();
        project.getSheets().forEach(library::registerAll);
        PinResolver pinResolver = new PinResolver(library);
        List<Pin> pins = resolveComponentPins(project, pinResolver, diagnostics);
        List<PowerPin> powerPins = resolvePowerPins(project, pinResolver);

        List<WireFragment> fragments = project.getWires().stream()
                .map(WireFragment::new)
                .toList();
        new LabelAssociator(config, diagnostics).associate(fragments, project.getLabels());

        ConnectivityGraph graph = new ConnectivityGraphBuilder(config, diagnostics)
                .build(project, pins, powerPins, fragments);

        List<MultipointGroup> groups = new MultipointDetector(graph).detect();
        MultipointResolver.Result multipoint = new MultipointResolver(diagnostics).resolve(groups);
        ConnectionResolver.Result twoPoint = new ConnectionResolver(graph, config, diagnostics)
                .resolve(multipoint.consumedIds());

        new DuplicateCircuitValidator(graph, diagnostics).validate(project);

        List<ConnectionRecord> records = new ArrayList<>(multipoint.records());
        records.addAll(twoPoint.records());
        Set<String> covered = new HashSet<>(multipoint.coveredFragmentIds());
        covered.addAll(twoPoint.coveredFragmentIds());
        reportUncovered(fragments, records, covered, diagnostics);

        if (config.isStrictMode() && !diagnostics.getErrors().isEmpty()) {
            log.info("Rejecting schematic: {} error(s)", diagnostics.getErrors().size());
            throw new WireBomException(diagnostics.getErrors());
        }

        WireBomReport report = new WireBomReport();
        records.forEach(report::addRecord);
        diagnostics.getDiagnostics().forEach(report::addDiagnostic);
        log.info("Produced {} connection record(s), {} diagnostic(s)",
                records.size(), report.getDiagnostics().size());
        return report;
    }

    private List<Pin> resolveComponentPins(SchematicProject project, PinResolver pinResolver,
                                           DiagnosticCollector diagnostics) {
        List<Pin> pins = new ArrayList<>();
        for (SchematicSheet sheet : project.getSheets()) {
            for (ComponentInstance component : sheet.getComponents()) {
                Optional<List<Pin>> resolved = pinResolver.resolvePins(component);
                if (resolved.isPresent()) {
                    pins.addAll(resolved.get());
                } else {
                    diagnostics.report(DiagnosticKind.UNKNOWN_SYMBOL,
                            "Component " + component.ref() + " on sheet " + sheet.getName()
                                    + " uses unknown library symbol " + component.libId(),
                            List.of(component.ref(), component.libId()));
                }
            }
        }
        log.info("Resolved {} component pin(s), {} library symbol(s)", pins.size(),
                project.getSheets().stream().mapToInt(s -> s.getLibSymbols().size()).sum());
        return pins;
    }

    private List<PowerPin> resolvePowerPins(SchematicProject project, PinResolver pinResolver) {
        List<PowerPin> powerPins = new ArrayList<>();
        for (SchematicSheet sheet : project.getSheets()) {
            for (PowerSymbol power : sheet.getPowerSymbols()) {
                ComponentInstance instance = power.instance();
                List<Pin> resolved = pinResolver.resolvePins(instance).orElse(List.of());
                if (resolved.isEmpty()) {
                    log.debug("No pin layout for power symbol {}, using its origin", instance.ref());
                    powerPins.add(new PowerPin(instance.ref(), power.netName(), instance.position(), sheet.getId()));
                }
                for (Pin pin : resolved) {
                    powerPins.add(new PowerPin(instance.ref(), power.netName(), pin.position(), sheet.getId()));
                }
            }
        }
        return powerPins;
    }

    /**
     * Every fragment must end up in a record or be explained by a diagnostic.
     */
    private void reportUncovered(List<WireFragment> fragments, List<ConnectionRecord> records,
                                 Set<String> covered, DiagnosticCollector diagnostics) {
        Set<String> recordedIds = new HashSet<>();
        records.forEach(r -> recordedIds.add(r.circuitId()));
        for (WireFragment fragment : fragments) {
            if (covered.contains(fragment.getId()) || diagnostics.implicates(fragment.getId())) continue;
            boolean contributes = fragment.getCircuitIds().stream()
                    .map(CircuitId::text)
                    .anyMatch(recordedIds::contains);
            if (contributes) continue;
            diagnostics.report(DiagnosticKind.UNLABELED_FRAGMENT,
                    "Wire " + fragment.getId() + " on sheet " + fragment.getSheetId()
                            + " is not part of any connection record",
                    List.of(fragment.getId()));
        }
    }
}
