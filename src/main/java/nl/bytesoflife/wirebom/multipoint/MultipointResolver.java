package nl.bytesoflife.wirebom.multipoint;

import nl.bytesoflife.wirebom.ConnectionRecord;
import nl.bytesoflife.wirebom.DiagnosticCollector;
import nl.bytesoflife.wirebom.graph.GraphNode;
import nl.bytesoflife.wirebom.model.CircuitId;
import nl.bytesoflife.wirebom.model.DiagnosticKind;
import nl.bytesoflife.wirebom.model.WireFragment;
import nl.bytesoflife.wirebom.trace.ConnectionResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns multipoint groups into records. In a group of N pins, N-1 branch segments carry
 * circuit ids and the one unlabeled segment leads to the common pin; every branch id becomes
 * a record from its branch pin to the common pin.
 */
public class MultipointResolver {

    private static final Logger log = LoggerFactory.getLogger(MultipointResolver.class);

    private final DiagnosticCollector diagnostics;

    public MultipointResolver(DiagnosticCollector diagnostics) {
        this.diagnostics = diagnostics;
    }

    public Result resolve(List<MultipointGroup> groups) {
        List<ConnectionRecord> records = new ArrayList<>();
        Set<String> consumedIds = new LinkedHashSet<>();
        Set<String> coveredFragments = new LinkedHashSet<>();

        for (MultipointGroup group : groups) {
            records.addAll(resolveGroup(group));
            for (WireFragment fragment : group.fragments()) {
                coveredFragments.add(fragment.getId());
                fragment.getCircuitIds().forEach(id -> consumedIds.add(id.text()));
            }
        }

        log.info("Resolved {} multipoint connection(s) from {} group(s)", records.size(), groups.size());
        return new Result(records, consumedIds, coveredFragments);
    }

    List<ConnectionRecord> resolveGroup(MultipointGroup group) {
        List<String> problems = new ArrayList<>();
        List<String> implicated = implicatedIds(group);
        PinSegment common = findCommon(group, problems, implicated);

        List<PinSegment> branches = group.segments().stream()
                .filter(s -> s != common)
                .toList();

        Set<String> branchIds = new LinkedHashSet<>();
        branches.forEach(b -> branchIds.addAll(b.labels()));
        if (branchIds.size() != group.size() - 1) {
            problems.add(report(DiagnosticKind.MULTIPOINT_LABEL_COUNT,
                    "Multipoint group " + group.describe() + " has " + branchIds.size()
                            + " branch circuit id(s) " + branchIds + ", expected " + (group.size() - 1),
                    implicated));
        }

        for (WireFragment fragment : group.fragments()) {
            if (!fragment.isMultiCircuit()) continue;
            for (CircuitId token : fragment.getCircuitIds()) {
                long carriers = branches.stream().filter(b -> b.carries(token)).count();
                if (carriers != 1) {
                    problems.add(report(DiagnosticKind.MULTIPOINT_LABEL_COUNT,
                            "Pipe label token " + token + " on wire " + fragment.getId() + " matches "
                                    + carriers + " branch(es) of multipoint group " + group.describe()
                                    + ", expected 1",
                            implicated));
                }
            }
        }

        boolean uncertain = !problems.isEmpty();
        List<ConnectionRecord> records = new ArrayList<>();
        for (PinSegment branch : branches) {
            List<WireFragment> along = new ArrayList<>(branch.fragments());
            along.addAll(common.fragments());
            List<String> notes = ConnectionResolver.notesAlong(along);
            for (String circuitId : branch.labels()) {
                records.add(new ConnectionRecord(circuitId,
                        branch.pin().ref(), branch.pin().pinNumber(),
                        common.pin().ref(), common.pin().pinNumber(),
                        notes, uncertain, problems));
            }
        }
        return records;
    }

    private PinSegment findCommon(MultipointGroup group, List<String> problems, List<String> implicated) {
        List<PinSegment> unlabeled = group.segments().stream()
                .filter(s -> !s.isLabeled())
                .toList();
        if (unlabeled.size() == 1) {
            return unlabeled.get(0);
        }

        if (unlabeled.isEmpty()) {
            PinSegment guess = group.segments().stream()
                    .min(Comparator.comparingLong(PinSegment::labeledFragmentCount))
                    .orElseThrow();
            problems.add(report(DiagnosticKind.MULTIPOINT_COMMON_PIN,
                    "Multipoint group " + group.describe() + " has no unlabeled pin; guessing "
                            + guess.pin().key() + " as the common pin",
                    implicated));
            return guess;
        }

        PinSegment guess = unlabeled.get(0);
        problems.add(report(DiagnosticKind.MULTIPOINT_COMMON_PIN,
                "Multipoint group " + group.describe() + " has " + unlabeled.size()
                        + " unlabeled pins; guessing " + guess.pin().key() + " as the common pin",
                implicated));
        return guess;
    }

    private String report(DiagnosticKind kind, String message, List<String> implicated) {
        return diagnostics.report(kind, message, implicated).getMessage();
    }

    private static List<String> implicatedIds(MultipointGroup group) {
        List<String> ids = new ArrayList<>();
        group.pins().forEach(p -> ids.add(p.id()));
        group.fragments().forEach(f -> ids.add(f.getId()));
        return ids;
    }

    /**
     * @param consumedIds every circuit id seen inside a group; no two-point record is made for these
     */
    public record Result(List<ConnectionRecord> records, Set<String> consumedIds,
                         Set<String> coveredFragmentIds) {
    }
}
