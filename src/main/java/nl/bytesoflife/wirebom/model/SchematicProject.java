package nl.bytesoflife.wirebom.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A root sheet plus the sub-sheets it references, one level deep.
 */
public class SchematicProject {

    public static final String ROOT_SHEET_ID = "root";

    private final SchematicSheet root;
    private final Map<String, SchematicSheet> children = new LinkedHashMap<>();
    private final Map<String, SheetSymbol> parentSymbols = new LinkedHashMap<>();
    private final List<SkippedSheet> skippedSheets = new ArrayList<>();

    public SchematicProject(SchematicSheet root) {
        this.root = root;
    }

    public SchematicProject addChild(SheetSymbol parentSymbol, SchematicSheet child) {
        children.put(child.getId(), child);
        parentSymbols.put(child.getId(), parentSymbol);
        return this;
    }

    public SchematicProject addSkippedSheet(SkippedSheet skipped) {
        skippedSheets.add(skipped);
        return this;
    }

    public SchematicSheet getRoot() {
        return root;
    }

    public Map<String, SchematicSheet> getChildren() {
        return Collections.unmodifiableMap(children);
    }

    /**
     * The sheet symbol on the root sheet that instantiates the given child sheet.
     */
    public Optional<SheetSymbol> getParentSymbol(String childSheetId) {
        return Optional.ofNullable(parentSymbols.get(childSheetId));
    }

    public List<SkippedSheet> getSkippedSheets() {
        return Collections.unmodifiableList(skippedSheets);
    }

    /**
     * Root sheet first, then children in the order they were referenced.
     */
    public List<SchematicSheet> getSheets() {
        List<SchematicSheet> sheets = new ArrayList<>();
        sheets.add(root);
        sheets.addAll(children.values());
        return sheets;
    }

    public Optional<SchematicSheet> getSheet(String sheetId) {
        if (root.getId().equals(sheetId)) return Optional.of(root);
        return Optional.ofNullable(children.get(sheetId));
    }

    public String sheetName(String sheetId) {
        return getSheet(sheetId).map(SchematicSheet::getName).orElse(sheetId);
    }

    public List<WireFragment> getWires() {
        List<WireFragment> wires = new ArrayList<>();
        for (SchematicSheet sheet : getSheets()) {
            wires.addAll(sheet.getWires());
        }
        return wires;
    }

    public List<Label> getLabels() {
        List<Label> labels = new ArrayList<>();
        for (SchematicSheet sheet : getSheets()) {
            labels.addAll(sheet.getLabels());
        }
        return labels;
    }
}
