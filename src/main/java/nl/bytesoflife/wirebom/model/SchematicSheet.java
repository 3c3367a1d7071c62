package nl.bytesoflife.wirebom.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The typed elements of one schematic document. Every element carries this sheet's id.
 */
public class SchematicSheet {

    private final String id;
    private final String name;
    private final String file;
    private final List<WireFragment> wires;
    private final List<Label> labels;
    private final List<Junction> junctions;
    private final List<ComponentInstance> components;
    private final List<PowerSymbol> powerSymbols;
    private final List<SheetSymbol> sheetSymbols;
    private final List<HierarchicalLabel> hierarchicalLabels;
    private final Map<String, LibSymbol> libSymbols;

    public SchematicSheet(String id, String name, String file,
                          List<WireFragment> wires, List<Label> labels, List<Junction> junctions,
                          List<ComponentInstance> components, List<PowerSymbol> powerSymbols,
                          List<SheetSymbol> sheetSymbols, List<HierarchicalLabel> hierarchicalLabels,
                          Map<String, LibSymbol> libSymbols) {
        this.id = id;
        this.name = name;
        this.file = file;
        this.wires = List.copyOf(wires);
        this.labels = List.copyOf(labels);
        this.junctions = List.copyOf(junctions);
        this.components = List.copyOf(components);
        this.powerSymbols = List.copyOf(powerSymbols);
        this.sheetSymbols = List.copyOf(sheetSymbols);
        this.hierarchicalLabels = List.copyOf(hierarchicalLabels);
        this.libSymbols = Collections.unmodifiableMap(new LinkedHashMap<>(libSymbols));
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public String getFile() { return file; }
    public List<WireFragment> getWires() { return wires; }
    public List<Label> getLabels() { return labels; }
    public List<Junction> getJunctions() { return junctions; }
    public List<ComponentInstance> getComponents() { return components; }
    public List<PowerSymbol> getPowerSymbols() { return powerSymbols; }
    public List<SheetSymbol> getSheetSymbols() { return sheetSymbols; }
    public List<HierarchicalLabel> getHierarchicalLabels() { return hierarchicalLabels; }
    public Map<String, LibSymbol> getLibSymbols() { return libSymbols; }

    @Override
    public String toString() {
        return "SchematicSheet{id='" + id + "', wires=" + wires.size() + ", labels=" + labels.size()
                + ", junctions=" + junctions.size() + ", components=" + components.size()
                + ", sheets=" + sheetSymbols.size() + "}";
    }
}
