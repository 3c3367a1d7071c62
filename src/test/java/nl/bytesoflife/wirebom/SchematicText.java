package nl.bytesoflife.wirebom;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Builds small {@code .kicad_sch} documents for tests. Library symbols used by placed
 * symbols are embedded automatically.
 * <ul>
 *     <li>{@code Test:Switch}, {@code Test:Lamp}: pin 1 at (-5.08, 0), pin 2 at (5.08, 0)</li>
 *     <li>{@code Test:Conn3}: pins 1, 2, 3 at (-5.08, 2.54), (-5.08, 0), (-5.08, -2.54)</li>
 *     <li>{@code Test:Terminal}: pin 1 at the origin</li>
 *     <li>{@code Test:Battery}: pin 1 at (0, 5.08), pin 2 at (0, -5.08)</li>
 *     <li>{@code power:GND}, {@code power:+12V}: power symbols with one pin at the origin</li>
 * </ul>
 */
public final class SchematicText {

    private static final Map<String, double[][]> PIN_LAYOUTS = new LinkedHashMap<>();

    static {
        PIN_LAYOUTS.put("Test:Switch", new double[][]{{1, -5.08, 0}, {2, 5.08, 0}});
        PIN_LAYOUTS.put("Test:Lamp", new double[][]{{1, -5.08, 0}, {2, 5.08, 0}});
        PIN_LAYOUTS.put("Test:Conn3", new double[][]{{1, -5.08, 2.54}, {2, -5.08, 0}, {3, -5.08, -2.54}});
        PIN_LAYOUTS.put("Test:Terminal", new double[][]{{1, 0, 0}});
        PIN_LAYOUTS.put("Test:Battery", new double[][]{{1, 0, 5.08}, {2, 0, -5.08}});
        PIN_LAYOUTS.put("power:GND", new double[][]{{1, 0, 0}});
        PIN_LAYOUTS.put("power:+12V", new double[][]{{1, 0, 0}});
    }

    private final StringBuilder body = new StringBuilder();
    private final Set<String> usedLibs = new LinkedHashSet<>();
    private int wireCount = 0;
    private int junctionCount = 0;

    public static SchematicText sheet() {
        return new SchematicText();
    }

    public SchematicText wire(double x1, double y1, double x2, double y2) {
        wireCount++;
        body.append(String.format(Locale.US,
                "  (wire (pts (xy %s %s) (xy %s %s))%n    (stroke (width 0) (type default))%n    (uuid \"w%d\")%n  )%n",
                num(x1), num(y1), num(x2), num(y2), wireCount));
        return this;
    }

    public SchematicText label(String text, double x, double y) {
        body.append(String.format(Locale.US,
                "  (label \"%s\" (at %s %s 0) (fields_autoplaced)%n    (effects (font (size 1.27 1.27)) (justify left bottom))%n    (uuid \"l-%s\")%n  )%n",
                text, num(x), num(y), text));
        return this;
    }

    public SchematicText junction(double x, double y) {
        junctionCount++;
        body.append(String.format(Locale.US,
                "  (junction (at %s %s) (diameter 0) (color 0 0 0 0)%n    (uuid \"j%d\")%n  )%n",
                num(x), num(y), junctionCount));
        return this;
    }

    public SchematicText symbol(String libId, String ref, double x, double y) {
        return symbol(libId, ref, x, y, 0);
    }

    public SchematicText symbol(String libId, String ref, double x, double y, int rotation) {
        usedLibs.add(libId);
        String value = libId.substring(libId.indexOf(':') + 1);
        body.append(String.format(Locale.US,
                "  (symbol (lib_id \"%s\") (at %s %s %d) (unit 1)%n    (in_bom yes) (on_board yes) (dnp no)%n    (uuid \"s-%s\")%n"
                        + "    (property \"Reference\" \"%s\" (at %s %s 0))%n    (property \"Value\" \"%s\" (at %s %s 0))%n  )%n",
                libId, num(x), num(y), rotation, ref, ref, num(x), num(y), value, num(x), num(y)));
        return this;
    }

    public SchematicText power(String net, String ref, double x, double y) {
        return symbol("power:" + net, ref, x, y);
    }

    public SchematicText sheetSymbol(String name, String file, String pinName, double pinX, double pinY) {
        body.append(String.format(Locale.US,
                "  (sheet (at %s %s) (size 20 10)%n    (uuid \"sheet-%s\")%n"
                        + "    (property \"Sheetname\" \"%s\" (at 0 0 0))%n    (property \"Sheetfile\" \"%s\" (at 0 0 0))%n"
                        + "    (pin \"%s\" input (at %s %s 0)%n      (uuid \"sp-%s\")%n    )%n  )%n",
                num(pinX), num(pinY - 5), name, name, file, pinName, num(pinX), num(pinY), pinName));
        return this;
    }

    public SchematicText hierarchicalLabel(String name, double x, double y) {
        body.append(String.format(Locale.US,
                "  (hierarchical_label \"%s\" (shape input) (at %s %s 180)%n    (uuid \"hl-%s\")%n  )%n",
                name, num(x), num(y), name));
        return this;
    }

    public String build() {
        StringBuilder sb = new StringBuilder();
        sb.append("(kicad_sch (version 20231120) (generator \"eeschema\")\n");
        sb.append("  (uuid \"00000000-0000-0000-0000-000000000001\")\n");
        sb.append("  (paper \"A4\")\n");
        sb.append("  (lib_symbols\n");
        for (String libId : usedLibs) {
            sb.append(libSymbol(libId));
        }
        sb.append("  )\n");
        sb.append(body);
        sb.append(")\n");
        return sb.toString();
    }

    private static String libSymbol(String libId) {
        double[][] pins = PIN_LAYOUTS.get(libId);
        if (pins == null) {
            throw new IllegalArgumentException("No test layout for " + libId);
        }
        String name = libId.substring(libId.indexOf(':') + 1);
        boolean power = libId.startsWith("power:");
        StringBuilder sb = new StringBuilder();
        sb.append("    (symbol \"").append(libId).append("\"").append(power ? " (power)" : "")
          .append(" (in_bom yes) (on_board yes)\n");
        sb.append("      (symbol \"").append(name).append("_0_1\"\n");
        sb.append("        (rectangle (start -2.54 1.27) (end 2.54 -1.27) (stroke (width 0) (type default)) (fill (type none)))\n");
        sb.append("      )\n");
        sb.append("      (symbol \"").append(name).append("_1_1\"\n");
        for (double[] pin : pins) {
            String number = String.valueOf((int) pin[0]);
            sb.append(String.format(Locale.US,
                    "        (pin %s line (at %s %s 0) (length 2.54)%n          (name \"~\" (effects (font (size 1.27 1.27))))%n"
                            + "          (number \"%s\" (effects (font (size 1.27 1.27))))%n        )%n",
                    power ? "power_in" : "passive", num(pin[1]), num(pin[2]), number));
        }
        sb.append("      )\n");
        sb.append("    )\n");
        return sb.toString();
    }

    private static String num(double value) {
        return String.format(Locale.US, "%.2f", value);
    }
}
