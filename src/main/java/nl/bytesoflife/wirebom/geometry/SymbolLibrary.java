package nl.bytesoflife.wirebom.geometry;

import nl.bytesoflife.wirebom.model.LibSymbol;
import nl.bytesoflife.wirebom.model.SchematicSheet;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Library pin layouts keyed by lib id, owned by a single run.
 * When two sheets embed the same lib id, the first definition wins.
 */
public class SymbolLibrary {

    private final Map<String, LibSymbol> symbols = new LinkedHashMap<>();

    public SymbolLibrary register(LibSymbol symbol) {
        symbols.putIfAbsent(symbol.libId(), symbol);
        return this;
    }

    public SymbolLibrary registerAll(SchematicSheet sheet) {
        for (LibSymbol symbol : sheet.getLibSymbols().values()) {
            register(symbol);
        }
        return this;
    }

    public Optional<LibSymbol> lookup(String libId) {
        return Optional.ofNullable(symbols.get(libId));
    }

    public int size() {
        return symbols.size();
    }
}
