package nl.bytesoflife.wirebom.parser;

import nl.bytesoflife.wirebom.model.SchematicProject;
import nl.bytesoflife.wirebom.model.SchematicSheet;
import nl.bytesoflife.wirebom.model.SheetSymbol;
import nl.bytesoflife.wirebom.model.SkippedSheet;
import nl.bytesoflife.wirebom.parser.SExpressionParser.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;

/**
 * Loads a root schematic and the sub-sheets it references, one level deep.
 */
public class SchematicLoader {

    private static final Logger log = LoggerFactory.getLogger(SchematicLoader.class);

    private final KicadSchematicParser parser = new KicadSchematicParser();

    public SchematicProject load(Path rootFile) throws IOException {
        SchematicSheet root = parser.parse(read(rootFile), SchematicProject.ROOT_SHEET_ID,
                fileStem(rootFile), rootFile.getFileName().toString());
        SchematicProject project = new SchematicProject(root);

        Set<Path> loadedFiles = new HashSet<>();
        loadedFiles.add(rootFile.toAbsolutePath().normalize());
        Set<String> usedIds = new HashSet<>();
        usedIds.add(SchematicProject.ROOT_SHEET_ID);

        for (SheetSymbol symbol : root.getSheetSymbols()) {
            Path childFile = rootFile.resolveSibling(symbol.sheetFile());
            if (!loadedFiles.add(childFile.toAbsolutePath().normalize())) {
                log.debug("Sheet file {} is instantiated more than once, ignoring '{}'",
                        symbol.sheetFile(), symbol.sheetName());
                project.addSkippedSheet(new SkippedSheet(symbol.sheetName(), symbol.sheetFile(),
                        root.getId(), SkippedSheet.Reason.DUPLICATE_INSTANCE));
                continue;
            }

            String childId = childSheetId(symbol, usedIds);
            SchematicSheet child = parser.parse(read(childFile), childId,
                    symbol.sheetName().isEmpty() ? childId : symbol.sheetName(), symbol.sheetFile());
            project.addChild(symbol, child);

            for (SheetSymbol nested : child.getSheetSymbols()) {
                log.debug("Not following nested sheet '{}' in {}", nested.sheetName(), childId);
                project.addSkippedSheet(new SkippedSheet(nested.sheetName(), nested.sheetFile(),
                        childId, SkippedSheet.Reason.NESTED));
            }
        }

        log.info("Loaded {} with {} sub-sheet(s), {} skipped", rootFile.getFileName(),
                project.getChildren().size(), project.getSkippedSheets().size());
        return project;
    }

    /**
     * Loads a single in-memory sheet as the root of a project without children.
     */
    public SchematicProject parse(String content) {
        SchematicSheet root = parser.parse(content, SchematicProject.ROOT_SHEET_ID,
                SchematicProject.ROOT_SHEET_ID, "");
        return new SchematicProject(root);
    }

    private String childSheetId(SheetSymbol symbol, Set<String> usedIds) {
        String[] candidates = {symbol.sheetName(), symbol.uuid()};
        for (String candidate : candidates) {
            if (!candidate.isEmpty() && usedIds.add(candidate)) {
                return candidate;
            }
        }
        String fallback = "sheet-" + usedIds.size();
        usedIds.add(fallback);
        return fallback;
    }

    static String read(Path file) throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return decoder.decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException e) {
            throw new ParseException(file.getFileName() + " is not valid UTF-8", e);
        }
    }

    private static String fileStem(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
