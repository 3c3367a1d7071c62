package nl.bytesoflife.wirebom.model;

/**
 * A sheet reference the loader refused to follow.
 */
public record SkippedSheet(String sheetName, String sheetFile, String referencedFrom, Reason reason) {

    public enum Reason {
        /** The sheet file was already instantiated once in this project. */
        DUPLICATE_INSTANCE,
        /** The reference sits inside a sub-sheet; only one level is loaded. */
        NESTED
    }
}
