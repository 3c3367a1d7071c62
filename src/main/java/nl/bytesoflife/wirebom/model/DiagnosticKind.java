package nl.bytesoflife.wirebom.model;

public enum DiagnosticKind {
    ORPHANED_LABEL(Category.ASSOCIATION),
    AMBIGUOUS_LABEL(Category.ASSOCIATION),
    EQUIDISTANT_LABEL(Category.ASSOCIATION),
    UNLABELED_FRAGMENT(Category.ASSOCIATION),
    NO_CIRCUIT_LABELS(Category.ASSOCIATION),

    UNTERMINATED_WIRE(Category.RESOLUTION),
    UNKNOWN_SYMBOL(Category.RESOLUTION),
    UNMATCHED_SHEET_PIN(Category.RESOLUTION),
    IGNORED_SHEET(Category.RESOLUTION),

    MULTIPOINT_LABEL_COUNT(Category.MULTIPOINT),
    MULTIPOINT_COMMON_PIN(Category.MULTIPOINT),

    DUPLICATE_CIRCUIT(Category.DUPLICATE);

    private final Category category;

    DiagnosticKind(Category category) {
        this.category = category;
    }

    public Category getCategory() {
        return category;
    }

    /**
     * Severity of this kind under the given mode. Association problems never abort a run.
     */
    public Severity severity(boolean strictMode) {
        if (strictMode && category.isPromotedInStrictMode()) {
            return Severity.ERROR;
        }
        return Severity.WARNING;
    }

    public enum Category {
        ASSOCIATION(false),
        RESOLUTION(true),
        MULTIPOINT(true),
        DUPLICATE(true);

        private final boolean promotedInStrictMode;

        Category(boolean promotedInStrictMode) {
            this.promotedInStrictMode = promotedInStrictMode;
        }

        public boolean isPromotedInStrictMode() {
            return promotedInStrictMode;
        }
    }
}
