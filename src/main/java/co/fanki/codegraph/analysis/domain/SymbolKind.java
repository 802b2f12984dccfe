package co.fanki.codegraph.analysis.domain;

/**
 * The kind of a declared symbol stored as a node in the {@link CodeGraph}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum SymbolKind {

    /** A function declaration. */
    FUNCTION("function"),

    /** A class declaration. */
    CLASS("class"),

    /** A const, let or var declaration. */
    VARIABLE("variable");

    private final String wireName;

    SymbolKind(final String theWireName) {
        this.wireName = theWireName;
    }

    /**
     * Returns the lowercase name used in cache entries and query results.
     *
     * @return the wire name, e.g. "function"
     */
    public String wireName() {
        return wireName;
    }

    /**
     * Parses a wire name (case-insensitive) into a SymbolKind.
     *
     * @param value the value to parse, may be null
     * @return the matching kind, or null if the value is blank or unknown
     */
    public static SymbolKind fromString(final String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        final String normalized = value.trim();
        for (final SymbolKind kind : values()) {
            if (kind.wireName.equalsIgnoreCase(normalized)) {
                return kind;
            }
        }
        return null;
    }

}
