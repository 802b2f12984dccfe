package co.fanki.codegraph.analysis.domain;

/**
 * The relationship carried by an {@link Edge}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum EdgeType {

    /** An import site refers to a declaration in another file. */
    IMPORTS("imports"),

    /** A call site possibly targets a function declaration. */
    CALLS("calls"),

    /** A class declaration extends another class declaration. */
    EXTENDS("extends");

    private final String wireName;

    EdgeType(final String theWireName) {
        this.wireName = theWireName;
    }

    /**
     * Returns the lowercase name used in cache entries and query results.
     *
     * @return the wire name, e.g. "calls"
     */
    public String wireName() {
        return wireName;
    }

    /**
     * Parses a wire name (case-insensitive) into an EdgeType.
     *
     * @param value the value to parse
     * @return the matching type
     * @throws IllegalArgumentException if the value is not a known type
     */
    public static EdgeType fromString(final String value) {
        if (value != null) {
            for (final EdgeType type : values()) {
                if (type.wireName.equalsIgnoreCase(value.trim())) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown edge type: " + value);
    }

}
