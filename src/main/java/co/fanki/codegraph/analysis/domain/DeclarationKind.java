package co.fanki.codegraph.analysis.domain;

/**
 * The keyword that introduced a variable declaration.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum DeclarationKind {

    CONST,
    LET,
    VAR;

    /**
     * Returns the source keyword, e.g. "const".
     *
     * @return the lowercase keyword
     */
    public String keyword() {
        return name().toLowerCase();
    }

    /**
     * Parses a source keyword into a DeclarationKind.
     *
     * @param keyword the keyword ("const", "let" or "var")
     * @return the declaration kind
     * @throws IllegalArgumentException if the keyword is unknown
     */
    public static DeclarationKind fromKeyword(final String keyword) {
        if (keyword == null) {
            throw new IllegalArgumentException("Keyword is required");
        }
        return valueOf(keyword.trim().toUpperCase());
    }

}
