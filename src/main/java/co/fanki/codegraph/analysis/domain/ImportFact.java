package co.fanki.codegraph.analysis.domain;

/**
 * A single imported binding of an import statement.
 *
 * <p>{@code import Foo from './foo'} yields imported name
 * {@code default}; a namespace import yields {@code *}.</p>
 *
 * @param source the raw module path, e.g. "../services/user"
 * @param imported the exported name in the source module
 * @param local the local binding name in the importing file
 * @param line the line of the import statement
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ImportFact(
        String source,
        String imported,
        String local,
        int line
) {

    /** Imported name of a default import. */
    public static final String DEFAULT = "default";

    /** Imported name of a namespace import. */
    public static final String NAMESPACE = "*";

    /**
     * Checks whether the source is a relative module path.
     *
     * @return true if the source starts with a dot
     */
    public boolean isRelative() {
        return source != null && source.startsWith(".");
    }

    /**
     * Checks whether this is a default import.
     *
     * @return true if the imported name is {@code default}
     */
    public boolean isDefault() {
        return DEFAULT.equals(imported);
    }

}
