package co.fanki.codegraph.analysis.domain;

import co.fanki.codegraph.shared.Preconditions;

/**
 * Builds the string identifiers used as keys in the {@link CodeGraph}.
 *
 * <p>Declarations are keyed {@code file:name:line}. Import sites and
 * call sites are synthetic edge sources that never become nodes:
 * {@code file:import:line} and {@code file:line}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class NodeIds {

    private NodeIds() {
    }

    /**
     * Builds the id of a declared symbol.
     *
     * @param file the declaring file, relative to the project root
     * @param name the symbol name
     * @param line the 1-based declaration line
     * @return the node id
     */
    public static String declaration(final String file, final String name,
            final int line) {
        Preconditions.requireNonBlank(file, "File is required");
        Preconditions.requireNonBlank(name, "Name is required");
        return file + ":" + name + ":" + line;
    }

    /**
     * Builds the synthetic id of an import statement.
     *
     * @param file the importing file
     * @param line the line of the import statement
     * @return the import site id
     */
    public static String importSite(final String file, final int line) {
        Preconditions.requireNonBlank(file, "File is required");
        return file + ":import:" + line;
    }

    /**
     * Builds the synthetic id of a call expression.
     *
     * @param file the file containing the call
     * @param line the line of the call
     * @return the call site id
     */
    public static String callSite(final String file, final int line) {
        Preconditions.requireNonBlank(file, "File is required");
        return file + ":" + line;
    }

}
