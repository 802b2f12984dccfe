package co.fanki.codegraph.analysis.domain;

/**
 * A declared symbol: the node type of the {@link CodeGraph}.
 *
 * <p>Implemented by {@link FunctionNode}, {@link ClassNode} and
 * {@link VariableNode}, which share name, file and line and add
 * kind-specific attributes. Two symbols with the same file, name and
 * line are the same entity.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface SymbolNode {

    /**
     * Returns the declared name.
     *
     * @return the symbol name
     */
    String name();

    /**
     * Returns the declaring file, relative to the project root.
     *
     * @return the file path with '/' separators
     */
    String file();

    /**
     * Returns the 1-based declaration line.
     *
     * @return the line number
     */
    int line();

    /**
     * Returns the kind of this symbol.
     *
     * @return the symbol kind
     */
    SymbolKind kind();

    /**
     * Returns the stable composite id {@code file:name:line}.
     *
     * @return the node id
     */
    default String id() {
        return NodeIds.declaration(file(), name(), line());
    }

}
