package co.fanki.codegraph.analysis.domain;

import co.fanki.codegraph.shared.Preconditions;

/**
 * A function declaration.
 *
 * @param name the function name
 * @param file the declaring file
 * @param line the 1-based declaration line
 * @param parameterCount the number of declared parameters
 * @param async whether the function is declared async
 * @param generator whether the function is a generator
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record FunctionNode(
        String name,
        String file,
        int line,
        int parameterCount,
        boolean async,
        boolean generator
) implements SymbolNode {

    public FunctionNode {
        Preconditions.requireNonBlank(name, "Function name is required");
        Preconditions.requireNonBlank(file, "File is required");
        Preconditions.requireNonNegative(parameterCount,
                "Parameter count must be non-negative");
    }

    /** {@inheritDoc} */
    @Override
    public SymbolKind kind() {
        return SymbolKind.FUNCTION;
    }

}
