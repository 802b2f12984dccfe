package co.fanki.codegraph.analysis.domain;

import co.fanki.codegraph.shared.Preconditions;

/**
 * A variable declaration.
 *
 * @param name the variable name
 * @param file the declaring file
 * @param line the 1-based declaration line
 * @param declarationKind the declaring keyword
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record VariableNode(
        String name,
        String file,
        int line,
        DeclarationKind declarationKind
) implements SymbolNode {

    public VariableNode {
        Preconditions.requireNonBlank(name, "Variable name is required");
        Preconditions.requireNonBlank(file, "File is required");
        Preconditions.requireNonNull(declarationKind,
                "Declaration kind is required");
    }

    /** {@inheritDoc} */
    @Override
    public SymbolKind kind() {
        return SymbolKind.VARIABLE;
    }

}
