package co.fanki.codegraph.analysis.domain;

import co.fanki.codegraph.shared.Preconditions;

import java.util.List;

/**
 * Everything a {@link FactExtractor} observed in one file, before any
 * cross-file linking.
 *
 * @param file the file path relative to the project root
 * @param declarations the declared functions, classes and variables
 * @param calls the call expressions
 * @param imports the imported bindings
 * @param exports the exports
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record FileFacts(
        String file,
        List<SymbolNode> declarations,
        List<CallFact> calls,
        List<ImportFact> imports,
        List<ExportFact> exports
) {

    public FileFacts {
        Preconditions.requireNonBlank(file, "File is required");
        declarations = declarations == null
                ? List.of() : List.copyOf(declarations);
        calls = calls == null ? List.of() : List.copyOf(calls);
        imports = imports == null ? List.of() : List.copyOf(imports);
        exports = exports == null ? List.of() : List.copyOf(exports);
    }

    /**
     * Creates facts for a file that yielded nothing.
     *
     * @param file the file path
     * @return facts with empty lists
     */
    public static FileFacts empty(final String file) {
        return new FileFacts(file, List.of(), List.of(), List.of(),
                List.of());
    }

    /**
     * Checks whether the file has a default export.
     *
     * @return true if any export is the default one
     */
    public boolean hasDefaultExport() {
        for (final ExportFact export : exports) {
            if (export.isDefault()) {
                return true;
            }
        }
        return false;
    }

}
