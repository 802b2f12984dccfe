package co.fanki.codegraph.analysis.domain;

import co.fanki.codegraph.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Links the facts of every file of a project into a {@link CodeGraph}.
 *
 * <p>Best effort by design. Every declaration becomes a node, then three
 * heuristic passes add edges:</p>
 * <ul>
 *   <li><b>imports</b>: a relative import is resolved to a file of the
 *       project by trying the extensions {@code .js .ts .jsx .tsx} and
 *       the {@code /index.js /index.ts} suffixes in that order; the import
 *       site is linked to the declarations of that file whose name equals
 *       the local binding, or to all of them for a default import of a
 *       file with a default export.</li>
 *   <li><b>calls</b>: a call site is linked to every function declared
 *       anywhere in the project under the callee name.</li>
 *   <li><b>extends</b>: a class is linked to every class declared
 *       anywhere in the project under its superclass name.</li>
 * </ul>
 *
 * <p>An edge is only added when its target is a node; everything else
 * is silently left unlinked. Functions and classes are looked up through
 * a name index built once per resolution.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class GraphResolver {

    private static final Logger LOG = LoggerFactory.getLogger(
            GraphResolver.class);

    /** Suffixes tried, in order, when resolving a relative import. */
    private static final List<String> IMPORT_SUFFIXES = List.of(
            ".js", ".ts", ".jsx", ".tsx", "/index.js", "/index.ts");

    /**
     * Builds a fresh graph from the facts of all files.
     *
     * @param factsByFile the facts keyed by relative file path; iteration
     *        order drives node and edge order
     * @return the populated graph
     */
    public CodeGraph resolve(final Map<String, FileFacts> factsByFile) {
        Preconditions.requireNonNull(factsByFile, "Facts are required");

        final CodeGraph graph = new CodeGraph();

        for (final FileFacts facts : factsByFile.values()) {
            for (final SymbolNode declaration : facts.declarations()) {
                graph.addNode(declaration);
            }
        }

        final Map<SymbolKind, Map<String, List<String>>> nameIndex =
                buildNameIndex(graph);

        for (final Map.Entry<String, FileFacts> entry
                : factsByFile.entrySet()) {
            final String file = entry.getKey();
            final FileFacts facts = entry.getValue();

            resolveImports(file, facts, factsByFile, graph);
            resolveCalls(file, facts, nameIndex, graph);
            resolveInheritance(facts, nameIndex, graph);
        }

        LOG.info("Resolved {} files into {} nodes and {} edges",
                factsByFile.size(), graph.nodeCount(), graph.edgeCount());

        return graph;
    }

    private Map<SymbolKind, Map<String, List<String>>> buildNameIndex(
            final CodeGraph graph) {

        final Map<SymbolKind, Map<String, List<String>>> index =
                new EnumMap<>(SymbolKind.class);

        for (final String id : graph.nodeIds()) {
            final SymbolNode node = graph.node(id);
            index.computeIfAbsent(node.kind(), k -> new HashMap<>())
                    .computeIfAbsent(node.name(), k -> new ArrayList<>())
                    .add(id);
        }
        return index;
    }

    private void resolveImports(final String file, final FileFacts facts,
            final Map<String, FileFacts> factsByFile,
            final CodeGraph graph) {

        for (final ImportFact imp : facts.imports()) {
            if (!imp.isRelative()) {
                continue;
            }

            final String basePath = joinImportPath(file, imp.source());

            for (final String suffix : IMPORT_SUFFIXES) {
                final String candidate = basePath.isEmpty()
                        ? suffix.substring(suffix.indexOf('/') + 1)
                        : basePath + suffix;
                final FileFacts target = factsByFile.get(candidate);
                if (target == null) {
                    continue;
                }

                final boolean defaultImportOfDefaultExport =
                        imp.isDefault() && target.hasDefaultExport();
                final String importSite = NodeIds.importSite(file,
                        imp.line());

                for (final String targetId : graph.nodeIdsInFile(candidate)) {
                    final SymbolNode node = graph.node(targetId);
                    if (node.name().equals(imp.local())
                            || defaultImportOfDefaultExport) {
                        graph.addEdge(importSite, targetId,
                                EdgeType.IMPORTS);
                    }
                }
                break;
            }
        }
    }

    private void resolveCalls(final String file, final FileFacts facts,
            final Map<SymbolKind, Map<String, List<String>>> nameIndex,
            final CodeGraph graph) {

        for (final CallFact call : facts.calls()) {
            final List<String> targets = lookup(nameIndex,
                    SymbolKind.FUNCTION, call.name());
            if (targets.isEmpty()) {
                continue;
            }
            final String callSite = NodeIds.callSite(file, call.line());
            for (final String targetId : targets) {
                graph.addEdge(callSite, targetId, EdgeType.CALLS);
            }
        }
    }

    private void resolveInheritance(final FileFacts facts,
            final Map<SymbolKind, Map<String, List<String>>> nameIndex,
            final CodeGraph graph) {

        for (final SymbolNode declaration : facts.declarations()) {
            if (!(declaration instanceof ClassNode classNode)
                    || !classNode.hasSuperClass()) {
                continue;
            }
            final List<String> parents = lookup(nameIndex,
                    SymbolKind.CLASS, classNode.superClass());
            if (parents.isEmpty()) {
                LOG.debug("Superclass {} of {} not found in project",
                        classNode.superClass(), classNode.id());
                continue;
            }
            for (final String parentId : parents) {
                graph.addEdge(classNode.id(), parentId, EdgeType.EXTENDS);
            }
        }
    }

    private static List<String> lookup(
            final Map<SymbolKind, Map<String, List<String>>> nameIndex,
            final SymbolKind kind, final String name) {
        final Map<String, List<String>> byName = nameIndex.get(kind);
        if (byName == null) {
            return List.of();
        }
        return byName.getOrDefault(name, List.of());
    }

    /**
     * Joins an import source with the importing file's directory.
     *
     * <p>The result is normalized and uses '/' separators, e.g. importing
     * {@code ../util/io} from {@code src/app/main.js} gives
     * {@code src/util/io}.</p>
     *
     * @param importer the importing file, relative to the project root
     * @param source the relative import source
     * @return the joined path, without extension
     */
    static String joinImportPath(final String importer,
            final String source) {
        final Path parent = Path.of(importer).getParent();
        final Path joined = parent == null
                ? Path.of(source)
                : parent.resolve(source);
        return joined.normalize().toString().replace('\\', '/');
    }

}
