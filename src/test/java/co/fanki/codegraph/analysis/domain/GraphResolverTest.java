package co.fanki.codegraph.analysis.domain;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link GraphResolver}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class GraphResolverTest {

    private final GraphResolver resolver = new GraphResolver();

    private static FileFacts facts(final String file,
            final List<SymbolNode> declarations,
            final List<CallFact> calls,
            final List<ImportFact> imports,
            final List<ExportFact> exports) {
        return new FileFacts(file, declarations, calls, imports, exports);
    }

    private static Map<String, FileFacts> project(final FileFacts... files) {
        final Map<String, FileFacts> map = new LinkedHashMap<>();
        for (final FileFacts f : files) {
            map.put(f.file(), f);
        }
        return map;
    }

    private static long count(final CodeGraph graph, final String from,
            final String to, final EdgeType type) {
        return graph.edges().stream()
                .filter(e -> e.from().equals(from) && e.to().equals(to)
                        && e.type() == type)
                .count();
    }

    @Test
    void whenResolving_givenNamedImportAndCall_shouldLinkBothToFunction() {
        final CodeGraph graph = resolver.resolve(project(
                facts("a.js",
                        List.of(new FunctionNode("foo", "a.js", 1, 0,
                                false, false)),
                        List.of(), List.of(), List.of()),
                facts("b.js", List.of(),
                        List.of(new CallFact("foo", 2, 0)),
                        List.of(new ImportFact("./a", "foo", "foo", 1)),
                        List.of())));

        assertEquals(1, count(graph, "b.js:2", "a.js:foo:1",
                EdgeType.CALLS));
        assertEquals(1, count(graph, "b.js:import:1", "a.js:foo:1",
                EdgeType.IMPORTS));
        assertEquals(2, graph.edgeCount());
    }

    @Test
    void whenResolving_givenSubclassInOtherFile_shouldAddExtendsEdge() {
        final CodeGraph graph = resolver.resolve(project(
                facts("base.js",
                        List.of(new ClassNode("Base", "base.js", 1, null,
                                null, null)),
                        List.of(), List.of(), List.of()),
                facts("derived.js",
                        List.of(new ClassNode("Derived", "derived.js", 1,
                                "Base", null, null)),
                        List.of(), List.of(), List.of())));

        assertEquals(1, count(graph, "derived.js:Derived:1", "base.js:Base:1",
                EdgeType.EXTENDS));
    }

    @Test
    void whenResolving_givenMissingSuperclass_shouldAddNoEdge() {
        final CodeGraph graph = resolver.resolve(project(
                facts("orphan.js",
                        List.of(new ClassNode("Orphan", "orphan.js", 1,
                                "Missing", null, null)),
                        List.of(), List.of(), List.of())));

        assertEquals(1, graph.nodeCount());
        assertEquals(0, graph.edgeCount());
    }

    @Test
    void whenResolving_givenDefaultImportOfDefaultExport_shouldLinkAll() {
        final CodeGraph graph = resolver.resolve(project(
                facts("src/util.js",
                        List.of(new FunctionNode("helper", "src/util.js", 1,
                                        1, false, false),
                                new VariableNode("VERSION", "src/util.js", 5,
                                        DeclarationKind.CONST)),
                        List.of(), List.of(),
                        List.of(new ExportFact(ImportFact.DEFAULT, null,
                                7))),
                facts("src/main.js", List.of(), List.of(),
                        List.of(new ImportFact("./util", ImportFact.DEFAULT,
                                "util", 1)),
                        List.of())));

        assertEquals(1, count(graph, "src/main.js:import:1",
                "src/util.js:helper:1", EdgeType.IMPORTS));
        assertEquals(1, count(graph, "src/main.js:import:1",
                "src/util.js:VERSION:5", EdgeType.IMPORTS));
    }

    @Test
    void whenResolving_givenDefaultImportWithoutDefaultExport_shouldMatchName() {
        final CodeGraph graph = resolver.resolve(project(
                facts("util.js",
                        List.of(new FunctionNode("util", "util.js", 1, 0,
                                        false, false),
                                new FunctionNode("other", "util.js", 3, 0,
                                        false, false)),
                        List.of(), List.of(), List.of()),
                facts("main.js", List.of(), List.of(),
                        List.of(new ImportFact("./util", ImportFact.DEFAULT,
                                "util", 1)),
                        List.of())));

        assertEquals(1, graph.edgeCount());
        assertEquals(1, count(graph, "main.js:import:1", "util.js:util:1",
                EdgeType.IMPORTS));
    }

    @Test
    void whenResolving_givenDirectoryImport_shouldUseIndexFile() {
        final CodeGraph graph = resolver.resolve(project(
                facts("lib/index.ts",
                        List.of(new FunctionNode("start", "lib/index.ts", 2,
                                0, false, false)),
                        List.of(), List.of(), List.of()),
                facts("app.ts", List.of(), List.of(),
                        List.of(new ImportFact("./lib", "start", "start", 1)),
                        List.of())));

        assertEquals(1, count(graph, "app.ts:import:1",
                "lib/index.ts:start:2", EdgeType.IMPORTS));
    }

    @Test
    void whenResolving_givenJsAndTsCandidates_shouldStopAtFirstExisting() {
        final CodeGraph graph = resolver.resolve(project(
                facts("a.js",
                        List.of(new FunctionNode("foo", "a.js", 1, 0,
                                false, false)),
                        List.of(), List.of(), List.of()),
                facts("a.ts",
                        List.of(new FunctionNode("foo", "a.ts", 1, 0,
                                false, false)),
                        List.of(), List.of(), List.of()),
                facts("b.js", List.of(), List.of(),
                        List.of(new ImportFact("./a", "foo", "foo", 1)),
                        List.of())));

        assertEquals(1, count(graph, "b.js:import:1", "a.js:foo:1",
                EdgeType.IMPORTS));
        assertEquals(0, count(graph, "b.js:import:1", "a.ts:foo:1",
                EdgeType.IMPORTS));
    }

    @Test
    void whenResolving_givenPackageImport_shouldIgnoreIt() {
        final CodeGraph graph = resolver.resolve(project(
                facts("lodash.js",
                        List.of(new FunctionNode("map", "lodash.js", 1, 0,
                                false, false)),
                        List.of(), List.of(), List.of()),
                facts("b.js", List.of(), List.of(),
                        List.of(new ImportFact("lodash", "map", "map", 1)),
                        List.of())));

        assertEquals(0, graph.edgeCount());
    }

    @Test
    void whenResolving_givenSameNameInTwoFiles_shouldLinkCallToBoth() {
        final CodeGraph graph = resolver.resolve(project(
                facts("a.js",
                        List.of(new FunctionNode("init", "a.js", 1, 0,
                                false, false)),
                        List.of(), List.of(), List.of()),
                facts("b.js",
                        List.of(new FunctionNode("init", "b.js", 1, 0,
                                false, false)),
                        List.of(), List.of(), List.of()),
                facts("c.js", List.of(),
                        List.of(new CallFact("init", 4, 0)),
                        List.of(), List.of())));

        assertEquals(1, count(graph, "c.js:4", "a.js:init:1",
                EdgeType.CALLS));
        assertEquals(1, count(graph, "c.js:4", "b.js:init:1",
                EdgeType.CALLS));
    }

    @Test
    void whenResolving_givenCallToVariableOrMember_shouldNotLink() {
        final CodeGraph graph = resolver.resolve(project(
                facts("a.js",
                        List.of(new VariableNode("handler", "a.js", 1,
                                DeclarationKind.CONST),
                                new FunctionNode("save", "a.js", 3, 0,
                                        false, false)),
                        List.of(new CallFact("handler", 8, 0),
                                new CallFact("repo.save", 9, 1)),
                        List.of(), List.of())));

        assertEquals(0, graph.edgeCount());
    }

    @Test
    void whenResolving_givenAnyProject_shouldOnlyTargetExistingNodes() {
        final CodeGraph graph = resolver.resolve(project(
                facts("src/a.js",
                        List.of(new FunctionNode("foo", "src/a.js", 1, 0,
                                        false, false),
                                new ClassNode("A", "src/a.js", 3, "Nope",
                                        null, null)),
                        List.of(new CallFact("foo", 9, 0),
                                new CallFact("bar", 10, 0)),
                        List.of(new ImportFact("../x/y", "z", "z", 1)),
                        List.of()),
                facts("src/b.js",
                        List.of(new ClassNode("B", "src/b.js", 1, "A",
                                null, null)),
                        List.of(new CallFact("foo", 2, 0)),
                        List.of(new ImportFact("./a", "foo", "foo", 1),
                                new ImportFact("./missing", "q", "q", 1)),
                        List.of())));

        assertTrue(graph.edgeCount() > 0);
        for (final Edge edge : graph.edges()) {
            assertTrue(graph.contains(edge.to()),
                    "Dangling target " + edge.to());
        }
    }

    @Test
    void whenJoiningImportPath_givenParentReference_shouldNormalize() {
        assertEquals("src/util/io",
                GraphResolver.joinImportPath("src/app/main.js",
                        "../util/io"));
        assertEquals("a", GraphResolver.joinImportPath("b.js", "./a"));
        assertEquals("src/lib",
                GraphResolver.joinImportPath("src/x.js", "./lib"));
    }

}
