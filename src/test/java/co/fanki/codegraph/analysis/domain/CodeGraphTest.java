package co.fanki.codegraph.analysis.domain;

import co.fanki.codegraph.shared.DomainException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for the CodeGraph store.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class CodeGraphTest {

    private static FunctionNode function(final String name,
            final String file, final int line) {
        return new FunctionNode(name, file, line, 0, false, false);
    }

    // -- addNode -----------------------------------------------------------

    @Test
    void whenAddingNode_givenFunction_shouldIndexItUnderCompositeId() {
        final CodeGraph graph = new CodeGraph();

        graph.addNode(function("foo", "src/a.js", 3));

        assertEquals(1, graph.nodeCount());
        assertTrue(graph.contains("src/a.js:foo:3"));
        assertEquals(Set.of("src/a.js:foo:3"),
                graph.nodeIdsInFile("src/a.js"));
        assertEquals(1, graph.fileCount());
    }

    @Test
    void whenAddingNode_givenSameIdTwice_shouldKeepLastWrite() {
        final CodeGraph graph = new CodeGraph();

        graph.addNode(function("foo", "a.js", 1));
        graph.addNode(new FunctionNode("foo", "a.js", 1, 3, true, false));

        assertEquals(1, graph.nodeCount());
        final FunctionNode stored = (FunctionNode) graph.node("a.js:foo:1");
        assertEquals(3, stored.parameterCount());
        assertTrue(stored.async());
        assertEquals(1, graph.nodeIdsInFile("a.js").size());
    }

    @Test
    void whenAddingNode_givenNullNode_shouldThrowException() {
        final CodeGraph graph = new CodeGraph();

        assertThrows(IllegalArgumentException.class,
                () -> graph.addNode(null));
    }

    @Test
    void whenGettingNodeIdsInFile_givenUnknownFile_shouldReturnEmpty() {
        final CodeGraph graph = new CodeGraph();

        assertTrue(graph.nodeIdsInFile("missing.js").isEmpty());
    }

    // -- addEdge -----------------------------------------------------------

    @Test
    void whenAddingEdge_givenTwoIds_shouldUpdateBothIndexes() {
        final CodeGraph graph = new CodeGraph();
        graph.addNode(function("foo", "a.js", 1));

        graph.addEdge("b.js:4", "a.js:foo:1", EdgeType.CALLS);

        assertEquals(1, graph.edgeCount());
        assertEquals(List.of(new Edge("b.js:4", "a.js:foo:1",
                EdgeType.CALLS)), graph.outgoingEdges("b.js:4"));
        assertEquals(List.of(new Edge("b.js:4", "a.js:foo:1",
                EdgeType.CALLS)), graph.incomingEdges("a.js:foo:1"));
        assertTrue(graph.outgoingEdges("a.js:foo:1").isEmpty());
    }

    @Test
    void whenAddingEdge_givenSameEdgeTwice_shouldKeepBothCopies() {
        final CodeGraph graph = new CodeGraph();

        graph.addEdge("b.js:4", "a.js:foo:1", EdgeType.CALLS);
        graph.addEdge("b.js:4", "a.js:foo:1", EdgeType.CALLS);

        assertEquals(2, graph.edgeCount());
        assertEquals(2, graph.incomingEdges("a.js:foo:1").size());
    }

    // -- getConnections ----------------------------------------------------

    private CodeGraph chain() {
        final CodeGraph graph = new CodeGraph();
        graph.addNode(function("a", "x.js", 1));
        graph.addNode(function("b", "x.js", 2));
        graph.addNode(function("c", "x.js", 3));
        graph.addEdge("x.js:a:1", "x.js:b:2", EdgeType.CALLS);
        graph.addEdge("x.js:b:2", "x.js:c:3", EdgeType.CALLS);
        return graph;
    }

    @Test
    void whenGettingConnections_givenDepthZero_shouldReturnNothing() {
        final CodeGraph graph = chain();

        assertTrue(graph.getConnections("x.js:a:1", Direction.OUTGOING, 0)
                .isEmpty());
    }

    @Test
    void whenGettingConnections_givenDepthOne_shouldReturnDirectEdges() {
        final CodeGraph graph = chain();

        final List<Connection> connections = graph.getConnections(
                "x.js:a:1", Direction.OUTGOING, 1);

        assertEquals(1, connections.size());
        assertEquals("x.js:b:2", connections.get(0).to());
        assertEquals("b", connections.get(0).toData().name());
        assertEquals("a", connections.get(0).fromData().name());
    }

    @Test
    void whenGettingConnections_givenDepthTwo_shouldReturnTwoHops() {
        final CodeGraph graph = chain();

        final List<Connection> connections = graph.getConnections(
                "x.js:a:1", Direction.OUTGOING, 2);

        assertEquals(2, connections.size());
        assertEquals("x.js:c:3", connections.get(1).to());
    }

    @Test
    void whenGettingConnections_givenIncoming_shouldWalkBackwards() {
        final CodeGraph graph = chain();

        final List<Connection> connections = graph.getConnections(
                "x.js:c:3", Direction.INCOMING, 5);

        assertEquals(2, connections.size());
        assertEquals("x.js:b:2", connections.get(0).from());
        assertEquals("x.js:a:1", connections.get(1).from());
    }

    @Test
    void whenGettingConnections_givenCycle_shouldTerminate() {
        final CodeGraph graph = new CodeGraph();
        graph.addNode(new ClassNode("A", "x.js", 1, "B", null, null));
        graph.addNode(new ClassNode("B", "x.js", 5, "A", null, null));
        graph.addEdge("x.js:A:1", "x.js:B:5", EdgeType.EXTENDS);
        graph.addEdge("x.js:B:5", "x.js:A:1", EdgeType.EXTENDS);

        final List<Connection> connections = graph.getConnections(
                "x.js:A:1", Direction.OUTGOING, 100);

        assertEquals(2, connections.size());
    }

    @Test
    void whenGettingConnections_givenBoth_shouldFollowEitherDirection() {
        final CodeGraph graph = chain();

        final List<Connection> connections = graph.getConnections(
                "x.js:b:2", Direction.BOTH, 1);

        assertEquals(2, connections.size());
        assertEquals("x.js:c:3", connections.get(0).to());
        assertEquals("x.js:a:1", connections.get(1).from());
    }

    @Test
    void whenGettingConnections_givenUnknownId_shouldReturnEmpty() {
        final CodeGraph graph = chain();

        assertTrue(graph.getConnections("nope", Direction.BOTH, 3)
                .isEmpty());
    }

    @Test
    void whenGettingConnections_givenCallSiteEndpoint_shouldLeaveDataNull() {
        final CodeGraph graph = new CodeGraph();
        graph.addNode(function("foo", "a.js", 1));
        graph.addEdge("b.js:7", "a.js:foo:1", EdgeType.CALLS);

        final List<Connection> connections = graph.getConnections(
                "a.js:foo:1", Direction.INCOMING, 1);

        assertEquals(1, connections.size());
        assertNull(connections.get(0).fromData());
    }

    @Test
    void whenGettingConnections_givenNegativeDepth_shouldReturnNothing() {
        final CodeGraph graph = chain();

        assertTrue(graph.getConnections("x.js:a:1", Direction.OUTGOING, -1)
                .isEmpty());
    }

    @Test
    void whenGettingConnections_givenDiamond_shouldExpandNodeReachedByShorterPath() {
        final CodeGraph graph = new CodeGraph();
        graph.addNode(function("a", "x.js", 1));
        graph.addNode(function("b", "x.js", 2));
        graph.addNode(function("c", "x.js", 3));
        graph.addNode(function("d", "x.js", 4));
        graph.addEdge("x.js:a:1", "x.js:b:2", EdgeType.CALLS);
        graph.addEdge("x.js:a:1", "x.js:c:3", EdgeType.CALLS);
        graph.addEdge("x.js:b:2", "x.js:c:3", EdgeType.CALLS);
        graph.addEdge("x.js:c:3", "x.js:d:4", EdgeType.CALLS);

        final List<Connection> connections = graph.getConnections(
                "x.js:a:1", Direction.OUTGOING, 2);

        assertEquals(4, connections.size());
        assertTrue(connections.stream().anyMatch(c ->
                c.from().equals("x.js:c:3") && c.to().equals("x.js:d:4")));
    }

    // -- searchNodes -------------------------------------------------------

    @Test
    void whenSearching_givenNameAndPathMatches_shouldRankNameFirst() {
        final CodeGraph graph = new CodeGraph();
        graph.addNode(function("render", "src/user/view.js", 1));
        graph.addNode(function("loadUser", "src/api.js", 9));

        final List<SymbolMatch> matches = graph.searchNodes("USER", null);

        assertEquals(2, matches.size());
        assertEquals("loadUser", matches.get(0).node().name());
        assertEquals(2, matches.get(0).score());
        assertEquals("render", matches.get(1).node().name());
        assertEquals(1, matches.get(1).score());
    }

    @Test
    void whenSearching_givenTurkishDefaultLocale_shouldStillMatchIgnoringCase() {
        final Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            final CodeGraph graph = new CodeGraph();
            graph.addNode(function("INIT", "boot.js", 1));

            final List<SymbolMatch> matches = graph.searchNodes("init", null);

            assertEquals(1, matches.size());
            assertEquals(2, matches.get(0).score());
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void whenSearching_givenKindFilter_shouldKeepOnlyThatKind() {
        final CodeGraph graph = new CodeGraph();
        graph.addNode(function("config", "a.js", 1));
        graph.addNode(new VariableNode("config", "a.js", 2,
                DeclarationKind.CONST));

        final List<SymbolMatch> matches = graph.searchNodes("config",
                SymbolKind.VARIABLE);

        assertEquals(1, matches.size());
        assertInstanceOf(VariableNode.class, matches.get(0).node());
    }

    @Test
    void whenSearching_givenNoMatch_shouldReturnEmpty() {
        final CodeGraph graph = chain();

        assertTrue(graph.searchNodes("zzz", null).isEmpty());
    }

    // -- serialization -----------------------------------------------------

    @Test
    void whenRoundTripping_givenAllKinds_shouldRestoreNodesEdgesAndIndex() {
        final CodeGraph graph = new CodeGraph();
        graph.addNode(new FunctionNode("foo", "a.js", 1, 2, true, true));
        graph.addNode(new ClassNode("Repo", "a.js", 4, "Base",
                List.of(new ClassNode.Method("constructor", "constructor",
                                false),
                        new ClassNode.Method("create", "method", true)),
                List.of(new ClassNode.Property("table", true))));
        graph.addNode(new VariableNode("limit", "b.js", 1,
                DeclarationKind.LET));
        graph.addEdge("b.js:import:1", "a.js:foo:1", EdgeType.IMPORTS);
        graph.addEdge("b.js:3", "a.js:foo:1", EdgeType.CALLS);
        graph.markSaved("/work/app", "abc123");

        final CodeGraph restored = CodeGraph.fromJson(graph.toJson());

        assertEquals(graph.nodeIds(), restored.nodeIds());
        for (final String id : graph.nodeIds()) {
            assertEquals(graph.node(id), restored.node(id));
        }
        assertEquals(new HashSet<>(graph.edges()),
                new HashSet<>(restored.edges()));
        assertEquals(graph.edgeCount(), restored.edgeCount());
        assertEquals(graph.files(), restored.files());
        assertEquals(graph.nodeIdsInFile("a.js"),
                restored.nodeIdsInFile("a.js"));
        assertEquals("abc123", restored.projectHash());
        assertEquals("/work/app", restored.metadata().projectPath());
        assertEquals(1, restored.incomingEdges("a.js:foo:1").stream()
                .filter(e -> e.type() == EdgeType.CALLS).count());
    }

    @Test
    void whenRoundTripping_givenEmptyGraph_shouldStayEmpty() {
        final CodeGraph restored = CodeGraph.fromJson(
                new CodeGraph().toJson());

        assertEquals(0, restored.nodeCount());
        assertEquals(0, restored.edgeCount());
        assertEquals(0, restored.fileCount());
    }

    @Test
    void whenLoadingJson_givenMalformedDocument_shouldThrowCacheCorrupted() {
        final DomainException e = assertThrows(DomainException.class,
                () -> CodeGraph.fromJson("{\"nodes\": [ {\"id\": "));

        assertEquals("CACHE_CORRUPTED", e.getErrorCode());
    }

    @Test
    void whenLoadingJson_givenUnknownEdgeType_shouldThrowCacheCorrupted() {
        final String json = "{\"nodes\": [], \"edges\": [{\"from\": \"a\","
                + " \"to\": \"b\", \"type\": \"owns\"}], \"fileIndex\": []}";

        final DomainException e = assertThrows(DomainException.class,
                () -> CodeGraph.fromJson(json));

        assertEquals("CACHE_CORRUPTED", e.getErrorCode());
    }

    @Test
    void whenLoadingJson_givenArrayRoot_shouldThrowCacheCorrupted() {
        final DomainException e = assertThrows(DomainException.class,
                () -> CodeGraph.fromJson("[]"));

        assertEquals("CACHE_CORRUPTED", e.getErrorCode());
    }

    @Test
    void whenSerializing_givenNodes_shouldWriteCacheEntrySections() {
        final CodeGraph graph = chain();

        final String json = graph.toJson();

        final List<String> sections = new ArrayList<>(List.of(
                "\"metadata\"", "\"projectHash\"", "\"nodes\"", "\"edges\"",
                "\"fileIndex\""));
        sections.removeIf(json::contains);
        assertTrue(sections.isEmpty(), "Missing sections: " + sections);
        assertFalse(json.contains("\"outgoing\""));
    }

}
