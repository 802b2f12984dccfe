package co.fanki.codegraph.analysis.domain;

import co.fanki.codegraph.shared.Preconditions;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only queries over one loaded {@link CodeGraph}.
 *
 * <p>Holds no state besides the graph it was created for, which it never
 * modifies. Result caps (50 symbols, 5 call graph roots) are applied
 * here rather than in the graph.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class GraphQueryEngine {

    /** Maximum number of symbols returned by a search. */
    public static final int MAX_SYMBOL_RESULTS = 50;

    /** Maximum number of functions a call graph is built for. */
    public static final int MAX_CALL_GRAPH_ROOTS = 5;

    private final CodeGraph graph;

    /**
     * Creates a query engine over the given graph.
     *
     * @param theGraph the graph to query
     */
    public GraphQueryEngine(final CodeGraph theGraph) {
        this.graph = Preconditions.requireNonNull(theGraph,
                "Graph is required");
    }

    /**
     * Searches symbols by name or file path.
     *
     * @param query the substring to look for; empty matches every symbol
     * @param kind optional kind filter, null for all kinds
     * @return the total match count and the best matches
     */
    public SymbolSearch findSymbol(final String query,
            final SymbolKind kind) {
        Preconditions.requireNonNull(query, "Query is required");

        final List<SymbolMatch> matches = graph.searchNodes(query, kind);
        final List<SymbolMatch> top = matches.size() > MAX_SYMBOL_RESULTS
                ? List.copyOf(matches.subList(0, MAX_SYMBOL_RESULTS))
                : List.copyOf(matches);

        return new SymbolSearch(query,
                kind != null ? kind.wireName() : "all",
                matches.size(), top);
    }

    /**
     * Returns what a symbol uses: outgoing edges up to the given depth.
     *
     * @param id the symbol id
     * @param depth the hop limit
     * @return the reached connections
     */
    public List<Connection> getDependencies(final String id,
            final int depth) {
        return graph.getConnections(id, Direction.OUTGOING, depth);
    }

    /**
     * Returns what uses a symbol: incoming edges up to the given depth.
     *
     * @param id the symbol id
     * @param depth the hop limit
     * @return the reached connections
     */
    public List<Connection> getDependents(final String id,
            final int depth) {
        return graph.getConnections(id, Direction.INCOMING, depth);
    }

    /**
     * Builds the call graph of the functions matching a name.
     *
     * <p>Up to {@value #MAX_CALL_GRAPH_ROOTS} matching functions are
     * expanded in both directions; only {@code calls} edges are kept.</p>
     *
     * @param functionName the function name, or part of it
     * @param depth the hop limit
     * @return the call graph keyed by function id, empty if no function
     *         matches
     */
    public CallGraph getCallGraph(final String functionName,
            final int depth) {
        Preconditions.requireNonNull(functionName,
                "Function name is required");

        final List<SymbolMatch> functions = graph.searchNodes(functionName,
                SymbolKind.FUNCTION);

        final Map<String, CallGraphEntry> entries = new LinkedHashMap<>();
        for (final SymbolMatch function : functions.subList(0,
                Math.min(functions.size(), MAX_CALL_GRAPH_ROOTS))) {

            final List<Connection> calls = new ArrayList<>();
            for (final Connection connection : graph.getConnections(
                    function.id(), Direction.BOTH, depth)) {
                if (connection.type() == EdgeType.CALLS) {
                    calls.add(connection);
                }
            }
            entries.put(function.id(), new CallGraphEntry(function, calls));
        }

        return new CallGraph(functionName, depth, entries);
    }

    /**
     * Lists the symbols declared in a file, by ascending line.
     *
     * @param file the file path relative to the project root
     * @return the file's symbols, empty if the file is unknown
     */
    public FileSymbols getFileSymbols(final String file) {
        Preconditions.requireNonBlank(file, "File is required");

        final List<FileSymbol> symbols = new ArrayList<>();
        for (final String id : graph.nodeIdsInFile(file)) {
            final SymbolNode node = graph.node(id);
            if (node != null) {
                symbols.add(new FileSymbol(id, node));
            }
        }
        symbols.sort(Comparator.comparingInt(s -> s.symbol().line()));

        return new FileSymbols(file, symbols.size(), symbols);
    }

    /**
     * Counts nodes per kind and edges per type.
     *
     * @return the graph statistics
     */
    public GraphStats getGraphStats() {
        final Map<String, Integer> nodeTypes = new LinkedHashMap<>();
        for (final SymbolNode node : graph.nodes()) {
            nodeTypes.merge(node.kind().wireName(), 1, Integer::sum);
        }

        final Map<String, Integer> edgeTypes = new LinkedHashMap<>();
        for (final Edge edge : graph.edges()) {
            edgeTypes.merge(edge.type().wireName(), 1, Integer::sum);
        }

        return new GraphStats(graph.nodeCount(), graph.edgeCount(),
                graph.fileCount(), nodeTypes, edgeTypes);
    }

    /**
     * Result of a symbol search.
     */
    public record SymbolSearch(
            String query,
            String type,
            int count,
            List<SymbolMatch> symbols
    ) {}

    /**
     * Call graph of the functions matching a name.
     */
    public record CallGraph(
            String functionName,
            int depth,
            Map<String, CallGraphEntry> functions
    ) {
        /** Message reported when no function matches. */
        public static final String NOT_FOUND = "Function not found";

        /** Checks if at least one function matched. */
        public boolean found() {
            return !functions.isEmpty();
        }

        /** Returns {@link #NOT_FOUND} when nothing matched, null otherwise. */
        public String error() {
            return found() ? null : NOT_FOUND;
        }
    }

    /**
     * One function of a call graph with its call connections.
     */
    public record CallGraphEntry(
            SymbolMatch function,
            List<Connection> connections
    ) {}

    /**
     * A symbol declared in a file, with its id.
     */
    public record FileSymbol(String id, SymbolNode symbol) {}

    /**
     * Symbols of a file, sorted by declaration line.
     */
    public record FileSymbols(
            String file,
            int symbolCount,
            List<FileSymbol> symbols
    ) {}

    /**
     * Aggregate counts of a graph.
     */
    public record GraphStats(
            int totalNodes,
            int totalEdges,
            int fileCount,
            Map<String, Integer> nodeTypes,
            Map<String, Integer> edgeTypes
    ) {}

}
