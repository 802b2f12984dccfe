package co.fanki.codegraph.analysis.domain;

import co.fanki.codegraph.shared.DomainException;
import co.fanki.codegraph.shared.Preconditions;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * The graph store: declared symbols as nodes and typed relations as
 * edges, with a reverse-edge index and a per-file index.
 *
 * <p>Pure data structure, no heuristics and no I/O. Edges live in a
 * single arena; the forward and reverse indexes hold positions into it
 * and are only ever updated together by {@link #addEdge}. Edges are not
 * deduplicated: the same relation added twice is stored twice.</p>
 *
 * <p>Supports depth-bounded traversal, substring search and JSON
 * serialization for the on-disk cache. A graph is populated once by the
 * {@link GraphResolver} and is not safe for concurrent mutation.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class CodeGraph {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Maps node id to the declared symbol, in insertion order. */
    private final Map<String, SymbolNode> nodes;

    /** Every edge ever added, in insertion order. */
    private final List<Edge> edges;

    /** Maps an id to the arena positions of its outgoing edges. */
    private final Map<String, List<Integer>> outgoing;

    /** Maps an id to the arena positions of its incoming edges. */
    private final Map<String, List<Integer>> incoming;

    /** Maps a file path to the ids of the nodes it declares. */
    private final Map<String, Set<String>> fileIndex;

    private GraphMetadata metadata;

    private String projectHash;

    /**
     * Creates an empty graph.
     */
    public CodeGraph() {
        this(GraphMetadata.createdNow(), null);
    }

    private CodeGraph(final GraphMetadata theMetadata,
            final String theProjectHash) {
        this.nodes = new LinkedHashMap<>();
        this.edges = new ArrayList<>();
        this.outgoing = new LinkedHashMap<>();
        this.incoming = new LinkedHashMap<>();
        this.fileIndex = new LinkedHashMap<>();
        this.metadata = theMetadata;
        this.projectHash = theProjectHash;
    }

    /**
     * Adds a node under its own composite id.
     *
     * @param node the declared symbol
     */
    public void addNode(final SymbolNode node) {
        Preconditions.requireNonNull(node, "Node is required");
        addNode(node.id(), node);
    }

    /**
     * Inserts or overwrites the node at the given id.
     *
     * <p>Last write wins. Empty edge lists are ensured for the id and the
     * id is added to the file index under the node's file.</p>
     *
     * @param id the node id
     * @param node the declared symbol
     */
    public void addNode(final String id, final SymbolNode node) {
        Preconditions.requireNonBlank(id, "Node id is required");
        Preconditions.requireNonNull(node, "Node is required");

        putNode(id, node);
        fileIndex.computeIfAbsent(node.file(), k -> new LinkedHashSet<>())
                .add(id);
    }

    /**
     * Adds a directed edge, updating the forward and reverse indexes.
     *
     * <p>Does not check that either endpoint is a known node; callers
     * decide which relations are worth materializing.</p>
     *
     * @param from the source id
     * @param to the target id
     * @param type the relation type
     */
    public void addEdge(final String from, final String to,
            final EdgeType type) {
        Preconditions.requireNonBlank(from, "From id is required");
        Preconditions.requireNonBlank(to, "To id is required");
        Preconditions.requireNonNull(type, "Edge type is required");

        final int position = edges.size();
        edges.add(new Edge(from, to, type));
        outgoing.computeIfAbsent(from, k -> new ArrayList<>()).add(position);
        incoming.computeIfAbsent(to, k -> new ArrayList<>()).add(position);
    }

    /**
     * Collects the edges reachable from a start id within a hop limit.
     *
     * <p>Depth-first and recursive. Each id is expanded at most once per
     * call, which also stops cycles. Only ids closer than {@code depth}
     * hops have their edges emitted, so {@code depth == 0} returns
     * nothing. With {@link Direction#BOTH} an edge between two visited
     * ids may be reported once from each end.</p>
     *
     * @param id the start id
     * @param direction which edges to follow
     * @param depth the maximum number of hops
     * @return the reached edges in traversal order, empty for a negative
     *         depth
     */
    public List<Connection> getConnections(final String id,
            final Direction direction, final int depth) {
        Preconditions.requireNonNull(id, "Start id is required");
        Preconditions.requireNonNull(direction, "Direction is required");

        final List<Connection> result = new ArrayList<>();
        traverse(id, 0, direction, depth, new LinkedHashSet<>(), result);
        return result;
    }

    private void traverse(final String id, final int currentDepth,
            final Direction direction, final int depth,
            final Set<String> visited, final List<Connection> result) {

        if (currentDepth >= depth || !visited.add(id)) {
            return;
        }

        if (direction.followsOutgoing()) {
            for (final Edge edge : outgoingEdges(id)) {
                result.add(toConnection(edge));
                traverse(edge.to(), currentDepth + 1, direction, depth,
                        visited, result);
            }
        }

        if (direction.followsIncoming()) {
            for (final Edge edge : incomingEdges(id)) {
                result.add(toConnection(edge));
                traverse(edge.from(), currentDepth + 1, direction, depth,
                        visited, result);
            }
        }
    }

    private Connection toConnection(final Edge edge) {
        return new Connection(edge.from(), edge.to(), edge.type(),
                nodes.get(edge.from()), nodes.get(edge.to()));
    }

    /**
     * Finds nodes whose name or file path contains the query,
     * ignoring case.
     *
     * <p>Name matches score 2, file-only matches score 1. Results are
     * sorted by descending score; ties keep insertion order.</p>
     *
     * @param query the substring to look for
     * @param kind optional kind filter, null for all kinds
     * @return the matches, best first
     */
    public List<SymbolMatch> searchNodes(final String query,
            final SymbolKind kind) {
        Preconditions.requireNonNull(query, "Query is required");

        final String lowerQuery = query.toLowerCase(Locale.ROOT);
        final List<SymbolMatch> results = new ArrayList<>();

        for (final Map.Entry<String, SymbolNode> entry : nodes.entrySet()) {
            final SymbolNode node = entry.getValue();
            if (kind != null && node.kind() != kind) {
                continue;
            }

            final boolean nameMatch = node.name().toLowerCase(Locale.ROOT)
                    .contains(lowerQuery);
            final boolean fileMatch = node.file().toLowerCase(Locale.ROOT)
                    .contains(lowerQuery);

            if (nameMatch || fileMatch) {
                results.add(new SymbolMatch(entry.getKey(), node,
                        nameMatch ? 2 : 1));
            }
        }

        results.sort((a, b) -> Integer.compare(b.score(), a.score()));
        return results;
    }

    /**
     * Returns the node stored at the given id.
     *
     * @param id the node id
     * @return the node, or null if absent
     */
    public SymbolNode node(final String id) {
        return nodes.get(id);
    }

    /**
     * Checks if the graph holds a node with the given id.
     *
     * @param id the id to check
     * @return true if a node exists at that id
     */
    public boolean contains(final String id) {
        return nodes.containsKey(id);
    }

    /**
     * Returns all node ids in insertion order.
     *
     * @return unmodifiable set of node ids
     */
    public Set<String> nodeIds() {
        return Collections.unmodifiableSet(nodes.keySet());
    }

    /**
     * Returns all nodes in insertion order.
     *
     * @return unmodifiable view of the nodes
     */
    public Collection<SymbolNode> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    /**
     * Returns every edge in insertion order.
     *
     * @return unmodifiable list of edges
     */
    public List<Edge> edges() {
        return Collections.unmodifiableList(edges);
    }

    /**
     * Returns the edges leaving the given id.
     *
     * @param id the source id
     * @return the outgoing edges, empty if none
     */
    public List<Edge> outgoingEdges(final String id) {
        return resolvePositions(outgoing.get(id));
    }

    /**
     * Returns the edges arriving at the given id.
     *
     * @param id the target id
     * @return the incoming edges, empty if none
     */
    public List<Edge> incomingEdges(final String id) {
        return resolvePositions(incoming.get(id));
    }

    private List<Edge> resolvePositions(final List<Integer> positions) {
        if (positions == null || positions.isEmpty()) {
            return List.of();
        }
        final List<Edge> result = new ArrayList<>(positions.size());
        for (final Integer position : positions) {
            result.add(edges.get(position));
        }
        return result;
    }

    /**
     * Returns the ids declared by the given file.
     *
     * @param file the file path relative to the project root
     * @return unmodifiable set of node ids, empty if the file is unknown
     */
    public Set<String> nodeIdsInFile(final String file) {
        final Set<String> ids = fileIndex.get(file);
        if (ids == null) {
            return Set.of();
        }
        return Collections.unmodifiableSet(ids);
    }

    /**
     * Returns the files present in the file index.
     *
     * @return unmodifiable set of file paths
     */
    public Set<String> files() {
        return Collections.unmodifiableSet(fileIndex.keySet());
    }

    /**
     * Returns the number of nodes.
     *
     * @return the node count
     */
    public int nodeCount() {
        return nodes.size();
    }

    /**
     * Returns the number of edges, duplicates included.
     *
     * @return the edge count
     */
    public int edgeCount() {
        return edges.size();
    }

    /**
     * Returns the number of files in the file index.
     *
     * @return the file count
     */
    public int fileCount() {
        return fileIndex.size();
    }

    /**
     * Returns the store-level metadata.
     *
     * @return the metadata
     */
    public GraphMetadata metadata() {
        return metadata;
    }

    /**
     * Returns the hash of the project path this graph was saved for.
     *
     * @return the project hash, or null if never saved
     */
    public String projectHash() {
        return projectHash;
    }

    /**
     * Stamps the graph as saved for a project.
     *
     * @param projectPath the project root path
     * @param theProjectHash the hash of the project path
     */
    public void markSaved(final String projectPath,
            final String theProjectHash) {
        Preconditions.requireNonBlank(projectPath,
                "Project path is required");
        Preconditions.requireNonBlank(theProjectHash,
                "Project hash is required");
        this.metadata = metadata.savedFor(projectPath);
        this.projectHash = theProjectHash;
    }

    private void putNode(final String id, final SymbolNode node) {
        nodes.put(id, node);
        outgoing.computeIfAbsent(id, k -> new ArrayList<>());
        incoming.computeIfAbsent(id, k -> new ArrayList<>());
    }

    // -- Serialization -------------------------------------------------------

    /**
     * Serializes this graph to the JSON cache entry format.
     *
     * @return the pretty-printed JSON document
     */
    public String toJson() {
        final ObjectNode root = MAPPER.createObjectNode();

        final ObjectNode metadataObj = MAPPER.createObjectNode();
        metadataObj.put("createdAt", metadata.createdAt().toString());
        metadataObj.put("updatedAt", metadata.updatedAt().toString());
        metadataObj.put("projectPath", metadata.projectPath());
        root.set("metadata", metadataObj);

        root.put("projectHash", projectHash);

        final ArrayNode nodesArray = MAPPER.createArrayNode();
        for (final Map.Entry<String, SymbolNode> entry : nodes.entrySet()) {
            nodesArray.add(nodeToJson(entry.getKey(), entry.getValue()));
        }
        root.set("nodes", nodesArray);

        final ArrayNode edgesArray = MAPPER.createArrayNode();
        for (final Edge edge : edges) {
            final ObjectNode edgeObj = MAPPER.createObjectNode();
            edgeObj.put("from", edge.from());
            edgeObj.put("to", edge.to());
            edgeObj.put("type", edge.type().wireName());
            edgesArray.add(edgeObj);
        }
        root.set("edges", edgesArray);

        final ArrayNode fileIndexArray = MAPPER.createArrayNode();
        for (final Map.Entry<String, Set<String>> entry
                : fileIndex.entrySet()) {
            final ObjectNode fileObj = MAPPER.createObjectNode();
            fileObj.put("file", entry.getKey());
            final ArrayNode idsArray = fileObj.putArray("nodeIds");
            entry.getValue().forEach(idsArray::add);
            fileIndexArray.add(fileObj);
        }
        root.set("fileIndex", fileIndexArray);

        try {
            return MAPPER.writerWithDefaultPrettyPrinter()
                    .writeValueAsString(root);
        } catch (final JsonProcessingException e) {
            throw new DomainException("Failed to serialize code graph",
                    "CACHE_IO", e);
        }
    }

    private static ObjectNode nodeToJson(final String id,
            final SymbolNode node) {

        final ObjectNode obj = MAPPER.createObjectNode();
        obj.put("id", id);
        obj.put("kind", node.kind().wireName());
        obj.put("name", node.name());
        obj.put("file", node.file());
        obj.put("line", node.line());

        if (node instanceof FunctionNode function) {
            obj.put("parameterCount", function.parameterCount());
            obj.put("async", function.async());
            obj.put("generator", function.generator());
        } else if (node instanceof ClassNode classNode) {
            if (classNode.superClass() != null) {
                obj.put("superClass", classNode.superClass());
            }
            final ArrayNode methods = obj.putArray("methods");
            for (final ClassNode.Method method : classNode.methods()) {
                final ObjectNode m = methods.addObject();
                m.put("name", method.name());
                m.put("kind", method.kind());
                m.put("static", method.isStatic());
            }
            final ArrayNode properties = obj.putArray("properties");
            for (final ClassNode.Property property
                    : classNode.properties()) {
                final ObjectNode p = properties.addObject();
                p.put("name", property.name());
                p.put("static", property.isStatic());
            }
        } else if (node instanceof VariableNode variable) {
            obj.put("declarationKind", variable.declarationKind().keyword());
        }
        return obj;
    }

    /**
     * Rebuilds a graph from its JSON cache entry.
     *
     * <p>The node set, edge list and file index come back exactly as
     * saved; the file index is restored from the document rather than
     * recomputed from the nodes.</p>
     *
     * @param json the JSON document
     * @return the rebuilt graph
     * @throws DomainException with code {@code CACHE_CORRUPTED} if the
     *         document is malformed
     */
    public static CodeGraph fromJson(final String json) {
        Preconditions.requireNonBlank(json, "JSON is required");

        try {
            final JsonNode root = MAPPER.readTree(json);
            if (root == null || !root.isObject()) {
                throw corrupted("document is not a JSON object", null);
            }

            final CodeGraph graph = new CodeGraph(
                    readMetadata(root.get("metadata")),
                    textOrNull(root, "projectHash"));

            for (final JsonNode nodeObj : arrayOrEmpty(root, "nodes")) {
                final SymbolNode node = nodeFromJson(nodeObj);
                graph.putNode(requiredText(nodeObj, "id"), node);
            }

            for (final JsonNode edgeObj : arrayOrEmpty(root, "edges")) {
                graph.addEdge(requiredText(edgeObj, "from"),
                        requiredText(edgeObj, "to"),
                        EdgeType.fromString(requiredText(edgeObj, "type")));
            }

            for (final JsonNode fileObj : arrayOrEmpty(root, "fileIndex")) {
                final Set<String> ids = new LinkedHashSet<>();
                for (final JsonNode id : arrayOrEmpty(fileObj, "nodeIds")) {
                    ids.add(id.asText());
                }
                graph.fileIndex.put(requiredText(fileObj, "file"), ids);
            }

            return graph;

        } catch (final JsonProcessingException
                | IllegalArgumentException
                | DateTimeParseException e) {
            throw corrupted(e.getMessage(), e);
        }
    }

    private static GraphMetadata readMetadata(final JsonNode metadataObj) {
        if (metadataObj == null || !metadataObj.isObject()) {
            return GraphMetadata.createdNow();
        }
        final String created = textOrNull(metadataObj, "createdAt");
        final String updated = textOrNull(metadataObj, "updatedAt");
        final Instant createdAt = created != null
                ? Instant.parse(created) : Instant.now();
        final Instant updatedAt = updated != null
                ? Instant.parse(updated) : createdAt;
        return new GraphMetadata(createdAt, updatedAt,
                textOrNull(metadataObj, "projectPath"));
    }

    private static SymbolNode nodeFromJson(final JsonNode obj) {
        final String kindName = requiredText(obj, "kind");
        final SymbolKind kind = SymbolKind.fromString(kindName);
        if (kind == null) {
            throw new IllegalArgumentException(
                    "Unknown symbol kind: " + kindName);
        }

        final String name = requiredText(obj, "name");
        final String file = requiredText(obj, "file");
        final int line = obj.path("line").asInt();

        return switch (kind) {
            case FUNCTION -> new FunctionNode(name, file, line,
                    obj.path("parameterCount").asInt(),
                    obj.path("async").asBoolean(),
                    obj.path("generator").asBoolean());
            case CLASS -> new ClassNode(name, file, line,
                    textOrNull(obj, "superClass"),
                    readMethods(obj), readProperties(obj));
            case VARIABLE -> new VariableNode(name, file, line,
                    DeclarationKind.fromKeyword(
                            requiredText(obj, "declarationKind")));
        };
    }

    private static List<ClassNode.Method> readMethods(final JsonNode obj) {
        final List<ClassNode.Method> methods = new ArrayList<>();
        for (final JsonNode m : arrayOrEmpty(obj, "methods")) {
            methods.add(new ClassNode.Method(requiredText(m, "name"),
                    textOrNull(m, "kind"), m.path("static").asBoolean()));
        }
        return methods;
    }

    private static List<ClassNode.Property> readProperties(
            final JsonNode obj) {
        final List<ClassNode.Property> properties = new ArrayList<>();
        for (final JsonNode p : arrayOrEmpty(obj, "properties")) {
            properties.add(new ClassNode.Property(requiredText(p, "name"),
                    p.path("static").asBoolean()));
        }
        return properties;
    }

    private static Iterable<JsonNode> arrayOrEmpty(final JsonNode parent,
            final String field) {
        final JsonNode value = parent.get(field);
        if (value == null || value.isNull()) {
            return List.of();
        }
        if (!value.isArray()) {
            throw new IllegalArgumentException(
                    "Field '" + field + "' is not an array");
        }
        return value;
    }

    private static String requiredText(final JsonNode parent,
            final String field) {
        final String value = textOrNull(parent, field);
        if (value == null) {
            throw new IllegalArgumentException(
                    "Missing field '" + field + "'");
        }
        return value;
    }

    private static String textOrNull(final JsonNode parent,
            final String field) {
        final JsonNode value = parent.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.asText();
    }

    private static DomainException corrupted(final String detail,
            final Throwable cause) {
        return new DomainException("Malformed cache entry: " + detail,
                "CACHE_CORRUPTED", cause);
    }

}
