package co.fanki.codegraph.analysis.application;

import co.fanki.codegraph.analysis.domain.BuildStatistics;
import co.fanki.codegraph.analysis.domain.CachedGraphSummary;
import co.fanki.codegraph.analysis.domain.CodeGraph;
import co.fanki.codegraph.analysis.domain.Connection;
import co.fanki.codegraph.analysis.domain.GraphCacheRepository;
import co.fanki.codegraph.analysis.domain.GraphMetadata;
import co.fanki.codegraph.analysis.domain.GraphQueryEngine;
import co.fanki.codegraph.analysis.domain.ProjectAnalyzer;
import co.fanki.codegraph.analysis.domain.ProjectBuild;
import co.fanki.codegraph.analysis.domain.SymbolKind;
import co.fanki.codegraph.shared.DomainException;
import co.fanki.codegraph.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Operation façade of the code graph engine.
 *
 * <p>Keeps one current graph per project path. A graph only becomes
 * current once its build or load has completed, so a graph under
 * construction is never visible to queries. Builds and loads of the same
 * project are serialized on the project path.</p>
 *
 * <p>Cache entries are keyed by the project path string only: a cached
 * graph is served as is after source edits until {@code force} is used.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class CodeGraphService {

    private static final Logger LOG = LoggerFactory.getLogger(
            CodeGraphService.class);

    private final Map<String, CodeGraph> graphs = new ConcurrentHashMap<>();

    private final Map<String, Object> projectLocks =
            new ConcurrentHashMap<>();

    private final ProjectAnalyzer projectAnalyzer;
    private final GraphCacheRepository cacheRepository;

    /**
     * Creates a new CodeGraphService.
     *
     * @param theProjectAnalyzer builds graphs from project directories
     * @param theCacheRepository persists graphs per project path
     */
    public CodeGraphService(final ProjectAnalyzer theProjectAnalyzer,
            final GraphCacheRepository theCacheRepository) {
        this.projectAnalyzer = Preconditions.requireNonNull(
                theProjectAnalyzer, "Project analyzer is required");
        this.cacheRepository = Preconditions.requireNonNull(
                theCacheRepository, "Cache repository is required");
    }

    /**
     * Analyzes a project, reusing its cache entry unless forced.
     *
     * <p>Without {@code force}, an existing cache entry is loaded and
     * becomes current. A missing or corrupted entry, or {@code force},
     * triggers a full rebuild that is saved and becomes current.</p>
     *
     * @param projectPath the project root path
     * @param force true to ignore the cache
     * @return the analysis outcome
     * @throws DomainException with code {@code PROJECT_NOT_FOUND} if the
     *         path is not a directory, {@code CACHE_IO} if the rebuilt
     *         graph cannot be saved
     */
    public AnalysisResult analyze(final String projectPath,
            final boolean force) {
        Preconditions.requireNonBlank(projectPath, "Project path is required");

        synchronized (lockFor(projectPath)) {
            if (!force) {
                final Optional<CodeGraph> cached = loadQuietly(projectPath);
                if (cached.isPresent()) {
                    final CodeGraph graph = cached.get();
                    graphs.put(projectPath, graph);
                    return AnalysisResult.fromCache(graph);
                }
            }

            final Path root = Path.of(projectPath);
            if (!Files.isDirectory(root)) {
                throw new DomainException(
                        "Project directory not found: " + projectPath,
                        "PROJECT_NOT_FOUND");
            }

            final ProjectBuild build;
            try {
                build = projectAnalyzer.analyze(root);
            } catch (final IOException e) {
                throw new UncheckedIOException(
                        "Cannot walk project " + projectPath, e);
            }

            cacheRepository.save(build.graph(), projectPath);
            graphs.put(projectPath, build.graph());

            LOG.info("Project {} analyzed: {} nodes, {} edges", projectPath,
                    build.statistics().nodeCount(),
                    build.statistics().edgeCount());

            return AnalysisResult.fromBuild(build);
        }
    }

    /**
     * Loads a project's cache entry and makes it current.
     *
     * @param projectPath the project root path
     * @return the load outcome; unsuccessful if there is no usable entry
     */
    public LoadResult loadCached(final String projectPath) {
        Preconditions.requireNonBlank(projectPath, "Project path is required");

        synchronized (lockFor(projectPath)) {
            final Optional<CodeGraph> cached = loadQuietly(projectPath);
            if (cached.isEmpty()) {
                return LoadResult.notFound();
            }
            final CodeGraph graph = cached.get();
            graphs.put(projectPath, graph);
            return LoadResult.loaded(graph);
        }
    }

    /**
     * Deletes the cache entry of one project, or of all projects.
     *
     * <p>Deleting a project's entry also drops its current graph.</p>
     *
     * @param projectPath the project root path, null to clear every entry
     * @return the clear outcome; a missing entry is reported, not raised
     */
    public ClearResult clearCache(final String projectPath) {
        if (projectPath == null || projectPath.isBlank()) {
            final int deleted = cacheRepository.deleteAll();
            graphs.clear();
            return new ClearResult(true,
                    "Cleared " + deleted + " cached graphs", deleted);
        }

        graphs.remove(projectPath);
        final boolean deleted = cacheRepository.delete(projectPath);
        return deleted
                ? new ClearResult(true, ClearResult.CLEARED, 1)
                : new ClearResult(false, ClearResult.NOTHING_TO_DELETE, 0);
    }

    /**
     * Summarizes every cache entry.
     *
     * @return the readable cache entries
     */
    public List<CachedGraphSummary> listCached() {
        return cacheRepository.list();
    }

    /**
     * Returns a query engine over the current graph of a project.
     *
     * @param projectPath the project root path
     * @return the query engine
     * @throws DomainException with code {@code GRAPH_NOT_LOADED} if the
     *         project was neither analyzed nor loaded
     */
    public GraphQueryEngine queries(final String projectPath) {
        Preconditions.requireNonBlank(projectPath, "Project path is required");

        final CodeGraph graph = graphs.get(projectPath);
        if (graph == null) {
            throw new DomainException(
                    "No graph loaded for project: " + projectPath
                            + ". Analyze or load it first",
                    "GRAPH_NOT_LOADED");
        }
        return new GraphQueryEngine(graph);
    }

    /**
     * Checks if a project has a current graph.
     *
     * @param projectPath the project root path
     * @return true if queries can be run for the project
     */
    public boolean isLoaded(final String projectPath) {
        return projectPath != null && graphs.containsKey(projectPath);
    }

    /**
     * Searches symbols of a project.
     *
     * @param projectPath the project root path
     * @param query the name or path substring
     * @param type optional kind name ({@code function}, {@code class},
     *        {@code variable}); null or blank searches all kinds
     * @return the search result, empty if the type names no known kind
     */
    public GraphQueryEngine.SymbolSearch findSymbol(final String projectPath,
            final String query, final String type) {
        final GraphQueryEngine engine = queries(projectPath);
        if (type == null || type.isBlank()) {
            return engine.findSymbol(query, null);
        }
        final SymbolKind kind = SymbolKind.fromString(type);
        if (kind == null) {
            LOG.debug("Unknown symbol type {}, nothing matches", type);
            return new GraphQueryEngine.SymbolSearch(query, type, 0,
                    List.of());
        }
        return engine.findSymbol(query, kind);
    }

    /**
     * Returns what a symbol of a project uses.
     *
     * @param projectPath the project root path
     * @param id the symbol id
     * @param depth the hop limit
     * @return the reached connections
     */
    public List<Connection> getDependencies(final String projectPath,
            final String id, final int depth) {
        return queries(projectPath).getDependencies(id, depth);
    }

    /**
     * Returns what uses a symbol of a project.
     *
     * @param projectPath the project root path
     * @param id the symbol id
     * @param depth the hop limit
     * @return the reached connections
     */
    public List<Connection> getDependents(final String projectPath,
            final String id, final int depth) {
        return queries(projectPath).getDependents(id, depth);
    }

    /**
     * Builds the call graph of a project's functions matching a name.
     *
     * @param projectPath the project root path
     * @param functionName the function name, or part of it
     * @param depth the hop limit
     * @return the call graph
     */
    public GraphQueryEngine.CallGraph getCallGraph(final String projectPath,
            final String functionName, final int depth) {
        return queries(projectPath).getCallGraph(functionName, depth);
    }

    /**
     * Lists the symbols declared in a file of a project.
     *
     * @param projectPath the project root path
     * @param file the file path relative to the project root
     * @return the file's symbols
     */
    public GraphQueryEngine.FileSymbols getFileSymbols(
            final String projectPath, final String file) {
        return queries(projectPath).getFileSymbols(file);
    }

    /**
     * Returns the statistics of a project's graph.
     *
     * @param projectPath the project root path
     * @return the graph statistics
     */
    public GraphQueryEngine.GraphStats getGraphStats(
            final String projectPath) {
        return queries(projectPath).getGraphStats();
    }

    /**
     * Loads a cache entry, treating a corrupted one as missing.
     */
    private Optional<CodeGraph> loadQuietly(final String projectPath) {
        try {
            return cacheRepository.load(projectPath);
        } catch (final DomainException e) {
            if (!"CACHE_CORRUPTED".equals(e.getErrorCode())) {
                throw e;
            }
            LOG.warn("Ignoring corrupted cache entry for {}: {}",
                    projectPath, e.getMessage());
            return Optional.empty();
        }
    }

    private Object lockFor(final String projectPath) {
        return projectLocks.computeIfAbsent(projectPath, k -> new Object());
    }

    /**
     * Outcome of {@link #analyze(String, boolean)}.
     *
     * @param success always true; failures are raised
     * @param message what happened
     * @param cached true if the graph came from the cache
     * @param nodeCount the number of nodes
     * @param edgeCount the number of edges
     * @param metadata the graph metadata
     * @param statistics the build statistics, null when cached
     */
    public record AnalysisResult(
            boolean success,
            String message,
            boolean cached,
            int nodeCount,
            int edgeCount,
            GraphMetadata metadata,
            BuildStatistics statistics
    ) {
        static AnalysisResult fromCache(final CodeGraph graph) {
            return new AnalysisResult(true, "Project loaded from cache", true,
                    graph.nodeCount(), graph.edgeCount(), graph.metadata(),
                    null);
        }

        static AnalysisResult fromBuild(final ProjectBuild build) {
            return new AnalysisResult(true,
                    "Project analyzed and cached successfully", false,
                    build.statistics().nodeCount(),
                    build.statistics().edgeCount(),
                    build.graph().metadata(), build.statistics());
        }
    }

    /**
     * Outcome of {@link #loadCached(String)}.
     */
    public record LoadResult(
            boolean success,
            String message,
            int nodeCount,
            int edgeCount,
            GraphMetadata metadata
    ) {
        static LoadResult notFound() {
            return new LoadResult(false,
                    "No cached graph found for this project", 0, 0, null);
        }

        static LoadResult loaded(final CodeGraph graph) {
            return new LoadResult(true, "Graph loaded from cache",
                    graph.nodeCount(), graph.edgeCount(), graph.metadata());
        }
    }

    /**
     * Outcome of {@link #clearCache(String)}.
     */
    public record ClearResult(
            boolean success,
            String message,
            int deletedCount
    ) {
        /** Message when a project's entry was deleted. */
        public static final String CLEARED = "Cache cleared for project";

        /** Message when a project had no entry. */
        public static final String NOTHING_TO_DELETE =
                "No cache found for project";
    }

}
