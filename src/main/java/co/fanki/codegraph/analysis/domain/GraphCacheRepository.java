package co.fanki.codegraph.analysis.domain;

import co.fanki.codegraph.shared.DomainException;
import co.fanki.codegraph.shared.Preconditions;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.DigestUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * File-based cache of serialized {@link CodeGraph}s.
 *
 * <p>One entry per project, stored as {@code graph_<hash>.json} in the
 * cache directory, where the hash is the MD5 of the project path string.
 * The key ignores file contents, so an entry goes stale when sources
 * change; only a forced rebuild refreshes it.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class GraphCacheRepository {

    private static final Logger LOG = LoggerFactory.getLogger(
            GraphCacheRepository.class);

    private static final String PREFIX = "graph_";

    private static final String SUFFIX = ".json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Path cacheDirectory;

    /**
     * Creates a new GraphCacheRepository.
     *
     * @param theCacheDirectory the directory holding cache entries,
     *        created on first write
     */
    public GraphCacheRepository(final Path theCacheDirectory) {
        this.cacheDirectory = Preconditions.requireNonNull(theCacheDirectory,
                "Cache directory is required");
    }

    /**
     * Computes the cache key of a project.
     *
     * @param projectPath the project root path
     * @return the lowercase hex MD5 of the path string
     */
    public String projectHash(final String projectPath) {
        Preconditions.requireNonBlank(projectPath,
                "Project path is required");
        return DigestUtils.md5DigestAsHex(
                projectPath.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Writes the graph as the cache entry of the project, replacing any
     * previous entry.
     *
     * <p>Stamps the graph with the project path, hash and save time.</p>
     *
     * @param graph the graph to save
     * @param projectPath the project root path
     * @return the written entry path
     * @throws DomainException with code {@code CACHE_IO} if the entry
     *         cannot be written
     */
    public Path save(final CodeGraph graph, final String projectPath) {
        Preconditions.requireNonNull(graph, "Graph is required");

        final String hash = projectHash(projectPath);
        final Path entry = entryPath(hash);
        graph.markSaved(projectPath, hash);

        try {
            Files.createDirectories(cacheDirectory);
            Files.writeString(entry, graph.toJson(), StandardCharsets.UTF_8);
        } catch (final IOException e) {
            throw new DomainException("Cannot write cache entry " + entry,
                    "CACHE_IO", e);
        }

        LOG.info("Graph saved to {}", entry);
        return entry;
    }

    /**
     * Reads the cache entry of a project.
     *
     * @param projectPath the project root path
     * @return the rebuilt graph, or empty if the project has no entry
     * @throws DomainException with code {@code CACHE_CORRUPTED} if the
     *         entry is malformed, {@code CACHE_IO} if it cannot be read
     */
    public Optional<CodeGraph> load(final String projectPath) {
        final Path entry = entryPath(projectHash(projectPath));

        if (!Files.isRegularFile(entry)) {
            LOG.info("No cached graph found for {}", projectPath);
            return Optional.empty();
        }

        final String json;
        try {
            json = Files.readString(entry, StandardCharsets.UTF_8);
        } catch (final IOException e) {
            throw new DomainException("Cannot read cache entry " + entry,
                    "CACHE_IO", e);
        }

        if (json.isBlank()) {
            throw new DomainException("Malformed cache entry: empty file",
                    "CACHE_CORRUPTED");
        }

        final CodeGraph graph = CodeGraph.fromJson(json);
        LOG.info("Graph loaded from {}", entry);
        return Optional.of(graph);
    }

    /**
     * Deletes the cache entry of a project.
     *
     * @param projectPath the project root path
     * @return true if an entry was deleted, false if there was none
     * @throws DomainException with code {@code CACHE_IO} if the entry
     *         exists but cannot be deleted
     */
    public boolean delete(final String projectPath) {
        final Path entry = entryPath(projectHash(projectPath));
        try {
            final boolean deleted = Files.deleteIfExists(entry);
            if (deleted) {
                LOG.info("Graph deleted: {}", entry);
            }
            return deleted;
        } catch (final IOException e) {
            throw new DomainException("Cannot delete cache entry " + entry,
                    "CACHE_IO", e);
        }
    }

    /**
     * Deletes every cache entry.
     *
     * @return the number of deleted entries
     * @throws DomainException with code {@code CACHE_IO} if the cache
     *         directory cannot be listed or an entry cannot be deleted
     */
    public int deleteAll() {
        int deleted = 0;
        for (final Path entry : entries()) {
            try {
                if (Files.deleteIfExists(entry)) {
                    deleted++;
                }
            } catch (final IOException e) {
                throw new DomainException(
                        "Cannot delete cache entry " + entry, "CACHE_IO", e);
            }
        }
        LOG.info("Deleted {} cached graphs", deleted);
        return deleted;
    }

    /**
     * Summarizes every readable cache entry.
     *
     * <p>Only the metadata and the node and edge counts are read. Entries
     * that cannot be parsed are skipped with a warning.</p>
     *
     * @return the entry summaries, ordered by file name
     */
    public List<CachedGraphSummary> list() {
        final List<CachedGraphSummary> summaries = new ArrayList<>();

        for (final Path entry : entries()) {
            final String fileName = entry.getFileName().toString();
            try {
                final JsonNode root = MAPPER.readTree(entry.toFile());
                if (root == null || !root.isObject()) {
                    LOG.warn("Skipping {}: not a cache entry", fileName);
                    continue;
                }
                final JsonNode metadata = root.path("metadata");
                summaries.add(new CachedGraphSummary(
                        fileName,
                        textOrNull(metadata, "projectPath"),
                        textOrNull(metadata, "createdAt"),
                        textOrNull(metadata, "updatedAt"),
                        root.path("nodes").size(),
                        root.path("edges").size()));
            } catch (final IOException e) {
                LOG.warn("Error reading {}: {}", fileName, e.getMessage());
            }
        }
        return summaries;
    }

    private List<Path> entries() {
        if (!Files.isDirectory(cacheDirectory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(cacheDirectory)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(this::isCacheEntry)
                    .sorted()
                    .toList();
        } catch (final IOException e) {
            throw new DomainException(
                    "Cannot list cache directory " + cacheDirectory,
                    "CACHE_IO", e);
        }
    }

    private boolean isCacheEntry(final Path path) {
        final String name = path.getFileName().toString();
        return name.startsWith(PREFIX) && name.endsWith(SUFFIX);
    }

    private Path entryPath(final String hash) {
        return cacheDirectory.resolve(PREFIX + hash + SUFFIX);
    }

    private static String textOrNull(final JsonNode parent,
            final String field) {
        final JsonNode value = parent.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

}
