package co.fanki.codegraph.analysis.domain;

/**
 * Summary of one cache entry, read without rebuilding the graph.
 *
 * @param file the cache entry file name
 * @param projectPath the project root the entry was saved for
 * @param createdAt the graph creation timestamp, ISO-8601
 * @param updatedAt the last save timestamp, ISO-8601
 * @param nodeCount the number of nodes in the entry
 * @param edgeCount the number of edges in the entry
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record CachedGraphSummary(
        String file,
        String projectPath,
        String createdAt,
        String updatedAt,
        int nodeCount,
        int edgeCount
) {}
