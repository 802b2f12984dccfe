package co.fanki.codegraph.analysis.domain;

import java.time.Instant;

/**
 * Store-level metadata of a {@link CodeGraph}.
 *
 * @param createdAt when the graph was created
 * @param updatedAt when the graph was last saved
 * @param projectPath the analyzed project root, null until saved
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record GraphMetadata(
        Instant createdAt,
        Instant updatedAt,
        String projectPath
) {

    /**
     * Creates metadata for a graph created now.
     *
     * @return fresh metadata with no project path
     */
    public static GraphMetadata createdNow() {
        final Instant now = Instant.now();
        return new GraphMetadata(now, now, null);
    }

    /**
     * Returns a copy stamped as saved now for the given project.
     *
     * @param theProjectPath the project root path
     * @return the updated metadata
     */
    public GraphMetadata savedFor(final String theProjectPath) {
        return new GraphMetadata(createdAt, Instant.now(), theProjectPath);
    }

}
