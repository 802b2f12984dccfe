package co.fanki.codegraph.analysis.domain;

import co.fanki.codegraph.shared.Preconditions;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Settings of a project analysis and of the graph cache.
 *
 * @param maxFileSize files larger than this many bytes are skipped
 * @param cacheDirectory the directory holding cache entries
 * @param extensions the supported file extensions, with leading dot
 * @param ignoredDirectories directory names never descended into
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record AnalysisSettings(
        long maxFileSize,
        Path cacheDirectory,
        Set<String> extensions,
        Set<String> ignoredDirectories
) {

    /** Default maximum file size: 5 MiB. */
    public static final long DEFAULT_MAX_FILE_SIZE = 5L * 1024 * 1024;

    /** Default supported extensions. */
    public static final List<String> DEFAULT_EXTENSIONS = List.of(
            ".js", ".jsx", ".ts", ".tsx", ".mjs");

    /** Default ignored directory names. */
    public static final List<String> DEFAULT_IGNORED_DIRECTORIES = List.of(
            "node_modules", ".git", "dist", "build", ".next", "coverage");

    public AnalysisSettings {
        Preconditions.requirePositive(maxFileSize,
                "Max file size must be positive");
        Preconditions.requireNonNull(cacheDirectory,
                "Cache directory is required");
        Preconditions.require(extensions != null && !extensions.isEmpty(),
                "At least one extension is required");
        extensions = Set.copyOf(extensions);
        ignoredDirectories = ignoredDirectories == null
                ? Set.of() : Set.copyOf(ignoredDirectories);
    }

    /**
     * Creates the default settings with the given cache directory.
     *
     * @param cacheDirectory the cache directory
     * @return settings with default size limit, extensions and ignores
     */
    public static AnalysisSettings defaults(final Path cacheDirectory) {
        return new AnalysisSettings(DEFAULT_MAX_FILE_SIZE, cacheDirectory,
                Set.copyOf(DEFAULT_EXTENSIONS),
                Set.copyOf(DEFAULT_IGNORED_DIRECTORIES));
    }

}
