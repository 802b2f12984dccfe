package co.fanki.codegraph.analysis.domain;

import co.fanki.codegraph.analysis.domain.BuildStatistics.SkippedFile;
import co.fanki.codegraph.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a {@link CodeGraph} from a project directory.
 *
 * <p>The build runs in three steps:</p>
 * <ol>
 *   <li>Walk the project root for files with a supported extension,
 *       outside ignored directories</li>
 *   <li>Read and extract each file on its own; oversized, unreadable or
 *       unparseable files are skipped and recorded, never fatal</li>
 *   <li>Hand the facts of all files to the {@link GraphResolver}, which
 *       only starts once every file has been extracted</li>
 * </ol>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ProjectAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(
            ProjectAnalyzer.class);

    private final AnalysisSettings settings;
    private final FactExtractor factExtractor;
    private final GraphResolver resolver;

    /**
     * Creates a new ProjectAnalyzer.
     *
     * @param theSettings the analysis settings
     * @param theFactExtractor the per-file fact extractor
     * @param theResolver the cross-file resolver
     */
    public ProjectAnalyzer(final AnalysisSettings theSettings,
            final FactExtractor theFactExtractor,
            final GraphResolver theResolver) {
        this.settings = Preconditions.requireNonNull(theSettings,
                "Settings are required");
        this.factExtractor = Preconditions.requireNonNull(theFactExtractor,
                "Fact extractor is required");
        this.resolver = Preconditions.requireNonNull(theResolver,
                "Resolver is required");
    }

    /**
     * Builds the graph of the project rooted at the given directory.
     *
     * @param projectRoot the project root directory
     * @return the built graph and its statistics
     * @throws IOException if the project directory cannot be walked
     */
    public ProjectBuild analyze(final Path projectRoot) throws IOException {
        Preconditions.requireNonNull(projectRoot,
                "Project root is required");

        LOG.info("Building code graph from: {}", projectRoot);
        final long startTime = System.currentTimeMillis();

        final List<String> files = discoverFiles(projectRoot);
        LOG.info("Discovered {} source files", files.size());

        final Map<String, FileFacts> factsByFile = new LinkedHashMap<>();
        final List<SkippedFile> skipped = new ArrayList<>();

        for (final String file : files) {
            final Path fullPath = projectRoot.resolve(file);
            final String reason = extractInto(file, fullPath, factsByFile);
            if (reason != null) {
                skipped.add(new SkippedFile(file, reason));
            }
        }

        final CodeGraph graph = resolver.resolve(factsByFile);

        final BuildStatistics statistics = new BuildStatistics(
                graph.nodeCount(), graph.edgeCount(), files.size(),
                factsByFile.size(), skipped);

        LOG.info("Code graph built in {}ms: {} nodes, {} edges,"
                        + " {} files analyzed, {} skipped",
                System.currentTimeMillis() - startTime,
                statistics.nodeCount(), statistics.edgeCount(),
                statistics.analyzedFileCount(), skipped.size());

        return new ProjectBuild(graph, statistics);
    }

    /**
     * Reads and extracts one file into the facts map.
     *
     * @return null on success, otherwise the reason the file was skipped
     */
    private String extractInto(final String file, final Path fullPath,
            final Map<String, FileFacts> factsByFile) {

        final String content;
        try {
            final long size = Files.size(fullPath);
            if (size > settings.maxFileSize()) {
                LOG.warn("Skipping {}: {} bytes exceeds maximum file size",
                        file, size);
                return "exceeds maximum file size";
            }
            content = new String(Files.readAllBytes(fullPath),
                    StandardCharsets.UTF_8);
        } catch (final IOException e) {
            LOG.warn("Skipping {}: cannot be read: {}", file,
                    e.getMessage());
            return "unreadable: " + e.getMessage();
        }

        try {
            final FileFacts extracted = factExtractor.extract(file, content);
            final FileFacts facts = extracted != null
                    ? extracted : FileFacts.empty(file);
            factsByFile.put(file, facts);
            LOG.debug("Extracted {}: {} declarations, {} calls, {} imports",
                    file, facts.declarations().size(), facts.calls().size(),
                    facts.imports().size());
            return null;
        } catch (final Exception e) {
            LOG.warn("Skipping {}: extraction failed: {}", file,
                    e.getMessage());
            return "extraction failed: " + e.getMessage();
        }
    }

    /**
     * Discovers all supported source files under the project root.
     *
     * <p>Directories named in the ignore list are skipped, at any depth.
     * Entries that cannot be read are logged and left out.</p>
     *
     * @param projectRoot the project root directory
     * @return sorted file paths relative to the root, with '/' separators
     * @throws IOException if the root itself cannot be walked
     */
    public List<String> discoverFiles(final Path projectRoot)
            throws IOException {

        if (!Files.isDirectory(projectRoot)) {
            LOG.warn("Project root not found: {}", projectRoot);
            return List.of();
        }

        final SourceFileCollector collector = new SourceFileCollector(
                projectRoot, settings);
        Files.walkFileTree(projectRoot, collector);

        final List<String> files = new ArrayList<>(collector.files());
        Collections.sort(files);
        return files;
    }

    /**
     * Collects supported source files while walking a project tree.
     */
    static final class SourceFileCollector extends SimpleFileVisitor<Path> {

        private final Path root;

        private final AnalysisSettings settings;

        private final List<String> files = new ArrayList<>();

        SourceFileCollector(final Path theRoot,
                final AnalysisSettings theSettings) {
            this.root = theRoot;
            this.settings = theSettings;
        }

        @Override
        public FileVisitResult preVisitDirectory(final Path dir,
                final BasicFileAttributes attrs) {
            if (!dir.equals(root) && settings.ignoredDirectories().contains(
                    dir.getFileName().toString())) {
                return FileVisitResult.SKIP_SUBTREE;
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFile(final Path file,
                final BasicFileAttributes attrs) {
            if (Files.isRegularFile(file) && hasSupportedExtension(file)) {
                files.add(root.relativize(file).toString()
                        .replace('\\', '/'));
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(final Path file,
                final IOException e) {
            LOG.warn("Skipping {}: cannot be read: {}", file, e.getMessage());
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult postVisitDirectory(final Path dir,
                final IOException e) {
            if (e != null) {
                LOG.warn("Directory {} was not fully listed: {}", dir,
                        e.getMessage());
            }
            return FileVisitResult.CONTINUE;
        }

        List<String> files() {
            return files;
        }

        private boolean hasSupportedExtension(final Path path) {
            final String name = path.getFileName().toString();
            for (final String extension : settings.extensions()) {
                if (name.endsWith(extension)) {
                    return true;
                }
            }
            return false;
        }
    }

}
