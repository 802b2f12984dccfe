package co.fanki.codegraph.config;

import co.fanki.codegraph.analysis.domain.AnalysisSettings;
import co.fanki.codegraph.analysis.domain.FactExtractor;
import co.fanki.codegraph.analysis.domain.GraphCacheRepository;
import co.fanki.codegraph.analysis.domain.GraphResolver;
import co.fanki.codegraph.analysis.domain.ProjectAnalyzer;
import co.fanki.codegraph.analysis.domain.nodejs.NodeJsFactExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Wiring of the code graph engine.
 *
 * <p>Settings come from the {@code code-graph.*} properties; the size
 * limit and the cache directory can be overridden through the
 * {@code MAX_FILE_SIZE} and {@code DB_PATH} environment variables.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class GraphEngineConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(
            GraphEngineConfiguration.class);

    /**
     * Creates the analysis settings.
     *
     * @param maxFileSize largest analyzed file, in bytes
     * @param cacheDir the cache directory
     * @param extensions the supported file extensions
     * @param ignoredDirs the directory names never descended into
     * @return the settings
     */
    @Bean
    public AnalysisSettings analysisSettings(
            @Value("${code-graph.max-file-size:5242880}")
            final long maxFileSize,
            @Value("${code-graph.cache-dir:./db}")
            final String cacheDir,
            @Value("${code-graph.extensions:.js,.jsx,.ts,.tsx,.mjs}")
            final String[] extensions,
            @Value("${code-graph.ignored-dirs:node_modules,.git,dist,build,"
                    + ".next,coverage}")
            final String[] ignoredDirs) {

        final AnalysisSettings settings = new AnalysisSettings(maxFileSize,
                Path.of(cacheDir), Set.copyOf(List.of(extensions)),
                Set.copyOf(List.of(ignoredDirs)));

        LOG.info("Code graph settings: max file size {} bytes, cache dir {}",
                settings.maxFileSize(),
                settings.cacheDirectory().toAbsolutePath());
        return settings;
    }

    /**
     * Creates the cache repository over the configured directory.
     *
     * @param settings the analysis settings
     * @return the cache repository
     */
    @Bean
    public GraphCacheRepository graphCacheRepository(
            final AnalysisSettings settings) {
        return new GraphCacheRepository(settings.cacheDirectory());
    }

    /**
     * Creates the JavaScript/TypeScript fact extractor.
     *
     * @return the fact extractor
     */
    @Bean
    public FactExtractor factExtractor() {
        return new NodeJsFactExtractor();
    }

    /**
     * Creates the cross-file resolver.
     *
     * @return the resolver
     */
    @Bean
    public GraphResolver graphResolver() {
        return new GraphResolver();
    }

    /**
     * Creates the project analyzer.
     *
     * @param settings the analysis settings
     * @param factExtractor the fact extractor
     * @param resolver the resolver
     * @return the project analyzer
     */
    @Bean
    public ProjectAnalyzer projectAnalyzer(final AnalysisSettings settings,
            final FactExtractor factExtractor,
            final GraphResolver resolver) {
        return new ProjectAnalyzer(settings, factExtractor, resolver);
    }

}
