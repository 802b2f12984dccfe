package co.fanki.codegraph.analysis.application;

import co.fanki.codegraph.analysis.application.CodeGraphService.AnalysisResult;
import co.fanki.codegraph.analysis.domain.AnalysisSettings;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Integration tests for the Spring wiring of {@link CodeGraphService}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootTest
class CodeGraphServiceIntegrationTest {

    @TempDir
    static Path workDir;

    @DynamicPropertySource
    static void configureProperties(final DynamicPropertyRegistry registry) {
        registry.add("code-graph.cache-dir",
                () -> workDir.resolve("db").toString());
        registry.add("code-graph.max-file-size", () -> "1024");
    }

    @Autowired
    private CodeGraphService service;

    @Autowired
    private AnalysisSettings settings;

    @Test
    void whenStarting_givenProperties_shouldBindSettings() {
        assertEquals(1024, settings.maxFileSize());
        assertEquals(workDir.resolve("db"), settings.cacheDirectory());
        assertTrue(settings.extensions().contains(".mjs"));
        assertTrue(settings.ignoredDirectories().contains("node_modules"));
    }

    @Test
    void whenAnalyzing_givenProject_shouldCacheUnderConfiguredDirectory()
            throws IOException {
        final Path project = Files.createDirectories(
                workDir.resolve("shop"));
        Files.writeString(project.resolve("cart.js"),
                "export class Cart {}\nexport function total(cart) {}\n");
        Files.writeString(project.resolve("huge.js"),
                "// " + "x".repeat(2048) + "\n");

        final AnalysisResult result = service.analyze(project.toString(),
                true);

        assertFalse(result.cached());
        assertEquals(2, result.nodeCount());
        assertEquals(1, result.statistics().skippedFiles().size());
        try (Stream<Path> entries = Files.list(workDir.resolve("db"))) {
            assertTrue(entries.anyMatch(p -> p.getFileName().toString()
                    .startsWith("graph_")));
        }
        assertEquals(1, service.getFileSymbols(project.toString(),
                "cart.js").symbols().stream()
                .filter(s -> s.symbol().name().equals("Cart")).count());
    }

}
