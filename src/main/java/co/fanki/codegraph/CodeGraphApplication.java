package co.fanki.codegraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Code Graph Engine Application.
 *
 * <p>Builds a graph of the declarations of a JavaScript/TypeScript project
 * (functions, classes, variables) and of the imports, calls and
 * inheritance that link them, caches it per project on disk and answers
 * symbol, dependency and call graph queries over it.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootApplication
public class CodeGraphApplication {

    /**
     * Main entry point for the application.
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        SpringApplication.run(CodeGraphApplication.class, args);
    }

}
