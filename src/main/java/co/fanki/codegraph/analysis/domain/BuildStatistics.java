package co.fanki.codegraph.analysis.domain;

import java.util.List;

/**
 * Summary of a graph build.
 *
 * @param nodeCount the number of nodes in the built graph
 * @param edgeCount the number of edges in the built graph
 * @param fileCount the number of discovered source files
 * @param analyzedFileCount the number of files whose facts were used
 * @param skippedFiles the files left out, with the reason
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record BuildStatistics(
        int nodeCount,
        int edgeCount,
        int fileCount,
        int analyzedFileCount,
        List<SkippedFile> skippedFiles
) {

    public BuildStatistics {
        skippedFiles = skippedFiles == null
                ? List.of() : List.copyOf(skippedFiles);
    }

    /**
     * A file left out of the build.
     *
     * @param file the file path relative to the project root
     * @param reason why the file was skipped
     */
    public record SkippedFile(String file, String reason) {}

}
