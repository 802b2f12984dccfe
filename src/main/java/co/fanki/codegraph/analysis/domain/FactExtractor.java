package co.fanki.codegraph.analysis.domain;

import java.io.IOException;

/**
 * Extracts file-local symbol facts from source text.
 *
 * <p>Implementations see one file at a time and know nothing about the
 * rest of the project. They may throw on input they cannot handle; the
 * {@link ProjectAnalyzer} treats any failure as "no facts for this
 * file" and moves on.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface FactExtractor {

    /**
     * Extracts the facts of a single file.
     *
     * @param file the file path relative to the project root
     * @param content the file text
     * @return the extracted facts, never null
     * @throws IOException if the content cannot be analyzed
     */
    FileFacts extract(String file, String content) throws IOException;

}
