package co.fanki.codegraph.analysis.domain;

/**
 * An export found in a file: a default export or one specifier of an
 * export list.
 *
 * @param exported the exported name, {@code default} for default exports
 * @param local the local name being exported, or null
 * @param line the line of the export statement
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ExportFact(String exported, String local, int line) {

    /**
     * Checks whether this is the default export.
     *
     * @return true if the exported name is {@code default}
     */
    public boolean isDefault() {
        return ImportFact.DEFAULT.equals(exported);
    }

}
