package co.fanki.codegraph.analysis.domain;

/**
 * A node found by {@link CodeGraph#searchNodes(String, SymbolKind)}.
 *
 * @param id the node id
 * @param node the matched node
 * @param score 2 when the name matches, 1 when only the file path does
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record SymbolMatch(String id, SymbolNode node, int score) {}
