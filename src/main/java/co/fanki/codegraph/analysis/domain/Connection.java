package co.fanki.codegraph.analysis.domain;

/**
 * An edge reached during a traversal, with both endpoints resolved.
 *
 * @param from the source id
 * @param to the target id
 * @param type the relation type
 * @param fromData the source node, or null for synthetic sites
 * @param toData the target node, or null if unknown
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Connection(
        String from,
        String to,
        EdgeType type,
        SymbolNode fromData,
        SymbolNode toData
) {}
