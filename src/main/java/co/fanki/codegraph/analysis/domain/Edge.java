package co.fanki.codegraph.analysis.domain;

/**
 * A directed, typed relation between two ids of the {@link CodeGraph}.
 *
 * <p>The source may be a synthetic import or call site id; the target
 * is always a declared node.</p>
 *
 * @param from the source id
 * @param to the target node id
 * @param type the relation type
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Edge(String from, String to, EdgeType type) {}
