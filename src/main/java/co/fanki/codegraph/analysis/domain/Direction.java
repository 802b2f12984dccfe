package co.fanki.codegraph.analysis.domain;

/**
 * Which edges a traversal follows from each visited node.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum Direction {

    OUTGOING,
    INCOMING,
    BOTH;

    boolean followsOutgoing() {
        return this == OUTGOING || this == BOTH;
    }

    boolean followsIncoming() {
        return this == INCOMING || this == BOTH;
    }

}
