package co.fanki.codegraph.analysis.domain;

/**
 * A freshly built graph together with its build statistics.
 *
 * @param graph the built graph
 * @param statistics the build statistics
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ProjectBuild(CodeGraph graph, BuildStatistics statistics) {}
