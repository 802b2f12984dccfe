package co.fanki.codegraph.analysis.domain;

/**
 * A call expression found in a file.
 *
 * @param name the callee, either {@code name} or {@code object.property}
 * @param line the line where the call starts
 * @param argumentCount the number of arguments passed
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record CallFact(String name, int line, int argumentCount) {}
