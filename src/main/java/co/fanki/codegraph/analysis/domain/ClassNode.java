package co.fanki.codegraph.analysis.domain;

import co.fanki.codegraph.shared.Preconditions;

import java.util.List;

/**
 * A class declaration with its members.
 *
 * <p>The superclass is kept as a plain name reference; linking it to
 * a declaration is the job of the {@link GraphResolver}.</p>
 *
 * @param name the class name
 * @param file the declaring file
 * @param line the 1-based declaration line
 * @param superClass the name in the extends clause, or null
 * @param methods the declared methods, in source order
 * @param properties the declared properties, in source order
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ClassNode(
        String name,
        String file,
        int line,
        String superClass,
        List<Method> methods,
        List<Property> properties
) implements SymbolNode {

    public ClassNode {
        Preconditions.requireNonBlank(name, "Class name is required");
        Preconditions.requireNonBlank(file, "File is required");
        methods = methods == null ? List.of() : List.copyOf(methods);
        properties = properties == null
                ? List.of() : List.copyOf(properties);
    }

    /**
     * A method declared in the class body.
     *
     * @param name the method name
     * @param kind one of constructor, method, get, set
     * @param isStatic whether the method is static
     */
    public record Method(String name, String kind, boolean isStatic) {}

    /**
     * A property declared in the class body.
     *
     * @param name the property name
     * @param isStatic whether the property is static
     */
    public record Property(String name, boolean isStatic) {}

    /** {@inheritDoc} */
    @Override
    public SymbolKind kind() {
        return SymbolKind.CLASS;
    }

    /**
     * Checks whether this class declares a superclass.
     *
     * @return true if an extends clause names a superclass
     */
    public boolean hasSuperClass() {
        return superClass != null && !superClass.isBlank();
    }

}
