package co.fanki.codegraph.analysis.domain.nodejs;

import co.fanki.codegraph.analysis.domain.CallFact;
import co.fanki.codegraph.analysis.domain.ClassNode;
import co.fanki.codegraph.analysis.domain.DeclarationKind;
import co.fanki.codegraph.analysis.domain.ExportFact;
import co.fanki.codegraph.analysis.domain.FactExtractor;
import co.fanki.codegraph.analysis.domain.FileFacts;
import co.fanki.codegraph.analysis.domain.FunctionNode;
import co.fanki.codegraph.analysis.domain.ImportFact;
import co.fanki.codegraph.analysis.domain.SymbolNode;
import co.fanki.codegraph.analysis.domain.VariableNode;
import co.fanki.codegraph.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * JavaScript/TypeScript implementation of {@link FactExtractor}.
 *
 * <p>Pattern based: every pattern runs over a {@link MaskedSource}, so
 * comments and string literals never produce facts. Recognized
 * constructs:</p>
 * <ul>
 *   <li>Function declarations: {@code [async] function[*] name(params)}.
 *       Named function expressions are left out.</li>
 *   <li>Class declarations with an optional {@code extends Identifier}
 *       clause, their methods (constructor, method, get, set) and their
 *       public properties. Private {@code #members} are left out.</li>
 *   <li>{@code const}, {@code let} and {@code var} declarators bound to a
 *       plain identifier; destructuring patterns are left out.</li>
 *   <li>Calls whose callee is an identifier, {@code foo(...)}, or a
 *       member of an identifier, {@code obj.foo(...)}, recorded as
 *       {@code obj.foo}.</li>
 *   <li>ES module imports (default, named, namespace) and exports
 *       ({@code export default}, {@code export { a as b }}).</li>
 * </ul>
 *
 * <p>Declarations are reported in source order. Lines are 1-based and
 * point at the start of the construct.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class NodeJsFactExtractor implements FactExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(
            NodeJsFactExtractor.class);

    private static final String IDENTIFIER = "[A-Za-z_$][\\w$]*";

    /** Matches a function declaration up to its opening parenthesis. */
    private static final Pattern FUNCTION_PATTERN = Pattern.compile(
            "(?<![\\w$.])(async\\s+)?function\\b\\s*(\\*)?\\s*("
                    + IDENTIFIER + ")\\s*(?:<[^>(]*>)?\\s*\\(");

    /** Matches a class declaration header. */
    private static final Pattern CLASS_PATTERN = Pattern.compile(
            "(?<![\\w$.])(?:abstract\\s+)?class\\s+(" + IDENTIFIER + ")"
                    + "(?:\\s*<[^>{]*>)?"
                    + "(?:\\s+extends\\s+([A-Za-z_$][\\w$.]*))?");

    /** Matches a variable declaration and its first binding. */
    private static final Pattern VARIABLE_PATTERN = Pattern.compile(
            "(?<![\\w$.])(const|let|var)\\s+(" + IDENTIFIER + ")");

    /** Matches an identifier or member call up to the parenthesis. */
    private static final Pattern CALL_PATTERN = Pattern.compile(
            "(?<![\\w$.#])(" + IDENTIFIER + ")(?:\\s*\\.\\s*("
                    + IDENTIFIER + "))?\\s*\\(");

    /** Matches an import clause up to the opening quote of its source. */
    private static final Pattern IMPORT_PATTERN = Pattern.compile(
            "(?<![\\w$.])import\\s+(?:type\\s+)?([\\w$*{}\\s,]*?)\\s*"
                    + "\\bfrom\\s*(['\"])");

    /** Matches an export list. */
    private static final Pattern EXPORT_LIST_PATTERN = Pattern.compile(
            "(?<![\\w$.])export\\s+(?:type\\s+)?\\{([^}]*)}");

    /** Matches a default export. */
    private static final Pattern EXPORT_DEFAULT_PATTERN = Pattern.compile(
            "(?<![\\w$.])export\\s+default\\b");

    /** Matches member modifiers at the start of a class member. */
    private static final Pattern MODIFIER_PATTERN = Pattern.compile(
            "^(static|public|private|protected|readonly|override|abstract"
                    + "|declare|accessor)\\s+");

    /** Matches a class method header. */
    private static final Pattern METHOD_PATTERN = Pattern.compile(
            "^(async\\s+)?(?:(get|set)\\s+)?(\\*\\s*)?(" + IDENTIFIER
                    + ")\\s*\\??\\s*(?:<[^>]*>)?\\s*\\(");

    /** Matches a class property. */
    private static final Pattern PROPERTY_PATTERN = Pattern.compile(
            "^(" + IDENTIFIER + ")\\s*[?!]?\\s*(?::|=|;|$)");

    /** Matches a method body opening after a parameter list. */
    private static final Pattern DEFINITION_TAIL_PATTERN = Pattern.compile(
            "^\\s*(?::[^={}();]+)?\\{");

    private static final Pattern IDENTIFIER_PATTERN = Pattern.compile(
            IDENTIFIER);

    /** Words that precede a parenthesis without being a call. */
    private static final Set<String> NON_CALLEES = Set.of(
            "if", "for", "while", "switch", "catch", "function", "return",
            "typeof", "void", "delete", "await", "yield", "in", "of",
            "instanceof", "do", "else", "case", "throw", "super", "import",
            "class", "new", "async", "with", "this", "export");

    /** Words after which a function or class is an expression. */
    private static final Set<String> EXPRESSION_WORDS = Set.of(
            "return", "yield", "await", "typeof", "void", "new", "in", "of",
            "case", "throw");

    private static final String EXPRESSION_PUNCTUATION = "=(,:?!&|[+-*/%<>~^";

    /** {@inheritDoc} */
    @Override
    public FileFacts extract(final String file, final String content) {
        Preconditions.requireNonBlank(file, "File is required");
        Preconditions.requireNonNull(content, "Content is required");

        final MaskedSource source = new MaskedSource(content);

        final List<Positioned<SymbolNode>> declarations =
                new ArrayList<>();
        extractFunctions(file, source, declarations);
        extractClasses(file, source, declarations);
        extractVariables(file, source, declarations);
        declarations.sort(Comparator.comparingInt(Positioned::offset));

        final List<SymbolNode> symbols = new ArrayList<>();
        for (final Positioned<SymbolNode> declaration : declarations) {
            symbols.add(declaration.value());
        }

        return new FileFacts(file, symbols, extractCalls(source),
                extractImports(source), extractExports(source));
    }

    private void extractFunctions(final String file,
            final MaskedSource source,
            final List<Positioned<SymbolNode>> out) {

        final Matcher matcher = FUNCTION_PATTERN.matcher(source.masked());
        while (matcher.find()) {
            if (isExpressionContext(source, matcher.start())) {
                continue;
            }
            final int open = matcher.end() - 1;
            final int close = source.matchingClose(open);
            final int parameters = close < 0
                    ? 0 : source.splitTopLevel(open + 1, close).size();

            out.add(new Positioned<>(matcher.start(), new FunctionNode(
                    matcher.group(3), file, source.lineOf(matcher.start()),
                    parameters, matcher.group(1) != null,
                    matcher.group(2) != null)));
        }
    }

    private void extractClasses(final String file,
            final MaskedSource source,
            final List<Positioned<SymbolNode>> out) {

        final String masked = source.masked();
        final Matcher matcher = CLASS_PATTERN.matcher(masked);
        while (matcher.find()) {
            final String name = matcher.group(1);
            if ("extends".equals(name) || "implements".equals(name)
                    || isExpressionContext(source, matcher.start())) {
                continue;
            }

            final String superClass = matcher.group(2);
            final List<ClassNode.Method> methods = new ArrayList<>();
            final List<ClassNode.Property> properties = new ArrayList<>();

            final int open = masked.indexOf('{', matcher.end());
            if (open >= 0) {
                int close = source.matchingClose(open);
                if (close < 0) {
                    LOG.debug("Unbalanced body for class {} in {}",
                            name, file);
                    close = masked.length();
                }
                extractMembers(source, open + 1, close, methods, properties);
            }

            // Only a plain identifier counts as a superclass name.
            final String parent = superClass != null
                    && superClass.indexOf('.') < 0 ? superClass : null;

            out.add(new Positioned<>(matcher.start(), new ClassNode(name, file,
                    source.lineOf(matcher.start()), parent, methods,
                    properties)));
        }
    }

    /**
     * Scans the lines of a class body that start at member level.
     */
    private void extractMembers(final MaskedSource source, final int from,
            final int to, final List<ClassNode.Method> methods,
            final List<ClassNode.Property> properties) {

        final String masked = source.masked();
        int depth = 0;
        boolean lineStart = true;

        for (int i = from; i < to; i++) {
            if (lineStart && depth == 0) {
                int lineEnd = masked.indexOf('\n', i);
                if (lineEnd < 0 || lineEnd > to) {
                    lineEnd = to;
                }
                parseMember(masked.substring(i, lineEnd).trim(), methods,
                        properties);
            }
            lineStart = false;

            final char c = masked.charAt(i);
            switch (c) {
                case '{', '(', '[' -> depth++;
                case '}', ')', ']' -> depth--;
                case '\n' -> lineStart = true;
                default -> {
                }
            }
        }
    }

    private void parseMember(final String line,
            final List<ClassNode.Method> methods,
            final List<ClassNode.Property> properties) {

        if (line.isEmpty()) {
            return;
        }

        String rest = line;
        boolean isStatic = false;
        boolean isAbstract = false;
        Matcher modifier = MODIFIER_PATTERN.matcher(rest);
        while (modifier.find()) {
            isStatic |= "static".equals(modifier.group(1));
            isAbstract |= "abstract".equals(modifier.group(1));
            rest = rest.substring(modifier.end());
            modifier = MODIFIER_PATTERN.matcher(rest);
        }
        if (isAbstract) {
            return;
        }

        final Matcher method = METHOD_PATTERN.matcher(rest);
        if (method.find()) {
            final String name = method.group(4);
            final String accessor = method.group(2);
            final String kind;
            if (accessor != null) {
                kind = accessor;
            } else if ("constructor".equals(name)) {
                kind = "constructor";
            } else {
                kind = "method";
            }
            methods.add(new ClassNode.Method(name, kind, isStatic));
            return;
        }

        final Matcher property = PROPERTY_PATTERN.matcher(rest);
        if (property.find()) {
            properties.add(new ClassNode.Property(property.group(1),
                    isStatic));
        }
    }

    private void extractVariables(final String file,
            final MaskedSource source,
            final List<Positioned<SymbolNode>> out) {

        final Matcher matcher = VARIABLE_PATTERN.matcher(source.masked());
        while (matcher.find()) {
            final String first = matcher.group(2);
            if ("enum".equals(first)) {
                continue;
            }
            final DeclarationKind kind = DeclarationKind.fromKeyword(
                    matcher.group(1));
            final int line = source.lineOf(matcher.start());

            out.add(new Positioned<>(matcher.start(),
                    new VariableNode(first, file, line, kind)));

            int offset = matcher.start() + 1;
            for (final String name : followingDeclarators(source,
                    matcher.end())) {
                out.add(new Positioned<>(offset++,
                        new VariableNode(name, file, line, kind)));
            }
        }
    }

    /**
     * Collects the identifiers bound after the first declarator of a
     * declaration, e.g. {@code b} and {@code c} in {@code let a, b = 1, c}.
     */
    private List<String> followingDeclarators(final MaskedSource source,
            final int from) {

        final String masked = source.masked();
        final List<String> names = new ArrayList<>();
        int depth = 0;
        int angle = 0;
        boolean inInitializer = false;

        for (int i = from; i < masked.length(); i++) {
            final char c = masked.charAt(i);
            final char next = i + 1 < masked.length()
                    ? masked.charAt(i + 1) : 0;

            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                if (depth == 0) {
                    break;
                }
                depth--;
            } else if (depth > 0) {
                continue;
            } else if (c == ';') {
                break;
            } else if (c == '<' && !inInitializer) {
                angle++;
            } else if (c == '>' && !inInitializer && angle > 0) {
                angle--;
            } else if (c == '=' && next != '=' && next != '>'
                    && angle == 0) {
                inInitializer = true;
            } else if (c == '\n' && !continuesOnNextLine(source, i)) {
                break;
            } else if (c == ',' && angle == 0) {
                inInitializer = false;
                int j = i + 1;
                while (j < masked.length()
                        && Character.isWhitespace(masked.charAt(j))) {
                    j++;
                }
                final Matcher identifier = IDENTIFIER_PATTERN.matcher(masked)
                        .region(j, masked.length());
                if (identifier.lookingAt()) {
                    names.add(identifier.group());
                }
            }
        }
        return names;
    }

    private boolean continuesOnNextLine(final MaskedSource source,
            final int newline) {
        final String masked = source.masked();
        final char before = source.previousSignificant(newline);
        if (before == ',' || before == '=') {
            return true;
        }
        for (int i = newline + 1; i < masked.length(); i++) {
            final char c = masked.charAt(i);
            if (!Character.isWhitespace(c)) {
                return c == ',';
            }
        }
        return false;
    }

    private List<CallFact> extractCalls(final MaskedSource source) {
        final String masked = source.masked();
        final List<CallFact> calls = new ArrayList<>();

        final Matcher matcher = CALL_PATTERN.matcher(masked);
        while (matcher.find()) {
            final String object = matcher.group(1);
            final String property = matcher.group(2);

            if (NON_CALLEES.contains(object)) {
                continue;
            }
            final String previous = source.previousWord(matcher.start());
            if ("new".equals(previous) || "function".equals(previous)
                    || isGeneratorName(source, matcher.start())) {
                continue;
            }

            // Method and object shorthand definitions: name(params) {
            final int open = matcher.end() - 1;
            final int close = source.matchingClose(open);
            if (close >= 0 && property == null
                    && isDefinition(masked, close + 1)) {
                continue;
            }

            final int arguments = close < 0
                    ? 0 : source.splitTopLevel(open + 1, close).size();
            final String name = property == null
                    ? object : object + "." + property;

            calls.add(new CallFact(name, source.lineOf(matcher.start()),
                    arguments));
        }
        return calls;
    }

    private boolean isDefinition(final String masked, final int afterClose) {
        int lineEnd = masked.indexOf('\n', afterClose);
        if (lineEnd < 0) {
            lineEnd = masked.length();
        }
        return DEFINITION_TAIL_PATTERN.matcher(
                masked.substring(afterClose, lineEnd)).find();
    }

    private boolean isGeneratorName(final MaskedSource source,
            final int offset) {
        if (source.previousSignificant(offset) != '*') {
            return false;
        }
        final int star = source.masked().lastIndexOf('*', offset);
        return "function".equals(source.previousWord(star));
    }

    private List<ImportFact> extractImports(final MaskedSource source) {
        final String masked = source.masked();
        final List<ImportFact> imports = new ArrayList<>();

        final Matcher matcher = IMPORT_PATTERN.matcher(masked);
        while (matcher.find()) {
            final int sourceStart = matcher.end();
            final int sourceEnd = masked.indexOf(matcher.group(2).charAt(0),
                    sourceStart);
            if (sourceEnd < 0) {
                continue;
            }
            final String from = source.original().substring(sourceStart,
                    sourceEnd);
            final int line = source.lineOf(matcher.start());

            parseImportClause(matcher.group(1).trim(), from, line, imports);
        }
        return imports;
    }

    /**
     * Parses {@code Default}, {@code * as ns}, {@code { a, b as c }} and
     * their combinations.
     */
    private void parseImportClause(final String clause, final String from,
            final int line, final List<ImportFact> out) {

        String head = clause;
        String named = null;
        final int brace = clause.indexOf('{');
        if (brace >= 0) {
            final int closeBrace = clause.indexOf('}', brace);
            named = clause.substring(brace + 1,
                    closeBrace < 0 ? clause.length() : closeBrace);
            head = clause.substring(0, brace);
        }

        for (final String part : head.split(",")) {
            final String binding = part.trim();
            if (binding.isEmpty()) {
                continue;
            }
            if (binding.startsWith("*")) {
                final String local = binding.replaceFirst("^\\*\\s*as\\s+", "")
                        .trim();
                out.add(new ImportFact(from, ImportFact.NAMESPACE, local,
                        line));
            } else {
                out.add(new ImportFact(from, ImportFact.DEFAULT, binding,
                        line));
            }
        }

        if (named == null) {
            return;
        }
        for (final String part : named.split(",")) {
            String specifier = part.trim();
            if (specifier.startsWith("type ")) {
                specifier = specifier.substring(5).trim();
            }
            if (specifier.isEmpty()) {
                continue;
            }
            final String[] names = specifier.split("\\s+as\\s+");
            final String imported = names[0].trim();
            final String local = names.length > 1 ? names[1].trim() : imported;
            out.add(new ImportFact(from, imported, local, line));
        }
    }

    private List<ExportFact> extractExports(final MaskedSource source) {
        final String masked = source.masked();
        final List<Positioned<ExportFact>> found = new ArrayList<>();

        final Matcher list = EXPORT_LIST_PATTERN.matcher(masked);
        while (list.find()) {
            final int line = source.lineOf(list.start());
            int offset = list.start();
            for (final String part : list.group(1).split(",")) {
                final String specifier = part.trim();
                if (specifier.isEmpty()) {
                    continue;
                }
                final String[] names = specifier.split("\\s+as\\s+");
                final String local = names[0].trim();
                final String exported = names.length > 1
                        ? names[1].trim() : local;
                found.add(new Positioned<>(offset++,
                        new ExportFact(exported, local, line)));
            }
        }

        final Matcher defaults = EXPORT_DEFAULT_PATTERN.matcher(masked);
        while (defaults.find()) {
            found.add(new Positioned<>(defaults.start(), new ExportFact(
                    ImportFact.DEFAULT, null, source.lineOf(defaults.start()))));
        }

        found.sort(Comparator.comparingInt(Positioned::offset));
        final List<ExportFact> exports = new ArrayList<>();
        for (final Positioned<ExportFact> export : found) {
            exports.add(export.value());
        }
        return exports;
    }

    /**
     * Checks if a function or class keyword at the given offset starts an
     * expression rather than a declaration, e.g. {@code x = function f()}.
     */
    private boolean isExpressionContext(final MaskedSource source,
            final int offset) {
        final char previous = source.previousSignificant(offset);
        if (previous != 0 && EXPRESSION_PUNCTUATION.indexOf(previous) >= 0) {
            return true;
        }
        return EXPRESSION_WORDS.contains(source.previousWord(offset));
    }

    /** A fact paired with the offset it was found at, for ordering. */
    private record Positioned<T>(int offset, T value) {}

}
