package co.fanki.codegraph.analysis.domain.nodejs;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * JavaScript/TypeScript source text with comments and string contents
 * blanked out.
 *
 * <p>Comment characters and the characters between string or template
 * quotes are replaced by spaces; quotes and line breaks are kept, so
 * every offset in the masked text matches the same offset in the
 * original text. Patterns run against the masked text never see code
 * that lives in a comment or a string.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
final class MaskedSource {

    private final String original;
    private final String masked;
    private final int[] lineStarts;

    MaskedSource(final String theOriginal) {
        this.original = theOriginal;
        this.masked = mask(theOriginal);
        this.lineStarts = computeLineStarts(theOriginal);
    }

    String original() {
        return original;
    }

    String masked() {
        return masked;
    }

    /**
     * Returns the 1-based line of an offset.
     */
    int lineOf(final int offset) {
        final int index = Arrays.binarySearch(lineStarts, offset);
        return index >= 0 ? index + 1 : -index - 1;
    }

    /**
     * Returns the offset of the closing bracket matching the opening one
     * at the given offset, or -1 if unbalanced.
     */
    int matchingClose(final int openIndex) {
        final char open = masked.charAt(openIndex);
        final char close = switch (open) {
            case '(' -> ')';
            case '{' -> '}';
            case '[' -> ']';
            default -> throw new IllegalArgumentException(
                    "Not an opening bracket: " + open);
        };

        int depth = 0;
        for (int i = openIndex; i < masked.length(); i++) {
            final char c = masked.charAt(i);
            if (c == open) {
                depth++;
            } else if (c == close) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * Splits the text between two offsets on commas that are not nested
     * in brackets, dropping blank segments.
     */
    List<String> splitTopLevel(final int from, final int to) {
        final List<String> segments = new ArrayList<>();
        int depth = 0;
        int angle = 0;
        int segmentStart = from;

        for (int i = from; i < to; i++) {
            final char c = masked.charAt(i);
            switch (c) {
                case '(', '[', '{' -> depth++;
                case ')', ']', '}' -> depth--;
                case '<' -> angle++;
                case '>' -> {
                    if (angle > 0 && masked.charAt(i - 1) != '=') {
                        angle--;
                    }
                }
                case ',' -> {
                    if (depth == 0 && angle == 0) {
                        addSegment(segments, segmentStart, i);
                        segmentStart = i + 1;
                    }
                }
                default -> {
                }
            }
        }
        addSegment(segments, segmentStart, to);
        return segments;
    }

    private void addSegment(final List<String> segments, final int from,
            final int to) {
        final String segment = masked.substring(from, to).trim();
        if (!segment.isEmpty()) {
            segments.add(segment);
        }
    }

    /**
     * Returns the word that ends right before the given offset, skipping
     * whitespace, or an empty string if the previous token is not a word.
     */
    String previousWord(final int offset) {
        int end = offset;
        while (end > 0 && Character.isWhitespace(masked.charAt(end - 1))) {
            end--;
        }
        int start = end;
        while (start > 0 && isIdentifierPart(masked.charAt(start - 1))) {
            start--;
        }
        return masked.substring(start, end);
    }

    /**
     * Returns the first non-whitespace character before the offset, or 0.
     */
    char previousSignificant(final int offset) {
        for (int i = offset - 1; i >= 0; i--) {
            final char c = masked.charAt(i);
            if (!Character.isWhitespace(c)) {
                return c;
            }
        }
        return 0;
    }

    static boolean isIdentifierPart(final char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }

    private static int[] computeLineStarts(final String text) {
        final List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        final int[] result = new int[starts.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = starts.get(i);
        }
        return result;
    }

    private enum State {
        CODE, LINE_COMMENT, BLOCK_COMMENT, SINGLE, DOUBLE, TEMPLATE
    }

    private static String mask(final String text) {
        final char[] out = text.toCharArray();
        State state = State.CODE;

        for (int i = 0; i < out.length; i++) {
            final char c = text.charAt(i);
            final char next = i + 1 < out.length ? text.charAt(i + 1) : 0;

            switch (state) {
                case CODE -> {
                    if (c == '/' && next == '/') {
                        state = State.LINE_COMMENT;
                        out[i] = ' ';
                    } else if (c == '/' && next == '*') {
                        state = State.BLOCK_COMMENT;
                        out[i] = ' ';
                        out[++i] = ' ';
                    } else if (c == '\'') {
                        state = State.SINGLE;
                    } else if (c == '"') {
                        state = State.DOUBLE;
                    } else if (c == '`') {
                        state = State.TEMPLATE;
                    }
                }
                case LINE_COMMENT -> {
                    if (c == '\n') {
                        state = State.CODE;
                    } else {
                        out[i] = ' ';
                    }
                }
                case BLOCK_COMMENT -> {
                    if (c == '*' && next == '/') {
                        out[i] = ' ';
                        out[++i] = ' ';
                        state = State.CODE;
                    } else if (c != '\n') {
                        out[i] = ' ';
                    }
                }
                case SINGLE, DOUBLE, TEMPLATE -> {
                    final char quote = state == State.SINGLE ? '\''
                            : state == State.DOUBLE ? '"' : '`';
                    if (c == '\\') {
                        out[i] = ' ';
                        if (next != 0 && next != '\n') {
                            out[++i] = ' ';
                        }
                    } else if (c == quote) {
                        state = State.CODE;
                    } else if (c == '\n') {
                        if (state != State.TEMPLATE) {
                            state = State.CODE;
                        }
                    } else {
                        out[i] = ' ';
                    }
                }
                default -> {
                }
            }
        }
        return new String(out);
    }

}
