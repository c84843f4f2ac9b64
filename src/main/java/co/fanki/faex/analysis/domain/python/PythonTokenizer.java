package co.fanki.faex.analysis.domain.python;

import co.fanki.faex.analysis.domain.python.PythonToken.Type;
import co.fanki.faex.shared.Preconditions;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Splits Python source text into tokens.
 *
 * <p>Follows the layout rules of the Python tokenizer: physical lines are
 * joined inside brackets and after a trailing backslash, blank and
 * comment-only lines produce no tokens, and changes of indentation at the
 * start of a logical line produce {@code INDENT}/{@code DEDENT} tokens. Tabs
 * advance the indentation to the next multiple of eight. Like CPython, at
 * most 200 brackets may be open at once and blocks nest at most 100
 * levels deep.</p>
 *
 * <p>Format strings are returned as single {@code STRING} tokens. Quotes
 * inside their replacement fields start nested literals, so an f-string may
 * reuse its own quote character inside {@code {...}}.</p>
 *
 * <p>Keywords are returned as {@code NAME} tokens; telling them apart is
 * the parser's job.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class PythonTokenizer {

    /** Operators and delimiters, longest first. */
    private static final List<String> OPERATORS = List.of(
            "**=", "//=", ">>=", "<<=", "...",
            "!=", "->", ":=", "**", "//", "<<", ">>", "<=", ">=", "==",
            "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "@=",
            "+", "-", "*", "/", "%", "@", "&", "|", "^", "~", "<", ">",
            "(", ")", "[", "]", "{", "}", ",", ":", ";", ".", "=");

    private static final Map<String, String> CLOSING_BRACKETS = Map.of(
            "(", ")", "[", "]", "{", "}");

    private static final Set<String> STRING_PREFIXES = Set.of(
            "r", "u", "b", "f", "br", "rb", "fr", "rf");

    private static final int TAB_SIZE = 8;

    private static final int MAX_BRACKETS = 200;

    private static final int MAX_INDENT_LEVELS = 100;

    private final String source;

    private final List<PythonToken> tokens = new ArrayList<>();

    /** Indentation widths of the open blocks, innermost on top. */
    private final Deque<Integer> indents = new ArrayDeque<>();

    /** Open brackets, innermost on top. */
    private final Deque<PythonToken> brackets = new ArrayDeque<>();

    private int pos;

    private int line = 1;

    private int lineStart;

    private boolean atLineStart = true;

    private PythonTokenizer(final String theSource) {
        this.source = theSource;
    }

    /**
     * Tokenizes a complete source file.
     *
     * @param source the decoded source text
     * @return the tokens, always terminated by {@code END_MARKER}
     * @throws PythonSyntaxException if the text is not valid Python layout
     */
    public static List<PythonToken> tokenize(final String source)
            throws PythonSyntaxException {
        Preconditions.requireNonNull(source, "Source is required");
        return new PythonTokenizer(source).run();
    }

    private List<PythonToken> run() throws PythonSyntaxException {
        indents.push(0);

        if (source.startsWith("\uFEFF")) {
            pos = 1;
            lineStart = 1;
        }

        while (pos < source.length()) {
            if (atLineStart && brackets.isEmpty()) {
                readIndentation();
                continue;
            }

            final char c = source.charAt(pos);
            if (c == ' ' || c == '\t' || c == '\f') {
                pos++;
            } else if (c == '#') {
                skipComment();
            } else if (c == '\n' || c == '\r') {
                endPhysicalLine();
            } else if (c == '\\') {
                continueLine();
            } else if (isIdentifierStart(c)) {
                readNameOrPrefixedString();
            } else if (isDigit(c) || (c == '.' && pos + 1 < source.length()
                    && isDigit(source.charAt(pos + 1)))) {
                readNumber();
            } else if (c == '"' || c == '\'') {
                readString(pos);
            } else {
                readOperator();
            }
        }

        finish();
        return tokens;
    }

    private void readIndentation() throws PythonSyntaxException {
        int width = 0;
        int p = pos;
        while (p < source.length()) {
            final char c = source.charAt(p);
            if (c == ' ') {
                width++;
            } else if (c == '\t') {
                width = (width / TAB_SIZE + 1) * TAB_SIZE;
            } else if (c == '\f') {
                width = 0;
            } else {
                break;
            }
            p++;
        }
        pos = p;

        if (pos >= source.length()) {
            return;
        }

        final char first = source.charAt(pos);
        if (first == '#' || first == '\n' || first == '\r') {
            // blank or comment-only line, indentation is irrelevant
            skipComment();
            if (pos < source.length()) {
                consumeNewline();
            }
            return;
        }

        atLineStart = false;
        final int column = pos - lineStart;
        final int current = indents.peek();

        if (width > current) {
            if (indents.size() > MAX_INDENT_LEVELS) {
                throw new PythonSyntaxException(
                        "too many levels of indentation", line, column);
            }
            indents.push(width);
            add(Type.INDENT, "", line, column);
        } else if (width < current) {
            while (width < indents.peek()) {
                indents.pop();
                add(Type.DEDENT, "", line, column);
            }
            if (width != indents.peek()) {
                throw new PythonSyntaxException(
                        "unindent does not match any outer indentation level",
                        line, column);
            }
        }
    }

    private void skipComment() {
        while (pos < source.length()) {
            final char c = source.charAt(pos);
            if (c == '\n' || c == '\r') {
                return;
            }
            pos++;
        }
    }

    private void endPhysicalLine() {
        if (brackets.isEmpty() && needsNewline()) {
            add(Type.NEWLINE, "", line, pos - lineStart);
        }
        consumeNewline();
        if (brackets.isEmpty()) {
            atLineStart = true;
        }
    }

    private void continueLine() throws PythonSyntaxException {
        final int column = pos - lineStart;
        pos++;
        if (pos >= source.length()) {
            throw new PythonSyntaxException(
                    "unexpected end of file after line continuation",
                    line, column);
        }
        final char next = source.charAt(pos);
        if (next != '\n' && next != '\r') {
            throw new PythonSyntaxException(
                    "unexpected character after line continuation character",
                    line, column);
        }
        consumeNewline();
    }

    private void consumeNewline() {
        if (source.charAt(pos) == '\r' && pos + 1 < source.length()
                && source.charAt(pos + 1) == '\n') {
            pos += 2;
        } else {
            pos++;
        }
        line++;
        lineStart = pos;
    }

    private void readNameOrPrefixedString() throws PythonSyntaxException {
        final int start = pos;
        while (pos < source.length()
                && isIdentifierPart(source.charAt(pos))) {
            pos++;
        }
        final String text = source.substring(start, pos);

        if (pos < source.length()
                && (source.charAt(pos) == '"' || source.charAt(pos) == '\'')
                && STRING_PREFIXES.contains(text.toLowerCase(Locale.ROOT))) {
            readString(start);
            return;
        }

        add(Type.NAME, text, line, start - lineStart);
    }

    private void readNumber() {
        final int start = pos;
        final String prefixes = "xXoObB";

        if (source.charAt(pos) == '0' && pos + 1 < source.length()
                && prefixes.indexOf(source.charAt(pos + 1)) >= 0) {
            pos += 2;
            while (pos < source.length()
                    && (Character.isLetterOrDigit(source.charAt(pos))
                    || source.charAt(pos) == '_')) {
                pos++;
            }
        } else {
            while (pos < source.length()) {
                final char c = source.charAt(pos);
                if (isDigit(c) || c == '_' || c == '.') {
                    pos++;
                } else if (c == 'e' || c == 'E') {
                    pos++;
                    if (pos < source.length() && (source.charAt(pos) == '+'
                            || source.charAt(pos) == '-')) {
                        pos++;
                    }
                } else if (c == 'j' || c == 'J') {
                    pos++;
                    break;
                } else {
                    break;
                }
            }
        }

        add(Type.NUMBER, source.substring(start, pos), line,
                start - lineStart);
    }

    /**
     * Reads a string literal whose prefix (if any) starts at {@code start}
     * and whose opening quote is at the current position.
     */
    private void readString(final int start) throws PythonSyntaxException {
        final int startLine = line;
        final int startColumn = start - lineStart;
        final String prefix = source.substring(start, pos);

        skipString(isFormatPrefix(prefix), startLine, startColumn);

        add(Type.STRING, source.substring(start, pos), startLine,
                startColumn);
    }

    /** Moves past the literal whose opening quote is at the current position. */
    private void skipString(final boolean formatted, final int startLine,
            final int startColumn) throws PythonSyntaxException {
        final char quote = source.charAt(pos);
        final String tripleQuote = String.valueOf(quote).repeat(3);
        final boolean triple = source.startsWith(tripleQuote, pos);

        pos += triple ? 3 : 1;

        while (true) {
            if (pos >= source.length()) {
                throw new PythonSyntaxException(triple
                        ? "unterminated triple-quoted string literal"
                        : "unterminated string literal",
                        startLine, startColumn);
            }

            final char c = source.charAt(pos);
            if (c == '\\') {
                pos++;
                if (pos < source.length()) {
                    final char escaped = source.charAt(pos);
                    if (escaped == '\n' || escaped == '\r') {
                        consumeNewline();
                    } else {
                        pos++;
                    }
                }
            } else if (c == '\n' || c == '\r') {
                if (!triple) {
                    throw new PythonSyntaxException(
                            "unterminated string literal",
                            startLine, startColumn);
                }
                consumeNewline();
            } else if (c == quote && !triple) {
                pos++;
                return;
            } else if (c == quote && source.startsWith(tripleQuote, pos)) {
                pos += 3;
                return;
            } else if (formatted && source.startsWith("{{", pos)) {
                pos += 2;
            } else if (formatted && c == '{') {
                pos++;
                skipReplacementField(startLine, startColumn);
            } else {
                pos++;
            }
        }
    }

    /**
     * Moves past an f-string replacement field, from just after its opening
     * brace to just after its closing one.
     */
    private void skipReplacementField(final int startLine,
            final int startColumn) throws PythonSyntaxException {
        int open = 0;
        while (true) {
            if (pos >= source.length()) {
                throw new PythonSyntaxException("f-string: expecting '}'",
                        startLine, startColumn);
            }

            final char c = source.charAt(pos);
            if (c == '"' || c == '\'') {
                skipString(false, line, pos - lineStart);
            } else if (isIdentifierStart(c)) {
                skipNameOrPrefixedString();
            } else if (c == '(' || c == '[' || c == '{') {
                open++;
                pos++;
            } else if (c == ')' || c == ']') {
                open--;
                pos++;
            } else if (c == '}') {
                pos++;
                if (open == 0) {
                    return;
                }
                open--;
            } else if (c == ':' && open == 0) {
                pos++;
                skipFormatSpec(startLine, startColumn);
                return;
            } else if (c == '\n' || c == '\r') {
                consumeNewline();
            } else {
                pos++;
            }
        }
    }

    /** Moves past a format spec and the brace closing its field. */
    private void skipFormatSpec(final int startLine, final int startColumn)
            throws PythonSyntaxException {
        while (true) {
            if (pos >= source.length()) {
                throw new PythonSyntaxException("f-string: expecting '}'",
                        startLine, startColumn);
            }

            final char c = source.charAt(pos);
            if (c == '{') {
                pos++;
                skipReplacementField(startLine, startColumn);
            } else if (c == '}') {
                pos++;
                return;
            } else if (c == '\n' || c == '\r') {
                consumeNewline();
            } else {
                pos++;
            }
        }
    }

    private void skipNameOrPrefixedString() throws PythonSyntaxException {
        final int start = pos;
        while (pos < source.length()
                && isIdentifierPart(source.charAt(pos))) {
            pos++;
        }
        final String text = source.substring(start, pos);

        if (pos < source.length()
                && (source.charAt(pos) == '"' || source.charAt(pos) == '\'')
                && STRING_PREFIXES.contains(text.toLowerCase(Locale.ROOT))) {
            skipString(isFormatPrefix(text), line, start - lineStart);
        }
    }

    private static boolean isFormatPrefix(final String prefix) {
        return prefix.toLowerCase(Locale.ROOT).indexOf('f') >= 0;
    }

    private void readOperator() throws PythonSyntaxException {
        final int column = pos - lineStart;

        for (final String operator : OPERATORS) {
            if (!source.startsWith(operator, pos)) {
                continue;
            }
            final PythonToken token = new PythonToken(Type.OPERATOR,
                    operator, line, column);
            pos += operator.length();

            if (CLOSING_BRACKETS.containsKey(operator)) {
                if (brackets.size() >= MAX_BRACKETS) {
                    throw new PythonSyntaxException(
                            "too many nested parentheses", line, column);
                }
                brackets.push(token);
            } else if (CLOSING_BRACKETS.containsValue(operator)) {
                closeBracket(token);
            }
            tokens.add(token);
            return;
        }

        final char c = source.charAt(pos);
        throw new PythonSyntaxException(String.format(
                "invalid character '%c' (U+%04X)", c, (int) c),
                line, column);
    }

    private void closeBracket(final PythonToken closing)
            throws PythonSyntaxException {
        if (brackets.isEmpty()) {
            throw new PythonSyntaxException(
                    "unmatched '" + closing.text() + "'",
                    closing.line(), closing.column());
        }
        final PythonToken opening = brackets.pop();
        if (!CLOSING_BRACKETS.get(opening.text()).equals(closing.text())) {
            throw new PythonSyntaxException("closing parenthesis '"
                    + closing.text() + "' does not match opening parenthesis '"
                    + opening.text() + "'", closing.line(), closing.column());
        }
    }

    private void finish() throws PythonSyntaxException {
        if (!brackets.isEmpty()) {
            final PythonToken open = brackets.peek();
            throw new PythonSyntaxException(
                    "'" + open.text() + "' was never closed",
                    open.line(), open.column());
        }

        final int column = pos - lineStart;
        if (needsNewline()) {
            add(Type.NEWLINE, "", line, column);
        }
        while (indents.peek() > 0) {
            indents.pop();
            add(Type.DEDENT, "", line, column);
        }
        add(Type.END_MARKER, "", line, column);
    }

    private boolean needsNewline() {
        if (tokens.isEmpty()) {
            return false;
        }
        final Type last = tokens.get(tokens.size() - 1).type();
        return last != Type.NEWLINE && last != Type.INDENT
                && last != Type.DEDENT;
    }

    private void add(final Type type, final String text, final int tokenLine,
            final int tokenColumn) {
        tokens.add(new PythonToken(type, text, tokenLine, tokenColumn));
    }

    private static boolean isDigit(final char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(final char c) {
        return c == '_' || Character.isLetter(c)
                || Character.isUnicodeIdentifierStart(c);
    }

    private static boolean isIdentifierPart(final char c) {
        return (c == '_' || Character.isLetterOrDigit(c)
                || Character.isUnicodeIdentifierPart(c))
                && !Character.isIdentifierIgnorable(c);
    }

}
