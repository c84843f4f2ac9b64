package co.fanki.faex.analysis.domain.python;

import co.fanki.faex.analysis.domain.python.PythonToken.Type;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link PythonTokenizer}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class PythonTokenizerTest {

    @Test
    void whenTokenizing_givenIndentedBlock_shouldEmitIndentAndDedent()
            throws PythonSyntaxException {
        final List<Type> types = types("""
                def f():
                    return 1
                x = 2
                """);

        assertEquals(List.of(
                Type.NAME, Type.NAME, Type.OPERATOR, Type.OPERATOR,
                Type.OPERATOR, Type.NEWLINE,
                Type.INDENT, Type.NAME, Type.NUMBER, Type.NEWLINE,
                Type.DEDENT, Type.NAME, Type.OPERATOR, Type.NUMBER,
                Type.NEWLINE, Type.END_MARKER), types);
    }

    @Test
    void whenTokenizing_givenNestedBlocksAtEndOfFile_shouldCloseAllOfThem()
            throws PythonSyntaxException {
        final List<PythonToken> tokens = PythonTokenizer.tokenize(
                "if a:\n    if b:\n        pass");

        final long dedents = tokens.stream()
                .filter(t -> t.type() == Type.DEDENT).count();

        assertEquals(2, dedents);
        assertEquals(Type.END_MARKER, tokens.get(tokens.size() - 1).type());
    }

    @Test
    void whenTokenizing_givenLinesInsideBrackets_shouldJoinThem()
            throws PythonSyntaxException {
        final List<Type> types = types("""
                call(
                    a,
                    b,
                )
                """);

        assertEquals(1, types.stream().filter(t -> t == Type.NEWLINE).count());
    }

    @Test
    void whenTokenizing_givenCommentAndBlankLines_shouldIgnoreThem()
            throws PythonSyntaxException {
        final List<Type> types = types("""
                # leading comment

                x = 1  # trailing
                    # badly indented comment
                y = 2
                """);

        assertEquals(0, types.stream().filter(t -> t == Type.INDENT).count());
        assertEquals(2, types.stream().filter(t -> t == Type.NEWLINE).count());
    }

    @Test
    void whenTokenizing_givenPrefixedAndTripleQuotedStrings_shouldKeepThemWhole()
            throws PythonSyntaxException {
        final List<PythonToken> tokens = PythonTokenizer.tokenize(
                "a = rb'x\\n'\nb = \"\"\"one\ntwo\"\"\"\n");

        assertEquals("rb'x\\n'", tokens.get(2).text());
        assertEquals(Type.STRING, tokens.get(6).type());
        assertEquals(2, tokens.get(6).line());
    }

    @Test
    void whenTokenizing_givenFStringReusingItsQuote_shouldKeepItWhole()
            throws PythonSyntaxException {
        final List<PythonToken> tokens = PythonTokenizer.tokenize(
                "a = f\"{\"x\"}\"\nb = f\"{d[\"k\"]}\"\n");

        assertEquals("f\"{\"x\"}\"", tokens.get(2).text());
        assertEquals(Type.NEWLINE, tokens.get(3).type());
        assertEquals("f\"{d[\"k\"]}\"", tokens.get(6).text());
        assertEquals(Type.END_MARKER, tokens.get(8).type());
    }

    @Test
    void whenTokenizing_givenFStringWithFormatSpecAndEscapedBraces_shouldKeepItWhole()
            throws PythonSyntaxException {
        final List<PythonToken> tokens = PythonTokenizer.tokenize(
                "a = f'{{literal}} {value:>{width}} {f'{inner!r}'}'\n");

        assertEquals("f'{{literal}} {value:>{width}} {f'{inner!r}'}'",
                tokens.get(2).text());
        assertEquals(Type.NEWLINE, tokens.get(3).type());
    }

    @Test
    void whenTokenizing_givenUnclosedReplacementField_shouldThrowSyntaxError() {
        final PythonSyntaxException e = assertThrows(
                PythonSyntaxException.class,
                () -> PythonTokenizer.tokenize("a = f'{value\n"));

        assertEquals(1, e.getLine());
    }

    @Test
    void whenTokenizing_givenTwoHundredNestedBrackets_shouldAcceptThem()
            throws PythonSyntaxException {
        final List<PythonToken> tokens = PythonTokenizer.tokenize(
                "x = " + "(".repeat(200) + "1" + ")".repeat(200) + "\n");

        assertEquals(Type.END_MARKER, tokens.get(tokens.size() - 1).type());
    }

    @Test
    void whenTokenizing_givenTooManyNestedBrackets_shouldThrowSyntaxError() {
        final PythonSyntaxException e = assertThrows(
                PythonSyntaxException.class,
                () -> PythonTokenizer.tokenize(
                        "x = " + "[".repeat(201) + "]".repeat(201) + "\n"));

        assertEquals("too many nested parentheses", e.getReason());
        assertEquals(204, e.getColumn());
    }

    @Test
    void whenTokenizing_givenTooManyIndentationLevels_shouldThrowSyntaxError() {
        final StringBuilder source = new StringBuilder();
        for (int level = 0; level <= 101; level++) {
            source.append(" ".repeat(level)).append("if x:\n");
        }
        source.append(" ".repeat(102)).append("pass\n");

        final PythonSyntaxException e = assertThrows(
                PythonSyntaxException.class,
                () -> PythonTokenizer.tokenize(source.toString()));

        assertEquals("too many levels of indentation", e.getReason());
    }

    @Test
    void whenTokenizing_givenLeadingByteOrderMark_shouldSkipIt()
            throws PythonSyntaxException {
        final List<PythonToken> tokens = PythonTokenizer.tokenize(
                "\uFEFFx = 1\n");

        assertEquals("x", tokens.get(0).text());
        assertEquals(0, tokens.get(0).column());
    }

    @Test
    void whenTokenizing_givenInconsistentDedent_shouldThrowSyntaxError() {
        final PythonSyntaxException e = assertThrows(
                PythonSyntaxException.class,
                () -> PythonTokenizer.tokenize("""
                        if a:
                                x = 1
                            y = 2
                        """));

        assertEquals("unindent does not match any outer indentation level",
                e.getReason());
        assertEquals(3, e.getLine());
    }

    @Test
    void whenTokenizing_givenUnterminatedString_shouldThrowSyntaxError() {
        final PythonSyntaxException e = assertThrows(
                PythonSyntaxException.class,
                () -> PythonTokenizer.tokenize("x = 'abc\n"));

        assertEquals("unterminated string literal", e.getReason());
        assertEquals(1, e.getLine());
        assertEquals(4, e.getColumn());
    }

    @Test
    void whenTokenizing_givenUnclosedBracket_shouldReportTheOpeningOne() {
        final PythonSyntaxException e = assertThrows(
                PythonSyntaxException.class,
                () -> PythonTokenizer.tokenize("x = [1, 2\ny = 3\n"));

        assertEquals("'[' was never closed", e.getReason());
        assertEquals(1, e.getLine());
    }

    @Test
    void whenTokenizing_givenMismatchedBracket_shouldThrowSyntaxError() {
        final PythonSyntaxException e = assertThrows(
                PythonSyntaxException.class,
                () -> PythonTokenizer.tokenize("x = (1]\n"));

        assertEquals("closing parenthesis ']' does not match opening"
                + " parenthesis '('", e.getReason());
    }

    @Test
    void whenTokenizing_givenInvalidCharacter_shouldThrowSyntaxError() {
        final PythonSyntaxException e = assertThrows(
                PythonSyntaxException.class,
                () -> PythonTokenizer.tokenize("x = 1 $ 2\n"));

        assertEquals("invalid character '$' (U+0024)", e.getReason());
        assertEquals("invalid character '$' (U+0024) (line 1, column 6)",
                e.getMessage());
    }

    private static List<Type> types(final String source)
            throws PythonSyntaxException {
        return PythonTokenizer.tokenize(source).stream()
                .map(PythonToken::type)
                .toList();
    }

}
