package co.fanki.faex.analysis.domain.python;

/**
 * A single token of Python source.
 *
 * @param type the token type
 * @param text the exact source text; empty for layout tokens
 * @param line the 1-based line where the token starts
 * @param column the 0-based column where the token starts
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record PythonToken(Type type, String text, int line, int column) {

    /** Token types produced by {@link PythonTokenizer}. */
    public enum Type {
        /** Identifier or keyword. */
        NAME,
        /** Numeric literal. */
        NUMBER,
        /** String or bytes literal, prefix and quotes included. */
        STRING,
        /** Operator or delimiter. */
        OPERATOR,
        /** End of a logical line. */
        NEWLINE,
        /** Start of an indented block. */
        INDENT,
        /** End of an indented block. */
        DEDENT,
        /** End of input. */
        END_MARKER
    }

    /**
     * Checks whether this token is the given operator.
     *
     * @param operator the operator text, e.g. "("
     * @return true if this is that operator
     */
    public boolean isOperator(final String operator) {
        return type == Type.OPERATOR && text.equals(operator);
    }

    /**
     * Checks whether this token is a name with the given text.
     *
     * @param name the identifier or keyword
     * @return true if this is that name
     */
    public boolean isName(final String name) {
        return type == Type.NAME && text.equals(name);
    }

    @Override
    public String toString() {
        return switch (type) {
            case NEWLINE -> "NEWLINE";
            case INDENT -> "INDENT";
            case DEDENT -> "DEDENT";
            case END_MARKER -> "end of file";
            default -> "'" + text + "'";
        };
    }

}
