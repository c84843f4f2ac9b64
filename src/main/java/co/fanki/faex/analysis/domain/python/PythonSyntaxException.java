package co.fanki.faex.analysis.domain.python;

/**
 * Raised by the tokenizer or the parser on malformed Python source.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class PythonSyntaxException extends SourceParseException {

    private static final long serialVersionUID = 1L;

    private final String reason;

    private final int line;

    private final int column;

    /**
     * Creates a new syntax exception.
     *
     * @param theReason what is wrong, e.g. "expected ':'"
     * @param theLine the 1-based line of the offending token
     * @param theColumn the 0-based column of the offending token
     */
    public PythonSyntaxException(final String theReason, final int theLine,
            final int theColumn) {
        super(theReason + " (line " + theLine + ", column " + theColumn
                + ")");
        this.reason = theReason;
        this.line = theLine;
        this.column = theColumn;
    }

    /** {@inheritDoc} */
    @Override
    public String label() {
        return "Syntax error";
    }

    /**
     * Returns the description without position.
     *
     * @return the reason
     */
    public String getReason() {
        return reason;
    }

    /**
     * Returns the line of the offending token.
     *
     * @return the 1-based line
     */
    public int getLine() {
        return line;
    }

    /**
     * Returns the column of the offending token.
     *
     * @return the 0-based column
     */
    public int getColumn() {
        return column;
    }

}
