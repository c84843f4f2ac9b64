package co.fanki.faex.analysis.domain.python;

/**
 * Raised when a source file cannot be turned into a syntax tree.
 *
 * <p>The analysis treats it as a file error: the file is skipped and the
 * message is recorded in the result, the run continues.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public abstract class SourceParseException extends Exception {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new parse exception.
     *
     * @param message the error message
     */
    protected SourceParseException(final String message) {
        super(message);
    }

    /**
     * Creates a new parse exception with a cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     */
    protected SourceParseException(final String message,
            final Throwable cause) {
        super(message, cause);
    }

    /**
     * Describes the kind of failure for error reports, e.g. "Syntax error".
     *
     * @return the failure label
     */
    public abstract String label();

}
