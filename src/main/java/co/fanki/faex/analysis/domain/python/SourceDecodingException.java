package co.fanki.faex.analysis.domain.python;

/**
 * Raised when the bytes of a source file are not valid UTF-8.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class SourceDecodingException extends SourceParseException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new decoding exception.
     *
     * @param message the error message
     * @param cause the underlying charset failure
     */
    public SourceDecodingException(final String message,
            final Throwable cause) {
        super(message, cause);
    }

    /** {@inheritDoc} */
    @Override
    public String label() {
        return "Encoding error";
    }

}
