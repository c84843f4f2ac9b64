package co.fanki.faex.analysis.domain.python;

/**
 * Raised when a source file disappears or cannot be read.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class SourceReadException extends SourceParseException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new read exception.
     *
     * @param message the error message
     * @param cause the underlying I/O failure
     */
    public SourceReadException(final String message, final Throwable cause) {
        super(message, cause);
    }

    /** {@inheritDoc} */
    @Override
    public String label() {
        return "Read error";
    }

}
