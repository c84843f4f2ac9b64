package co.fanki.faex.shared;

/**
 * Raised when a caller asks the analysis for something it cannot do.
 *
 * <p>Examples are a nonexistent root path or a negative call depth. These
 * are rejected before any file is read; problems found inside the analyzed
 * sources are never reported through this exception.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class DomainException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String errorCode;

    /**
     * Creates a new domain exception with a message and error code.
     *
     * @param message the error message
     * @param errorCode the specific error code, e.g. {@code PATH_NOT_FOUND}
     */
    public DomainException(final String message, final String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    /**
     * Returns the error code for this exception.
     *
     * @return the error code
     */
    public String getErrorCode() {
        return errorCode;
    }

}
