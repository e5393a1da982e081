package co.fanki.digraph.shared;

/**
 * Base exception for domain-level errors.
 *
 * <p>Raised for violations of the declaration contract, for invalid
 * options and for unreadable input or unwritable output. Every instance
 * carries an error code, which the command line shell maps to a process
 * exit code without looking at the message.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class DomainException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Code used when a caller does not classify the failure. */
    public static final String DOMAIN_ERROR = "DOMAIN_ERROR";

    private final String errorCode;

    /**
     * Creates a new domain exception.
     *
     * @param message the error message
     * @param theErrorCode the error code, {@link #DOMAIN_ERROR} if null
     */
    public DomainException(final String message, final String theErrorCode) {
        this(message, theErrorCode, null);
    }

    /**
     * Creates a new domain exception caused by a lower level failure.
     *
     * @param message the error message
     * @param theErrorCode the error code, {@link #DOMAIN_ERROR} if null
     * @param cause the underlying cause, may be null
     */
    public DomainException(final String message, final String theErrorCode,
            final Throwable cause) {
        super(message, cause);
        this.errorCode = theErrorCode == null ? DOMAIN_ERROR : theErrorCode;
    }

    /**
     * Returns the error code for this exception.
     *
     * @return the error code, never null
     */
    public String getErrorCode() {
        return errorCode;
    }

}
