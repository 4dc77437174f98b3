package io.github.yok.flexetl.exception;

/**
 * Raised by a transformation that received an argument it cannot work with, such as a column
 * that does not exist or a non-numeric column handed to a numeric operation.
 *
 * <p>
 * The table the transformation was applied to is left untouched.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class TransformationException extends EtlException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates the exception.
     *
     * @param message detail message
     */
    public TransformationException(String message) {
        super(message);
    }

    /**
     * Creates the exception with a root cause.
     *
     * @param message detail message
     * @param cause root cause
     */
    public TransformationException(String message, Throwable cause) {
        super(message, cause);
    }
}
