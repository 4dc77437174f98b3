package io.github.yok.flexetl.exception;

/**
 * Base class of every exception raised by the ETL pipeline.
 *
 * <p>
 * All subclasses are unchecked so that chained pipeline calls stay free of {@code throws}
 * clauses. Messages always name the operation and the offending argument or column.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class EtlException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception with a message.
     *
     * @param message detail message
     */
    public EtlException(String message) {
        super(message);
    }

    /**
     * Creates an exception with a message and a root cause.
     *
     * @param message detail message
     * @param cause root cause
     */
    public EtlException(String message, Throwable cause) {
        super(message, cause);
    }
}
