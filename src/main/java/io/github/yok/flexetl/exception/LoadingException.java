package io.github.yok.flexetl.exception;

/**
 * Wraps an I/O failure of the table codec or the stats sink while writing.
 *
 * @author Yasuharu.Okawauchi
 */
public class LoadingException extends EtlException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates the exception.
     *
     * @param message detail message
     * @param cause root cause
     */
    public LoadingException(String message, Throwable cause) {
        super(message, cause);
    }
}
