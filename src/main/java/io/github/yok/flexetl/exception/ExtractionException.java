package io.github.yok.flexetl.exception;

/**
 * Wraps an I/O failure of the table codec while reading a dataset.
 *
 * @author Yasuharu.Okawauchi
 */
public class ExtractionException extends EtlException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates the exception.
     *
     * @param message detail message
     * @param cause root cause
     */
    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
