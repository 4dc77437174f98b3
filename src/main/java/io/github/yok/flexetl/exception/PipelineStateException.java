package io.github.yok.flexetl.exception;

/**
 * Raised when a pipeline method is called before the state it needs exists, for example
 * transforming before extracting or finishing a pipeline that was never started.
 *
 * @author Yasuharu.Okawauchi
 */
public class PipelineStateException extends EtlException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates the exception.
     *
     * @param message detail message
     */
    public PipelineStateException(String message) {
        super(message);
    }
}
