package io.github.yok.flexetl.exception;

/**
 * Raised for an unknown strategy, method, type or aggregate name, or for a missing mandatory
 * parameter such as the fill value of the {@code fill} strategy.
 *
 * @author Yasuharu.Okawauchi
 */
public class ConfigurationException extends EtlException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates the exception.
     *
     * @param message detail message
     */
    public ConfigurationException(String message) {
        super(message);
    }
}
