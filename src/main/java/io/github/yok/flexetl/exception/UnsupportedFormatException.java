package io.github.yok.flexetl.exception;

import java.util.Collection;

/**
 * Raised when a dataset format can be neither taken from the format hint nor inferred from the
 * file suffix.
 *
 * @author Yasuharu.Okawauchi
 */
public class UnsupportedFormatException extends ConfigurationException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates the exception naming the supported formats.
     *
     * @param format the rejected format name
     * @param supported names of the supported formats
     */
    public UnsupportedFormatException(String format, Collection<String> supported) {
        super("Unsupported format: " + format + ". Supported: " + String.join(", ", supported));
    }
}
