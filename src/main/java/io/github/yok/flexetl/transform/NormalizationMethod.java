package io.github.yok.flexetl.transform;

import io.github.yok.flexetl.exception.ConfigurationException;
import java.util.Locale;

/**
 * Methods of {@code normalize_column}.
 *
 * @author Yasuharu.Okawauchi
 */
public enum NormalizationMethod {

    // (v - min) / (max - min)
    MINMAX,

    // (v - mean) / stddev
    ZSCORE;

    /**
     * Resolves a method from its name.
     *
     * @param name method name (case-insensitive)
     * @return the method
     * @throws ConfigurationException if the name is unknown
     */
    public static NormalizationMethod fromName(String name) {
        String key = name == null ? "" : name.trim().toUpperCase(Locale.ROOT);
        for (NormalizationMethod method : values()) {
            if (method.name().equals(key)) {
                return method;
            }
        }
        throw new ConfigurationException("normalize_column: unknown method: " + name
                + ". Supported: minmax, zscore");
    }
}
