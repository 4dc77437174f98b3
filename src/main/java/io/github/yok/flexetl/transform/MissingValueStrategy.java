package io.github.yok.flexetl.transform;

import io.github.yok.flexetl.exception.ConfigurationException;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Strategies of {@code handle_missing_values}.
 *
 * @author Yasuharu.Okawauchi
 */
public enum MissingValueStrategy {

    // Remove every row holding at least one missing cell
    DROP,

    // Replace missing cells with a fill value
    FILL,

    // Copy the nearest preceding value of the same column
    FORWARD_FILL,

    // Copy the nearest following value of the same column
    BACKWARD_FILL;

    /**
     * Returns the name used in configuration, e.g. {@code forward_fill}.
     *
     * @return lowercase name
     */
    public String getConfigName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a strategy from its configuration name.
     *
     * @param name strategy name (case-insensitive)
     * @return the strategy
     * @throws ConfigurationException if the name is unknown
     */
    public static MissingValueStrategy fromName(String name) {
        for (MissingValueStrategy strategy : values()) {
            if (strategy.getConfigName().equalsIgnoreCase(name == null ? "" : name.trim())) {
                return strategy;
            }
        }
        throw new ConfigurationException("handle_missing_values: unknown strategy: " + name
                + ". Supported: " + Arrays.stream(values())
                        .map(MissingValueStrategy::getConfigName)
                        .collect(Collectors.joining(", ")));
    }
}
