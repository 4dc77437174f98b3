package io.github.yok.flexetl.transform;

import io.github.yok.flexetl.exception.ConfigurationException;
import java.util.Locale;

/**
 * Selects which member of a duplicate group survives {@code remove_duplicates}.
 *
 * @author Yasuharu.Okawauchi
 */
public enum DuplicateKeep {

    // Keep the first occurrence
    FIRST,

    // Keep the last occurrence
    LAST,

    // Drop every member of a duplicate group
    NONE;

    /**
     * Resolves a policy from its name; {@code false} is accepted as an alias of {@code none}.
     *
     * @param name policy name (case-insensitive)
     * @return the policy
     * @throws ConfigurationException if the name is unknown
     */
    public static DuplicateKeep fromName(String name) {
        String key = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        switch (key) {
            case "first":
                return FIRST;
            case "last":
                return LAST;
            case "none":
            case "false":
                return NONE;
            default:
                throw new ConfigurationException(
                        "remove_duplicates: unknown keep policy: " + name
                                + ". Supported: first, last, none");
        }
    }
}
