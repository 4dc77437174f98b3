package io.github.yok.flexetl.codec;

import io.github.yok.flexetl.exception.UnsupportedFormatException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Getter;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;

/**
 * Enumeration of supported dataset formats.
 *
 * <p>
 * Each format defines one or more names that are recognized both as file extensions and as
 * explicit format hints. For example, {@link #YAML} supports both {@code yaml} and {@code yml}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public enum DataFormat {

    // Comma-Separated Values format (CSV).
    CSV("csv"),

    // JavaScript Object Notation format (JSON), array of records.
    JSON("json"),

    // YAML Ain't Markup Language format (YAML/YML), sequence of mappings.
    YAML("yaml", "yml");

    // Set of valid extensions for this format (all lowercase).
    private final Set<String> extensions;

    DataFormat(String... exts) {
        this.extensions = Arrays.stream(exts).map(e -> e.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }

    /**
     * Determines whether the given file extension or hint belongs to this format.
     *
     * @param ext extension or hint (case-insensitive, with or without a leading dot)
     * @return {@code true} if the name matches this format
     */
    public boolean matches(String ext) {
        return extensions.contains(StringUtils.removeStart(ext, ".").toLowerCase(Locale.ROOT));
    }

    /**
     * Returns the names of the supported formats.
     *
     * @return lowercase format names in declaration order
     */
    public static List<String> supportedNames() {
        return Arrays.stream(values()).map(f -> f.name().toLowerCase(Locale.ROOT))
                .collect(Collectors.toList());
    }

    /**
     * Resolves a format from a hint such as {@code csv} or {@code .yml}.
     *
     * @param name format name or extension
     * @return the matching format
     * @throws UnsupportedFormatException if no format matches
     */
    public static DataFormat fromName(String name) {
        if (StringUtils.isNotBlank(name)) {
            for (DataFormat format : values()) {
                if (format.matches(name.trim())) {
                    return format;
                }
            }
        }
        throw new UnsupportedFormatException(StringUtils.defaultIfBlank(name, "(none)"),
                supportedNames());
    }

    /**
     * Resolves the format of a file: the hint when given, otherwise the file extension.
     *
     * @param path file path
     * @param hint explicit format, or {@code null}
     * @return the matching format
     * @throws UnsupportedFormatException if neither the hint nor the extension is supported
     */
    public static DataFormat resolve(Path path, String hint) {
        if (StringUtils.isNotBlank(hint)) {
            return fromName(hint);
        }
        return fromName(FilenameUtils.getExtension(path.getFileName().toString()));
    }
}
