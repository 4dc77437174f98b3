package io.github.yok.flexetl.table;

import io.github.yok.flexetl.exception.ConfigurationException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Getter;

/**
 * Canonical value types of a {@link Column}.
 *
 * <p>
 * Each type owns the Java class its values are stored as and the names accepted when the type is
 * given as text (type conversion mappings, schema files).
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public enum ColumnType {

    // 64-bit integers stored as Long
    INT(Long.class, "int", "integer", "int64", "long"),

    // Double precision numbers stored as Double
    FLOAT(Double.class, "float", "double", "float64", "number"),

    // Text
    STRING(String.class, "string", "str", "text"),

    // Booleans
    BOOL(Boolean.class, "bool", "boolean"),

    // Calendar dates stored as LocalDate
    DATE(LocalDate.class, "date"),

    // Local date-times stored as LocalDateTime
    DATETIME(LocalDateTime.class, "datetime", "timestamp"),

    // Mixed values
    OBJECT(Object.class, "object");

    // Java class the values of this type are stored as
    private final Class<?> javaType;

    // Accepted textual names (all lowercase)
    private final Set<String> names;

    ColumnType(Class<?> javaType, String... names) {
        this.javaType = javaType;
        this.names = Arrays.stream(names).collect(Collectors.toSet());
    }

    /**
     * Determines whether the given non-missing value is an instance of this type.
     *
     * <p>
     * {@link #INT} also accepts {@link Integer}, {@link Short} and {@link Byte}; {@link #FLOAT}
     * also accepts {@link Float}. {@code null} is never accepted.
     * </p>
     *
     * @param value value to check
     * @return {@code true} if the value belongs to this type
     */
    public boolean accepts(Object value) {
        if (value == null) {
            return false;
        }
        switch (this) {
            case INT:
                return value instanceof Long || value instanceof Integer || value instanceof Short
                        || value instanceof Byte;
            case FLOAT:
                return value instanceof Double || value instanceof Float;
            case OBJECT:
                return true;
            default:
                return javaType.isInstance(value);
        }
    }

    /**
     * Resolves a type from its textual name (case-insensitive).
     *
     * @param name type name such as {@code int}, {@code str} or {@code float64}
     * @return the matching type
     * @throws ConfigurationException if the name is unknown
     */
    public static ColumnType fromName(String name) {
        if (name != null) {
            String key = name.trim().toLowerCase(Locale.ROOT);
            for (ColumnType type : values()) {
                if (type.names.contains(key)) {
                    return type;
                }
            }
        }
        throw new ConfigurationException("Unknown column type: " + name + ". Supported: "
                + Arrays.stream(values()).filter(t -> t != OBJECT)
                        .map(t -> t.name().toLowerCase(Locale.ROOT))
                        .collect(Collectors.joining(", ")));
    }

    /**
     * Infers the narrowest type holding every non-missing value of the given sequence.
     *
     * <p>
     * Returns {@link #OBJECT} when the values are of different types or when no value is present.
     * </p>
     *
     * @param values column values (may contain {@code null})
     * @return inferred type
     */
    public static ColumnType infer(Iterable<?> values) {
        ColumnType found = null;
        for (Object value : values) {
            if (value == null) {
                continue;
            }
            ColumnType current = of(value);
            if (found == null) {
                found = current;
            } else if (found != current) {
                return OBJECT;
            }
        }
        return found == null ? OBJECT : found;
    }

    /**
     * Returns the type of a single non-missing value.
     *
     * @param value value
     * @return the type of the value, {@link #OBJECT} for unsupported classes
     */
    public static ColumnType of(Object value) {
        for (ColumnType type : values()) {
            if (type != OBJECT && type.accepts(value)) {
                return type;
            }
        }
        return OBJECT;
    }
}
