package io.github.yok.flexetl.table;

import io.github.yok.flexetl.exception.ConfigurationException;
import java.util.Objects;
import lombok.Getter;

/**
 * Value used to replace missing cells, tagged with its kind.
 *
 * <p>
 * The same fill value is applied to every column, whatever its type; the per-column coercion
 * rules live in {@link io.github.yok.flexetl.transform.DataTransformer}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public final class FillValue {

    /**
     * Kinds of fill values.
     */
    public enum Kind {
        INT, FLOAT, STRING, BOOL, NULL
    }

    private static final FillValue NONE = new FillValue(Kind.NULL, null);

    private final Kind kind;
    private final Object value;

    private FillValue(Kind kind, Object value) {
        this.kind = kind;
        this.value = value;
    }

    /**
     * Creates an integer fill value.
     *
     * @param value value
     * @return fill value of kind {@link Kind#INT}
     */
    public static FillValue ofInt(long value) {
        return new FillValue(Kind.INT, value);
    }

    /**
     * Creates a floating point fill value.
     *
     * @param value value
     * @return fill value of kind {@link Kind#FLOAT}
     */
    public static FillValue ofFloat(double value) {
        return new FillValue(Kind.FLOAT, value);
    }

    /**
     * Creates a text fill value.
     *
     * @param value value, must not be {@code null}
     * @return fill value of kind {@link Kind#STRING}
     */
    public static FillValue ofString(String value) {
        return new FillValue(Kind.STRING, Objects.requireNonNull(value, "value"));
    }

    /**
     * Creates a boolean fill value.
     *
     * @param value value
     * @return fill value of kind {@link Kind#BOOL}
     */
    public static FillValue ofBool(boolean value) {
        return new FillValue(Kind.BOOL, value);
    }

    /**
     * Returns the absent fill value.
     *
     * @return fill value of kind {@link Kind#NULL}
     */
    public static FillValue none() {
        return NONE;
    }

    /**
     * Wraps a raw Java value.
     *
     * @param value integer, floating point, text or boolean value, or {@code null}
     * @return matching fill value
     * @throws ConfigurationException for any other class
     */
    public static FillValue of(Object value) {
        if (value == null) {
            return NONE;
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short
                || value instanceof Byte) {
            return ofInt(((Number) value).longValue());
        }
        if (value instanceof Double || value instanceof Float) {
            return ofFloat(((Number) value).doubleValue());
        }
        if (value instanceof String) {
            return ofString((String) value);
        }
        if (value instanceof Boolean) {
            return ofBool((Boolean) value);
        }
        throw new ConfigurationException(
                "Unsupported fill value type: " + value.getClass().getSimpleName());
    }

    /**
     * Determines whether this is the absent fill value.
     *
     * @return {@code true} for kind {@link Kind#NULL}
     */
    public boolean isNull() {
        return kind == Kind.NULL;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FillValue)) {
            return false;
        }
        FillValue other = (FillValue) o;
        return kind == other.kind && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        return kind == Kind.NULL ? "null" : String.valueOf(value);
    }
}
