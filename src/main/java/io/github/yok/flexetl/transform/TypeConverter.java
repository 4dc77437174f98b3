package io.github.yok.flexetl.transform;

import io.github.yok.flexetl.exception.TransformationException;
import io.github.yok.flexetl.table.Column;
import io.github.yok.flexetl.table.ColumnType;
import io.github.yok.flexetl.util.DateTimeFormats;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.Generated;
import org.apache.commons.lang3.StringUtils;

/**
 * Converts whole columns to a target {@link ColumnType}.
 *
 * <p>
 * Missing values stay missing. The first value that cannot be converted aborts the column with a
 * {@link TransformationException} naming the row; the caller decides whether that is fatal.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
final class TypeConverter {

    @Generated
    private TypeConverter() {}

    /**
     * Converts every non-missing value of a column.
     *
     * @param column source column
     * @param target target type
     * @return converted column of type {@code target}
     * @throws TransformationException if a value cannot be converted
     */
    static Column convert(Column column, ColumnType target) {
        if (target == ColumnType.OBJECT) {
            return Column.of(column.getName(), ColumnType.OBJECT, column.getValues());
        }
        List<Object> converted = new ArrayList<>(column.size());
        for (int i = 0; i < column.size(); i++) {
            Object value = column.get(i);
            if (value == null) {
                converted.add(null);
                continue;
            }
            try {
                converted.add(convertValue(value, target));
            } catch (IllegalArgumentException e) {
                throw new TransformationException("Cannot convert column " + column.getName()
                        + " to " + target.name().toLowerCase(Locale.ROOT) + ": row " + i
                        + " holds " + value, e);
            }
        }
        return Column.of(column.getName(), target, converted);
    }

    /**
     * Converts one non-missing value.
     *
     * @param value value
     * @param target target type
     * @return converted value
     * @throws IllegalArgumentException if the value cannot be converted
     */
    static Object convertValue(Object value, ColumnType target) {
        switch (target) {
            case INT:
                return toLong(value);
            case FLOAT:
                return toDouble(value);
            case STRING:
                return value.toString();
            case BOOL:
                return toBoolean(value);
            case DATE:
                return toDate(value);
            case DATETIME:
                return toDateTime(value);
            default:
                return value;
        }
    }

    private static Long toLong(Object value) {
        if (value instanceof Boolean) {
            return ((Boolean) value) ? 1L : 0L;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new IllegalArgumentException("not a finite number: " + d);
            }
            // (double) Long.MAX_VALUE is 2^63
            if (d >= (double) Long.MAX_VALUE || d < (double) Long.MIN_VALUE) {
                throw new IllegalArgumentException("out of int range: " + d);
            }
            // truncation toward zero
            return (long) d;
        }
        if (value instanceof BigInteger || value instanceof BigDecimal) {
            try {
                return new BigDecimal(value.toString()).toBigInteger().longValueExact();
            } catch (ArithmeticException e) {
                throw new IllegalArgumentException("out of int range: " + value, e);
            }
        }
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String) {
            String text = ((String) value).trim();
            try {
                return Long.parseLong(text);
            } catch (NumberFormatException e) {
                return toLong(Double.parseDouble(text));
            }
        }
        throw new IllegalArgumentException("not convertible to int: " + value);
    }

    private static Double toDouble(Object value) {
        if (value instanceof Boolean) {
            return ((Boolean) value) ? 1.0 : 0.0;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            return Double.parseDouble(((String) value).trim());
        }
        throw new IllegalArgumentException("not convertible to float: " + value);
    }

    private static Boolean toBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue() != 0.0;
        }
        if (value instanceof String) {
            String text = StringUtils.lowerCase(((String) value).trim(), Locale.ROOT);
            switch (text) {
                case "true":
                case "1":
                case "yes":
                    return Boolean.TRUE;
                case "false":
                case "0":
                case "no":
                    return Boolean.FALSE;
                default:
                    break;
            }
        }
        throw new IllegalArgumentException("not convertible to bool: " + value);
    }

    private static LocalDate toDate(Object value) {
        if (value instanceof LocalDate) {
            return (LocalDate) value;
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).toLocalDate();
        }
        return DateTimeFormats.parseDate(value.toString())
                .orElseThrow(() -> new IllegalArgumentException("not a date: " + value));
    }

    private static LocalDateTime toDateTime(Object value) {
        if (value instanceof LocalDateTime) {
            return (LocalDateTime) value;
        }
        if (value instanceof LocalDate) {
            return ((LocalDate) value).atStartOfDay();
        }
        return DateTimeFormats.parseDateTime(value.toString())
                .orElseThrow(() -> new IllegalArgumentException("not a date-time: " + value));
    }
}
