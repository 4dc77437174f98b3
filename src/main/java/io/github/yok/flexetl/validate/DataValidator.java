package io.github.yok.flexetl.validate;

import com.google.common.base.Preconditions;
import io.github.yok.flexetl.table.Row;
import io.github.yok.flexetl.table.Table;
import io.github.yok.flexetl.util.DateTimeFormats;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import lombok.Generated;
import lombok.extern.slf4j.Slf4j;

/**
 * Validation engine: value checks and schema-driven row validation.
 *
 * <p>
 * Every check is total: bad input yields {@code false} or an error message, never an exception.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class DataValidator {

    private static final Pattern EMAIL =
            Pattern.compile("^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$");

    private static final Pattern PHONE = Pattern.compile("^[\\d\\s\\-+()]{10,}$");

    // Decimal notation with optional sign and exponent
    private static final Pattern DECIMAL =
            Pattern.compile("^[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?$");

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private DataValidator() {}

    /**
     * Checks an e-mail address.
     *
     * @param value value
     * @return {@code true} for a string of the form {@code local@domain.tld}
     */
    public static boolean validateEmail(Object value) {
        return value instanceof String && EMAIL.matcher((String) value).matches();
    }

    /**
     * Checks a phone number: at least ten digits, spaces, {@code +}, {@code -} or parentheses.
     *
     * @param value value
     * @return {@code true} for a matching string
     */
    public static boolean validatePhone(Object value) {
        return value instanceof String && PHONE.matcher((String) value).matches();
    }

    /**
     * Checks a numeric value against inclusive bounds.
     *
     * <p>
     * Numbers, booleans (1 / 0) and strings in decimal notation are accepted; anything else,
     * including NaN, fails.
     * </p>
     *
     * @param value value
     * @param min inclusive lower bound, or {@code null}
     * @param max inclusive upper bound, or {@code null}
     * @return {@code true} if the value is numeric and within the bounds
     */
    public static boolean validateNumeric(Object value, Double min, Double max) {
        Optional<Double> number = toDouble(value);
        if (!number.isPresent() || number.get().isNaN()) {
            return false;
        }
        double v = number.get();
        if (min != null && v < min) {
            return false;
        }
        return max == null || v <= max;
    }

    /**
     * Checks a numeric value without bounds.
     *
     * @param value value
     * @return {@code true} if the value is numeric
     */
    public static boolean validateNumeric(Object value) {
        return validateNumeric(value, null, null);
    }

    private static Optional<Double> toDouble(Object value) {
        if (value instanceof Boolean) {
            return Optional.of(((Boolean) value) ? 1.0 : 0.0);
        }
        if (value instanceof Number) {
            return Optional.of(((Number) value).doubleValue());
        }
        if (value instanceof String && DECIMAL.matcher(((String) value).trim()).matches()) {
            return Optional.of(Double.parseDouble(((String) value).trim()));
        }
        return Optional.empty();
    }

    /**
     * Checks a date string with a strict parse: the whole text must match and every field must
     * be valid.
     *
     * @param value value
     * @param format strftime ({@code %d/%m/%Y}) or {@code java.time} ({@code dd/MM/yyyy})
     *        pattern
     * @return {@code true} for a string that parses
     */
    public static boolean validateDate(Object value, String format) {
        if (!(value instanceof String)) {
            return false;
        }
        DateTimeFormatter formatter;
        try {
            formatter = DateTimeFormats.strictFormatter(format);
        } catch (IllegalArgumentException e) {
            log.warn("Invalid date format {}: {}", format, e.getMessage());
            return false;
        }
        try {
            formatter.parse((String) value);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    /**
     * Checks a date string in {@link DateRule#DEFAULT_FORMAT}.
     *
     * @param value value
     * @return {@code true} for an ISO date string
     */
    public static boolean validateDate(Object value) {
        return validateDate(value, DateRule.DEFAULT_FORMAT);
    }

    /**
     * Checks the length of a string against inclusive bounds.
     *
     * @param value value
     * @param minLength inclusive minimum length
     * @param maxLength inclusive maximum length, or {@code null}
     * @return {@code true} for a string within the bounds
     */
    public static boolean validateStringLength(Object value, int minLength, Integer maxLength) {
        if (!(value instanceof String)) {
            return false;
        }
        int length = ((String) value).length();
        return length >= minLength && (maxLength == null || length <= maxLength);
    }

    /**
     * Checks membership with {@link Object#equals(Object)}, without coercion.
     *
     * @param value value
     * @param allowed allowed values
     * @return {@code true} if {@code allowed} contains the value
     */
    public static boolean validateInList(Object value, Collection<?> allowed) {
        return allowed != null && allowed.contains(value);
    }

    /**
     * Validates a row against a schema.
     *
     * <p>
     * For every schema field in order: a field absent from the row is reported as missing;
     * otherwise every rule of the field is applied in the order type, email, numeric, date and
     * every violation is recorded.
     * </p>
     *
     * @param row field name → value; a present key with a {@code null} value is a present field
     * @param schema schema
     * @return validation result
     */
    public static ValidationResult validateRow(Map<String, ?> row, Schema schema) {
        Preconditions.checkNotNull(row, "row must not be null");
        Preconditions.checkNotNull(schema, "schema must not be null");
        List<String> errors = new ArrayList<>();
        for (String field : schema.getFieldNames()) {
            if (!row.containsKey(field)) {
                errors.add("Missing required field: " + field);
                continue;
            }
            Object value = row.get(field);
            for (FieldRule rule : schema.getRules(field)) {
                rule.check(field, value).ifPresent(errors::add);
            }
        }
        return new ValidationResult(errors);
    }

    /**
     * Validates a table row against a schema.
     *
     * @param row row view
     * @param schema schema
     * @return validation result
     */
    public static ValidationResult validateRow(Row row, Schema schema) {
        return validateRow(row.asMap(), schema);
    }

    /**
     * Validates every row of a table.
     *
     * @param table table
     * @param schema schema
     * @return one result per row, in row order
     */
    public static List<ValidationResult> validateTable(Table table, Schema schema) {
        Preconditions.checkNotNull(table, "table must not be null");
        List<ValidationResult> results = new ArrayList<>(table.getRowCount());
        for (Row row : table.getRows()) {
            results.add(validateRow(row, schema));
        }
        return results;
    }
}
