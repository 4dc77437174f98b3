package io.github.yok.flexetl.validate;

import java.util.Optional;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;

/**
 * Requires the text form of the value to be a date in a given format.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode
@ToString
public final class DateRule implements FieldRule {

    /** Format used when none is given. */
    public static final String DEFAULT_FORMAT = "%Y-%m-%d";

    // strftime or java.time pattern
    private final String format;

    /**
     * Creates the rule.
     *
     * @param format strftime or {@code java.time} pattern; blank means {@link #DEFAULT_FORMAT}
     */
    public DateRule(String format) {
        this.format = StringUtils.defaultIfBlank(format, DEFAULT_FORMAT);
    }

    /**
     * Creates a rule with {@link #DEFAULT_FORMAT}.
     *
     * @return ISO date rule
     */
    public static DateRule iso() {
        return new DateRule(DEFAULT_FORMAT);
    }

    @Override
    public RuleKind getKind() {
        return RuleKind.DATE;
    }

    @Override
    public Optional<String> check(String field, Object value) {
        if (DataValidator.validateDate(String.valueOf(value), format)) {
            return Optional.empty();
        }
        return Optional.of("Field " + field + ": invalid date (expected format: " + format + ")");
    }
}
