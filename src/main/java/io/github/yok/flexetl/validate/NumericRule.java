package io.github.yok.flexetl.validate;

import com.google.common.base.Preconditions;
import java.util.Optional;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Requires a numeric value within optional inclusive bounds.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode
@ToString
public final class NumericRule implements FieldRule {

    // Inclusive lower bound, null = unbounded
    private final Double min;

    // Inclusive upper bound, null = unbounded
    private final Double max;

    /**
     * Creates the rule.
     *
     * @param min inclusive lower bound, or {@code null}
     * @param max inclusive upper bound, or {@code null}
     * @throws IllegalArgumentException if {@code min > max}
     */
    public NumericRule(Double min, Double max) {
        Preconditions.checkArgument(min == null || max == null || min <= max,
                "min %s must not exceed max %s", min, max);
        this.min = min;
        this.max = max;
    }

    /**
     * Creates an unbounded rule.
     *
     * @return rule accepting any numeric value
     */
    public static NumericRule any() {
        return new NumericRule(null, null);
    }

    @Override
    public RuleKind getKind() {
        return RuleKind.NUMERIC;
    }

    @Override
    public Optional<String> check(String field, Object value) {
        if (DataValidator.validateNumeric(value, min, max)) {
            return Optional.empty();
        }
        return Optional.of("Field " + field + ": invalid numeric value");
    }
}
