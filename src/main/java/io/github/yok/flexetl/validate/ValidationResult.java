package io.github.yok.flexetl.validate;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of validating one row.
 *
 * <p>
 * {@code warnings} is part of the result shape but no rule produces warnings; it is always empty.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode
@ToString
public final class ValidationResult {

    private final boolean valid;
    private final List<String> errors;
    private final List<String> warnings;

    /**
     * Creates a result; the row is valid when there are no errors.
     *
     * @param errors error messages in evaluation order
     */
    public ValidationResult(List<String> errors) {
        this.errors = ImmutableList.copyOf(errors);
        this.warnings = ImmutableList.of();
        this.valid = this.errors.isEmpty();
    }
}
