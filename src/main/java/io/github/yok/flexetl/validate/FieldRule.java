package io.github.yok.flexetl.validate;

import java.util.Optional;

/**
 * One validation rule applied to the value of a schema field.
 *
 * <p>
 * A field holds at most one rule of each {@link RuleKind}. Rules never throw on bad input; a
 * violation is returned as an error message.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface FieldRule {

    /**
     * Returns the kind of this rule.
     *
     * @return rule kind, which fixes the evaluation order within a field
     */
    RuleKind getKind();

    /**
     * Checks a present value.
     *
     * @param field field name, used in the message
     * @param value field value, {@code null} when the cell is missing
     * @return the error message, or empty when the value passes
     */
    Optional<String> check(String field, Object value);
}
