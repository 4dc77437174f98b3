package io.github.yok.flexetl.validate;

import java.util.Optional;
import lombok.ToString;

/**
 * Requires the text form of the value to be an e-mail address.
 *
 * @author Yasuharu.Okawauchi
 */
@ToString
public final class EmailRule implements FieldRule {

    /** Shared instance; the rule has no parameters. */
    public static final EmailRule INSTANCE = new EmailRule();

    private EmailRule() {}

    @Override
    public RuleKind getKind() {
        return RuleKind.EMAIL;
    }

    @Override
    public Optional<String> check(String field, Object value) {
        if (DataValidator.validateEmail(String.valueOf(value))) {
            return Optional.empty();
        }
        return Optional.of("Field " + field + ": invalid email");
    }
}
