package io.github.yok.flexetl.validate;

import com.google.common.base.Preconditions;
import io.github.yok.flexetl.table.ColumnType;
import java.util.Locale;
import java.util.Optional;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Requires the value to be an instance of a {@link ColumnType}. A missing value never passes.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode
@ToString
public final class TypeRule implements FieldRule {

    private final ColumnType type;

    /**
     * Creates the rule.
     *
     * @param type required type
     */
    public TypeRule(ColumnType type) {
        this.type = Preconditions.checkNotNull(type, "type must not be null");
    }

    @Override
    public RuleKind getKind() {
        return RuleKind.TYPE;
    }

    @Override
    public Optional<String> check(String field, Object value) {
        if (type.accepts(value)) {
            return Optional.empty();
        }
        String actual = value == null ? "null" : value.getClass().getSimpleName();
        return Optional.of("Field " + field + ": expected type "
                + type.name().toLowerCase(Locale.ROOT) + ", got " + actual);
    }
}
