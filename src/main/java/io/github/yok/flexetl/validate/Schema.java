package io.github.yok.flexetl.validate;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import io.github.yok.flexetl.exception.ConfigurationException;
import io.github.yok.flexetl.table.ColumnType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.commons.lang3.StringUtils;

/**
 * Declarative validation schema: an ordered mapping from field name to a set of
 * {@link FieldRule rules}, at most one per {@link RuleKind}.
 *
 * <p>
 * Build one with {@link #builder()}, or from the nested mapping read from a schema file with
 * {@link #fromMap(Map)}:
 * </p>
 *
 * <pre>
 * email:
 *   type: string
 *   email: true
 * age:
 *   numeric: true
 *   min: 0
 *   max: 120
 * birthday:
 *   date: true
 *   date_format: "%Y-%m-%d"
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
public final class Schema {

    // Keys accepted in a field definition of fromMap
    private static final Set<String> RULE_KEYS =
            ImmutableSet.of("type", "email", "numeric", "min", "max", "date", "date_format");

    // field name → rules by kind, in field declaration order
    private final Map<String, Map<RuleKind, FieldRule>> fields;

    private Schema(Map<String, Map<RuleKind, FieldRule>> fields) {
        this.fields = Collections.unmodifiableMap(fields);
    }

    /**
     * Starts a new schema.
     *
     * @return empty builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the field names in declaration order.
     *
     * @return immutable list of field names
     */
    public List<String> getFieldNames() {
        return ImmutableList.copyOf(fields.keySet());
    }

    /**
     * Returns the rules of a field in evaluation order (type, email, numeric, date).
     *
     * @param field field name
     * @return immutable list of rules, empty for an unknown field
     */
    public List<FieldRule> getRules(String field) {
        Map<RuleKind, FieldRule> rules = fields.get(field);
        return rules == null ? ImmutableList.of() : ImmutableList.copyOf(rules.values());
    }

    /**
     * Returns the number of fields.
     *
     * @return field count
     */
    public int size() {
        return fields.size();
    }

    /**
     * Builds a schema from a nested mapping.
     *
     * <p>
     * Each field maps to a definition with the optional keys {@code type} (a type name such as
     * {@code string} or {@code int}), {@code email}, {@code numeric} with {@code min} /
     * {@code max}, and {@code date} with {@code date_format}. A {@code null} definition declares
     * a required field without rules.
     * </p>
     *
     * @param raw field name → definition
     * @return schema
     * @throws ConfigurationException on an unknown key, a value of the wrong kind or an unknown
     *         type name
     */
    public static Schema fromMap(Map<String, ?> raw) {
        Preconditions.checkNotNull(raw, "raw schema must not be null");
        Builder builder = builder();
        for (Map.Entry<String, ?> entry : raw.entrySet()) {
            String field = entry.getKey();
            Object definition = entry.getValue();
            if (definition == null) {
                builder.field(field);
                continue;
            }
            if (!(definition instanceof Map)) {
                throw new ConfigurationException("Schema field " + field
                        + ": definition must be a mapping, got " + definition);
            }
            Map<?, ?> rules = (Map<?, ?>) definition;
            for (Object key : rules.keySet()) {
                if (!RULE_KEYS.contains(String.valueOf(key))) {
                    throw new ConfigurationException("Schema field " + field + ": unknown rule "
                            + key + ". Supported: " + String.join(", ", RULE_KEYS));
                }
            }
            List<FieldRule> fieldRules = new ArrayList<>();
            Object type = rules.get("type");
            if (type != null) {
                fieldRules.add(new TypeRule(ColumnType.fromName(type.toString())));
            }
            if (flag(field, rules, "email")) {
                fieldRules.add(EmailRule.INSTANCE);
            }
            if (flag(field, rules, "numeric")) {
                fieldRules.add(
                        new NumericRule(bound(field, rules, "min"), bound(field, rules, "max")));
            }
            if (flag(field, rules, "date")) {
                Object format = rules.get("date_format");
                fieldRules.add(new DateRule(format == null ? null : format.toString()));
            }
            builder.field(field, fieldRules.toArray(new FieldRule[0]));
        }
        return builder.build();
    }

    private static boolean flag(String field, Map<?, ?> rules, String key) {
        Object value = rules.get(key);
        if (value == null) {
            return false;
        }
        if (!(value instanceof Boolean)) {
            throw new ConfigurationException(
                    "Schema field " + field + ": " + key + " must be true or false, got " + value);
        }
        return (Boolean) value;
    }

    private static Double bound(String field, Map<?, ?> rules, String key) {
        Object value = rules.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Number)) {
            throw new ConfigurationException(
                    "Schema field " + field + ": " + key + " must be a number, got " + value);
        }
        return ((Number) value).doubleValue();
    }

    @Override
    public String toString() {
        return "Schema" + fields;
    }

    /**
     * Builder of {@link Schema}.
     */
    public static final class Builder {

        private final Map<String, Map<RuleKind, FieldRule>> fields = new LinkedHashMap<>();

        private Builder() {}

        /**
         * Declares a field, or adds rules to an already declared field. A rule replaces an
         * earlier rule of the same kind.
         *
         * @param name field name
         * @param rules rules of the field (none for a presence-only field)
         * @return this builder
         */
        public Builder field(String name, FieldRule... rules) {
            Preconditions.checkArgument(StringUtils.isNotBlank(name),
                    "field name must not be blank");
            Map<RuleKind, FieldRule> byKind =
                    fields.computeIfAbsent(name, k -> new EnumMap<>(RuleKind.class));
            for (FieldRule rule : rules) {
                Preconditions.checkNotNull(rule, "rule of field %s must not be null", name);
                byKind.put(rule.getKind(), rule);
            }
            return this;
        }

        /**
         * Builds the schema.
         *
         * @return immutable schema
         */
        public Schema build() {
            Map<String, Map<RuleKind, FieldRule>> copy = new LinkedHashMap<>();
            for (Map.Entry<String, Map<RuleKind, FieldRule>> entry : fields.entrySet()) {
                copy.put(entry.getKey(),
                        Collections.unmodifiableMap(new EnumMap<>(entry.getValue())));
            }
            return new Schema(copy);
        }
    }
}
