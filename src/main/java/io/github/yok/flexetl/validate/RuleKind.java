package io.github.yok.flexetl.validate;

/**
 * Kinds of field rules, declared in evaluation order.
 *
 * @author Yasuharu.Okawauchi
 */
public enum RuleKind {

    // Java type of the value
    TYPE,

    // E-mail address format
    EMAIL,

    // Numeric value within optional bounds
    NUMERIC,

    // Date text in a given format
    DATE
}
