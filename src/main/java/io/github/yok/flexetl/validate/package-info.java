/**
 * Validation engine.
 *
 * <p>
 * {@link io.github.yok.flexetl.validate.DataValidator} holds the value checks and applies a
 * {@link io.github.yok.flexetl.validate.Schema} of
 * {@link io.github.yok.flexetl.validate.FieldRule rules} to rows. Violations are returned as
 * {@link io.github.yok.flexetl.validate.ValidationResult data}, never thrown.
 * </p>
 */
package io.github.yok.flexetl.validate;
