/**
 * Tabular data model.
 *
 * <p>
 * A {@link io.github.yok.flexetl.table.Table} is an ordered set of equal-length, uniquely named,
 * typed {@link io.github.yok.flexetl.table.Column columns}; {@code null} marks a missing value.
 * Transformations and validation read rows through {@link io.github.yok.flexetl.table.Row}.
 * </p>
 */
package io.github.yok.flexetl.table;
