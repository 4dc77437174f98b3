/**
 * Transformation engine.
 *
 * <p>
 * {@link io.github.yok.flexetl.transform.DataTransformer} implements the table operations
 * (deduplication, missing values, renaming, projection, filtering, type conversion,
 * normalization, calculated columns and aggregation). Each returns a
 * {@link io.github.yok.flexetl.transform.TransformResult} and never mutates its input.
 * </p>
 */
package io.github.yok.flexetl.transform;
