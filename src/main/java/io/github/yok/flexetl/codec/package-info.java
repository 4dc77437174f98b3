/**
 * Reading and writing tables as CSV, JSON and YAML files.
 *
 * <p>
 * {@link io.github.yok.flexetl.codec.TableCodec} is the seam used by the pipeline;
 * {@link io.github.yok.flexetl.codec.DefaultTableCodec} resolves a
 * {@link io.github.yok.flexetl.codec.DataFormat} and delegates to a
 * {@link io.github.yok.flexetl.codec.FormatHandler}.
 * </p>
 */
package io.github.yok.flexetl.codec;
