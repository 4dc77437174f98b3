/**
 * Pipeline orchestrator and its statistics.
 *
 * <p>
 * {@link io.github.yok.flexetl.core.EtlPipeline} chains extraction, transformations, validation
 * and loading over one table and accumulates {@link io.github.yok.flexetl.core.PipelineStats},
 * persisted through a {@link io.github.yok.flexetl.core.StatsSink}.
 * </p>
 */
package io.github.yok.flexetl.core;
