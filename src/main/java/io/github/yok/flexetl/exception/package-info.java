/**
 * Exception hierarchy of the ETL pipeline.
 *
 * <p>
 * Precondition, configuration and transformation errors are raised immediately and abort only the
 * current call. Codec and sink failures are wrapped into {@link
 * io.github.yok.flexetl.exception.ExtractionException} or {@link
 * io.github.yok.flexetl.exception.LoadingException}.
 * </p>
 */
package io.github.yok.flexetl.exception;
