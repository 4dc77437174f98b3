package io.github.yok.flexetl.util;

import io.github.yok.flexetl.exception.ConfigurationException;
import io.github.yok.flexetl.exception.PipelineStateException;
import lombok.Generated;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Reports fatal pipeline errors of the command line.
 *
 * <p>
 * The error is logged with its stack trace and a concise message is echoed to
 * {@code System.err}. The JVM is not terminated here; the caller turns the returned exit code
 * into the process status. Tests can switch the current thread to "throw instead of report".
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class ErrorHandler {

    /** Exit code of a run that failed while processing data. */
    public static final int EXIT_FAILURE = 1;

    /** Exit code of a run rejected because of its arguments or configuration. */
    public static final int EXIT_USAGE = 2;

    private static final ThreadLocal<Boolean> EXIT_DISABLED =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private ErrorHandler() {}

    /**
     * Makes {@link #errorAndExit} throw on the current thread instead of reporting.
     */
    public static void disableExitForCurrentThread() {
        EXIT_DISABLED.set(Boolean.TRUE);
    }

    /**
     * Restores normal reporting on the current thread.
     */
    public static void restoreExitForCurrentThread() {
        EXIT_DISABLED.remove();
    }

    /**
     * Logs a fatal error with its cause and prints a concise message to {@code System.err}.
     *
     * @param message what the pipeline was doing
     * @param cause root cause
     * @return exit code for the cause, see {@link #exitCodeOf(Throwable)}
     * @throws IllegalStateException if exit is disabled for the current thread
     */
    public static int errorAndExit(String message, Throwable cause) {
        log.error("{}\n{}", message, ExceptionUtils.getStackTrace(cause));
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message, cause);
        }
        System.err.println("ERROR: " + message + "\n" + ExceptionUtils.getRootCauseMessage(cause));
        return exitCodeOf(cause);
    }

    /**
     * Logs a fatal error and prints it to {@code System.err}.
     *
     * @param message error message
     * @return {@link #EXIT_USAGE}
     * @throws IllegalStateException if exit is disabled for the current thread
     */
    public static int errorAndExit(String message) {
        log.error(message);
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message);
        }
        System.err.println("ERROR: " + message);
        return EXIT_USAGE;
    }

    /**
     * Maps an error to a process exit code.
     *
     * @param cause error
     * @return {@link #EXIT_USAGE} for configuration and state errors, {@link #EXIT_FAILURE}
     *         otherwise
     */
    public static int exitCodeOf(Throwable cause) {
        if (cause instanceof ConfigurationException || cause instanceof PipelineStateException) {
            return EXIT_USAGE;
        }
        return EXIT_FAILURE;
    }
}
