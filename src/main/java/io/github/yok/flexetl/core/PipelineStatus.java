package io.github.yok.flexetl.core;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Lifecycle status of a pipeline.
 *
 * <p>
 * The only transitions are {@code pending → running → completed} and {@code running → failed}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public enum PipelineStatus {

    // Created, not started
    PENDING,

    // Between run() and finish()/fail()
    RUNNING,

    // finish() was called
    COMPLETED,

    // fail() was called
    FAILED;

    /**
     * Returns the lowercase name written to the statistics document.
     *
     * @return e.g. {@code running}
     */
    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Determines whether a transition to {@code next} is allowed.
     *
     * @param next target status
     * @return {@code true} for pending→running, running→completed and running→failed
     */
    public boolean canTransitionTo(PipelineStatus next) {
        switch (this) {
            case PENDING:
                return next == RUNNING;
            case RUNNING:
                return next == COMPLETED || next == FAILED;
            default:
                return false;
        }
    }
}
