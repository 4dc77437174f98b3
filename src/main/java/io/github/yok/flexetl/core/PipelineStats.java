package io.github.yok.flexetl.core;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import java.time.LocalDateTime;
import lombok.Data;

/**
 * Cumulative statistics of one pipeline.
 *
 * <p>
 * Every successful transformation adds 1 to {@code transformationsApplied}. Deduplication adds
 * the removed rows to {@code duplicatesRemoved} and missing-value handling adds the missing cells
 * it met to {@code missingValuesHandled}; both accumulate across calls. Serialized with snake_case
 * keys; timestamps are written as ISO-8601 text.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({"total_records", "valid_records", "invalid_records", "duplicates_removed",
        "missing_values_handled", "transformations_applied", "execution_time", "start_time",
        "end_time", "status"})
public class PipelineStats {

    // Rows of the last extracted table
    private long totalRecords;

    // Rows that passed the last validation pass
    private long validRecords;

    // Rows that failed the last validation pass
    private long invalidRecords;

    private long duplicatesRemoved;

    private long missingValuesHandled;

    private long transformationsApplied;

    // Seconds
    private double executionTime;

    @JsonSerialize(using = ToStringSerializer.class)
    private LocalDateTime startTime;

    @JsonSerialize(using = ToStringSerializer.class)
    private LocalDateTime endTime;

    private PipelineStatus status = PipelineStatus.PENDING;

    /**
     * Returns an independent snapshot of these statistics.
     *
     * @return copy
     */
    public PipelineStats copy() {
        PipelineStats copy = new PipelineStats();
        copy.totalRecords = totalRecords;
        copy.validRecords = validRecords;
        copy.invalidRecords = invalidRecords;
        copy.duplicatesRemoved = duplicatesRemoved;
        copy.missingValuesHandled = missingValuesHandled;
        copy.transformationsApplied = transformationsApplied;
        copy.executionTime = executionTime;
        copy.startTime = startTime;
        copy.endTime = endTime;
        copy.status = status;
        return copy;
    }

    /**
     * Combines the statistics of two independent pipelines.
     *
     * <p>
     * Counters and execution times are summed; the time span covers both runs. The status is
     * {@code failed} if either failed, {@code running} if either is still running, {@code pending}
     * if either never started, and {@code completed} otherwise.
     * </p>
     *
     * @param other statistics of another pipeline
     * @return new combined statistics; neither input is modified
     */
    public PipelineStats merge(PipelineStats other) {
        PipelineStats merged = new PipelineStats();
        merged.totalRecords = totalRecords + other.totalRecords;
        merged.validRecords = validRecords + other.validRecords;
        merged.invalidRecords = invalidRecords + other.invalidRecords;
        merged.duplicatesRemoved = duplicatesRemoved + other.duplicatesRemoved;
        merged.missingValuesHandled = missingValuesHandled + other.missingValuesHandled;
        merged.transformationsApplied = transformationsApplied + other.transformationsApplied;
        merged.executionTime = executionTime + other.executionTime;
        merged.startTime = earliest(startTime, other.startTime);
        merged.endTime = latest(endTime, other.endTime);
        merged.status = mergeStatus(status, other.status);
        return merged;
    }

    private static LocalDateTime earliest(LocalDateTime a, LocalDateTime b) {
        if (a == null || b == null) {
            return a == null ? b : a;
        }
        return a.isBefore(b) ? a : b;
    }

    private static LocalDateTime latest(LocalDateTime a, LocalDateTime b) {
        if (a == null || b == null) {
            return a == null ? b : a;
        }
        return a.isAfter(b) ? a : b;
    }

    private static PipelineStatus mergeStatus(PipelineStatus a, PipelineStatus b) {
        PipelineStatus[] precedence = {PipelineStatus.FAILED, PipelineStatus.RUNNING,
                PipelineStatus.PENDING};
        for (PipelineStatus status : precedence) {
            if (a == status || b == status) {
                return status;
            }
        }
        return PipelineStatus.COMPLETED;
    }
}
