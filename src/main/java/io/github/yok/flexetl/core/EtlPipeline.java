package io.github.yok.flexetl.core;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.github.yok.flexetl.codec.TableCodec;
import io.github.yok.flexetl.exception.ExtractionException;
import io.github.yok.flexetl.exception.LoadingException;
import io.github.yok.flexetl.exception.PipelineStateException;
import io.github.yok.flexetl.table.ColumnType;
import io.github.yok.flexetl.table.FillValue;
import io.github.yok.flexetl.table.Row;
import io.github.yok.flexetl.table.Table;
import io.github.yok.flexetl.transform.AggregateFunction;
import io.github.yok.flexetl.transform.DataTransformer;
import io.github.yok.flexetl.transform.DuplicateKeep;
import io.github.yok.flexetl.transform.MissingValueStrategy;
import io.github.yok.flexetl.transform.NormalizationMethod;
import io.github.yok.flexetl.transform.TransformResult;
import io.github.yok.flexetl.util.LogPathUtil;
import io.github.yok.flexetl.validate.DataValidator;
import io.github.yok.flexetl.validate.Schema;
import io.github.yok.flexetl.validate.ValidationResult;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import lombok.extern.slf4j.Slf4j;

/**
 * Pipeline orchestrator: a chainable façade holding one current {@link Table} and one
 * {@link PipelineStats}.
 *
 * <p>
 * <strong>Usage:</strong>
 * </p>
 *
 * <pre>
 * EtlPipeline pipeline = new EtlPipeline(codec, statsSink);
 * pipeline.run();
 * pipeline.extract(Paths.get("in.csv"))
 *         .removeDuplicates()
 *         .handleMissingValues(MissingValueStrategy.DROP)
 *         .normalizeColumn("age", NormalizationMethod.MINMAX)
 *         .load(Paths.get("out.json"));
 * pipeline.finish();
 * pipeline.saveStats(Paths.get("stats.json"));
 * </pre>
 *
 * <p>
 * Every transformation requires a table (see {@link #extract(Path)}), delegates to
 * {@link DataTransformer}, updates its own counter, increments
 * {@code transformations_applied} and returns {@code this}. A transformation that throws leaves
 * the table and the statistics as they were. The pipeline copies tables it adopts and hands out
 * copies, so its table is never shared.
 * </p>
 *
 * <p>
 * Instances are not thread-safe; run independent pipelines over disjoint tables and combine
 * their statistics with {@link PipelineStats#merge(PipelineStats)}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class EtlPipeline {

    private final TableCodec codec;
    private final StatsSink statsSink;
    private final DataTransformer transformer;
    private final Clock clock;

    private final PipelineStats stats = new PipelineStats();

    // Warnings of every transformation, in order
    private final List<String> warnings = new ArrayList<>();

    // Failing rows of the last validation pass: row index → result
    private Map<Integer, ValidationResult> validationErrors = ImmutableMap.of();

    private Table table;

    /**
     * Creates a pipeline with the default transformer and the system clock.
     *
     * @param codec table reader/writer
     * @param statsSink statistics writer
     */
    public EtlPipeline(TableCodec codec, StatsSink statsSink) {
        this(codec, statsSink, new DataTransformer(), Clock.systemDefaultZone());
    }

    /**
     * Creates a pipeline.
     *
     * @param codec table reader/writer
     * @param statsSink statistics writer
     * @param transformer transformation engine
     * @param clock clock used for start and end timestamps
     */
    public EtlPipeline(TableCodec codec, StatsSink statsSink, DataTransformer transformer,
            Clock clock) {
        this.codec = Preconditions.checkNotNull(codec, "codec must not be null");
        this.statsSink = Preconditions.checkNotNull(statsSink, "statsSink must not be null");
        this.transformer = Preconditions.checkNotNull(transformer, "transformer must not be null");
        this.clock = Preconditions.checkNotNull(clock, "clock must not be null");
    }

    /**
     * Marks the start of an execution: {@code pending → running}, start timestamp recorded.
     *
     * @return this pipeline
     * @throws PipelineStateException if the pipeline is not pending
     */
    public EtlPipeline run() {
        transition(PipelineStatus.RUNNING);
        stats.setStartTime(LocalDateTime.now(clock));
        log.info("Pipeline started");
        return this;
    }

    /**
     * Marks the end of an execution: {@code running → completed}, end timestamp recorded and
     * execution time set to the time elapsed since {@link #run()}.
     *
     * @return this pipeline
     * @throws PipelineStateException if the pipeline is not running
     */
    public EtlPipeline finish() {
        transition(PipelineStatus.COMPLETED);
        LocalDateTime end = LocalDateTime.now(clock);
        stats.setEndTime(end);
        stats.setExecutionTime(Duration.between(stats.getStartTime(), end).toNanos() / 1e9);
        logCompletion();
        return this;
    }

    /**
     * Marks the end of an execution with a measured duration.
     *
     * @param executionSeconds duration measured by the caller, in seconds
     * @return this pipeline
     * @throws PipelineStateException if the pipeline is not running
     */
    public EtlPipeline finish(double executionSeconds) {
        Preconditions.checkArgument(executionSeconds >= 0, "execution time must not be negative");
        transition(PipelineStatus.COMPLETED);
        stats.setEndTime(LocalDateTime.now(clock));
        stats.setExecutionTime(executionSeconds);
        logCompletion();
        return this;
    }

    /**
     * Marks an execution as failed: {@code running → failed}, end timestamp recorded.
     *
     * @param cause error that ended the execution
     * @return this pipeline
     * @throws PipelineStateException if the pipeline is not running
     */
    public EtlPipeline fail(Throwable cause) {
        transition(PipelineStatus.FAILED);
        LocalDateTime end = LocalDateTime.now(clock);
        stats.setEndTime(end);
        stats.setExecutionTime(Duration.between(stats.getStartTime(), end).toNanos() / 1e9);
        log.error("Pipeline failed: {}", cause == null ? "unknown error" : cause.getMessage());
        return this;
    }

    /**
     * Runs the given steps between {@link #run()} and {@link #finish()}. When a step throws, the
     * pipeline is marked failed and the exception is rethrown.
     *
     * @param steps steps applied to this pipeline
     * @return this pipeline
     */
    public EtlPipeline execute(Consumer<EtlPipeline> steps) {
        Preconditions.checkNotNull(steps, "steps must not be null");
        run();
        try {
            steps.accept(this);
        } catch (RuntimeException e) {
            fail(e);
            throw e;
        }
        return finish();
    }

    private void transition(PipelineStatus next) {
        PipelineStatus current = stats.getStatus();
        if (!current.canTransitionTo(next)) {
            throw new PipelineStateException("Illegal pipeline transition: " + current.getValue()
                    + " -> " + next.getValue());
        }
        stats.setStatus(next);
    }

    private void logCompletion() {
        log.info("Pipeline completed in {}s: total={}, duplicatesRemoved={}, "
                + "missingValuesHandled={}, transformations={}", stats.getExecutionTime(),
                stats.getTotalRecords(), stats.getDuplicatesRemoved(),
                stats.getMissingValuesHandled(), stats.getTransformationsApplied());
    }

    /**
     * Extracts the table from a file, format taken from its suffix.
     *
     * @param source dataset file
     * @return this pipeline
     * @throws ExtractionException if the file cannot be read
     * @throws io.github.yok.flexetl.exception.UnsupportedFormatException if the suffix is not
     *         supported
     */
    public EtlPipeline extract(Path source) {
        return extract(source, null);
    }

    /**
     * Extracts the table from a file.
     *
     * @param source dataset file
     * @param format explicit format, or {@code null} to use the suffix
     * @return this pipeline
     * @throws ExtractionException if the file cannot be read
     * @throws io.github.yok.flexetl.exception.UnsupportedFormatException if the format is not
     *         supported
     */
    public EtlPipeline extract(Path source, String format) {
        Preconditions.checkNotNull(source, "source must not be null");
        Table extracted;
        try {
            extracted = codec.extract(source, format);
        } catch (IOException e) {
            throw new ExtractionException(
                    "extract: cannot read " + LogPathUtil.renderPathForLog(source), e);
        }
        adopt(extracted);
        return this;
    }

    /**
     * Adopts an in-memory table; the pipeline keeps its own copy.
     *
     * @param source table
     * @return this pipeline
     */
    public EtlPipeline extract(Table source) {
        Preconditions.checkNotNull(source, "table must not be null");
        adopt(source.copy());
        return this;
    }

    private void adopt(Table extracted) {
        this.table = extracted;
        this.validationErrors = ImmutableMap.of();
        stats.setTotalRecords(extracted.getRowCount());
        log.info("extract: {} rows, columns={}", extracted.getRowCount(),
                extracted.getColumnNames());
    }

    /**
     * Writes the current table to a file, format taken from its suffix.
     *
     * @param destination target file
     * @return this pipeline
     * @throws PipelineStateException if no table was extracted
     * @throws LoadingException if the file cannot be written
     */
    public EtlPipeline load(Path destination) {
        return load(destination, null);
    }

    /**
     * Writes the current table to a file.
     *
     * @param destination target file
     * @param format explicit format, or {@code null} to use the suffix
     * @return this pipeline
     * @throws PipelineStateException if no table was extracted
     * @throws LoadingException if the file cannot be written
     */
    public EtlPipeline load(Path destination, String format) {
        Preconditions.checkNotNull(destination, "destination must not be null");
        requireTable("load");
        try {
            codec.load(table, destination, format);
        } catch (IOException e) {
            throw new LoadingException(
                    "load: cannot write " + LogPathUtil.renderPathForLog(destination), e);
        }
        return this;
    }

    /**
     * Removes rows duplicated on every column, keeping the first occurrence.
     *
     * @return this pipeline
     */
    public EtlPipeline removeDuplicates() {
        return removeDuplicates(null, DuplicateKeep.FIRST);
    }

    /**
     * Removes duplicate rows; the removed rows are added to {@code duplicates_removed}.
     *
     * @param subset comparison columns, or {@code null} for all columns
     * @param keep surviving member of each duplicate group
     * @return this pipeline
     */
    public EtlPipeline removeDuplicates(List<String> subset, DuplicateKeep keep) {
        return apply("remove_duplicates", t -> transformer.removeDuplicates(t, subset, keep),
                affected -> stats.setDuplicatesRemoved(stats.getDuplicatesRemoved() + affected));
    }

    /**
     * Removes duplicate rows with a keep policy given by name ({@code first}, {@code last},
     * {@code none} or {@code false}).
     *
     * @param subset comparison columns, or {@code null} for all columns
     * @param keep keep policy name
     * @return this pipeline
     */
    public EtlPipeline removeDuplicates(List<String> subset, String keep) {
        return removeDuplicates(subset, DuplicateKeep.fromName(keep));
    }

    /**
     * Handles missing values with a strategy that needs no fill value.
     *
     * @param strategy strategy
     * @return this pipeline
     */
    public EtlPipeline handleMissingValues(MissingValueStrategy strategy) {
        return handleMissingValues(strategy, FillValue.none());
    }

    /**
     * Handles missing values; the missing cells met are added to {@code missing_values_handled}.
     *
     * @param strategy strategy
     * @param fillValue value for {@link MissingValueStrategy#FILL}
     * @return this pipeline
     */
    public EtlPipeline handleMissingValues(MissingValueStrategy strategy, FillValue fillValue) {
        return apply("handle_missing_values",
                t -> transformer.handleMissingValues(t, strategy, fillValue),
                affected -> stats
                        .setMissingValuesHandled(stats.getMissingValuesHandled() + affected));
    }

    /**
     * Handles missing values with a strategy given by name and a raw fill value.
     *
     * @param strategy strategy name such as {@code forward_fill}
     * @param fillValue integer, floating point, text or boolean value, or {@code null}
     * @return this pipeline
     */
    public EtlPipeline handleMissingValues(String strategy, Object fillValue) {
        return handleMissingValues(MissingValueStrategy.fromName(strategy),
                FillValue.of(fillValue));
    }

    /**
     * Renames columns in mapping order.
     *
     * @param mapping old name → new name
     * @return this pipeline
     */
    public EtlPipeline renameColumns(Map<String, String> mapping) {
        return apply("rename_columns", t -> transformer.renameColumns(t, mapping), null);
    }

    /**
     * Projects to the given columns; absent names are skipped with a warning.
     *
     * @param names column names in the requested order
     * @return this pipeline
     */
    public EtlPipeline selectColumns(List<String> names) {
        return apply("select_columns", t -> transformer.selectColumns(t, names), null);
    }

    /**
     * Keeps the rows accepted by the predicate.
     *
     * @param predicate row predicate
     * @return this pipeline
     */
    public EtlPipeline filterRows(Predicate<Row> predicate) {
        return apply("filter_rows", t -> transformer.filterRows(t, predicate), null);
    }

    /**
     * Converts column types, best effort per column.
     *
     * @param mapping column name → target type
     * @return this pipeline
     */
    public EtlPipeline convertDataTypes(Map<String, ColumnType> mapping) {
        return apply("convert_data_types", t -> transformer.convertDataTypes(t, mapping), null);
    }

    /**
     * Converts column types given by name ({@code int}, {@code float}, {@code str},
     * {@code bool}, {@code date}, ...). Every name is resolved before any column is touched.
     *
     * @param mapping column name → type name
     * @return this pipeline
     * @throws io.github.yok.flexetl.exception.ConfigurationException on an unknown type name
     */
    public EtlPipeline convertDataTypesByName(Map<String, String> mapping) {
        Preconditions.checkNotNull(mapping, "mapping must not be null");
        return convertDataTypes(DataTransformer.resolveTypes(mapping));
    }

    /**
     * Normalizes a numeric column.
     *
     * @param column column name
     * @param method normalization method
     * @return this pipeline
     */
    public EtlPipeline normalizeColumn(String column, NormalizationMethod method) {
        return apply("normalize_column", t -> transformer.normalizeColumn(t, column, method),
                null);
    }

    /**
     * Normalizes a numeric column with a method given by name ({@code minmax} or
     * {@code zscore}).
     *
     * @param column column name
     * @param method method name
     * @return this pipeline
     */
    public EtlPipeline normalizeColumn(String column, String method) {
        return normalizeColumn(column, NormalizationMethod.fromName(method));
    }

    /**
     * Adds or replaces a column computed from every row.
     *
     * @param column column name
     * @param function row → value
     * @return this pipeline
     */
    public EtlPipeline addCalculatedColumn(String column, Function<Row, Object> function) {
        return apply("add_calculated_column",
                t -> transformer.addCalculatedColumn(t, column, function), null);
    }

    /**
     * Groups and aggregates the table.
     *
     * @param groupBy grouping columns
     * @param aggregates column → aggregate function
     * @return this pipeline
     */
    public EtlPipeline aggregateData(List<String> groupBy,
            Map<String, AggregateFunction> aggregates) {
        return apply("aggregate_data", t -> transformer.aggregateData(t, groupBy, aggregates),
                null);
    }

    /**
     * Groups and aggregates the table with functions given by name ({@code mean}, {@code sum},
     * ...). Every name is resolved before the table is touched.
     *
     * @param groupBy grouping columns
     * @param aggregates column → function name
     * @return this pipeline
     * @throws io.github.yok.flexetl.exception.ConfigurationException on an unknown function name
     */
    public EtlPipeline aggregateDataByName(List<String> groupBy, Map<String, String> aggregates) {
        Preconditions.checkNotNull(aggregates, "aggregates must not be null");
        Map<String, AggregateFunction> functions = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : aggregates.entrySet()) {
            functions.put(entry.getKey(), AggregateFunction.fromName(entry.getValue()));
        }
        return aggregateData(groupBy, functions);
    }

    private EtlPipeline apply(String operation, Function<Table, TransformResult> operationCall,
            Consumer<Long> counter) {
        requireTable(operation);
        TransformResult result = operationCall.apply(table);
        table = result.getTable();
        warnings.addAll(result.getWarnings());
        if (counter != null) {
            counter.accept((long) result.getAffected());
        }
        stats.setTransformationsApplied(stats.getTransformationsApplied() + 1);
        log.debug("{}: affected={}, rows={}", operation, result.getAffected(),
                table.getRowCount());
        return this;
    }

    /**
     * Validates every row of the current table.
     *
     * <p>
     * Sets {@code valid_records} and {@code invalid_records} (each pass overwrites the previous
     * counts) and keeps the failing rows, see {@link #getValidationErrors()}. The table is not
     * changed and the pass does not count as a transformation.
     * </p>
     *
     * @param schema schema
     * @return this pipeline
     * @throws PipelineStateException if no table was extracted
     */
    public EtlPipeline validate(Schema schema) {
        Preconditions.checkNotNull(schema, "schema must not be null");
        requireTable("validate");
        List<ValidationResult> results = DataValidator.validateTable(table, schema);
        Map<Integer, ValidationResult> failures = new LinkedHashMap<>();
        for (int i = 0; i < results.size(); i++) {
            if (!results.get(i).isValid()) {
                failures.put(i, results.get(i));
            }
        }
        validationErrors = ImmutableMap.copyOf(failures);
        stats.setValidRecords(results.size() - failures.size());
        stats.setInvalidRecords(failures.size());
        if (failures.isEmpty()) {
            log.info("validate: all {} rows valid", results.size());
        } else {
            log.warn("validate: {} of {} rows invalid", failures.size(), results.size());
        }
        return this;
    }

    /**
     * Returns a snapshot of the statistics.
     *
     * @return independent copy
     */
    public PipelineStats getStats() {
        return stats.copy();
    }

    /**
     * Writes a statistics snapshot.
     *
     * @param destination target file
     * @return this pipeline
     * @throws LoadingException if the document cannot be written; the pipeline is unchanged
     */
    public EtlPipeline saveStats(Path destination) {
        Preconditions.checkNotNull(destination, "destination must not be null");
        try {
            statsSink.persist(getStats(), destination);
        } catch (IOException e) {
            throw new LoadingException("save_stats: cannot write "
                    + LogPathUtil.renderPathForLog(destination), e);
        }
        return this;
    }

    /**
     * Determines whether a table has been extracted.
     *
     * @return {@code true} once {@link #extract(Path)} or {@link #extract(Table)} succeeded
     */
    public boolean hasTable() {
        return table != null;
    }

    /**
     * Returns a copy of the current table.
     *
     * @return independent copy
     * @throws PipelineStateException if no table was extracted
     */
    public Table getTable() {
        requireTable("get_table");
        return table.copy();
    }

    /**
     * Returns the warnings of every transformation so far, in order.
     *
     * @return immutable list
     */
    public List<String> getWarnings() {
        return ImmutableList.copyOf(warnings);
    }

    /**
     * Returns the failing rows of the last validation pass.
     *
     * @return row index → result, in row order
     */
    public Map<Integer, ValidationResult> getValidationErrors() {
        return validationErrors;
    }

    private void requireTable(String operation) {
        if (table == null) {
            throw new PipelineStateException(
                    operation + ": no table loaded, call extract() first");
        }
    }
}
