package io.github.yok.flexetl.transform;

import com.google.common.base.Preconditions;
import io.github.yok.flexetl.exception.ConfigurationException;
import io.github.yok.flexetl.exception.TransformationException;
import io.github.yok.flexetl.table.Column;
import io.github.yok.flexetl.table.ColumnType;
import io.github.yok.flexetl.table.FillValue;
import io.github.yok.flexetl.table.Row;
import io.github.yok.flexetl.table.Table;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.function.Predicate;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Transformation engine: table operations chained by
 * {@link io.github.yok.flexetl.core.EtlPipeline}.
 *
 * <p>
 * Every operation leaves its input table untouched and returns a {@link TransformResult} carrying
 * the new table, the number of rows, cells or columns it affected, and its warnings. Malformed
 * arguments fail loudly with a {@link TransformationException} or a
 * {@link ConfigurationException}; the only soft failures are columns skipped by
 * {@link #selectColumns(Table, List)} and per-column failures of
 * {@link #convertDataTypes(Table, Map)}.
 * </p>
 *
 * <p>
 * The class is stateless and safe to share.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class DataTransformer {

    /**
     * Removes duplicate rows.
     *
     * <p>
     * Rows are compared on {@code subset}, or on every column when {@code subset} is {@code null}
     * or empty. Survivors keep their relative order.
     * </p>
     *
     * @param table input table
     * @param subset comparison columns, or {@code null} for all columns
     * @param keep which member of a duplicate group survives
     * @return result whose affected count is the number of rows removed
     * @throws TransformationException if a subset column does not exist
     */
    public TransformResult removeDuplicates(Table table, List<String> subset, DuplicateKeep keep) {
        Preconditions.checkNotNull(table, "table must not be null");
        Preconditions.checkNotNull(keep, "keep must not be null");
        List<String> keyColumns =
                subset == null || subset.isEmpty() ? table.getColumnNames() : subset;
        for (String name : keyColumns) {
            requireColumn("remove_duplicates", table, name);
        }

        List<List<Object>> keys = new ArrayList<>(table.getRowCount());
        Map<List<Object>, Integer> occurrences = new HashMap<>();
        Map<List<Object>, Integer> lastIndex = new HashMap<>();
        for (int i = 0; i < table.getRowCount(); i++) {
            List<Object> key = keyOf(table, keyColumns, i);
            keys.add(key);
            occurrences.merge(key, 1, Integer::sum);
            lastIndex.put(key, i);
        }

        List<Integer> kept = new ArrayList<>();
        Set<List<Object>> seen = new HashSet<>();
        for (int i = 0; i < keys.size(); i++) {
            List<Object> key = keys.get(i);
            switch (keep) {
                case FIRST:
                    if (seen.add(key)) {
                        kept.add(i);
                    }
                    break;
                case LAST:
                    if (lastIndex.get(key) == i) {
                        kept.add(i);
                    }
                    break;
                default:
                    if (occurrences.get(key) == 1) {
                        kept.add(i);
                    }
                    break;
            }
        }
        int removed = table.getRowCount() - kept.size();
        log.info("remove_duplicates: removed {} of {} rows (keep={})", removed,
                table.getRowCount(), keep.name().toLowerCase(Locale.ROOT));
        return new TransformResult(table.selectRows(kept), removed);
    }

    /**
     * Handles missing cells.
     *
     * <ul>
     * <li>{@link MissingValueStrategy#DROP}: removes every row holding a missing cell.</li>
     * <li>{@link MissingValueStrategy#FILL}: replaces every missing cell with {@code fillValue}.
     * An INT column filled with a FLOAT value becomes FLOAT, an INT value filled into a FLOAT
     * column is widened, any other mismatch turns the column into OBJECT.</li>
     * <li>{@link MissingValueStrategy#FORWARD_FILL} / {@link MissingValueStrategy#BACKWARD_FILL}:
     * copies the nearest preceding / following value of the same column; a cell with no such
     * value stays missing.</li>
     * </ul>
     *
     * @param table input table
     * @param strategy strategy
     * @param fillValue value for {@link MissingValueStrategy#FILL}, ignored otherwise
     * @return result whose affected count is the number of missing cells before the operation
     * @throws ConfigurationException if {@code fill} is requested without a fill value
     */
    public TransformResult handleMissingValues(Table table, MissingValueStrategy strategy,
            FillValue fillValue) {
        Preconditions.checkNotNull(table, "table must not be null");
        Preconditions.checkNotNull(strategy, "strategy must not be null");
        if (strategy == MissingValueStrategy.FILL && (fillValue == null || fillValue.isNull())) {
            throw new ConfigurationException(
                    "handle_missing_values: strategy fill requires a fill value");
        }
        int missing = table.countMissing();
        if (missing == 0) {
            log.info("handle_missing_values: no missing values");
            return new TransformResult(table.copy(), 0);
        }

        Table result;
        switch (strategy) {
            case DROP:
                result = dropIncompleteRows(table);
                break;
            case FILL:
                result = new Table();
                for (Column column : table.getColumns()) {
                    result.putColumn(fill(column, fillValue));
                }
                break;
            default:
                boolean forward = strategy == MissingValueStrategy.FORWARD_FILL;
                result = new Table();
                for (Column column : table.getColumns()) {
                    result.putColumn(propagate(column, forward));
                }
                break;
        }
        log.info("handle_missing_values: {} missing cells handled (strategy={}, rows {} -> {})",
                missing, strategy.getConfigName(), table.getRowCount(), result.getRowCount());
        return new TransformResult(result, missing);
    }

    /**
     * Renames columns all at once; every source name refers to the input table.
     *
     * <p>
     * Absent source columns are ignored. A renamed column keeps the position of its source and
     * replaces a column carrying the target name unless that column is renamed away itself. When
     * two sources share a target, the later entry of {@code mapping} wins.
     * </p>
     *
     * @param table input table
     * @param mapping old name → new name
     * @return result whose affected count is the number of columns renamed
     * @throws TransformationException if a target name is blank
     */
    public TransformResult renameColumns(Table table, Map<String, String> mapping) {
        Preconditions.checkNotNull(table, "table must not be null");
        Preconditions.checkNotNull(mapping, "mapping must not be null");
        for (Map.Entry<String, String> entry : mapping.entrySet()) {
            if (StringUtils.isBlank(entry.getValue())) {
                throw new TransformationException(
                        "rename_columns: blank target name for column " + entry.getKey());
            }
        }

        // Sources present in the input table and actually renamed
        Map<String, String> effective = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : mapping.entrySet()) {
            String from = entry.getKey();
            if (!table.hasColumn(from)) {
                log.debug("rename_columns: column {} not found, ignored", from);
            } else if (!from.equals(entry.getValue())) {
                effective.put(from, entry.getValue());
            }
        }
        // target -> source that ends up with the name; the later mapping entry wins
        Map<String, String> winners = new HashMap<>();
        for (Map.Entry<String, String> entry : effective.entrySet()) {
            winners.put(entry.getValue(), entry.getKey());
        }

        List<Column> columns = new ArrayList<>();
        for (Column column : table.getColumns()) {
            String name = column.getName();
            String to = effective.get(name);
            if (to != null) {
                if (name.equals(winners.get(to))) {
                    columns.add(column.rename(to));
                } else {
                    log.debug("rename_columns: column {} overwritten by {}", name,
                            winners.get(to));
                }
            } else if (winners.containsKey(name)) {
                log.debug("rename_columns: column {} overwritten by {}", name, winners.get(name));
            } else {
                columns.add(column);
            }
        }
        int renamed = effective.size();
        log.info("rename_columns: {} columns renamed", renamed);
        return new TransformResult(new Table(columns), renamed);
    }

    /**
     * Projects the table to the given columns in the requested order.
     *
     * <p>
     * Absent names are skipped with a warning; a name requested twice is kept once.
     * </p>
     *
     * @param table input table
     * @param names requested column names
     * @return result whose affected count is the number of columns dropped
     */
    public TransformResult selectColumns(Table table, List<String> names) {
        Preconditions.checkNotNull(table, "table must not be null");
        Preconditions.checkNotNull(names, "names must not be null");
        List<String> warnings = new ArrayList<>();
        Set<String> selected = new LinkedHashSet<>();
        for (String name : names) {
            if (table.hasColumn(name)) {
                selected.add(name);
            } else {
                String warning = "select_columns: column " + name + " not found, skipped";
                log.warn(warning);
                warnings.add(warning);
            }
        }
        List<Column> columns = new ArrayList<>(selected.size());
        for (String name : selected) {
            columns.add(table.getColumn(name));
        }
        Table result = new Table(columns);
        if (columns.isEmpty()) {
            log.warn("select_columns: no requested column exists, the result has no columns");
        }
        int dropped = table.getColumnCount() - columns.size();
        log.info("select_columns: {} columns kept, {} dropped", columns.size(), dropped);
        return new TransformResult(result, dropped, warnings);
    }

    /**
     * Keeps the rows accepted by a predicate.
     *
     * @param table input table
     * @param predicate row predicate, evaluated once per row
     * @return result whose affected count is the number of rows removed
     * @throws TransformationException if the predicate throws
     */
    public TransformResult filterRows(Table table, Predicate<Row> predicate) {
        Preconditions.checkNotNull(table, "table must not be null");
        Preconditions.checkNotNull(predicate, "predicate must not be null");
        List<Integer> kept = new ArrayList<>();
        for (Row row : table.getRows()) {
            boolean accepted;
            try {
                accepted = predicate.test(row);
            } catch (RuntimeException e) {
                throw new TransformationException(
                        "filter_rows: predicate failed on row " + row.getIndex(), e);
            }
            if (accepted) {
                kept.add(row.getIndex());
            }
        }
        int removed = table.getRowCount() - kept.size();
        log.info("filter_rows: removed {} of {} rows", removed, table.getRowCount());
        return new TransformResult(table.selectRows(kept), removed);
    }

    /**
     * Converts columns to the given types, column by column.
     *
     * <p>
     * A column that fails to convert is logged, reported as a warning and left as it was; the
     * other columns are still converted. Absent columns are skipped with a warning. Missing cells
     * stay missing.
     * </p>
     *
     * @param table input table
     * @param mapping column name → target type
     * @return result whose affected count is the number of columns converted
     */
    public TransformResult convertDataTypes(Table table, Map<String, ColumnType> mapping) {
        Preconditions.checkNotNull(table, "table must not be null");
        Preconditions.checkNotNull(mapping, "mapping must not be null");
        Table result = table.copy();
        List<String> warnings = new ArrayList<>();
        int converted = 0;
        for (Map.Entry<String, ColumnType> entry : mapping.entrySet()) {
            String name = entry.getKey();
            ColumnType target = Preconditions.checkNotNull(entry.getValue(),
                    "target type of column %s must not be null", name);
            if (!table.hasColumn(name)) {
                String warning = "convert_data_types: column " + name + " not found, skipped";
                log.warn(warning);
                warnings.add(warning);
                continue;
            }
            try {
                result.putColumn(TypeConverter.convert(table.getColumn(name), target));
                converted++;
                log.debug("convert_data_types: column {} converted to {}", name, target);
            } catch (TransformationException e) {
                log.error("convert_data_types: {}", e.getMessage(), e);
                warnings.add("convert_data_types: " + e.getMessage());
            }
        }
        log.info("convert_data_types: {} of {} columns converted", converted, mapping.size());
        return new TransformResult(result, converted, warnings);
    }

    /**
     * Resolves a textual type mapping such as {@code {age: "int64"}}.
     *
     * <p>
     * Every name is resolved before any conversion work, so an unknown name fails the whole call.
     * </p>
     *
     * @param mapping column name → type name
     * @return column name → type, in the same order
     * @throws ConfigurationException if a type name is unknown
     */
    public static Map<String, ColumnType> resolveTypes(Map<String, String> mapping) {
        Map<String, ColumnType> types = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : mapping.entrySet()) {
            types.put(entry.getKey(), ColumnType.fromName(entry.getValue()));
        }
        return types;
    }

    /**
     * Normalizes a numeric column.
     *
     * <p>
     * The result column is FLOAT; missing cells stay missing. A constant column ({@code max ==
     * min} for minmax, zero deviation for zscore) becomes all {@code 0.0} with a warning. zscore
     * divides by the sample standard deviation; a single value counts as zero deviation.
     * </p>
     *
     * @param table input table
     * @param name column to normalize
     * @param method normalization method
     * @return result whose affected count is the number of values normalized
     * @throws TransformationException if the column does not exist or holds non-numeric values
     */
    public TransformResult normalizeColumn(Table table, String name, NormalizationMethod method) {
        Preconditions.checkNotNull(table, "table must not be null");
        Preconditions.checkNotNull(method, "method must not be null");
        Column column = requireColumn("normalize_column", table, name);
        List<Double> numbers = new ArrayList<>();
        for (Object value : column.getValues()) {
            if (value == null) {
                continue;
            }
            if (!(value instanceof Number)) {
                throw new TransformationException("normalize_column: column " + name
                        + " holds non-numeric value " + value);
            }
            numbers.add(((Number) value).doubleValue());
        }

        List<String> warnings = new ArrayList<>();
        double offset = 0.0;
        double scale = 0.0;
        if (!numbers.isEmpty()) {
            if (method == NormalizationMethod.MINMAX) {
                offset = Collections.min(numbers);
                scale = Collections.max(numbers) - offset;
                if (scale == 0.0) {
                    warnings.add("normalize_column: column " + name
                            + " has a degenerate range (max == min), values set to 0");
                }
            } else {
                offset = AggregateFunction.mean(numbers);
                scale = numbers.size() < 2 ? 0.0 : AggregateFunction.sampleStdDev(numbers);
                if (scale == 0.0) {
                    warnings.add("normalize_column: column " + name
                            + " has zero standard deviation, values set to 0");
                }
            }
        }
        for (String warning : warnings) {
            log.warn(warning);
        }

        List<Object> normalized = new ArrayList<>(column.size());
        for (Object value : column.getValues()) {
            if (value == null) {
                normalized.add(null);
            } else if (scale == 0.0) {
                normalized.add(0.0);
            } else {
                normalized.add((((Number) value).doubleValue() - offset) / scale);
            }
        }
        Table result = table.copy();
        result.putColumn(Column.of(name, ColumnType.FLOAT, normalized));
        log.info("normalize_column: {} values of column {} normalized ({})", numbers.size(), name,
                method.name().toLowerCase(Locale.ROOT));
        return new TransformResult(result, numbers.size(), warnings);
    }

    /**
     * Computes a column from every row.
     *
     * <p>
     * An existing column of the same name is replaced in place; otherwise the column is appended.
     * The column type is inferred from the computed values.
     * </p>
     *
     * @param table input table
     * @param name column name
     * @param function row → value
     * @return result whose affected count is the number of rows computed
     * @throws TransformationException if the name is blank or the function throws
     */
    public TransformResult addCalculatedColumn(Table table, String name,
            Function<Row, Object> function) {
        Preconditions.checkNotNull(table, "table must not be null");
        Preconditions.checkNotNull(function, "function must not be null");
        if (StringUtils.isBlank(name)) {
            throw new TransformationException("add_calculated_column: blank column name");
        }
        List<Object> values = new ArrayList<>(table.getRowCount());
        for (Row row : table.getRows()) {
            try {
                values.add(function.apply(row));
            } catch (RuntimeException e) {
                throw new TransformationException("add_calculated_column: computing column "
                        + name + " failed on row " + row.getIndex(), e);
            }
        }
        Table result = table.copy();
        result.putColumn(Column.of(name, values));
        log.info("add_calculated_column: column {} computed for {} rows", name, values.size());
        return new TransformResult(result, values.size());
    }

    /**
     * Groups rows and aggregates columns.
     *
     * <p>
     * The result has one row per distinct key of the {@code groupBy} columns, in ascending key
     * order (missing keys last), with the {@code groupBy} columns first and one column per
     * {@code aggregates} entry, named after its source column.
     * </p>
     *
     * @param table input table
     * @param groupBy grouping columns
     * @param aggregates column → aggregate function
     * @return result whose affected count is the number of groups
     * @throws TransformationException if {@code groupBy} is empty, a column does not exist, a
     *         column is both grouped and aggregated, or a numeric function meets non-numeric values
     */
    public TransformResult aggregateData(Table table, List<String> groupBy,
            Map<String, AggregateFunction> aggregates) {
        Preconditions.checkNotNull(table, "table must not be null");
        Preconditions.checkNotNull(aggregates, "aggregates must not be null");
        if (groupBy == null || groupBy.isEmpty()) {
            throw new TransformationException("aggregate_data: group_by must not be empty");
        }
        for (String name : groupBy) {
            requireColumn("aggregate_data", table, name);
        }
        for (String name : aggregates.keySet()) {
            requireColumn("aggregate_data", table, name);
            if (groupBy.contains(name)) {
                throw new TransformationException(
                        "aggregate_data: column " + name + " is both grouped and aggregated");
            }
        }

        Map<List<Object>, List<Integer>> groups = new TreeMap<>(ValueComparator.KEY_ORDER);
        for (int i = 0; i < table.getRowCount(); i++) {
            groups.computeIfAbsent(keyOf(table, groupBy, i), k -> new ArrayList<>()).add(i);
        }

        List<Column> columns = new ArrayList<>();
        int position = 0;
        for (String name : groupBy) {
            List<Object> values = new ArrayList<>(groups.size());
            for (List<Object> key : groups.keySet()) {
                values.add(key.get(position));
            }
            columns.add(Column.of(name, table.getColumn(name).getType(), values));
            position++;
        }
        for (Map.Entry<String, AggregateFunction> entry : aggregates.entrySet()) {
            Column source = table.getColumn(entry.getKey());
            AggregateFunction function = Preconditions.checkNotNull(entry.getValue(),
                    "aggregate function of column %s must not be null", entry.getKey());
            List<Object> values = new ArrayList<>(groups.size());
            for (List<Integer> rows : groups.values()) {
                List<Object> present = new ArrayList<>(rows.size());
                for (int row : rows) {
                    if (!source.isMissing(row)) {
                        present.add(source.get(row));
                    }
                }
                values.add(function.apply(source.getName(), source.getType(), present));
            }
            columns.add(Column.of(source.getName(), values));
        }
        log.info("aggregate_data: {} rows grouped into {} groups by {}", table.getRowCount(),
                groups.size(), groupBy);
        return new TransformResult(new Table(columns), groups.size());
    }

    private static Column requireColumn(String operation, Table table, String name) {
        if (name == null || !table.hasColumn(name)) {
            throw new TransformationException(operation + ": column " + name
                    + " not found. Available: " + table.getColumnNames());
        }
        return table.getColumn(name);
    }

    private static List<Object> keyOf(Table table, List<String> columns, int row) {
        List<Object> key = new ArrayList<>(columns.size());
        for (String name : columns) {
            key.add(table.getValue(row, name));
        }
        return key;
    }

    private static Table dropIncompleteRows(Table table) {
        List<Integer> kept = new ArrayList<>();
        for (int i = 0; i < table.getRowCount(); i++) {
            boolean complete = true;
            for (Column column : table.getColumns()) {
                if (column.isMissing(i)) {
                    complete = false;
                    break;
                }
            }
            if (complete) {
                kept.add(i);
            }
        }
        return table.selectRows(kept);
    }

    private static Column fill(Column column, FillValue fillValue) {
        if (column.countMissing() == 0) {
            return column;
        }
        ColumnType type = column.getType();
        Object value = fillValue.getValue();
        boolean promote = false;
        if (type == ColumnType.INT && fillValue.getKind() == FillValue.Kind.FLOAT) {
            promote = true;
        } else if (type == ColumnType.FLOAT && fillValue.getKind() == FillValue.Kind.INT) {
            value = ((Number) value).doubleValue();
        }
        List<Object> values = new ArrayList<>(column.size());
        for (Object current : column.getValues()) {
            if (current == null) {
                values.add(value);
            } else if (promote) {
                values.add(((Number) current).doubleValue());
            } else {
                values.add(current);
            }
        }
        if (promote) {
            return Column.of(column.getName(), ColumnType.FLOAT, values);
        }
        if (type == ColumnType.OBJECT) {
            // an all-missing column takes the type of the fill value
            return Column.of(column.getName(), values);
        }
        if (type.accepts(value)) {
            return Column.of(column.getName(), type, values);
        }
        log.debug("handle_missing_values: column {} ({}) filled with {} becomes object",
                column.getName(), type, fillValue.getKind());
        return Column.of(column.getName(), ColumnType.OBJECT, values);
    }

    private static Column propagate(Column column, boolean forward) {
        int size = column.size();
        Object[] values = column.getValues().toArray();
        Object carry = null;
        for (int step = 0; step < size; step++) {
            int i = forward ? step : size - 1 - step;
            if (values[i] == null) {
                values[i] = carry;
            } else {
                carry = values[i];
            }
        }
        List<Object> filled = new ArrayList<>(size);
        Collections.addAll(filled, values);
        return Column.of(column.getName(), column.getType(), filled);
    }
}
