package io.github.yok.flexetl.table;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.github.yok.flexetl.exception.TransformationException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory table: an ordered collection of uniquely named {@link Column columns} of equal
 * length.
 *
 * <p>
 * Insertion order is the display and serialization order. Every column always holds exactly
 * {@link #getRowCount()} values; {@link #putColumn(Column)} rejects columns of another length.
 * </p>
 *
 * <p>
 * A table with no columns has zero rows.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class Table {

    // Columns by name, in display order
    private final Map<String, Column> columns = new LinkedHashMap<>();

    // Shared length of every column
    private int rowCount;

    /**
     * Creates an empty table.
     */
    public Table() {
        this.rowCount = 0;
    }

    /**
     * Creates a table with the given columns.
     *
     * @param columns columns in display order
     * @throws IllegalArgumentException on duplicate names or different lengths
     */
    public Table(List<Column> columns) {
        this();
        for (Column column : columns) {
            Preconditions.checkArgument(!this.columns.containsKey(column.getName()),
                    "duplicate column name: %s", column.getName());
            putColumn(column);
        }
    }

    /**
     * Builds a table from row maps.
     *
     * <p>
     * The column set is {@code columnNames}; a key absent from a row map yields a missing value.
     * </p>
     *
     * @param columnNames column names in display order
     * @param rows row maps (column name → value)
     * @return new table
     */
    public static Table fromRows(List<String> columnNames, List<? extends Map<String, ?>> rows) {
        Set<String> names = new LinkedHashSet<>(columnNames);
        List<Column> columns = new ArrayList<>(names.size());
        for (String name : names) {
            List<Object> values = new ArrayList<>(rows.size());
            for (Map<String, ?> row : rows) {
                values.add(row.get(name));
            }
            columns.add(Column.of(name, values));
        }
        return new Table(columns);
    }

    /**
     * Builds a table from row maps, taking the column set from the union of the row keys in
     * encounter order.
     *
     * @param rows row maps
     * @return new table
     */
    public static Table fromRows(List<? extends Map<String, ?>> rows) {
        Set<String> names = new LinkedHashSet<>();
        for (Map<String, ?> row : rows) {
            names.addAll(row.keySet());
        }
        return fromRows(new ArrayList<>(names), rows);
    }

    /**
     * Returns the number of rows.
     *
     * @return row count
     */
    public int getRowCount() {
        return rowCount;
    }

    /**
     * Returns the number of columns.
     *
     * @return column count
     */
    public int getColumnCount() {
        return columns.size();
    }

    /**
     * Returns the column names in display order.
     *
     * @return immutable list of names
     */
    public List<String> getColumnNames() {
        return ImmutableList.copyOf(columns.keySet());
    }

    /**
     * Returns the columns in display order.
     *
     * @return immutable list of columns
     */
    public List<Column> getColumns() {
        return ImmutableList.copyOf(columns.values());
    }

    /**
     * Determines whether a column exists.
     *
     * @param name column name
     * @return {@code true} if present
     */
    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    /**
     * Returns a column by name.
     *
     * @param name column name
     * @return the column
     * @throws TransformationException if the column does not exist
     */
    public Column getColumn(String name) {
        Column column = columns.get(name);
        if (column == null) {
            throw new TransformationException(
                    "Column not found: " + name + ". Available: " + columns.keySet());
        }
        return column;
    }

    /**
     * Returns a single cell.
     *
     * @param row zero-based row index
     * @param column column name
     * @return value, {@code null} when missing
     */
    public Object getValue(int row, String column) {
        return getColumn(column).get(row);
    }

    /**
     * Returns a read-only view of one row.
     *
     * @param index zero-based row index
     * @return row view
     */
    public Row getRow(int index) {
        Preconditions.checkElementIndex(index, rowCount, "row");
        return new Row(this, index);
    }

    /**
     * Returns read-only views of every row.
     *
     * @return rows in order
     */
    public List<Row> getRows() {
        List<Row> rows = new ArrayList<>(rowCount);
        for (int i = 0; i < rowCount; i++) {
            rows.add(new Row(this, i));
        }
        return rows;
    }

    /**
     * Adds a column, or replaces the column of the same name keeping its position.
     *
     * <p>
     * The first column put into an empty table defines the row count.
     * </p>
     *
     * @param column column to add
     * @throws IllegalArgumentException if the column length differs from the row count
     */
    public void putColumn(Column column) {
        Preconditions.checkNotNull(column, "column must not be null");
        boolean replacingOnlyColumn = columns.size() == 1 && columns.containsKey(column.getName());
        if (columns.isEmpty() || replacingOnlyColumn) {
            rowCount = column.size();
        } else {
            Preconditions.checkArgument(column.size() == rowCount,
                    "column %s has %s values but the table has %s rows", column.getName(),
                    column.size(), rowCount);
        }
        columns.put(column.getName(), column);
    }

    /**
     * Removes a column if present.
     *
     * @param name column name
     * @return the removed column, or {@code null} if absent
     */
    public Column removeColumn(String name) {
        Column removed = columns.remove(name);
        if (columns.isEmpty()) {
            rowCount = 0;
        }
        return removed;
    }

    /**
     * Returns a table made of the given rows, in the given order.
     *
     * @param rows zero-based row indices
     * @return new table with the same columns
     */
    public Table selectRows(List<Integer> rows) {
        List<Column> selected = new ArrayList<>(columns.size());
        for (Column column : columns.values()) {
            selected.add(column.select(rows));
        }
        return new Table(selected);
    }

    /**
     * Counts the missing cells across all columns.
     *
     * @return number of {@code null} cells
     */
    public int countMissing() {
        int count = 0;
        for (Column column : columns.values()) {
            count += column.countMissing();
        }
        return count;
    }

    /**
     * Returns a copy of this table. Columns are immutable, so the copy shares them.
     *
     * @return independent table with the same content
     */
    public Table copy() {
        return new Table(new ArrayList<>(columns.values()));
    }

    /**
     * Returns the rows as ordered maps, missing values included as {@code null}.
     *
     * @return list of row maps
     */
    public List<Map<String, Object>> toRowMaps() {
        List<Map<String, Object>> result = new ArrayList<>(rowCount);
        for (int i = 0; i < rowCount; i++) {
            result.add(new Row(this, i).asMap());
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Table)) {
            return false;
        }
        Table other = (Table) o;
        return rowCount == other.rowCount && new ArrayList<>(columns.values())
                .equals(new ArrayList<>(other.columns.values()));
    }

    @Override
    public int hashCode() {
        return new ArrayList<>(columns.values()).hashCode();
    }

    @Override
    public String toString() {
        return "Table[rows=" + rowCount + ", columns=" + columns.keySet() + "]";
    }
}
