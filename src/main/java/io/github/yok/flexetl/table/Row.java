package io.github.yok.flexetl.table;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only view of one row of a {@link Table}.
 *
 * <p>
 * Handed to row predicates and calculated-column functions so that they can read every column of
 * the row. The view reads through to the table it was created from.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class Row {

    private final Table table;
    private final int index;

    Row(Table table, int index) {
        this.table = table;
        this.index = index;
    }

    /**
     * Returns the zero-based position of this row in its table.
     *
     * @return row index
     */
    public int getIndex() {
        return index;
    }

    /**
     * Determines whether the table has the given column.
     *
     * @param column column name
     * @return {@code true} if present
     */
    public boolean contains(String column) {
        return table.hasColumn(column);
    }

    /**
     * Returns the value of a column.
     *
     * @param column column name
     * @return value, {@code null} when missing
     * @throws io.github.yok.flexetl.exception.TransformationException if the column does not exist
     */
    public Object get(String column) {
        return table.getValue(index, column);
    }

    /**
     * Determines whether the value of a column is missing.
     *
     * @param column column name
     * @return {@code true} if missing
     */
    public boolean isMissing(String column) {
        return get(column) == null;
    }

    /**
     * Returns the value of a column rendered as text.
     *
     * @param column column name
     * @return text, {@code null} when missing
     */
    public String getString(String column) {
        Object value = get(column);
        return value == null ? null : value.toString();
    }

    /**
     * Returns the value of a numeric column as a double.
     *
     * @param column column name
     * @return value, {@code null} when missing
     * @throws ClassCastException if the value is not a number
     */
    public Double getDouble(String column) {
        Object value = get(column);
        return value == null ? null : ((Number) value).doubleValue();
    }

    /**
     * Returns the value of a numeric column as a long.
     *
     * @param column column name
     * @return value, {@code null} when missing
     * @throws ClassCastException if the value is not a number
     */
    public Long getLong(String column) {
        Object value = get(column);
        return value == null ? null : ((Number) value).longValue();
    }

    /**
     * Returns the value of a boolean column.
     *
     * @param column column name
     * @return value, {@code null} when missing
     * @throws ClassCastException if the value is not a boolean
     */
    public Boolean getBoolean(String column) {
        return (Boolean) get(column);
    }

    /**
     * Returns the row as an ordered map, missing values included as {@code null}.
     *
     * @return column name → value
     */
    public Map<String, Object> asMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        for (Column column : table.getColumns()) {
            map.put(column.getName(), column.get(index));
        }
        return map;
    }

    @Override
    public String toString() {
        return "Row" + index + asMap();
    }
}
