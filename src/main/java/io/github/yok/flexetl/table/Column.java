package io.github.yok.flexetl.table;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

/**
 * Immutable named column of a {@link Table}.
 *
 * <p>
 * Values are stored in their canonical Java class (see {@link ColumnType}); {@code null} marks a
 * missing value. Columns built with {@link #of(String, List)} widen {@link Integer},
 * {@link Short} and {@link Byte} to {@link Long} and {@link Float} to {@link Double} and infer
 * their type from the non-missing values.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public final class Column {

    // Column name (unique within a table)
    private final String name;

    // Type shared by every non-missing value
    private final ColumnType type;

    // Values in row order, null = missing
    private final List<Object> values;

    private Column(String name, ColumnType type, List<Object> values) {
        this.name = name;
        this.type = type;
        this.values = Collections.unmodifiableList(values);
    }

    /**
     * Creates a column and infers its type.
     *
     * @param name column name
     * @param values raw values (may contain {@code null})
     * @return new column
     * @throws IllegalArgumentException if the name is blank
     */
    public static Column of(String name, List<?> values) {
        Preconditions.checkArgument(StringUtils.isNotBlank(name), "column name must not be blank");
        Preconditions.checkNotNull(values, "values must not be null");
        List<Object> normalized = new ArrayList<>(values.size());
        for (Object value : values) {
            normalized.add(normalize(value));
        }
        return new Column(name, ColumnType.infer(normalized), normalized);
    }

    /**
     * Creates a column of an explicit type.
     *
     * @param name column name
     * @param type column type
     * @param values values (may contain {@code null})
     * @return new column
     * @throws IllegalArgumentException if a value does not belong to {@code type}
     */
    public static Column of(String name, ColumnType type, List<?> values) {
        Preconditions.checkArgument(StringUtils.isNotBlank(name), "column name must not be blank");
        Preconditions.checkNotNull(type, "type must not be null");
        Preconditions.checkNotNull(values, "values must not be null");
        List<Object> normalized = new ArrayList<>(values.size());
        for (Object value : values) {
            Object v = normalize(value);
            Preconditions.checkArgument(v == null || type.accepts(v),
                    "value %s of column %s is not of type %s", v, name, type);
            normalized.add(v);
        }
        return new Column(name, type, normalized);
    }

    /**
     * Widens a raw value to its canonical class.
     *
     * @param value raw value
     * @return canonical value, {@code null} for {@code null}
     */
    static Object normalize(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float) {
            // go through the decimal representation so 1.1f stays 1.1
            return Double.parseDouble(value.toString());
        }
        return value;
    }

    /**
     * Returns the number of values.
     *
     * @return row count of the column
     */
    public int size() {
        return values.size();
    }

    /**
     * Returns the value at the given row.
     *
     * @param row zero-based row index
     * @return value, {@code null} when missing
     */
    public Object get(int row) {
        return values.get(row);
    }

    /**
     * Determines whether the value at the given row is missing.
     *
     * @param row zero-based row index
     * @return {@code true} if missing
     */
    public boolean isMissing(int row) {
        return values.get(row) == null;
    }

    /**
     * Counts the missing values.
     *
     * @return number of {@code null} cells
     */
    public int countMissing() {
        int count = 0;
        for (Object value : values) {
            if (value == null) {
                count++;
            }
        }
        return count;
    }

    /**
     * Returns a copy of this column under another name.
     *
     * @param newName new column name
     * @return renamed column
     */
    public Column rename(String newName) {
        Preconditions.checkArgument(StringUtils.isNotBlank(newName),
                "column name must not be blank");
        return new Column(newName, type, new ArrayList<>(values));
    }

    /**
     * Returns a column made of the given rows, in the given order.
     *
     * @param rows zero-based row indices
     * @return new column of the same name and type
     */
    public Column select(List<Integer> rows) {
        List<Object> selected = new ArrayList<>(rows.size());
        for (int row : rows) {
            selected.add(values.get(row));
        }
        return new Column(name, type, selected);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Column)) {
            return false;
        }
        Column other = (Column) o;
        return name.equals(other.name) && type == other.type && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, values);
    }

    @Override
    public String toString() {
        return name + "(" + type + ")" + values;
    }
}
