package io.github.yok.flexetl.codec;

import io.github.yok.flexetl.table.Table;
import java.io.IOException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Generated;

/**
 * Conversions between table values and the plain values of record-oriented documents (JSON
 * arrays of objects, YAML sequences of mappings).
 *
 * @author Yasuharu.Okawauchi
 */
final class RecordValues {

    @Generated
    private RecordValues() {}

    /**
     * Renders a table as records; dates and date-times become ISO-8601 text.
     *
     * @param table table
     * @return one ordered map per row
     */
    static List<Map<String, Object>> toRecords(Table table) {
        List<Map<String, Object>> records = new ArrayList<>(table.getRowCount());
        for (Map<String, Object> row : table.toRowMaps()) {
            Map<String, Object> record = new LinkedHashMap<>();
            for (Map.Entry<String, Object> entry : row.entrySet()) {
                Object value = entry.getValue();
                record.put(entry.getKey(),
                        value instanceof TemporalAccessor ? value.toString() : value);
            }
            records.add(record);
        }
        return records;
    }

    /**
     * Builds a table from document records; the columns are the union of the record keys in
     * encounter order.
     *
     * @param records parsed records
     * @param source file name for error messages
     * @return table
     * @throws IOException if an element is not a mapping
     */
    static Table fromRecords(List<?> records, String source) throws IOException {
        List<Map<String, Object>> rows = new ArrayList<>(records.size());
        int index = 0;
        for (Object element : records) {
            if (!(element instanceof Map)) {
                throw new IOException(
                        source + ": record " + index + " is not an object: " + element);
            }
            Map<String, Object> row = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) element).entrySet()) {
                row.put(String.valueOf(entry.getKey()), fromDocument(entry.getValue()));
            }
            rows.add(row);
            index++;
        }
        return Table.fromRows(rows);
    }

    /**
     * Maps a parsed document value to a table value. YAML timestamps ({@link Date}) become
     * {@link LocalDate} at midnight UTC and {@link LocalDateTime} otherwise.
     *
     * @param value parsed value
     * @return table value
     */
    static Object fromDocument(Object value) {
        if (value instanceof Date) {
            LocalDateTime dateTime =
                    ((Date) value).toInstant().atOffset(ZoneOffset.UTC).toLocalDateTime();
            return dateTime.toLocalTime().equals(LocalTime.MIDNIGHT) ? dateTime.toLocalDate()
                    : dateTime;
        }
        return value;
    }
}
