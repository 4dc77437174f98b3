package io.github.yok.flexetl.codec;

import com.google.common.base.Preconditions;
import io.github.yok.flexetl.config.CsvFormatProperties;
import io.github.yok.flexetl.table.Column;
import io.github.yok.flexetl.table.Table;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.csv.DuplicateHeaderMode;
import org.apache.commons.csv.QuoteMode;
import org.apache.commons.lang3.StringUtils;

/**
 * CSV reader and writer based on Apache Commons CSV.
 *
 * <p>
 * <strong>Reading:</strong> the first record is the header. An empty cell is a missing value.
 * The file is decoded with {@code etl.csv.charset}; when it is not valid in that charset it is
 * decoded again with {@code etl.csv.fallback-charset}. Each column is typed from its non-missing
 * cells, trying integer, then floating point, then boolean ({@code true}/{@code false}) and
 * keeping text otherwise.
 * </p>
 *
 * <p>
 * <strong>Writing:</strong> UTF-8 with a header record and minimal quoting; missing values are
 * written as empty cells.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class CsvFormatHandler implements FormatHandler {

    private static final Pattern INTEGER = Pattern.compile("^[+-]?\\d+$");

    private static final Pattern DECIMAL =
            Pattern.compile("^[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?$");

    private final CsvFormatProperties properties;

    /**
     * Creates a handler.
     *
     * @param properties CSV settings
     */
    public CsvFormatHandler(CsvFormatProperties properties) {
        this.properties = Preconditions.checkNotNull(properties, "properties must not be null");
    }

    @Override
    public DataFormat getFormat() {
        return DataFormat.CSV;
    }

    @Override
    public Table read(Path source) throws IOException {
        String text = StringUtils.removeStart(decode(Files.readAllBytes(source), source), "\uFEFF");
        CSVFormat format = CSVFormat.DEFAULT.builder().setDelimiter(properties.delimiterChar())
                .setHeader().setSkipHeaderRecord(true).setIgnoreEmptyLines(true)
                .setDuplicateHeaderMode(DuplicateHeaderMode.DISALLOW).get();

        List<String> headers;
        List<List<String>> cells = new ArrayList<>();
        try (CSVParser parser = CSVParser.parse(text, format)) {
            headers = parser.getHeaderNames();
            for (CSVRecord record : parser) {
                List<String> row = new ArrayList<>(headers.size());
                for (int i = 0; i < headers.size(); i++) {
                    row.add(i < record.size() ? record.get(i) : null);
                }
                cells.add(row);
            }
        } catch (IllegalArgumentException e) {
            throw new IOException("Malformed CSV header in " + source + ": " + e.getMessage(), e);
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }

        List<Column> columns = new ArrayList<>(headers.size());
        for (int i = 0; i < headers.size(); i++) {
            List<String> raw = new ArrayList<>(cells.size());
            for (List<String> row : cells) {
                raw.add(StringUtils.isEmpty(row.get(i)) ? null : row.get(i));
            }
            if (StringUtils.isBlank(headers.get(i))) {
                throw new IOException("Blank CSV header at position " + i + " in " + source);
            }
            columns.add(Column.of(headers.get(i), inferValues(raw)));
        }
        log.debug("CSV read: {} columns, {} rows", columns.size(), cells.size());
        return new Table(columns);
    }

    private String decode(byte[] bytes, Path source) throws IOException {
        Charset primary = properties.primaryCharset();
        try {
            return primary.newDecoder().onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT).decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            Charset fallback = properties.fallback();
            log.warn("{} is not valid {}, reading it as {}", source.getFileName(), primary,
                    fallback);
            return new String(bytes, fallback);
        }
    }

    /**
     * Types raw cells: all integers become {@link Long}, all decimals {@link Double}, all
     * {@code true}/{@code false} {@link Boolean}, anything else stays text.
     *
     * @param raw cells, {@code null} for missing
     * @return typed values
     */
    static List<Object> inferValues(List<String> raw) {
        if (allMatch(raw, v -> INTEGER.matcher(v.trim()).matches() && fitsLong(v.trim()))) {
            return map(raw, v -> Long.parseLong(v.trim()));
        }
        if (allMatch(raw, v -> DECIMAL.matcher(v.trim()).matches())) {
            return map(raw, v -> Double.parseDouble(v.trim()));
        }
        if (allMatch(raw, v -> "true".equalsIgnoreCase(v.trim())
                || "false".equalsIgnoreCase(v.trim()))) {
            return map(raw, v -> Boolean.valueOf(v.trim().toLowerCase(Locale.ROOT)));
        }
        return map(raw, v -> v);
    }

    private static boolean fitsLong(String value) {
        try {
            Long.parseLong(value);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static boolean allMatch(List<String> raw, Predicate<String> test) {
        boolean any = false;
        for (String value : raw) {
            if (value == null) {
                continue;
            }
            if (!test.test(value)) {
                return false;
            }
            any = true;
        }
        return any;
    }

    private static List<Object> map(List<String> raw, Function<String, Object> parser) {
        List<Object> values = new ArrayList<>(raw.size());
        for (String value : raw) {
            values.add(value == null ? null : parser.apply(value));
        }
        return values;
    }

    @Override
    public void write(Table table, Path destination) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder().setDelimiter(properties.delimiterChar())
                .setHeader(table.getColumnNames().toArray(new String[0]))
                .setQuoteMode(QuoteMode.MINIMAL).setRecordSeparator(System.lineSeparator()).get();
        try (Writer w = Files.newBufferedWriter(destination, StandardCharsets.UTF_8);
                CSVPrinter printer = new CSVPrinter(w, format)) {
            for (int i = 0; i < table.getRowCount(); i++) {
                List<Object> row = new ArrayList<>(table.getColumnCount());
                for (Column column : table.getColumns()) {
                    row.add(column.get(i));
                }
                printer.printRecord(row);
            }
        }
        log.debug("CSV written: {} columns, {} rows", table.getColumnCount(), table.getRowCount());
    }
}
