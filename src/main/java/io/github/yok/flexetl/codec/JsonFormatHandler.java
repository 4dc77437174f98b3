package io.github.yok.flexetl.codec;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.yok.flexetl.table.Table;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * JSON reader and writer based on Jackson.
 *
 * <p>
 * A dataset is an array of objects (one object per row, keys are column names). Whole numbers
 * are read as integers and other numbers as floating point values; nested objects and arrays are
 * kept as maps and lists. Output is indented UTF-8.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class JsonFormatHandler implements FormatHandler {

    private final ObjectMapper mapper = new ObjectMapper();

    @Override
    public DataFormat getFormat() {
        return DataFormat.JSON;
    }

    @Override
    public Table read(Path source) throws IOException {
        JsonNode root;
        try (Reader reader = Files.newBufferedReader(source, StandardCharsets.UTF_8)) {
            root = mapper.readTree(reader);
        }
        if (root == null || root.isMissingNode()) {
            return new Table();
        }
        if (!root.isArray()) {
            throw new IOException(source.getFileName() + ": expected an array of objects, got "
                    + root.getNodeType());
        }
        List<Object> records = mapper.convertValue(root, new TypeReference<List<Object>>() {});
        Table table = RecordValues.fromRecords(records, String.valueOf(source.getFileName()));
        log.debug("JSON read: {} columns, {} rows", table.getColumnCount(), table.getRowCount());
        return table;
    }

    @Override
    public void write(Table table, Path destination) throws IOException {
        mapper.writerWithDefaultPrettyPrinter().writeValue(destination.toFile(),
                RecordValues.toRecords(table));
        log.debug("JSON written: {} rows", table.getRowCount());
    }
}
