package io.github.yok.flexetl.codec;

import io.github.yok.flexetl.table.Table;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * YAML reader and writer based on SnakeYAML.
 *
 * <p>
 * A dataset is a sequence of mappings. Output uses block style.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class YamlFormatHandler implements FormatHandler {

    @Override
    public DataFormat getFormat() {
        return DataFormat.YAML;
    }

    @Override
    public Table read(Path source) throws IOException {
        Object document;
        try (Reader reader = Files.newBufferedReader(source, StandardCharsets.UTF_8)) {
            document = new Yaml().load(reader);
        } catch (YAMLException e) {
            throw new IOException("Malformed YAML in " + source.getFileName(), e);
        }
        if (document == null) {
            return new Table();
        }
        if (!(document instanceof List)) {
            throw new IOException(source.getFileName() + ": expected a sequence of mappings");
        }
        Table table =
                RecordValues.fromRecords((List<?>) document, String.valueOf(source.getFileName()));
        log.debug("YAML read: {} columns, {} rows", table.getColumnCount(), table.getRowCount());
        return table;
    }

    @Override
    public void write(Table table, Path destination) throws IOException {
        DumperOptions opts = new DumperOptions();
        opts.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        opts.setPrettyFlow(true);
        try (Writer writer = Files.newBufferedWriter(destination, StandardCharsets.UTF_8)) {
            new Yaml(opts).dump(RecordValues.toRecords(table), writer);
        }
        log.debug("YAML written: {} rows", table.getRowCount());
    }
}
