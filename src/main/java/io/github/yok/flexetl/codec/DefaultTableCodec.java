package io.github.yok.flexetl.codec;

import com.google.common.base.Preconditions;
import io.github.yok.flexetl.config.CsvFormatProperties;
import io.github.yok.flexetl.table.Table;
import io.github.yok.flexetl.util.LogPathUtil;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * File-based {@link TableCodec} dispatching to one {@link FormatHandler} per {@link DataFormat}.
 *
 * <p>
 * The format is resolved from the hint or the file suffix before the file is touched, so an
 * unsupported format fails with
 * {@link io.github.yok.flexetl.exception.UnsupportedFormatException} naming {@code csv, json,
 * yaml}. Loading creates missing parent directories.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class DefaultTableCodec implements TableCodec {

    private final Map<DataFormat, FormatHandler> handlers = new EnumMap<>(DataFormat.class);

    /**
     * Creates a codec with the CSV, JSON and YAML handlers.
     *
     * @param csvProperties CSV settings
     */
    @Autowired
    public DefaultTableCodec(CsvFormatProperties csvProperties) {
        this(Arrays.asList(new CsvFormatHandler(csvProperties), new JsonFormatHandler(),
                new YamlFormatHandler()));
    }

    /**
     * Creates a codec with the given handlers; a later handler replaces an earlier one of the same
     * format.
     *
     * @param handlers format handlers
     */
    DefaultTableCodec(List<FormatHandler> handlers) {
        for (FormatHandler handler : handlers) {
            this.handlers.put(handler.getFormat(), handler);
        }
    }

    @Override
    public Table extract(Path source, String formatHint) throws IOException {
        Preconditions.checkNotNull(source, "source must not be null");
        FormatHandler handler = handlerFor(source, formatHint);
        if (!Files.isRegularFile(source)) {
            throw new NoSuchFileException(source.toString(), null, "dataset file not found");
        }
        log.info("Extracting {} as {}", LogPathUtil.renderFileForLog(source),
                handler.getFormat());
        Table table = handler.read(source);
        log.info("Extracted {} rows x {} columns", table.getRowCount(), table.getColumnCount());
        return table;
    }

    @Override
    public void load(Table table, Path destination, String formatHint) throws IOException {
        Preconditions.checkNotNull(table, "table must not be null");
        Preconditions.checkNotNull(destination, "destination must not be null");
        FormatHandler handler = handlerFor(destination, formatHint);
        Path parent = destination.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        handler.write(table, destination);
        log.info("Loaded {} rows into {}", table.getRowCount(),
                LogPathUtil.renderFileForLog(destination));
    }

    private FormatHandler handlerFor(Path path, String hint) {
        DataFormat format = DataFormat.resolve(path, hint);
        FormatHandler handler = handlers.get(format);
        Preconditions.checkState(handler != null, "no handler registered for %s", format);
        return handler;
    }
}
