package io.github.yok.flexetl.codec;

import io.github.yok.flexetl.table.Table;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads tables from and writes tables to files.
 *
 * <p>
 * The format comes from the hint when one is given, otherwise from the file suffix. A format
 * outside {@link DataFormat} is rejected with
 * {@link io.github.yok.flexetl.exception.UnsupportedFormatException} before any I/O.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface TableCodec {

    /**
     * Reads a table.
     *
     * @param source file to read
     * @param formatHint explicit format, or {@code null} to use the suffix
     * @return the table
     * @throws IOException if the file cannot be read or is malformed
     */
    Table extract(Path source, String formatHint) throws IOException;

    /**
     * Writes a table, creating parent directories as needed.
     *
     * @param table table to write
     * @param destination file to write
     * @param formatHint explicit format, or {@code null} to use the suffix
     * @throws IOException if the file cannot be written
     */
    void load(Table table, Path destination, String formatHint) throws IOException;
}
