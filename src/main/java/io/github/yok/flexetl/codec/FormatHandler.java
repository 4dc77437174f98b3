package io.github.yok.flexetl.codec;

import io.github.yok.flexetl.table.Table;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Reader and writer of one {@link DataFormat}.
 *
 * @author Yasuharu.Okawauchi
 */
public interface FormatHandler {

    /**
     * Returns the handled format.
     *
     * @return format
     */
    DataFormat getFormat();

    /**
     * Reads a table.
     *
     * @param source existing file
     * @return the table
     * @throws IOException on read failure or malformed content
     */
    Table read(Path source) throws IOException;

    /**
     * Writes a table; the parent directory exists.
     *
     * @param table table
     * @param destination file
     * @throws IOException on write failure
     */
    void write(Table table, Path destination) throws IOException;
}
