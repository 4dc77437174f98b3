package io.github.yok.flexetl.core;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Persists a statistics snapshot as a structured document.
 *
 * @author Yasuharu.Okawauchi
 */
public interface StatsSink {

    /**
     * Writes the snapshot, creating parent directories as needed.
     *
     * @param stats snapshot to write
     * @param destination target file
     * @throws IOException if the document cannot be written
     */
    void persist(PipelineStats stats, Path destination) throws IOException;
}
