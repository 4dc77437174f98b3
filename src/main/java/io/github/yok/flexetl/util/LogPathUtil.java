package io.github.yok.flexetl.util;

import com.google.common.base.Preconditions;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import lombok.Generated;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;

/**
 * Utility for rendering dataset paths for logs.
 *
 * <p>
 * A path under the working directory is rendered relative to it, any other path as an absolute
 * normalized path. {@link #renderFileForLog(Path)} appends the human-readable size of an existing
 * file.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class LogPathUtil {

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private LogPathUtil() {}

    /**
     * Renders a path for logs.
     *
     * @param path file or directory
     * @return path relative to the working directory when under it, otherwise absolute
     * @throws NullPointerException if {@code path} is {@code null}
     */
    public static String renderPathForLog(Path path) {
        Preconditions.checkNotNull(path, "path must not be null");
        Path base = Paths.get(System.getProperty("user.dir")).toAbsolutePath().normalize();
        Path abs = path.toAbsolutePath().normalize();
        if (abs.startsWith(base) && !abs.equals(base)) {
            return base.relativize(abs).toString();
        }
        return abs.toString();
    }

    /**
     * Renders a file path followed by its size, e.g. {@code data/in.csv (12 KB)}.
     *
     * @param file file
     * @return rendered path; the size is omitted when the file does not exist or is unreadable
     */
    public static String renderFileForLog(Path file) {
        String rendered = renderPathForLog(file);
        if (!Files.isRegularFile(file)) {
            return rendered;
        }
        try {
            return rendered + " (" + FileUtils.byteCountToDisplaySize(Files.size(file)) + ")";
        } catch (IOException e) {
            log.debug("Cannot read size of {}: {}", rendered, e.getMessage());
            return rendered;
        }
    }
}
