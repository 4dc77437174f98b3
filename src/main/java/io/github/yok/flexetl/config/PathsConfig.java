package io.github.yok.flexetl.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that reads the {@code data-path} property from the application root
 * configuration and composes the directories relative CLI paths are resolved against.
 *
 * <p>
 * The {@code data-path} points to the base directory under which this tool expects
 * {@code /input} (datasets to extract, schema files) and {@code /output} (loaded datasets,
 * statistics) subdirectories. When it is not set, relative paths resolve against the working
 * directory.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties
@Data
public class PathsConfig {

    // Base path that serves as the application's root data directory
    private String dataPath;

    /**
     * Returns the input directory.
     *
     * @return {@code <data-path>/input}, or the working directory when {@code data-path} is unset
     */
    public Path getInput() {
        return resolveBase("input");
    }

    /**
     * Returns the output directory.
     *
     * @return {@code <data-path>/output}, or the working directory when {@code data-path} is unset
     */
    public Path getOutput() {
        return resolveBase("output");
    }

    /**
     * Resolves a path given on the command line against the input directory.
     *
     * @param path absolute or relative path
     * @return the path itself when absolute, otherwise the path under {@link #getInput()}
     */
    public Path resolveInput(String path) {
        return resolve(getInput(), path);
    }

    /**
     * Resolves a path given on the command line against the output directory.
     *
     * @param path absolute or relative path
     * @return the path itself when absolute, otherwise the path under {@link #getOutput()}
     */
    public Path resolveOutput(String path) {
        return resolve(getOutput(), path);
    }

    private Path resolveBase(String child) {
        if (StringUtils.isBlank(dataPath)) {
            return Paths.get("");
        }
        return Paths.get(dataPath, child);
    }

    private static Path resolve(Path base, String path) {
        Path p = Paths.get(path);
        return p.isAbsolute() ? p : base.resolve(p);
    }
}
