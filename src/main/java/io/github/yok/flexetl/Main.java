package io.github.yok.flexetl;

import io.github.yok.flexetl.codec.TableCodec;
import io.github.yok.flexetl.config.CsvFormatProperties;
import io.github.yok.flexetl.config.EtlProperties;
import io.github.yok.flexetl.config.PathsConfig;
import io.github.yok.flexetl.core.EtlPipeline;
import io.github.yok.flexetl.core.PipelineStats;
import io.github.yok.flexetl.core.PipelineStatus;
import io.github.yok.flexetl.core.StatsSink;
import io.github.yok.flexetl.exception.EtlException;
import io.github.yok.flexetl.exception.LoadingException;
import io.github.yok.flexetl.transform.DataTransformer;
import io.github.yok.flexetl.transform.MissingValueStrategy;
import io.github.yok.flexetl.util.ErrorHandler;
import io.github.yok.flexetl.validate.Schema;
import io.github.yok.flexetl.validate.SchemaLoader;
import io.github.yok.flexetl.validate.ValidationResult;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Provides the application entry point.
 *
 * <p>
 * Parses the command-line options and runs the default pipeline: extract → remove duplicates →
 * handle missing values → validate against a schema → load → save statistics.
 * </p>
 *
 * <p>
 * Argument specification:
 * </p>
 * <ul>
 * <li>{@code --input <file>} or {@code -i <file>} (required) is the dataset to extract.</li>
 * <li>{@code --output <file[,file...]>} or {@code -o <file[,file...]>} lists the files to load
 * the result into; the format of each comes from its suffix.</li>
 * <li>{@code --stats <file>} or {@code -s <file>} is the statistics file; defaults to
 * {@code etl.stats-file-name} in the output directory.</li>
 * <li>{@code --schema <file>} is a YAML or JSON schema validated after the transformations.</li>
 * </ul>
 *
 * <p>
 * Relative paths are resolved against the {@code input} and {@code output} directories of
 * {@link PathsConfig}. The steps are switched by {@link EtlProperties}; in strict mode a row
 * that violates the schema fails the run. A failed run is marked failed, its statistics are still
 * written when possible, and the error goes through {@link ErrorHandler}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 * @see PathsConfig
 * @see EtlProperties
 * @see CsvFormatProperties
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties({PathsConfig.class, EtlProperties.class,
        CsvFormatProperties.class})
@RequiredArgsConstructor
public class Main implements CommandLineRunner, ExitCodeGenerator {

    private final PathsConfig pathsConfig;
    private final EtlProperties etlProperties;
    private final TableCodec tableCodec;
    private final StatsSink statsSink;
    private final DataTransformer transformer;

    // Process status of the last run
    private int exitCode;

    /**
     * Bootstraps the application and exits with the status of the run.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        System.exit(SpringApplication.exit(app.run(args)));
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        // Parse CLI arguments
        String input = null;
        List<String> outputs = new ArrayList<>();
        String stats = null;
        String schema = null;
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--input":
                case "-i":
                    input = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--output":
                case "-o":
                    if (i + 1 < args.length) {
                        outputs = Arrays.stream(args[++i].split(",")).map(String::trim)
                                .filter(StringUtils::isNotEmpty).collect(Collectors.toList());
                    }
                    break;
                case "--stats":
                case "-s":
                    stats = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--schema":
                    schema = (i + 1 < args.length ? args[++i] : null);
                    break;
                default:
                    log.warn("Unknown argument: {}", args[i]);
            }
        }
        if (StringUtils.isBlank(input)) {
            exitCode = ErrorHandler.errorAndExit("Input file is required (--input <file>).");
            return;
        }

        Path inputPath = pathsConfig.resolveInput(input);
        Path statsPath = stats != null ? pathsConfig.resolveOutput(stats)
                : pathsConfig.getOutput().resolve(etlProperties.getStatsFileName());
        log.info("Input: {}, Outputs: {}, Stats: {}, Schema: {}", inputPath, outputs, statsPath,
                schema);

        EtlPipeline pipeline =
                new EtlPipeline(tableCodec, statsSink, transformer, Clock.systemDefaultZone());
        pipeline.run();
        try {
            pipeline.extract(inputPath);
            if (etlProperties.isRemoveDuplicates()) {
                pipeline.removeDuplicates();
            }
            if (etlProperties.isHandleMissingValues()) {
                pipeline.handleMissingValues(
                        MissingValueStrategy.fromName(etlProperties.getMissingStrategy()));
            }
            if (schema != null) {
                validate(pipeline, SchemaLoader.load(pathsConfig.resolveInput(schema)));
            }
            for (String output : outputs) {
                pipeline.load(pathsConfig.resolveOutput(output));
            }
            pipeline.finish();
            pipeline.saveStats(statsPath);
            exitCode = 0;
            log.info("Pipeline run completed.");
        } catch (Exception e) {
            PipelineStats snapshot = pipeline.getStats();
            if (snapshot.getStatus() == PipelineStatus.RUNNING) {
                pipeline.fail(e);
                saveStatsQuietly(pipeline, statsPath);
            }
            exitCode = ErrorHandler.errorAndExit("Pipeline failed: " + e.getMessage(), e);
        }
    }

    private void validate(EtlPipeline pipeline, Schema schema) {
        pipeline.validate(schema);
        Map<Integer, ValidationResult> failures = pipeline.getValidationErrors();
        for (Map.Entry<Integer, ValidationResult> entry : failures.entrySet()) {
            log.warn("Row {} invalid: {}", entry.getKey(), entry.getValue().getErrors());
        }
        if (etlProperties.isStrictMode() && !failures.isEmpty()) {
            throw new EtlException("validate: " + failures.size()
                    + " rows violate the schema (etl.strict-mode=true)");
        }
    }

    private static void saveStatsQuietly(EtlPipeline pipeline, Path statsPath) {
        try {
            pipeline.saveStats(statsPath);
        } catch (LoadingException e) {
            log.warn("Statistics of the failed run could not be saved: {}", e.getMessage(), e);
        }
    }
}
