package io.github.yok.flexetl.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Property class that holds the settings of the default pipeline run by the command line.
 *
 * <p>
 * Specify the following properties in {@code application.yml}.
 * </p>
 * <ul>
 * <li>{@code etl.remove-duplicates}: remove duplicate rows after extraction (default
 * {@code true})</li>
 * <li>{@code etl.handle-missing-values}: handle missing cells after deduplication (default
 * {@code true})</li>
 * <li>{@code etl.missing-strategy}: {@code drop}, {@code forward_fill} or {@code backward_fill}
 * (default {@code drop})</li>
 * <li>{@code etl.strict-mode}: fail the run when a row violates the schema (default
 * {@code false})</li>
 * <li>{@code etl.stats-file-name}: statistics file written to the output directory when
 * {@code --stats} is not given (default {@code pipeline_stats.json})</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "etl")
@Getter
@Setter
@NoArgsConstructor
public class EtlProperties {

    private boolean removeDuplicates = true;

    private boolean handleMissingValues = true;

    private String missingStrategy = "drop";

    private boolean strictMode = false;

    private String statsFileName = "pipeline_stats.json";
}
