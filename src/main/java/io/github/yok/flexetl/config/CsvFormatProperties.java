package io.github.yok.flexetl.config;

import java.nio.charset.Charset;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Property class that holds the CSV reading settings.
 *
 * <ul>
 * <li>{@code etl.csv.charset}: charset tried first (default {@code UTF-8})</li>
 * <li>{@code etl.csv.fallback-charset}: charset used when the file is not valid in
 * {@code charset} (default {@code ISO-8859-1})</li>
 * <li>{@code etl.csv.delimiter}: field delimiter (default {@code ,})</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "etl.csv")
@Getter
@Setter
@NoArgsConstructor
public class CsvFormatProperties {

    private String charset = "UTF-8";

    private String fallbackCharset = "ISO-8859-1";

    private String delimiter = ",";

    /**
     * Returns the primary charset.
     *
     * @return charset
     * @throws java.nio.charset.UnsupportedCharsetException if the name is unknown
     */
    public Charset primaryCharset() {
        return Charset.forName(charset);
    }

    /**
     * Returns the fallback charset.
     *
     * @return charset
     * @throws java.nio.charset.UnsupportedCharsetException if the name is unknown
     */
    public Charset fallback() {
        return Charset.forName(fallbackCharset);
    }

    /**
     * Returns the delimiter character.
     *
     * @return first character of {@code delimiter}, or {@code ,} when it is empty
     */
    public char delimiterChar() {
        return delimiter == null || delimiter.isEmpty() ? ',' : delimiter.charAt(0);
    }
}
