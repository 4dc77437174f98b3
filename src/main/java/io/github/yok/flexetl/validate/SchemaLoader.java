package io.github.yok.flexetl.validate;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.yok.flexetl.codec.DataFormat;
import io.github.yok.flexetl.exception.ConfigurationException;
import io.github.yok.flexetl.util.LogPathUtil;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Generated;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads a {@link Schema} from a YAML ({@code .yaml}, {@code .yml}) or JSON ({@code .json}) file
 * holding the nested mapping described in {@link Schema#fromMap(Map)}.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class SchemaLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private SchemaLoader() {}

    /**
     * Loads a schema file.
     *
     * @param path schema file
     * @return schema
     * @throws IOException if the file cannot be read or parsed
     * @throws ConfigurationException if the file is not YAML or JSON, or its content is not a
     *         valid schema
     */
    public static Schema load(Path path) throws IOException {
        DataFormat format = DataFormat.resolve(path, null);
        Map<String, Object> raw;
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            switch (format) {
                case JSON:
                    raw = MAPPER.readValue(reader,
                            new TypeReference<LinkedHashMap<String, Object>>() {});
                    break;
                case YAML:
                    raw = toFieldMap(new Yaml().load(reader), path);
                    break;
                default:
                    throw new ConfigurationException(
                            "Schema file must be YAML or JSON: " + path.getFileName());
            }
        } catch (YAMLException e) {
            throw new IOException("Malformed YAML schema " + path.getFileName(), e);
        }
        Schema schema = Schema.fromMap(raw == null ? new LinkedHashMap<>() : raw);
        log.info("Schema loaded from {}: fields={}", LogPathUtil.renderPathForLog(path),
                schema.getFieldNames());
        return schema;
    }

    private static Map<String, Object> toFieldMap(Object document, Path path) {
        if (document == null) {
            return new LinkedHashMap<>();
        }
        if (!(document instanceof Map)) {
            throw new ConfigurationException(
                    "Schema file " + path.getFileName() + " must hold a mapping of fields");
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) document).entrySet()) {
            fields.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return fields;
    }
}
