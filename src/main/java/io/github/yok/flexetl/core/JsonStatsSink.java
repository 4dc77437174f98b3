package io.github.yok.flexetl.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.google.common.base.Preconditions;
import io.github.yok.flexetl.util.LogPathUtil;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * {@link StatsSink} writing an indented UTF-8 JSON document with snake_case keys.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class JsonStatsSink implements StatsSink {

    private final ObjectMapper mapper =
            new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    @Override
    public void persist(PipelineStats stats, Path destination) throws IOException {
        Preconditions.checkNotNull(stats, "stats must not be null");
        Preconditions.checkNotNull(destination, "destination must not be null");
        Path parent = destination.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(destination, StandardCharsets.UTF_8)) {
            mapper.writeValue(writer, stats);
        }
        log.info("Statistics saved to {}", LogPathUtil.renderPathForLog(destination));
    }
}
