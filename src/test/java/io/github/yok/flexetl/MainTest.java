package io.github.yok.flexetl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.yok.flexetl.codec.DefaultTableCodec;
import io.github.yok.flexetl.config.CsvFormatProperties;
import io.github.yok.flexetl.config.EtlProperties;
import io.github.yok.flexetl.config.PathsConfig;
import io.github.yok.flexetl.core.JsonStatsSink;
import io.github.yok.flexetl.transform.DataTransformer;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MainTest {

    @TempDir
    Path tmp;

    private final ObjectMapper mapper = new ObjectMapper();
    private final PrintStream originalErr = System.err;
    private ByteArrayOutputStream err;
    private EtlProperties etlProperties;
    private Main main;

    @BeforeEach
    void setUp() throws Exception {
        err = new ByteArrayOutputStream();
        System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));

        PathsConfig pathsConfig = new PathsConfig();
        pathsConfig.setDataPath(tmp.toString());
        etlProperties = new EtlProperties();
        main = new Main(pathsConfig, etlProperties,
                new DefaultTableCodec(new CsvFormatProperties()), new JsonStatsSink(),
                new DataTransformer());

        Files.createDirectories(tmp.resolve("input"));
        Files.writeString(tmp.resolve("input/in.csv"),
                "id,email\n1,a@example.com\n1,a@example.com\n2,\n3,broken\n",
                StandardCharsets.UTF_8);
        Files.writeString(tmp.resolve("input/schema.yml"), "email:\n  email: true\n",
                StandardCharsets.UTF_8);
    }

    @AfterEach
    void tearDown() {
        System.setErr(originalErr);
    }

    @Test
    void run_異常ケース_input未指定_使用法エラーとなること() {
        main.run("--output", "out.json");

        assertEquals(2, main.getExitCode());
        assertTrue(err.toString(StandardCharsets.UTF_8)
                .contains("ERROR: Input file is required (--input <file>)."));
    }

    @Test
    void run_正常ケース_CSVからJSONへ_出力と統計が書き込まれること() throws Exception {
        main.run("-i", "in.csv", "-o", "out.json, copy.yaml,", "--verbose");

        assertEquals(0, main.getExitCode());
        JsonNode rows = mapper.readTree(tmp.resolve("output/out.json").toFile());
        assertEquals(2, rows.size());
        assertEquals("a@example.com", rows.get(0).get("email").asText());
        assertEquals("broken", rows.get(1).get("email").asText());
        assertTrue(Files.exists(tmp.resolve("output/copy.yaml")));

        JsonNode stats = mapper.readTree(tmp.resolve("output/pipeline_stats.json").toFile());
        assertEquals("completed", stats.get("status").asText());
        assertEquals(4, stats.get("total_records").asInt());
        assertFalse(stats.get("end_time").isNull());
    }

    @Test
    void run_正常ケース_スキーマ違反_非strictでは成功となること() throws Exception {
        Path statsFile = tmp.resolve("stats/run.json");

        main.run("--input", "in.csv", "--schema", "schema.yml", "--stats",
                statsFile.toString());

        assertEquals(0, main.getExitCode());
        JsonNode stats = mapper.readTree(statsFile.toFile());
        assertEquals("completed", stats.get("status").asText());
        assertEquals(1, stats.get("invalid_records").asInt());
    }

    @Test
    void run_異常ケース_スキーマ違反_strictでは失敗の統計が書き込まれること() throws Exception {
        etlProperties.setStrictMode(true);

        main.run("--input", "in.csv", "--schema", "schema.yml", "-o", "out.json");

        assertEquals(1, main.getExitCode());
        assertFalse(Files.exists(tmp.resolve("output/out.json")));
        JsonNode stats = mapper.readTree(tmp.resolve("output/pipeline_stats.json").toFile());
        assertEquals("failed", stats.get("status").asText());
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("etl.strict-mode=true"));
    }

    @Test
    void run_異常ケース_未対応の出力形式_設定エラーとなること() throws Exception {
        etlProperties.setHandleMissingValues(false);

        main.run("--input", "in.csv", "--output", "out.xlsx");

        assertEquals(2, main.getExitCode());
        JsonNode stats = mapper.readTree(tmp.resolve("output/pipeline_stats.json").toFile());
        assertEquals("failed", stats.get("status").asText());
    }

    @Test
    void run_異常ケース_入力ファイルなし_処理エラーとなること() {
        main.run("--input", "missing.csv");

        assertEquals(1, main.getExitCode());
        assertTrue(Files.exists(tmp.resolve("output/pipeline_stats.json")));
    }
}
