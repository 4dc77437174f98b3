package io.github.yok.flexetl.codec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.flexetl.table.Column;
import io.github.yok.flexetl.table.ColumnType;
import io.github.yok.flexetl.table.Table;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DocumentFormatHandlerTest {

    private final JsonFormatHandler json = new JsonFormatHandler();
    private final YamlFormatHandler yaml = new YamlFormatHandler();

    @Test
    void json_read_正常ケース_オブジェクト配列_キーの和集合が列となること(@TempDir Path tmp)
            throws Exception {
        Path file = tmp.resolve("in.json");
        Files.writeString(file,
                "[{\"id\": 1, \"score\": 1.5}, {\"id\": 2, \"name\": \"b\", \"score\": null}]",
                StandardCharsets.UTF_8);

        Table table = json.read(file);

        assertEquals(List.of("id", "score", "name"), table.getColumnNames());
        assertEquals(ColumnType.INT, table.getColumn("id").getType());
        assertEquals(Arrays.asList(1.5, null), table.getColumn("score").getValues());
        assertNull(table.getValue(0, "name"));
    }

    @Test
    void json_read_異常ケース_配列でない_IOExceptionが送出されること(@TempDir Path tmp) throws Exception {
        Path file = tmp.resolve("obj.json");
        Files.writeString(file, "{\"a\": 1}", StandardCharsets.UTF_8);
        IOException ex = assertThrows(IOException.class, () -> json.read(file));
        assertTrue(ex.getMessage().contains("expected an array of objects"));
    }

    @Test
    void json_read_異常ケース_要素がオブジェクトでない_IOExceptionが送出されること(@TempDir Path tmp)
            throws Exception {
        Path file = tmp.resolve("arr.json");
        Files.writeString(file, "[{\"a\": 1}, 2]", StandardCharsets.UTF_8);
        IOException ex = assertThrows(IOException.class, () -> json.read(file));
        assertTrue(ex.getMessage().contains("record 1 is not an object"));
    }

    @Test
    void json_read_正常ケース_空ファイル_空の表となること(@TempDir Path tmp) throws Exception {
        Path file = tmp.resolve("empty.json");
        Files.writeString(file, "", StandardCharsets.UTF_8);
        assertEquals(0, json.read(file).getColumnCount());
    }

    @Test
    void json_write_正常ケース_日付はISO文字列として書き込まれ読み戻せること(@TempDir Path tmp)
            throws Exception {
        Table table = new Table(List.of(Column.of("id", List.of(1L)),
                Column.of("day", List.of(LocalDate.of(2024, 3, 1)))));
        Path file = tmp.resolve("out.json");

        json.write(table, file);

        String text = Files.readString(file, StandardCharsets.UTF_8);
        assertTrue(text.contains("\"day\" : \"2024-03-01\""));
        Table back = json.read(file);
        assertEquals(1L, back.getValue(0, "id"));
        assertEquals("2024-03-01", back.getValue(0, "day"));
    }

    @Test
    void yaml_read_正常ケース_マッピングの列_日付と日時が変換されること(@TempDir Path tmp)
            throws Exception {
        Path file = tmp.resolve("in.yaml");
        Files.writeString(file, String.join("\n", "- id: 1", "  day: 2024-03-01",
                "  at: 2024-03-01T10:15:00Z", "- id: 2", "  day: 2024-03-02", ""),
                StandardCharsets.UTF_8);

        Table table = yaml.read(file);

        assertEquals(List.of(1L, 2L), table.getColumn("id").getValues());
        assertEquals(ColumnType.DATE, table.getColumn("day").getType());
        assertEquals(LocalDate.of(2024, 3, 2), table.getValue(1, "day"));
        assertEquals(LocalDateTime.of(2024, 3, 1, 10, 15), table.getValue(0, "at"));
        assertNull(table.getValue(1, "at"));
    }

    @Test
    void yaml_read_異常ケース_マッピングでない文書_IOExceptionが送出されること(@TempDir Path tmp)
            throws Exception {
        Path file = tmp.resolve("map.yml");
        Files.writeString(file, "a: 1\n", StandardCharsets.UTF_8);
        assertThrows(IOException.class, () -> yaml.read(file));
    }

    @Test
    void yaml_read_異常ケース_壊れたYAML_IOExceptionが送出されること(@TempDir Path tmp) throws Exception {
        Path file = tmp.resolve("bad.yml");
        Files.writeString(file, "- a: [1\n", StandardCharsets.UTF_8);
        assertThrows(IOException.class, () -> yaml.read(file));
    }

    @Test
    void yaml_write_正常ケース_ブロック形式で書き込まれ読み戻せること(@TempDir Path tmp) throws Exception {
        Table table = new Table(List.of(Column.of("id", List.of(1L, 2L)),
                Column.of("name", Arrays.asList("a", null))));
        Path file = tmp.resolve("out.yml");

        yaml.write(table, file);

        String text = Files.readString(file, StandardCharsets.UTF_8);
        assertTrue(text.startsWith("- id: 1"));
        assertEquals(table, yaml.read(file));
    }
}
