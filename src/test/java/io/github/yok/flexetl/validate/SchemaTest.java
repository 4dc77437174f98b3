package io.github.yok.flexetl.validate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.flexetl.exception.ConfigurationException;
import io.github.yok.flexetl.table.ColumnType;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SchemaTest {

    @Test
    void builder_正常ケース_規則は種別順に並び同種の規則は置き換えられること() {
        Schema schema = Schema.builder()
                .field("a", DateRule.iso(), new TypeRule(ColumnType.STRING), EmailRule.INSTANCE)
                .field("a", new TypeRule(ColumnType.INT)).build();

        List<FieldRule> rules = schema.getRules("a");
        assertEquals(3, rules.size());
        assertEquals(new TypeRule(ColumnType.INT), rules.get(0));
        assertEquals(RuleKind.EMAIL, rules.get(1).getKind());
        assertEquals(RuleKind.DATE, rules.get(2).getKind());
        assertTrue(schema.getRules("unknown").isEmpty());
    }

    @Test
    void fromMap_正常ケース_入れ子のマップから規則が作られること() {
        Map<String, Object> age = new LinkedHashMap<>();
        age.put("numeric", true);
        age.put("min", 0);
        age.put("max", 120);
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("email", Map.of("type", "string", "email", true));
        raw.put("age", age);
        raw.put("birthday", Map.of("date", true, "date_format", "%d/%m/%Y"));
        raw.put("id", null);

        Schema schema = Schema.fromMap(raw);

        assertEquals(List.of("email", "age", "birthday", "id"), schema.getFieldNames());
        assertEquals(4, schema.size());
        assertEquals(List.of(new NumericRule(0.0, 120.0)), schema.getRules("age"));
        assertEquals(List.of(new DateRule("%d/%m/%Y")), schema.getRules("birthday"));
        assertTrue(schema.getRules("id").isEmpty());
    }

    @Test
    void fromMap_正常ケース_falseのフラグ_規則が作られないこと() {
        Schema schema = Schema.fromMap(Map.of("a", Map.of("email", false)));
        assertTrue(schema.getRules("a").isEmpty());
    }

    @Test
    void fromMap_異常ケース_未知のキー_ConfigurationExceptionが送出されること() {
        ConfigurationException ex = assertThrows(ConfigurationException.class,
                () -> Schema.fromMap(Map.of("a", Map.of("regex", ".*"))));
        assertTrue(ex.getMessage().contains("unknown rule regex"));
    }

    @Test
    void fromMap_異常ケース_値の種類が不正_ConfigurationExceptionが送出されること() {
        assertThrows(ConfigurationException.class,
                () -> Schema.fromMap(Map.of("a", Map.of("email", "yes"))));
        assertThrows(ConfigurationException.class,
                () -> Schema.fromMap(Map.of("a", Map.of("numeric", true, "min", "0"))));
        assertThrows(ConfigurationException.class, () -> Schema.fromMap(Map.of("a", "string")));
        assertThrows(ConfigurationException.class,
                () -> Schema.fromMap(Map.of("a", Map.of("type", "decimal"))));
    }

    @Test
    void numericRule_異常ケース_下限が上限を超える_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class, () -> new NumericRule(10.0, 1.0));
    }

    @Test
    void dateRule_正常ケース_空白の書式_既定の書式となること() {
        assertEquals(DateRule.DEFAULT_FORMAT, new DateRule(" ").getFormat());
        Map<String, Object> raw = new HashMap<>();
        raw.put("d", Map.of("date", true));
        assertEquals(List.of(DateRule.iso()), Schema.fromMap(raw).getRules("d"));
    }
}
