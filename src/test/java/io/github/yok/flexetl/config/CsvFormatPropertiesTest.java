package io.github.yok.flexetl.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import org.junit.jupiter.api.Test;

class CsvFormatPropertiesTest {

    @Test
    void defaults_正常ケース_既定値が設定されていること() {
        CsvFormatProperties properties = new CsvFormatProperties();
        assertEquals(StandardCharsets.UTF_8, properties.primaryCharset());
        assertEquals(StandardCharsets.ISO_8859_1, properties.fallback());
        assertEquals(',', properties.delimiterChar());
    }

    @Test
    void delimiterChar_正常ケース_空文字_カンマとなること() {
        CsvFormatProperties properties = new CsvFormatProperties();
        properties.setDelimiter("");
        assertEquals(',', properties.delimiterChar());
        properties.setDelimiter("\t");
        assertEquals('\t', properties.delimiterChar());
    }

    @Test
    void primaryCharset_異常ケース_未知の文字コード_UnsupportedCharsetExceptionが送出されること() {
        CsvFormatProperties properties = new CsvFormatProperties();
        properties.setCharset("no-such-charset");
        assertThrows(UnsupportedCharsetException.class, properties::primaryCharset);
    }

    @Test
    void etlProperties_正常ケース_既定値が設定されていること() {
        EtlProperties properties = new EtlProperties();
        assertTrue(properties.isRemoveDuplicates());
        assertTrue(properties.isHandleMissingValues());
        assertEquals("drop", properties.getMissingStrategy());
        assertFalse(properties.isStrictMode());
        assertEquals("pipeline_stats.json", properties.getStatsFileName());
    }
}
