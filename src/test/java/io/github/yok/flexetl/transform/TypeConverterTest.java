package io.github.yok.flexetl.transform;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.flexetl.exception.TransformationException;
import io.github.yok.flexetl.table.Column;
import io.github.yok.flexetl.table.ColumnType;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class TypeConverterTest {

    @Test
    void convert_正常ケース_文字列からINT_欠損値は保持され小数は切り捨てられること() {
        Column column = Column.of("n", Arrays.asList("1", null, " 2.9 ", "-3.7"));

        Column converted = TypeConverter.convert(column, ColumnType.INT);

        assertEquals(ColumnType.INT, converted.getType());
        assertEquals(Arrays.asList(1L, null, 2L, -3L), converted.getValues());
    }

    @Test
    void convert_異常ケース_NaNをINTへ変換する_行番号付きのTransformationExceptionとなること() {
        Column column = Column.of("n", List.of(1.0, Double.NaN));

        TransformationException ex = assertThrows(TransformationException.class,
                () -> TypeConverter.convert(column, ColumnType.INT));

        assertEquals("Cannot convert column n to int: row 1 holds NaN", ex.getMessage());
    }

    @Test
    void convert_異常ケース_INTの範囲外の値_行番号付きのTransformationExceptionとなること() {
        Column column = Column.of("n", List.of("1", "1e30"));

        TransformationException ex = assertThrows(TransformationException.class,
                () -> TypeConverter.convert(column, ColumnType.INT));

        assertEquals("Cannot convert column n to int: row 1 holds 1e30", ex.getMessage());
        assertTrue(ex.getCause() instanceof IllegalArgumentException);
    }

    @Test
    void convertValue_異常ケース_INTの範囲外の数値_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class,
                () -> TypeConverter.convertValue(1e30, ColumnType.INT));
        assertThrows(IllegalArgumentException.class,
                () -> TypeConverter.convertValue(-1e19, ColumnType.INT));
        assertThrows(IllegalArgumentException.class,
                () -> TypeConverter.convertValue("9223372036854775808", ColumnType.INT));
        assertThrows(IllegalArgumentException.class, () -> TypeConverter
                .convertValue(BigInteger.ONE.shiftLeft(64), ColumnType.INT));
    }

    @Test
    void convertValue_正常ケース_INTの境界値_変換されること() {
        assertEquals(Long.MAX_VALUE,
                TypeConverter.convertValue("9223372036854775807", ColumnType.INT));
        assertEquals(Long.MIN_VALUE,
                TypeConverter.convertValue((double) Long.MIN_VALUE, ColumnType.INT));
        assertEquals(12L, TypeConverter.convertValue(new BigDecimal("12.9"), ColumnType.INT));
    }

    @Test
    void convert_正常ケース_各種表記をBOOLへ変換すること() {
        Column column = Column.of("b", List.of("Yes", "no", "1", "FALSE"));
        Column converted = TypeConverter.convert(column, ColumnType.BOOL);
        assertEquals(List.of(true, false, true, false), converted.getValues());
    }

    @Test
    void convertValue_正常ケース_数値からBOOL_0以外が真となること() {
        assertEquals(Boolean.TRUE, TypeConverter.convertValue(2L, ColumnType.BOOL));
        assertEquals(Boolean.FALSE, TypeConverter.convertValue(0.0, ColumnType.BOOL));
    }

    @Test
    void convertValue_異常ケース_不明な真偽値表記_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class,
                () -> TypeConverter.convertValue("maybe", ColumnType.BOOL));
    }

    @Test
    void convertValue_正常ケース_日付と日時を相互変換すること() {
        assertEquals(LocalDate.of(2024, 2, 29),
                TypeConverter.convertValue("2024/02/29", ColumnType.DATE));
        assertEquals(LocalDate.of(2024, 2, 29), TypeConverter
                .convertValue(LocalDateTime.of(2024, 2, 29, 10, 0), ColumnType.DATE));
        assertEquals(LocalDateTime.of(2024, 2, 29, 10, 30),
                TypeConverter.convertValue("2024-02-29 10:30", ColumnType.DATETIME));
        assertEquals(LocalDateTime.of(2024, 2, 29, 0, 0),
                TypeConverter.convertValue(LocalDate.of(2024, 2, 29), ColumnType.DATETIME));
    }

    @Test
    void convertValue_正常ケース_真偽値を数値へ変換すること() {
        assertEquals(1L, TypeConverter.convertValue(true, ColumnType.INT));
        assertEquals(0.0, TypeConverter.convertValue(false, ColumnType.FLOAT));
        assertEquals("12", TypeConverter.convertValue(12L, ColumnType.STRING));
    }

    @Test
    void convert_正常ケース_OBJECT指定_値がそのまま保持されること() {
        Column column = Column.of("m", List.of(1L, "a"));
        Column converted = TypeConverter.convert(column, ColumnType.OBJECT);
        assertEquals(column.getValues(), converted.getValues());
    }

    @Test
    void convert_異常ケース_日付でない文字列_原因が保持されること() {
        Column column = Column.of("d", List.of("yesterday"));
        TransformationException ex = assertThrows(TransformationException.class,
                () -> TypeConverter.convert(column, ColumnType.DATE));
        assertTrue(ex.getCause() instanceof IllegalArgumentException);
    }
}
