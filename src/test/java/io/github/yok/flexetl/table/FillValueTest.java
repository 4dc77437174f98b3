package io.github.yok.flexetl.table;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.flexetl.exception.ConfigurationException;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class FillValueTest {

    @Test
    void of_正常ケース_各Java型を指定する_対応する種別となること() {
        assertEquals(FillValue.ofInt(3L), FillValue.of(3));
        assertEquals(FillValue.ofFloat(2.5), FillValue.of(2.5f));
        assertEquals(FillValue.ofString("x"), FillValue.of("x"));
        assertEquals(FillValue.ofBool(true), FillValue.of(Boolean.TRUE));
        assertSame(FillValue.none(), FillValue.of(null));
        assertTrue(FillValue.none().isNull());
    }

    @Test
    void of_異常ケース_未対応の型を指定する_ConfigurationExceptionが送出されること() {
        assertThrows(ConfigurationException.class, () -> FillValue.of(LocalDate.now()));
    }

    @Test
    void toString_正常ケース_種別ごとの表記が返ること() {
        assertEquals("null", FillValue.none().toString());
        assertEquals("0", FillValue.ofInt(0).toString());
        assertEquals(FillValue.Kind.FLOAT, FillValue.ofFloat(0).getKind());
    }
}
