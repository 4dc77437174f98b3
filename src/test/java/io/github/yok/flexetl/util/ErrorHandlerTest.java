package io.github.yok.flexetl.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.flexetl.exception.ConfigurationException;
import io.github.yok.flexetl.exception.ExtractionException;
import io.github.yok.flexetl.exception.PipelineStateException;
import io.github.yok.flexetl.exception.UnsupportedFormatException;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.lang.reflect.Constructor;
import java.util.List;
import org.junit.jupiter.api.Test;

class ErrorHandlerTest {

    @Test
    void コンストラクタ_正常ケース_リフレクションで生成する_インスタンスが生成されること() throws Exception {
        Constructor<ErrorHandler> constructor = ErrorHandler.class.getDeclaredConstructor();
        constructor.setAccessible(true);
        ErrorHandler instance = constructor.newInstance();
        assertEquals(ErrorHandler.class, instance.getClass());
    }

    @Test
    void errorAndExit_異常ケース_exit無効を指定する_IllegalStateExceptionが送出されること() {
        ErrorHandler.disableExitForCurrentThread();
        try {
            RuntimeException cause = new RuntimeException("root");
            IllegalStateException ex = assertThrows(IllegalStateException.class,
                    () -> ErrorHandler.errorAndExit("boom", cause));
            assertEquals("boom", ex.getMessage());
            assertSame(cause, ex.getCause());

            IllegalStateException ex2 = assertThrows(IllegalStateException.class,
                    () -> ErrorHandler.errorAndExit("boom2"));
            assertEquals("boom2", ex2.getMessage());
        } finally {
            ErrorHandler.restoreExitForCurrentThread();
        }
    }

    @Test
    void errorAndExit_正常ケース_Throwableありを指定する_標準エラーへ根本原因が出力されること() {
        PrintStream originalErr = System.err;
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        int code;
        try {
            System.setErr(new PrintStream(err));
            code = ErrorHandler.errorAndExit("boom",
                    new ExtractionException("extract failed", new IOException("disk")));
        } finally {
            System.setErr(originalErr);
        }
        String message = err.toString();
        assertTrue(message.contains("ERROR: boom"));
        assertTrue(message.contains("IOException: disk"));
        assertEquals(ErrorHandler.EXIT_FAILURE, code);
    }

    @Test
    void errorAndExit_正常ケース_メッセージのみを指定する_使用法エラーのコードが返ること() {
        PrintStream originalErr = System.err;
        try {
            System.setErr(new PrintStream(new ByteArrayOutputStream()));
            assertEquals(ErrorHandler.EXIT_USAGE, ErrorHandler.errorAndExit("boom2"));
        } finally {
            System.setErr(originalErr);
        }
    }

    @Test
    void exitCodeOf_正常ケース_設定エラーと状態エラーは2でその他は1となること() {
        assertEquals(2, ErrorHandler.exitCodeOf(new ConfigurationException("x")));
        assertEquals(2, ErrorHandler.exitCodeOf(new UnsupportedFormatException("xlsx",
                List.of("csv"))));
        assertEquals(2, ErrorHandler.exitCodeOf(new PipelineStateException("x")));
        assertEquals(1, ErrorHandler.exitCodeOf(new IllegalArgumentException("x")));
    }
}
