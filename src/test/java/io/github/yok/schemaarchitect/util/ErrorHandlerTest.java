package io.github.yok.schemaarchitect.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import java.io.ByteArrayOutputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class ErrorHandlerTest {

    @Test
    void コンストラクタ_異常ケース_リフレクションで生成する_AssertionErrorが送出されること()
            throws Exception {
        Constructor<ErrorHandler> constructor = ErrorHandler.class.getDeclaredConstructor();
        constructor.setAccessible(true);
        InvocationTargetException ex =
                assertThrows(InvocationTargetException.class, constructor::newInstance);
        assertInstanceOf(AssertionError.class, ex.getCause());
    }

    @Test
    void reportFatal_正常ケース_原因ありを指定する_根本原因のメッセージが付くこと() {
        IOException cause = new FileNotFoundException("schema.sql (No such file or directory)");

        String err = captureErr(() -> ErrorHandler.reportFatal("Fatal error: cannot read",
                new UncheckedIOException(cause)));

        assertEquals("ERROR: Fatal error: cannot read (FileNotFoundException: schema.sql "
                + "(No such file or directory))", lastLine(err));
    }

    @Test
    void reportFatal_正常ケース_メッセージのみを指定する_1行で出力されること() {
        String err = captureErr(() -> ErrorHandler.reportFatal("Input file is required."));

        assertEquals("ERROR: Input file is required.", lastLine(err));
    }

    @Test
    void reportFatal_正常ケース_原因にnullを指定する_メッセージのみと同じ出力になること() {
        String err = captureErr(() -> ErrorHandler.reportFatal("boom", null));

        assertEquals("ERROR: boom", lastLine(err));
    }

    private static String captureErr(Runnable action) {
        PrintStream originalErr = System.err;
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        try {
            System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
            action.run();
        } finally {
            System.setErr(originalErr);
        }
        return err.toString(StandardCharsets.UTF_8);
    }

    // ログも標準エラーに出るため、最後の行だけを比較する
    private static String lastLine(String text) {
        String[] lines = text.strip().split("\\R");
        return lines[lines.length - 1];
    }
}
