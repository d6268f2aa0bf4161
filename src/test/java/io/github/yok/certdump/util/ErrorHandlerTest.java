package io.github.yok.certdump.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.lang.reflect.Constructor;
import java.sql.SQLException;
import org.apache.commons.lang3.StringUtils;
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
    void reportFatal_正常ケース_標準エラーへ出力され例外が送出されないこと() {
        PrintStream originalErr = System.err;
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        try {
            System.setErr(new PrintStream(err));
            ErrorHandler.reportFatal("boom", new RuntimeException("root"));
        } finally {
            System.setErr(originalErr);
        }
        String message = err.toString();
        assertTrue(message.contains("ERROR: boom"));
        assertTrue(message.contains("root"));
    }

    // -------------------------------------------------------------------------
    // describe
    // -------------------------------------------------------------------------

    @Test
    void describe_正常ケース_メッセージと根本原因が連結されること() {
        Exception e = new IllegalStateException("Failed to read table: t",
                new SQLException("relation \"t\" does not exist"));
        assertEquals("Failed to read table: t: relation \"t\" does not exist",
                ErrorHandler.describe(e));
    }

    @Test
    void describe_正常ケース_メッセージがない_根本原因のメッセージが使われること() {
        Exception e = new RuntimeException(new SQLException("timeout"));
        assertTrue(ErrorHandler.describe(e).contains("timeout"));
    }

    @Test
    void describe_正常ケース_改行が空白にまとめられ上限で切り詰められること() {
        assertEquals("a b", ErrorHandler.describe(new RuntimeException("a\n  b")));
        String longText = StringUtils.repeat('x', ErrorHandler.MAX_DETAIL_LENGTH + 10);
        assertEquals(ErrorHandler.MAX_DETAIL_LENGTH,
                ErrorHandler.describe(new RuntimeException(longText)).length());
    }
}
