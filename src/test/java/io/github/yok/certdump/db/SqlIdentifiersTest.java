package io.github.yok.certdump.db;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import org.junit.jupiter.api.Test;

class SqlIdentifiersTest {

    @Test
    void quote_正常ケース_識別子が二重引用符で囲まれること() {
        assertEquals("\"fato_processos\"", SqlIdentifiers.quote("fato_processos"));
        assertEquals("_t1", SqlIdentifiers.requireValid("_t1"));
    }

    @Test
    void quote_異常ケース_不正な識別子_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class, () -> SqlIdentifiers.quote("a\"b"));
        assertThrows(IllegalArgumentException.class, () -> SqlIdentifiers.quote("1abc"));
        assertThrows(IllegalArgumentException.class, () -> SqlIdentifiers.quote(""));
        assertThrows(IllegalArgumentException.class, () -> SqlIdentifiers.quote(null));
    }
}
