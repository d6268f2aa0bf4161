package io.github.yok.certdump.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.sql.Types;
import org.junit.jupiter.api.Test;

class ColumnKindTest {

    @Test
    void fromSqlType_正常ケース_SQL型が種別に対応付けられること() {
        assertEquals(ColumnKind.INTEGER, ColumnKind.fromSqlType(Types.INTEGER));
        assertEquals(ColumnKind.INTEGER, ColumnKind.fromSqlType(Types.BIGINT));
        assertEquals(ColumnKind.REAL, ColumnKind.fromSqlType(Types.NUMERIC));
        assertEquals(ColumnKind.REAL, ColumnKind.fromSqlType(Types.DOUBLE));
        assertEquals(ColumnKind.BOOLEAN, ColumnKind.fromSqlType(Types.BIT));
        assertEquals(ColumnKind.TEMPORAL, ColumnKind.fromSqlType(Types.DATE));
        assertEquals(ColumnKind.TEMPORAL, ColumnKind.fromSqlType(Types.TIMESTAMP_WITH_TIMEZONE));
        assertEquals(ColumnKind.TEXT, ColumnKind.fromSqlType(Types.VARCHAR));
        assertEquals(ColumnKind.TEXT, ColumnKind.fromSqlType(Types.OTHER));
    }

    @Test
    void isCanonical_正常ケース_正規型とnullのみtrueが返ること() {
        assertTrue(ColumnKind.INTEGER.isCanonical(null));
        assertTrue(ColumnKind.INTEGER.isCanonical(3L));
        assertFalse(ColumnKind.INTEGER.isCanonical(3));
        assertEquals(Double.class, ColumnKind.REAL.getCanonicalType());
    }
}
