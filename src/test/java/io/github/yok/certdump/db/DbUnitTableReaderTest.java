package io.github.yok.certdump.db;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.certdump.core.ErrorKind;
import io.github.yok.certdump.core.ExtractionException;
import io.github.yok.certdump.model.ColumnKind;
import io.github.yok.certdump.model.Dataset;
import java.math.BigDecimal;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import org.dbunit.database.IDatabaseConnection;
import org.dbunit.dataset.Column;
import org.dbunit.dataset.ITable;
import org.dbunit.dataset.ITableMetaData;
import org.dbunit.dataset.datatype.DataType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DbUnitTableReaderTest {

    private IDatabaseConnection dbConn;
    private DbUnitTableReader reader;

    @BeforeEach
    void setup() {
        dbConn = mock(IDatabaseConnection.class);
        reader = new DbUnitTableReader(dbConn);
    }

    // -------------------------------------------------------------------------
    // fetchTable
    // -------------------------------------------------------------------------

    @Test
    void fetchTable_正常ケース_列種別とセル値がそのまま読み込まれること() throws Exception {
        ITable table = mock(ITable.class);
        ITableMetaData meta = mock(ITableMetaData.class);
        Column[] cols = new Column[] {new Column("id", DataType.INTEGER),
                new Column("nome", DataType.VARCHAR), new Column("valor", DataType.NUMERIC),
                new Column("criado_em", DataType.TIMESTAMP)};
        when(dbConn.createQueryTable("dim_pessoa", "SELECT * FROM \"dim_pessoa\""))
                .thenReturn(table);
        when(table.getTableMetaData()).thenReturn(meta);
        when(meta.getColumns()).thenReturn(cols);
        when(table.getRowCount()).thenReturn(2);
        Timestamp ts = Timestamp.valueOf("2024-01-01 08:00:00");
        when(table.getValue(0, "id")).thenReturn(1);
        when(table.getValue(0, "nome")).thenReturn("Ana");
        when(table.getValue(0, "valor")).thenReturn(new BigDecimal("10.5"));
        when(table.getValue(0, "criado_em")).thenReturn(ts);
        when(table.getValue(1, "id")).thenReturn(2);
        when(table.getValue(1, "nome")).thenReturn(null);
        when(table.getValue(1, "valor")).thenReturn(null);
        when(table.getValue(1, "criado_em")).thenReturn(null);

        Dataset ds = reader.fetchTable("dim_pessoa");

        assertEquals("dim_pessoa", ds.getName());
        assertEquals(List.of("id", "nome", "valor", "criado_em"), ds.getColumnNames());
        assertEquals(ColumnKind.INTEGER, ds.getColumns().get(0).getKind());
        assertEquals(ColumnKind.TEXT, ds.getColumns().get(1).getKind());
        assertEquals(ColumnKind.REAL, ds.getColumns().get(2).getKind());
        assertEquals(ColumnKind.TEMPORAL, ds.getColumns().get(3).getKind());
        assertEquals(2, ds.getRowCount());
        assertEquals(1, ds.getCell(0, 0).getValue());
        assertEquals(new BigDecimal("10.5"), ds.getCell(0, 2).getValue());
        assertEquals(ts, ds.getCell(0, 3).getValue());
        assertTrue(ds.getCell(1, 1).isMissing());
    }

    @Test
    void fetchTable_異常ケース_クエリが失敗する_ExtractionExceptionが送出されること()
            throws Exception {
        SQLException cause = new SQLException("relation does not exist");
        when(dbConn.createQueryTable(anyString(), anyString())).thenThrow(cause);

        ExtractionException ex =
                assertThrows(ExtractionException.class, () -> reader.fetchTable("dim_juiz"));

        assertEquals("Failed to read table: dim_juiz", ex.getMessage());
        assertEquals(ErrorKind.EXTRACTION_FAILURE, ex.getKind());
        assertEquals(cause, ex.getCause());
    }

    @Test
    void fetchTable_異常ケース_不正なテーブル名_ExtractionExceptionが送出されること()
            throws Exception {
        ExtractionException ex = assertThrows(ExtractionException.class,
                () -> reader.fetchTable("dim_pessoa; DROP TABLE x"));

        assertInstanceOf(IllegalArgumentException.class, ex.getCause());
        verify(dbConn, never()).createQueryTable(anyString(), anyString());
    }

    // -------------------------------------------------------------------------
    // countRows
    // -------------------------------------------------------------------------

    @Test
    void countRows_正常ケース_行数が返ること() throws Exception {
        when(dbConn.getRowCount("fato_processos")).thenReturn(42);
        assertEquals(42L, reader.countRows("fato_processos"));
    }

    @Test
    void countRows_異常ケース_SQLException_ExtractionExceptionが送出されること() throws Exception {
        when(dbConn.getRowCount("fato_processos")).thenThrow(new SQLException("timeout"));
        assertThrows(ExtractionException.class, () -> reader.countRows("fato_processos"));
    }
}
