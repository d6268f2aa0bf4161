package io.github.yok.certdump.db;

import io.github.yok.certdump.core.ExtractionException;
import io.github.yok.certdump.model.Cell;
import io.github.yok.certdump.model.ColumnKind;
import io.github.yok.certdump.model.ColumnSpec;
import io.github.yok.certdump.model.Dataset;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.dbunit.database.IDatabaseConnection;
import org.dbunit.dataset.Column;
import org.dbunit.dataset.DataSetException;
import org.dbunit.dataset.ITable;

/**
 * Reads catalog tables through DBUnit.
 *
 * <p>
 * Each table is read with an unconditional {@code SELECT *}. Column kinds come from the JDBC SQL
 * type of the DBUnit column metadata; cell payloads are kept exactly as the driver returned them
 * and are normalized later by the validation pass.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class DbUnitTableReader implements TableReader {

    private final IDatabaseConnection dbConn;

    /**
     * Creates a reader on an open DBUnit connection owned by the caller.
     *
     * @param dbConn DBUnit connection
     */
    public DbUnitTableReader(IDatabaseConnection dbConn) {
        this.dbConn = dbConn;
    }

    @Override
    public Dataset fetchTable(String tableName) throws ExtractionException {
        try {
            String sql = "SELECT * FROM " + SqlIdentifiers.quote(tableName);
            log.debug("Table[{}] Extraction SQL: {}", tableName, sql);
            ITable table = dbConn.createQueryTable(tableName, sql);
            Column[] cols = table.getTableMetaData().getColumns();

            List<ColumnSpec> columns = new ArrayList<>(cols.length);
            for (Column col : cols) {
                ColumnKind kind = ColumnKind.fromSqlType(col.getDataType().getSqlType());
                columns.add(new ColumnSpec(col.getColumnName(), kind));
                log.debug("Table[{}] Column[{}] SQL type={} → {}", tableName,
                        col.getColumnName(), col.getSqlTypeName(), kind);
            }

            int rowCount = table.getRowCount();
            List<List<Cell>> rows = new ArrayList<>(rowCount);
            for (int r = 0; r < rowCount; r++) {
                List<Cell> row = new ArrayList<>(cols.length);
                for (int c = 0; c < cols.length; c++) {
                    Object raw = table.getValue(r, cols[c].getColumnName());
                    row.add(Cell.of(columns.get(c).getKind(), raw));
                }
                rows.add(row);
            }
            log.info("Table[{}] {} rows extracted", tableName, rowCount);
            return new Dataset(tableName, columns, rows);
        } catch (DataSetException | SQLException | IllegalArgumentException e) {
            throw new ExtractionException("Failed to read table: " + tableName, e);
        }
    }

    @Override
    public long countRows(String tableName) throws ExtractionException {
        try {
            return dbConn.getRowCount(SqlIdentifiers.requireValid(tableName));
        } catch (SQLException | IllegalArgumentException e) {
            throw new ExtractionException("Failed to count rows of table: " + tableName, e);
        }
    }
}
