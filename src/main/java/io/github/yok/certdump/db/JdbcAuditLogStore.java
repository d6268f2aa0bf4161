package io.github.yok.certdump.db;

import io.github.yok.certdump.model.AuditAction;
import io.github.yok.certdump.model.AuditLogEntry;
import io.github.yok.certdump.model.AuditStatus;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Audit log store backed by a PostgreSQL table.
 *
 * <p>
 * Table layout (created when missing):
 * </p>
 *
 * <pre>
 * id                 SERIAL PRIMARY KEY
 * executed_at        TIMESTAMP
 * table_name         VARCHAR(50)
 * action             VARCHAR(20)   -- VALIDATION, EXTRACTION, ERROR, START, END
 * rows_processed     INT
 * duplicates_found   INT
 * nulls_found        INT
 * duplicates_removed INT
 * nulls_treated      INT
 * status             VARCHAR(10)   -- SUCCESS, ERROR, WARNING
 * detail_text        TEXT
 * output_file        VARCHAR(255)
 * </pre>
 *
 * <p>
 * Rows are only ever inserted. The connection is owned by the caller and is expected to be in
 * auto-commit mode.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class JdbcAuditLogStore implements AuditLogStore {

    static final String[] COLUMNS = {"id", "executed_at", "table_name", "action",
            "rows_processed", "duplicates_found", "nulls_found", "duplicates_removed",
            "nulls_treated", "status", "detail_text", "output_file"};

    private final Connection conn;
    private final String quotedTable;

    /**
     * Creates a store.
     *
     * @param conn open JDBC connection
     * @param tableName audit log table name
     * @throws IllegalArgumentException if {@code tableName} is not a plain identifier
     */
    public JdbcAuditLogStore(Connection conn, String tableName) {
        this.conn = conn;
        this.quotedTable = SqlIdentifiers.quote(tableName);
    }

    @Override
    public void ensureSchema() throws SQLException {
        String ddl = "CREATE TABLE IF NOT EXISTS " + quotedTable + " ("
                + "id SERIAL PRIMARY KEY, "
                + "executed_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP, "
                + "table_name VARCHAR(50), "
                + "action VARCHAR(20), "
                + "rows_processed INT DEFAULT 0, "
                + "duplicates_found INT DEFAULT 0, "
                + "nulls_found INT DEFAULT 0, "
                + "duplicates_removed INT DEFAULT 0, "
                + "nulls_treated INT DEFAULT 0, "
                + "status VARCHAR(10), "
                + "detail_text TEXT, "
                + "output_file VARCHAR(255))";
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(ddl);
        }
        log.info("Audit log table created/verified: {}", quotedTable);
    }

    @Override
    public void append(AuditLogEntry entry) throws SQLException {
        String sql = "INSERT INTO " + quotedTable
                + " (executed_at, table_name, action, rows_processed, duplicates_found,"
                + " nulls_found, duplicates_removed, nulls_treated, status, detail_text,"
                + " output_file) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setTimestamp(1, Timestamp.valueOf(entry.getTimestamp()));
            ps.setString(2, entry.getTableName());
            ps.setString(3, entry.getAction().name());
            ps.setInt(4, entry.getRowsProcessed());
            ps.setInt(5, entry.getDuplicatesFound());
            ps.setInt(6, entry.getNullsFound());
            ps.setInt(7, entry.getDuplicatesRemoved());
            ps.setInt(8, entry.getNullsTreated());
            ps.setString(9, entry.getStatus().name());
            ps.setString(10, StringUtils.defaultString(entry.getDetailText()));
            ps.setString(11, StringUtils.defaultString(entry.getOutputFile()));
            ps.executeUpdate();
        }
        log.debug("Audit[{}] {} {} {}", entry.getTableName(), entry.getAction(),
                entry.getStatus(), entry.getDetailText());
    }

    @Override
    public List<AuditLogEntry> findSince(LocalDateTime since) throws SQLException {
        String sql = "SELECT " + String.join(", ", COLUMNS) + " FROM " + quotedTable
                + " WHERE executed_at >= ? ORDER BY executed_at DESC, id DESC";
        List<AuditLogEntry> entries = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setTimestamp(1, Timestamp.valueOf(since));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    entries.add(AuditLogEntry.builder().id(rs.getLong("id"))
                            .timestamp(rs.getTimestamp("executed_at").toLocalDateTime())
                            .tableName(rs.getString("table_name"))
                            .action(AuditAction.valueOf(rs.getString("action")))
                            .rowsProcessed(rs.getInt("rows_processed"))
                            .duplicatesFound(rs.getInt("duplicates_found"))
                            .nullsFound(rs.getInt("nulls_found"))
                            .duplicatesRemoved(rs.getInt("duplicates_removed"))
                            .nullsTreated(rs.getInt("nulls_treated"))
                            .status(AuditStatus.valueOf(rs.getString("status")))
                            .detailText(StringUtils.defaultString(rs.getString("detail_text")))
                            .outputFile(StringUtils.defaultString(rs.getString("output_file")))
                            .build());
                }
            }
        }
        return entries;
    }
}
