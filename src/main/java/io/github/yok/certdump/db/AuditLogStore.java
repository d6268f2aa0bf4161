package io.github.yok.certdump.db;

import io.github.yok.certdump.model.AuditLogEntry;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Append-only store of audit log entries.
 *
 * @author Yasuharu.Okawauchi
 */
public interface AuditLogStore {

    /**
     * Creates the audit log table if it does not exist yet.
     *
     * @throws SQLException on SQL error
     */
    void ensureSchema() throws SQLException;

    /**
     * Appends one entry. The store assigns the entry number.
     *
     * @param entry entry to append
     * @throws SQLException on SQL error
     */
    void append(AuditLogEntry entry) throws SQLException;

    /**
     * Returns the entries whose timestamp is at or after {@code since}, newest first.
     *
     * @param since lower bound (inclusive)
     * @return matching entries including their store-assigned ids
     * @throws SQLException on SQL error
     */
    List<AuditLogEntry> findSince(LocalDateTime since) throws SQLException;
}
