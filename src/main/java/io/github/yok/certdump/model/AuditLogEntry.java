package io.github.yok.certdump.model;

import java.time.LocalDateTime;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One row of the append-only audit log.
 *
 * <p>
 * Entries are created by the validation orchestrator and the extraction runner and are never
 * updated or deleted. {@code id} is assigned by the store and is {@code null} until the entry has
 * been read back.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@Builder(toBuilder = true)
public class AuditLogEntry {

    Long id;

    @NonNull
    LocalDateTime timestamp;

    @NonNull
    String tableName;

    @NonNull
    AuditAction action;

    int rowsProcessed;
    int duplicatesFound;
    int nullsFound;
    int duplicatesRemoved;
    int nullsTreated;

    @NonNull
    AuditStatus status;

    @Builder.Default
    String detailText = "";

    @Builder.Default
    String outputFile = "";
}
