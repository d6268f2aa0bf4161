package io.github.yok.certdump.core;

import io.github.yok.certdump.db.AuditLogStore;
import io.github.yok.certdump.model.AuditAction;
import io.github.yok.certdump.model.AuditLogEntry;
import io.github.yok.certdump.model.AuditStatus;
import io.github.yok.certdump.model.CleaningStatistics;
import io.github.yok.certdump.model.Dataset;
import java.sql.SQLException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs the cleaning stages over one dataset and assembles its statistics.
 *
 * <p>
 * <strong>Stages:</strong> {@code START → DEDUPLICATE → IMPUTE → CHECK_REFERENTIAL} (fact datasets
 * only) {@code → NORMALIZE_TYPES → DONE}. Each of the first three stages appends one
 * {@link AuditAction#VALIDATION} entry, with status {@link AuditStatus#WARNING} when the stage
 * found something to fix.
 * </p>
 *
 * <p>
 * Foreign keys of fact datasets are exempt from imputation so that the referential check sees
 * them as extracted. No stage is retried; an empty dataset yields an empty result with all-zero
 * statistics.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ValidationOrchestrator {

    private final DuplicateResolver duplicateResolver;
    private final NullImputationPolicy imputationPolicy;
    private final ReferentialIntegrityChecker referentialChecker;
    private final TypeNormalizer typeNormalizer;
    private final AuditLogStore auditLogStore;
    private final Clock clock;

    /**
     * Creates an orchestrator.
     *
     * @param duplicateResolver duplicate stage
     * @param imputationPolicy imputation stage
     * @param referentialChecker referential stage
     * @param typeNormalizer normalization stage
     * @param auditLogStore audit log receiving the VALIDATION entries
     * @param clock clock stamping the audit entries
     */
    public ValidationOrchestrator(DuplicateResolver duplicateResolver,
            NullImputationPolicy imputationPolicy, ReferentialIntegrityChecker referentialChecker,
            TypeNormalizer typeNormalizer, AuditLogStore auditLogStore, Clock clock) {
        this.duplicateResolver = duplicateResolver;
        this.imputationPolicy = imputationPolicy;
        this.referentialChecker = referentialChecker;
        this.typeNormalizer = typeNormalizer;
        this.auditLogStore = auditLogStore;
        this.clock = clock;
    }

    /**
     * Validates and cleans one dataset.
     *
     * @param raw dataset as extracted
     * @return cleaned dataset and statistics
     * @throws SQLException if an audit entry cannot be appended
     */
    public ValidationResult validate(Dataset raw) throws SQLException {
        String table = raw.getName();
        boolean fact = referentialChecker.appliesTo(table);
        Set<String> exempt = referentialChecker.foreignKeysOf(table);
        log.info("Table[{}] Validating {} rows", table, raw.getRowCount());
        enter(table, ValidationStage.START);

        // --- 1) Duplicates ---
        enter(table, ValidationStage.DEDUPLICATE);
        DuplicateResolution dedup = duplicateResolver.resolve(raw);
        log.info("Table[{}] Duplicates found: {}", table, dedup.getDuplicatesFound());
        appendValidation(AuditLogEntry.builder().tableName(table)
                .rowsProcessed(raw.getRowCount()).duplicatesFound(dedup.getDuplicatesFound())
                .duplicatesRemoved(dedup.getDuplicatesRemoved())
                .status(AuditStatus.warningIf(dedup.getDuplicatesFound()))
                .detailText("Duplicates found and removed: " + dedup.getDuplicatesRemoved()));

        // --- 2) Missing values ---
        enter(table, ValidationStage.IMPUTE);
        ImputationResult imputed = imputationPolicy.impute(dedup.getDataset(), exempt);
        log.info("Table[{}] Null values found: {}", table, imputed.getNullsFound());
        appendValidation(AuditLogEntry.builder().tableName(table)
                .rowsProcessed(imputed.getDataset().getRowCount())
                .nullsFound(imputed.getNullsFound()).nullsTreated(imputed.getNullsTreated())
                .status(AuditStatus.warningIf(imputed.getNullsFound()))
                .detailText("Null values found and treated: " + imputed.getNullsTreated()));

        // --- 3) Foreign keys (fact datasets only) ---
        Dataset current = imputed.getDataset();
        int dropped = 0;
        if (fact) {
            enter(table, ValidationStage.CHECK_REFERENTIAL);
            ReferentialCheckResult checked = referentialChecker.check(current);
            dropped = checked.getRowsDropped();
            current = checked.getDataset();
            appendValidation(AuditLogEntry.builder().tableName(table)
                    .rowsProcessed(current.getRowCount())
                    .status(AuditStatus.warningIf(dropped))
                    .detailText("Rows removed for missing foreign keys "
                            + checked.getCheckedColumns() + ": " + dropped));
        }

        // --- 4) Canonical types ---
        enter(table, ValidationStage.NORMALIZE_TYPES);
        current = typeNormalizer.normalize(current);

        CleaningStatistics stats = CleaningStatistics.builder().rowsInitial(raw.getRowCount())
                .rowsFinal(current.getRowCount()).duplicatesFound(dedup.getDuplicatesFound())
                .duplicatesRemoved(dedup.getDuplicatesRemoved())
                .nullsFound(imputed.getNullsFound()).nullsTreated(imputed.getNullsTreated())
                .referentialRowsDropped(dropped).build();
        enter(table, ValidationStage.DONE);
        log.info("Table[{}] Final rows after cleaning: {} ({}% of the original rows)", table,
                stats.getRowsFinal(),
                String.format(Locale.ROOT, "%.1f", stats.retainedPercentage()));
        return new ValidationResult(current, stats);
    }

    private void enter(String table, ValidationStage stage) {
        log.debug("Table[{}] Stage → {}", table, stage);
    }

    private void appendValidation(AuditLogEntry.AuditLogEntryBuilder entry) throws SQLException {
        auditLogStore.append(
                entry.timestamp(LocalDateTime.now(clock)).action(AuditAction.VALIDATION).build());
    }
}
