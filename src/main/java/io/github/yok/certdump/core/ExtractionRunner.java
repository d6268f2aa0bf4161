package io.github.yok.certdump.core;

import io.github.yok.certdump.config.AuditConfig;
import io.github.yok.certdump.config.CatalogConfig;
import io.github.yok.certdump.config.PathsConfig;
import io.github.yok.certdump.db.AuditLogStore;
import io.github.yok.certdump.db.TableReader;
import io.github.yok.certdump.model.AuditAction;
import io.github.yok.certdump.model.AuditLogEntry;
import io.github.yok.certdump.model.AuditStatus;
import io.github.yok.certdump.model.CleaningStatistics;
import io.github.yok.certdump.model.ColumnSpec;
import io.github.yok.certdump.model.Dataset;
import io.github.yok.certdump.util.CsvUtils;
import io.github.yok.certdump.util.ErrorHandler;
import io.github.yok.certdump.util.LogPathUtil;
import java.io.File;
import java.io.IOException;
import java.nio.file.Paths;
import java.sql.SQLException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;

/**
 * Drives one extraction run over every catalog table.
 *
 * <p>
 * <strong>Flow:</strong>
 * </p>
 * <ol>
 * <li>Create the audit table if missing and append the run-level {@code START} entry.</li>
 * <li>For each table, in catalog order: fetch, validate, verify the cleaned data, write
 * {@code <snapshotDir>/<table>.csv} and append an {@code EXTRACTION} entry.</li>
 * <li>Log the database row counts and the run summary.</li>
 * <li>Write the run report with every audit entry recorded since the run started.</li>
 * <li>Append the run-level {@code END} entry.</li>
 * </ol>
 *
 * <p>
 * A failing table is recorded as an {@code ERROR} entry and the run moves on to the next table. A
 * failure outside the table loop is recorded as an {@code ERROR} entry at run level. Nothing is
 * retried and nothing is rethrown.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ExtractionRunner {

    // Columns of the run report, in audit table order
    static final String[] REPORT_HEADERS = {"id", "executed_at", "table_name", "action",
            "rows_processed", "duplicates_found", "nulls_found", "duplicates_removed",
            "nulls_treated", "status", "detail_text", "output_file"};

    private final PathsConfig pathsConfig;
    private final CatalogConfig catalogConfig;
    private final AuditConfig auditConfig;
    private final TableReader tableReader;
    private final ValidationOrchestrator orchestrator;
    private final DuplicateResolver duplicateResolver;
    private final NullImputationPolicy imputationPolicy;
    private final ReferentialIntegrityChecker referentialChecker;
    private final SnapshotWriter snapshotWriter;
    private final AuditLogStore auditLogStore;
    private final Clock clock;

    /**
     * Creates a runner.
     *
     * @param pathsConfig path settings
     * @param catalogConfig tables to extract
     * @param auditConfig audit and report settings
     * @param tableReader source of the datasets
     * @param orchestrator cleaning pipeline
     * @param duplicateResolver used by the final verification
     * @param imputationPolicy used by the final verification to select the checked columns
     * @param referentialChecker used by the final verification to exempt foreign keys
     * @param snapshotWriter snapshot destination
     * @param auditLogStore audit log
     * @param clock clock stamping the run-level entries
     */
    public ExtractionRunner(PathsConfig pathsConfig, CatalogConfig catalogConfig,
            AuditConfig auditConfig, TableReader tableReader, ValidationOrchestrator orchestrator,
            DuplicateResolver duplicateResolver, NullImputationPolicy imputationPolicy,
            ReferentialIntegrityChecker referentialChecker, SnapshotWriter snapshotWriter,
            AuditLogStore auditLogStore, Clock clock) {
        this.pathsConfig = pathsConfig;
        this.catalogConfig = catalogConfig;
        this.auditConfig = auditConfig;
        this.tableReader = tableReader;
        this.orchestrator = orchestrator;
        this.duplicateResolver = duplicateResolver;
        this.imputationPolicy = imputationPolicy;
        this.referentialChecker = referentialChecker;
        this.snapshotWriter = snapshotWriter;
        this.auditLogStore = auditLogStore;
        this.clock = clock;
    }

    /**
     * Runs the extraction.
     *
     * @return per-table outcomes and totals; tables not reached before a run-level failure are
     *         missing from it
     */
    public RunSummary execute() {
        LocalDateTime runStart = LocalDateTime.now(clock);
        List<TableOutcome> outcomes = new ArrayList<>();
        RunSummary summary = new RunSummary(outcomes, Map.of());
        log.info("=== Validated extraction started ===");
        try {
            // --- 1) Audit table and START entry ---
            auditLogStore.ensureSchema();
            auditLogStore.append(systemEntry(AuditAction.START, AuditStatus.SUCCESS)
                    .detailText("Starting validated extraction").build());

            // --- 2) Tables ---
            File snapshotDir = prepareSnapshotDir();
            for (String table : catalogConfig.getTables()) {
                outcomes.add(processTable(table, snapshotDir));
            }

            // --- 3) Row counts and summary ---
            summary = new RunSummary(outcomes, countDatabaseRows());
            summary.logSummary();

            // --- 4) Run report ---
            writeReport(snapshotDir, runStart);

            // --- 5) END entry ---
            double rate = summary.successRate();
            auditLogStore.append(systemEntry(AuditAction.END,
                    summary.isAllSucceeded() ? AuditStatus.SUCCESS : AuditStatus.WARNING)
                            .rowsProcessed(summary.totalRowsFinal())
                            .duplicatesFound(summary.totalDuplicatesRemoved())
                            .nullsTreated(summary.totalNullsTreated())
                            .detailText(String.format(Locale.ROOT,
                                    "Extraction finished: %.1f%% success", rate))
                            .build());
            log.info("=== Validated extraction completed: {}/{} tables ===",
                    summary.getSuccessCount(), summary.getTableCount());
        } catch (CertDumpException | SQLException | RuntimeException e) {
            log.error("Extraction run failed", e);
            appendSafely(systemEntry(AuditAction.ERROR, AuditStatus.ERROR)
                    .detailText("Run failed: " + ErrorHandler.describe(e)).build());
        }
        return summary;
    }

    /**
     * Processes one table. Every failure is turned into a failed outcome.
     *
     * @param table table name
     * @param snapshotDir snapshot directory
     * @return outcome of the table
     */
    TableOutcome processTable(String table, File snapshotDir) {
        log.info("Table[{}] Processing", table);
        try {
            Dataset raw = tableReader.fetchTable(table);
            ValidationResult result = orchestrator.validate(raw);
            Dataset cleaned = verify(result.getDataset());
            CleaningStatistics stats = result.getStatistics();
            int residual = result.getDataset().getRowCount() - cleaned.getRowCount();
            if (residual > 0) {
                stats = stats.withResidualDuplicatesRemoved(residual);
                auditLogStore.append(AuditLogEntry.builder().timestamp(LocalDateTime.now(clock))
                        .tableName(table).action(AuditAction.VALIDATION)
                        .rowsProcessed(cleaned.getRowCount()).duplicatesFound(residual)
                        .duplicatesRemoved(residual).status(AuditStatus.WARNING)
                        .detailText("Residual duplicates removed at final check: " + residual)
                        .build());
            }

            String fileName = table + ".csv";
            File csv = new File(snapshotDir, fileName);
            snapshotWriter.write(cleaned, csv);
            double sizeMb = CsvUtils.sizeInMegabytes(csv);
            log.info(String.format(Locale.ROOT, "Table[%s] Saved %s (%d rows, %.2f MB)", table,
                    LogPathUtil.renderForLog(Paths.get(pathsConfig.getDataPath()), csv),
                    cleaned.getRowCount(), sizeMb));

            auditLogStore.append(AuditLogEntry.builder().timestamp(LocalDateTime.now(clock))
                    .tableName(table).action(AuditAction.EXTRACTION)
                    .rowsProcessed(cleaned.getRowCount())
                    .duplicatesFound(stats.getDuplicatesFound())
                    .nullsFound(stats.getNullsFound())
                    .duplicatesRemoved(stats.getDuplicatesRemoved())
                    .nullsTreated(stats.getNullsTreated()).status(AuditStatus.SUCCESS)
                    .detailText("CSV file written with " + cleaned.getRowCount() + " valid rows")
                    .outputFile(fileName).build());
            return TableOutcome.success(table, stats, fileName, sizeMb);
        } catch (CertDumpException e) {
            return fail(table, e.getKind(), e);
        } catch (SQLException e) {
            return fail(table, ErrorKind.SYSTEM_FAILURE, e);
        } catch (RuntimeException e) {
            return fail(table, ErrorKind.EXTRACTION_FAILURE, e);
        }
    }

    /**
     * Final verification of a cleaned dataset: residual duplicates are removed again and residual
     * missing cells in imputed columns are reported.
     *
     * @param dataset cleaned dataset
     * @return dataset to write
     */
    Dataset verify(Dataset dataset) {
        String table = dataset.getName();
        Dataset current = dataset;
        int residualDuplicates = duplicateResolver.countDuplicates(current);
        if (residualDuplicates > 0) {
            log.warn("Table[{}] {} duplicates still present after cleaning; removing", table,
                    residualDuplicates);
            current = duplicateResolver.resolve(current).getDataset();
        }

        Set<String> exempt = referentialChecker.foreignKeysOf(table);
        int residualNulls = 0;
        List<ColumnSpec> columns = current.getColumns();
        for (int c = 0; c < columns.size(); c++) {
            if (imputationPolicy.isEligible(columns.get(c).getName(), exempt)) {
                residualNulls += current.countMissing(c);
            }
        }
        if (residualNulls > 0) {
            log.warn("Table[{}] {} null values still present in imputed columns", table,
                    residualNulls);
        }
        log.info("Table[{}] Final check: residual duplicates={}, residual nulls={}", table,
                residualDuplicates, residualNulls);
        return current;
    }

    private TableOutcome fail(String table, ErrorKind kind, Exception e) {
        String message = ErrorHandler.describe(e);
        log.error("Table[{}] Extraction failed ({}): {}", table, kind, message, e);
        appendSafely(AuditLogEntry.builder().timestamp(LocalDateTime.now(clock)).tableName(table)
                .action(AuditAction.ERROR).status(AuditStatus.ERROR)
                .detailText("Extraction failed: " + message).build());
        return TableOutcome.failure(new ExtractionError(table, kind, message));
    }

    private File prepareSnapshotDir() throws SnapshotWriteException {
        File dir = new File(pathsConfig.getSnapshotDir());
        try {
            FileUtils.forceMkdir(dir);
        } catch (IOException e) {
            throw new SnapshotWriteException("Failed to create snapshot directory: " + dir, e);
        }
        return dir;
    }

    private Map<String, Long> countDatabaseRows() {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (String table : catalogConfig.getTables()) {
            try {
                counts.put(table, tableReader.countRows(table));
            } catch (ExtractionException e) {
                log.warn("Table[{}] Row count unavailable: {}", table, ErrorHandler.describe(e));
            }
        }
        return counts;
    }

    private void writeReport(File snapshotDir, LocalDateTime runStart)
            throws SQLException, SnapshotWriteException {
        List<AuditLogEntry> entries = auditLogStore.findSince(runStart);
        if (entries.isEmpty()) {
            log.info("No audit entries recorded since {}; run report skipped", runStart);
            return;
        }
        List<List<String>> rows = new ArrayList<>(entries.size());
        for (AuditLogEntry e : entries) {
            rows.add(Arrays.asList(CsvUtils.formatValue(e.getId()),
                    CsvUtils.formatValue(e.getTimestamp()), e.getTableName(),
                    e.getAction().name(), String.valueOf(e.getRowsProcessed()),
                    String.valueOf(e.getDuplicatesFound()), String.valueOf(e.getNullsFound()),
                    String.valueOf(e.getDuplicatesRemoved()), String.valueOf(e.getNullsTreated()),
                    e.getStatus().name(), e.getDetailText(), e.getOutputFile()));
        }
        File report = new File(snapshotDir, auditConfig.getReportFileName());
        try {
            CsvUtils.writeCsvUtf8(report, REPORT_HEADERS, rows);
        } catch (IOException e) {
            throw new SnapshotWriteException("Failed to write run report: " + report, e);
        }
        log.info("Run report saved: {} ({} entries)",
                LogPathUtil.renderForLog(Paths.get(pathsConfig.getDataPath()), report),
                entries.size());
    }

    private AuditLogEntry.AuditLogEntryBuilder systemEntry(AuditAction action,
            AuditStatus status) {
        return AuditLogEntry.builder().timestamp(LocalDateTime.now(clock))
                .tableName(auditConfig.getSystemScope()).action(action).status(status);
    }

    private void appendSafely(AuditLogEntry entry) {
        try {
            auditLogStore.append(entry);
        } catch (SQLException | RuntimeException e) {
            log.error("Failed to record audit entry {} for {}: {}", entry.getAction(),
                    entry.getTableName(), ErrorHandler.describe(e));
        }
    }
}
