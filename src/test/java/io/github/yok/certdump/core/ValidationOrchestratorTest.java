package io.github.yok.certdump.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import io.github.yok.certdump.config.ImputationConfig;
import io.github.yok.certdump.db.AuditLogStore;
import io.github.yok.certdump.model.AuditAction;
import io.github.yok.certdump.model.AuditLogEntry;
import io.github.yok.certdump.model.AuditStatus;
import io.github.yok.certdump.model.CleaningStatistics;
import io.github.yok.certdump.model.ColumnKind;
import io.github.yok.certdump.model.Dataset;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class ValidationOrchestratorTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-03-15T10:00:00Z"), ZoneOffset.UTC);

    private AuditLogStore store;
    private ValidationOrchestrator orchestrator;

    @BeforeEach
    void setup() {
        store = mock(AuditLogStore.class);
        ReferentialIntegrityChecker checker = new ReferentialIntegrityChecker(
                Map.of("fato_processos", List.of("id_pessoa", "id_juiz", "id_advogado")));
        orchestrator = new ValidationOrchestrator(new DuplicateResolver(),
                new NullImputationPolicy(new ImputationConfig(), clock), checker,
                new TypeNormalizer(), store, clock);
    }

    private List<AuditLogEntry> capturedEntries(int expected) throws SQLException {
        ArgumentCaptor<AuditLogEntry> captor = ArgumentCaptor.forClass(AuditLogEntry.class);
        verify(store, times(expected)).append(captor.capture());
        return captor.getAllValues();
    }

    @Test
    void validate_正常ケース_重複と欠損が処理され統計が返ること() throws Exception {
        Dataset raw = Dataset.builder("dim_pessoa").column("id", ColumnKind.INTEGER)
                .column("nome", ColumnKind.TEXT).column("cpf", ColumnKind.TEXT)
                .row(1, "A", null).row(1, "A", null).row(2, null, "111").build();

        ValidationResult result = orchestrator.validate(raw);

        CleaningStatistics stats = result.getStatistics();
        assertEquals(3, stats.getRowsInitial());
        assertEquals(2, stats.getRowsFinal());
        assertEquals(1, stats.getDuplicatesFound());
        assertEquals(1, stats.getDuplicatesRemoved());
        assertEquals(2, stats.getNullsFound());
        assertEquals(2, stats.getNullsTreated());
        assertEquals(0, stats.getReferentialRowsDropped());

        Dataset out = result.getDataset();
        assertEquals(2, out.getRowCount());
        assertEquals(1L, out.getCell(0, 0).getValue());
        assertEquals("000.000.000-00", out.getCell(0, 2).getValue());
        assertEquals("Nome não informado", out.getCell(1, 1).getValue());
        assertEquals("111", out.getCell(1, 2).getValue());
    }

    @Test
    void validate_正常ケース_次元表は検証ログが2件記録されること() throws Exception {
        Dataset raw = Dataset.builder("dim_pessoa").column("id", ColumnKind.INTEGER)
                .column("nome", ColumnKind.TEXT).row(1L, "A").row(1L, "A").row(2L, null)
                .build();

        orchestrator.validate(raw);

        List<AuditLogEntry> entries = capturedEntries(2);
        AuditLogEntry dedup = entries.get(0);
        assertEquals(AuditAction.VALIDATION, dedup.getAction());
        assertEquals("dim_pessoa", dedup.getTableName());
        assertEquals(AuditStatus.WARNING, dedup.getStatus());
        assertEquals(3, dedup.getRowsProcessed());
        assertEquals(1, dedup.getDuplicatesFound());
        assertEquals("Duplicates found and removed: 1", dedup.getDetailText());
        assertEquals(LocalDateTime.of(2024, 3, 15, 10, 0), dedup.getTimestamp());

        AuditLogEntry nulls = entries.get(1);
        assertEquals(AuditStatus.WARNING, nulls.getStatus());
        assertEquals(2, nulls.getRowsProcessed());
        assertEquals(1, nulls.getNullsFound());
        assertEquals(1, nulls.getNullsTreated());
        assertEquals("Null values found and treated: 1", nulls.getDetailText());
    }

    @Test
    void validate_正常ケース_ファクト表の外部キー欠損行が削除され検証ログが3件記録されること()
            throws Exception {
        Dataset raw = Dataset.builder("fato_processos").column("id", ColumnKind.INTEGER)
                .column("id_pessoa", ColumnKind.INTEGER).column("id_juiz", ColumnKind.INTEGER)
                .column("id_advogado", ColumnKind.INTEGER)
                .column("valor_causa", ColumnKind.REAL).row(1L, 10L, 20L, 30L, null)
                .row(2L, 11L, null, 31L, 100.0d).build();

        ValidationResult result = orchestrator.validate(raw);

        assertEquals(1, result.getDataset().getRowCount());
        assertEquals(1, result.getStatistics().getReferentialRowsDropped());
        assertEquals(1, result.getStatistics().getNullsFound());
        assertEquals(0.0d, result.getDataset().getCell(0, 4).getValue());

        List<AuditLogEntry> entries = capturedEntries(3);
        AuditLogEntry fk = entries.get(2);
        assertEquals(AuditStatus.WARNING, fk.getStatus());
        assertEquals(1, fk.getRowsProcessed());
        assertEquals("Rows removed for missing foreign keys [id_pessoa, id_juiz, id_advogado]: 1",
                fk.getDetailText());
    }

    @Test
    void validate_正常ケース_問題がない_すべてSUCCESSで記録されること() throws Exception {
        Dataset raw = Dataset.builder("dim_juiz").column("id", ColumnKind.INTEGER)
                .column("nome", ColumnKind.TEXT).row(1L, "A").build();

        ValidationResult result = orchestrator.validate(raw);

        assertEquals(raw, result.getDataset());
        assertTrue(capturedEntries(2).stream().allMatch(e -> e.getStatus() == AuditStatus.SUCCESS));
    }

    @Test
    void validate_正常ケース_空のデータセット_統計がすべて0であること() throws Exception {
        Dataset raw = Dataset.builder("dim_juiz").column("id", ColumnKind.INTEGER)
                .column("nome", ColumnKind.TEXT).build();

        ValidationResult result = orchestrator.validate(raw);

        assertEquals(0, result.getDataset().getRowCount());
        assertEquals(CleaningStatistics.builder().build(), result.getStatistics());
    }

    @Test
    void validate_正常ケース_結果を再検証しても変化しないこと() throws Exception {
        Dataset raw = Dataset.builder("dim_advogado").column("id", ColumnKind.INTEGER)
                .column("oab", ColumnKind.TEXT).row(1, null).row(1, null).row(2, "PE-1").build();

        Dataset once = orchestrator.validate(raw).getDataset();
        ValidationResult twice = orchestrator.validate(once);

        assertEquals(once, twice.getDataset());
        assertEquals(0, twice.getStatistics().getDuplicatesFound());
        assertEquals(0, twice.getStatistics().getNullsFound());
    }

    @Test
    void validate_異常ケース_監査ログ記録に失敗する_SQLExceptionが送出されること() throws Exception {
        doThrow(new SQLException("audit down")).when(store).append(any());
        Dataset raw = Dataset.builder("dim_juiz").column("id", ColumnKind.INTEGER).row(1L)
                .build();

        SQLException ex = assertThrows(SQLException.class, () -> orchestrator.validate(raw));
        assertEquals("audit down", ex.getMessage());
    }
}
