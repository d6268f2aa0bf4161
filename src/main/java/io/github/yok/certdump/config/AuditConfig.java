package io.github.yok.certdump.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Settings of the audit log table and the run report.
 *
 * <ul>
 * <li>{@code audit.table-name}: audit log table (created if missing)</li>
 * <li>{@code audit.report-file-name}: run report written next to the snapshots</li>
 * <li>{@code audit.system-scope}: table name used for run-level entries</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "audit")
@Getter
@Setter
@NoArgsConstructor
public class AuditConfig {

    private String tableName = "log_extractions";

    private String reportFileName = "relatorio_logs.csv";

    private String systemScope = "SYSTEM";
}
