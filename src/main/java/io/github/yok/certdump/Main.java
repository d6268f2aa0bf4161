package io.github.yok.certdump;

import io.github.yok.certdump.config.AuditConfig;
import io.github.yok.certdump.config.CatalogConfig;
import io.github.yok.certdump.config.ConnectionConfig;
import io.github.yok.certdump.config.ImputationConfig;
import io.github.yok.certdump.config.PathsConfig;
import io.github.yok.certdump.core.CsvSnapshotWriter;
import io.github.yok.certdump.core.DuplicateResolver;
import io.github.yok.certdump.core.ExtractionRunner;
import io.github.yok.certdump.core.NullImputationPolicy;
import io.github.yok.certdump.core.ReferentialIntegrityChecker;
import io.github.yok.certdump.core.RunSummary;
import io.github.yok.certdump.core.TypeNormalizer;
import io.github.yok.certdump.core.ValidationOrchestrator;
import io.github.yok.certdump.db.ConnectionFactory;
import io.github.yok.certdump.db.DbUnitConnectionFactory;
import io.github.yok.certdump.db.DbUnitTableReader;
import io.github.yok.certdump.db.JdbcAuditLogStore;
import io.github.yok.certdump.util.ErrorHandler;
import java.sql.Connection;
import java.time.Clock;
import java.util.Arrays;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.dbunit.database.IDatabaseConnection;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Provides the application entry point.
 *
 * <p>
 * Opens one connection to the configured database, wires the extraction components on it and runs
 * {@link ExtractionRunner}. The connection is closed when the run ends. The program takes no
 * command-line options.
 * </p>
 *
 * <p>
 * Spring Boot loads {@link PathsConfig}, {@link ConnectionConfig}, {@link CatalogConfig},
 * {@link AuditConfig} and {@link ImputationConfig} from {@code application.yml}.
 * </p>
 *
 * <p>
 * Failures never terminate the JVM with a non-zero status: a failing table is recorded in the audit
 * log, and a failure to connect is reported on the log and {@code System.err}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 * @see ExtractionRunner
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties({PathsConfig.class, ConnectionConfig.class, CatalogConfig.class,
        AuditConfig.class, ImputationConfig.class})
@RequiredArgsConstructor
public class Main implements CommandLineRunner {

    private final PathsConfig pathsConfig;
    private final ConnectionConfig connectionConfig;
    private final CatalogConfig catalogConfig;
    private final AuditConfig auditConfig;
    private final ImputationConfig imputationConfig;
    private final ConnectionFactory connectionFactory;
    private final DbUnitConnectionFactory dbUnitConnectionFactory;

    /**
     * Bootstraps the application.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        app.run(args);
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments (ignored)
     */
    @Override
    public void run(String... args) {
        if (args.length > 0) {
            log.warn("Arguments are not supported and will be ignored: {}", Arrays.toString(args));
        }
        log.info("Application started. Database [{}], Tables {}", connectionConfig.getUrl(),
                catalogConfig.getTables());

        try (Connection conn = connectionFactory.open(connectionConfig)) {
            IDatabaseConnection dbConn =
                    dbUnitConnectionFactory.create(conn, connectionConfig.getSchema());
            RunSummary summary = createRunner(conn, dbConn, Clock.systemDefaultZone()).execute();
            log.info("Extraction finished. {}/{} tables written", summary.getSuccessCount(),
                    summary.getTableCount());
        } catch (Exception e) {
            ErrorHandler.reportFatal("Fatal error: extraction aborted", e);
        }
    }

    /**
     * Wires the extraction components on an open connection.
     *
     * @param conn JDBC connection used by the audit log
     * @param dbConn DBUnit connection used to read the catalog tables
     * @param clock clock stamping audit entries and synthesized values
     * @return runner
     */
    ExtractionRunner createRunner(Connection conn, IDatabaseConnection dbConn, Clock clock) {
        JdbcAuditLogStore auditLogStore = new JdbcAuditLogStore(conn, auditConfig.getTableName());
        DuplicateResolver duplicateResolver = new DuplicateResolver();
        NullImputationPolicy imputationPolicy = new NullImputationPolicy(imputationConfig, clock);
        ReferentialIntegrityChecker referentialChecker =
                new ReferentialIntegrityChecker(catalogConfig.getFactTables());
        ValidationOrchestrator orchestrator = new ValidationOrchestrator(duplicateResolver,
                imputationPolicy, referentialChecker, new TypeNormalizer(), auditLogStore, clock);
        return new ExtractionRunner(pathsConfig, catalogConfig, auditConfig,
                new DbUnitTableReader(dbConn), orchestrator, duplicateResolver, imputationPolicy,
                referentialChecker, new CsvSnapshotWriter(), auditLogStore, clock);
    }
}
