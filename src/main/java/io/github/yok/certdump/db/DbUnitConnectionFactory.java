package io.github.yok.certdump.db;

import java.sql.Connection;
import lombok.extern.slf4j.Slf4j;
import org.dbunit.DatabaseUnitException;
import org.dbunit.database.DatabaseConfig;
import org.dbunit.database.DatabaseConnection;
import org.dbunit.database.IDatabaseConnection;
import org.dbunit.dataset.datatype.IDataTypeFactory;
import org.dbunit.ext.postgresql.PostgresqlDataTypeFactory;
import org.springframework.stereotype.Component;

/**
 * Wraps the run's JDBC connection into a DBUnit connection configured for extraction.
 *
 * <p>
 * The PostgreSQL data type factory makes DBUnit report vendor types (for example {@code bool},
 * {@code uuid}, {@code timestamptz}) with their JDBC SQL types, from which column kinds are
 * derived.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class DbUnitConnectionFactory {

    /**
     * Creates a DBUnit connection on top of an open JDBC connection.
     *
     * @param conn open JDBC connection (not closed by DBUnit until the caller closes it)
     * @param schema schema that holds the catalog tables
     * @return configured DBUnit connection
     * @throws DatabaseUnitException if DBUnit rejects the schema
     */
    public IDatabaseConnection create(Connection conn, String schema)
            throws DatabaseUnitException {
        DatabaseConnection dbConn = new DatabaseConnection(conn, schema);
        configure(dbConn.getConfig(), new PostgresqlDataTypeFactory());
        return dbConn;
    }

    /**
     * Applies extraction settings to a DBUnit configuration.
     *
     * @param cfg DBUnit {@link DatabaseConfig} object
     * @param dataTypeFactory vendor-specific {@link IDataTypeFactory} implementation
     */
    void configure(DatabaseConfig cfg, IDataTypeFactory dataTypeFactory) {
        cfg.setProperty(DatabaseConfig.PROPERTY_DATATYPE_FACTORY, dataTypeFactory);
        log.debug("DBUnit: DataTypeFactory set to {}", dataTypeFactory.getClass().getSimpleName());

        // Escape identifiers with double quotes
        cfg.setProperty(DatabaseConfig.PROPERTY_ESCAPE_PATTERN, "\"?\"");
        log.debug("DBUnit: escape pattern = \"?\"");

        // Empty strings are values, not missing cells
        cfg.setProperty(DatabaseConfig.FEATURE_ALLOW_EMPTY_FIELDS, true);
        log.debug("DBUnit: allow empty fields = true");
    }
}
