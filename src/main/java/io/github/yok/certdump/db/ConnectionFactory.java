package io.github.yok.certdump.db;

import io.github.yok.certdump.config.ConnectionConfig;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Opens the JDBC connection shared by extraction and the audit log for one run.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class ConnectionFactory {

    /**
     * Loads the configured driver and opens a connection. The caller owns and closes it.
     *
     * @param config connection settings
     * @return open connection in auto-commit mode
     * @throws SQLException if the connection cannot be opened
     * @throws ClassNotFoundException if the driver class is not on the class path
     */
    public Connection open(ConnectionConfig config) throws SQLException, ClassNotFoundException {
        Class.forName(config.getDriverClass());
        log.info("Connecting to {} as {}", config.getUrl(), config.getUser());
        Connection conn = DriverManager.getConnection(config.getUrl(), config.getUser(),
                config.getPassword());
        conn.setAutoCommit(true);
        return conn;
    }
}
