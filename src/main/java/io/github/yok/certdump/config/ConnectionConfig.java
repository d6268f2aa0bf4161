package io.github.yok.certdump.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Connection settings of the source database, loaded from {@code application.yml}.
 *
 * <pre>
 * connection:
 *   url: jdbc:postgresql://localhost:5432/juridico
 *   user: postgres
 *   password: postgres
 *   driver-class: org.postgresql.Driver
 *   schema: public
 * </pre>
 *
 * <p>
 * The same connection serves extraction and the audit log.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "connection")
@Data
public class ConnectionConfig {

    // JDBC connection URL
    private String url;
    // Database user name
    private String user;
    // Database password
    private String password;
    // Fully qualified JDBC driver class name
    private String driverClass = "org.postgresql.Driver";
    // Schema that holds the catalog tables
    private String schema = "public";
}
