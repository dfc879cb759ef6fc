package io.github.yok.nntpchan.config;

import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that binds the {@code database} section of {@code application.yml}.
 *
 * <pre>
 * database:
 *   engine: POSTGRESQL
 *   host: /var/run/postgresql
 *   name: postgres
 * </pre>
 *
 * <p>
 * A {@code host} beginning with {@code /} is a unix socket directory rather than a network host.
 * Host, name and user are trimmed when bound.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "database")
@Data
public class DatabaseConfig {

    // Socket file factory used by the PostgreSQL driver for unix domain sockets
    static final String UNIX_SOCKET_FACTORY =
            "org.newsclub.net.unix.AFUNIXSocketFactory$FactoryArg";

    /**
     * Database product.
     */
    private DatabaseEngine engine = DatabaseEngine.POSTGRESQL;

    /**
     * Network host name, or the directory holding the server's unix socket.
     */
    private String host = "/var/run/postgresql";

    /**
     * TCP port; {@code null} means the engine's default port.
     */
    private Integer port;

    /**
     * Database name (service name for Oracle).
     */
    private String name = "postgres";

    // Login user; null lets the driver use its own default (peer authentication on sockets)
    private String user;

    // Login password
    private String password;

    public void setHost(String host) {
        this.host = StringUtils.trim(host);
    }

    public void setName(String name) {
        this.name = StringUtils.trim(name);
    }

    public void setUser(String user) {
        this.user = StringUtils.trim(user);
    }

    /**
     * Returns whether {@link #host} points at a unix socket directory.
     *
     * @return {@code true} when the host is an absolute filesystem path
     */
    public boolean isUnixSocket() {
        return host != null && host.startsWith("/");
    }

    /**
     * Returns the configured port or the engine's default port.
     *
     * @return effective TCP port
     * @throws IllegalStateException if no engine is configured
     */
    public int effectivePort() {
        if (port != null) {
            return port;
        }
        if (engine == null) {
            throw new IllegalStateException(
                    "database.engine is not configured. Please set 'database.engine'.");
        }
        return engine.getDefaultPort();
    }

    /**
     * Builds the JDBC URL for the configured engine.
     *
     * <p>
     * For PostgreSQL with a socket directory the URL routes through junixsocket and targets
     * {@code {host}/.s.PGSQL.{port}}, the socket file name the server creates.
     * </p>
     *
     * @return JDBC connection URL
     * @throws IllegalStateException if the engine, host or name is missing, or a socket
     *         directory is used with an engine other than PostgreSQL
     */
    public String toJdbcUrl() {
        if (engine == null) {
            throw new IllegalStateException(
                    "database.engine is not configured. Please set 'database.engine'.");
        }
        if (StringUtils.isBlank(host)) {
            throw new IllegalStateException(
                    "database.host is not configured. Please set 'database.host'.");
        }
        if (StringUtils.isBlank(name)) {
            throw new IllegalStateException(
                    "database.name is not configured. Please set 'database.name'.");
        }
        int effectivePort = effectivePort();
        if (isUnixSocket()) {
            if (engine != DatabaseEngine.POSTGRESQL) {
                throw new IllegalStateException(
                        "Unix socket hosts are only supported for POSTGRESQL, not " + engine);
            }
            String dir = host.endsWith("/") ? host.substring(0, host.length() - 1) : host;
            return "jdbc:postgresql://localhost/" + name + "?socketFactory=" + UNIX_SOCKET_FACTORY
                    + "&socketFactoryArg=" + dir + "/.s.PGSQL." + effectivePort;
        }
        switch (engine) {
            case POSTGRESQL:
                return "jdbc:postgresql://" + host + ":" + effectivePort + "/" + name;
            case MYSQL:
                return "jdbc:mysql://" + host + ":" + effectivePort + "/" + name;
            case SQLSERVER:
                return "jdbc:sqlserver://" + host + ":" + effectivePort + ";databaseName=" + name;
            case ORACLE:
                return "jdbc:oracle:thin:@//" + host + ":" + effectivePort + "/" + name;
            default:
                throw new IllegalStateException("Unsupported database engine: " + engine);
        }
    }
}
