package io.github.yok.nntpchan.config;

/**
 * Enumerates the database products the front-end can be pointed at.
 *
 * <p>
 * Each constant carries the default TCP port of the product and the class name of its JDBC driver.
 * Drivers are not loaded explicitly; JDBC 4 service loading picks them up from the classpath.
 * </p>
 *
 * <ul>
 * <li>POSTGRESQL — the engine the front-end ships with</li>
 * <li>MYSQL — for MySQL / MariaDB</li>
 * <li>SQLSERVER — for Microsoft SQL Server</li>
 * <li>ORACLE — for Oracle Database</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public enum DatabaseEngine {
    // PostgreSQL; supports unix socket directories as host
    POSTGRESQL(5432, "org.postgresql.Driver"),
    // MySQL / MariaDB
    MYSQL(3306, "com.mysql.cj.jdbc.Driver"),
    // Microsoft SQL Server
    SQLSERVER(1433, "com.microsoft.sqlserver.jdbc.SQLServerDriver"),
    // Oracle Database (service name in DatabaseConfig#name)
    ORACLE(1521, "oracle.jdbc.OracleDriver");

    private final int defaultPort;
    private final String driverClass;

    DatabaseEngine(int defaultPort, String driverClass) {
        this.defaultPort = defaultPort;
        this.driverClass = driverClass;
    }

    /**
     * Returns the port the product listens on when none is configured.
     *
     * @return default TCP port
     */
    public int getDefaultPort() {
        return defaultPort;
    }

    /**
     * Returns the fully qualified JDBC driver class name.
     *
     * @return driver class name
     */
    public String getDriverClass() {
        return driverClass;
    }
}
