package io.github.yok.nntpchan.datasource;

import io.github.yok.nntpchan.settings.FrontendSettings;
import java.util.Objects;
import javax.sql.DataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.stereotype.Component;

/**
 * Creates the {@link DataSource} the front-end reads its board index from.
 *
 * <p>
 * The data source is built from the JDBC URL, driver class and credentials in
 * {@link FrontendSettings}. No connection is opened here; the JDBC driver itself is loaded on the
 * first {@link DataSource#getConnection()} call.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class FrontendDataSourceFactory {

    /**
     * Creates a data source for the configured database.
     *
     * @param settings assembled settings
     * @return unpooled data source
     * @throws NullPointerException if {@code settings} is {@code null}
     */
    public DataSource create(FrontendSettings settings) {
        Objects.requireNonNull(settings, "settings");

        DriverManagerDataSource dataSource = new DriverManagerDataSource(settings.getJdbcUrl());
        dataSource.setUsername(settings.getDatabaseUser());
        dataSource.setPassword(settings.getDatabasePassword());

        log.info("DataSource created: engine={}, url={}, driverClass={}",
                settings.getDatabaseEngine(), settings.getJdbcUrl(),
                settings.getDatabaseEngine().getDriverClass());
        return dataSource;
    }
}
