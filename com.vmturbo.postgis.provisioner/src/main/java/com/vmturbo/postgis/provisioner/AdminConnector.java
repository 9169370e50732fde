package com.vmturbo.postgis.provisioner;

import java.sql.Connection;
import java.sql.SQLException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.sql.DataSource;

import com.google.common.base.Strings;
import com.google.common.escape.Escaper;
import com.google.common.net.UrlEscapers;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.postgresql.ds.PGSimpleDataSource;
import org.springframework.web.util.UriComponentsBuilder;

import com.vmturbo.postgis.provisioner.ProvisioningException.ConnectionException;

/**
 * Opens connections to the database server using the superuser credentials of a
 * {@link ProvisioningConfig}.
 *
 * <p>Every connection is new and owned by the caller, who must close it. There are no retries: a
 * failed attempt is reported immediately as a {@link ConnectionException}.</p>
 */
public class AdminConnector {
    private static final Logger logger = LogManager.getLogger();

    private static final String JDBC_SCHEME = "jdbc:postgresql";
    private static final String PUBLIC_SCHEMA = "public";
    /** matches the driver's decoding of the URL path and query values. */
    private static final Escaper URL_VALUE_ESCAPER = UrlEscapers.urlFormParameterEscaper();

    /**
     * Connect to the administrative database, from which databases are created and dropped.
     *
     * @param config provisioning config
     * @return new connection
     * @throws ConnectionException if the connection cannot be established
     */
    public Connection connectAsAdmin(@Nonnull ProvisioningConfig config)
            throws ConnectionException {
        return connect(config, config.getRootDatabaseName());
    }

    /**
     * Connect to the database being provisioned, for extension setup.
     *
     * @param config provisioning config
     * @return new connection
     * @throws ConnectionException if the connection cannot be established
     */
    public Connection connectToTarget(@Nonnull ProvisioningConfig config)
            throws ConnectionException {
        return connect(config, config.getDatabaseName());
    }

    private Connection connect(ProvisioningConfig config, String database)
            throws ConnectionException {
        final String url = getUrl(config, database);
        final String user = config.getSuperUserName();
        logger.debug("Connecting to {} as {}", url, user);
        try {
            final DataSource dataSource = createDataSource(url, user,
                    config.getSuperUserPassword(),
                    (int)config.getConnectTimeout().getSeconds());
            return dataSource.getConnection();
        } catch (SQLException e) {
            final String msg = String.format("Failed to connect to %s as %s (SQLSTATE %s)",
                    url, user, e.getSQLState());
            throw new ConnectionException(msg, copySQLExceptionWithoutStack(msg, e));
        } catch (IllegalArgumentException e) {
            throw new ConnectionException(String.format("Invalid connection URL %s: %s",
                    url, e.getMessage()), null);
        }
    }

    /**
     * Create a data source for the given connection parameters.
     *
     * @param url               connection URL
     * @param user              login name
     * @param password          login password
     * @param connectTimeoutSecs connect timeout in seconds, zero for none
     * @return new data source
     * @throws SQLException if the data source cannot be configured
     */
    protected DataSource createDataSource(@Nonnull String url, @Nullable String user,
            @Nullable String password, int connectTimeoutSecs) throws SQLException {
        final PGSimpleDataSource dataSource = new PGSimpleDataSource();
        dataSource.setUrl(url);
        dataSource.setUser(user);
        dataSource.setPassword(password);
        dataSource.setCurrentSchema(PUBLIC_SCHEMA);
        dataSource.setConnectTimeout(connectTimeoutSecs);
        dataSource.setLoginTimeout(connectTimeoutSecs);
        return dataSource;
    }

    /**
     * Get a connection URL for the configured server and the given database. Credentials never
     * appear in the URL.
     *
     * <p>The database name and driver property values are percent-encoded, so that any name
     * accepted by {@code CREATE DATABASE} reaches the driver unchanged.</p>
     *
     * @param config   provisioning config
     * @param database database to connect to
     * @return connection URL
     */
    public static String getUrl(@Nonnull ProvisioningConfig config, @Nonnull String database) {
        final UriComponentsBuilder builder = UriComponentsBuilder.newInstance()
                .scheme(JDBC_SCHEME)
                .host(config.getHost())
                .port(config.getPort())
                .path("/" + URL_VALUE_ESCAPER.escape(Strings.nullToEmpty(database)));
        config.getDriverProperties().forEach((name, value) ->
                builder.queryParam(name, URL_VALUE_ESCAPER.escape(value)));
        return builder.build().toUriString();
    }

    /**
     * Create a copy of a driver exception that keeps only its SQLSTATE and vendor code.
     *
     * @param msg message for the copy
     * @param e   original exception
     * @return sanitized copy
     */
    static SQLException copySQLExceptionWithoutStack(String msg, SQLException e) {
        return new SQLException(msg, e.getSQLState(), e.getErrorCode());
    }
}
