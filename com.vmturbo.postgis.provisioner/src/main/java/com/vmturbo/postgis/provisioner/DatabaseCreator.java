package com.vmturbo.postgis.provisioner;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.regex.Pattern;

import javax.annotation.Nonnull;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.vmturbo.postgis.provisioner.ProvisioningException.SqlExecutionException;

/**
 * Creates and drops databases over an administrative connection.
 */
public class DatabaseCreator {
    private static final Logger logger = LogManager.getLogger();

    /** SQLSTATE reported by PostgreSQL for {@code duplicate_database}. */
    public static final String DUPLICATE_DATABASE_SQLSTATE = "42P04";

    private static final Pattern ALREADY_EXISTS_PATTERN =
            Pattern.compile("database .* already exists");

    private final SqlExecutor executor;

    /**
     * Create a new instance.
     *
     * @param executor statement executor
     */
    public DatabaseCreator(@Nonnull SqlExecutor executor) {
        this.executor = executor;
    }

    /**
     * Create the configured database.
     *
     * <p>Creation of a database that already exists is not an error: it is reported as
     * {@link ProvisioningResult.Outcome#ALREADY_EXISTS}. Any other server error is reported as a
     * failed result carrying the server's message.</p>
     *
     * @param adminConnection connection to the administrative database
     * @param config          provisioning config
     * @return outcome of the attempt
     */
    public ProvisioningResult createDatabase(@Nonnull Connection adminConnection,
            @Nonnull ProvisioningConfig config) {
        final String databaseName = config.getDatabaseName();
        try {
            executor.execute(adminConnection, SqlStatements.createDatabase(config));
            logger.info("Created database {}", databaseName);
            return ProvisioningResult.created(databaseName);
        } catch (SQLException e) {
            if (isAlreadyExists(e)) {
                logger.info("Database {} already exists", databaseName);
                return ProvisioningResult.alreadyExists(databaseName);
            }
            logger.error("Failed to create database {}: {}", databaseName, e.getMessage());
            return ProvisioningResult.failed(databaseName, String.valueOf(e.getMessage()));
        }
    }

    /**
     * Drop the configured database, if it exists.
     *
     * @param adminConnection connection to the administrative database
     * @param config          provisioning config
     * @throws SqlExecutionException if the server rejects the drop
     */
    public void dropDatabase(@Nonnull Connection adminConnection,
            @Nonnull ProvisioningConfig config) throws SqlExecutionException {
        final String sql = SqlStatements.dropDatabase(config.getDatabaseName());
        try {
            executor.execute(adminConnection, sql);
        } catch (SQLException e) {
            throw new SqlExecutionException(sql, e);
        }
        logger.info("Dropped database {}", config.getDatabaseName());
    }

    private static boolean isAlreadyExists(SQLException e) {
        return DUPLICATE_DATABASE_SQLSTATE.equals(e.getSQLState())
                || (e.getMessage() != null
                        && ALREADY_EXISTS_PATTERN.matcher(e.getMessage()).find());
    }
}
