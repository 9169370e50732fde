package com.vmturbo.postgis.provisioner;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;

import javax.annotation.Nonnull;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.vmturbo.postgis.provisioner.ProvisioningException.ConnectionException;
import com.vmturbo.postgis.provisioner.ProvisioningException.SqlExecutionException;
import com.vmturbo.postgis.provisioner.dump.OsCommandRunner;
import com.vmturbo.postgis.provisioner.dump.StructureDumper;

/**
 * Entry point for provisioning operations on a PostGIS database.
 *
 * <p>Database creation proceeds through the states in {@link State}:</p>
 *
 * <pre>
 * START -> ADMIN_CONNECTED -> DATABASE_CREATED | DATABASE_EXISTS
 *       -> TARGET_CONNECTED -> EXTENSIONS_INSTALLED -> DONE
 * </pre>
 *
 * <p>A database that already exists still has its extensions installed, so re-running creation
 * against a partly provisioned database completes it. A failed creation stops before the target
 * database is connected.</p>
 *
 * <p>Instances hold no per-request state and may be shared between threads.</p>
 */
public class Provisioner {
    private static final Logger logger = LogManager.getLogger();

    /**
     * States of the database creation flow.
     */
    public enum State {
        /** Nothing done yet. */
        START,
        /** Connected to the administrative database. */
        ADMIN_CONNECTED,
        /** Database was created. */
        DATABASE_CREATED,
        /** Database was already present. */
        DATABASE_EXISTS,
        /** Connected to the new database. */
        TARGET_CONNECTED,
        /** Extensions are installed. */
        EXTENSIONS_INSTALLED,
        /** Provisioning completed. */
        DONE,
        /** Provisioning stopped on a failure. */
        FAILED
    }

    private final AdminConnector connector;
    private final StructureDumper structureDumper;

    /**
     * Create a new instance.
     *
     * @param connector       source of server connections
     * @param structureDumper runner of structure dumps and loads
     */
    public Provisioner(@Nonnull AdminConnector connector,
            @Nonnull StructureDumper structureDumper) {
        this.connector = connector;
        this.structureDumper = structureDumper;
    }

    /**
     * Create a new instance that connects with the PostgreSQL driver and runs the installed
     * client tools.
     */
    public Provisioner() {
        this(new AdminConnector(), new StructureDumper(new OsCommandRunner()));
    }

    /**
     * Create the configured database if needed, and install its extensions.
     *
     * @param config provisioning config
     * @return outcome of database creation; if it is {@code FAILED} no extensions were installed
     * @throws ProvisioningException if a connection fails or extension installation fails
     */
    public ProvisioningResult create(@Nonnull ProvisioningConfig config)
            throws ProvisioningException {
        final String db = config.getDatabaseName();
        final SqlExecutor executor = new SqlExecutor(config.getStatementTimeout());
        State state = State.START;
        final ProvisioningResult result;
        try {
            try (Connection admin = connector.connectAsAdmin(config)) {
                state = transition(db, state, State.ADMIN_CONNECTED);
                result = new DatabaseCreator(executor).createDatabase(admin, config);
            } catch (SQLException e) {
                throw closeFailure(config, e);
            }
            switch (result.getOutcome()) {
                case CREATED:
                    state = transition(db, state, State.DATABASE_CREATED);
                    break;
                case ALREADY_EXISTS:
                    state = transition(db, state, State.DATABASE_EXISTS);
                    break;
                default:
                    transition(db, state, State.FAILED);
                    return result;
            }
            state = installExtensions(config, executor, db, state);
            transition(db, state, State.DONE);
            return result;
        } catch (ProvisioningException | RuntimeException e) {
            if (state != State.FAILED) {
                transition(db, state, State.FAILED);
            }
            throw e;
        }
    }

    /**
     * Install the configured extensions into an existing database.
     *
     * @param config provisioning config
     * @throws ProvisioningException if the connection or installation fails
     */
    public void installExtensions(@Nonnull ProvisioningConfig config)
            throws ProvisioningException {
        installExtensions(config, new SqlExecutor(config.getStatementTimeout()),
                config.getDatabaseName(), State.START);
    }

    /**
     * Drop the configured database, if it exists.
     *
     * @param config provisioning config
     * @throws ProvisioningException if the connection or the drop fails
     */
    public void drop(@Nonnull ProvisioningConfig config) throws ProvisioningException {
        final DatabaseCreator creator =
                new DatabaseCreator(new SqlExecutor(config.getStatementTimeout()));
        try (Connection admin = connector.connectAsAdmin(config)) {
            creator.dropDatabase(admin, config);
        } catch (SQLException e) {
            throw closeFailure(config, e);
        }
    }

    /**
     * Dump the schema of the configured database.
     *
     * @param config     provisioning config
     * @param outputFile file to write
     * @throws ProvisioningException if the dump fails
     */
    public void structureDump(@Nonnull ProvisioningConfig config, @Nonnull Path outputFile)
            throws ProvisioningException {
        structureDumper.dump(config, outputFile);
    }

    /**
     * Load a schema file into the configured database.
     *
     * @param config    provisioning config
     * @param inputFile file to load
     * @throws ProvisioningException if the load fails
     */
    public void structureLoad(@Nonnull ProvisioningConfig config, @Nonnull Path inputFile)
            throws ProvisioningException {
        structureDumper.load(config, inputFile);
    }

    private State installExtensions(ProvisioningConfig config, SqlExecutor executor, String db,
            State state) throws ProvisioningException {
        final ExtensionInstaller installer = new ExtensionInstaller(executor);
        try (Connection target = connector.connectToTarget(config)) {
            state = transition(db, state, State.TARGET_CONNECTED);
            installer.installExtensions(target, config);
            state = transition(db, state, State.EXTENSIONS_INSTALLED);
            logInstalledExtensions(installer, target, db);
        } catch (SQLException e) {
            throw closeFailure(config, e);
        }
        return state;
    }

    private static void logInstalledExtensions(ExtensionInstaller installer, Connection target,
            String db) {
        try {
            logger.info("Extensions installed in {}: {}", db,
                    installer.installedExtensions(target));
        } catch (SqlExecutionException e) {
            logger.warn("Could not list extensions installed in {}", db, e);
        }
    }

    private static State transition(String db, State from, State to) {
        logger.info("Provisioning {}: {} -> {}", db, from, to);
        return to;
    }

    private static ConnectionException closeFailure(ProvisioningConfig config, SQLException e) {
        final String msg = String.format("Failed to close connection for database %s",
                config.getDatabaseName());
        return new ConnectionException(msg, AdminConnector.copySQLExceptionWithoutStack(msg, e));
    }
}
