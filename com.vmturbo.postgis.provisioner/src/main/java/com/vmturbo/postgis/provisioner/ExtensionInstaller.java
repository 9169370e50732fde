package com.vmturbo.postgis.provisioner;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Map;
import java.util.Optional;

import javax.annotation.Nonnull;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.vmturbo.postgis.provisioner.ProvisioningException.SchemaSearchPathException;
import com.vmturbo.postgis.provisioner.ProvisioningException.SqlExecutionException;

/**
 * Installs the configured extensions into a database.
 *
 * <p>Every statement issued is idempotent, so installing into a database that already has the
 * extensions changes nothing.</p>
 */
public class ExtensionInstaller {
    private static final Logger logger = LogManager.getLogger();

    private final SqlExecutor executor;

    /**
     * Create a new instance.
     *
     * @param executor statement executor
     */
    public ExtensionInstaller(@Nonnull SqlExecutor executor) {
        this.executor = executor;
    }

    /**
     * Install the configured extensions, in configured order.
     *
     * <p>Extensions that live in a fixed schema (e.g. {@code postgis_topology}) are installed
     * there, and that schema must be part of the search path; this is checked for all
     * extensions before anything is executed. Other extensions go into the configured extension
     * schema, which is created if needed, or else into the server default.</p>
     *
     * @param targetConnection superuser connection to the database being provisioned
     * @param config           provisioning config
     * @throws SchemaSearchPathException if a fixed schema is missing from the search path
     * @throws SqlExecutionException     if the server rejects a statement
     */
    public void installExtensions(@Nonnull Connection targetConnection,
            @Nonnull ProvisioningConfig config)
            throws SchemaSearchPathException, SqlExecutionException {
        checkSearchPath(config);
        for (String extension : config.getExtensions()) {
            final Optional<String> fixedSchema = PostgisExtensions.fixedSchemaOf(extension);
            if (fixedSchema.isPresent()) {
                execute(targetConnection,
                        SqlStatements.createExtensionInFixedSchema(extension, fixedSchema.get()));
            } else if (config.getExtensionSchema().isPresent()) {
                final String schema = config.getExtensionSchema().get();
                ensureSchema(targetConnection, schema);
                execute(targetConnection,
                        SqlStatements.createExtensionWithSchema(extension, schema));
            } else {
                execute(targetConnection, SqlStatements.createExtension(extension));
            }
        }
    }

    /**
     * List the extensions installed in a database.
     *
     * @param connection connection to the database
     * @return map of extension name to the schema it is installed in, ordered by name
     * @throws SqlExecutionException if the catalog query fails
     */
    public Map<String, String> installedExtensions(@Nonnull Connection connection)
            throws SqlExecutionException {
        try {
            return executor.queryPairs(connection, SqlStatements.installedExtensions());
        } catch (SQLException e) {
            throw new SqlExecutionException(
                    SqlStatements.render(SqlStatements.installedExtensions()), e);
        }
    }

    private void checkSearchPath(ProvisioningConfig config) throws SchemaSearchPathException {
        for (String extension : config.getExtensions()) {
            final Optional<String> fixedSchema = PostgisExtensions.fixedSchemaOf(extension);
            if (fixedSchema.isPresent()
                    && !config.getSchemaSearchPath().contains(fixedSchema.get())) {
                throw new SchemaSearchPathException(extension, fixedSchema.get());
            }
        }
    }

    private void ensureSchema(Connection conn, String schema) throws SqlExecutionException {
        final boolean exists;
        try {
            exists = executor.exists(conn, SqlStatements.schemaExists(schema));
        } catch (SQLException e) {
            throw new SqlExecutionException(
                    SqlStatements.render(SqlStatements.schemaExists(schema)), e);
        }
        if (exists) {
            logger.debug("Schema {} already exists", schema);
        } else {
            execute(conn, SqlStatements.createSchema(schema));
            execute(conn, SqlStatements.grantAllOnSchemaToPublic(schema));
        }
    }

    private void execute(Connection conn, String sql) throws SqlExecutionException {
        try {
            executor.execute(conn, sql);
        } catch (SQLException e) {
            throw new SqlExecutionException(sql, e);
        }
    }
}
