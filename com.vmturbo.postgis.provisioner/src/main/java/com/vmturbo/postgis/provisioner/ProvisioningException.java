package com.vmturbo.postgis.provisioner;

import java.sql.SQLException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Checked exception to be thrown from provisioning operations.
 *
 * <p>Specific failure classes are declared as nested subclasses, so callers can either handle
 * them individually or catch this class for all of them.</p>
 */
public class ProvisioningException extends Exception {

    /**
     * Constructs exception with message and root cause.
     *
     * @param message exception message
     * @param cause exception cause
     */
    public ProvisioningException(@Nonnull String message, @Nullable Throwable cause) {
        super(message, cause);
    }

    /**
     * Constructs exception with message.
     *
     * @param message exception message
     */
    public ProvisioningException(@Nonnull String message) {
        super(message);
    }

    /**
     * Configuration is missing a required property or has an unusable value.
     */
    public static class InvalidConfigException extends ProvisioningException {
        /**
         * Create a new instance.
         *
         * @param message description of the problem
         */
        public InvalidConfigException(@Nonnull String message) {
            super(message);
        }

        /**
         * Create a new instance.
         *
         * @param message description of the problem
         * @param cause   underlying parse failure
         */
        public InvalidConfigException(@Nonnull String message, @Nullable Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * A connection to the database server could not be established, because of a network,
     * authentication or timeout failure.
     *
     * <p>The cause never carries the driver's original message, since that may include
     * credentials; only its SQLSTATE and vendor code are retained.</p>
     */
    public static class ConnectionException extends ProvisioningException {
        /**
         * Create a new instance.
         *
         * @param message description of the failed connection, without credentials
         * @param cause   sanitized copy of the driver exception
         */
        public ConnectionException(@Nonnull String message, @Nullable SQLException cause) {
            super(message, cause);
        }

        /**
         * Get the SQLSTATE reported by the driver, if any.
         *
         * @return SQLSTATE or null
         */
        @Nullable
        public String getSqlState() {
            return getCause() instanceof SQLException ? ((SQLException)getCause()).getSQLState()
                    : null;
        }
    }

    /**
     * The database to be created already exists.
     *
     * <p>This is recoverable; most callers treat it the same as a successful creation.</p>
     */
    public static class DatabaseAlreadyExistsException extends ProvisioningException {
        /**
         * Create a new instance.
         *
         * @param databaseName name of the existing database
         */
        public DatabaseAlreadyExistsException(@Nonnull String databaseName) {
            super(String.format("Database %s already exists", databaseName));
        }
    }

    /**
     * An extension requires a schema that is missing from the configured search path.
     */
    public static class SchemaSearchPathException extends ProvisioningException {
        /**
         * Create a new instance.
         *
         * @param extensionName extension that needs the schema
         * @param schemaName    schema missing from the search path
         */
        public SchemaSearchPathException(@Nonnull String extensionName,
                @Nonnull String schemaName) {
            super(String.format("'%s' must be in schema_search_path for %s",
                    schemaName, extensionName));
        }
    }

    /**
     * The server rejected a statement, or an external tool acting on the database failed.
     */
    public static class SqlExecutionException extends ProvisioningException {
        /**
         * Create a new instance wrapping a server error; the server message is preserved.
         *
         * @param sql   statement that failed
         * @param cause server error
         */
        public SqlExecutionException(@Nonnull String sql, @Nonnull SQLException cause) {
            super(String.format("Failed to execute `%s`: %s", sql, cause.getMessage()), cause);
        }

        /**
         * Create a new instance with a message.
         *
         * @param message description of the failure
         */
        public SqlExecutionException(@Nonnull String message) {
            super(message);
        }
    }
}
