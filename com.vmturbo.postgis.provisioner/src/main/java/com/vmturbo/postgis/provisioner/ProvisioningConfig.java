package com.vmturbo.postgis.provisioner;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import com.vmturbo.postgis.provisioner.ProvisioningException.InvalidConfigException;

/**
 * Immutable, fully resolved description of a database to be provisioned.
 *
 * <p>Instances are created with a {@link Builder}, normally by {@link ProvisioningConfigResolver}.
 * Properties left unset in the builder take the defaults declared here; in particular the
 * superuser credentials default to the owner's, and the extension list defaults to
 * {@code postgis}.</p>
 */
public class ProvisioningConfig {

    /** default value for host name. */
    public static final String DEFAULT_HOST = "localhost";
    /** default port for PostgreSQL. */
    public static final int DEFAULT_PORT = 5432;
    /** default database used for admin connections. */
    public static final String DEFAULT_ROOT_DATABASE_NAME = "postgres";
    /** default database encoding. */
    public static final String DEFAULT_ENCODING = "utf8";
    /** default extensions installed in a new database. */
    public static final List<String> DEFAULT_EXTENSIONS = ImmutableList.of("postgis");
    /** default connect timeout. */
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    /** default statement timeout. */
    public static final Duration DEFAULT_STATEMENT_TIMEOUT = Duration.ofSeconds(60);
    /** default pg_dump executable, resolved through PATH. */
    public static final String DEFAULT_PG_DUMP_PATH = "pg_dump";
    /** default psql executable, resolved through PATH. */
    public static final String DEFAULT_PSQL_PATH = "psql";

    private final String host;
    private final int port;
    private final String databaseName;
    private final String ownerUserName;
    private final String ownerPassword;
    private final String superUserName;
    private final String superUserPassword;
    private final String rootDatabaseName;
    private final String encoding;
    private final String template;
    private final String collation;
    private final String ctype;
    private final String tablespace;
    private final Integer connectionLimit;
    private final List<String> schemaSearchPath;
    private final List<String> extensions;
    private final String extensionSchema;
    private final Duration connectTimeout;
    private final Duration statementTimeout;
    private final Map<String, String> driverProperties;
    private final boolean restrictDumpToSearchPath;
    private final String pgDumpPath;
    private final String psqlPath;

    private ProvisioningConfig(Builder builder) {
        this.host = Strings.isNullOrEmpty(builder.host) ? DEFAULT_HOST : builder.host;
        this.port = builder.port != null ? builder.port : DEFAULT_PORT;
        this.databaseName = builder.databaseName;
        this.ownerUserName = builder.ownerUserName;
        this.ownerPassword = builder.ownerPassword;
        this.superUserName = Strings.isNullOrEmpty(builder.superUserName)
                ? builder.ownerUserName : builder.superUserName;
        this.superUserPassword = builder.superUserPassword != null
                ? builder.superUserPassword : builder.ownerPassword;
        this.rootDatabaseName = Strings.isNullOrEmpty(builder.rootDatabaseName)
                ? DEFAULT_ROOT_DATABASE_NAME : builder.rootDatabaseName;
        this.encoding = Strings.isNullOrEmpty(builder.encoding)
                ? DEFAULT_ENCODING : builder.encoding;
        this.template = Strings.emptyToNull(builder.template);
        this.collation = Strings.emptyToNull(builder.collation);
        this.ctype = Strings.emptyToNull(builder.ctype);
        this.tablespace = Strings.emptyToNull(builder.tablespace);
        this.connectionLimit = builder.connectionLimit;
        this.schemaSearchPath = ImmutableList.copyOf(builder.schemaSearchPath);
        this.extensions = builder.extensions != null
                ? ImmutableList.copyOf(builder.extensions) : DEFAULT_EXTENSIONS;
        this.extensionSchema = Strings.emptyToNull(builder.extensionSchema);
        this.connectTimeout = builder.connectTimeout != null
                ? builder.connectTimeout : DEFAULT_CONNECT_TIMEOUT;
        this.statementTimeout = builder.statementTimeout != null
                ? builder.statementTimeout : DEFAULT_STATEMENT_TIMEOUT;
        this.driverProperties = ImmutableMap.copyOf(builder.driverProperties);
        this.restrictDumpToSearchPath = builder.restrictDumpToSearchPath;
        this.pgDumpPath = Strings.isNullOrEmpty(builder.pgDumpPath)
                ? DEFAULT_PG_DUMP_PATH : builder.pgDumpPath;
        this.psqlPath = Strings.isNullOrEmpty(builder.psqlPath)
                ? DEFAULT_PSQL_PATH : builder.psqlPath;
    }

    /**
     * Create a new builder.
     *
     * @return new builder
     */
    public static Builder newBuilder() {
        return new Builder();
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public String getDatabaseName() {
        return databaseName;
    }

    @Nullable
    public String getOwnerUserName() {
        return ownerUserName;
    }

    @Nullable
    public String getOwnerPassword() {
        return ownerPassword;
    }

    @Nullable
    public String getSuperUserName() {
        return superUserName;
    }

    @Nullable
    public String getSuperUserPassword() {
        return superUserPassword;
    }

    /**
     * Check whether creation is performed by a login other than the database owner, in which
     * case ownership of the new database must be handed to the owner explicitly.
     *
     * @return true if the superuser and owner logins differ
     */
    public boolean hasDistinctSuperUser() {
        return ownerUserName != null && !Objects.equals(superUserName, ownerUserName);
    }

    public String getRootDatabaseName() {
        return rootDatabaseName;
    }

    public String getEncoding() {
        return encoding;
    }

    public Optional<String> getTemplate() {
        return Optional.ofNullable(template);
    }

    public Optional<String> getCollation() {
        return Optional.ofNullable(collation);
    }

    public Optional<String> getCtype() {
        return Optional.ofNullable(ctype);
    }

    public Optional<String> getTablespace() {
        return Optional.ofNullable(tablespace);
    }

    public Optional<Integer> getConnectionLimit() {
        return Optional.ofNullable(connectionLimit);
    }

    public List<String> getSchemaSearchPath() {
        return schemaSearchPath;
    }

    public List<String> getExtensions() {
        return extensions;
    }

    public Optional<String> getExtensionSchema() {
        return Optional.ofNullable(extensionSchema);
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public Duration getStatementTimeout() {
        return statementTimeout;
    }

    public Map<String, String> getDriverProperties() {
        return driverProperties;
    }

    /**
     * Whether structure dumps should be restricted to the schemas in the search path.
     *
     * @return true to pass one {@code --schema} option per search path entry to pg_dump
     */
    public boolean isRestrictDumpToSearchPath() {
        return restrictDumpToSearchPath;
    }

    public String getPgDumpPath() {
        return pgDumpPath;
    }

    public String getPsqlPath() {
        return psqlPath;
    }

    @Override
    public String toString() {
        return String.format("ProvisioningConfig[url=jdbc:postgresql://%s:%s/%s; owner=%s; su=%s]",
                host, port, databaseName != null ? databaseName : "?",
                ownerUserName != null ? ownerUserName : "?",
                superUserName != null ? superUserName : "?");
    }

    /**
     * Builder for {@link ProvisioningConfig}.
     */
    public static class Builder {
        private String host;
        private Integer port;
        private String databaseName;
        private String ownerUserName;
        private String ownerPassword;
        private String superUserName;
        private String superUserPassword;
        private String rootDatabaseName;
        private String encoding;
        private String template;
        private String collation;
        private String ctype;
        private String tablespace;
        private Integer connectionLimit;
        private List<String> schemaSearchPath = ImmutableList.of();
        private List<String> extensions;
        private String extensionSchema;
        private Duration connectTimeout;
        private Duration statementTimeout;
        private Map<String, String> driverProperties = ImmutableMap.of();
        private boolean restrictDumpToSearchPath;
        private String pgDumpPath;
        private String psqlPath;

        private Builder() {
        }

        /**
         * Specify the database server host.
         *
         * @param host host name
         * @return this builder
         */
        public Builder withHost(@Nullable String host) {
            this.host = host;
            return this;
        }

        /**
         * Specify the database server port.
         *
         * @param port port number
         * @return this builder
         */
        public Builder withPort(@Nullable Integer port) {
            this.port = port;
            return this;
        }

        /**
         * Specify the name of the database to provision.
         *
         * @param databaseName database name
         * @return this builder
         */
        public Builder withDatabaseName(@Nullable String databaseName) {
            this.databaseName = databaseName;
            return this;
        }

        /**
         * Specify the login that will own the database.
         *
         * @param userName owner login
         * @param password owner password
         * @return this builder
         */
        public Builder withOwner(@Nullable String userName, @Nullable String password) {
            this.ownerUserName = userName;
            this.ownerPassword = password;
            return this;
        }

        /**
         * Specify the privileged login used for database creation and extension setup.
         *
         * @param userName superuser login, or null to use the owner's
         * @param password superuser password, or null to use the owner's
         * @return this builder
         */
        public Builder withSuperUser(@Nullable String userName, @Nullable String password) {
            this.superUserName = userName;
            this.superUserPassword = password;
            return this;
        }

        /**
         * Specify the database that admin connections are made to.
         *
         * @param rootDatabaseName admin database name
         * @return this builder
         */
        public Builder withRootDatabaseName(@Nullable String rootDatabaseName) {
            this.rootDatabaseName = rootDatabaseName;
            return this;
        }

        /**
         * Specify the encoding of the new database.
         *
         * @param encoding encoding name
         * @return this builder
         */
        public Builder withEncoding(@Nullable String encoding) {
            this.encoding = encoding;
            return this;
        }

        /**
         * Specify the template database for the new database.
         *
         * @param template template database name
         * @return this builder
         */
        public Builder withTemplate(@Nullable String template) {
            this.template = template;
            return this;
        }

        /**
         * Specify LC_COLLATE for the new database.
         *
         * @param collation collation name
         * @return this builder
         */
        public Builder withCollation(@Nullable String collation) {
            this.collation = collation;
            return this;
        }

        /**
         * Specify LC_CTYPE for the new database.
         *
         * @param ctype character classification locale
         * @return this builder
         */
        public Builder withCtype(@Nullable String ctype) {
            this.ctype = ctype;
            return this;
        }

        /**
         * Specify the tablespace of the new database.
         *
         * @param tablespace tablespace name
         * @return this builder
         */
        public Builder withTablespace(@Nullable String tablespace) {
            this.tablespace = tablespace;
            return this;
        }

        /**
         * Specify the connection limit of the new database.
         *
         * @param connectionLimit maximum concurrent connections, -1 for no limit
         * @return this builder
         */
        public Builder withConnectionLimit(@Nullable Integer connectionLimit) {
            this.connectionLimit = connectionLimit;
            return this;
        }

        /**
         * Specify the schema search path.
         *
         * @param schemaSearchPath schema names, in lookup order
         * @return this builder
         */
        public Builder withSchemaSearchPath(@Nonnull List<String> schemaSearchPath) {
            this.schemaSearchPath = Objects.requireNonNull(schemaSearchPath);
            return this;
        }

        /**
         * Specify the extensions to install, in installation order.
         *
         * @param extensions extension names, or null for the default list
         * @return this builder
         */
        public Builder withExtensions(@Nullable List<String> extensions) {
            this.extensions = extensions;
            return this;
        }

        /**
         * Specify the schema into which extensions are installed.
         *
         * @param extensionSchema schema name, or null for the server default
         * @return this builder
         */
        public Builder withExtensionSchema(@Nullable String extensionSchema) {
            this.extensionSchema = extensionSchema;
            return this;
        }

        /**
         * Specify the connect timeout.
         *
         * @param connectTimeout timeout
         * @return this builder
         */
        public Builder withConnectTimeout(@Nullable Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        /**
         * Specify the statement timeout.
         *
         * @param statementTimeout timeout
         * @return this builder
         */
        public Builder withStatementTimeout(@Nullable Duration statementTimeout) {
            this.statementTimeout = statementTimeout;
            return this;
        }

        /**
         * Specify additional JDBC driver properties, added to connection URLs.
         *
         * @param driverProperties driver properties
         * @return this builder
         */
        public Builder withDriverProperties(@Nonnull Map<String, String> driverProperties) {
            this.driverProperties = Objects.requireNonNull(driverProperties);
            return this;
        }

        /**
         * Specify whether structure dumps are restricted to the search path schemas.
         *
         * @param restrict true to restrict
         * @return this builder
         */
        public Builder withRestrictDumpToSearchPath(boolean restrict) {
            this.restrictDumpToSearchPath = restrict;
            return this;
        }

        /**
         * Specify the locations of the PostgreSQL client tools used for structure dumps.
         *
         * @param pgDumpPath pg_dump executable, or null for the default
         * @param psqlPath   psql executable, or null for the default
         * @return this builder
         */
        public Builder withClientTools(@Nullable String pgDumpPath, @Nullable String psqlPath) {
            this.pgDumpPath = pgDumpPath;
            this.psqlPath = psqlPath;
            return this;
        }

        /**
         * Build the config.
         *
         * @return new config
         * @throws InvalidConfigException if the database name is missing
         */
        public ProvisioningConfig build() throws InvalidConfigException {
            if (Strings.isNullOrEmpty(databaseName)) {
                throw new InvalidConfigException("No database name configured");
            }
            if (port != null && (port <= 0 || port > 65535)) {
                throw new InvalidConfigException("Invalid port: " + port);
            }
            return new ProvisioningConfig(this);
        }
    }
}
