package com.vmturbo.postgis.provisioner;

import javax.annotation.Nonnull;

/**
 * Configuration properties understood by {@link ProvisioningConfigResolver}.
 *
 * <p>Each property has a key in each of the two supported configuration layouts: the legacy flat
 * record, which uses snake-case keys, and the endpoint record, which uses camel-case names.</p>
 */
public enum ProvisioningProperty {

    /** database server host. */
    HOST("host", "host"),
    /** database server port. */
    PORT("port", "port"),
    /** name of database to provision. */
    DATABASE_NAME("database", "databaseName"),
    /** login that will own the database. */
    USER_NAME("username", "userName"),
    /** owner password. */
    PASSWORD("password", "password"),
    /** privileged login used for creation and extension setup. */
    SU_USER_NAME("su_username", "rootUserName"),
    /** privileged login password. */
    SU_PASSWORD("su_password", "rootPassword"),
    /** database used for admin connections. */
    ROOT_DATABASE_NAME("root_database", "rootDatabaseName"),
    /** encoding of new database. */
    ENCODING("encoding", "encoding"),
    /** template of new database. */
    TEMPLATE("template", "template"),
    /** LC_COLLATE of new database. */
    COLLATION("collation", "collation"),
    /** LC_CTYPE of new database. */
    CTYPE("ctype", "ctype"),
    /** tablespace of new database. */
    TABLESPACE("tablespace", "tablespace"),
    /** connection limit of new database. */
    CONNECTION_LIMIT("connection_limit", "connectionLimit"),
    /** comma-separated schema search path. */
    SCHEMA_SEARCH_PATH("schema_search_path", "schemaSearchPath"),
    /** extensions to install, as a comma-separated string or a list. */
    EXTENSIONS("postgis_extension", "extensions"),
    /** schema into which extensions are installed. */
    EXTENSION_SCHEMA("postgis_schema", "extensionSchema"),
    /** connect timeout, in seconds. */
    CONNECT_TIMEOUT("connect_timeout", "connectTimeoutSecs"),
    /** statement timeout, in seconds. */
    STATEMENT_TIMEOUT("statement_timeout", "statementTimeoutSecs"),
    /** additional JDBC driver properties, as a map. */
    DRIVER_PROPERTIES("driver_properties", "driverProperties"),
    /** which schemas structure dumps include: {@code schema_search_path} or {@code all}. */
    DUMP_SCHEMAS("dump_schemas", "dumpSchemas"),
    /** location of the pg_dump executable. */
    PG_DUMP_PATH("pg_dump_path", "pgDumpPath"),
    /** location of the psql executable. */
    PSQL_PATH("psql_path", "psqlPath");

    private final String legacyKey;
    private final String endpointKey;

    ProvisioningProperty(String legacyKey, String endpointKey) {
        this.legacyKey = legacyKey;
        this.endpointKey = endpointKey;
    }

    /**
     * Key of this property in a legacy flat configuration record.
     *
     * @return legacy key
     */
    @Nonnull
    public String getLegacyKey() {
        return legacyKey;
    }

    /**
     * Name of this property in an endpoint configuration record.
     *
     * @return endpoint property name
     */
    @Nonnull
    public String getEndpointKey() {
        return endpointKey;
    }
}
