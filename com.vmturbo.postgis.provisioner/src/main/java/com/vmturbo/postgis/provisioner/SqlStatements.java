package com.vmturbo.postgis.provisioner;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import javax.annotation.Nonnull;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableSet;

import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Query;
import org.jooq.Record;
import org.jooq.SQLDialect;
import org.jooq.Table;
import org.jooq.impl.DSL;

/**
 * Builders for the statements issued during provisioning.
 *
 * <p>Identifiers are rendered the way PostgreSQL's {@code quote_ident} would render them: bare if
 * they are lower-case simple identifiers that are not reserved words, double-quoted otherwise
 * (with embedded quotes doubled). String values appear only as inline literals, and catalog
 * lookups use bind parameters.</p>
 */
public class SqlStatements {
    private SqlStatements() {}

    private static final DSLContext dsl = DSL.using(SQLDialect.POSTGRES);

    private static final Pattern SIMPLE_IDENTIFIER = Pattern.compile("[a-z_][a-z0-9_$]*");

    /** PostgreSQL reserved key words, which must always be quoted as identifiers. */
    private static final Set<String> RESERVED_WORDS = ImmutableSet.of(
            "all", "analyse", "analyze", "and", "any", "array", "as", "asc", "asymmetric",
            "authorization", "binary", "both", "case", "cast", "check", "collate", "collation",
            "column", "concurrently", "constraint", "create", "cross", "current_catalog",
            "current_date", "current_role", "current_schema", "current_time",
            "current_timestamp", "current_user", "default", "deferrable", "desc", "distinct",
            "do", "else", "end", "except", "false", "fetch", "for", "foreign", "freeze", "from",
            "full", "grant", "group", "having", "ilike", "in", "initially", "inner", "intersect",
            "into", "is", "isnull", "join", "lateral", "leading", "left", "like", "limit",
            "localtime", "localtimestamp", "natural", "not", "notnull", "null", "offset", "on",
            "only", "or", "order", "outer", "overlaps", "placing", "primary", "references",
            "returning", "right", "select", "session_user", "similar", "some", "symmetric",
            "system_user", "table", "tablesample", "then", "to", "trailing", "true", "union",
            "unique", "user", "using", "variadic", "verbose", "when", "where", "window", "with");

    // catalog objects
    private static final Table<Record> SCHEMATA =
            DSL.table(DSL.name("information_schema", "schemata"));
    private static final Field<String> SCHEMA_NAME =
            DSL.field(DSL.name("schema_name"), String.class);
    private static final Table<Record> PG_EXTENSION =
            DSL.table(DSL.name("pg_catalog", "pg_extension"));
    private static final Table<Record> PG_NAMESPACE =
            DSL.table(DSL.name("pg_catalog", "pg_namespace"));
    /** extension name column of extension listing query. */
    public static final Field<String> EXTNAME =
            DSL.field(DSL.name("pg_extension", "extname"), String.class);
    /** schema name column of extension listing query. */
    public static final Field<String> NSPNAME =
            DSL.field(DSL.name("pg_namespace", "nspname"), String.class);

    /**
     * Render an identifier.
     *
     * @param name identifier
     * @return identifier as it should appear in SQL
     */
    @Nonnull
    public static String identifier(@Nonnull String name) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(name), "Empty SQL identifier");
        final boolean bare = SIMPLE_IDENTIFIER.matcher(name).matches()
                && !RESERVED_WORDS.contains(name);
        return dsl.render(bare ? DSL.unquotedName(name) : DSL.quotedName(name));
    }

    /**
     * Render a string literal.
     *
     * @param value string value
     * @return quoted literal
     */
    @Nonnull
    public static String literal(@Nonnull String value) {
        return dsl.render(DSL.inline(value));
    }

    /**
     * Build a {@code CREATE DATABASE} statement for the given config.
     *
     * <p>The database owner is only specified when the database is created by a login other
     * than the owner.</p>
     *
     * @param config provisioning config
     * @return statement
     */
    @Nonnull
    public static String createDatabase(@Nonnull ProvisioningConfig config) {
        final StringBuilder sql = new StringBuilder("CREATE DATABASE ")
                .append(identifier(config.getDatabaseName()))
                .append(" ENCODING ").append(literal(config.getEncoding()));
        if (config.hasDistinctSuperUser()) {
            sql.append(" OWNER ").append(identifier(config.getOwnerUserName()));
        }
        config.getTemplate().ifPresent(t -> sql.append(" TEMPLATE ").append(identifier(t)));
        config.getCollation().ifPresent(c -> sql.append(" LC_COLLATE ").append(literal(c)));
        config.getCtype().ifPresent(c -> sql.append(" LC_CTYPE ").append(literal(c)));
        config.getTablespace().ifPresent(t -> sql.append(" TABLESPACE ").append(identifier(t)));
        config.getConnectionLimit().ifPresent(n -> sql.append(" CONNECTION LIMIT ").append(n));
        return sql.toString();
    }

    /**
     * Build a {@code DROP DATABASE IF EXISTS} statement.
     *
     * @param databaseName database name
     * @return statement
     */
    @Nonnull
    public static String dropDatabase(@Nonnull String databaseName) {
        return "DROP DATABASE IF EXISTS " + identifier(databaseName);
    }

    /**
     * Build a {@code CREATE SCHEMA} statement.
     *
     * @param schemaName schema name
     * @return statement
     */
    @Nonnull
    public static String createSchema(@Nonnull String schemaName) {
        return "CREATE SCHEMA " + identifier(schemaName);
    }

    /**
     * Build a statement granting all privileges on a schema to every role.
     *
     * @param schemaName schema name
     * @return statement
     */
    @Nonnull
    public static String grantAllOnSchemaToPublic(@Nonnull String schemaName) {
        return String.format("GRANT ALL ON SCHEMA %s TO PUBLIC", identifier(schemaName));
    }

    /**
     * Build a {@code CREATE EXTENSION} statement that installs into the server's default schema.
     *
     * @param extensionName extension name
     * @return statement
     */
    @Nonnull
    public static String createExtension(@Nonnull String extensionName) {
        return "CREATE EXTENSION IF NOT EXISTS " + identifier(extensionName);
    }

    /**
     * Build a {@code CREATE EXTENSION} statement that installs into a configured schema.
     *
     * @param extensionName extension name
     * @param schemaName    target schema
     * @return statement
     */
    @Nonnull
    public static String createExtensionWithSchema(@Nonnull String extensionName,
            @Nonnull String schemaName) {
        return String.format("%s WITH SCHEMA %s",
                createExtension(extensionName), identifier(schemaName));
    }

    /**
     * Build a {@code CREATE EXTENSION} statement for an extension whose schema is fixed by the
     * extension itself.
     *
     * @param extensionName extension name
     * @param schemaName    the extension's schema
     * @return statement
     */
    @Nonnull
    public static String createExtensionInFixedSchema(@Nonnull String extensionName,
            @Nonnull String schemaName) {
        return String.format("%s SCHEMA %s",
                createExtension(extensionName), identifier(schemaName));
    }

    /**
     * Build a query that yields a row if the given schema exists.
     *
     * @param schemaName schema name, passed as a bind value
     * @return query
     */
    @Nonnull
    public static Query schemaExists(@Nonnull String schemaName) {
        return dsl.selectOne().from(SCHEMATA).where(SCHEMA_NAME.eq(schemaName));
    }

    /**
     * Build a query listing installed extensions with the schemas they were installed into,
     * yielding {@link #EXTNAME} and {@link #NSPNAME} columns.
     *
     * @return query
     */
    @Nonnull
    public static Query installedExtensions() {
        return dsl.select(EXTNAME, NSPNAME)
                .from(PG_EXTENSION)
                .join(PG_NAMESPACE)
                .on(DSL.field(DSL.name("pg_namespace", "oid"))
                        .eq(DSL.field(DSL.name("pg_extension", "extnamespace"))))
                .orderBy(EXTNAME);
    }

    /**
     * Render a query with {@code ?} placeholders for its bind values.
     *
     * @param query query
     * @return SQL text
     */
    @Nonnull
    static String render(@Nonnull Query query) {
        return dsl.render(query);
    }

    /**
     * Get the bind values of a query, in placeholder order.
     *
     * @param query query
     * @return bind values
     */
    @Nonnull
    static List<Object> bindValues(@Nonnull Query query) {
        return dsl.extractBindValues(query);
    }
}
