package com.vmturbo.postgis.provisioner;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.anEmptyMap;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;

import java.time.Duration;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

import com.google.common.collect.ImmutableMap;

import org.junit.Test;

import com.vmturbo.postgis.provisioner.ProvisioningException.InvalidConfigException;

/**
 * Tests of {@link ProvisioningConfigResolver} class, using both configuration layouts.
 */
public class ProvisioningConfigResolverTest {

    private final Map<String, String> overrideMap = new HashMap<>();
    private final UnaryOperator<String> overrides = overrideMap::get;

    private ProvisioningConfig resolve(Map<String, ?> raw, String name)
            throws InvalidConfigException {
        return new ProvisioningConfigResolver(ConfigAdapter.forRecord(raw, name), overrides)
                .resolve();
    }

    /**
     * Check that a legacy record with nothing but a database name gets the expected defaults.
     *
     * @throws InvalidConfigException shouldn't happen
     */
    @Test
    public void testLegacyDefaults() throws InvalidConfigException {
        final ProvisioningConfig config = resolve(ImmutableMap.of("database", "geo_db"), null);
        assertThat(config.getDatabaseName(), is("geo_db"));
        assertThat(config.getHost(), is("localhost"));
        assertThat(config.getPort(), is(5432));
        assertThat(config.getRootDatabaseName(), is("postgres"));
        assertThat(config.getEncoding(), is("utf8"));
        assertThat(config.getExtensions(), contains("postgis"));
        assertThat(config.getSchemaSearchPath(), is(empty()));
        assertThat(config.getExtensionSchema(), is(Optional.empty()));
        assertThat(config.getTemplate(), is(Optional.empty()));
        assertThat(config.getConnectionLimit(), is(Optional.empty()));
        assertThat(config.getOwnerUserName(), is(nullValue()));
        assertThat(config.getSuperUserName(), is(nullValue()));
        assertThat(config.hasDistinctSuperUser(), is(false));
        assertThat(config.getConnectTimeout(), is(Duration.ofSeconds(10)));
        assertThat(config.getStatementTimeout(), is(Duration.ofSeconds(60)));
        assertThat(config.getDriverProperties(), is(anEmptyMap()));
        assertThat(config.isRestrictDumpToSearchPath(), is(false));
        assertThat(config.getPgDumpPath(), is("pg_dump"));
        assertThat(config.getPsqlPath(), is("psql"));
    }

    /**
     * Check that all legacy keys are picked up, including comma-separated lists.
     *
     * @throws InvalidConfigException shouldn't happen
     */
    @Test
    public void testLegacyRecord() throws InvalidConfigException {
        final Map<String, Object> raw = new HashMap<>();
        raw.put("database", "geo_db");
        raw.put("host", "db.example.com");
        raw.put("port", 5433);
        raw.put("username", "geo");
        raw.put("password", " geo pw ");
        raw.put("su_username", "postgres");
        raw.put("su_password", "supw");
        raw.put("encoding", "latin1");
        raw.put("template", "template0");
        raw.put("connection_limit", "20");
        raw.put("postgis_extension", "postgis, postgis_topology");
        raw.put("schema_search_path", "public,topology");
        raw.put("postgis_schema", "gis");
        raw.put("connect_timeout", 3);
        raw.put("driver_properties", "ssl=true, sslmode=require");
        raw.put("dump_schemas", "schema_search_path");
        raw.put("pg_dump_path", "/usr/pgsql/bin/pg_dump");
        final ProvisioningConfig config = resolve(raw, null);
        assertThat(config.getHost(), is("db.example.com"));
        assertThat(config.getPort(), is(5433));
        assertThat(config.getOwnerUserName(), is("geo"));
        assertThat(config.getOwnerPassword(), is(" geo pw "));
        assertThat(config.getSuperUserName(), is("postgres"));
        assertThat(config.getSuperUserPassword(), is("supw"));
        assertThat(config.hasDistinctSuperUser(), is(true));
        assertThat(config.getEncoding(), is("latin1"));
        assertThat(config.getTemplate(), is(Optional.of("template0")));
        assertThat(config.getConnectionLimit(), is(Optional.of(20)));
        assertThat(config.getExtensions(), contains("postgis", "postgis_topology"));
        assertThat(config.getSchemaSearchPath(), contains("public", "topology"));
        assertThat(config.getExtensionSchema(), is(Optional.of("gis")));
        assertThat(config.getConnectTimeout(), is(Duration.ofSeconds(3)));
        assertThat(config.getDriverProperties(),
                is(ImmutableMap.of("ssl", "true", "sslmode", "require")));
        assertThat(config.isRestrictDumpToSearchPath(), is(true));
        assertThat(config.getPgDumpPath(), is("/usr/pgsql/bin/pg_dump"));
        assertThat(config.getPsqlPath(), is("psql"));
    }

    /**
     * Check that superuser credentials default to the owner's.
     *
     * @throws InvalidConfigException shouldn't happen
     */
    @Test
    public void testSuperUserDefaultsToOwner() throws InvalidConfigException {
        final ProvisioningConfig config = resolve(ImmutableMap.of(
                "database", "geo_db", "username", "geo", "password", "pw"), null);
        assertThat(config.getSuperUserName(), is("geo"));
        assertThat(config.getSuperUserPassword(), is("pw"));
        assertThat(config.hasDistinctSuperUser(), is(false));
    }

    /**
     * Check that extensions given as a list are trimmed, with blank entries dropped.
     *
     * @throws InvalidConfigException shouldn't happen
     */
    @Test
    public void testExtensionList() throws InvalidConfigException {
        final ProvisioningConfig config = resolve(ImmutableMap.of("database", "geo_db",
                "postgis_extension", Arrays.asList("postgis", " ", "postgis_raster ")), null);
        assertThat(config.getExtensions(), contains("postgis", "postgis_raster"));
    }

    /**
     * Check that a named legacy section is selected.
     *
     * @throws InvalidConfigException shouldn't happen
     */
    @Test
    public void testLegacySection() throws InvalidConfigException {
        final Map<String, Object> raw = ImmutableMap.of(
                "development", ImmutableMap.of("database", "dev_db"),
                "test", ImmutableMap.of("database", "test_db"));
        assertThat(resolve(raw, "test").getDatabaseName(), is("test_db"));
    }

    /**
     * Check that a missing legacy section is reported.
     *
     * @throws InvalidConfigException expected
     */
    @Test(expected = InvalidConfigException.class)
    public void testMissingLegacySection() throws InvalidConfigException {
        resolve(ImmutableMap.of("development", ImmutableMap.of("database", "dev_db")), "test");
    }

    /**
     * Check that endpoint properties fall back through name prefixes to the defaults section.
     *
     * @throws InvalidConfigException shouldn't happen
     */
    @Test
    public void testEndpointRecord() throws InvalidConfigException {
        final Map<String, Object> geo = new HashMap<>();
        geo.put("databaseName", "geo_db");
        geo.put("port", 5433);
        geo.put("userName", "geo");
        geo.put("extensions", Arrays.asList("postgis", "postgis_topology"));
        geo.put("schemaSearchPath", "public,topology");
        geo.put("eu", ImmutableMap.of("databaseName", "geo_eu"));
        final Map<String, Object> raw = ImmutableMap.of("dbs", ImmutableMap.of(
                "postgisDefault", ImmutableMap.of(
                        "host", "db.example.com", "rootUserName", "postgres",
                        "rootPassword", "secret"),
                "geo", geo));

        final ProvisioningConfig config = resolve(raw, "geo");
        assertThat(config.getDatabaseName(), is("geo_db"));
        assertThat(config.getHost(), is("db.example.com"));
        assertThat(config.getPort(), is(5433));
        assertThat(config.getOwnerUserName(), is("geo"));
        assertThat(config.getSuperUserName(), is("postgres"));
        assertThat(config.getSuperUserPassword(), is("secret"));
        assertThat(config.getExtensions(), contains("postgis", "postgis_topology"));
        assertThat(config.getSchemaSearchPath(), contains("public", "topology"));

        final ProvisioningConfig eu = resolve(raw, "geo.eu");
        assertThat(eu.getDatabaseName(), is("geo_eu"));
        assertThat(eu.getPort(), is(5433));
        assertThat(eu.getHost(), is("db.example.com"));
    }

    /**
     * Check that overrides take precedence over the configuration record.
     *
     * @throws InvalidConfigException shouldn't happen
     */
    @Test
    public void testOverrides() throws InvalidConfigException {
        overrideMap.put("provision.rootPassword", "from-override");
        overrideMap.put("provision.databaseName", "other_db");
        final ProvisioningConfig config = resolve(ImmutableMap.of(
                "database", "geo_db", "su_username", "postgres", "su_password", "from-file"),
                null);
        assertThat(config.getDatabaseName(), is("other_db"));
        assertThat(config.getSuperUserPassword(), is("from-override"));
    }

    /**
     * Check that a record without a database name is rejected.
     *
     * @throws InvalidConfigException expected
     */
    @Test(expected = InvalidConfigException.class)
    public void testMissingDatabaseName() throws InvalidConfigException {
        resolve(ImmutableMap.of("host", "db.example.com", "database", "  "), null);
    }

    /**
     * Check that a non-numeric port is rejected.
     *
     * @throws InvalidConfigException expected
     */
    @Test(expected = InvalidConfigException.class)
    public void testBadPort() throws InvalidConfigException {
        resolve(ImmutableMap.of("database", "geo_db", "port", "fifty"), null);
    }

    /**
     * Check that an out-of-range port is rejected.
     *
     * @throws InvalidConfigException expected
     */
    @Test(expected = InvalidConfigException.class)
    public void testPortOutOfRange() throws InvalidConfigException {
        resolve(ImmutableMap.of("database", "geo_db", "port", 70000), null);
    }

    /**
     * Check that a list where a single value is expected is rejected.
     *
     * @throws InvalidConfigException expected
     */
    @Test(expected = InvalidConfigException.class)
    public void testListForSingleValue() throws InvalidConfigException {
        resolve(ImmutableMap.of("database", "geo_db", "host", Arrays.asList("a", "b")), null);
    }

    /**
     * Check that a negative timeout is rejected.
     *
     * @throws InvalidConfigException expected
     */
    @Test(expected = InvalidConfigException.class)
    public void testNegativeTimeout() throws InvalidConfigException {
        resolve(ImmutableMap.of("database", "geo_db", "statement_timeout", -1), null);
    }

    /**
     * Check that an unknown dump scope is rejected.
     *
     * @throws InvalidConfigException expected
     */
    @Test(expected = InvalidConfigException.class)
    public void testBadDumpSchemas() throws InvalidConfigException {
        resolve(ImmutableMap.of("database", "geo_db", "dump_schemas", "some"), null);
    }

    /**
     * Check that malformed driver properties are rejected.
     *
     * @throws InvalidConfigException expected
     */
    @Test(expected = InvalidConfigException.class)
    public void testBadDriverProperties() throws InvalidConfigException {
        resolve(ImmutableMap.of("database", "geo_db", "driver_properties", "ssl"), null);
    }
}
