package com.vmturbo.postgis.provisioner;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.SQLException;
import java.util.Arrays;

import com.google.common.collect.ImmutableList;

import org.junit.Before;
import org.junit.Test;

import com.vmturbo.postgis.provisioner.ProvisioningException.ConnectionException;
import com.vmturbo.postgis.provisioner.ProvisioningException.SchemaSearchPathException;
import com.vmturbo.postgis.provisioner.ProvisioningResult.Outcome;
import com.vmturbo.postgis.provisioner.dump.StructureDumper;

/**
 * Tests of {@link Provisioner} class.
 */
public class ProvisionerTest {

    private final AdminConnector connector = mock(AdminConnector.class);
    private final StructureDumper dumper = mock(StructureDumper.class);
    private final Provisioner provisioner = new Provisioner(connector, dumper);
    private JdbcMocks admin;
    private JdbcMocks target;
    private ProvisioningConfig config;

    /**
     * Set up connections for the geo_db scenario.
     *
     * @throws Exception if setup fails
     */
    @Before
    public void before() throws Exception {
        admin = new JdbcMocks();
        target = new JdbcMocks();
        config = ProvisioningConfig.newBuilder()
                .withDatabaseName("geo_db")
                .withOwner("geo", "pw")
                .withExtensions(Arrays.asList("postgis", "postgis_topology"))
                .withSchemaSearchPath(ImmutableList.of("public", "topology"))
                .build();
        when(connector.connectAsAdmin(any(ProvisioningConfig.class))).thenReturn(admin.connection);
        when(connector.connectToTarget(any(ProvisioningConfig.class)))
                .thenReturn(target.connection);
    }

    /**
     * Check the full creation flow: database created on the admin connection, extensions on the
     * target connection, both connections closed.
     *
     * @throws Exception if the test fails
     */
    @Test
    public void testCreate() throws Exception {
        final ProvisioningResult result = provisioner.create(config);
        assertThat(result.getOutcome(), is(Outcome.CREATED));
        assertThat(admin.executed, contains("CREATE DATABASE geo_db ENCODING 'utf8'"));
        assertThat(target.executed, contains(
                "CREATE EXTENSION IF NOT EXISTS postgis",
                "CREATE EXTENSION IF NOT EXISTS postgis_topology SCHEMA topology"));
        verify(admin.connection).close();
        verify(target.connection).close();
    }

    /**
     * Check that an existing database still gets its extensions installed.
     *
     * @throws Exception if the test fails
     */
    @Test
    public void testCreateExisting() throws Exception {
        admin.failOn("CREATE DATABASE", new SQLException("already there", "42P04"));
        final ProvisioningResult result = provisioner.create(config);
        assertThat(result.getOutcome(), is(Outcome.ALREADY_EXISTS));
        assertThat(target.executed.size(), is(2));
    }

    /**
     * Check that a failure to list installed extensions does not fail a completed creation.
     *
     * @throws Exception if the test fails
     */
    @Test
    public void testCreateWithUnreadableCatalog() throws Exception {
        when(target.preparedStatement.executeQuery())
                .thenThrow(new SQLException("permission denied for pg_extension", "42501"));
        final ProvisioningResult result = provisioner.create(config);
        assertThat(result.getOutcome(), is(Outcome.CREATED));
        assertThat(target.executed.size(), is(2));
        verify(target.connection).close();
    }

    /**
     * Check that a failed creation stops before connecting to the target database.
     *
     * @throws Exception if the test fails
     */
    @Test
    public void testCreateFailed() throws Exception {
        admin.failOn("CREATE DATABASE", new SQLException("permission denied", "42501"));
        final ProvisioningResult result = provisioner.create(config);
        assertThat(result.getOutcome(), is(Outcome.FAILED));
        verify(connector, never()).connectToTarget(any(ProvisioningConfig.class));
        verify(admin.connection).close();
    }

    /**
     * Check that a search path problem is reported after creation, with no extension SQL issued.
     *
     * @throws Exception expected
     */
    @Test(expected = SchemaSearchPathException.class)
    public void testCreateWithBadSearchPath() throws Exception {
        final ProvisioningConfig badConfig = ProvisioningConfig.newBuilder()
                .withDatabaseName("geo_db")
                .withExtensions(ImmutableList.of("postgis_topology"))
                .build();
        try {
            provisioner.create(badConfig);
        } finally {
            assertThat(admin.executed.size(), is(1));
            assertThat(target.executed, is(empty()));
            verify(target.connection).close();
        }
    }

    /**
     * Check that a connection failure propagates.
     *
     * @throws Exception expected
     */
    @Test(expected = ConnectionException.class)
    public void testConnectionFailure() throws Exception {
        when(connector.connectAsAdmin(any(ProvisioningConfig.class)))
                .thenThrow(new ConnectionException("Failed to connect", null));
        provisioner.create(config);
    }

    /**
     * Check that extension installation alone does not touch the admin database.
     *
     * @throws Exception if the test fails
     */
    @Test
    public void testInstallExtensionsOnly() throws Exception {
        provisioner.installExtensions(config);
        verify(connector, never()).connectAsAdmin(any(ProvisioningConfig.class));
        assertThat(target.executed.size(), is(2));
    }

    /**
     * Check that drop runs on the admin connection.
     *
     * @throws Exception if the test fails
     */
    @Test
    public void testDrop() throws Exception {
        provisioner.drop(config);
        assertThat(admin.executed, contains("DROP DATABASE IF EXISTS geo_db"));
        verify(admin.connection).close();
    }

    /**
     * Check that structure operations are delegated to the dumper.
     *
     * @throws Exception if the test fails
     */
    @Test
    public void testStructureOperations() throws Exception {
        final Path file = Paths.get("structure.sql");
        provisioner.structureDump(config, file);
        provisioner.structureLoad(config, file);
        verify(dumper).dump(config, file);
        verify(dumper).load(config, file);
    }
}
