package com.vmturbo.postgis.provisioner;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;

import com.google.common.collect.ImmutableMap;

import org.junit.Test;

import com.vmturbo.postgis.provisioner.ProvisioningException.InvalidConfigException;

/**
 * Tests of {@link EndpointConfigAdapter} class.
 */
public class EndpointConfigAdapterTest {

    /**
     * Check that a dotted endpoint name is looked up under each of its prefixes, then the
     * defaults section.
     */
    @Test
    public void testLookupPrefixes() {
        assertThat(new EndpointConfigAdapter(ImmutableMap.of(), "a.b.c").lookupPrefixes(),
                contains("a.b.c", "a.b", "a", "postgisDefault"));
        assertThat(new EndpointConfigAdapter(ImmutableMap.of(), "geo").lookupPrefixes(),
                contains("geo", "postgisDefault"));
        assertThat(new EndpointConfigAdapter(ImmutableMap.of(), null).lookupPrefixes(),
                contains("postgisDefault"));
    }

    /**
     * Check that the most specific section setting a property wins.
     */
    @Test
    public void testMostSpecificWins() {
        final EndpointConfigAdapter adapter = new EndpointConfigAdapter(ImmutableMap.of(
                "postgisDefault", ImmutableMap.of("host", "default-host", "port", 1),
                "geo", ImmutableMap.of("host", "geo-host",
                        "eu", ImmutableMap.of("port", 2))), "geo.eu");
        assertThat(adapter.get(ProvisioningProperty.PORT), is(2));
        assertThat(adapter.get(ProvisioningProperty.HOST), is("geo-host"));
        assertThat(adapter.get(ProvisioningProperty.DATABASE_NAME), is(nullValue()));
    }

    /**
     * Check that an endpoint name not declared in the record is rejected, rather than resolved
     * entirely from the defaults section.
     *
     * @throws InvalidConfigException expected
     */
    @Test(expected = InvalidConfigException.class)
    public void testUndeclaredEndpoint() throws InvalidConfigException {
        ConfigAdapter.forRecord(ImmutableMap.of("dbs", ImmutableMap.of(
                "postgisDefault", ImmutableMap.of("databaseName", "shared_db"),
                "geo", ImmutableMap.of("databaseName", "geo_db"))), "goe");
    }

    /**
     * Check that an endpoint declared through a dotted prefix, or no endpoint at all, is
     * accepted.
     *
     * @throws InvalidConfigException shouldn't happen
     */
    @Test
    public void testDeclaredEndpoint() throws InvalidConfigException {
        final ImmutableMap<String, ?> raw = ImmutableMap.of("dbs", ImmutableMap.of(
                "postgisDefault", ImmutableMap.of("databaseName", "shared_db"),
                "geo", ImmutableMap.of("databaseName", "geo_db")));
        assertThat(ConfigAdapter.forRecord(raw, "geo.eu")
                .get(ProvisioningProperty.DATABASE_NAME), is("geo_db"));
        assertThat(ConfigAdapter.forRecord(raw, null)
                .get(ProvisioningProperty.DATABASE_NAME), is("shared_db"));
    }

    /**
     * Check that property descriptions name the endpoint.
     */
    @Test
    public void testDescribe() {
        assertThat(new EndpointConfigAdapter(ImmutableMap.of(), "geo")
                        .describe(ProvisioningProperty.SU_USER_NAME),
                is("dbs.geo.rootUserName"));
        assertThat(new EndpointConfigAdapter(ImmutableMap.of(), null)
                        .describe(ProvisioningProperty.EXTENSIONS),
                is("dbs.postgisDefault.extensions"));
    }
}
