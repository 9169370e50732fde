package com.vmturbo.postgis.provisioner;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Splitter;

import com.vmturbo.postgis.provisioner.ProvisioningException.InvalidConfigException;

/**
 * {@link ConfigAdapter} for endpoint configuration records.
 *
 * <p>Endpoints are declared in a {@code dbs} section, keyed by endpoint name. A property is looked
 * up under the endpoint's name first, then under each dot-boundary prefix of the name from longest
 * to shortest, and finally in the {@code postgisDefault} section, so shared settings need only be
 * written once:</p>
 *
 * <pre>
 * dbs:
 *   postgisDefault:
 *     host: db.example.com
 *     rootUserName: postgres
 *   geo:
 *     databaseName: geo_db
 *     extensions: [postgis, postgis_topology]
 *     schemaSearchPath: public,topology
 * </pre>
 */
public class EndpointConfigAdapter implements ConfigAdapter {

    /** key of the section holding endpoint definitions. */
    public static final String ENDPOINTS_KEY = "dbs";
    /** name of the section providing defaults for all endpoints. */
    public static final String DEFAULTS_SECTION = "postgisDefault";

    private static final Splitter DOT_SPLITTER = Splitter.on('.');

    private final Map<?, ?> endpoints;
    private final String name;

    /**
     * Create a new instance.
     *
     * @param endpoints contents of the {@code dbs} section
     * @param name      endpoint name, or null to use only the defaults section
     */
    EndpointConfigAdapter(@Nonnull Map<?, ?> endpoints, @Nullable String name) {
        this.endpoints = endpoints;
        this.name = name;
    }

    /**
     * Create an adapter for an endpoint record, checking that a named endpoint is declared.
     *
     * <p>An endpoint is declared when its own section, or the section of one of its dotted
     * prefixes, is present. The defaults section alone does not declare an endpoint.</p>
     *
     * @param endpoints contents of the {@code dbs} section
     * @param name      endpoint name, or null to use only the defaults section
     * @return new adapter
     * @throws InvalidConfigException if a named endpoint is requested but not declared
     */
    static EndpointConfigAdapter of(@Nonnull Map<?, ?> endpoints, @Nullable String name)
            throws InvalidConfigException {
        final EndpointConfigAdapter adapter = new EndpointConfigAdapter(endpoints, name);
        if (name != null && !adapter.isDeclared()) {
            throw new InvalidConfigException(String.format(
                    "No endpoint named '%s' in %s section", name, ENDPOINTS_KEY));
        }
        return adapter;
    }

    @Nullable
    @Override
    public Object get(@Nonnull ProvisioningProperty property) {
        for (String prefix : lookupPrefixes()) {
            final Object section = navigate(prefix);
            if (section instanceof Map) {
                final Object value = ((Map<?, ?>)section).get(property.getEndpointKey());
                if (value != null) {
                    return value;
                }
            }
        }
        return null;
    }

    @Nonnull
    @Override
    public String describe(@Nonnull ProvisioningProperty property) {
        return String.join(".", ENDPOINTS_KEY, name != null ? name : DEFAULTS_SECTION,
                property.getEndpointKey());
    }

    /**
     * Get the section names consulted for a property, in priority order.
     *
     * @return section names
     */
    @VisibleForTesting
    List<String> lookupPrefixes() {
        final List<String> result = new ArrayList<>();
        String prefix = name;
        while (prefix != null) {
            result.add(prefix);
            final int lastDot = prefix.lastIndexOf('.');
            prefix = lastDot >= 0 ? prefix.substring(0, lastDot) : null;
        }
        result.add(DEFAULTS_SECTION);
        return result;
    }

    private boolean isDeclared() {
        for (String prefix : lookupPrefixes()) {
            if (!DEFAULTS_SECTION.equals(prefix) && navigate(prefix) instanceof Map) {
                return true;
            }
        }
        return false;
    }

    @Nullable
    private Object navigate(String dottedName) {
        Object current = endpoints;
        for (String part : DOT_SPLITTER.split(dottedName)) {
            if (!(current instanceof Map)) {
                return null;
            }
            current = ((Map<?, ?>)current).get(part);
        }
        return current;
    }
}
