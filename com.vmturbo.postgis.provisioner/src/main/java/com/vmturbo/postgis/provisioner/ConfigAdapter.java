package com.vmturbo.postgis.provisioner;

import java.util.Map;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import com.vmturbo.postgis.provisioner.ProvisioningException.InvalidConfigException;

/**
 * Read access to a raw configuration record, hiding which generation of configuration layout the
 * record uses.
 *
 * <p>Values are returned as they appear in the record (strings, numbers, lists or maps);
 * {@link ProvisioningConfigResolver} normalizes them.</p>
 */
public interface ConfigAdapter {

    /**
     * Get the raw value of a property.
     *
     * @param property property to look up
     * @return raw value, or null if the record does not set it
     */
    @Nullable
    Object get(@Nonnull ProvisioningProperty property);

    /**
     * Get the key under which the given property would be found, for use in messages.
     *
     * @param property property
     * @return key as it appears in this record's layout
     */
    @Nonnull
    String describe(@Nonnull ProvisioningProperty property);

    /**
     * Select an adapter for the given record, based on its layout.
     *
     * <p>A record with a {@code dbs} section is an endpoint record; anything else is a legacy
     * flat record.</p>
     *
     * @param raw  raw configuration record
     * @param name endpoint name (endpoint records) or section name (legacy records), or null
     * @return adapter for the record
     * @throws InvalidConfigException if the named section or endpoint is not present
     */
    @Nonnull
    static ConfigAdapter forRecord(@Nonnull Map<String, ?> raw, @Nullable String name)
            throws InvalidConfigException {
        if (raw.get(EndpointConfigAdapter.ENDPOINTS_KEY) instanceof Map) {
            return EndpointConfigAdapter.of(
                    (Map<?, ?>)raw.get(EndpointConfigAdapter.ENDPOINTS_KEY), name);
        } else {
            return LegacyConfigAdapter.of(raw, name);
        }
    }
}
