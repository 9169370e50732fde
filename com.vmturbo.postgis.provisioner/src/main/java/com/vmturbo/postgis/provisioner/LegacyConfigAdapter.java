package com.vmturbo.postgis.provisioner;

import java.util.Map;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import com.vmturbo.postgis.provisioner.ProvisioningException.InvalidConfigException;

/**
 * {@link ConfigAdapter} for the legacy flat configuration record, where every property is a
 * top-level snake-case key, e.g.:
 *
 * <pre>
 * database: geo_db
 * username: geo
 * su_username: postgres
 * postgis_extension: postgis,postgis_topology
 * schema_search_path: public,topology
 * </pre>
 *
 * <p>A file may hold several such records as named sections (e.g. one per environment), in which
 * case the section is selected by name.</p>
 */
public class LegacyConfigAdapter implements ConfigAdapter {

    private final Map<?, ?> record;

    LegacyConfigAdapter(@Nonnull Map<?, ?> record) {
        this.record = record;
    }

    /**
     * Create an adapter for a legacy record, selecting a named section if requested.
     *
     * @param raw  file contents
     * @param name section name, or null if the file holds a single record
     * @return new adapter
     * @throws InvalidConfigException if a named section is requested but not present
     */
    static LegacyConfigAdapter of(@Nonnull Map<String, ?> raw, @Nullable String name)
            throws InvalidConfigException {
        if (name == null) {
            return new LegacyConfigAdapter(raw);
        }
        final Object section = raw.get(name);
        if (section instanceof Map) {
            return new LegacyConfigAdapter((Map<?, ?>)section);
        }
        throw new InvalidConfigException(
                String.format("No configuration section named '%s'", name));
    }

    @Nullable
    @Override
    public Object get(@Nonnull ProvisioningProperty property) {
        return record.get(property.getLegacyKey());
    }

    @Nonnull
    @Override
    public String describe(@Nonnull ProvisioningProperty property) {
        return property.getLegacyKey();
    }
}
