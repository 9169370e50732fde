package com.vmturbo.postgis.provisioner;

import java.util.Optional;

import javax.annotation.Nonnull;

/**
 * Extensions from the PostGIS distribution that need special handling during installation.
 *
 * <p>Extensions not listed here (including any non-PostGIS extension named in the configuration)
 * are installed into the configured extension schema, if any, or else the server default.</p>
 */
public enum PostgisExtensions {

    /** Geometry and geography types. */
    POSTGIS("postgis", null),

    /** Raster support. */
    POSTGIS_RASTER("postgis_raster", null),

    /** Topology support; always lives in its own {@code topology} schema. */
    POSTGIS_TOPOLOGY("postgis_topology", "topology"),

    /** SFCGAL backed functions. */
    POSTGIS_SFCGAL("postgis_sfcgal", null),

    /** TIGER geocoder. */
    POSTGIS_TIGER_GEOCODER("postgis_tiger_geocoder", null),

    /** Address normalizer. */
    ADDRESS_STANDARDIZER("address_standardizer", null),

    /** Fuzzy string matching, required by the geocoder. */
    FUZZYSTRMATCH("fuzzystrmatch", null);

    private final String extensionName;
    private final String fixedSchema;

    PostgisExtensions(String extensionName, String fixedSchema) {
        this.extensionName = extensionName;
        this.fixedSchema = fixedSchema;
    }

    public String getExtensionName() {
        return extensionName;
    }

    /**
     * Return the schema this extension must be installed into, regardless of configuration.
     * That schema must also appear in the schema search path.
     *
     * @return fixed schema name, if the extension has one
     */
    public Optional<String> getFixedSchema() {
        return Optional.ofNullable(fixedSchema);
    }

    /**
     * Find the schema an extension must be installed into, by extension name.
     *
     * @param extensionName extension name as configured
     * @return fixed schema, or empty if the extension is unknown or has no fixed schema
     */
    public static Optional<String> fixedSchemaOf(@Nonnull String extensionName) {
        for (PostgisExtensions extension : values()) {
            if (extension.extensionName.equals(extensionName)) {
                return extension.getFixedSchema();
            }
        }
        return Optional.empty();
    }
}
