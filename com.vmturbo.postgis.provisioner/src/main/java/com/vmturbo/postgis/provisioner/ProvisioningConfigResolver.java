package com.vmturbo.postgis.provisioner;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.function.UnaryOperator;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.vmturbo.postgis.provisioner.ProvisioningException.InvalidConfigException;

/**
 * Resolves a raw configuration record into a {@link ProvisioningConfig}.
 *
 * <p>Property values are taken from the following sources, in decreasing priority:</p>
 *
 * <ul>
 *     <li>
 *         Overrides, looked up as {@code provision.<name>} where {@code <name>} is the endpoint
 *         property name (e.g. {@code provision.rootPassword}). The CLI supplies system properties
 *         here, so credentials need not be written to the configuration file.
 *     </li>
 *     <li>The configuration record, read through a {@link ConfigAdapter}.</li>
 *     <li>Built-in defaults; see {@link ProvisioningConfig}.</li>
 * </ul>
 *
 * <p>The resolver is a pure transformation and performs no I/O.</p>
 */
public class ProvisioningConfigResolver {
    private static final Logger logger = LogManager.getLogger();

    /** prefix of override property names. */
    public static final String OVERRIDE_PREFIX = "provision.";

    /** {@link ProvisioningProperty#DUMP_SCHEMAS} value restricting dumps to the search path. */
    public static final String DUMP_SCHEMAS_SEARCH_PATH = "schema_search_path";
    /** {@link ProvisioningProperty#DUMP_SCHEMAS} value dumping all schemas. */
    public static final String DUMP_SCHEMAS_ALL = "all";

    private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();
    private static final Splitter.MapSplitter MAP_SPLITTER =
            Splitter.on(',').trimResults().omitEmptyStrings().withKeyValueSeparator('=');

    private final ConfigAdapter adapter;
    private final UnaryOperator<String> overrides;

    /**
     * Create a new instance.
     *
     * @param adapter   access to the configuration record
     * @param overrides lookup function for override values; returns null for absent values
     */
    public ProvisioningConfigResolver(@Nonnull ConfigAdapter adapter,
            @Nonnull UnaryOperator<String> overrides) {
        this.adapter = adapter;
        this.overrides = overrides;
    }

    /**
     * Create a new instance with no overrides.
     *
     * @param adapter access to the configuration record
     */
    public ProvisioningConfigResolver(@Nonnull ConfigAdapter adapter) {
        this(adapter, key -> null);
    }

    /**
     * Resolve the configuration.
     *
     * @return resolved configuration
     * @throws InvalidConfigException if a required property is missing or a value is unusable
     */
    public ProvisioningConfig resolve() throws InvalidConfigException {
        final ProvisioningConfig config = ProvisioningConfig.newBuilder()
                .withHost(getString(ProvisioningProperty.HOST))
                .withPort(getInteger(ProvisioningProperty.PORT))
                .withDatabaseName(getString(ProvisioningProperty.DATABASE_NAME))
                .withOwner(getString(ProvisioningProperty.USER_NAME),
                        getSecret(ProvisioningProperty.PASSWORD))
                .withSuperUser(getString(ProvisioningProperty.SU_USER_NAME),
                        getSecret(ProvisioningProperty.SU_PASSWORD))
                .withRootDatabaseName(getString(ProvisioningProperty.ROOT_DATABASE_NAME))
                .withEncoding(getString(ProvisioningProperty.ENCODING))
                .withTemplate(getString(ProvisioningProperty.TEMPLATE))
                .withCollation(getString(ProvisioningProperty.COLLATION))
                .withCtype(getString(ProvisioningProperty.CTYPE))
                .withTablespace(getString(ProvisioningProperty.TABLESPACE))
                .withConnectionLimit(getInteger(ProvisioningProperty.CONNECTION_LIMIT))
                .withSchemaSearchPath(getListOrEmpty(ProvisioningProperty.SCHEMA_SEARCH_PATH))
                .withExtensions(getList(ProvisioningProperty.EXTENSIONS))
                .withExtensionSchema(getString(ProvisioningProperty.EXTENSION_SCHEMA))
                .withConnectTimeout(getSeconds(ProvisioningProperty.CONNECT_TIMEOUT))
                .withStatementTimeout(getSeconds(ProvisioningProperty.STATEMENT_TIMEOUT))
                .withDriverProperties(getMap(ProvisioningProperty.DRIVER_PROPERTIES))
                .withRestrictDumpToSearchPath(getDumpSchemas())
                .withClientTools(getString(ProvisioningProperty.PG_DUMP_PATH),
                        getString(ProvisioningProperty.PSQL_PATH))
                .build();
        logger.debug("Resolved configuration {}: extensions={}, search path={}",
                config, config.getExtensions(), config.getSchemaSearchPath());
        return config;
    }

    @Nullable
    private Object getRaw(ProvisioningProperty property) {
        final String override = overrides.apply(OVERRIDE_PREFIX + property.getEndpointKey());
        return override != null ? override : adapter.get(property);
    }

    @Nullable
    private String getString(ProvisioningProperty property) throws InvalidConfigException {
        final Object value = getRaw(property);
        if (value == null) {
            return null;
        } else if (value instanceof Map || value instanceof List) {
            throw new InvalidConfigException(String.format("Property %s must be a single value",
                    adapter.describe(property)));
        }
        return StringUtils.trimToNull(value.toString());
    }

    /**
     * Get a password property; unlike other strings these are not trimmed.
     *
     * @param property property
     * @return value, or null if not set
     * @throws InvalidConfigException if the value is a list or a map
     */
    @Nullable
    private String getSecret(ProvisioningProperty property) throws InvalidConfigException {
        final Object value = getRaw(property);
        if (value instanceof Map || value instanceof List) {
            throw new InvalidConfigException(String.format("Property %s must be a single value",
                    adapter.describe(property)));
        }
        return value != null ? value.toString() : null;
    }

    @Nullable
    private Integer getInteger(ProvisioningProperty property) throws InvalidConfigException {
        final String value = getString(property);
        try {
            return value != null ? Integer.valueOf(value) : null;
        } catch (NumberFormatException e) {
            throw new InvalidConfigException(String.format("Property %s must be an integer: %s",
                    adapter.describe(property), value), e);
        }
    }

    @Nullable
    private Duration getSeconds(ProvisioningProperty property) throws InvalidConfigException {
        final Integer seconds = getInteger(property);
        if (seconds != null && seconds < 0) {
            throw new InvalidConfigException(String.format("Property %s must not be negative",
                    adapter.describe(property)));
        }
        return seconds != null ? Duration.ofSeconds(seconds) : null;
    }

    /**
     * Get a list-valued property, given either as a comma-separated string or as a list.
     *
     * @param property property
     * @return trimmed list without empty elements, or null if the property is not set
     * @throws InvalidConfigException if the value is neither a string nor a list
     */
    @Nullable
    private List<String> getList(ProvisioningProperty property) throws InvalidConfigException {
        final Object value = getRaw(property);
        if (value == null) {
            return null;
        } else if (value instanceof List) {
            final ImmutableList.Builder<String> result = ImmutableList.builder();
            for (Object element : (List<?>)value) {
                final String s = element != null ? element.toString().trim() : "";
                if (!s.isEmpty()) {
                    result.add(s);
                }
            }
            return result.build();
        } else if (value instanceof Map) {
            throw new InvalidConfigException(String.format("Property %s must be a list",
                    adapter.describe(property)));
        } else {
            return ImmutableList.copyOf(LIST_SPLITTER.split(value.toString()));
        }
    }

    private List<String> getListOrEmpty(ProvisioningProperty property)
            throws InvalidConfigException {
        final List<String> list = getList(property);
        return list != null ? list : ImmutableList.of();
    }

    private Map<String, String> getMap(ProvisioningProperty property)
            throws InvalidConfigException {
        final Object value = getRaw(property);
        final Map<String, String> result = new LinkedHashMap<>();
        if (value instanceof Map) {
            for (Entry<?, ?> entry : ((Map<?, ?>)value).entrySet()) {
                result.put(String.valueOf(entry.getKey()), String.valueOf(entry.getValue()));
            }
        } else if (value != null) {
            try {
                result.putAll(MAP_SPLITTER.split(value.toString()));
            } catch (IllegalArgumentException e) {
                throw new InvalidConfigException(String.format(
                        "Property %s must be a map or a list of key=value pairs",
                        adapter.describe(property)), e);
            }
        }
        return result;
    }

    private boolean getDumpSchemas() throws InvalidConfigException {
        final String value = getString(ProvisioningProperty.DUMP_SCHEMAS);
        if (value == null || DUMP_SCHEMAS_ALL.equals(value)) {
            return false;
        } else if (DUMP_SCHEMAS_SEARCH_PATH.equals(value)) {
            return true;
        }
        throw new InvalidConfigException(String.format("Property %s must be '%s' or '%s': %s",
                adapter.describe(ProvisioningProperty.DUMP_SCHEMAS),
                DUMP_SCHEMAS_SEARCH_PATH, DUMP_SCHEMAS_ALL, value));
    }
}
