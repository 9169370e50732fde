package com.vmturbo.postgis.provisioner.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import javax.annotation.Nonnull;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import com.vmturbo.postgis.provisioner.ProvisioningException.InvalidConfigException;

/**
 * Reads a configuration file into a raw configuration record. Files are YAML; JSON files work
 * too, since JSON is a subset of YAML.
 */
public class ConfigFileLoader {

    private static final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    /**
     * Load a configuration file.
     *
     * @param file file to load
     * @return top-level mapping of the file
     * @throws InvalidConfigException if the file cannot be read, does not parse, or does not
     *                                hold a mapping
     */
    @Nonnull
    public Map<String, Object> load(@Nonnull Path file) throws InvalidConfigException {
        if (!Files.isReadable(file)) {
            throw new InvalidConfigException(
                    String.format("Configuration file %s is not readable", file));
        }
        final Map<String, Object> raw;
        try {
            raw = yamlMapper.readValue(file.toFile(), new TypeReference<Map<String, Object>>() {});
        } catch (IOException e) {
            throw new InvalidConfigException(String.format(
                    "Failed to parse configuration file %s: %s", file, e.getMessage()), e);
        }
        if (raw == null) {
            throw new InvalidConfigException(
                    String.format("Configuration file %s is empty", file));
        }
        return raw;
    }
}
