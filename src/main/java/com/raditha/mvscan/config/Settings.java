package com.raditha.mvscan.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Key/value settings loaded from a YAML file ({@code mvscan.yml} by default).
 * <p>
 * CLI arguments are applied on top with {@link #setProperty(String, String, Object)}
 * before the detector configuration is built, so the priority is
 * CLI arguments &gt; YAML &gt; defaults.
 */
public class Settings {

    private static final Logger logger = LoggerFactory.getLogger(Settings.class);

    public static final String DEFAULT_FILE = "mvscan.yml";

    private final Map<String, Object> properties;

    private Settings(Map<String, Object> properties) {
        this.properties = properties;
    }

    public static Settings empty() {
        return new Settings(new LinkedHashMap<>());
    }

    /**
     * Load settings from the given YAML file.
     *
     * @throws IOException if the file cannot be read or parsed
     */
    public static Settings load(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            Settings settings = read(in);
            logger.debug("Loaded settings from {}", file);
            return settings;
        }
    }

    /**
     * Load {@code mvscan.yml} from the working directory when present.
     */
    public static Settings loadDefault() throws IOException {
        Path file = Path.of(DEFAULT_FILE);
        if (Files.isRegularFile(file)) {
            return load(file);
        }
        logger.debug("No {} found, using defaults", DEFAULT_FILE);
        return empty();
    }

    public static Settings read(InputStream in) throws IOException {
        ObjectMapper yaml = new ObjectMapper(new YAMLFactory());
        Map<String, Object> map = yaml.readValue(in, new TypeReference<LinkedHashMap<String, Object>>() {
        });
        return new Settings(map == null ? new LinkedHashMap<>() : map);
    }

    public Object getProperty(String key) {
        return properties.get(key);
    }

    public void setProperty(String key, Object value) {
        properties.put(key, value);
    }

    /**
     * Set a property inside a section, creating the section if needed.
     */
    @SuppressWarnings("unchecked")
    public void setProperty(String section, String key, Object value) {
        Object raw = properties.get(section);
        Map<String, Object> map;
        if (raw instanceof Map) {
            map = new LinkedHashMap<>((Map<String, Object>) raw);
        } else {
            map = new LinkedHashMap<>();
        }
        map.put(key, value);
        properties.put(section, map);
    }
}
