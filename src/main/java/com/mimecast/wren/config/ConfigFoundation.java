package com.mimecast.wren.config;

import com.google.gson.Gson;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;

import java.io.IOException;
import java.io.Reader;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration foundation.
 *
 * <p>Wraps a configuration map with type safe accessors.
 * <p>Maps can be given directly or read from a JSON5 file.
 * <br>JSON5 is read leniently so comments and unquoted keys are accepted.
 */
@SuppressWarnings("unchecked")
public abstract class ConfigFoundation {

    private static final Type MAP_TYPE = new TypeToken<Map<String, Object>>() {}.getType();

    /**
     * Configuration map.
     */
    protected Map<String, Object> map = new HashMap<>();

    /**
     * Constructs a new ConfigFoundation instance.
     */
    protected ConfigFoundation() {
    }

    /**
     * Constructs a new ConfigFoundation instance with given map.
     *
     * @param map Configuration map.
     */
    protected ConfigFoundation(Map<String, Object> map) {
        if (map != null) {
            this.map = map;
        }
    }

    /**
     * Constructs a new ConfigFoundation instance with configuration file path.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read file.
     */
    protected ConfigFoundation(String path) throws IOException {
        this.map = readFile(Paths.get(path));
    }

    /**
     * Reads a JSON5 file into a map.
     *
     * @param path File path.
     * @return Map of String, Object.
     * @throws IOException Unable to read or parse file.
     */
    static Map<String, Object> readFile(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            JsonReader jsonReader = new JsonReader(reader);
            jsonReader.setLenient(true);

            Map<String, Object> parsed = new Gson().fromJson(jsonReader, MAP_TYPE);
            return parsed != null ? parsed : new HashMap<>();
        } catch (RuntimeException e) {
            throw new IOException("Unable to parse configuration file: " + path + " - " + e.getMessage(), e);
        }
    }

    /**
     * Gets the underlying map.
     *
     * @return Map of String, Object.
     */
    public Map<String, Object> getMap() {
        return map;
    }

    /**
     * Checks if property exists.
     *
     * @param name Property name.
     * @return Boolean.
     */
    public boolean hasProperty(String name) {
        return map.containsKey(name) && map.get(name) != null;
    }

    /**
     * Sets property.
     *
     * @param name  Property name.
     * @param value Property value.
     */
    public void setProperty(String name, Object value) {
        map.put(name, value);
    }

    /**
     * Gets String property.
     *
     * @param name Property name.
     * @return String.
     */
    public String getStringProperty(String name) {
        return getStringProperty(name, null);
    }

    /**
     * Gets String property with default.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return String.
     */
    public String getStringProperty(String name, String defaultValue) {
        Object value = map.get(name);
        if (value == null) {
            return defaultValue;
        }

        // Gson reads all numbers as doubles.
        if (value instanceof Double && (Double) value == Math.rint((Double) value)) {
            return String.valueOf(((Double) value).longValue());
        }

        return String.valueOf(value);
    }

    /**
     * Gets Long property.
     *
     * @param name Property name.
     * @return Long.
     */
    public Long getLongProperty(String name) {
        return getLongProperty(name, 0L);
    }

    /**
     * Gets Long property with default.
     * <p>Strings are parsed, unparseable values return the default.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return Long.
     */
    public Long getLongProperty(String name, Long defaultValue) {
        Object value = map.get(name);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }

        if (value instanceof String) {
            try {
                return Long.parseLong(((String) value).trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }

        return defaultValue;
    }

    /**
     * Gets Double property with default.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return Double.
     */
    public Double getDoubleProperty(String name, Double defaultValue) {
        Object value = map.get(name);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }

        if (value instanceof String) {
            try {
                return Double.parseDouble(((String) value).trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }

        return defaultValue;
    }

    /**
     * Gets Boolean property.
     *
     * @param name Property name.
     * @return Boolean.
     */
    public boolean getBooleanProperty(String name) {
        return getBooleanProperty(name, false);
    }

    /**
     * Gets Boolean property with default.
     * <p>Strings 1/true/yes/on and 0/false/no/off are understood.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return Boolean.
     */
    public boolean getBooleanProperty(String name, boolean defaultValue) {
        Object value = map.get(name);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }

        if (value instanceof String) {
            return parseBoolean((String) value, defaultValue);
        }

        return defaultValue;
    }

    /**
     * Gets Map property.
     * <p>Missing or non-map values yield an empty map which is stored back so nested edits persist.
     *
     * @param name Property name.
     * @return Map of String, Object.
     */
    public Map<String, Object> getMapProperty(String name) {
        Object value = map.get(name);
        if (value instanceof Map) {
            return (Map<String, Object>) value;
        }

        Map<String, Object> empty = new HashMap<>();
        map.put(name, empty);
        return empty;
    }

    /**
     * Gets List property.
     *
     * @param name Property name.
     * @return List or null if not set.
     */
    public List<Object> getListProperty(String name) {
        Object value = map.get(name);
        if (value instanceof List) {
            return (List<Object>) value;
        }

        return null;
    }

    /**
     * Parses a boolean string.
     *
     * @param value        String value.
     * @param defaultValue Default value when not understood.
     * @return Boolean.
     */
    public static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null) {
            return defaultValue;
        }

        switch (value.trim().toLowerCase()) {
            case "1":
            case "true":
            case "yes":
            case "on":
                return true;
            case "0":
            case "false":
            case "no":
            case "off":
                return false;
            default:
                return defaultValue;
        }
    }
}
