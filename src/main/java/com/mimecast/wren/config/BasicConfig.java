package com.mimecast.wren.config;

import java.io.IOException;
import java.util.Map;

/**
 * Basic configuration container.
 *
 * <p>Generic config for sections that do not warrant a typed class.
 */
public class BasicConfig extends ConfigFoundation {

    /**
     * Constructs a new BasicConfig instance.
     */
    public BasicConfig() {
        super();
    }

    /**
     * Constructs a new BasicConfig instance with given map.
     *
     * @param map Configuration map.
     */
    public BasicConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Constructs a new BasicConfig instance with configuration file path.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read file.
     */
    public BasicConfig(String path) throws IOException {
        super(path);
    }
}
