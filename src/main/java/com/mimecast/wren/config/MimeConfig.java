package com.mimecast.wren.config;

import java.util.Map;

/**
 * Payload content configuration.
 *
 * <p>Controls which decoded parts are sent downstream.
 */
public class MimeConfig extends BasicConfig {

    /**
     * Constructs a new MimeConfig instance with given map.
     *
     * @param map Configuration map.
     */
    public MimeConfig(Map<String, Object> map) {
        super(map);
    }

    public boolean isIncludeHeaders() {
        return getBooleanProperty("includeHeaders", true);
    }

    public boolean isIncludeBody() {
        return getBooleanProperty("includeBody", true);
    }

    public boolean isIncludeAttachments() {
        return getBooleanProperty("includeAttachments", true);
    }

    /**
     * Gets primary charset strategy name.
     * <p>native or fallback, the other one becomes the fallback.
     *
     * @return Strategy name.
     */
    public String getPrimaryStrategy() {
        return getStringProperty("primaryStrategy", "native").trim().toLowerCase();
    }
}
