package com.mimecast.wren.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Local domains configuration.
 */
public class DomainsConfig extends BasicConfig {

    /**
     * Constructs a new DomainsConfig instance with given map.
     *
     * @param map Configuration map.
     */
    public DomainsConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Gets URL serving the authoritative domain list.
     *
     * @return URL string or empty if none.
     */
    public String getUrl() {
        return getStringProperty("url", "");
    }

    /**
     * Gets static domain list used until the first refresh or when refresh fails.
     *
     * @return List of lowercase domains.
     */
    public List<String> getLocal() {
        List<String> domains = new ArrayList<>();
        List<Object> list = getListProperty("local");
        if (list != null) {
            for (Object entry : list) {
                String domain = String.valueOf(entry).trim().toLowerCase();
                if (!domain.isEmpty()) {
                    domains.add(domain);
                }
            }
        }
        return domains;
    }

    /**
     * Gets cache time to live in milliseconds.
     *
     * @return TTL value.
     */
    public long getCacheTtlMs() {
        return getLongProperty("cacheTtlMs", 5L * 60 * 1000);
    }
}
