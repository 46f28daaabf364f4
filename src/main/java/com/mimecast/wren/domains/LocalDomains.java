package com.mimecast.wren.domains;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.mimecast.wren.config.DomainsConfig;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongSupplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Local domain cache.
 *
 * <p>Owns the list of domains that receive inbound mail.
 * <br>A timer refreshes it from the domains URL, JSON of the form {"domains": [...]}.
 * <br>Fetched domains are used while younger than the TTL, the configured list otherwise.
 * <br>Failed or empty refreshes keep the previous state.
 *
 * <p>{@link #isLocal(String)} and friends only read the cache, they never do I/O.
 */
public class LocalDomains implements Closeable {
    private static final Logger log = LogManager.getLogger(LocalDomains.class);

    private static final Pattern ANGLE_ADDRESS = Pattern.compile("<([^>]+)>");
    private static final int FETCH_TIMEOUT_SECONDS = 10;

    private final String url;
    private final String apiKey;
    private final List<String> staticDomains;
    private final long ttlMs;
    private final LongSupplier clock;
    private final OkHttpClient httpClient;
    private final AtomicBoolean refreshing = new AtomicBoolean(false);

    private volatile List<String> cached;
    private volatile long cachedAt;
    private ScheduledExecutorService scheduler;

    /**
     * Constructs a new LocalDomains instance.
     *
     * @param config Domains configuration.
     * @param apiKey API key sent as X-API-Key.
     */
    public LocalDomains(DomainsConfig config, String apiKey) {
        this(config, apiKey, System::currentTimeMillis);
    }

    /**
     * Constructs a new LocalDomains instance with given clock.
     *
     * @param config Domains configuration.
     * @param apiKey API key sent as X-API-Key.
     * @param clock  Millisecond clock.
     */
    public LocalDomains(DomainsConfig config, String apiKey, LongSupplier clock) {
        this.url = config.getUrl();
        this.apiKey = apiKey;
        this.staticDomains = Collections.unmodifiableList(config.getLocal());
        this.ttlMs = Math.max(1000L, config.getCacheTtlMs());
        this.clock = clock;
        this.httpClient = new OkHttpClient.Builder()
                .connectTimeout(FETCH_TIMEOUT_SECONDS, TimeUnit.SECONDS)
                .readTimeout(FETCH_TIMEOUT_SECONDS, TimeUnit.SECONDS)
                .callTimeout(FETCH_TIMEOUT_SECONDS, TimeUnit.SECONDS)
                .build();
    }

    /**
     * Runs the first refresh and schedules the periodic one.
     * <p>Does nothing beyond logging when no domains URL is configured.
     */
    public synchronized void start() {
        if (url == null || url.isBlank()) {
            log.info("Local domains from configuration: {}", staticDomains);
            return;
        }

        if (scheduler != null) {
            return;
        }

        refresh();

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "domains-refresh");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleAtFixedRate(() -> {
            try {
                refresh();
            } catch (RuntimeException e) {
                log.error("Periodic domain refresh failed: {}", e.getMessage(), e);
            }
        }, ttlMs, ttlMs, TimeUnit.MILLISECONDS);

        log.info("Local domains refresh scheduled: url={}, ttlMs={}", url, ttlMs);
    }

    /**
     * Refreshes the cache from the domains URL.
     * <p>Concurrent calls are skipped while one is in progress.
     *
     * @return Domains in effect after the refresh.
     */
    public List<String> refresh() {
        if (url == null || url.isBlank()) {
            return getDomains();
        }

        if (!refreshing.compareAndSet(false, true)) {
            log.debug("Domain refresh already in progress, skipping");
            return getDomains();
        }

        try {
            List<String> fetched = fetch();
            if (fetched.isEmpty()) {
                log.warn("No domains returned from {}, keeping existing cache", url);
            } else {
                cached = Collections.unmodifiableList(fetched);
                cachedAt = clock.getAsLong();
                log.info("Domain cache updated with {} domains", fetched.size());
            }
        } catch (IOException | JsonParseException | IllegalStateException e) {
            log.warn("Failed to refresh domains from {}: {}", url, e.getMessage());
        } finally {
            refreshing.set(false);
        }

        return getDomains();
    }

    /**
     * Fetches the domain list.
     */
    private List<String> fetch() throws IOException {
        HttpUrl httpUrl = HttpUrl.parse(url);
        if (httpUrl == null) {
            throw new IOException("Invalid URL scheme: only http/https allowed: " + url);
        }

        Request request = new Request.Builder()
                .url(httpUrl)
                .header("X-API-Key", apiKey != null ? apiKey : "")
                .header("Accept", "application/json")
                .get()
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException("HTTP " + response.code());
            }

            ResponseBody body = response.body();
            JsonElement json = JsonParser.parseString(body != null ? body.string() : "");

            List<String> domains = new ArrayList<>();
            if (json.isJsonObject()) {
                JsonObject object = json.getAsJsonObject();
                if (object.has("domains") && object.get("domains").isJsonArray()) {
                    JsonArray array = object.getAsJsonArray("domains");
                    for (JsonElement element : array) {
                        if (element.isJsonPrimitive() && !element.getAsString().isBlank()) {
                            domains.add(element.getAsString().trim().toLowerCase(Locale.ROOT));
                        }
                    }
                }
            }
            return domains;
        }
    }

    /**
     * Gets domains currently in effect.
     *
     * @return Fetched domains while fresh, configured domains otherwise.
     */
    public List<String> getDomains() {
        List<String> current = cached;
        if (current != null && clock.getAsLong() - cachedAt < ttlMs) {
            return current;
        }
        return staticDomains;
    }

    /**
     * Checks if a domain is local.
     *
     * @param domain Domain name.
     * @return Boolean.
     */
    public boolean isLocal(String domain) {
        if (domain == null || domain.isBlank()) {
            return false;
        }
        return getDomains().contains(domain.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * Checks if an address is on a local domain.
     *
     * @param address Address, display name form accepted.
     * @return Boolean.
     */
    public boolean isLocalAddress(String address) {
        return isLocal(extractDomain(address));
    }

    /**
     * Gets first recipient on a local domain.
     *
     * @param recipients Recipient addresses.
     * @return Local recipient, else the first recipient, else empty string.
     */
    public String firstLocal(List<String> recipients) {
        if (recipients == null || recipients.isEmpty()) {
            return "";
        }

        for (String recipient : recipients) {
            if (isLocalAddress(recipient)) {
                return recipient;
            }
        }
        return recipients.get(0);
    }

    /**
     * Extracts the domain of an address.
     * <p>Handles "user@domain" and "Name &lt;user@domain&gt;".
     *
     * @param address Address.
     * @return Lowercase domain or null.
     */
    public static String extractDomain(String address) {
        String email = extractEmail(address);
        String[] parts = email.split("@", -1);
        if (parts.length != 2 || parts[1].isBlank()) {
            return null;
        }
        return parts[1].trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Extracts the bare address.
     *
     * @param address Address, display name form accepted.
     * @return Bare address, empty string for null.
     */
    public static String extractEmail(String address) {
        if (address == null) {
            return "";
        }
        Matcher matcher = ANGLE_ADDRESS.matcher(address);
        return matcher.find() ? matcher.group(1).trim() : address.trim();
    }

    /**
     * Stops the refresh timer.
     */
    @Override
    public synchronized void close() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
        httpClient.dispatcher().executorService().shutdown();
    }
}
