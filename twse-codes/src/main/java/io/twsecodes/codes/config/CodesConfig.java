package io.twsecodes.codes.config;

import io.twsecodes.codes.source.ListingSource;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Runtime settings. Each value comes from a system property, else an environment variable, else a default.
 *
 * @param fallbackCsv null to use the CSV bundled on the classpath
 */
public record CodesConfig(
        String jdbcUrl,
        String jdbcUser,
        String jdbcPassword,
        Path cacheDir,
        Path fallbackCsv,
        Map<ListingSource, URI> endpoints,
        Duration httpTimeout
) {
    public static final String DEFAULT_JDBC_URL = "jdbc:h2:file:./twse_codes;DB_CLOSE_DELAY=-1";

    public CodesConfig {
        endpoints = Map.copyOf(endpoints);
    }

    public static CodesConfig fromEnv() {
        String url = get("codes.jdbc.url", "CODES_JDBC_URL", DEFAULT_JDBC_URL);
        String user = get("codes.jdbc.user", "CODES_JDBC_USER", null);
        String password = get("codes.jdbc.password", "CODES_JDBC_PASSWORD", null);
        Path cache = Path.of(get("codes.cache.dir", "CODES_CACHE_DIR", "./.codes-cache"));
        String fallback = get("codes.fallback.csv", "CODES_FALLBACK_CSV", null);
        Map<ListingSource, URI> endpoints = new EnumMap<>(ListingSource.class);
        endpoints.put(ListingSource.LISTED, URI.create(get("codes.url.listed", "CODES_URL_LISTED", ListingSource.LISTED.defaultUri().toString())));
        endpoints.put(ListingSource.OTC, URI.create(get("codes.url.otc", "CODES_URL_OTC", ListingSource.OTC.defaultUri().toString())));
        endpoints.put(ListingSource.FUTURES_INDEX, URI.create(get("codes.url.futures", "CODES_URL_FUTURES", ListingSource.FUTURES_INDEX.defaultUri().toString())));
        long timeout = Long.parseLong(get("codes.http.timeout.seconds", "CODES_HTTP_TIMEOUT_SECONDS", "30"));
        return new CodesConfig(url, user, password, cache, fallback == null ? null : Path.of(fallback), endpoints, Duration.ofSeconds(timeout));
    }

    private static String get(String property, String env, String def) {
        String v = System.getProperty(property, System.getenv().getOrDefault(env, def));
        return v == null || v.isBlank() ? def : v;
    }
}
