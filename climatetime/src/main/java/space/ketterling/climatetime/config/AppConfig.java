package space.ketterling.climatetime.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Properties;

/**
 * Application configuration loaded from environment variables or properties.
 *
 * <p>
 * Groups the runtime settings for the API, the Open-Meteo upstreams, request
 * pacing, scenario projection and the result cache.
 * </p>
 */
public record AppConfig(
        // API
        int apiPort,

        // Open-Meteo
        String archiveUrl,
        String climateUrl,
        Duration archiveTimeout,
        Duration climateTimeout,

        // Pacing between per-year archive calls
        Duration yearFetchInterval,

        // Projections
        int projectionThreads,
        int upstreamLastStartYear,

        // Cache
        Duration cacheSweepInterval,
        Duration ttlYearly,
        Duration ttlDecades,
        Duration ttlTrends,
        Duration ttlProjections,
        Duration ttlDaily,

        // Time
        ZoneId clockZoneId) {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    /**
     * Loads configuration using environment variables, system properties, and
     * application.properties (in that order).
     */
    public static AppConfig load() {
        Properties p = new Properties();
        try (InputStream in = AppConfig.class.getClassLoader().getResourceAsStream("application.properties")) {
            if (in != null)
                p.load(in);
        } catch (IOException e) {
            log.warn("Could not read application.properties, using defaults: {}", e.getMessage());
        }
        return fromProperties(p);
    }

    /**
     * Builds a config from the given properties, still letting env vars and
     * -D properties win.
     */
    public static AppConfig fromProperties(Properties p) {
        int port = Integer.parseInt(envOr(p, "API_PORT", "api.port", "8080"));

        String archiveUrl = requireNonBlank(envOr(p, "OPEN_METEO_ARCHIVE_URL", "openMeteo.archiveUrl",
                "https://archive-api.open-meteo.com/v1/archive"));
        String climateUrl = requireNonBlank(envOr(p, "OPEN_METEO_CLIMATE_URL", "openMeteo.climateUrl",
                "https://climate-api.open-meteo.com/v1/climate"));
        Duration archiveTimeout = Duration.parse(envOr(p, "OPEN_METEO_ARCHIVE_TIMEOUT", "openMeteo.archiveTimeout",
                "PT10S"));
        Duration climateTimeout = Duration.parse(envOr(p, "OPEN_METEO_CLIMATE_TIMEOUT", "openMeteo.climateTimeout",
                "PT15S"));

        // ~10k calls/day upstream quota
        Duration yearFetchInterval = Duration.parse(envOr(p, "YEAR_FETCH_INTERVAL", "yearFetch.interval", "PT2S"));

        int projectionThreads = Integer.parseInt(envOr(p, "PROJECTION_THREADS", "projection.threads", "8"));
        int upstreamLastStartYear = Integer.parseInt(envOr(p, "PROJECTION_UPSTREAM_LAST_START_YEAR",
                "projection.upstreamLastStartYear", "2050"));

        Duration sweep = Duration.parse(envOr(p, "CACHE_SWEEP_INTERVAL", "cache.sweepInterval", "PT30M"));
        Duration ttlYearly = Duration.parse(envOr(p, "CACHE_TTL_YEARLY", "cache.ttl.yearly", "P7D"));
        Duration ttlDecades = Duration.parse(envOr(p, "CACHE_TTL_DECADES", "cache.ttl.decades", "P7D"));
        Duration ttlTrends = Duration.parse(envOr(p, "CACHE_TTL_TRENDS", "cache.ttl.trends", "P30D"));
        Duration ttlProjections = Duration.parse(envOr(p, "CACHE_TTL_PROJECTIONS", "cache.ttl.projections", "P7D"));
        Duration ttlDaily = Duration.parse(envOr(p, "CACHE_TTL_DAILY", "cache.ttl.daily", "P1D"));

        ZoneId zoneId = ZoneId.of(envOr(p, "CLOCK_ZONE", "clock.zone", "UTC"));

        if (projectionThreads < 1) {
            throw new IllegalStateException("projection.threads must be at least 1");
        }
        if (sweep.isZero() || sweep.isNegative()) {
            throw new IllegalStateException("cache.sweepInterval must be positive, got " + sweep);
        }

        // constructor args must match record field order exactly
        return new AppConfig(
                port,

                archiveUrl,
                climateUrl,
                archiveTimeout,
                climateTimeout,

                yearFetchInterval,

                projectionThreads,
                upstreamLastStartYear,

                sweep,
                ttlYearly,
                ttlDecades,
                ttlTrends,
                ttlProjections,
                ttlDaily,

                zoneId);
    }

    // ----------------------------
    // helpers
    // ----------------------------
    /**
     * Reads a value from env, then JVM property, then properties file fallback.
     */
    private static String envOr(Properties p, String envKey, String propKey, String def) {
        String v = System.getenv(envKey);
        if (v != null && !v.isBlank())
            return v;
        String sys = System.getProperty(propKey);
        if (sys != null && !sys.isBlank())
            return sys;
        return p.getProperty(propKey, def);
    }

    /**
     * Ensures a required config value is present and not blank.
     */
    private static String requireNonBlank(String v) {
        if (v == null || v.isBlank()) {
            throw new IllegalStateException(
                    "Missing required config value (env var, -Dprop, or application.properties).");
        }
        return v;
    }
}
