package space.ketterling.climatetime.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class AppConfigTest {

    @Test
    void defaultsApplyWhenNothingIsSet() {
        AppConfig cfg = AppConfig.fromProperties(new Properties());

        assertEquals(Duration.ofSeconds(2), cfg.yearFetchInterval());
        assertEquals(2050, cfg.upstreamLastStartYear());
        assertEquals(Duration.ofDays(30), cfg.ttlTrends());
        assertEquals(Duration.ofDays(1), cfg.ttlDaily());
        assertEquals(ZoneId.of("UTC"), cfg.clockZoneId());
    }

    @Test
    void propertiesOverrideDefaults() {
        Properties p = new Properties();
        p.setProperty("openMeteo.archiveUrl", "http://localhost:9999/v1/archive");
        p.setProperty("yearFetch.interval", "PT0.5S");
        p.setProperty("projection.upstreamLastStartYear", "2040");

        AppConfig cfg = AppConfig.fromProperties(p);

        assertEquals("http://localhost:9999/v1/archive", cfg.archiveUrl());
        assertEquals(Duration.ofMillis(500), cfg.yearFetchInterval());
        assertEquals(2040, cfg.upstreamLastStartYear());
    }

    @Test
    void projectionPoolNeedsAThread() {
        Properties p = new Properties();
        p.setProperty("projection.threads", "0");

        assertThrows(IllegalStateException.class, () -> AppConfig.fromProperties(p));
    }

    @Test
    void cacheSweepIntervalMustBePositive() {
        for (String interval : new String[] { "PT0S", "-PT5M" }) {
            Properties p = new Properties();
            p.setProperty("cache.sweepInterval", interval);

            assertThrows(IllegalStateException.class, () -> AppConfig.fromProperties(p), interval);
        }
    }
}
