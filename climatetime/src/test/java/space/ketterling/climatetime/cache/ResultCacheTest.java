package space.ketterling.climatetime.cache;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResultCacheTest {
    private MutableClock clock;
    private ResultCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        cache = new ResultCache(Duration.ofMinutes(30), clock);
    }

    @AfterEach
    void tearDown() {
        cache.close();
    }

    @Test
    void valueIsReturnedBeforeItsTtl() {
        cache.set("k", "v", Duration.ofHours(1));
        clock.advance(Duration.ofMinutes(59));

        assertEquals("v", cache.get("k", String.class).orElseThrow());
        assertEquals(1, cache.stats().hits());
    }

    @Test
    void entryExpiresExactlyAtTtlAndIsRemoved() {
        cache.set("k", "v", Duration.ofHours(1));
        clock.advance(Duration.ofHours(1));

        assertTrue(cache.get("k", String.class).isEmpty());
        assertEquals(0, cache.size());
        assertEquals(1, cache.stats().expirations());
        assertEquals(1, cache.stats().misses());
    }

    @Test
    void laterWriteWins() {
        cache.set("k", "first", Duration.ofHours(1));
        cache.set("k", "second", Duration.ofHours(1));

        assertEquals("second", cache.get("k", String.class).orElseThrow());
    }

    @Test
    void wrongTypeIsAMiss() {
        cache.set("k", 42, Duration.ofHours(1));

        assertTrue(cache.get("k", String.class).isEmpty());
        assertEquals(42, cache.get("k", Integer.class).orElseThrow());
    }

    @Test
    void cleanupDropsOnlyExpiredEntries() {
        cache.set("short", "a", Duration.ofMinutes(5));
        cache.set("long", "b", Duration.ofDays(7));
        clock.advance(Duration.ofMinutes(10));

        assertEquals(1, cache.cleanup());
        assertEquals(1, cache.size());
        assertTrue(cache.get("long", String.class).isPresent());
    }

    @Test
    void deleteAndClear() {
        cache.set("a", "1", Duration.ofHours(1));
        cache.set("b", "2", Duration.ofHours(1));
        cache.set("c", "3", Duration.ofHours(1));

        assertTrue(cache.delete("a"));
        assertFalse(cache.delete("a"));
        assertEquals(2, cache.clear());
        assertEquals(0, cache.size());
    }

    @Test
    void startAndCloseAreIdempotent() {
        cache.start();
        cache.start();
        cache.close();
        cache.close();
    }

    /** Clock whose instant only moves when told to. */
    static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
