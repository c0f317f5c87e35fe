package space.ketterling.climatetime.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory key/value cache with a per-entry TTL.
 *
 * <p>
 * Expired entries are dropped lazily when read, and by a sweep that runs on
 * its own single-thread scheduler between {@link #start()} and
 * {@link #close()}. Writes are last-write-wins; every cached value is a pure
 * function of its key, so a racing duplicate write is harmless.
 * </p>
 */
public final class ResultCache implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ResultCache.class);

    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration sweepInterval;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong expirations = new AtomicLong();
    private final AtomicLong sweeps = new AtomicLong();

    private ScheduledExecutorService sweepExec;
    private ScheduledFuture<?> sweepTask;

    public ResultCache(Duration sweepInterval) {
        this(sweepInterval, Clock.systemUTC());
    }

    public ResultCache(Duration sweepInterval, Clock clock) {
        this.sweepInterval = sweepInterval;
        this.clock = clock;
    }

    /**
     * Starts the periodic sweep. Calling it twice is a no-op.
     */
    public synchronized void start() {
        if (sweepExec != null)
            return;
        sweepExec = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cache-sweep");
            t.setDaemon(true);
            return t;
        });
        long periodMs = sweepInterval.toMillis();
        sweepTask = sweepExec.scheduleWithFixedDelay(this::sweep, periodMs, periodMs, TimeUnit.MILLISECONDS);
        log.info("Result cache sweep scheduled every {}", sweepInterval);
    }

    public void set(String key, Object value, Duration ttl) {
        long expiresAt = clock.millis() + ttl.toMillis();
        entries.put(key, new CacheEntry(value, expiresAt));
        log.debug("Cache SET {} (ttl {})", key, ttl);
    }

    /**
     * Returns the value if it has not expired. A stale entry is removed on the
     * way out.
     */
    public <T> Optional<T> get(String key, Class<T> type) {
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            misses.incrementAndGet();
            log.debug("Cache MISS {}", key);
            return Optional.empty();
        }
        if (entry.isExpired(clock.millis())) {
            entries.remove(key, entry);
            expirations.incrementAndGet();
            misses.incrementAndGet();
            log.debug("Cache EXPIRED {}", key);
            return Optional.empty();
        }
        if (!type.isInstance(entry.value())) {
            misses.incrementAndGet();
            log.warn("Cache entry {} holds {}, expected {}", key, entry.value().getClass().getSimpleName(),
                    type.getSimpleName());
            return Optional.empty();
        }
        hits.incrementAndGet();
        log.debug("Cache HIT {}", key);
        return Optional.of(type.cast(entry.value()));
    }

    public boolean delete(String key) {
        return entries.remove(key) != null;
    }

    /**
     * Drops every entry.
     *
     * @return how many entries were removed
     */
    public int clear() {
        int size = entries.size();
        entries.clear();
        log.info("Cache CLEAR removed {} entries", size);
        return size;
    }

    public int size() {
        return entries.size();
    }

    /**
     * Removes every expired entry.
     *
     * @return how many entries were removed
     */
    public int cleanup() {
        long now = clock.millis();
        int removed = 0;
        for (var e : entries.entrySet()) {
            if (e.getValue().isExpired(now) && entries.remove(e.getKey(), e.getValue())) {
                removed++;
            }
        }
        expirations.addAndGet(removed);
        return removed;
    }

    public Stats stats() {
        return new Stats(entries.size(), hits.get(), misses.get(), expirations.get(), sweeps.get());
    }

    @Override
    public synchronized void close() {
        if (sweepTask != null)
            sweepTask.cancel(false);
        if (sweepExec != null) {
            sweepExec.shutdownNow();
            try {
                if (!sweepExec.awaitTermination(3, TimeUnit.SECONDS)) {
                    log.warn("cache-sweep did not terminate cleanly");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        sweepExec = null;
        sweepTask = null;
    }

    private void sweep() {
        MDC.put("job", "cache-sweep");
        try {
            int removed = cleanup();
            sweeps.incrementAndGet();
            if (removed > 0) {
                log.info("Cache CLEANUP removed {} expired entries", removed);
            }
        } catch (RuntimeException e) {
            log.error("Cache sweep failed", e);
        } finally {
            MDC.remove("job");
        }
    }

    private record CacheEntry(Object value, long expiresAtMs) {
        boolean isExpired(long nowMs) {
            return nowMs >= expiresAtMs;
        }
    }

    public record Stats(int entries, long hits, long misses, long expirations, long sweeps) {
    }
}
