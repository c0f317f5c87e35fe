package space.ketterling.climatetime.metrics;

import java.time.Clock;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks call outcomes and latency for the upstream Open-Meteo endpoints.
 *
 * <p>
 * Counts are kept in per-minute buckets over a rolling 60-minute window, so a
 * burst of failures ages out on its own.
 * </p>
 */
public final class ExternalApiMetrics {
    public static final int WINDOW_MINUTES = 60;

    private final Clock clock;
    private final Map<String, Window> upstreams = new ConcurrentHashMap<>();

    public ExternalApiMetrics() {
        this(Clock.systemUTC());
    }

    public ExternalApiMetrics(Clock clock) {
        this.clock = clock;
    }

    /**
     * Records one call against the named upstream.
     */
    public void record(String upstream, boolean success, long latencyMs) {
        if (upstream == null || upstream.isBlank())
            return;
        upstreams.computeIfAbsent(upstream, k -> new Window()).add(currentMinute(), success, latencyMs);
    }

    /**
     * Per-upstream snapshot of the last hour, sorted by name.
     */
    public Map<String, UpstreamSnapshot> snapshot() {
        long nowMin = currentMinute();
        Map<String, UpstreamSnapshot> out = new TreeMap<>();
        upstreams.forEach((name, w) -> out.put(name, w.snapshot(nowMin)));
        return out;
    }

    private long currentMinute() {
        return clock.millis() / 60_000L;
    }

    /**
     * Health summary for one upstream.
     *
     * @param status one of no-data, ok, degraded, down
     */
    public record UpstreamSnapshot(
            long callsLastHour,
            long failuresLastHour,
            double failurePct,
            double meanLatencyMs,
            String status) {
    }

    private static final class Window {
        private final long[] minute = new long[WINDOW_MINUTES];
        private final long[] calls = new long[WINDOW_MINUTES];
        private final long[] failures = new long[WINDOW_MINUTES];
        private final long[] latencyMs = new long[WINDOW_MINUTES];

        private synchronized void add(long nowMin, boolean success, long elapsedMs) {
            int idx = (int) (nowMin % WINDOW_MINUTES);
            if (minute[idx] != nowMin) {
                minute[idx] = nowMin;
                calls[idx] = 0L;
                failures[idx] = 0L;
                latencyMs[idx] = 0L;
            }
            calls[idx]++;
            latencyMs[idx] += Math.max(0L, elapsedMs);
            if (!success)
                failures[idx]++;
        }

        private synchronized UpstreamSnapshot snapshot(long nowMin) {
            long callSum = 0L;
            long failSum = 0L;
            long latencySum = 0L;
            for (int i = 0; i < WINDOW_MINUTES; i++) {
                if (calls[i] == 0L || nowMin - minute[i] >= WINDOW_MINUTES)
                    continue;
                callSum += calls[i];
                failSum += failures[i];
                latencySum += latencyMs[i];
            }
            if (callSum == 0L) {
                return new UpstreamSnapshot(0L, 0L, 0.0, 0.0, "no-data");
            }
            double failurePct = failSum * 100.0 / callSum;
            String status = failurePct >= 50.0 ? "down" : failurePct >= 10.0 ? "degraded" : "ok";
            return new UpstreamSnapshot(callSum, failSum, failurePct, (double) latencySum / callSum, status);
        }
    }
}
