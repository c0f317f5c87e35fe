package space.ketterling.climatetime.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.Javalin;
import space.ketterling.climatetime.cache.ResultCache;
import space.ketterling.climatetime.metrics.ExternalApiMetrics;

/**
 * Routes that report upstream health and manage the result cache.
 */
final class ApiRoutesMetrics {
    /**
     * Utility class; do not instantiate.
     */
    private ApiRoutesMetrics() {
    }

    /**
     * Registers metric and cache endpoints.
     */
    static void register(ApiServer api) {
        Javalin app = api.app();
        ObjectMapper om = api.om();
        ExternalApiMetrics metrics = api.metrics();
        ResultCache cache = api.cache();

        app.get("/api/metrics/external", ctx -> {
            ObjectNode out = om.createObjectNode();
            out.put("window_minutes", ExternalApiMetrics.WINDOW_MINUTES);
            ArrayNode services = out.putArray("services");

            for (var e : metrics.snapshot().entrySet()) {
                var snap = e.getValue();
                ObjectNode row = om.createObjectNode();
                row.put("service", e.getKey());
                row.put("calls_last_hour", snap.callsLastHour());
                row.put("failures_last_hour", snap.failuresLastHour());
                row.put("failure_pct", snap.failurePct());
                row.put("mean_latency_ms", snap.meanLatencyMs());
                row.put("status", snap.status());
                services.add(row);
            }

            ctx.json(out);
        });

        app.get("/api/cache/stats", ctx -> ctx.json(cache.stats()));

        app.delete("/api/cache", ctx -> {
            int removed = cache.clear();
            ctx.json(om.createObjectNode().put("cleared", removed));
        });
    }
}
