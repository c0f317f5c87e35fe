/*
* Copyright 2025 Taylor Ketterling
* API Server for ClimateTime, a historical climate and scenario projection service.
* utalizes Javalin for HTTP server and provides historical, future and operations endpoints.
* uses Jackson for JSON processing.
*/

package space.ketterling.climatetime.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.climatetime.cache.ResultCache;
import space.ketterling.climatetime.config.AppConfig;
import space.ketterling.climatetime.future.FutureClimateService;
import space.ketterling.climatetime.historical.HistoricalClimateService;
import space.ketterling.climatetime.metrics.ExternalApiMetrics;
import space.ketterling.climatetime.openmeteo.OpenMeteoException;

import java.time.Clock;

public class ApiServer {
    private static final Logger log = LoggerFactory.getLogger(ApiServer.class);

    private final AppConfig cfg;
    private final ObjectMapper om;
    private final HistoricalClimateService historical;
    private final FutureClimateService future;
    private final ResultCache cache;
    private final ExternalApiMetrics metrics;
    private final Clock clock;
    private final ApiParams params;
    private Javalin app;

    public ApiServer(AppConfig cfg, ObjectMapper om, HistoricalClimateService historical, FutureClimateService future,
            ResultCache cache, ExternalApiMetrics metrics, Clock clock) {
        this.cfg = cfg;
        this.om = om;
        this.historical = historical;
        this.future = future;
        this.cache = cache;
        this.metrics = metrics;
        this.clock = clock;
        this.params = new ApiParams(clock);
    }

    public void start() {
        app = Javalin.create(j -> {
            j.http.defaultContentType = "application/json";
            j.jsonMapper(new JavalinJackson(om, false));
            j.bundledPlugins.enableCors(cors -> cors.addRule(r -> r.anyHost()));
        });

        // Basic request logging + record start time for latency measurement
        app.before(ctx -> {
            ctx.attribute("startTime", System.currentTimeMillis());
            log.info("Incoming {} {} from {}", ctx.method(), ctx.path(), ctx.ip());
            ctx.header("Access-Control-Max-Age", "600");
        });

        // After-handler to log response status and duration
        app.after(ctx -> {
            Long t0 = ctx.attribute("startTime");
            long ms = (t0 == null) ? -1 : (System.currentTimeMillis() - t0);
            log.info("Handled {} {} -> {} ({} ms)", ctx.method(), ctx.path(), ctx.status(), ms);
        });

        app.exception(InvalidRequestException.class, (e, ctx) -> {
            log.warn("Rejected {} {}: {}", ctx.method(), ctx.path(), e.getMessage());
            ctx.status(400).json(om.createObjectNode().put("error", e.getMessage()));
        });

        app.exception(OpenMeteoException.class, (e, ctx) -> {
            log.warn("Upstream failure on {} {}: {}", ctx.method(), ctx.path(), e.getMessage());
            ctx.status(502).json(om.createObjectNode()
                    .put("error", "upstream_error")
                    .put("message", e.getMessage()));
        });

        // Helpful JSON error instead of default HTML-ish errors
        app.exception(Exception.class, (e, ctx) -> {
            log.error("Unhandled error on {} {}", ctx.method(), ctx.path(), e);
            ctx.status(500).json(om.createObjectNode()
                    .put("error", "internal_error")
                    .put("message", e.getMessage() == null ? "Unknown error" : e.getMessage()));
        });

        ApiRoutesRoot.register(this);
        ApiRoutesHistorical.register(this);
        ApiRoutesFuture.register(this);
        ApiRoutesMetrics.register(this);

        app.start(cfg.apiPort());
        log.info("API server listening on port {}", app.port());
    }

    public void stop() {
        if (app != null)
            app.stop();
        log.info("API server stopped");
    }

    /** Bound port, which differs from the configured one when that is 0. */
    public int port() {
        return app.port();
    }

    Javalin app() {
        return app;
    }

    ObjectMapper om() {
        return om;
    }

    Clock clock() {
        return clock;
    }

    ApiParams params() {
        return params;
    }

    HistoricalClimateService historical() {
        return historical;
    }

    FutureClimateService future() {
        return future;
    }

    ResultCache cache() {
        return cache;
    }

    ExternalApiMetrics metrics() {
        return metrics;
    }
}
