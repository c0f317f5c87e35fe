/*
* Copyright 2025 Taylor Ketterling
* Main application entry point for ClimateTime, a historical climate and scenario projection service.
*
* Initializes configuration, the Open-Meteo client, request pacing, the result cache,
* the historical and future climate services, and starts the API server.
* Startup flow wires everything in dependency order; program also handles a graceful shutdown.
*/

package space.ketterling.climatetime;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.climatetime.api.ApiServer;
import space.ketterling.climatetime.cache.ResultCache;
import space.ketterling.climatetime.config.AppConfig;
import space.ketterling.climatetime.future.FutureClimateService;
import space.ketterling.climatetime.future.ProjectionExtrapolator;
import space.ketterling.climatetime.future.ScenarioProjectionEngine;
import space.ketterling.climatetime.future.SyntheticProjections;
import space.ketterling.climatetime.historical.DecadalAggregator;
import space.ketterling.climatetime.historical.HistoricalClimateService;
import space.ketterling.climatetime.historical.TrendAnalyzer;
import space.ketterling.climatetime.historical.YearFetcher;
import space.ketterling.climatetime.historical.YearlyAggregator;
import space.ketterling.climatetime.metrics.ExternalApiMetrics;
import space.ketterling.climatetime.openmeteo.OpenMeteoClient;
import space.ketterling.climatetime.pacing.FixedIntervalPacer;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

public final class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) throws Exception {
        log.info("Starting application");
        AppConfig cfg = AppConfig.load();
        Clock clock = Clock.system(cfg.clockZoneId());

        ObjectMapper om = new ObjectMapper();
        ExternalApiMetrics metrics = new ExternalApiMetrics(clock);
        OpenMeteoClient openMeteo = new OpenMeteoClient(cfg, om, metrics);

        // One pacer for the whole process so concurrent requests share the quota
        FixedIntervalPacer pacer = new FixedIntervalPacer(cfg.yearFetchInterval());

        ResultCache cache = new ResultCache(cfg.cacheSweepInterval(), clock);
        cache.start();

        HistoricalClimateService historical = new HistoricalClimateService(
                cfg,
                openMeteo,
                new YearFetcher(openMeteo, pacer, new YearlyAggregator()),
                new DecadalAggregator(),
                new TrendAnalyzer(),
                cache);

        ExecutorService projectionPool = Executors.newFixedThreadPool(cfg.projectionThreads(), namedThreads());
        ScenarioProjectionEngine engine = new ScenarioProjectionEngine(
                openMeteo,
                projectionPool,
                cfg.upstreamLastStartYear(),
                new ProjectionExtrapolator(),
                new SyntheticProjections(),
                clock);
        FutureClimateService future = new FutureClimateService(engine, cache, cfg.ttlProjections());

        ApiServer api = new ApiServer(cfg, om, historical, future, cache, metrics, clock);
        api.start();
        log.info("API server started on port {}", api.port());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                log.info("Shutting down...");
                api.stop();
                projectionPool.shutdown();
                if (!projectionPool.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("Projection pool did not terminate cleanly");
                    projectionPool.shutdownNow();
                }
                cache.close();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (Exception e) {
                log.error("Shutdown error", e);
            }
        }));
    }

    private static ThreadFactory namedThreads() {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "projection-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
