package space.ketterling.climatetime.api;

import io.javalin.Javalin;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root and health endpoints for the API.
 */
final class ApiRoutesRoot {
    /**
     * Utility class; do not instantiate.
     */
    private ApiRoutesRoot() {
    }

    /**
     * Registers root and health endpoints.
     */
    static void register(ApiServer api) {
        Javalin app = api.app();

        app.get("/", ctx -> ctx.json(Map.of(
                "service", "climatetime",
                "status", "ok",
                "endpoints", new String[] {
                        "GET /health",
                        "GET /api/historical/weather?lat=40.71&lon=-74.01&startDate=2020-01-01&endDate=2020-12-31",
                        "GET /api/historical/yearly?lat=40.71&lon=-74.01&years=2019,2020,2021",
                        "GET /api/historical/decades?lat=40.71&lon=-74.01&startDecade=1980&endDecade=2010",
                        "GET /api/historical/trends?lat=40.71&lon=-74.01&startYear=1990&endYear=2020",
                        "GET /api/future/projections?lat=40.71&lon=-74.01&scenario=moderate",
                        "GET /api/future/scenarios?lat=40.71&lon=-74.01",
                        "GET /api/future/periods?lat=40.71&lon=-74.01&scenario=moderate&periods=2030s,2050s",
                        "GET /api/future/summary?lat=40.71&lon=-74.01",
                        "GET /api/metrics/external",
                        "GET /api/cache/stats",
                        "DELETE /api/cache"
                })));

        app.get("/health", ctx -> {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("status", "ok");
            out.put("time", OffsetDateTime.now(api.clock()).toString());
            out.put("cacheEntries", api.cache().size());
            ctx.json(out);
        });
    }
}
