package space.ketterling.climatetime.api;

import io.javalin.Javalin;
import space.ketterling.climatetime.historical.HistoricalClimateService;

import java.time.LocalDate;
import java.util.List;

/**
 * Routes for observed history: raw daily data, yearly and decadal rollups and
 * trends. The multi-year routes block while years are fetched one by one.
 */
final class ApiRoutesHistorical {
    /**
     * Utility class; do not instantiate.
     */
    private ApiRoutesHistorical() {
    }

    static void register(ApiServer api) {
        Javalin app = api.app();
        ApiParams params = api.params();
        HistoricalClimateService historical = api.historical();

        app.get("/api/historical/weather", ctx -> {
            double[] ll = params.latLon(ctx);
            LocalDate[] range = params.dateRange(ctx);
            ctx.json(historical.daily(ll[0], ll[1], range[0], range[1]));
        });

        app.get("/api/historical/yearly", ctx -> {
            double[] ll = params.latLon(ctx);
            List<Integer> years = params.years(ctx);
            ctx.json(historical.yearly(ll[0], ll[1], years));
        });

        app.get("/api/historical/decades", ctx -> {
            double[] ll = params.latLon(ctx);
            int[] decades = params.decades(ctx);
            ctx.json(historical.decades(ll[0], ll[1], decades[0], decades[1], params.lastCompleteYear()));
        });

        app.get("/api/historical/trends", ctx -> {
            double[] ll = params.latLon(ctx);
            int[] span = params.trendYears(ctx);
            ctx.json(historical.trends(ll[0], ll[1], span[0], span[1]));
        });
    }
}
