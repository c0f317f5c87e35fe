package space.ketterling.climatetime.api;

import io.javalin.Javalin;
import space.ketterling.climatetime.future.FutureClimateService;
import space.ketterling.climatetime.model.ProjectionWindow;
import space.ketterling.climatetime.model.Scenario;

import java.util.List;

/**
 * Routes for scenario projections. They always answer 200; an upstream outage
 * shows up as {@code metadata.source = "synthetic"} in the body.
 */
final class ApiRoutesFuture {
    /**
     * Utility class; do not instantiate.
     */
    private ApiRoutesFuture() {
    }

    static void register(ApiServer api) {
        Javalin app = api.app();
        ApiParams params = api.params();
        FutureClimateService future = api.future();

        app.get("/api/future/projections", ctx -> {
            double[] ll = params.latLon(ctx);
            Scenario scenario = params.scenario(ctx);
            ctx.json(future.projections(ll[0], ll[1], scenario));
        });

        app.get("/api/future/scenarios", ctx -> {
            double[] ll = params.latLon(ctx);
            ctx.json(future.allScenarios(ll[0], ll[1]));
        });

        app.get("/api/future/periods", ctx -> {
            double[] ll = params.latLon(ctx);
            Scenario scenario = params.scenario(ctx);
            List<ProjectionWindow> periods = params.periods(ctx, FutureClimateService.DEFAULT_PERIODS);
            ctx.json(future.periods(ll[0], ll[1], scenario, periods));
        });

        app.get("/api/future/summary", ctx -> {
            double[] ll = params.latLon(ctx);
            ctx.json(future.summary(ll[0], ll[1]));
        });
    }
}
