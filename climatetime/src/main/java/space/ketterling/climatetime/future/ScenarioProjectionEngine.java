package space.ketterling.climatetime.future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.climatetime.historical.DailyStats;
import space.ketterling.climatetime.model.Baseline;
import space.ketterling.climatetime.model.ChangeFromBaseline;
import space.ketterling.climatetime.model.DailyArchive;
import space.ketterling.climatetime.model.DataSource;
import space.ketterling.climatetime.model.Location;
import space.ketterling.climatetime.model.ProjectionMetadata;
import space.ketterling.climatetime.model.ProjectionPeriod;
import space.ketterling.climatetime.model.ProjectionWindow;
import space.ketterling.climatetime.model.Scenario;
import space.ketterling.climatetime.model.ScenarioProjection;
import space.ketterling.climatetime.model.ScenarioSet;
import space.ketterling.climatetime.openmeteo.OpenMeteoClient;
import space.ketterling.climatetime.openmeteo.OpenMeteoException;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Builds four-decade projections per emission scenario.
 *
 * <p>
 * Periods the climate API covers are fetched concurrently on the given
 * executor; later periods are extrapolated. If any fetched period fails, the
 * whole projection is replaced by {@link SyntheticProjections}, never a mix of
 * real and synthetic periods. Nothing here blocks on a pool thread; callers
 * join the returned futures.
 * </p>
 */
public class ScenarioProjectionEngine {
    private static final Logger log = LoggerFactory.getLogger(ScenarioProjectionEngine.class);

    static final String DATA_SOURCE = "Open-Meteo Climate API (CMIP6)";
    static final String CONFIDENCE = "Medium-High (CMIP6 multi-model ensemble)";

    private final OpenMeteoClient client;
    private final Executor executor;
    private final int upstreamLastStartYear;
    private final ProjectionExtrapolator extrapolator;
    private final SyntheticProjections synthetic;
    private final Clock clock;
    private final Baseline baseline = Baseline.REFERENCE;

    public ScenarioProjectionEngine(OpenMeteoClient client, Executor executor, int upstreamLastStartYear,
            ProjectionExtrapolator extrapolator, SyntheticProjections synthetic, Clock clock) {
        this.client = client;
        this.executor = executor;
        this.upstreamLastStartYear = upstreamLastStartYear;
        this.extrapolator = extrapolator;
        this.synthetic = synthetic;
        this.clock = clock;
    }

    public CompletableFuture<ScenarioProjection> project(double lat, double lon, Scenario scenario) {
        log.info("Building {} projections for {},{}", scenario.id(), lat, lon);
        Location location = new Location(lat, lon);

        List<CompletableFuture<ProjectionPeriod>> periods = new ArrayList<>();
        for (ProjectionWindow w : ProjectionWindow.values()) {
            periods.add(periodAsync(lat, lon, scenario, w));
        }

        return CompletableFuture.allOf(periods.toArray(new CompletableFuture<?>[0]))
                .handle((ignored, err) -> {
                    if (err != null) {
                        Throwable cause = err instanceof CompletionException && err.getCause() != null
                                ? err.getCause()
                                : err;
                        log.warn("Projection fetch failed for {} at {},{}, falling back to synthetic: {}",
                                scenario.id(), lat, lon, cause.getMessage());
                        return synthetic.build(location, scenario, clock.instant());
                    }
                    List<ProjectionPeriod> done = periods.stream().map(CompletableFuture::join).toList();
                    log.info("Retrieved {} projection periods for {}", done.size(), scenario.id());
                    return new ScenarioProjection(
                            location,
                            scenario,
                            scenario.model(),
                            done,
                            baseline,
                            new ProjectionMetadata(DataSource.REAL, DATA_SOURCE, clock.instant().toString(),
                                    CONFIDENCE));
                });
    }

    /**
     * All three scenarios, computed concurrently.
     */
    public CompletableFuture<ScenarioSet> compare(double lat, double lon) {
        log.info("Fetching all climate scenarios for {},{}", lat, lon);
        CompletableFuture<ScenarioProjection> optimistic = project(lat, lon, Scenario.OPTIMISTIC);
        CompletableFuture<ScenarioProjection> moderate = project(lat, lon, Scenario.MODERATE);
        CompletableFuture<ScenarioProjection> pessimistic = project(lat, lon, Scenario.PESSIMISTIC);
        return CompletableFuture.allOf(optimistic, moderate, pessimistic)
                .thenApply(v -> new ScenarioSet(optimistic.join(), moderate.join(), pessimistic.join()));
    }

    private CompletableFuture<ProjectionPeriod> periodAsync(double lat, double lon, Scenario scenario,
            ProjectionWindow window) {
        if (window.startYear() > upstreamLastStartYear) {
            return CompletableFuture.completedFuture(extrapolator.extrapolate(scenario, window));
        }
        return CompletableFuture.supplyAsync(() -> {
            try {
                return fetchPeriod(lat, lon, scenario, window);
            } catch (OpenMeteoException e) {
                throw new CompletionException(e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CompletionException(e);
            }
        }, executor);
    }

    ProjectionPeriod fetchPeriod(double lat, double lon, Scenario scenario, ProjectionWindow window)
            throws OpenMeteoException, InterruptedException {
        DailyArchive data = client.climateModel(lat, lon,
                LocalDate.of(window.startYear(), 1, 1),
                LocalDate.of(window.endYear(), 12, 31),
                scenario.model());

        DailyStats s = DailyStats.of(data.days());
        if (s.validDays() == 0) {
            throw new OpenMeteoException("No valid model days for " + window.label() + " (" + scenario.model() + ")",
                    OpenMeteoException.NO_STATUS);
        }

        double temperatureChange = s.temperatureMeanAvg() - baseline.temperatureMean();
        double precipitationChange = (s.precipitationTotal() - baseline.precipitation())
                / baseline.precipitation() * 100;

        return new ProjectionPeriod(
                window,
                window.startYear(),
                window.endYear(),
                s.temperatureMaxAvg(),
                s.temperatureMinAvg(),
                s.temperatureMeanAvg(),
                s.precipitationTotal(),
                s.precipitationAvg(),
                new ChangeFromBaseline(temperatureChange, precipitationChange),
                scenario.uncertaintyAround(s.temperatureMeanAvg(), s.precipitationTotal()));
    }
}
