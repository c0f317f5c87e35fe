package space.ketterling.climatetime.future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.climatetime.cache.CacheKeys;
import space.ketterling.climatetime.cache.ResultCache;
import space.ketterling.climatetime.model.DataSource;
import space.ketterling.climatetime.model.PeriodSelection;
import space.ketterling.climatetime.model.ProjectionPeriod;
import space.ketterling.climatetime.model.ProjectionSummary;
import space.ketterling.climatetime.model.ProjectionWindow;
import space.ketterling.climatetime.model.Scenario;
import space.ketterling.climatetime.model.ScenarioProjection;
import space.ketterling.climatetime.model.ScenarioSet;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Cached access to scenario projections and the views derived from them.
 *
 * <p>
 * Only projections built from real model data are cached; a synthetic
 * fallback is served once and the upstream is asked again next time.
 * </p>
 */
public class FutureClimateService {
    private static final Logger log = LoggerFactory.getLogger(FutureClimateService.class);

    public static final List<ProjectionWindow> DEFAULT_PERIODS = List.of(
            ProjectionWindow.DECADE_2030S,
            ProjectionWindow.DECADE_2040S,
            ProjectionWindow.DECADE_2050S);

    private final ScenarioProjectionEngine engine;
    private final ResultCache cache;
    private final Duration ttl;

    public FutureClimateService(ScenarioProjectionEngine engine, ResultCache cache, Duration ttl) {
        this.engine = engine;
        this.cache = cache;
        this.ttl = ttl;
    }

    public ScenarioProjection projections(double lat, double lon, Scenario scenario) {
        String key = CacheKeys.projections(lat, lon, scenario);
        Optional<ScenarioProjection> cached = cache.get(key, ScenarioProjection.class);
        if (cached.isPresent()) {
            log.info("Returning cached {} projections for {},{}", scenario.id(), lat, lon);
            return cached.get();
        }

        ScenarioProjection projection = engine.project(lat, lon, scenario).join();
        if (isReal(projection)) {
            cache.set(key, projection, ttl);
        }
        return projection;
    }

    public ScenarioSet allScenarios(double lat, double lon) {
        String key = CacheKeys.allScenarios(lat, lon);
        Optional<ScenarioSet> cached = cache.get(key, ScenarioSet.class);
        if (cached.isPresent()) {
            log.info("Returning cached scenario comparison for {},{}", lat, lon);
            return cached.get();
        }

        ScenarioSet set = engine.compare(lat, lon).join();
        if (isReal(set.optimistic()) && isReal(set.moderate()) && isReal(set.pessimistic())) {
            cache.set(key, set, ttl);
        }
        return set;
    }

    /**
     * The scenario's projection restricted to {@code requested}. Periods keep
     * their chronological order.
     */
    public PeriodSelection periods(double lat, double lon, Scenario scenario, List<ProjectionWindow> requested) {
        List<ProjectionWindow> wanted = requested == null || requested.isEmpty() ? DEFAULT_PERIODS : requested;
        ScenarioProjection p = projections(lat, lon, scenario);

        List<ProjectionPeriod> selected = p.projectionPeriods().stream()
                .filter(pp -> wanted.contains(pp.period()))
                .toList();
        List<ProjectionWindow> available = p.projectionPeriods().stream().map(ProjectionPeriod::period).toList();

        return new PeriodSelection(
                p.location(),
                p.scenario(),
                p.model(),
                selected,
                p.baseline(),
                p.metadata(),
                List.copyOf(wanted),
                available);
    }

    /**
     * Key changes of the moderate scenario for the 2030s and 2050s, plus every
     * period's change with its temperature band relative to the mean.
     */
    public ProjectionSummary summary(double lat, double lon) {
        ScenarioProjection p = projections(lat, lon, Scenario.MODERATE);

        ProjectionPeriod p2030s = find(p, ProjectionWindow.DECADE_2030S);
        ProjectionPeriod p2050s = find(p, ProjectionWindow.DECADE_2050S);
        ProjectionSummary.KeyChanges keyChanges = new ProjectionSummary.KeyChanges(
                p2030s.changeFromBaseline().temperature(),
                p2050s.changeFromBaseline().temperature(),
                p2030s.changeFromBaseline().precipitation(),
                p2050s.changeFromBaseline().precipitation());

        List<ProjectionSummary.PeriodChange> changes = p.projectionPeriods().stream()
                .map(pp -> new ProjectionSummary.PeriodChange(
                        pp.period(),
                        pp.changeFromBaseline().temperature(),
                        pp.changeFromBaseline().precipitation(),
                        pp.uncertaintyRange().temperatureLow() - pp.temperatureMeanAvg(),
                        pp.uncertaintyRange().temperatureHigh() - pp.temperatureMeanAvg()))
                .toList();

        return new ProjectionSummary(p.location(), keyChanges, changes, p.baseline(), p.metadata());
    }

    private static ProjectionPeriod find(ScenarioProjection p, ProjectionWindow window) {
        return p.projectionPeriods().stream()
                .filter(pp -> pp.period() == window)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("Projection has no " + window.label() + " period"));
    }

    private static boolean isReal(ScenarioProjection p) {
        return p.metadata().source() == DataSource.REAL;
    }
}
