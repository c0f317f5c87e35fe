package space.ketterling.climatetime.future;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import space.ketterling.climatetime.cache.ResultCache;
import space.ketterling.climatetime.model.Baseline;
import space.ketterling.climatetime.model.DataSource;
import space.ketterling.climatetime.model.Location;
import space.ketterling.climatetime.model.PeriodSelection;
import space.ketterling.climatetime.model.ProjectionMetadata;
import space.ketterling.climatetime.model.ProjectionPeriod;
import space.ketterling.climatetime.model.ProjectionSummary;
import space.ketterling.climatetime.model.ProjectionWindow;
import space.ketterling.climatetime.model.Scenario;
import space.ketterling.climatetime.model.ScenarioProjection;
import space.ketterling.climatetime.model.ScenarioSet;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FutureClimateServiceTest {

    @Mock
    ScenarioProjectionEngine engine;

    private ResultCache cache;
    private FutureClimateService service;

    @BeforeEach
    void setUp() {
        cache = new ResultCache(Duration.ofMinutes(30));
        service = new FutureClimateService(engine, cache, Duration.ofDays(7));
    }

    @AfterEach
    void tearDown() {
        cache.close();
    }

    @Test
    void realProjectionIsCached() {
        ScenarioProjection real = extrapolated(Scenario.MODERATE);
        when(engine.project(40.0, -74.0, Scenario.MODERATE)).thenReturn(CompletableFuture.completedFuture(real));

        assertSame(real, service.projections(40.0, -74.0, Scenario.MODERATE));
        assertSame(real, service.projections(40.0, -74.0, Scenario.MODERATE));
        verify(engine, times(1)).project(40.0, -74.0, Scenario.MODERATE);
    }

    @Test
    void syntheticProjectionIsNotCached() {
        ScenarioProjection fake = new SyntheticProjections().build(new Location(40.0, -74.0), Scenario.OPTIMISTIC,
                Instant.parse("2025-01-01T00:00:00Z"));
        when(engine.project(40.0, -74.0, Scenario.OPTIMISTIC)).thenReturn(CompletableFuture.completedFuture(fake));

        service.projections(40.0, -74.0, Scenario.OPTIMISTIC);
        service.projections(40.0, -74.0, Scenario.OPTIMISTIC);

        verify(engine, times(2)).project(40.0, -74.0, Scenario.OPTIMISTIC);
        assertEquals(0, cache.size());
    }

    @Test
    void scenarioComparisonIsCachedWhenAllReal() {
        ScenarioSet set = new ScenarioSet(extrapolated(Scenario.OPTIMISTIC), extrapolated(Scenario.MODERATE),
                extrapolated(Scenario.PESSIMISTIC));
        when(engine.compare(1.0, 2.0)).thenReturn(CompletableFuture.completedFuture(set));

        service.allScenarios(1.0, 2.0);
        assertSame(set, service.allScenarios(1.0, 2.0));
        verify(engine, times(1)).compare(1.0, 2.0);
    }

    @Test
    void periodsDefaultToTheLaterThreeDecades() {
        when(engine.project(40.0, -74.0, Scenario.PESSIMISTIC))
                .thenReturn(CompletableFuture.completedFuture(extrapolated(Scenario.PESSIMISTIC)));

        PeriodSelection s = service.periods(40.0, -74.0, Scenario.PESSIMISTIC, List.of());

        assertEquals(FutureClimateService.DEFAULT_PERIODS, s.requestedPeriods());
        assertEquals(List.of(ProjectionWindow.values()), s.availablePeriods());
        assertEquals(FutureClimateService.DEFAULT_PERIODS,
                s.projectionPeriods().stream().map(ProjectionPeriod::period).toList());
    }

    @Test
    void periodsKeepChronologicalOrder() {
        when(engine.project(40.0, -74.0, Scenario.MODERATE))
                .thenReturn(CompletableFuture.completedFuture(extrapolated(Scenario.MODERATE)));

        PeriodSelection s = service.periods(40.0, -74.0, Scenario.MODERATE,
                List.of(ProjectionWindow.DECADE_2050S, ProjectionWindow.DECADE_2020S));

        assertEquals(List.of(ProjectionWindow.DECADE_2020S, ProjectionWindow.DECADE_2050S),
                s.projectionPeriods().stream().map(ProjectionPeriod::period).toList());
        assertEquals(List.of(ProjectionWindow.DECADE_2050S, ProjectionWindow.DECADE_2020S), s.requestedPeriods());
    }

    @Test
    void summaryUsesModerateKeyChanges() {
        when(engine.project(40.0, -74.0, Scenario.MODERATE))
                .thenReturn(CompletableFuture.completedFuture(extrapolated(Scenario.MODERATE)));

        ProjectionSummary summary = service.summary(40.0, -74.0);

        assertEquals(0.8, summary.keyChanges().temperature2030s(), 1e-9);
        assertEquals(2.4, summary.keyChanges().temperature2050s(), 1e-9);
        assertEquals(5.0, summary.keyChanges().precipitation2030s(), 1e-9);
        assertEquals(15.0, summary.keyChanges().precipitation2050s(), 1e-9);
        assertEquals(4, summary.projectionPeriods().size());
        assertEquals(-0.8, summary.projectionPeriods().get(0).temperatureUncertaintyLow(), 1e-9);
        assertEquals(0.8, summary.projectionPeriods().get(0).temperatureUncertaintyHigh(), 1e-9);
    }

    /** Deterministic "real" projection built from the extrapolation formulas. */
    private static ScenarioProjection extrapolated(Scenario scenario) {
        ProjectionExtrapolator x = new ProjectionExtrapolator();
        List<ProjectionPeriod> periods = new ArrayList<>();
        for (ProjectionWindow w : ProjectionWindow.values()) {
            periods.add(x.extrapolate(scenario, w));
        }
        return new ScenarioProjection(new Location(40.0, -74.0), scenario, scenario.model(), periods,
                Baseline.REFERENCE,
                new ProjectionMetadata(DataSource.REAL, "test", "2025-01-01T00:00:00Z", "test"));
    }
}
