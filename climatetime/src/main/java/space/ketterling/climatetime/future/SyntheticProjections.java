package space.ketterling.climatetime.future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.climatetime.model.Baseline;
import space.ketterling.climatetime.model.ChangeFromBaseline;
import space.ketterling.climatetime.model.DataSource;
import space.ketterling.climatetime.model.Location;
import space.ketterling.climatetime.model.ProjectionMetadata;
import space.ketterling.climatetime.model.ProjectionPeriod;
import space.ketterling.climatetime.model.ProjectionWindow;
import space.ketterling.climatetime.model.Scenario;
import space.ketterling.climatetime.model.ScenarioProjection;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic stand-in projections used when the climate API cannot serve a
 * complete answer. Always tagged {@link DataSource#SYNTHETIC}.
 */
public final class SyntheticProjections {
    private static final Logger log = LoggerFactory.getLogger(SyntheticProjections.class);

    static final int REFERENCE_YEAR = 2025;
    static final double TEMPERATURE_PER_YEAR = 0.06;
    static final double PRECIPITATION_PER_YEAR = 0.5;

    public ScenarioProjection build(Location location, Scenario scenario, Instant now) {
        log.info("Using synthetic climate projections for {} ({})", location, scenario.id());
        List<ProjectionPeriod> periods = new ArrayList<>(ProjectionWindow.values().length);
        for (ProjectionWindow w : ProjectionWindow.values()) {
            periods.add(period(scenario, w));
        }
        return new ScenarioProjection(
                location,
                scenario,
                scenario.model(),
                periods,
                Baseline.SYNTHETIC,
                new ProjectionMetadata(
                        DataSource.SYNTHETIC,
                        "Synthetic climate projections (upstream unavailable)",
                        now.toString(),
                        "Synthetic data - not derived from climate models"));
    }

    ProjectionPeriod period(Scenario scenario, ProjectionWindow window) {
        int yearsFromNow = window.startYear() - REFERENCE_YEAR;
        double tempIncrease = yearsFromNow * TEMPERATURE_PER_YEAR;
        double precipChange = yearsFromNow * PRECIPITATION_PER_YEAR;

        double temperature = scenario.syntheticTemperatureBase() + tempIncrease;
        double precipitation = scenario.syntheticPrecipitationBase() + precipChange;

        return new ProjectionPeriod(
                window,
                window.startYear(),
                window.endYear(),
                temperature + 6,
                temperature - 4,
                temperature,
                precipitation,
                precipitation / 365,
                new ChangeFromBaseline(tempIncrease, precipChange / scenario.syntheticPrecipitationBase() * 100),
                scenario.uncertaintyAround(temperature, precipitation));
    }
}
