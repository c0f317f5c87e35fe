package space.ketterling.climatetime.future;

import space.ketterling.climatetime.model.Baseline;
import space.ketterling.climatetime.model.ChangeFromBaseline;
import space.ketterling.climatetime.model.ProjectionPeriod;
import space.ketterling.climatetime.model.ProjectionWindow;
import space.ketterling.climatetime.model.Scenario;

/**
 * Linear extrapolation for periods past the climate API's coverage.
 *
 * <p>
 * Change accrues per decade from 2020: 0.8 °C and 5 % precipitation, both
 * scaled by the scenario multiplier, applied on top of the reference baseline.
 * </p>
 */
public final class ProjectionExtrapolator {
    public static final int BASE_YEAR = 2020;
    public static final double TEMPERATURE_PER_DECADE = 0.8;
    public static final double PRECIPITATION_PCT_PER_DECADE = 5.0;

    private final Baseline baseline;

    public ProjectionExtrapolator() {
        this(Baseline.REFERENCE);
    }

    public ProjectionExtrapolator(Baseline baseline) {
        this.baseline = baseline;
    }

    public static double temperatureIncrease(Scenario scenario, int startYear) {
        return decadesFromBase(startYear) * TEMPERATURE_PER_DECADE * scenario.multiplier();
    }

    public static double precipitationChangePct(Scenario scenario, int startYear) {
        return decadesFromBase(startYear) * PRECIPITATION_PCT_PER_DECADE * scenario.multiplier();
    }

    public ProjectionPeriod extrapolate(Scenario scenario, ProjectionWindow window) {
        double tempIncrease = temperatureIncrease(scenario, window.startYear());
        double precipChange = precipitationChangePct(scenario, window.startYear());

        double temperature = baseline.temperatureMean() + tempIncrease;
        double precipitation = baseline.precipitation() * (1 + precipChange / 100.0);

        return new ProjectionPeriod(
                window,
                window.startYear(),
                window.endYear(),
                temperature + 5,
                temperature - 5,
                temperature,
                precipitation,
                precipitation / 365,
                new ChangeFromBaseline(tempIncrease, precipChange),
                scenario.uncertaintyAround(temperature, precipitation));
    }

    private static double decadesFromBase(int startYear) {
        return (startYear - BASE_YEAR) / 10.0;
    }
}
