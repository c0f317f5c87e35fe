package space.ketterling.climatetime.model;

import java.util.List;

/**
 * Condensed view of the moderate scenario used by overview screens.
 */
public record ProjectionSummary(
        Location location,
        KeyChanges keyChanges,
        List<PeriodChange> projectionPeriods,
        Baseline baseline,
        ProjectionMetadata metadata) {

    public record KeyChanges(
            double temperature2030s,
            double temperature2050s,
            double precipitation2030s,
            double precipitation2050s) {
    }

    /**
     * @param temperatureUncertaintyLow  lower band edge relative to the mean
     * @param temperatureUncertaintyHigh upper band edge relative to the mean
     */
    public record PeriodChange(
            ProjectionWindow period,
            double temperatureChange,
            double precipitationChange,
            double temperatureUncertaintyLow,
            double temperatureUncertaintyHigh) {
    }
}
