package space.ketterling.climatetime.model;

/**
 * Reduction of one calendar year of valid days.
 */
public record YearlySummary(
        int year,
        double temperatureMaxAvg,
        double temperatureMinAvg,
        double temperatureMeanAvg,
        double precipitationTotal,
        double precipitationAvg,
        double humidityAvg,
        double windSpeedAvg,
        double pressureAvg,
        int dataPointsCount) {
}
