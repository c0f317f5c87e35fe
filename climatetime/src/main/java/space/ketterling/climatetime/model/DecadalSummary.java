package space.ketterling.climatetime.model;

/**
 * Unweighted mean of the yearly summaries that fall in one decade.
 */
public record DecadalSummary(
        int decadeStart,
        int decadeEnd,
        double temperatureMaxAvg,
        double temperatureMinAvg,
        double temperatureMeanAvg,
        double precipitationTotalAvg,
        double precipitationAnnualAvg,
        double humidityAvg,
        double windSpeedAvg,
        double pressureAvg,
        int yearsCount) {
}
