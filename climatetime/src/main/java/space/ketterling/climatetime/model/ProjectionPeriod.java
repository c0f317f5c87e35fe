package space.ketterling.climatetime.model;

public record ProjectionPeriod(
        ProjectionWindow period,
        int startYear,
        int endYear,
        double temperatureMaxAvg,
        double temperatureMinAvg,
        double temperatureMeanAvg,
        double precipitationTotal,
        double precipitationAvg,
        ChangeFromBaseline changeFromBaseline,
        UncertaintyRange uncertaintyRange) {
}
