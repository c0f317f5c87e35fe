package space.ketterling.climatetime.model;

/**
 * Inter-model spread around a projected value (not a confidence interval).
 */
public record UncertaintyRange(
        double temperatureLow,
        double temperatureHigh,
        double precipitationLow,
        double precipitationHigh) {

    public double temperatureWidth() {
        return temperatureHigh - temperatureLow;
    }

    public double precipitationWidth() {
        return precipitationHigh - precipitationLow;
    }
}
