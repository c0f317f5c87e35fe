package space.ketterling.climatetime.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * One day of upstream weather data. Any measurement may be null when the
 * upstream series has no value for that date.
 *
 * @param date ISO local date (YYYY-MM-DD) as reported upstream
 */
public record DailyRecord(
        String date,
        Double temperatureMax,
        Double temperatureMin,
        Double temperatureMean,
        Double precipitation,
        Double humidity,
        Double windSpeed,
        Double pressure) {

    /**
     * A day counts towards aggregation only when all three temperatures are
     * present.
     */
    @JsonIgnore
    public boolean isValid() {
        return temperatureMean != null && temperatureMax != null && temperatureMin != null;
    }

    /**
     * Precipitation with an absent value read as 0 mm.
     */
    @JsonIgnore
    public double precipitationOrZero() {
        return precipitation == null ? 0.0 : precipitation;
    }
}
