package space.ketterling.climatetime.model;

/**
 * Least-squares trend of one metric over a run of years.
 *
 * @param confidenceLevel R² of the fit scaled to 0-100
 * @param baselineValue   value of the earliest year
 * @param currentValue    value of the latest year
 */
public record TrendResult(
        String metric,
        String periodStart,
        String periodEnd,
        double trendSlope,
        TrendDirection trendDirection,
        double confidenceLevel,
        double baselineValue,
        double currentValue,
        double percentChange) {
}
