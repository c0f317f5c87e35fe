package space.ketterling.climatetime.model;

import java.util.List;

/**
 * Trend analysis response. {@code trends} is empty when fewer than ten years
 * could be retrieved.
 */
public record TrendReport(
        Location location,
        YearRange period,
        List<Integer> dataYears,
        List<TrendResult> trends,
        List<YearlySummary> yearlyData,
        List<Skipped> skippedYears) {

    public record YearRange(int startYear, int endYear) {
    }
}
