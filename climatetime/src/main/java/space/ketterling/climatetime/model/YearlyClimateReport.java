package space.ketterling.climatetime.model;

import java.util.List;

public record YearlyClimateReport(
        Location location,
        List<Integer> requestedYears,
        List<Integer> retrievedYears,
        List<Skipped> skippedYears,
        List<YearlySummary> yearlyData) {
}
