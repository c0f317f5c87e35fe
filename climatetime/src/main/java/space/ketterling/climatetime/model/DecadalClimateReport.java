package space.ketterling.climatetime.model;

import java.util.List;

public record DecadalClimateReport(
        Location location,
        DecadeRange requestedDecades,
        List<DecadalSummary> decadalData,
        List<Skipped> skippedYears) {

    public record DecadeRange(int start, int end) {
    }
}
