package space.ketterling.climatetime.model;

import java.util.List;

/**
 * A projection narrowed to a subset of its periods.
 */
public record PeriodSelection(
        Location location,
        Scenario scenario,
        String model,
        List<ProjectionPeriod> projectionPeriods,
        Baseline baseline,
        ProjectionMetadata metadata,
        List<ProjectionWindow> requestedPeriods,
        List<ProjectionWindow> availablePeriods) {
}
