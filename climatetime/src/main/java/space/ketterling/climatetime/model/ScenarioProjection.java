package space.ketterling.climatetime.model;

import java.util.List;

/**
 * Full projection response for one scenario.
 */
public record ScenarioProjection(
        Location location,
        Scenario scenario,
        String model,
        List<ProjectionPeriod> projectionPeriods,
        Baseline baseline,
        ProjectionMetadata metadata) {

    public ScenarioProjection {
        projectionPeriods = List.copyOf(projectionPeriods);
    }
}
