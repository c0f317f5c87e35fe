package space.ketterling.climatetime.model;

/**
 * One projection per scenario, for side-by-side comparison.
 */
public record ScenarioSet(
        ScenarioProjection optimistic,
        ScenarioProjection moderate,
        ScenarioProjection pessimistic) {

    public ScenarioProjection get(Scenario scenario) {
        return switch (scenario) {
            case OPTIMISTIC -> optimistic;
            case MODERATE -> moderate;
            case PESSIMISTIC -> pessimistic;
        };
    }
}
