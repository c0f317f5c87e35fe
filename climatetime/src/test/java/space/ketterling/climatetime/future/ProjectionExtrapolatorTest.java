package space.ketterling.climatetime.future;

import org.junit.jupiter.api.Test;
import space.ketterling.climatetime.model.ProjectionPeriod;
import space.ketterling.climatetime.model.ProjectionWindow;
import space.ketterling.climatetime.model.Scenario;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProjectionExtrapolatorTest {
    private final ProjectionExtrapolator extrapolator = new ProjectionExtrapolator();

    @Test
    void laterDecadesAreWarmerForEveryScenario() {
        for (Scenario s : Scenario.values()) {
            ProjectionPeriod p2030s = extrapolator.extrapolate(s, ProjectionWindow.DECADE_2030S);
            ProjectionPeriod p2050s = extrapolator.extrapolate(s, ProjectionWindow.DECADE_2050S);

            assertTrue(p2050s.temperatureMeanAvg() > p2030s.temperatureMeanAvg(), s.id());
            assertTrue(p2050s.precipitationTotal() > p2030s.precipitationTotal(), s.id());
        }
    }

    @Test
    void moderate2050sMatchesTheRate() {
        ProjectionPeriod p = extrapolator.extrapolate(Scenario.MODERATE, ProjectionWindow.DECADE_2050S);

        // three decades past 2020 at 0.8 °C and 5 % each
        assertEquals(17.4, p.temperatureMeanAvg(), 1e-9);
        assertEquals(22.4, p.temperatureMaxAvg(), 1e-9);
        assertEquals(12.4, p.temperatureMinAvg(), 1e-9);
        assertEquals(920.0, p.precipitationTotal(), 1e-9);
        assertEquals(920.0 / 365, p.precipitationAvg(), 1e-9);
        assertEquals(2.4, p.changeFromBaseline().temperature(), 1e-9);
        assertEquals(15.0, p.changeFromBaseline().precipitation(), 1e-9);
        assertEquals(2050, p.startYear());
        assertEquals(2059, p.endYear());
    }

    @Test
    void multiplierScalesTheIncrease() {
        assertEquals(0.6 * 0.8 * 2, ProjectionExtrapolator.temperatureIncrease(Scenario.OPTIMISTIC, 2040), 1e-9);
        assertEquals(1.4 * 5 * 2, ProjectionExtrapolator.precipitationChangePct(Scenario.PESSIMISTIC, 2040), 1e-9);
        assertEquals(0.0, ProjectionExtrapolator.temperatureIncrease(Scenario.PESSIMISTIC, 2020), 1e-9);
    }

    @Test
    void bandIsCentredOnTheProjection() {
        ProjectionPeriod p = extrapolator.extrapolate(Scenario.OPTIMISTIC, ProjectionWindow.DECADE_2040S);

        assertEquals(p.temperatureMeanAvg() - 0.5, p.uncertaintyRange().temperatureLow(), 1e-9);
        assertEquals(p.precipitationTotal() * 1.1, p.uncertaintyRange().precipitationHigh(), 1e-9);
    }
}
