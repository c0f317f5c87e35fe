package space.ketterling.climatetime.future;

import org.junit.jupiter.api.Test;
import space.ketterling.climatetime.model.Baseline;
import space.ketterling.climatetime.model.DataSource;
import space.ketterling.climatetime.model.Location;
import space.ketterling.climatetime.model.ProjectionPeriod;
import space.ketterling.climatetime.model.ProjectionWindow;
import space.ketterling.climatetime.model.Scenario;
import space.ketterling.climatetime.model.ScenarioProjection;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;

class SyntheticProjectionsTest {
    private final SyntheticProjections synthetic = new SyntheticProjections();

    @Test
    void projectionIsTaggedSynthetic() {
        Instant now = Instant.parse("2025-05-01T00:00:00Z");
        ScenarioProjection p = synthetic.build(new Location(1, 2), Scenario.PESSIMISTIC, now);

        assertEquals(DataSource.SYNTHETIC, p.metadata().source());
        assertEquals(Baseline.SYNTHETIC, p.baseline());
        assertEquals("EC_Earth3P_HR", p.model());
        assertEquals(now.toString(), p.metadata().lastUpdated());
        assertEquals(4, p.projectionPeriods().size());
    }

    @Test
    void periodFollowsTheFixedRates() {
        ProjectionPeriod p = synthetic.period(Scenario.MODERATE, ProjectionWindow.DECADE_2030S);

        // five years after 2025
        assertEquals(17.5, p.temperatureMeanAvg(), 1e-9);
        assertEquals(23.5, p.temperatureMaxAvg(), 1e-9);
        assertEquals(13.5, p.temperatureMinAvg(), 1e-9);
        assertEquals(822.5, p.precipitationTotal(), 1e-9);
        assertEquals(0.3, p.changeFromBaseline().temperature(), 1e-9);
        assertEquals(2.5 / 820 * 100, p.changeFromBaseline().precipitation(), 1e-9);
        assertEquals(17.5 - 0.8, p.uncertaintyRange().temperatureLow(), 1e-9);
    }

    @Test
    void twentiesSitBeforeTheReferenceYear() {
        ProjectionPeriod p = synthetic.period(Scenario.OPTIMISTIC, ProjectionWindow.DECADE_2020S);

        assertEquals(16.5 - 0.3, p.temperatureMeanAvg(), 1e-9);
        assertEquals(-0.3, p.changeFromBaseline().temperature(), 1e-9);
    }
}
