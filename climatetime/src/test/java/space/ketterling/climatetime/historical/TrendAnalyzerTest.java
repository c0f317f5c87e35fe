package space.ketterling.climatetime.historical;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import space.ketterling.climatetime.model.TrendDirection;
import space.ketterling.climatetime.model.TrendResult;
import space.ketterling.climatetime.model.YearlySummary;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Least-squares fitting, direction thresholds and the minimum-points rule.
 */
class TrendAnalyzerTest {
    private final TrendAnalyzer analyzer = new TrendAnalyzer();

    @Nested
    @DisplayName("fit()")
    class FitTests {

        @Test
        @DisplayName("perfect line -> exact slope and R² = 1")
        void perfectLine() {
            double[] x = { 2000, 2001, 2002, 2003 };
            double[] y = { 10.0, 10.5, 11.0, 11.5 };

            TrendAnalyzer.LinearFit fit = TrendAnalyzer.fit(x, y);

            assertEquals(0.5, fit.slope(), 1e-9);
            assertEquals(1.0, fit.rSquared(), 1e-9);
        }

        @Test
        @DisplayName("constant series -> slope 0 and R² = 1")
        void constantSeries() {
            double[] x = { 1, 2, 3, 4, 5 };
            double[] y = { 7, 7, 7, 7, 7 };

            TrendAnalyzer.LinearFit fit = TrendAnalyzer.fit(x, y);

            assertEquals(0.0, fit.slope(), 1e-12);
            assertEquals(1.0, fit.rSquared(), 1e-12);
        }

        @Test
        @DisplayName("fractional constant over real years -> slope 0 and R² = 1")
        void fractionalConstantOverRealYears() {
            double[] x = new double[20];
            double[] y = new double[20];
            for (int i = 0; i < 20; i++) {
                x[i] = 1990 + i;
                y[i] = 15.3;
            }

            TrendAnalyzer.LinearFit fit = TrendAnalyzer.fit(x, y);

            assertEquals(0.0, fit.slope(), 1e-12);
            assertEquals(15.3, fit.intercept(), 1e-9);
            assertEquals(1.0, fit.rSquared(), 1e-12);
        }

        @Test
        @DisplayName("noisy series -> R² strictly between 0 and 1")
        void noisySeries() {
            double[] x = { 1, 2, 3, 4, 5, 6 };
            double[] y = { 1, 3, 2, 5, 4, 6 };

            double r2 = TrendAnalyzer.fit(x, y).rSquared();

            assertTrue(r2 > 0.0 && r2 < 1.0);
        }

        @Test
        @DisplayName("identical x values are rejected")
        void degenerateX() {
            assertThrows(IllegalArgumentException.class,
                    () -> TrendAnalyzer.fit(new double[] { 3, 3, 3 }, new double[] { 1, 2, 3 }));
        }
    }

    @Nested
    @DisplayName("direction()")
    class DirectionTests {

        @Test
        void thresholdIsExclusive() {
            assertEquals(TrendDirection.STABLE, TrendAnalyzer.direction(0.0099));
            assertEquals(TrendDirection.STABLE, TrendAnalyzer.direction(-0.0099));
            assertEquals(TrendDirection.INCREASING, TrendAnalyzer.direction(0.01));
            assertEquals(TrendDirection.DECREASING, TrendAnalyzer.direction(-0.01));
        }
    }

    @Nested
    @DisplayName("analyze()")
    class AnalyzeTests {

        @Test
        @DisplayName("9 years -> no trends")
        void nineYearsIsTooFew() {
            assertTrue(analyzer.analyze(warming(2000, 9)).isEmpty());
        }

        @Test
        @DisplayName("10 years -> both trends")
        void tenYearsIsEnough() {
            List<TrendResult> trends = analyzer.analyze(warming(2000, 10));

            assertEquals(2, trends.size());
            assertEquals(TrendAnalyzer.TEMPERATURE_MEAN, trends.get(0).metric());
            assertEquals(TrendAnalyzer.PRECIPITATION_ANNUAL, trends.get(1).metric());
        }

        @Test
        @DisplayName("perfectly linear warming -> increasing with 100 % confidence")
        void linearWarming() {
            TrendResult t = analyzer.analyze(warming(1990, 21)).get(0);

            assertEquals(TrendDirection.INCREASING, t.trendDirection());
            assertEquals(0.05, t.trendSlope(), 1e-9);
            assertEquals(100.0, t.confidenceLevel(), 1e-6);
            assertEquals("1990", t.periodStart());
            assertEquals("2010", t.periodEnd());
            assertEquals(10.0, t.baselineValue(), 1e-9);
            assertEquals(11.0, t.currentValue(), 1e-9);
            assertEquals(10.0, t.percentChange(), 1e-9);
        }

        @Test
        @DisplayName("flat fractional series -> stable with confidence inside 0..100")
        void flatFractionalSeries() {
            for (double v : new double[] { 15.3, 0.1, 812.7 }) {
                List<TrendAnalyzer.YearValue> series = new ArrayList<>();
                for (int year = 1990; year < 2010; year++) {
                    series.add(new TrendAnalyzer.YearValue(year, v));
                }

                TrendResult t = analyzer.trend(TrendAnalyzer.TEMPERATURE_MEAN, series).orElseThrow();

                assertEquals(TrendDirection.STABLE, t.trendDirection());
                assertEquals(100.0, t.confidenceLevel(), 1e-9, "value " + v);
                assertEquals(0.0, t.percentChange(), 1e-9);
            }
        }

        @Test
        @DisplayName("unsorted input is ordered by year first")
        void unsortedInput() {
            List<YearlySummary> years = new ArrayList<>(warming(2000, 12));
            Collections.reverse(years);

            TrendResult t = analyzer.analyze(years).get(0);

            assertEquals("2000", t.periodStart());
            assertEquals(TrendDirection.INCREASING, t.trendDirection());
        }

        @Test
        @DisplayName("flat precipitation -> stable")
        void flatPrecipitation() {
            TrendResult precip = analyzer.analyze(warming(2000, 15)).get(1);

            assertEquals(TrendDirection.STABLE, precip.trendDirection());
            assertEquals(0.0, precip.percentChange(), 1e-9);
        }
    }

    /** Mean temperature 10 °C rising 0.05 °C a year, precipitation fixed. */
    private static List<YearlySummary> warming(int firstYear, int count) {
        List<YearlySummary> out = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            double mean = 10.0 + 0.05 * i;
            out.add(new YearlySummary(firstYear + i, mean + 5, mean - 5, mean, 800, 800 / 365.0, 60, 12, 1013, 365));
        }
        return out;
    }
}
