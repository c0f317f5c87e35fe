package space.ketterling.climatetime.historical;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.climatetime.model.TrendDirection;
import space.ketterling.climatetime.model.TrendResult;
import space.ketterling.climatetime.model.YearlySummary;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.ToDoubleFunction;

/**
 * Ordinary least-squares trends over yearly climate series.
 */
public final class TrendAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(TrendAnalyzer.class);

    /** Fewer yearly points than this and no trend is reported. */
    public static final int MIN_POINTS = 10;

    /** Slopes smaller than this (per year) count as flat. */
    public static final double STABLE_SLOPE = 0.01;

    /** Relative size, against the sum of squared values, below which variance is ignored. */
    static final double FLAT_TOLERANCE = 1e-12;

    public static final String TEMPERATURE_MEAN = "temperature_mean";
    public static final String PRECIPITATION_ANNUAL = "precipitation_annual";

    /**
     * Mean temperature and annual precipitation trends, or an empty list when
     * there are fewer than {@value #MIN_POINTS} years.
     */
    public List<TrendResult> analyze(List<YearlySummary> years) {
        if (years.size() < MIN_POINTS) {
            log.warn("Insufficient data for trend analysis: {} years, need {}", years.size(), MIN_POINTS);
            return List.of();
        }
        List<YearlySummary> sorted = new ArrayList<>(years);
        sorted.sort(Comparator.comparingInt(YearlySummary::year));

        List<TrendResult> out = new ArrayList<>(2);
        trend(TEMPERATURE_MEAN, series(sorted, YearlySummary::temperatureMeanAvg)).ifPresent(out::add);
        trend(PRECIPITATION_ANNUAL, series(sorted, YearlySummary::precipitationTotal)).ifPresent(out::add);
        return out;
    }

    /**
     * Fits one metric. The series must be ordered by year.
     *
     * <p>
     * Baseline and current are the first and last observed values, not the
     * fitted line's endpoints; the percent change divides by that single
     * first value.
     * </p>
     */
    public Optional<TrendResult> trend(String metric, List<YearValue> series) {
        if (series.size() < MIN_POINTS)
            return Optional.empty();

        double[] x = new double[series.size()];
        double[] y = new double[series.size()];
        for (int i = 0; i < series.size(); i++) {
            x[i] = series.get(i).year();
            y[i] = series.get(i).value();
        }
        LinearFit fit = fit(x, y);

        YearValue first = series.get(0);
        YearValue last = series.get(series.size() - 1);
        double percentChange = (last.value() - first.value()) / first.value() * 100.0;

        return Optional.of(new TrendResult(
                metric,
                String.valueOf(first.year()),
                String.valueOf(last.year()),
                fit.slope(),
                direction(fit.slope()),
                fit.rSquared() * 100.0,
                first.value(),
                last.value(),
                percentChange));
    }

    public static TrendDirection direction(double slope) {
        if (Math.abs(slope) < STABLE_SLOPE)
            return TrendDirection.STABLE;
        return slope > 0 ? TrendDirection.INCREASING : TrendDirection.DECREASING;
    }

    /**
     * Least-squares line through the points. x is centred on its mean so years
     * around 2000 do not swamp the sums. A series with no spread beyond rounding
     * that the line reproduces gets R² = 1 instead of 0/0; R² is kept in [0, 1].
     */
    public static LinearFit fit(double[] x, double[] y) {
        int n = x.length;
        double sumX = 0, sumY = 0, sumY2 = 0;
        for (int i = 0; i < n; i++) {
            sumX += x[i];
            sumY += y[i];
            sumY2 += y[i] * y[i];
        }
        double xMean = sumX / n;
        double yMean = sumY / n;

        double sxx = 0, sxy = 0;
        for (int i = 0; i < n; i++) {
            double dx = x[i] - xMean;
            sxx += dx * dx;
            sxy += dx * (y[i] - yMean);
        }
        if (sxx == 0) {
            throw new IllegalArgumentException("x values must not all be equal");
        }
        double slope = sxy / sxx;
        double intercept = yMean - slope * xMean;

        double ssTot = 0, ssRes = 0;
        for (int i = 0; i < n; i++) {
            double predicted = yMean + slope * (x[i] - xMean);
            ssTot += (y[i] - yMean) * (y[i] - yMean);
            ssRes += (y[i] - predicted) * (y[i] - predicted);
        }

        // Sums of squares at this scale are rounding noise
        double noise = FLAT_TOLERANCE * Math.max(sumY2, Double.MIN_NORMAL);
        double rSquared;
        if (ssTot <= noise) {
            rSquared = ssRes <= noise ? 1.0 : 0.0;
        } else {
            rSquared = Math.max(0.0, Math.min(1.0, 1 - ssRes / ssTot));
        }
        return new LinearFit(slope, intercept, rSquared);
    }

    private static List<YearValue> series(List<YearlySummary> years, ToDoubleFunction<YearlySummary> metric) {
        return years.stream().map(y -> new YearValue(y.year(), metric.applyAsDouble(y))).toList();
    }

    /** One point of a yearly series. */
    public record YearValue(int year, double value) {
    }

    public record LinearFit(double slope, double intercept, double rSquared) {
    }
}
