package space.ketterling.climatetime.historical;

import space.ketterling.climatetime.model.DailyRecord;

import java.util.List;
import java.util.function.Function;

/**
 * Means and totals over the valid days of a daily series.
 *
 * <p>
 * Each mean skips nulls for its own metric. Missing precipitation counts as
 * 0 mm, so {@code precipitationAvg} always averages over every valid day. A
 * metric with no samples averages to 0.
 * </p>
 */
public record DailyStats(
        double temperatureMaxAvg,
        double temperatureMinAvg,
        double temperatureMeanAvg,
        double precipitationTotal,
        double precipitationAvg,
        double humidityAvg,
        double windSpeedAvg,
        double pressureAvg,
        int validDays) {

    public static DailyStats of(List<DailyRecord> days) {
        List<DailyRecord> valid = days.stream().filter(DailyRecord::isValid).toList();
        double precipTotal = 0.0;
        for (DailyRecord d : valid) {
            precipTotal += d.precipitationOrZero();
        }
        return new DailyStats(
                mean(valid, DailyRecord::temperatureMax),
                mean(valid, DailyRecord::temperatureMin),
                mean(valid, DailyRecord::temperatureMean),
                precipTotal,
                valid.isEmpty() ? 0.0 : precipTotal / valid.size(),
                mean(valid, DailyRecord::humidity),
                mean(valid, DailyRecord::windSpeed),
                mean(valid, DailyRecord::pressure),
                valid.size());
    }

    private static double mean(List<DailyRecord> days, Function<DailyRecord, Double> metric) {
        double sum = 0.0;
        int n = 0;
        for (DailyRecord d : days) {
            Double v = metric.apply(d);
            if (v == null || v.isNaN())
                continue;
            sum += v;
            n++;
        }
        return n == 0 ? 0.0 : sum / n;
    }
}
