package space.ketterling.climatetime.historical;

import space.ketterling.climatetime.model.DailyRecord;
import space.ketterling.climatetime.model.YearlySummary;

import java.util.List;
import java.util.Optional;

/**
 * Reduces one calendar year of daily records to a {@link YearlySummary}.
 */
public final class YearlyAggregator {

    /**
     * @return empty when the year has no valid day at all
     */
    public Optional<YearlySummary> aggregate(int year, List<DailyRecord> days) {
        DailyStats s = DailyStats.of(days);
        if (s.validDays() == 0)
            return Optional.empty();

        return Optional.of(new YearlySummary(
                year,
                s.temperatureMaxAvg(),
                s.temperatureMinAvg(),
                s.temperatureMeanAvg(),
                s.precipitationTotal(),
                s.precipitationAvg(),
                s.humidityAvg(),
                s.windSpeedAvg(),
                s.pressureAvg(),
                s.validDays()));
    }
}
