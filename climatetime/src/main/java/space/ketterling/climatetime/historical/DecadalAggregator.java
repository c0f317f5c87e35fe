package space.ketterling.climatetime.historical;

import space.ketterling.climatetime.model.DecadalSummary;
import space.ketterling.climatetime.model.YearlySummary;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.ToDoubleFunction;

/**
 * Groups yearly summaries into decades and averages them.
 *
 * <p>
 * Every decadal value is the unweighted mean of the per-year values; nothing
 * is re-derived from daily data.
 * </p>
 */
public final class DecadalAggregator {

    public static int decadeOf(int year) {
        return Math.floorDiv(year, 10) * 10;
    }

    /**
     * @return one summary per decade that has data, ascending by start year
     */
    public List<DecadalSummary> summarize(List<YearlySummary> years) {
        Map<Integer, List<YearlySummary>> byDecade = new TreeMap<>();
        for (YearlySummary y : years) {
            byDecade.computeIfAbsent(decadeOf(y.year()), k -> new ArrayList<>()).add(y);
        }

        List<DecadalSummary> out = new ArrayList<>(byDecade.size());
        for (var e : byDecade.entrySet()) {
            List<YearlySummary> members = e.getValue();
            int start = e.getKey();
            out.add(new DecadalSummary(
                    start,
                    start + 9,
                    mean(members, YearlySummary::temperatureMaxAvg),
                    mean(members, YearlySummary::temperatureMinAvg),
                    mean(members, YearlySummary::temperatureMeanAvg),
                    mean(members, YearlySummary::precipitationTotal),
                    mean(members, YearlySummary::precipitationAvg),
                    mean(members, YearlySummary::humidityAvg),
                    mean(members, YearlySummary::windSpeedAvg),
                    mean(members, YearlySummary::pressureAvg),
                    members.size()));
        }
        return out;
    }

    private static double mean(List<YearlySummary> years, ToDoubleFunction<YearlySummary> metric) {
        return years.stream().mapToDouble(metric).average().orElse(0.0);
    }
}
