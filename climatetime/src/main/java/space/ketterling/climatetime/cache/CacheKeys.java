package space.ketterling.climatetime.cache;

import space.ketterling.climatetime.model.Scenario;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds cache keys from coordinates rounded to two decimals (about 1.1 km),
 * so nearby lookups share one entry.
 */
public final class CacheKeys {

    /**
     * Utility class; do not instantiate.
     */
    private CacheKeys() {
    }

    public static String location(double lat, double lon, String prefix, String suffix) {
        String base = prefix + ":" + round2(lat) + "," + round2(lon);
        return suffix == null ? base : base + ":" + suffix;
    }

    /** Years are expected sorted. */
    public static String yearly(double lat, double lon, List<Integer> years) {
        return location(lat, lon, "historical",
                years.stream().map(String::valueOf).collect(Collectors.joining(",")));
    }

    public static String decades(double lat, double lon, int startDecade, int endDecade) {
        return location(lat, lon, "decades", startDecade + "-" + endDecade);
    }

    public static String trends(double lat, double lon, int startYear, int endYear) {
        return location(lat, lon, "trends", startYear + "-" + endYear);
    }

    public static String dailyHistory(double lat, double lon, String startDate, String endDate) {
        return location(lat, lon, "historical-daily", startDate + "_" + endDate);
    }

    public static String projections(double lat, double lon, Scenario scenario) {
        return location(lat, lon, "future-projections", scenario.id());
    }

    public static String allScenarios(double lat, double lon) {
        return location(lat, lon, "all-scenarios", null);
    }

    static double round2(double v) {
        // + 0.0 folds -0.0 into 0.0
        return Math.round(v * 100.0) / 100.0 + 0.0;
    }
}
