package space.ketterling.climatetime.model;

import java.util.List;

/**
 * Raw daily history for a location and date range.
 */
public record DailyHistoryReport(
        Location location,
        String timezone,
        String timezoneAbbreviation,
        double elevation,
        List<DailyRecord> dailyData,
        double generationTimeMs) {

    public static DailyHistoryReport of(DailyArchive archive) {
        return new DailyHistoryReport(
                new Location(archive.latitude(), archive.longitude()),
                archive.timezone(),
                archive.timezoneAbbreviation(),
                archive.elevation(),
                archive.days(),
                archive.generationTimeMs());
    }
}
