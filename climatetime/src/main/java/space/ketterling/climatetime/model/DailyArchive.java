package space.ketterling.climatetime.model;

import java.util.List;

/**
 * Parsed daily payload from an Open-Meteo endpoint (archive or climate model).
 */
public record DailyArchive(
        double latitude,
        double longitude,
        String timezone,
        String timezoneAbbreviation,
        double elevation,
        double generationTimeMs,
        List<DailyRecord> days) {

    public DailyArchive {
        days = List.copyOf(days);
    }
}
