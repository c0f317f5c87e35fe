package space.ketterling.climatetime.historical;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.climatetime.cache.CacheKeys;
import space.ketterling.climatetime.cache.ResultCache;
import space.ketterling.climatetime.config.AppConfig;
import space.ketterling.climatetime.model.DailyHistoryReport;
import space.ketterling.climatetime.model.DecadalClimateReport;
import space.ketterling.climatetime.model.DecadalSummary;
import space.ketterling.climatetime.model.Location;
import space.ketterling.climatetime.model.PartialResult;
import space.ketterling.climatetime.model.TrendReport;
import space.ketterling.climatetime.model.TrendResult;
import space.ketterling.climatetime.model.YearlyClimateReport;
import space.ketterling.climatetime.model.YearlySummary;
import space.ketterling.climatetime.openmeteo.OpenMeteoClient;
import space.ketterling.climatetime.openmeteo.OpenMeteoException;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Historical climate: raw daily history, yearly and decadal rollups, and
 * long-run trends.
 *
 * <p>
 * Multi-year results are cached by rounded location. A result with skipped
 * years is returned but not cached, so the missing years are tried again on
 * the next request.
 * </p>
 */
public class HistoricalClimateService {
    private static final Logger log = LoggerFactory.getLogger(HistoricalClimateService.class);

    private final AppConfig cfg;
    private final OpenMeteoClient client;
    private final YearFetcher fetcher;
    private final DecadalAggregator decadal;
    private final TrendAnalyzer trendAnalyzer;
    private final ResultCache cache;

    public HistoricalClimateService(AppConfig cfg, OpenMeteoClient client, YearFetcher fetcher,
            DecadalAggregator decadal, TrendAnalyzer trendAnalyzer, ResultCache cache) {
        this.cfg = cfg;
        this.client = client;
        this.fetcher = fetcher;
        this.decadal = decadal;
        this.trendAnalyzer = trendAnalyzer;
        this.cache = cache;
    }

    /**
     * Daily observations for a date range, straight from the archive.
     */
    public DailyHistoryReport daily(double lat, double lon, LocalDate start, LocalDate end)
            throws OpenMeteoException, InterruptedException {
        String key = CacheKeys.dailyHistory(lat, lon, start.toString(), end.toString());
        Optional<DailyHistoryReport> cached = cache.get(key, DailyHistoryReport.class);
        if (cached.isPresent())
            return cached.get();

        log.info("Fetching historical weather for {},{} from {} to {}", lat, lon, start, end);
        DailyHistoryReport report = DailyHistoryReport.of(client.archive(lat, lon, start, end));
        log.info("Retrieved {} days of historical weather", report.dailyData().size());
        cache.set(key, report, cfg.ttlDaily());
        return report;
    }

    /**
     * One summary per requested year that could be computed.
     *
     * @param requestedYears distinct years as the caller sent them
     */
    public YearlyClimateReport yearly(double lat, double lon, List<Integer> requestedYears)
            throws InterruptedException {
        List<Integer> years = new ArrayList<>(new TreeSet<>(requestedYears));
        String key = CacheKeys.yearly(lat, lon, years);
        Optional<YearlyClimateReport> cached = cache.get(key, YearlyClimateReport.class);
        if (cached.isPresent()) {
            log.info("Returning cached yearly climate data for {},{}", lat, lon);
            return cached.get();
        }

        PartialResult<YearlySummary> result = fetcher.fetch(lat, lon, years);
        YearlyClimateReport report = new YearlyClimateReport(
                new Location(lat, lon),
                List.copyOf(requestedYears),
                retrievedYears(result.items()),
                result.skipped(),
                result.items());

        if (result.isComplete()) {
            cache.set(key, report, cfg.ttlYearly());
        }
        return report;
    }

    /**
     * Decade averages for every decade from {@code startDecade} through
     * {@code endDecade}, limited to years up to {@code lastYear}.
     */
    public DecadalClimateReport decades(double lat, double lon, int startDecade, int endDecade, int lastYear)
            throws InterruptedException {
        String key = CacheKeys.decades(lat, lon, startDecade, endDecade);
        Optional<DecadalClimateReport> cached = cache.get(key, DecadalClimateReport.class);
        if (cached.isPresent()) {
            log.info("Returning cached decadal climate data for {},{}", lat, lon);
            return cached.get();
        }

        PartialResult<YearlySummary> result = fetcher.fetch(lat, lon,
                yearsInDecades(startDecade, endDecade, lastYear));
        List<DecadalSummary> decades = decadal.summarize(result.items());
        DecadalClimateReport report = new DecadalClimateReport(
                new Location(lat, lon),
                new DecadalClimateReport.DecadeRange(startDecade, endDecade),
                decades,
                result.skipped());

        if (result.isComplete()) {
            cache.set(key, report, cfg.ttlDecades());
        }
        return report;
    }

    /**
     * Temperature and precipitation trends over an inclusive year span.
     */
    public TrendReport trends(double lat, double lon, int startYear, int endYear) throws InterruptedException {
        String key = CacheKeys.trends(lat, lon, startYear, endYear);
        Optional<TrendReport> cached = cache.get(key, TrendReport.class);
        if (cached.isPresent()) {
            log.info("Returning cached climate trends for {},{}", lat, lon);
            return cached.get();
        }

        List<Integer> years = new ArrayList<>(endYear - startYear + 1);
        for (int y = startYear; y <= endYear; y++) {
            years.add(y);
        }
        PartialResult<YearlySummary> result = fetcher.fetch(lat, lon, years);
        List<TrendResult> trends = trendAnalyzer.analyze(result.items());

        TrendReport report = new TrendReport(
                new Location(lat, lon),
                new TrendReport.YearRange(startYear, endYear),
                retrievedYears(result.items()),
                trends,
                result.items(),
                result.skipped());

        if (result.isComplete()) {
            cache.set(key, report, cfg.ttlTrends());
        }
        return report;
    }

    /**
     * Every year of the decades in range, capped at {@code lastYear}.
     */
    public static List<Integer> yearsInDecades(int startDecade, int endDecade, int lastYear) {
        List<Integer> years = new ArrayList<>();
        for (int decade = startDecade; decade <= endDecade; decade += 10) {
            for (int year = decade; year < decade + 10 && year <= lastYear; year++) {
                years.add(year);
            }
        }
        return years;
    }

    private static List<Integer> retrievedYears(List<YearlySummary> items) {
        return items.stream().map(YearlySummary::year).toList();
    }
}
