package space.ketterling.climatetime.historical;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.climatetime.model.DailyArchive;
import space.ketterling.climatetime.model.PartialResult;
import space.ketterling.climatetime.model.Skipped;
import space.ketterling.climatetime.model.YearlySummary;
import space.ketterling.climatetime.openmeteo.OpenMeteoClient;
import space.ketterling.climatetime.openmeteo.OpenMeteoException;
import space.ketterling.climatetime.pacing.RequestPacer;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Pulls one calendar year of archive data per request and summarizes it.
 *
 * <p>
 * Years are fetched one at a time in the order given, each after taking a
 * permit from the pacer. A year that fails to fetch or parse, or has no valid
 * day, is reported as skipped and the loop moves on. Nothing is retried.
 * </p>
 */
public class YearFetcher {
    private static final Logger log = LoggerFactory.getLogger(YearFetcher.class);

    static final String NO_VALID_DAYS = "no valid days";

    private final OpenMeteoClient client;
    private final RequestPacer pacer;
    private final YearlyAggregator aggregator;

    public YearFetcher(OpenMeteoClient client, RequestPacer pacer, YearlyAggregator aggregator) {
        this.client = client;
        this.pacer = pacer;
        this.aggregator = aggregator;
    }

    public PartialResult<YearlySummary> fetch(double lat, double lon, List<Integer> years)
            throws InterruptedException {
        if (years.isEmpty())
            return new PartialResult<>(List.of(), List.of());

        log.info("Fetching yearly climate data for {} years: {}-{} at {},{}", years.size(), years.get(0),
                years.get(years.size() - 1), lat, lon);
        List<YearlySummary> out = new ArrayList<>(years.size());
        List<Skipped> skipped = new ArrayList<>();

        for (int i = 0; i < years.size(); i++) {
            int year = years.get(i);
            pacer.acquire();
            log.info("Processing year {} ({}/{})", year, i + 1, years.size());
            try {
                DailyArchive archive = client.archive(lat, lon, LocalDate.of(year, 1, 1), LocalDate.of(year, 12, 31));
                Optional<YearlySummary> summary = aggregator.aggregate(year, archive.days());
                if (summary.isPresent()) {
                    out.add(summary.get());
                } else {
                    log.warn("Year {} has no valid days, skipping", year);
                    skipped.add(new Skipped(String.valueOf(year), NO_VALID_DAYS));
                }
            } catch (OpenMeteoException e) {
                log.warn("Failed to fetch data for year {}: {}", year, e.getMessage());
                skipped.add(new Skipped(String.valueOf(year), e.getMessage()));
            }
        }

        log.info("Retrieved {} of {} years ({} skipped)", out.size(), years.size(), skipped.size());
        return new PartialResult<>(out, skipped);
    }
}
