/*
* Copyright 2025 Taylor Ketterling
* Open-Meteo client for ClimateTime.
* Utilizes Java HttpClient for the daily archive and CMIP6 climate-model endpoints
* and Jackson for JSON processing.
*/

package space.ketterling.climatetime.openmeteo;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.climatetime.config.AppConfig;
import space.ketterling.climatetime.metrics.ExternalApiMetrics;
import space.ketterling.climatetime.model.DailyArchive;
import space.ketterling.climatetime.model.DailyRecord;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * HTTP client for the Open-Meteo daily archive and climate-model APIs.
 *
 * <p>
 * Every call is a single bounded-range request. There are no retries here;
 * callers decide what a failed range means for them.
 * </p>
 */
public class OpenMeteoClient {
    private static final Logger log = LoggerFactory.getLogger(OpenMeteoClient.class);

    public static final String ARCHIVE = "open-meteo-archive";
    public static final String CLIMATE = "open-meteo-climate";

    static final List<String> ARCHIVE_SERIES = List.of(
            "temperature_2m_max",
            "temperature_2m_min",
            "temperature_2m_mean",
            "precipitation_sum",
            "relative_humidity_2m_mean",
            "wind_speed_10m_mean",
            "surface_pressure_mean");

    static final List<String> CLIMATE_SERIES = List.of(
            "temperature_2m_max",
            "temperature_2m_min",
            "temperature_2m_mean",
            "precipitation_sum");

    private final HttpClient http;
    private final AppConfig cfg;
    private final ObjectMapper om;
    private final ExternalApiMetrics metrics;

    /**
     * Creates a client using app config and a shared {@link ObjectMapper}.
     */
    public OpenMeteoClient(AppConfig cfg, ObjectMapper om, ExternalApiMetrics metrics) {
        this.cfg = cfg;
        this.om = om;
        this.metrics = metrics;
        this.http = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    /**
     * Fetches observed daily history for an inclusive date range.
     */
    public DailyArchive archive(double lat, double lon, LocalDate start, LocalDate end)
            throws OpenMeteoException, InterruptedException {
        String url = cfg.archiveUrl()
                + "?latitude=" + lat
                + "&longitude=" + lon
                + "&start_date=" + start
                + "&end_date=" + end
                + "&daily=" + enc(String.join(",", ARCHIVE_SERIES))
                + "&timezone=auto";
        return fetchDaily(ARCHIVE, url, cfg.archiveTimeout(), lat, lon);
    }

    /**
     * Fetches model-simulated daily values for an inclusive date range.
     *
     * @param model Open-Meteo model identifier, e.g. {@code MPI_ESM1_2_HR}
     */
    public DailyArchive climateModel(double lat, double lon, LocalDate start, LocalDate end, String model)
            throws OpenMeteoException, InterruptedException {
        String url = cfg.climateUrl()
                + "?latitude=" + lat
                + "&longitude=" + lon
                + "&start_date=" + start
                + "&end_date=" + end
                + "&daily=" + enc(String.join(",", CLIMATE_SERIES))
                + "&models=" + enc(model);
        return fetchDaily(CLIMATE, url, cfg.climateTimeout(), lat, lon);
    }

    private DailyArchive fetchDaily(String upstream, String url, Duration timeout, double lat, double lon)
            throws OpenMeteoException, InterruptedException {
        log.debug("{} request -> {}", upstream, url);
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();

        long t0 = System.currentTimeMillis();
        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            metrics.record(upstream, false, System.currentTimeMillis() - t0);
            throw new OpenMeteoException(upstream + " request failed: " + e.getMessage(), e);
        }
        long elapsed = System.currentTimeMillis() - t0;

        int code = resp.statusCode();
        if (code < 200 || code >= 300) {
            metrics.record(upstream, false, elapsed);
            String reason = code == 429 ? "rate limit exceeded"
                    : code == 400 ? "invalid request parameters"
                            : "status " + code;
            throw new OpenMeteoException(upstream + " request failed: " + reason + " url=" + url, code);
        }

        try {
            DailyArchive archive = parse(om.readTree(resp.body()), lat, lon);
            metrics.record(upstream, true, elapsed);
            log.debug("{} response {} with {} days ({} ms)", upstream, code, archive.days().size(), elapsed);
            return archive;
        } catch (JsonProcessingException e) {
            metrics.record(upstream, false, elapsed);
            throw new OpenMeteoException(upstream + " returned unreadable JSON", e);
        } catch (OpenMeteoException e) {
            metrics.record(upstream, false, elapsed);
            throw e;
        }
    }

    /**
     * Turns the parallel {@code daily.*} arrays into one record per date.
     * A payload without {@code daily.time} is rejected. The requested
     * coordinates stand in when the payload does not echo its own.
     */
    static DailyArchive parse(JsonNode root, double lat, double lon) throws OpenMeteoException {
        JsonNode daily = root.path("daily");
        JsonNode time = daily.path("time");
        if (!time.isArray()) {
            throw new OpenMeteoException("Invalid response format from Open-Meteo: missing daily.time",
                    OpenMeteoException.NO_STATUS);
        }

        List<DailyRecord> days = new ArrayList<>(time.size());
        for (int i = 0; i < time.size(); i++) {
            days.add(new DailyRecord(
                    time.get(i).asText(),
                    valueAt(daily, "temperature_2m_max", i),
                    valueAt(daily, "temperature_2m_min", i),
                    valueAt(daily, "temperature_2m_mean", i),
                    valueAt(daily, "precipitation_sum", i),
                    valueAt(daily, "relative_humidity_2m_mean", i),
                    valueAt(daily, "wind_speed_10m_mean", i),
                    valueAt(daily, "surface_pressure_mean", i)));
        }

        return new DailyArchive(
                root.path("latitude").asDouble(lat),
                root.path("longitude").asDouble(lon),
                root.path("timezone").asText("UTC"),
                root.path("timezone_abbreviation").asText("UTC"),
                root.path("elevation").asDouble(0.0),
                root.path("generationtime_ms").asDouble(0.0),
                days);
    }

    private static Double valueAt(JsonNode daily, String series, int i) {
        JsonNode arr = daily.get(series);
        if (arr == null || !arr.isArray() || i >= arr.size())
            return null;
        JsonNode v = arr.get(i);
        if (v == null || v.isNull() || !v.isNumber())
            return null;
        return v.asDouble();
    }

    /**
     * URL-encodes a string for safe query parameters.
     */
    private static String enc(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }
}
