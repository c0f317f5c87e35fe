package space.ketterling.climatetime.api;

import io.javalin.http.Context;
import space.ketterling.climatetime.model.ProjectionWindow;
import space.ketterling.climatetime.model.Scenario;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Query parameter parsing and range checks shared by the route classes.
 * Every failure is an {@link InvalidRequestException}.
 */
final class ApiParams {
    static final int FIRST_YEAR = 1940;
    static final LocalDate FIRST_DATE = LocalDate.of(FIRST_YEAR, 1, 1);
    static final int MAX_YEARS_PER_REQUEST = 10;
    static final int MAX_TREND_YEARS = 50;
    static final int MIN_TREND_SPAN = 10;
    static final int MAX_DECADE_YEARS = 50;
    static final long MAX_HISTORY_DAYS = 1825;
    /** Archive data lags real time by about two days. */
    static final int ARCHIVE_DELAY_DAYS = 2;

    private static final Pattern ISO_DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern YEAR = Pattern.compile("^-?\\d{1,9}$");

    private final Clock clock;

    ApiParams(Clock clock) {
        this.clock = clock;
    }

    /** Last complete calendar year. */
    int lastCompleteYear() {
        return LocalDate.now(clock).getYear() - 1;
    }

    LocalDate latestArchiveDate() {
        return LocalDate.now(clock).minusDays(ARCHIVE_DELAY_DAYS);
    }

    /**
     * Reads and range-checks {@code lat} and {@code lon}.
     */
    double[] latLon(Context ctx) {
        String lat = ctx.queryParam("lat");
        String lon = ctx.queryParam("lon");
        if (isBlank(lat) || isBlank(lon)) {
            throw new InvalidRequestException("Missing required parameters: lat and lon");
        }
        Double la = parseDouble(lat);
        Double lo = parseDouble(lon);
        if (la == null || lo == null || la < -90.0 || la > 90.0 || lo < -180.0 || lo > 180.0) {
            throw new InvalidRequestException(
                    "Invalid coordinates. Latitude must be between -90 and 90, longitude between -180 and 180.");
        }
        return new double[] { la, lo };
    }

    int requiredInt(Context ctx, String name, String formatHint) {
        String raw = ctx.queryParam(name);
        if (isBlank(raw)) {
            throw new InvalidRequestException("Missing required parameter: " + name);
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new InvalidRequestException(formatHint);
        }
    }

    /**
     * Comma-separated years, deduplicated, each between 1940 and last year.
     */
    List<Integer> years(Context ctx) {
        String raw = ctx.queryParam("years");
        if (isBlank(raw)) {
            throw new InvalidRequestException("Missing required parameter: years");
        }
        Set<Integer> years = new LinkedHashSet<>();
        // entries that are not numbers are dropped
        for (String part : raw.split(",")) {
            String p = part.trim();
            if (YEAR.matcher(p).matches())
                years.add(Integer.parseInt(p));
        }
        if (years.isEmpty()) {
            throw new InvalidRequestException(
                    "Invalid years format. Provide comma-separated years like: 2020,2021,2022");
        }

        int last = lastCompleteYear();
        List<Integer> invalid = years.stream().filter(y -> y < FIRST_YEAR || y > last).toList();
        if (!invalid.isEmpty()) {
            throw new InvalidRequestException("Invalid years: "
                    + invalid.stream().map(String::valueOf).collect(Collectors.joining(", "))
                    + ". Years must be between " + FIRST_YEAR + " and " + last);
        }
        if (years.size() > MAX_YEARS_PER_REQUEST) {
            throw new InvalidRequestException(
                    "Too many years requested. Maximum " + MAX_YEARS_PER_REQUEST + " years per request.");
        }
        return new ArrayList<>(years);
    }

    /**
     * Validated decade range. Both ends are floored to the start of their
     * decade.
     */
    int[] decades(Context ctx) {
        String hint = "Invalid decade format. Use 4-digit years like: 1980, 1990, 2000";
        int start = Math.floorDiv(requiredInt(ctx, "startDecade", hint), 10) * 10;
        int end = Math.floorDiv(requiredInt(ctx, "endDecade", hint), 10) * 10;

        int currentYear = LocalDate.now(clock).getYear();
        if (start < FIRST_YEAR || end >= currentYear) {
            throw new InvalidRequestException("Decade range must be between " + FIRST_YEAR + " and "
                    + (Math.floorDiv(currentYear, 10) * 10 - 10));
        }
        if (start > end) {
            throw new InvalidRequestException("startDecade must not be after endDecade");
        }
        int yearCount = Math.min(end + 9, lastCompleteYear()) - start + 1;
        if (yearCount > MAX_DECADE_YEARS) {
            throw new InvalidRequestException("Too many years requested. Limit to 5 decades maximum.");
        }
        return new int[] { start, end };
    }

    /**
     * Validated trend span: at least {@value #MIN_TREND_SPAN} years apart and
     * at most {@value #MAX_TREND_YEARS} years long.
     */
    int[] trendYears(Context ctx) {
        String hint = "Invalid year format. Use 4-digit years like: 1980, 2020";
        int start = requiredInt(ctx, "startYear", hint);
        int end = requiredInt(ctx, "endYear", hint);

        int last = lastCompleteYear();
        if (start < FIRST_YEAR || end > last || start >= end) {
            throw new InvalidRequestException("Invalid year range. Must be between " + FIRST_YEAR + " and " + last
                    + ", with startYear < endYear");
        }
        if (end - start < MIN_TREND_SPAN) {
            throw new InvalidRequestException("Minimum " + MIN_TREND_SPAN + " years required for trend analysis");
        }
        if (end - start + 1 > MAX_TREND_YEARS) {
            throw new InvalidRequestException(
                    "Too many years requested. Maximum " + MAX_TREND_YEARS + " years for trend analysis.");
        }
        return new int[] { start, end };
    }

    /**
     * Validated raw history range: ISO dates, start before end, inside the
     * archive's coverage and no longer than about five years.
     */
    LocalDate[] dateRange(Context ctx) {
        String startRaw = ctx.queryParam("startDate");
        String endRaw = ctx.queryParam("endDate");
        if (isBlank(startRaw) || isBlank(endRaw)) {
            throw new InvalidRequestException("Missing required parameters: startDate and endDate");
        }
        LocalDate start = isoDate(startRaw.trim());
        LocalDate end = isoDate(endRaw.trim());

        LocalDate max = latestArchiveDate();
        if (start.isBefore(FIRST_DATE) || end.isAfter(max)) {
            throw new InvalidRequestException("Date range must be between " + FIRST_DATE + " and " + max);
        }
        if (!start.isBefore(end)) {
            throw new InvalidRequestException("Start date must be before end date");
        }
        if (end.toEpochDay() - start.toEpochDay() > MAX_HISTORY_DAYS) {
            throw new InvalidRequestException("Date range too large. Maximum 5 years per request.");
        }
        return new LocalDate[] { start, end };
    }

    /**
     * {@code scenario} parameter, defaulting to moderate.
     */
    Scenario scenario(Context ctx) {
        String raw = ctx.queryParam("scenario");
        if (isBlank(raw))
            return Scenario.MODERATE;
        return Scenario.fromId(raw).orElseThrow(() -> new InvalidRequestException(
                "Invalid scenario. Must be: optimistic, moderate, or pessimistic"));
    }

    /**
     * {@code periods} parameter as decade labels, or the default set when
     * absent.
     */
    List<ProjectionWindow> periods(Context ctx, List<ProjectionWindow> defaults) {
        String raw = ctx.queryParam("periods");
        if (isBlank(raw))
            return defaults;

        List<ProjectionWindow> out = new ArrayList<>();
        List<String> invalid = new ArrayList<>();
        for (String label : raw.split(",")) {
            ProjectionWindow.fromLabel(label).ifPresentOrElse(out::add, () -> invalid.add(label.trim()));
        }
        if (!invalid.isEmpty()) {
            String valid = Arrays.stream(ProjectionWindow.values()).map(ProjectionWindow::label)
                    .collect(Collectors.joining(", "));
            throw new InvalidRequestException(
                    "Invalid periods: " + String.join(", ", invalid) + ". Valid periods: " + valid);
        }
        return out;
    }

    private static LocalDate isoDate(String s) {
        if (!ISO_DATE.matcher(s).matches()) {
            throw new InvalidRequestException("Invalid date format. Use YYYY-MM-DD format.");
        }
        try {
            return LocalDate.parse(s);
        } catch (DateTimeParseException e) {
            throw new InvalidRequestException("Invalid date: " + s);
        }
    }

    private static Double parseDouble(String s) {
        try {
            double v = Double.parseDouble(s.trim());
            return Double.isNaN(v) ? null : v;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
