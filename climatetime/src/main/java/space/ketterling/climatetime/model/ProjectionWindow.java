package space.ketterling.climatetime.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * The four decade buckets every projection covers.
 */
public enum ProjectionWindow {
    DECADE_2020S("2020s", 2020, 2029),
    DECADE_2030S("2030s", 2030, 2039),
    DECADE_2040S("2040s", 2040, 2049),
    DECADE_2050S("2050s", 2050, 2059);

    private final String label;
    private final int startYear;
    private final int endYear;

    ProjectionWindow(String label, int startYear, int endYear) {
        this.label = label;
        this.startYear = startYear;
        this.endYear = endYear;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public int startYear() {
        return startYear;
    }

    public int endYear() {
        return endYear;
    }

    public static Optional<ProjectionWindow> fromLabel(String label) {
        if (label == null)
            return Optional.empty();
        for (ProjectionWindow w : values()) {
            if (w.label.equals(label.trim()))
                return Optional.of(w);
        }
        return Optional.empty();
    }
}
