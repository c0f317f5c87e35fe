package space.ketterling.climatetime.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TrendDirection {
    INCREASING,
    DECREASING,
    STABLE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
