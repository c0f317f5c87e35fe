package space.ketterling.climatetime.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Whether a projection was computed from upstream model data or substituted
 * with synthetic values.
 */
public enum DataSource {
    REAL,
    SYNTHETIC;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
