package space.ketterling.climatetime.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Emission scenarios and the fixed tables that go with them.
 *
 * <p>
 * Uncertainty factors widen strictly from optimistic to pessimistic; the
 * precipitation factor is a percentage of the projected value.
 * </p>
 */
public enum Scenario {
    OPTIMISTIC("optimistic", "CMCC_CM2_VHR4", 0.6, 0.5, 10.0, 16.5, 850.0),
    MODERATE("moderate", "MPI_ESM1_2_HR", 1.0, 0.8, 15.0, 17.2, 820.0),
    PESSIMISTIC("pessimistic", "EC_Earth3P_HR", 1.4, 1.2, 20.0, 18.8, 780.0);

    private final String id;
    private final String model;
    private final double multiplier;
    private final double temperatureUncertainty;
    private final double precipitationUncertaintyPct;
    private final double syntheticTemperatureBase;
    private final double syntheticPrecipitationBase;

    Scenario(String id, String model, double multiplier, double temperatureUncertainty,
            double precipitationUncertaintyPct, double syntheticTemperatureBase, double syntheticPrecipitationBase) {
        this.id = id;
        this.model = model;
        this.multiplier = multiplier;
        this.temperatureUncertainty = temperatureUncertainty;
        this.precipitationUncertaintyPct = precipitationUncertaintyPct;
        this.syntheticTemperatureBase = syntheticTemperatureBase;
        this.syntheticPrecipitationBase = syntheticPrecipitationBase;
    }

    @JsonValue
    public String id() {
        return id;
    }

    /** Open-Meteo climate model queried for this scenario. */
    public String model() {
        return model;
    }

    /** Scales the per-decade rate of change used for extrapolation. */
    public double multiplier() {
        return multiplier;
    }

    /** Half-width of the temperature band, in °C. */
    public double temperatureUncertainty() {
        return temperatureUncertainty;
    }

    /** Half-width of the precipitation band, in percent of the value. */
    public double precipitationUncertaintyPct() {
        return precipitationUncertaintyPct;
    }

    public double syntheticTemperatureBase() {
        return syntheticTemperatureBase;
    }

    public double syntheticPrecipitationBase() {
        return syntheticPrecipitationBase;
    }

    /**
     * Symmetric band around a projected temperature and precipitation total.
     */
    public UncertaintyRange uncertaintyAround(double temperature, double precipitation) {
        return new UncertaintyRange(
                temperature - temperatureUncertainty,
                temperature + temperatureUncertainty,
                precipitation * (1 - precipitationUncertaintyPct / 100.0),
                precipitation * (1 + precipitationUncertaintyPct / 100.0));
    }

    public static Optional<Scenario> fromId(String id) {
        if (id == null)
            return Optional.empty();
        for (Scenario s : values()) {
            if (s.id.equals(id.trim()))
                return Optional.of(s);
        }
        return Optional.empty();
    }
}
