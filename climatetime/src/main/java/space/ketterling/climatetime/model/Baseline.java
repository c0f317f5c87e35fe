package space.ketterling.climatetime.model;

/**
 * Reference climate that projected periods are compared against.
 */
public record Baseline(String period, double temperatureMean, double precipitation) {

    public static final Baseline REFERENCE = new Baseline("1990-2020", 15.0, 800.0);
    public static final Baseline SYNTHETIC = new Baseline("1990-2020", 15.2, 845.0);
}
