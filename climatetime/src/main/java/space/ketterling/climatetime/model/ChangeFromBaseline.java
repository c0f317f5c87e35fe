package space.ketterling.climatetime.model;

/**
 * @param temperature   absolute difference in °C
 * @param precipitation relative difference in percent of the baseline total
 */
public record ChangeFromBaseline(double temperature, double precipitation) {
}
