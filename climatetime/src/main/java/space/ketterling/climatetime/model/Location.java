package space.ketterling.climatetime.model;

/**
 * Latitude/longitude pair echoed back in every response.
 */
public record Location(double latitude, double longitude) {
}
