package space.ketterling.climatetime.model;

/**
 * An item that was dropped from a partial result, with the reason.
 */
public record Skipped(String id, String reason) {
}
