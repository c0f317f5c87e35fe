package space.ketterling.climatetime.api;

/**
 * A request parameter failed validation. Mapped to HTTP 400.
 */
public class InvalidRequestException extends RuntimeException {
    public InvalidRequestException(String message) {
        super(message);
    }
}
