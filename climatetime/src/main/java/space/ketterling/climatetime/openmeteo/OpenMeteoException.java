package space.ketterling.climatetime.openmeteo;

/**
 * Failure talking to Open-Meteo: a non-2xx status, a transport error or a
 * payload without the expected daily series.
 */
public class OpenMeteoException extends Exception {
    public static final int NO_STATUS = -1;

    private final int statusCode;

    public OpenMeteoException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public OpenMeteoException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = NO_STATUS;
    }

    /**
     * HTTP status of the failed call, or {@link #NO_STATUS} when the request
     * never produced one.
     */
    public int statusCode() {
        return statusCode;
    }

    public boolean isRateLimited() {
        return statusCode == 429;
    }
}
