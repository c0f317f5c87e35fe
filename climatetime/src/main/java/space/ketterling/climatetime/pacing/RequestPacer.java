package space.ketterling.climatetime.pacing;

/**
 * Hands out permission to issue one upstream request.
 */
public interface RequestPacer {

    /**
     * Blocks until the next request may go out.
     */
    void acquire() throws InterruptedException;

    /** Pacer that never waits. */
    RequestPacer UNPACED = () -> {
    };
}
