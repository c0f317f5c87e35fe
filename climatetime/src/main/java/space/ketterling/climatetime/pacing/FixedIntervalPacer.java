package space.ketterling.climatetime.pacing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Spaces permits at least {@code interval} apart, process wide.
 *
 * <p>
 * The first permit is immediate. Waiting happens while holding the pacer's
 * lock, so concurrent callers queue up and share one upstream budget.
 * </p>
 */
public final class FixedIntervalPacer implements RequestPacer {
    private static final Logger log = LoggerFactory.getLogger(FixedIntervalPacer.class);

    private final long intervalMs;
    private final PacingClock clock;
    private final Object lock = new Object();
    private long nextPermitAt = Long.MIN_VALUE;
    private long permitsIssued;

    public FixedIntervalPacer(Duration interval) {
        this(interval, PacingClock.SYSTEM);
    }

    public FixedIntervalPacer(Duration interval, PacingClock clock) {
        if (interval.isNegative()) {
            throw new IllegalArgumentException("interval must not be negative: " + interval);
        }
        this.intervalMs = interval.toMillis();
        this.clock = clock;
    }

    @Override
    public void acquire() throws InterruptedException {
        synchronized (lock) {
            long now = clock.nowMillis();
            if (nextPermitAt != Long.MIN_VALUE && now < nextPermitAt) {
                long waitMs = nextPermitAt - now;
                log.debug("Pacing upstream request, waiting {} ms", waitMs);
                clock.sleepMillis(waitMs);
                now = clock.nowMillis();
            }
            nextPermitAt = now + intervalMs;
            permitsIssued++;
        }
    }

    public long permitsIssued() {
        synchronized (lock) {
            return permitsIssued;
        }
    }

    public Duration interval() {
        return Duration.ofMillis(intervalMs);
    }
}
