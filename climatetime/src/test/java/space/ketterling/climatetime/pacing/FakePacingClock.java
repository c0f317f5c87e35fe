package space.ketterling.climatetime.pacing;

import java.util.ArrayList;
import java.util.List;

/**
 * Virtual clock: sleeping advances the reading instantly and is recorded.
 */
final class FakePacingClock implements PacingClock {
    private long now;
    final List<Long> sleeps = new ArrayList<>();

    FakePacingClock(long startMillis) {
        this.now = startMillis;
    }

    void advance(long millis) {
        now += millis;
    }

    @Override
    public long nowMillis() {
        return now;
    }

    @Override
    public void sleepMillis(long millis) {
        sleeps.add(millis);
        now += millis;
    }
}
