package space.ketterling.climatetime.pacing;

/**
 * Time source for pacers. Tests swap in a virtual clock whose sleep just
 * advances the reading.
 */
public interface PacingClock {

    long nowMillis();

    void sleepMillis(long millis) throws InterruptedException;

    PacingClock SYSTEM = new PacingClock() {
        @Override
        public long nowMillis() {
            return System.currentTimeMillis();
        }

        @Override
        public void sleepMillis(long millis) throws InterruptedException {
            Thread.sleep(millis);
        }
    };
}
