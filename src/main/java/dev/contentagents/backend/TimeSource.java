package dev.contentagents.backend;

import java.time.Duration;

/**
 * Monotonic clock plus sleep, injectable so throttle and backoff can be tested without
 * real time passing.
 */
public interface TimeSource {

    long nanoTime();

    void sleep(Duration duration) throws InterruptedException;

    TimeSource SYSTEM = new TimeSource() {
        @Override
        public long nanoTime() {
            return System.nanoTime();
        }

        @Override
        public void sleep(Duration duration) throws InterruptedException {
            if (!duration.isNegative() && !duration.isZero()) {
                Thread.sleep(duration.toMillis(), duration.toNanosPart() % 1_000_000);
            }
        }
    };
}
