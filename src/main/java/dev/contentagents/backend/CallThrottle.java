package dev.contentagents.backend;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Global minimum-interval gate in front of the generation provider.
 * <p>
 * Each caller reserves the next free slot under a fair lock, so slots are handed out in
 * arrival order, then waits for its slot outside the lock. Consecutive slots are at
 * least {@code minInterval} apart.
 */
public final class CallThrottle {

    private static final Logger log = LoggerFactory.getLogger(CallThrottle.class);

    private final long intervalNanos;
    private final TimeSource time;
    private final ReentrantLock lock = new ReentrantLock(true);

    private long nextSlot;
    private boolean used;

    public CallThrottle(Duration minInterval, TimeSource time) {
        if (minInterval.isNegative()) {
            throw new IllegalArgumentException("minInterval must not be negative: " + minInterval);
        }
        this.intervalNanos = minInterval.toNanos();
        this.time = time;
    }

    public static CallThrottle unthrottled() {
        return new CallThrottle(Duration.ZERO, TimeSource.SYSTEM);
    }

    /**
     * Blocks until the caller may issue its request.
     *
     * @return how long the caller waited
     */
    public Duration acquire() throws InterruptedException {
        long slot;
        lock.lockInterruptibly();
        try {
            long now = time.nanoTime();
            slot = used ? Math.max(now, nextSlot) : now;
            used = true;
            nextSlot = slot + intervalNanos;
        } finally {
            lock.unlock();
        }

        long waitNanos = slot - time.nanoTime();
        if (waitNanos <= 0) {
            return Duration.ZERO;
        }
        Duration wait = Duration.ofNanos(waitNanos);
        log.debug("Throttled: waiting {} ms for next call slot", wait.toMillis());
        time.sleep(wait);
        return wait;
    }
}
