package com.reliability.fta.util;

import org.apache.logging.log4j.Logger;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Limits how often a warning is written.
 * Every pass recomputes the whole tree, so a persistent anomaly such as a
 * dangling link would otherwise log once per mutation.
 */
public class WarningRateLimiter {
    private final Logger logger;
    private final long minIntervalNanos;
    private final AtomicLong lastLogTime;
    private final AtomicLong suppressed = new AtomicLong();

    public WarningRateLimiter(Logger logger, long minIntervalMillis) {
        this.logger = logger;
        this.minIntervalNanos = minIntervalMillis * 1_000_000;
        this.lastLogTime = new AtomicLong(System.nanoTime() - minIntervalNanos - 1);
    }

    /** @return true if the message was written, false if throttled. */
    public boolean warn(String message) {
        long now = System.nanoTime();
        long last = lastLogTime.get();
        if (now - last > minIntervalNanos && lastLogTime.compareAndSet(last, now)) {
            long dropped = suppressed.getAndSet(0);
            if (dropped > 0)
                logger.warn("{} ({} similar warnings suppressed)", message, dropped);
            else
                logger.warn(message);
            return true;
        }
        suppressed.incrementAndGet();
        return false;
    }
}
