package com.spreadsheet.fgraph.util;

import org.apache.logging.log4j.Logger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Limits the rate of error logging so that a broken formula copied down a
 * whole column does not flood the log on every recalculation.
 */
public class ErrorRateLimiter {
    private final Logger logger;
    private final long minIntervalNanos;
    private final AtomicLong lastLogTime = new AtomicLong(0);
    private final AtomicLong suppressed = new AtomicLong(0);

    public ErrorRateLimiter(Logger logger, long minIntervalMillis) {
        this.logger = logger;
        this.minIntervalNanos = minIntervalMillis * 1_000_000;
    }

    /**
     * Logs at ERROR unless another message was logged within the interval.
     *
     * @return true if the message was logged
     */
    public boolean log(String message, Throwable t) {
        long now = System.nanoTime();
        long last = lastLogTime.get();
        if (last == 0 || now - last > minIntervalNanos) {
            // only one caller wins the slot when several race
            if (lastLogTime.compareAndSet(last, now)) {
                long dropped = suppressed.getAndSet(0);
                if (dropped > 0)
                    logger.error(message + " (Throttled, " + dropped + " similar errors suppressed)", t);
                else
                    logger.error(message + " (Throttled)", t);
                return true;
            }
        }
        suppressed.incrementAndGet();
        return false;
    }

    /** Number of messages dropped since the last one that was logged. */
    public long suppressedCount() {
        return suppressed.get();
    }
}
