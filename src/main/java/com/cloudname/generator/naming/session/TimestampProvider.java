package com.cloudname.generator.naming.session;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;

import lombok.NonNull;

/**
 * Holds the single timestamp shared by every name of one deployment run.
 *
 * The value is read from the clock on first use (unless a package timestamp
 * was preset) and stays fixed afterwards; the first caller wins.
 */
public class TimestampProvider {

    private static final long UNSET = Long.MIN_VALUE;

    private final Clock clock;
    private final AtomicLong timestamp;

    public TimestampProvider(@NonNull Clock clock) {
        this(clock, null);
    }

    public TimestampProvider(@NonNull Clock clock, Long presetTimestamp) {
        this.clock = clock;
        this.timestamp = new AtomicLong(presetTimestamp != null && presetTimestamp > 0 ? presetTimestamp : UNSET);
    }

    /**
     * Epoch milliseconds of the session.
     */
    public long timestamp() {
        long current = timestamp.get();
        if (current != UNSET) {
            return current;
        }
        timestamp.compareAndSet(UNSET, clock.millis());
        return timestamp.get();
    }
}
