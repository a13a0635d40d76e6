package com.trackinglog.engine.time;

import com.trackinglog.core.time.LedgerClock;

import java.time.Clock;

/**
 * Wall clock in epoch seconds, clamped so readings never go backwards.
 */
public class WallLedgerClock implements LedgerClock {

    private final Clock clock;
    private long last;

    public WallLedgerClock(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized long now() {
        long seconds = clock.instant().getEpochSecond();
        if (seconds > last) {
            last = seconds;
        }
        return last;
    }
}
