package com.trackinglog.engine.time;

import com.trackinglog.core.time.LedgerClock;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counter-based logical clock. Every reading returns a value strictly greater than
 * the previous one, so each mutation gets its own timestamp.
 */
public class LogicalLedgerClock implements LedgerClock {

    private final AtomicLong counter;

    public LogicalLedgerClock(long genesis) {
        if (genesis < 0) {
            throw new IllegalArgumentException("genesis must be non-negative: " + genesis);
        }
        this.counter = new AtomicLong(genesis);
    }

    @Override
    public long now() {
        return counter.getAndIncrement();
    }
}
