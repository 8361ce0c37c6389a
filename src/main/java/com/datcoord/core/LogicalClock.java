package com.datcoord.core;

import java.util.concurrent.atomic.AtomicLong;

public class LogicalClock {
    private final AtomicLong counter;

    public LogicalClock() {
        this(0L);
    }

    public LogicalClock(long start) {
        if (start < 0) {
            throw new IllegalArgumentException("clock start must be >= 0");
        }
        this.counter = new AtomicLong(start);
    }

    public long tick() {
        return counter.incrementAndGet();
    }

    public long current() {
        return counter.get();
    }

    public void advanceTo(long value) {
        counter.accumulateAndGet(value, Math::max);
    }
}
