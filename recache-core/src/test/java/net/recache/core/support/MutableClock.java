package net.recache.core.support;

import net.recache.core.spi.Clock;

import java.time.Duration;
import java.time.Instant;

public final class MutableClock implements Clock {
    private volatile Instant now;

    public MutableClock(Instant start) { this.now = start; }

    @Override
    public Instant now() { return now; }

    public void advance(Duration d) { now = now.plus(d); }
}
