package org.boc;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * A clock that only moves when a test tells it to.
 */
public class MutableClock extends Clock {

    private Instant now;

    public MutableClock(Instant start)
    {
        this.now = start;
    }

    public MutableClock()
    {
        this(Instant.parse("2026-02-03T19:00:00Z"));
    }

    public void advance(Duration duration)
    {
        now = now.plus(duration);
    }

    public void set(Instant instant)
    {
        now = instant;
    }

    @Override
    public ZoneId getZone()
    {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone)
    {
        return this;
    }

    @Override
    public Instant instant()
    {
        return now;
    }
}
