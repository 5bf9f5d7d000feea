package de.htwsaar.modelcache.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;

/** Verstellbare Uhr für deterministische Zeit-Tests. */
public final class MutableClock extends Clock {

    private Instant current;

    public MutableClock(Instant start) {
        this.current = start;
    }

    public static MutableClock atEpochMillis(long ms) {
        return new MutableClock(Instant.ofEpochMilli(ms));
    }

    public void advance(Duration d) {
        current = current.plus(d);
    }

    public void advanceMillis(long ms) {
        current = current.plusMillis(ms);
    }

    public void setMillis(long ms) {
        current = Instant.ofEpochMilli(ms);
    }

    @Override
    public ZoneId getZone() {
        return ZoneId.of("UTC");
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return this;
    }

    @Override
    public Instant instant() {
        return current;
    }
}
