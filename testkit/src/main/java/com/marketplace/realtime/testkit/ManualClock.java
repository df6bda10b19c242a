package com.marketplace.realtime.testkit;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * A {@link Clock} that only moves when told to.
 *
 * <p>Shared by tests that need to reason about delays, backoff and idle timeouts without
 * sleeping. Usually driven through {@link ManualScheduler#advanceBy(Duration)} so that timers
 * observe the exact instant they were due at.
 */
public final class ManualClock extends Clock {

    private volatile long currentMillis;
    private final ZoneId zone;

    public ManualClock() {
        this(0L);
    }

    public ManualClock(long startMillis) {
        this(startMillis, ZoneOffset.UTC);
    }

    private ManualClock(long startMillis, ZoneId zone) {
        this.currentMillis = startMillis;
        this.zone = zone;
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return new ManualClock(currentMillis, Objects.requireNonNull(zone, "zone"));
    }

    @Override
    public long millis() {
        return currentMillis;
    }

    @Override
    public Instant instant() {
        return Instant.ofEpochMilli(currentMillis);
    }

    public void advance(Duration duration) {
        if (duration.isNegative()) {
            throw new IllegalArgumentException("Cannot move a clock backwards: " + duration);
        }
        currentMillis += duration.toMillis();
    }

    void setMillis(long millis) {
        if (millis < currentMillis) {
            throw new IllegalArgumentException("Cannot move a clock backwards to " + millis);
        }
        currentMillis = millis;
    }
}
