/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.rotlog.appender;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Rotates when the clock crosses an interval boundary.
 * <p>
 * Boundaries are multiples of the interval counted from the epoch, so a daily
 * policy rolls at UTC midnight whatever the local zone. Archive names carry the
 * start of the period they cover, formatted in the clock's zone.
 */
public final class TimeBasedRollingPolicy implements RollingPolicy {

    private static final Logger LOG = LoggerFactory.getLogger(TimeBasedRollingPolicy.class);

    private final long intervalMillis;
    private final String suffixPattern;
    private final DateTimeFormatter formatter;
    private final Clock clock;

    private long nextRolloverTime;

    /**
     * @param intervalMillis rollover interval, must be positive
     * @param suffixPattern  {@link DateTimeFormatter} pattern for archive suffixes
     * @param clock          time source; its zone is used for suffixes
     */
    public TimeBasedRollingPolicy(long intervalMillis, String suffixPattern, Clock clock) {
        if (intervalMillis <= 0) {
            throw new IllegalArgumentException("Rollover interval must be positive: " + intervalMillis);
        }
        this.intervalMillis = intervalMillis;
        this.suffixPattern = Objects.requireNonNull(suffixPattern, "suffixPattern");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.formatter = DateTimeFormatter.ofPattern(suffixPattern).withZone(clock.getZone());
        this.nextRolloverTime = boundaryAfter(clock.millis());
        LOG.debug("Time based rolling every {} ms, first rollover at {}",
                intervalMillis, Instant.ofEpochMilli(nextRolloverTime));
    }

    public long intervalMillis() {
        return intervalMillis;
    }

    public String suffixPattern() {
        return suffixPattern;
    }

    /** Epoch millis at which the next rotation becomes due. */
    public long nextRolloverTime() {
        return nextRolloverTime;
    }

    @Override
    public boolean shouldRotate(long pendingBytes) {
        return clock.millis() >= nextRolloverTime;
    }

    @Override
    public void onRotate() {
        long from = Math.max(clock.millis(), nextRolloverTime);
        nextRolloverTime = boundaryAfter(from);
        LOG.debug("Next rollover at {}", Instant.ofEpochMilli(nextRolloverTime));
    }

    @Override
    public String archiveSuffix() {
        return formatter.format(Instant.ofEpochMilli(nextRolloverTime - intervalMillis));
    }

    /** First interval boundary strictly after the given time. */
    private long boundaryAfter(long millis) {
        return (Math.floorDiv(millis, intervalMillis) + 1) * intervalMillis;
    }

    @Override
    public String toString() {
        return "TimeBasedRollingPolicy{" +
                "intervalMillis=" + intervalMillis +
                ", suffixPattern='" + suffixPattern + '\'' +
                ", nextRolloverTime=" + nextRolloverTime +
                '}';
    }
}
