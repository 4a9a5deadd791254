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
import java.util.Optional;

/**
 * Parsed rotation settings.
 * <p>
 * The raw configuration strings (strategy, interval, size) are parsed once into
 * this record. Invalid settings never fail: they are logged and degrade to
 * {@link Strategy#NONE} so that a bad rotation setting cannot stop log capture.
 *
 * <h2>Accepted values</h2>
 * <table border="1">
 *   <tr><th>Strategy</th><th>Value</th><th>Interval</th><th>Archive suffix</th></tr>
 *   <tr><td>time</td><td>daily</td><td>24h</td><td>--yyyy-MM-dd</td></tr>
 *   <tr><td>time</td><td>hourly</td><td>1h</td><td>--yyyy-MM-dd--HH</td></tr>
 *   <tr><td>time</td><td>minutely</td><td>1m</td><td>--yyyy-MM-dd--HH-mm</td></tr>
 *   <tr><td>time</td><td>N (seconds)</td><td>N s</td><td>--yyyy-MM-dd--HH-mm-ss</td></tr>
 *   <tr><td>size</td><td>N (bytes)</td><td>-</td><td>--NNNNNN</td></tr>
 * </table>
 *
 * @param strategy       which rotation is enabled
 * @param intervalMillis rollover interval for {@link Strategy#TIME}, 0 otherwise
 * @param suffixPattern  archive suffix pattern for {@link Strategy#TIME}, null otherwise
 * @param maxBytes       rollover threshold for {@link Strategy#SIZE}, 0 otherwise
 */
public record RollingSpec(
        Strategy strategy,
        long intervalMillis,
        String suffixPattern,
        long maxBytes
) {

    private static final Logger LOG = LoggerFactory.getLogger(RollingSpec.class);

    static final long DAILY_MILLIS = 24 * 60 * 60 * 1000L;
    static final long HOURLY_MILLIS = 60 * 60 * 1000L;
    static final long MINUTELY_MILLIS = 60 * 1000L;

    static final String DAILY_PATTERN = "--yyyy-MM-dd";
    static final String HOURLY_PATTERN = "--yyyy-MM-dd--HH";
    static final String MINUTELY_PATTERN = "--yyyy-MM-dd--HH-mm";
    static final String SECONDS_PATTERN = "--yyyy-MM-dd--HH-mm-ss";

    /** No rotation: a single ever-growing file. */
    public static final RollingSpec NONE = new RollingSpec(Strategy.NONE, 0L, null, 0L);

    public enum Strategy {
        NONE,
        TIME,
        SIZE
    }

    public RollingSpec {
        if (strategy == null) {
            throw new IllegalArgumentException("strategy must not be null");
        }
        if (strategy == Strategy.TIME && (intervalMillis <= 0 || suffixPattern == null)) {
            throw new IllegalArgumentException("Time based rolling needs a positive interval and a suffix pattern");
        }
        if (strategy == Strategy.SIZE && maxBytes <= 0) {
            throw new IllegalArgumentException("Size based rolling needs a positive byte threshold");
        }
    }

    public static RollingSpec timeBased(long intervalMillis, String suffixPattern) {
        return new RollingSpec(Strategy.TIME, intervalMillis, suffixPattern, 0L);
    }

    public static RollingSpec sizeBased(long maxBytes) {
        return new RollingSpec(Strategy.SIZE, 0L, null, maxBytes);
    }

    /**
     * Parses the raw rotation settings.
     *
     * @param strategy "", "none", "time" or "size"
     * @param interval interval for "time": daily, hourly, minutely or a positive number of seconds
     * @param maxBytes byte threshold for "size"
     * @return the parsed spec, {@link #NONE} when rotation is off or misconfigured
     */
    public static RollingSpec parse(String strategy, String interval, String maxBytes) {
        String s = strategy == null ? "" : strategy.trim();
        switch (s) {
            case "":
            case "none":
                return NONE;
            case "time":
                return parseInterval(interval).orElseGet(() -> {
                    LOG.warn("Illegal interval for rolling logs [{}], rolling logs not enabled", interval);
                    return NONE;
                });
            case "size":
                return parseSize(maxBytes).orElseGet(() -> {
                    LOG.warn("Illegal size [{}] for rolling logs, rolling logs not enabled", maxBytes);
                    return NONE;
                });
            default:
                LOG.warn("Illegal strategy [{}] for rolling logs, rolling logs not enabled", strategy);
                return NONE;
        }
    }

    /**
     * Parses a time interval value.
     *
     * @return the time based spec, or empty if the value is not a valid interval
     */
    public static Optional<RollingSpec> parseInterval(String interval) {
        if (interval == null) {
            return Optional.empty();
        }
        String value = interval.trim();
        switch (value) {
            case "daily":
                return Optional.of(timeBased(DAILY_MILLIS, DAILY_PATTERN));
            case "hourly":
                return Optional.of(timeBased(HOURLY_MILLIS, HOURLY_PATTERN));
            case "minutely":
                return Optional.of(timeBased(MINUTELY_MILLIS, MINUTELY_PATTERN));
            default:
                return parsePositiveLong(value)
                        .filter(seconds -> seconds <= Long.MAX_VALUE / 1000)
                        .map(seconds -> timeBased(seconds * 1000L, SECONDS_PATTERN));
        }
    }

    /**
     * Parses a byte threshold value.
     *
     * @return the size based spec, or empty if the value is not a positive integer
     */
    public static Optional<RollingSpec> parseSize(String maxBytes) {
        if (maxBytes == null) {
            return Optional.empty();
        }
        return parsePositiveLong(maxBytes.trim()).map(RollingSpec::sizeBased);
    }

    private static Optional<Long> parsePositiveLong(String value) {
        try {
            long parsed = Long.parseLong(value);
            return parsed > 0 ? Optional.of(parsed) : Optional.empty();
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * @return true if this spec rotates files
     */
    public boolean rotates() {
        return strategy != Strategy.NONE;
    }

    /**
     * Builds a fresh policy for one appender.
     *
     * @param clock time source for time based rotation
     * @return the policy, or empty for {@link Strategy#NONE}
     */
    public Optional<RollingPolicy> newPolicy(Clock clock) {
        switch (strategy) {
            case TIME:
                return Optional.of(new TimeBasedRollingPolicy(intervalMillis, suffixPattern, clock));
            case SIZE:
                return Optional.of(new SizeBasedRollingPolicy(maxBytes));
            default:
                return Optional.empty();
        }
    }

    /** Human readable description used in log messages. */
    public String describe() {
        switch (strategy) {
            case TIME:
                return "rolling every " + (intervalMillis / 1000) + " s";
            case SIZE:
                return "rolling every " + maxBytes + " bytes";
            default:
                return "no rolling";
        }
    }
}
