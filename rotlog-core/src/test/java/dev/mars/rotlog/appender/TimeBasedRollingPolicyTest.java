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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link TimeBasedRollingPolicy}.
 */
class TimeBasedRollingPolicyTest {

    private static final Instant T0 = Instant.parse("2026-10-19T10:00:30Z");

    private static TimeBasedRollingPolicy minutely(MutableClock clock) {
        return new TimeBasedRollingPolicy(RollingSpec.MINUTELY_MILLIS, RollingSpec.MINUTELY_PATTERN, clock);
    }

    // ========================================================================
    // Rollover boundary
    // ========================================================================

    @Nested
    @DisplayName("Rollover boundary")
    class BoundaryTests {

        @Test
        @DisplayName("First rollover is the next interval boundary")
        void testFirstRolloverIsNextBoundary() {
            MutableClock clock = new MutableClock(T0);
            TimeBasedRollingPolicy policy = minutely(clock);

            assertEquals(Instant.parse("2026-10-19T10:01:00Z").toEpochMilli(), policy.nextRolloverTime());
        }

        @Test
        @DisplayName("Construction exactly on a boundary waits for the following one")
        void testConstructionOnBoundary() {
            MutableClock clock = new MutableClock(Instant.parse("2026-10-19T10:00:00Z"));
            TimeBasedRollingPolicy policy = minutely(clock);

            assertEquals(Instant.parse("2026-10-19T10:01:00Z").toEpochMilli(), policy.nextRolloverTime());
            assertFalse(policy.shouldRotate(1));
        }

        @Test
        @DisplayName("Rotation becomes due at the boundary, not before")
        void testShouldRotateAtBoundary() {
            MutableClock clock = new MutableClock(T0);
            TimeBasedRollingPolicy policy = minutely(clock);

            assertFalse(policy.shouldRotate(100));
            clock.set(Instant.parse("2026-10-19T10:00:59.999Z"));
            assertFalse(policy.shouldRotate(100));
            clock.set(Instant.parse("2026-10-19T10:01:00Z"));
            assertTrue(policy.shouldRotate(100));
        }

        @Test
        @DisplayName("Pending byte count does not influence the decision")
        void testIgnoresPendingBytes() {
            MutableClock clock = new MutableClock(T0);
            TimeBasedRollingPolicy policy = minutely(clock);

            assertFalse(policy.shouldRotate(0));
            assertFalse(policy.shouldRotate(Long.MAX_VALUE));
            clock.advance(Duration.ofMinutes(1));
            assertTrue(policy.shouldRotate(0));
            assertTrue(policy.shouldRotate(Long.MAX_VALUE));
        }

        @Test
        @DisplayName("onRotate advances one interval and stops the rotation firing again")
        void testOnRotateAdvancesOneInterval() {
            MutableClock clock = new MutableClock(T0);
            TimeBasedRollingPolicy policy = minutely(clock);

            clock.set(Instant.parse("2026-10-19T10:01:10Z"));
            assertTrue(policy.shouldRotate(1));
            policy.onRotate();

            assertEquals(Instant.parse("2026-10-19T10:02:00Z").toEpochMilli(), policy.nextRolloverTime());
            assertFalse(policy.shouldRotate(1));
        }

        @Test
        @DisplayName("Idle intervals are skipped, never revisited")
        void testSkipsIdleIntervals() {
            MutableClock clock = new MutableClock(T0);
            TimeBasedRollingPolicy policy = minutely(clock);

            clock.set(Instant.parse("2026-10-19T10:05:30Z"));
            assertTrue(policy.shouldRotate(1));
            policy.onRotate();

            assertEquals(Instant.parse("2026-10-19T10:06:00Z").toEpochMilli(), policy.nextRolloverTime());
            assertFalse(policy.shouldRotate(1));
        }

        @Test
        @DisplayName("Custom seconds interval aligns to multiples of the interval")
        void testCustomSecondsInterval() {
            MutableClock clock = new MutableClock(T0);
            TimeBasedRollingPolicy policy = new TimeBasedRollingPolicy(7000L, RollingSpec.SECONDS_PATTERN, clock);

            long next = policy.nextRolloverTime();
            assertEquals(0, next % 7000);
            assertTrue(next > T0.toEpochMilli());
            assertTrue(next - T0.toEpochMilli() <= 7000);
        }
    }

    // ========================================================================
    // Archive suffix
    // ========================================================================

    @Nested
    @DisplayName("Archive suffix")
    class SuffixTests {

        @Test
        @DisplayName("Minutely suffix names the minute being closed")
        void testMinutelySuffixIsEarlierMinute() {
            MutableClock clock = new MutableClock(T0);
            TimeBasedRollingPolicy policy = minutely(clock);

            clock.set(Instant.parse("2026-10-19T10:01:05Z"));
            assertTrue(policy.shouldRotate(1));
            assertEquals("--2026-10-19--10-00", policy.archiveSuffix());
            policy.onRotate();

            clock.set(Instant.parse("2026-10-19T10:02:01Z"));
            assertEquals("--2026-10-19--10-01", policy.archiveSuffix());
        }

        @Test
        @DisplayName("Daily suffix is the date")
        void testDailySuffix() {
            MutableClock clock = new MutableClock(T0);
            TimeBasedRollingPolicy policy =
                    new TimeBasedRollingPolicy(RollingSpec.DAILY_MILLIS, RollingSpec.DAILY_PATTERN, clock);

            assertEquals("--2026-10-19", policy.archiveSuffix());
        }

        @Test
        @DisplayName("Hourly suffix is date and hour")
        void testHourlySuffix() {
            MutableClock clock = new MutableClock(T0);
            TimeBasedRollingPolicy policy =
                    new TimeBasedRollingPolicy(RollingSpec.HOURLY_MILLIS, RollingSpec.HOURLY_PATTERN, clock);

            assertEquals("--2026-10-19--10", policy.archiveSuffix());
        }

        @Test
        @DisplayName("Seconds suffix carries date, hour, minute and second")
        void testSecondsSuffixShape() {
            MutableClock clock = new MutableClock(T0);
            TimeBasedRollingPolicy policy = new TimeBasedRollingPolicy(5000L, RollingSpec.SECONDS_PATTERN, clock);

            assertEquals("--2026-10-19--10-00-30", policy.archiveSuffix());
        }

        @Test
        @DisplayName("Suffix is formatted in the clock's zone")
        void testSuffixUsesClockZone() {
            MutableClock utc = new MutableClock(T0);
            TimeBasedRollingPolicy policy = new TimeBasedRollingPolicy(
                    RollingSpec.HOURLY_MILLIS, RollingSpec.HOURLY_PATTERN, utc.withZone(ZoneOffset.ofHours(2)));

            assertEquals("--2026-10-19--12", policy.archiveSuffix());
        }

        @Test
        @DisplayName("Successive suffixes strictly increase")
        void testSuffixesIncrease() {
            MutableClock clock = new MutableClock(T0);
            TimeBasedRollingPolicy policy = minutely(clock);

            String previous = null;
            for (int i = 0; i < 5; i++) {
                clock.advance(Duration.ofSeconds(61 + i * 45L));
                assertTrue(policy.shouldRotate(1));
                String suffix = policy.archiveSuffix();
                if (previous != null) {
                    assertTrue(suffix.compareTo(previous) > 0, suffix + " should sort after " + previous);
                }
                previous = suffix;
                policy.onRotate();
            }
        }
    }

    @Test
    void testRejectsNonPositiveInterval() {
        MutableClock clock = new MutableClock(T0);
        assertThrows(IllegalArgumentException.class,
                () -> new TimeBasedRollingPolicy(0L, RollingSpec.SECONDS_PATTERN, clock));
        assertThrows(IllegalArgumentException.class,
                () -> new TimeBasedRollingPolicy(-1000L, RollingSpec.SECONDS_PATTERN, clock));
    }
}
