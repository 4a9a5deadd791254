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

import dev.mars.rotlog.appender.RollingSpec.Strategy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link RollingSpec} parsing and policy creation.
 */
class RollingSpecTest {

    // ========================================================================
    // Strategy
    // ========================================================================

    @Nested
    @DisplayName("Strategy")
    class StrategyTests {

        @ParameterizedTest
        @ValueSource(strings = {"", " ", "none"})
        @DisplayName("Empty or none strategy disables rolling")
        void testNoRolling(String strategy) {
            assertSame(RollingSpec.NONE, RollingSpec.parse(strategy, "daily", "1024"));
        }

        @Test
        @DisplayName("Null strategy disables rolling")
        void testNullStrategy() {
            assertSame(RollingSpec.NONE, RollingSpec.parse(null, "daily", "1024"));
        }

        @ParameterizedTest
        @ValueSource(strings = {"weekly", "TIME", "sized", "random"})
        @DisplayName("Unknown strategy falls back to no rolling")
        void testUnknownStrategy(String strategy) {
            RollingSpec spec = RollingSpec.parse(strategy, "daily", "1024");

            assertEquals(Strategy.NONE, spec.strategy());
            assertFalse(spec.rotates());
        }
    }

    // ========================================================================
    // Time based
    // ========================================================================

    @Nested
    @DisplayName("Time based")
    class TimeTests {

        @Test
        void testDaily() {
            RollingSpec spec = RollingSpec.parse("time", "daily", "");

            assertEquals(Strategy.TIME, spec.strategy());
            assertEquals(86_400_000L, spec.intervalMillis());
            assertEquals("--yyyy-MM-dd", spec.suffixPattern());
        }

        @Test
        void testHourly() {
            RollingSpec spec = RollingSpec.parse("time", "hourly", "");

            assertEquals(3_600_000L, spec.intervalMillis());
            assertEquals("--yyyy-MM-dd--HH", spec.suffixPattern());
        }

        @Test
        void testMinutely() {
            RollingSpec spec = RollingSpec.parse("time", "minutely", "");

            assertEquals(60_000L, spec.intervalMillis());
            assertEquals("--yyyy-MM-dd--HH-mm", spec.suffixPattern());
        }

        @Test
        void testSecondsLiteral() {
            RollingSpec spec = RollingSpec.parse("time", "90", "");

            assertEquals(90_000L, spec.intervalMillis());
            assertEquals("--yyyy-MM-dd--HH-mm-ss", spec.suffixPattern());
        }

        @ParameterizedTest
        @ValueSource(strings = {"bogus", "0", "-5", "1.5", "", "Daily", "99999999999999999999"})
        @DisplayName("Invalid interval falls back to no rolling")
        void testInvalidInterval(String interval) {
            assertSame(RollingSpec.NONE, RollingSpec.parse("time", interval, ""));
        }

        @Test
        void testNullInterval() {
            assertSame(RollingSpec.NONE, RollingSpec.parse("time", null, ""));
        }

        @Test
        @DisplayName("Seconds that would overflow millis are rejected")
        void testOverflowingSeconds() {
            assertTrue(RollingSpec.parseInterval(Long.toString(Long.MAX_VALUE)).isEmpty());
        }
    }

    // ========================================================================
    // Size based
    // ========================================================================

    @Nested
    @DisplayName("Size based")
    class SizeTests {

        @Test
        void testValidSize() {
            RollingSpec spec = RollingSpec.parse("size", "daily", "1048576");

            assertEquals(Strategy.SIZE, spec.strategy());
            assertEquals(1_048_576L, spec.maxBytes());
        }

        @Test
        void testSizeIsTrimmed() {
            assertEquals(10L, RollingSpec.parse("size", null, " 10 ").maxBytes());
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "0", "-1", "abc", "10MB"})
        @DisplayName("Invalid size falls back to no rolling")
        void testInvalidSize(String maxBytes) {
            assertSame(RollingSpec.NONE, RollingSpec.parse("size", "daily", maxBytes));
        }

        @Test
        void testNullSize() {
            assertSame(RollingSpec.NONE, RollingSpec.parse("size", "daily", null));
        }
    }

    // ========================================================================
    // Policy creation
    // ========================================================================

    @Test
    void testNewPolicyForEachStrategy() {
        MutableClock clock = new MutableClock(Instant.parse("2026-10-19T10:00:30Z"));

        assertTrue(RollingSpec.NONE.newPolicy(clock).isEmpty());
        assertInstanceOf(TimeBasedRollingPolicy.class,
                RollingSpec.parse("time", "hourly", "").newPolicy(clock).orElseThrow());
        assertInstanceOf(SizeBasedRollingPolicy.class,
                RollingSpec.parse("size", "", "100").newPolicy(clock).orElseThrow());
    }

    @Test
    void testNewPolicyIsFreshEachTime() {
        MutableClock clock = new MutableClock(Instant.parse("2026-10-19T10:00:30Z"));
        RollingSpec spec = RollingSpec.sizeBased(10);

        assertNotSame(spec.newPolicy(clock).orElseThrow(), spec.newPolicy(clock).orElseThrow());
    }

    @Test
    void testRejectsInconsistentSpec() {
        assertThrows(IllegalArgumentException.class, () -> RollingSpec.timeBased(0, "--yyyy"));
        assertThrows(IllegalArgumentException.class, () -> RollingSpec.timeBased(1000, null));
        assertThrows(IllegalArgumentException.class, () -> RollingSpec.sizeBased(0));
        assertThrows(IllegalArgumentException.class, () -> new RollingSpec(null, 0, null, 0));
    }
}
