package com.example.mediaagent.progress;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.OptionalLong;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TimeRemainingTest {

    private final AtomicLong clock = new AtomicLong();
    private TimeRemaining timeRemaining;

    @BeforeEach
    void setUp() {
        timeRemaining = new TimeRemaining(Duration.ofSeconds(1), clock::get);
    }

    private void advance(long seconds) {
        clock.addAndGet(TimeUnit.SECONDS.toNanos(seconds));
    }

    @Test
    void unknownUntilFirstSample() {
        timeRemaining.add(1, 1000);
        timeRemaining.update(1, 100);

        assertTrue(timeRemaining.timeRemainingSeconds().isEmpty());
    }

    @Test
    void estimatesFromMeasuredRate() {
        timeRemaining.add(1, 1000);
        advance(2);
        timeRemaining.update(1, 200);

        // 100 B/s, 800 B restantes
        assertEquals(OptionalLong.of(8), timeRemaining.timeRemainingSeconds());
    }

    @Test
    void slowestDeviceWins() {
        timeRemaining.add(1, 1000);
        timeRemaining.add(2, 1000);
        advance(1);
        timeRemaining.update(1, 500);
        timeRemaining.update(2, 100);

        assertEquals(OptionalLong.of(9), timeRemaining.timeRemainingSeconds());

        timeRemaining.remove(2);
        assertEquals(OptionalLong.of(1), timeRemaining.timeRemainingSeconds());
    }

    @Test
    void pausedTimeDoesNotLowerTheRate() {
        timeRemaining.add(1, 1000);
        advance(1);
        timeRemaining.update(1, 100);

        timeRemaining.pause();
        advance(60);
        timeRemaining.resume();
        advance(1);
        timeRemaining.update(1, 100);

        assertEquals(OptionalLong.of(8), timeRemaining.timeRemainingSeconds());
    }

    @Test
    void skippedBytesShortenTheEstimateWithoutRaisingTheRate() {
        timeRemaining.add(1, 1000);
        advance(1);
        timeRemaining.update(1, 100);

        timeRemaining.skip(1, 500);
        advance(1);
        timeRemaining.update(1, 100);

        // continua a 100 B/s, 300 B restantes
        assertEquals(OptionalLong.of(3), timeRemaining.timeRemainingSeconds());
    }

    @Test
    void nothingOutstandingIsZero() {
        timeRemaining.add(1, 100);
        timeRemaining.update(1, 100);

        assertEquals(OptionalLong.of(0), timeRemaining.timeRemainingSeconds());
        timeRemaining.clear();
        assertEquals(OptionalLong.of(0), timeRemaining.timeRemainingSeconds());
    }
}
