package com.signal.corroboration.fetch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RequestThrottleTest {

    @Test
    @DisplayName("Should not wait before the first request")
    void firstRequestIsImmediate() throws InterruptedException {
        ManualClock clock = new ManualClock();
        RequestThrottle throttle = new RequestThrottle(Duration.ofSeconds(2), clock, clock);

        throttle.acquire();

        assertTrue(clock.getSleeps().isEmpty());
    }

    @Test
    @DisplayName("Should sleep only the remainder of the interval")
    void sleepsRemainder() throws InterruptedException {
        ManualClock clock = new ManualClock();
        RequestThrottle throttle = new RequestThrottle(Duration.ofSeconds(2), clock, clock);

        throttle.acquire();
        clock.advance(Duration.ofMillis(500));
        throttle.acquire();

        assertEquals(List.of(Duration.ofMillis(1500)), clock.getSleeps());
    }

    @Test
    @DisplayName("Should not sleep when the interval has already passed")
    void noSleepAfterInterval() throws InterruptedException {
        ManualClock clock = new ManualClock();
        RequestThrottle throttle = new RequestThrottle(Duration.ofSeconds(2), clock, clock);

        throttle.acquire();
        clock.advance(Duration.ofSeconds(3));
        throttle.acquire();

        assertTrue(clock.getSleeps().isEmpty());
    }

    @Test
    @DisplayName("Should space a burst of requests by the interval")
    void spacesBurst() throws InterruptedException {
        ManualClock clock = new ManualClock();
        RequestThrottle throttle = new RequestThrottle(Duration.ofSeconds(1), clock, clock);

        for (int i = 0; i < 4; i++) {
            throttle.acquire();
        }

        assertEquals(3, clock.getSleeps().size());
        assertEquals(Duration.ofSeconds(3), clock.totalSlept());
    }

    @Test
    @DisplayName("Should reject a negative interval")
    void rejectsNegativeInterval() {
        ManualClock clock = new ManualClock();
        assertThrows(IllegalArgumentException.class,
                () -> new RequestThrottle(Duration.ofSeconds(-1), clock, clock));
    }
}
