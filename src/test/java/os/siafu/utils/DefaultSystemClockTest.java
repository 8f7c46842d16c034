package os.siafu.utils;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;

public class DefaultSystemClockTest {

    private DefaultSystemClock defaultSystemClock;

    @BeforeEach
    void init() {
        defaultSystemClock = new DefaultSystemClock();
    }

    @Test
    void return_current_instant() {
        Instant before = Instant.now();

        Instant now = defaultSystemClock.now();

        Instant after = Instant.now();

        assertNotNull(now);
        assertFalse(now.isBefore(before));
        assertFalse(now.isAfter(after));
    }
}
