package os.siafu.schedule;

import org.junit.jupiter.api.Test;
import os.siafu.SchedulerException;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CustomRuleTest {

    private final Instant previous = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void map_known_names_to_fixed_steps() {
        assertEquals(Duration.ofDays(1), new CustomRule("daily", 0).getStep());
        assertEquals(Duration.ofDays(7), new CustomRule("weekly", 99).getStep());
        assertEquals(Duration.ofDays(30), new CustomRule("Monthly", 0).getStep());
    }

    @Test
    void fall_back_to_frequency_in_days() {
        CustomRule rule = new CustomRule("fortnightly", 14);

        assertEquals(previous.plus(Duration.ofDays(14)), rule.next(previous, previous).get());
    }

    @Test
    void start_one_minute_from_now_by_default() {
        assertEquals(previous.plusSeconds(60), new CustomRule("weekly", 1).defaultFirstRun(previous).get());
    }

    @Test
    void require_positive_frequency_for_unknown_names() {
        assertThrows(SchedulerException.class, () -> new CustomRule("sometimes", 0));
        assertDoesNotThrow(() -> new CustomRule("daily", 0));
    }
}
