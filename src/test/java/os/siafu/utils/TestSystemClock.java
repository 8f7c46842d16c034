package os.siafu.utils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

public class TestSystemClock implements SystemClock {

    private Clock clock = Clock.systemUTC();

    @Override
    public Instant now() {
        return clock.instant();
    }

    public void timeTravelBy(Duration duration) {
        this.clock = Clock.offset(this.clock, duration);
    }

    public void fixedTime(Instant now) {
        this.clock = Clock.fixed(now, ZoneOffset.UTC);
    }

    public void resetTime() {
        this.clock = Clock.systemUTC();
    }
}
