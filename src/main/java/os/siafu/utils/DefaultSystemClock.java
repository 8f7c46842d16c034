package os.siafu.utils;

import java.time.Instant;

public class DefaultSystemClock implements SystemClock {

    @Override
    public Instant now() {
        return Instant.now();
    }
}
