package os.siafu.utils;

import java.time.Instant;

public interface SystemClock {

    Instant now();
}
