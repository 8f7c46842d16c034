package os.siafu.schedule;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Fires a single time at a fixed instant.
 */
public final class OnceSchedule extends Schedule {

    private final Instant runAt;

    public OnceSchedule(Instant runAt) {
        super(1);
        this.runAt = Objects.requireNonNull(runAt, "runAt");
    }

    public Instant getRunAt() {
        return runAt;
    }

    @Override
    protected Optional<Instant> upcomingRun() {
        return getRunCount() == 0 ? Optional.of(runAt) : Optional.empty();
    }

    @Override
    protected void moveToNextRun(Instant now) {
    }
}
