package os.siafu.schedule;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Fires a single time at an instant drawn once, when the schedule is built, from {@code [start, end)}.
 * If {@code end} is not after {@code start} the schedule never fires.
 */
public final class RandomSchedule extends Schedule {

    private final Instant start;
    private final Instant end;
    private final Instant runAt;

    public RandomSchedule(Instant start, Instant end, RandomInstantResolver resolver) {
        super(null);
        this.start = Objects.requireNonNull(start, "start");
        this.end = Objects.requireNonNull(end, "end");
        this.runAt = resolver.resolve(start, end).orElse(null);
    }

    public Instant getStart() {
        return start;
    }

    public Instant getEnd() {
        return end;
    }

    @Override
    protected Optional<Instant> upcomingRun() {
        return getRunCount() == 0 ? Optional.ofNullable(runAt) : Optional.empty();
    }

    @Override
    protected void moveToNextRun(Instant now) {
    }
}
