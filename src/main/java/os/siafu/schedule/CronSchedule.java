package os.siafu.schedule;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Fires on every instant matched by a {@link CronExpression}.
 *
 * <p>After each run the next run is looked up from the time of the tick, not from the run that just fired.
 * A schedule that was due many times while nobody polled therefore fires once and continues with the next
 * upcoming match.</p>
 */
public final class CronSchedule extends Schedule {

    private final CronExpression expression;
    private Instant upcoming;

    public CronSchedule(CronExpression expression, Instant now) {
        super(null);
        this.expression = Objects.requireNonNull(expression, "expression");
        this.upcoming = expression.nextAfter(now).orElse(null);
    }

    public CronExpression getExpression() {
        return expression;
    }

    @Override
    protected Optional<Instant> upcomingRun() {
        return Optional.ofNullable(upcoming);
    }

    @Override
    protected void moveToNextRun(Instant now) {
        upcoming = null;
        upcoming = expression.nextAfter(now).orElse(null);
    }
}
