package os.siafu.schedule;

import os.siafu.SchedulerException;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Fires repeatedly following a {@link RecurrenceRule}. The planned next run is stored and replaced on every
 * advancement, so fixed intervals are counted from the previous planned run and not from the time the job
 * actually ran.
 */
public final class RecurringSchedule extends Schedule {

    private final RecurrenceRule rule;
    private Instant nextRun;

    public RecurringSchedule(RecurrenceRule rule, Instant firstRun) {
        super(null);
        this.rule = Objects.requireNonNull(rule, "rule");
        this.nextRun = firstRun;
    }

    public RecurrenceRule getRule() {
        return rule;
    }

    @Override
    protected Optional<Instant> upcomingRun() {
        return Optional.ofNullable(nextRun);
    }

    @Override
    protected void moveToNextRun(Instant now) {
        if (nextRun == null) {
            return;
        }

        Instant previous = nextRun;
        try {
            nextRun = rule.next(previous, now).orElse(null);
        } catch (SchedulerException e) {
            nextRun = null;
            throw e;
        }
    }
}
