package os.siafu.schedule;

import java.time.Instant;
import java.util.Optional;

/**
 * The cadence of a {@link RecurringSchedule}. Rules are immutable; computing an instant never changes a rule.
 *
 * @see IntervalRule
 * @see CustomRule
 * @see CronRule
 */
public interface RecurrenceRule {

    /**
     * Computes the run following a run that was planned for {@code previous} and fired at {@code now}.
     *
     * @param previous the planned time of the run that just fired
     * @param now      the current time
     * @return the next planned run, or {@link Optional#empty()} if the rule produces no further runs
     */
    Optional<Instant> next(Instant previous, Instant now);

    /**
     * Computes the first run of a schedule that was built without an explicit start time.
     *
     * @param now the time the schedule is built
     * @return the first planned run, or {@link Optional#empty()} if the rule never fires
     */
    Optional<Instant> defaultFirstRun(Instant now);
}
