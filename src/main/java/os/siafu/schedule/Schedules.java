package os.siafu.schedule;

import os.siafu.SchedulerException;
import os.siafu.time.ScheduleTime;
import os.siafu.utils.SystemClock;

import java.time.Instant;

/**
 * Factory methods that resolve {@link ScheduleTime schedule times} against a clock and create schedules.
 *
 * <p>Schedules created here can be capped directly, e.g.
 * {@code Schedules.recurring(IntervalRule.minutely(5), null, clock).limitRuns(3)}, and handed to
 * {@link os.siafu.JobBuilder#schedule(Schedule)}.</p>
 */
public final class Schedules {

    private Schedules() {
    }

    public static OnceSchedule once(ScheduleTime time, SystemClock clock) {
        return new OnceSchedule(time.resolve(clock));
    }

    /**
     * @param start first run, or {@code null} to let the rule pick its default first run
     */
    public static RecurringSchedule recurring(RecurrenceRule rule, ScheduleTime start, SystemClock clock) {
        Instant firstRun = start != null
                ? start.resolve(clock)
                : rule.defaultFirstRun(clock.now()).orElse(null);
        return new RecurringSchedule(rule, firstRun);
    }

    /**
     * @throws SchedulerException of kind {@code INVALID_SCHEDULE} if the pattern is malformed
     */
    public static CronSchedule cron(String pattern, SystemClock clock) {
        return new CronSchedule(CronExpression.parse(pattern), clock.now());
    }

    public static RandomSchedule random(ScheduleTime start, ScheduleTime end, RandomInstantResolver resolver, SystemClock clock) {
        return new RandomSchedule(start.resolve(clock), end.resolve(clock), resolver);
    }
}
