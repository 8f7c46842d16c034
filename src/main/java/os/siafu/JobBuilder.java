package os.siafu;

import os.siafu.schedule.CronSchedule;
import os.siafu.schedule.IntervalRule;
import os.siafu.schedule.RandomInstantResolver;
import os.siafu.schedule.RecurrenceRule;
import os.siafu.schedule.Schedule;
import os.siafu.schedule.Schedules;
import os.siafu.time.ScheduleTime;
import os.siafu.utils.DefaultSystemClock;
import os.siafu.utils.Log;
import os.siafu.utils.SystemClock;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.UUID;

/**
 * Fluent builder for {@link Job jobs}.
 *
 * <pre>{@code
 * Job job = new JobBuilder("cleanup")
 *         .recurring(IntervalRule.hourly(1), null)
 *         .maxRepeat(24)
 *         .handler(() -> cache.clear())
 *         .build();
 * }</pre>
 *
 * <p>Relative schedule times are resolved against the builder's clock at the moment the schedule is added.</p>
 */
public class JobBuilder {

    private final Log logger = Log.get(JobBuilder.class);

    private final String id = UUID.randomUUID().toString();
    private final String name;
    private final SystemClock systemClock;
    private final RandomInstantResolver randomInstantResolver;

    private final List<Schedule> schedules = new ArrayList<>();
    private final List<String> diagnostics = new ArrayList<>();
    private Instant nextRun;
    private JobFunction function;
    private boolean built;

    public JobBuilder(String name) {
        this(name, new DefaultSystemClock(), new Random());
    }

    public JobBuilder(String name, SystemClock systemClock, Random random) {
        this(name, systemClock, new RandomInstantResolver(random));
    }

    public JobBuilder(String name, SystemClock systemClock, RandomInstantResolver randomInstantResolver) {
        this.name = name == null || name.isEmpty() ? null : name;
        this.systemClock = Objects.requireNonNull(systemClock, "systemClock");
        this.randomInstantResolver = Objects.requireNonNull(randomInstantResolver, "randomInstantResolver");
    }

    /**
     * Runs the job a single time.
     */
    public JobBuilder once(ScheduleTime time) {
        return schedule(Schedules.once(time, systemClock));
    }

    /**
     * Runs the job repeatedly following the given rule.
     *
     * @param start the first run, or {@code null} to start one step of the rule from now
     */
    public JobBuilder recurring(RecurrenceRule rule, ScheduleTime start) {
        return schedule(Schedules.recurring(rule, start, systemClock));
    }

    /**
     * Runs the job repeatedly with the given interval, see {@link IntervalRule#of(Duration)}.
     *
     * @param start the first run, or {@code null} to start one interval from now
     */
    public JobBuilder every(Duration interval, ScheduleTime start) {
        return recurring(IntervalRule.of(interval), start);
    }

    /**
     * Runs the job on every instant matched by the cron pattern.
     *
     * <p>A malformed pattern does not fail the builder: the schedule is left out and the problem is recorded in
     * {@link Job#getDiagnostics()}. Check that the job still has schedules if the pattern comes from user input.</p>
     */
    public JobBuilder cron(String pattern) {
        CronSchedule schedule;
        try {
            schedule = Schedules.cron(pattern, systemClock);
        } catch (SchedulerException e) {
            diagnostics.add(e.getMessage());
            logger.warn("Skipping cron schedule of job '" + describe() + "': " + e.getMessage());
            return this;
        }
        return schedule(schedule);
    }

    /**
     * Runs the job a single time at a random instant between {@code start} (inclusive) and {@code end} (exclusive).
     * The instant is drawn now. If {@code end} is not after {@code start} the schedule never fires.
     */
    public JobBuilder random(ScheduleTime start, ScheduleTime end) {
        return schedule(Schedules.random(start, end, randomInstantResolver, systemClock));
    }

    /**
     * Adds a schedule built elsewhere, for example with {@link Schedules}.
     *
     * @throws IllegalArgumentException if the schedule was already added to a job
     */
    public JobBuilder schedule(Schedule schedule) {
        Objects.requireNonNull(schedule, "schedule");
        schedule.assignTo(id);
        schedules.add(schedule);
        schedule.peekNextRun().ifPresent(this::tightenNextRun);
        return this;
    }

    /**
     * Limits the number of runs of the schedule added last, i.e. {@link #lastSchedule()}.
     *
     * @throws IllegalStateException if no schedule has been added yet
     */
    public JobBuilder maxRepeat(int maxRuns) {
        lastSchedule().limitRuns(maxRuns);
        return this;
    }

    /**
     * @return the schedule added last
     * @throws IllegalStateException if no schedule has been added yet
     */
    public Schedule lastSchedule() {
        if (schedules.isEmpty()) {
            throw new IllegalStateException("Job '" + describe() + "' has no schedule yet");
        }
        return schedules.get(schedules.size() - 1);
    }

    public JobBuilder handler(JobFunction function) {
        this.function = Objects.requireNonNull(function, "function");
        return this;
    }

    public List<String> getDiagnostics() {
        return new ArrayList<>(diagnostics);
    }

    /**
     * @throws IllegalStateException if called a second time, since jobs must not share their schedules
     */
    public Job build() {
        if (built) {
            throw new IllegalStateException("Job '" + describe() + "' has already been built");
        }
        built = true;
        return new Job(id, name, new ArrayList<>(schedules), nextRun, function, new ArrayList<>(diagnostics));
    }

    private void tightenNextRun(Instant candidate) {
        if (nextRun == null || candidate.isBefore(nextRun)) {
            nextRun = candidate;
        }
    }

    private String describe() {
        return name != null ? name : id;
    }
}
