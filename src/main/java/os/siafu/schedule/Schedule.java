package os.siafu.schedule;

import os.siafu.SchedulerException;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * A single firing rule of a job together with its run count and optional run limit.
 *
 * <p>{@link #peekNextRun()} only reads the state of a schedule. {@link #advance(Instant)} is the one and only
 * transition and is performed by the {@link os.siafu.Scheduler} right after the owning job fired. Calling it from
 * anywhere else counts as a run.</p>
 *
 * <p>Once {@link #getRunCount() the run count} reaches {@link #getMaxRuns() the run limit} the schedule is
 * exhausted and never reports a next run again.</p>
 */
public abstract class Schedule {

    private Integer maxRuns;
    private int runCount;
    private String owner;

    protected Schedule(Integer maxRuns) {
        if (maxRuns != null) {
            checkLimit(maxRuns);
        }
        this.maxRuns = maxRuns;
    }

    /**
     * Returns the time this schedule is due next, without changing any state.
     *
     * @return the next planned run, or {@link Optional#empty()} if this schedule will not fire again
     */
    public final Optional<Instant> peekNextRun() {
        if (isExhausted()) {
            return Optional.empty();
        }
        return upcomingRun();
    }

    /**
     * Records a run of this schedule and moves it to its following run.
     *
     * @param now the time of the tick in which the schedule fired
     * @return the new next run, or {@link Optional#empty()} if this schedule will not fire again
     * @throws SchedulerException of kind {@code TIME_CALCULATION} if the following run can not be computed;
     *                            the schedule does not fire again in that case
     */
    public final Optional<Instant> advance(Instant now) {
        if (isExhausted()) {
            return Optional.empty();
        }

        runCount++;

        if (!isExhausted()) {
            moveToNextRun(now);
        }

        return peekNextRun();
    }

    /**
     * Limits the number of runs of this schedule.
     *
     * @param maxRuns the maximum number of runs, must be positive
     * @return this schedule
     */
    public Schedule limitRuns(int maxRuns) {
        checkLimit(maxRuns);
        this.maxRuns = maxRuns;
        return this;
    }

    /**
     * Binds this schedule to the job with the given id. A schedule belongs to exactly one job.
     *
     * @throws IllegalArgumentException if the schedule already belongs to a job
     */
    public final void assignTo(String jobId) {
        if (owner != null) {
            throw new IllegalArgumentException(this + " already belongs to job " + owner);
        }
        this.owner = Objects.requireNonNull(jobId, "jobId");
    }

    public final Optional<String> getOwner() {
        return Optional.ofNullable(owner);
    }

    public OptionalInt getMaxRuns() {
        return maxRuns == null ? OptionalInt.empty() : OptionalInt.of(maxRuns);
    }

    public int getRunCount() {
        return runCount;
    }

    public boolean isExhausted() {
        return maxRuns != null && runCount >= maxRuns;
    }

    /**
     * @return the next run ignoring the run limit
     */
    protected abstract Optional<Instant> upcomingRun();

    /**
     * Moves the schedule past the run that just fired. Only called while the schedule is not exhausted.
     */
    protected abstract void moveToNextRun(Instant now);

    private static void checkLimit(int maxRuns) {
        if (maxRuns <= 0) {
            throw SchedulerException.invalidSchedule("Maximum number of runs must be positive, but was " + maxRuns);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "nextRun=" + peekNextRun().orElse(null) +
                ", maxRuns=" + maxRuns +
                ", runCount=" + runCount +
                '}';
    }
}
