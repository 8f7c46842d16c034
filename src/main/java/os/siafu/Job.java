package os.siafu;

import os.siafu.schedule.Schedule;
import os.siafu.utils.ExceptionUtils;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A named unit of work with its schedules. Jobs are created by a {@link JobBuilder} and, once added, owned
 * by a {@link Scheduler}, which keeps {@link #getLastRun()} and {@link #getNextRun()} up to date.
 */
public class Job {

    private final String id;
    private final String name;
    private final List<Schedule> schedules;
    private final JobFunction function;
    private final List<String> diagnostics;

    private Instant lastRun;
    private Instant nextRun;

    Job(String id, String name, List<Schedule> schedules, Instant nextRun, JobFunction function, List<String> diagnostics) {
        this.id = id;
        this.name = name;
        this.schedules = Collections.unmodifiableList(schedules);
        this.nextRun = nextRun;
        this.function = function;
        this.diagnostics = Collections.unmodifiableList(diagnostics);
    }

    /**
     * Executes the job function once. No bookkeeping is done here, run counts and run times are maintained by
     * the {@link Scheduler}.
     *
     * @throws SchedulerException of kind {@code HANDLER_NOT_BUILT} if the job has no function, or of kind
     *                            {@code EXECUTION_FAILED} if the function threw an exception
     */
    public void run() {
        if (function == null) {
            throw SchedulerException.handlerNotBuilt(getDisplayName());
        }

        try {
            function.run();
        } catch (Exception e) {
            throw SchedulerException.executionFailed(getDisplayName() + ": " + ExceptionUtils.messageOf(e), e);
        }
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDisplayName() {
        return name != null ? name : id;
    }

    public List<Schedule> getSchedules() {
        return schedules;
    }

    public boolean hasFunction() {
        return function != null;
    }

    /**
     * @return the problems met while building the job, e.g. cron patterns that could not be parsed and were
     * therefore left out
     */
    public List<String> getDiagnostics() {
        return diagnostics;
    }

    public Optional<Instant> getLastRun() {
        return Optional.ofNullable(lastRun);
    }

    /**
     * @return the earliest next run of all schedules of this job, or {@link Optional#empty()} if the job will not
     * fire again
     */
    public Optional<Instant> getNextRun() {
        return Optional.ofNullable(nextRun);
    }

    boolean isDue(Instant now) {
        return nextRun != null && !nextRun.isAfter(now);
    }

    void recordRun(Instant runTime) {
        this.lastRun = runTime;
    }

    Optional<Instant> refreshNextRun() {
        Instant earliest = null;
        for (Schedule schedule : schedules) {
            Instant candidate = schedule.peekNextRun().orElse(null);
            if (candidate != null && (earliest == null || candidate.isBefore(earliest))) {
                earliest = candidate;
            }
        }
        this.nextRun = earliest;
        return getNextRun();
    }

    @Override
    public String toString() {
        return "Job{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", schedules=" + schedules +
                ", lastRun=" + lastRun +
                ", nextRun=" + nextRun +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return id.equals(((Job) o).id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }
}
