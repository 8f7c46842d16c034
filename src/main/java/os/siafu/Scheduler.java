package os.siafu;

import os.siafu.schedule.Schedule;
import os.siafu.utils.DefaultSystemClock;
import os.siafu.utils.Log;
import os.siafu.utils.SystemClock;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;

/**
 * Owns a set of {@link Job jobs} and runs the ones that are due.
 *
 * <p>The scheduler has no thread of its own. Call {@link #runPending()} periodically, either from your own loop or
 * by means of a {@link SchedulerRunner}. Instances are not thread-safe; callers sharing a scheduler between threads
 * have to synchronize on it.</p>
 */
public class Scheduler {

    private static final Comparator<Job> BY_NEXT_RUN = Comparator.comparing(
            (Job job) -> job.getNextRun().orElse(null),
            Comparator.nullsLast(Comparator.naturalOrder()));

    private final Map<String, Job> jobsById = new LinkedHashMap<>();
    private final List<JobExecutionListener> listeners = new CopyOnWriteArrayList<>();
    private final SystemClock systemClock;

    private final Log logger = Log.get(Scheduler.class);

    public Scheduler() {
        this(new DefaultSystemClock());
    }

    public Scheduler(SystemClock systemClock) {
        this.systemClock = Objects.requireNonNull(systemClock, "systemClock");
    }

    /**
     * Hands the job over to this scheduler.
     *
     * @param job the job to run
     * @throws SchedulerException       of kind {@code MISSING_SCHEDULE} if the job has no schedule, or of kind
     *                                  {@code HANDLER_NOT_BUILT} if the job has no function
     * @throws IllegalArgumentException if the job has already been added
     */
    public void addJob(Job job) {
        Objects.requireNonNull(job, "job");

        if (job.getSchedules().isEmpty()) {
            logger.error("Rejecting job '" + job.getDisplayName() + "' without schedule");
            throw SchedulerException.missingSchedule(job.getDisplayName());
        }

        if (!job.hasFunction()) {
            logger.error("Rejecting job '" + job.getDisplayName() + "' without handler");
            throw SchedulerException.handlerNotBuilt(job.getDisplayName());
        }

        if (jobsById.putIfAbsent(job.getId(), job) != null) {
            throw new IllegalArgumentException(String.format("Job '%s' is already added", job.getDisplayName()));
        }

        logger.info("Added job '" + job.getDisplayName() + "' with " + job.getSchedules().size()
                + " schedule(s), next run: " + job.getNextRun().map(Instant::toString).orElse("none"));
    }

    /**
     * Runs every job that is due and advances its due schedules.
     *
     * <p>A job fires at most once per call, even if several of its schedules are due. A failing job does not stop
     * the remaining jobs from running and its schedules are advanced as if it had succeeded. Once all due jobs
     * ran, the first failure is thrown; further failures are attached as
     * {@link Throwable#getSuppressed() suppressed exceptions}.</p>
     *
     * @return the number of jobs that fired
     * @throws SchedulerException if at least one job failed or one of its next runs could not be computed
     */
    public int runPending() {
        Instant now = systemClock.now();
        List<SchedulerException> failures = new ArrayList<>();
        int fired = 0;

        for (Job job : jobsById.values()) {
            if (!job.isDue(now)) {
                continue;
            }

            List<Schedule> dueSchedules = dueSchedules(job, now);
            if (dueSchedules.isEmpty()) {
                // a schedule was limited after the job was added
                Optional<Instant> nextRun = job.refreshNextRun();
                logger.debug("Job '" + job.getDisplayName() + "' has no due schedule, next run: "
                        + nextRun.map(Instant::toString).orElse("none"));
                continue;
            }

            fired++;
            logger.debug("Running job '" + job.getDisplayName() + "' planned for " + job.getNextRun().orElse(null));

            SchedulerException failure = execute(job);
            job.recordRun(now);

            SchedulerException advanceFailure = advance(job, dueSchedules, now);
            Optional<Instant> nextRun = job.refreshNextRun();

            if (failure == null) {
                notifySucceeded(job);
            } else {
                failures.add(failure);
                notifyFailed(job, failure);
            }

            if (advanceFailure != null) {
                failures.add(advanceFailure);
            }

            if (nextRun.isPresent()) {
                logger.debug("Next run of job '" + job.getDisplayName() + "': " + nextRun.get());
            } else {
                logger.info("Job '" + job.getDisplayName() + "' has no further runs");
                notifyCompleted(job);
            }
        }

        if (!failures.isEmpty()) {
            SchedulerException first = failures.get(0);
            for (SchedulerException other : failures.subList(1, failures.size())) {
                first.addSuppressed(other);
            }
            throw first;
        }

        return fired;
    }

    /**
     * @return the earliest next run of all jobs, or {@link Optional#empty()} if no job will fire again
     */
    public Optional<Instant> nextRun() {
        return jobsById.values().stream()
                .map(Job::getNextRun)
                .filter(Optional::isPresent)
                .map(Optional::get)
                .min(Comparator.naturalOrder());
    }

    /**
     * @return all jobs ordered by ascending next run; jobs without a next run come last
     */
    public List<Job> listAllJobs() {
        List<Job> jobs = new ArrayList<>(jobsById.values());
        jobs.sort(BY_NEXT_RUN);
        return Collections.unmodifiableList(jobs);
    }

    public Optional<Job> findJob(String id) {
        return Optional.ofNullable(jobsById.get(id));
    }

    /**
     * @throws SchedulerException of kind {@code JOB_NOT_FOUND} if no job with the given id was added
     */
    public Job getJob(String id) {
        return findJob(id).orElseThrow(() -> SchedulerException.jobNotFound(id));
    }

    public void subscribe(JobExecutionListener listener) {
        listeners.add(listener);
    }

    public void unsubscribe(JobExecutionListener listener) {
        listeners.remove(listener);
    }

    /**
     * Sets the log level of all siafu loggers.
     */
    public void setLogLevel(Level level) {
        Log.setLevel(level);
    }

    public void enableDebugLogging() {
        Log.setLevel(Level.FINE);
    }

    public void enableErrorOnlyLogging() {
        Log.setLevel(Level.SEVERE);
    }

    private SchedulerException execute(Job job) {
        try {
            job.run();
            return null;
        } catch (SchedulerException e) {
            logger.error("Job '" + job.getDisplayName() + "' failed", e);
            return e;
        }
    }

    private List<Schedule> dueSchedules(Job job, Instant now) {
        List<Schedule> due = new ArrayList<>();
        for (Schedule schedule : job.getSchedules()) {
            Optional<Instant> nextRun = schedule.peekNextRun();
            if (nextRun.isPresent() && !nextRun.get().isAfter(now)) {
                due.add(schedule);
            }
        }
        return due;
    }

    private SchedulerException advance(Job job, List<Schedule> dueSchedules, Instant now) {
        SchedulerException failure = null;
        for (Schedule schedule : dueSchedules) {
            try {
                schedule.advance(now);
            } catch (SchedulerException e) {
                logger.error("Unable to compute next run of " + schedule + " of job '" + job.getDisplayName() + "'", e);
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        return failure;
    }

    private void notifySucceeded(Job job) {
        listeners.forEach(l -> l.succeeded(job.getName(), job.getId()));
    }

    private void notifyFailed(Job job, SchedulerException exception) {
        listeners.forEach(l -> l.failed(job.getName(), job.getId(), exception));
    }

    private void notifyCompleted(Job job) {
        listeners.forEach(l -> l.completed(job.getName(), job.getId()));
    }
}
