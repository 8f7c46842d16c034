package os.siafu;

import os.siafu.utils.Log;
import os.siafu.utils.NamedThreadFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Polls a {@link Scheduler} on a background thread.
 *
 * <p>All calls into the scheduler made by the runner are synchronized on the scheduler. Jobs added while the
 * runner is active should go through {@link #addJob(Job)}.</p>
 */
public class SchedulerRunner {

    public static final Duration DEFAULT_INITIAL_DELAY = Duration.ZERO;
    public static final Duration DEFAULT_POLLING_INTERVAL = Duration.ofSeconds(1);

    private final Scheduler scheduler;
    private final Duration initialDelay;
    private final Duration pollingInterval;

    private ScheduledExecutorService executor;
    private volatile Exception lastRunException;

    private final Log logger = Log.get(SchedulerRunner.class);

    public SchedulerRunner(Scheduler scheduler) {
        this(scheduler, DEFAULT_INITIAL_DELAY, DEFAULT_POLLING_INTERVAL);
    }

    public SchedulerRunner(Scheduler scheduler, Duration initialDelay, Duration pollingInterval) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.initialDelay = Objects.requireNonNull(initialDelay, "initialDelay");
        this.pollingInterval = Objects.requireNonNull(pollingInterval, "pollingInterval");

        if (initialDelay.isNegative()) {
            throw new IllegalArgumentException("InitialDelay must not be negative");
        }

        if (pollingInterval.isNegative() || pollingInterval.isZero()) {
            throw new IllegalArgumentException("PollingInterval must be positive");
        }
    }

    /**
     * Starts polling the scheduler.
     */
    public synchronized void start() {
        if (isRunning()) {
            logger.warn("SchedulerRunner is running, ignoring start request");
            return;
        }

        executor = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("Siafu-Scheduler-"));
        executor.scheduleWithFixedDelay(this::runPending, initialDelay.toMillis(), pollingInterval.toMillis(), TimeUnit.MILLISECONDS);

        logger.info("Started SchedulerRunner with polling interval " + pollingInterval);
    }

    /**
     * Stops polling. Blocks until a running pass has completed, or a timeout of 15 seconds occurs.
     */
    public void stop() {
        stop(15, TimeUnit.SECONDS);
    }

    public synchronized void stop(long timeout, TimeUnit timeUnit) {
        if (executor == null) {
            return;
        }

        logger.info("Stopping SchedulerRunner with timeout: " + timeout + " " + timeUnit);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(timeout, timeUnit)) {
                logger.warn("SchedulerRunner did not terminate within the timeout period");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            logger.error("SchedulerRunner shutdown was interrupted", e);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public synchronized boolean isRunning() {
        return executor != null && !executor.isShutdown();
    }

    /**
     * Adds a job to the scheduler, safe to call while the runner is active.
     */
    public void addJob(Job job) {
        synchronized (scheduler) {
            scheduler.addJob(job);
        }
    }

    public boolean isLastRunFailed() {
        return lastRunException != null;
    }

    /**
     * @return the exception of the last pass or {@code null} if the last pass was successful
     */
    public Exception lastRunException() {
        return lastRunException;
    }

    void runPending() {
        try {
            int fired;
            synchronized (scheduler) {
                fired = scheduler.runPending();
            }
            if (fired > 0) {
                logger.trace("Fired " + fired + " job(s)");
            }
            lastRunException = null;
        } catch (Exception e) {
            logger.error("Pass over pending jobs failed", e);
            lastRunException = e;
        }
    }
}
