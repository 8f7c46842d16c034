package os.siafu;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import os.siafu.schedule.IntervalRule;
import os.siafu.time.ScheduleTime;
import os.siafu.utils.LoggingTestSetup;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@ExtendWith(LoggingTestSetup.class)
class SchedulerRunnerTest {

    private Scheduler scheduler;
    private SchedulerRunner runner;

    @BeforeEach
    void init() {
        scheduler = new Scheduler();
        runner = new SchedulerRunner(scheduler, Duration.ZERO, Duration.ofMillis(10));
    }

    @AfterEach
    void stop() {
        runner.stop();
    }

    @Test
    void run_due_jobs_in_background() {
        AtomicInteger executions = new AtomicInteger();
        runner.addJob(new JobBuilder("background")
                .recurring(IntervalRule.secondly(1), ScheduleTime.delay(Duration.ZERO))
                .maxRepeat(2)
                .handler(executions::incrementAndGet)
                .build());

        runner.start();

        await().atMost(Duration.ofSeconds(5)).until(() -> executions.get() == 2);
        assertTrue(runner.isRunning());
        assertFalse(runner.isLastRunFailed());
    }

    @Test
    void keep_polling_after_failed_pass() {
        AtomicInteger executions = new AtomicInteger();
        runner.addJob(new JobBuilder("failing").once(ScheduleTime.delay(Duration.ZERO)).handler(() -> {
            throw new IllegalStateException("failure");
        }).build());

        runner.start();
        await().atMost(Duration.ofSeconds(5)).until(runner::isLastRunFailed);

        SchedulerException exception = assertInstanceOf(SchedulerException.class, runner.lastRunException());
        assertEquals(ErrorKind.EXECUTION_FAILED, exception.getKind());

        runner.addJob(new JobBuilder("healthy").once(ScheduleTime.delay(Duration.ZERO)).handler(executions::incrementAndGet).build());

        await().atMost(Duration.ofSeconds(5)).until(() -> executions.get() == 1);
        await().atMost(Duration.ofSeconds(5)).until(() -> runner.lastRunException() == null);
    }

    @Test
    void ignore_second_start_and_stop_on_request() {
        runner.start();
        runner.start();

        runner.stop();

        assertFalse(runner.isRunning());
        assertNull(runner.lastRunException());
    }

    @Test
    void reject_non_positive_polling_interval() {
        assertThrows(IllegalArgumentException.class, () -> new SchedulerRunner(scheduler, Duration.ZERO, Duration.ZERO));
    }
}
