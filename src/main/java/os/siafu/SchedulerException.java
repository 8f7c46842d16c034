package os.siafu;

/**
 * Exception thrown for every failure detected while building, registering or running jobs.
 *
 * <p>The {@link ErrorKind} tells the caller what went wrong; the message carries the details.</p>
 */
public class SchedulerException extends RuntimeException {

    private final ErrorKind kind;

    private SchedulerException(ErrorKind kind, String detail, Throwable cause) {
        super(detail == null ? kind.description() : kind.description() + ": " + detail, cause);
        this.kind = kind;
    }

    public static SchedulerException invalidSchedule(String detail) {
        return new SchedulerException(ErrorKind.INVALID_SCHEDULE, detail, null);
    }

    public static SchedulerException invalidSchedule(String detail, Throwable cause) {
        return new SchedulerException(ErrorKind.INVALID_SCHEDULE, detail, cause);
    }

    public static SchedulerException missingSchedule(String jobName) {
        return new SchedulerException(ErrorKind.MISSING_SCHEDULE, jobName, null);
    }

    public static SchedulerException handlerNotBuilt(String jobName) {
        return new SchedulerException(ErrorKind.HANDLER_NOT_BUILT, jobName, null);
    }

    public static SchedulerException executionFailed(String detail, Throwable cause) {
        return new SchedulerException(ErrorKind.EXECUTION_FAILED, detail, cause);
    }

    public static SchedulerException timeCalculation(String detail, Throwable cause) {
        return new SchedulerException(ErrorKind.TIME_CALCULATION, detail, cause);
    }

    public static SchedulerException jobNotFound(String jobId) {
        return new SchedulerException(ErrorKind.JOB_NOT_FOUND, jobId, null);
    }

    public ErrorKind getKind() {
        return kind;
    }
}
