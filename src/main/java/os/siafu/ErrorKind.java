package os.siafu;

/** The kind of failure reported by a {@link SchedulerException}. */
public enum ErrorKind {
    /** A schedule descriptor could not be parsed or resolved. */
    INVALID_SCHEDULE("Invalid schedule"),
    /** A job was registered without any schedule. */
    MISSING_SCHEDULE("No schedule found"),
    /** A job was registered, or asked to run, without a handler. */
    HANDLER_NOT_BUILT("Handler not built"),
    /** The job handler threw an exception. */
    EXECUTION_FAILED("Job execution failed"),
    /** An instant could not be computed. */
    TIME_CALCULATION("Error calculating target time"),
    /** No job is registered under the requested id. */
    JOB_NOT_FOUND("Job not found");

    private final String description;

    ErrorKind(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
