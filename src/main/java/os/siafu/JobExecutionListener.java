package os.siafu;

public interface JobExecutionListener {

    /**
     * Called, after a job got executed without throwing an exception.
     *
     * @param name the name of the job, {@code null} if the job is unnamed
     * @param id   the generated id of the job
     */
    void succeeded(String name, String id);

    /**
     * Called, after a job execution raised an exception. The schedules of the job are advanced anyway.
     *
     * @param name      the name of the job, {@code null} if the job is unnamed
     * @param id        the generated id of the job
     * @param exception the exception, wrapping the one thrown by the job function
     */
    void failed(String name, String id, SchedulerException exception);

    /**
     * Called, after the last schedule of a job ran out of runs. The job will not fire again.
     *
     * @param name the name of the job, {@code null} if the job is unnamed
     * @param id   the generated id of the job
     */
    void completed(String name, String id);
}
