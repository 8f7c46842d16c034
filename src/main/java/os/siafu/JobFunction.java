package os.siafu;

/**
 * The unit of work executed when a job fires.
 */
@FunctionalInterface
public interface JobFunction {
    void run() throws Exception;
}
