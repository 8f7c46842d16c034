package os.siafu.utils;

public class ExceptionUtils {

    private ExceptionUtils() {
    }

    /**
     * Returns the message of the given throwable, falling back to its class name if it carries none.
     */
    public static String messageOf(Throwable throwable) {
        String message = throwable.getMessage();
        if (message == null || message.isEmpty()) {
            return throwable.getClass().getName();
        }
        return message;
    }

}
