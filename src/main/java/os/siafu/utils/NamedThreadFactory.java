package os.siafu.utils;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;

public class NamedThreadFactory implements ThreadFactory {

    private final AtomicLong threadIndex = new AtomicLong(0);
    private final String threadNamePrefix;
    private final boolean daemon;
    private final Log logger = Log.get(NamedThreadFactory.class);

    public NamedThreadFactory(String threadNamePrefix) {
        this(threadNamePrefix, true);
    }

    public NamedThreadFactory(String threadNamePrefix, boolean daemon) {
        this.threadNamePrefix = threadNamePrefix;
        this.daemon = daemon;
    }

    @Override
    public Thread newThread(Runnable runnable) {
        Thread thread = new Thread(runnable);
        thread.setName(threadNamePrefix + threadIndex.getAndIncrement());
        thread.setDaemon(daemon);

        thread.setUncaughtExceptionHandler((t, e) ->
                logger.error("Uncaught exception in thread " + t.getName() + ". The scheduler stops polling until restarted.", e));

        return thread;
    }

}
