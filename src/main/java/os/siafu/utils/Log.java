package os.siafu.utils;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public final class Log {

    public static final String ROOT_LOGGER_NAME = "os.siafu";

    private final Logger logger;

    private Log(Class<?> clazz) {
        this.logger = Logger.getLogger(clazz.getName());
    }

    public static Log get(Class<?> clazz) {
        return new Log(clazz);
    }

    public void trace(String msg) {
        logger.finer(msg);
    }

    public void debug(String msg) {
        logger.fine(msg);
    }

    public void info(String msg) {
        logger.info(msg);
    }

    public void warn(String msg) {
        logger.warning(msg);
    }

    public void error(String msg) {
        logger.severe(msg);
    }

    public void error(String msg, Throwable t) {
        logger.log(Level.SEVERE, msg, t);
    }

    public boolean isDebugEnabled() {
        return logger.isLoggable(Level.FINE);
    }

    public static void setLevel(Level level) {
        Logger pkgLogger = Logger.getLogger(ROOT_LOGGER_NAME);
        pkgLogger.setLevel(level);

        for (Handler handler : pkgLogger.getHandlers()) {
            handler.setLevel(level);
        }
    }

    public static Level getLevel() {
        return Logger.getLogger(ROOT_LOGGER_NAME).getLevel();
    }

    /**
     * Replaces the global {@link LogManager} configuration with the properties read from the given stream.
     *
     * @param configuration stream in {@code logging.properties} format
     * @throws IOException if the stream can not be read
     */
    public static void readConfiguration(InputStream configuration) throws IOException {
        LogManager.getLogManager().readConfiguration(configuration);
    }
}
