package os.siafu.utils;

import org.junit.jupiter.api.extension.BeforeAllCallback;
import org.junit.jupiter.api.extension.ExtensionContext;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

public class LoggingTestSetup implements BeforeAllCallback {

    private static boolean initialized = false;

    @Override
    public void beforeAll(ExtensionContext context) {
        if (initialized) {
            return;
        }
        initialized = true;

        try (InputStream is = getClass().getResourceAsStream("/logging.properties")) {
            if (is != null) {
                Log.readConfiguration(is);
            } else {
                System.err.println("logging.properties not found on classpath");
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
