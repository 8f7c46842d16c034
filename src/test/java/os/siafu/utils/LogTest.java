package os.siafu.utils;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.logging.Level;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@ExtendWith(LoggingTestSetup.class)
class LogTest {

    private final Log log = Log.get(LogTest.class);

    @AfterEach
    void resetLevel() {
        Log.setLevel(Level.FINE);
    }

    @Test
    void apply_level_to_all_loggers_of_the_library() {
        Log.setLevel(Level.SEVERE);

        assertEquals(Level.SEVERE, Log.getLevel());
        assertFalse(log.isDebugEnabled());

        Log.setLevel(Level.FINE);

        assertTrue(log.isDebugEnabled());
    }

    @Test
    void read_configuration_from_properties() throws Exception {
        String properties = "os.siafu.level=WARNING\n";

        Log.readConfiguration(new ByteArrayInputStream(properties.getBytes(StandardCharsets.UTF_8)));

        assertEquals(Level.WARNING, Logger.getLogger(Log.ROOT_LOGGER_NAME).getLevel());

        try (InputStream is = getClass().getResourceAsStream("/logging.properties")) {
            Log.readConfiguration(is);
        }
    }
}
