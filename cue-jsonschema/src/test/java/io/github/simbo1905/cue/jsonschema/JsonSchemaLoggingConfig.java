package io.github.simbo1905.cue.jsonschema;

import org.junit.jupiter.api.BeforeAll;

import java.util.Locale;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Lets `-Dcue.jsonschema.log=FINER` (or the ConsoleHandler level) turn on translator
/// tracing in tests without touching other loggers.
public class JsonSchemaLoggingConfig {

    @BeforeAll
    static void traceTranslator() {
        final Level level = requestedLevel();
        SchemaLogging.LOG.setLevel(level);
        for (Handler handler : Logger.getLogger("").getHandlers()) {
            final Level current = handler.getLevel();
            if (current == null || current.intValue() > level.intValue()) {
                handler.setLevel(level);
            }
        }
    }

    private static Level requestedLevel() {
        String prop = System.getProperty("cue.jsonschema.log");
        if (prop == null) {
            prop = System.getProperty("java.util.logging.ConsoleHandler.level");
        }
        if (prop == null || prop.isBlank()) {
            return Level.INFO;
        }
        try {
            return Level.parse(prop.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            SchemaLogging.LOG.warning(() -> "ignoring unknown log level " + e.getMessage());
            return Level.INFO;
        }
    }
}
