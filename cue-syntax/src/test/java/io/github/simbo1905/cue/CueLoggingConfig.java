package io.github.simbo1905.cue;

import org.junit.jupiter.api.BeforeAll;

import java.util.Locale;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Sets the level of the parser, sanitizer and evaluator loggers from
/// `java.util.logging.ConsoleHandler.level`, INFO when unset.
public class CueLoggingConfig {

    @BeforeAll
    static void configureCueLoggers() {
        final String prop = System.getProperty("java.util.logging.ConsoleHandler.level");
        Level level = Level.INFO;
        if (prop != null && !prop.isBlank()) {
            try {
                level = Level.parse(prop.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                Logger.getLogger("io.github.simbo1905.cue").warning(() -> "bad log level: " + prop);
            }
        }
        Logger.getLogger("io.github.simbo1905.cue").setLevel(level);
        for (Handler handler : Logger.getLogger("").getHandlers()) {
            if (handler.getLevel() == null || handler.getLevel().intValue() > level.intValue()) {
                handler.setLevel(level);
            }
        }
    }
}
