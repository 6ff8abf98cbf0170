package deckhand.engine.config;

import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runtime control of the {@code deckhand} logger hierarchy.
 */
public final class LogLevels {

    private static final Logger log = LoggerFactory.getLogger(LogLevels.class);

    public static final String ROOT_LOGGER = "deckhand";

    private LogLevels() {
    }

    /**
     * Set the level of every deckhand logger. Unknown names fall back to INFO.
     */
    public static void apply(String level) {
        if (level == null || level.isBlank()) {
            return;
        }
        Logger logger = LoggerFactory.getLogger(ROOT_LOGGER);
        if (logger instanceof ch.qos.logback.classic.Logger) {
            ch.qos.logback.classic.Logger logback = (ch.qos.logback.classic.Logger) logger;
            Level target = Level.toLevel(level.trim(), Level.INFO);
            if (!target.equals(logback.getLevel())) {
                logback.setLevel(target);
                log.debug("Log level set to {}", target);
            }
        } else {
            log.warn("Cannot set log level {}: logging backend is not Logback", level);
        }
    }
}
