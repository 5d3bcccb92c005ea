package cz.vut.fit.zoneguard.standalone.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.LoggerFactory;

/**
 * Adjusts the Logback configuration at runtime.
 */
public final class LoggingConfigurator {
    private static final org.slf4j.Logger Logger = LoggerFactory.getLogger(LoggingConfigurator.class);

    private LoggingConfigurator() {
    }

    /**
     * Lowers the root logger level, and the level of the scanner's own loggers, to DEBUG.
     */
    public static void enableVerboseLogging() {
        final var factory = LoggerFactory.getILoggerFactory();
        if (factory instanceof LoggerContext context) {
            context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).setLevel(Level.DEBUG);
            context.getLogger("cz.vut.fit.zoneguard").setLevel(Level.DEBUG);
            return;
        }

        Logger.warn("Verbose logging requested but the logging backend {} cannot be reconfigured",
                factory.getClass().getName());
    }
}
