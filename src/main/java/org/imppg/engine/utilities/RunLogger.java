package org.imppg.engine.utilities;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for writing a per-run log file next to the output of an alignment or batch run.
 *
 * <p>While a session is open, everything logged under {@code org.imppg} is also written to
 * {@code <output-directory>/imppg-run.log}. Use with try-with-resources:</p>
 * <pre>{@code
 * try (RunLogger.Session session = RunLogger.start(outputDir)) {
 *     logger.info("Aligning {} images", n);
 *     // ... run ...
 * } // appender detached
 * }</pre>
 *
 * <p>Does nothing (and says so at debug level) when Logback is not the SLF4J binding.</p>
 */
public class RunLogger {
    private static final Logger logger = LoggerFactory.getLogger(RunLogger.class);

    public static final String LOG_FILE_NAME = "imppg-run.log";
    static final String ENGINE_LOGGER = "org.imppg";
    private static final String PATTERN = "%d{yyyy-MM-dd HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n";

    private RunLogger() {
    }

    /**
     * Starts logging into {@code <outputDirectory>/imppg-run.log}.
     *
     * @param outputDirectory existing directory receiving the log file
     * @return a session that detaches the file appender when closed
     */
    public static Session start(Path outputDirectory) {
        return new Session(attach(outputDirectory));
    }

    private static FileAppender<ILoggingEvent> attach(Path outputDirectory) {
        if (outputDirectory == null || !Files.isDirectory(outputDirectory)) {
            logger.warn("Cannot enable run logging: invalid directory: {}", outputDirectory);
            return null;
        }
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (!(factory instanceof LoggerContext context)) {
            logger.debug("Run logging needs Logback, found {}", factory.getClass().getName());
            return null;
        }

        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(PATTERN);
        encoder.start();

        FileAppender<ILoggingEvent> appender = new FileAppender<>();
        appender.setContext(context);
        appender.setName("RUN_LOG-" + outputDirectory);
        appender.setFile(outputDirectory.resolve(LOG_FILE_NAME).toString());
        appender.setAppend(true);
        appender.setEncoder(encoder);
        appender.start();

        ch.qos.logback.classic.Logger engineLogger = context.getLogger(ENGINE_LOGGER);
        engineLogger.addAppender(appender);
        logger.info("Run logging enabled: {}", outputDirectory.resolve(LOG_FILE_NAME));
        return appender;
    }

    private static void detach(FileAppender<ILoggingEvent> appender) {
        if (LoggerFactory.getILoggerFactory() instanceof LoggerContext context) {
            logger.info("Run logging disabled: {}", appender.getFile());
            context.getLogger(ENGINE_LOGGER).detachAppender(appender);
        }
        appender.stop();
    }

    /**
     * Auto-closeable run log session. Ensures the file appender is detached when the session closes.
     */
    public static class Session implements AutoCloseable {
        private FileAppender<ILoggingEvent> appender;

        private Session(FileAppender<ILoggingEvent> appender) {
            this.appender = appender;
        }

        /**
         * @return true if the log file is being written
         */
        public boolean isActive() {
            return appender != null;
        }

        @Override
        public void close() {
            if (appender != null) {
                detach(appender);
                appender = null;
            }
        }
    }
}
