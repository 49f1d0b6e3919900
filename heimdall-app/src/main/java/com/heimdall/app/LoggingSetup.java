package com.heimdall.app;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.rolling.RollingFileAppender;
import ch.qos.logback.core.rolling.TimeBasedRollingPolicy;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Runtime adjustments of the Logback configuration: root level and the rolling log file under
 * {@code logging.directory}. Other SLF4J backends keep their own configuration; a warning is logged.
 */
final class LoggingSetup {

    private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingSetup.class);

    static final String FILE_APPENDER = "HEIMDALL_FILE";
    private static final String PATTERN = "%d{yyyy-MM-dd HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n";
    private static final int MAX_HISTORY_DAYS = 14;

    private LoggingSetup() {
    }

    /** Sets the root level; returns false when the backend is not Logback. */
    static boolean applyLevel(LogLevel level) {
        Optional<LoggerContext> context = logbackContext();
        if (context.isEmpty()) {
            log.warn("Log level {} requested but backend {} does not support dynamic level updates", level,
                    LoggerFactory.getILoggerFactory().getClass().getName());
            return false;
        }
        Logger root = context.get().getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        if (!level.toLogback().equals(root.getLevel())) {
            root.setLevel(level.toLogback());
            log.info("Log level set to {}", level);
        }
        return true;
    }

    /**
     * Adds a daily rolling {@code heimdall.log} in {@code directory} to the root logger.
     *
     * @return the started appender, or empty when the backend is not Logback or the directory cannot be created
     */
    static Optional<RollingFileAppender<ILoggingEvent>> attachFileAppender(Path directory) {
        Optional<LoggerContext> context = logbackContext();
        if (context.isEmpty()) {
            return Optional.empty();
        }
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            log.warn("Log directory {} unavailable; logging to console only: {}", directory, e.getMessage());
            return Optional.empty();
        }
        LoggerContext ctx = context.get();

        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(ctx);
        encoder.setPattern(PATTERN);
        encoder.start();

        RollingFileAppender<ILoggingEvent> appender = new RollingFileAppender<>();
        appender.setContext(ctx);
        appender.setName(FILE_APPENDER);
        appender.setFile(directory.resolve("heimdall.log").toString());

        TimeBasedRollingPolicy<ILoggingEvent> policy = new TimeBasedRollingPolicy<>();
        policy.setContext(ctx);
        policy.setParent(appender);
        policy.setFileNamePattern(directory.resolve("heimdall.%d{yyyy-MM-dd}.log").toString());
        policy.setMaxHistory(MAX_HISTORY_DAYS);
        policy.start();

        appender.setRollingPolicy(policy);
        appender.setEncoder(encoder);
        appender.start();
        ctx.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).addAppender(appender);
        log.debug("Logging to {}", directory);
        return Optional.of(appender);
    }

    static void detach(RollingFileAppender<ILoggingEvent> appender) {
        logbackContext().ifPresent(ctx -> ctx.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).detachAppender(appender));
        appender.stop();
    }

    private static Optional<LoggerContext> logbackContext() {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (factory instanceof LoggerContext context) {
            return Optional.of(context);
        }
        return Optional.empty();
    }
}
