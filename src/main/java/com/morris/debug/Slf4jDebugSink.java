package com.morris.debug;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends hub output to SLF4J. Each tag gets its own logger named {@code morris.<tag>}
 * so levels can be tuned per component in logback.xml.
 */
public final class Slf4jDebugSink implements DebugSink {

    static final String LOGGER_PREFIX = "morris.";

    private final Map<String, Logger> loggers = new ConcurrentHashMap<>();

    @Override
    public void log(DebugLevel level, String tag, String message, Throwable error) {
        Logger logger = loggerFor(tag);
        switch (level) {
            case TRACE:
                if (error == null) logger.trace(message); else logger.trace(message, error);
                break;
            case DEBUG:
                if (error == null) logger.debug(message); else logger.debug(message, error);
                break;
            case INFO:
                if (error == null) logger.info(message); else logger.info(message, error);
                break;
            case WARN:
                if (error == null) logger.warn(message); else logger.warn(message, error);
                break;
            case ERROR:
            default:
                if (error == null) logger.error(message); else logger.error(message, error);
                break;
        }
    }

    Logger loggerFor(String tag) {
        String name = LOGGER_PREFIX + (tag == null || tag.isEmpty() ? "core" : tag);
        return loggers.computeIfAbsent(name, LoggerFactory::getLogger);
    }
}
