package com.meltwater.rxinflight.util;

import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;

/**
 * Logger which outputs a message followed by key/value pairs in a standardized way.
 *
 * <p>
 * Example usage:
 * <code><pre>
 * Logger log = new Logger(DrainCoordinator.class);
 * log.infoWithParams("Waiting for outstanding deliveries", "consumerTag", tag, "outstanding", 3);
 * </pre></code>
 * Which would output something like this (depending on your slf4j backend configuration):
 * <pre>INFO DrainCoordinator: Waiting for outstanding deliveries [ consumerTag="amq-1", outstanding=3 ]</pre>
 * </p>
 *
 * <p>Note that values must have a sane toString() method.</p>
 */
public class Logger {

    private enum Level {TRACE, DEBUG, INFO, WARN, ERROR}

    private static final List<Class<?>> UNQUOTED_TYPES = Arrays.asList(
            Boolean.class,
            Byte.class,
            Character.class,
            Double.class,
            Float.class,
            Integer.class,
            Long.class,
            Short.class,
            Void.class);

    private final org.slf4j.Logger logger;

    public Logger(Class<?> clazz) {
        this(LoggerFactory.getLogger(clazz));
    }

    public Logger(String loggerName) {
        this(LoggerFactory.getLogger(loggerName));
    }

    protected Logger(org.slf4j.Logger logger) {
        this.logger = logger;
    }

    public String getName() {
        return logger.getName();
    }

    public void traceWithParams(String message, Object... arguments) {
        log(Level.TRACE, message, null, arguments);
    }

    public void traceWithParams(String message, Throwable t, Object... arguments) {
        log(Level.TRACE, message, t, arguments);
    }

    public void debugWithParams(String message, Object... arguments) {
        log(Level.DEBUG, message, null, arguments);
    }

    public void debugWithParams(String message, Throwable t, Object... arguments) {
        log(Level.DEBUG, message, t, arguments);
    }

    public void infoWithParams(String message, Object... arguments) {
        log(Level.INFO, message, null, arguments);
    }

    public void infoWithParams(String message, Throwable t, Object... arguments) {
        log(Level.INFO, message, t, arguments);
    }

    public void warnWithParams(String message, Object... arguments) {
        log(Level.WARN, message, null, arguments);
    }

    public void warnWithParams(String message, Throwable t, Object... arguments) {
        log(Level.WARN, message, t, arguments);
    }

    public void errorWithParams(String message, Object... arguments) {
        log(Level.ERROR, message, null, arguments);
    }

    public void errorWithParams(String message, Throwable t, Object... arguments) {
        log(Level.ERROR, message, t, arguments);
    }

    private void log(Level level, String message, Throwable t, Object[] arguments) {
        if (!isEnabled(level)) {
            return;
        }
        String line;
        try {
            line = buildLogMessage(message, arguments);
        } catch (IllegalArgumentException e) {
            logger.error(
                    "Failed to assemble log message for logger {}! Arguments must be declared in pairs! message={}, arguments={}",
                    getName(), message, Arrays.toString(arguments));
            line = message;
        }
        switch (level) {
            case TRACE:
                logger.trace(line, t);
                break;
            case DEBUG:
                logger.debug(line, t);
                break;
            case INFO:
                logger.info(line, t);
                break;
            case WARN:
                logger.warn(line, t);
                break;
            default:
                logger.error(line, t);
        }
    }

    private boolean isEnabled(Level level) {
        switch (level) {
            case TRACE:
                return logger.isTraceEnabled();
            case DEBUG:
                return logger.isDebugEnabled();
            case INFO:
                return logger.isInfoEnabled();
            case WARN:
                return logger.isWarnEnabled();
            default:
                return logger.isErrorEnabled();
        }
    }

    protected String buildLogMessage(String message, Object[] arguments) {
        if (arguments.length % 2 != 0) {
            throw new IllegalArgumentException(
                    "Arguments must be declared in pairs: (message, key, value, key2, value2, ...)");
        }
        final StringBuilder sb = new StringBuilder(message);
        if (arguments.length == 0) {
            return sb.toString();
        }
        sb.append(" [ ");
        for (int i = 0; i < arguments.length; i += 2) {
            append(sb, arguments[i], arguments[i + 1]);
            if (i + 2 < arguments.length) {
                sb.append(", ");
            }
        }
        sb.append(" ]");
        return sb.toString();
    }

    private void append(StringBuilder sb, Object key, Object value) {
        if (value instanceof Object[]) {
            appendList(sb, key, Arrays.asList((Object[]) value));
        } else if (value instanceof List) {
            appendList(sb, key, (List<?>) value);
        } else {
            sb.append(key).append('=');
            if (isUnquoted(value)) {
                sb.append(value);
            } else {
                sb.append('"').append(value).append('"');
            }
        }
    }

    private void appendList(StringBuilder sb, Object key, List<?> list) {
        for (int i = 0; i < list.size(); i++) {
            append(sb, key, list.get(i));
            if (i + 1 < list.size()) {
                sb.append(", ");
            }
        }
    }

    private boolean isUnquoted(Object o) {
        return o == null || UNQUOTED_TYPES.contains(o.getClass());
    }
}
