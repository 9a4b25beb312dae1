package net.findmyaisle.util;

import java.util.Arrays;
import org.slf4j.Logger;

/**
 * Lightweight helpers for consistent logging of warnings and errors with optional causes.
 */
public final class LoggingUtils {
    private LoggingUtils() {
    }

    public static void error(Logger logger, Throwable throwable, String message, Object... args) {
        if (logger == null || message == null) {
            return;
        }
        logger.error(message, withCause(throwable, args));
    }

    public static void warn(Logger logger, Throwable throwable, String message, Object... args) {
        if (logger == null || message == null) {
            return;
        }
        logger.warn(message, withCause(throwable, args));
    }

    /**
     * SLF4J treats a trailing throwable argument as the cause, so the stack trace is kept
     * while the placeholders still bind to the leading arguments.
     */
    private static Object[] withCause(Throwable throwable, Object... args) {
        Object[] base = (args == null) ? new Object[0] : args;
        if (throwable == null) {
            return base;
        }
        Object[] finalArgs = Arrays.copyOf(base, base.length + 1);
        finalArgs[finalArgs.length - 1] = throwable;
        return finalArgs;
    }
}
