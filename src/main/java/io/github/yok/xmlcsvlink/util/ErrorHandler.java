package io.github.yok.xmlcsvlink.util;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Reports conversion failures that end the current command.
 *
 * <p>
 * <strong>Behavior:</strong>
 * </p>
 * <ul>
 * <li>Logs the message (and stack trace, if any) using SLF4J.</li>
 * <li>Writes {@code ERROR: <message>} and the root cause to {@code System.err}.</li>
 * <li>Does not terminate the JVM by itself.</li>
 * <li>Tests can switch the current thread to throwing {@link IllegalStateException} instead.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class ErrorHandler {

    private static final ThreadLocal<Boolean> EXIT_DISABLED =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    private ErrorHandler() {
        // Utility class; do not instantiate.
    }

    /**
     * Switch to "throw exception instead of reporting" for the current thread (useful for tests).
     */
    public static void disableExitForCurrentThread() {
        EXIT_DISABLED.set(Boolean.TRUE);
    }

    /**
     * Restore normal behavior for the current thread.
     */
    public static void restoreExitForCurrentThread() {
        EXIT_DISABLED.remove();
    }

    /**
     * Logs the message with the stack trace of {@code cause} and prints the message with the root
     * cause to {@code System.err}.
     *
     * @param message message to report
     * @param cause failure that ended the command
     * @throws IllegalStateException if exit is disabled for the current thread
     */
    public static void errorAndExit(String message, Throwable cause) {
        log.error("{}\n{}", message, ExceptionUtils.getStackTrace(cause));
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message, cause);
        }
        System.err.println("ERROR: " + message + "\n" + ExceptionUtils.getRootCauseMessage(cause));
    }

    /**
     * Logs the message and prints it to {@code System.err}.
     *
     * @param message message to report
     * @throws IllegalStateException if exit is disabled for the current thread
     */
    public static void errorAndExit(String message) {
        log.error(message);
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message);
        }
        System.err.println("ERROR: " + message);
    }
}
