package io.github.yok.schemaarchitect.util;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Reports fatal command-line errors.
 *
 * <p>
 * The error is logged and a single {@code ERROR:} line goes to {@code System.err}, so standard
 * output only ever carries command results. The JVM is not terminated; the caller stops its own
 * work after reporting.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class ErrorHandler {

    private ErrorHandler() {
        throw new AssertionError("ErrorHandler must not be instantiated.");
    }

    /**
     * Reports an invalid invocation, such as a missing option.
     *
     * @param message what is wrong
     */
    public static void reportFatal(String message) {
        reportFatal(message, null);
    }

    /**
     * Reports a failure, with the root cause message appended to the {@code ERROR:} line.
     *
     * @param message what failed
     * @param cause cause of the failure; may be {@code null}
     */
    public static void reportFatal(String message, Throwable cause) {
        if (cause == null) {
            log.error(message);
            System.err.println("ERROR: " + message);
            return;
        }
        log.error(message, cause);
        System.err.println("ERROR: " + message + " (" + ExceptionUtils.getRootCauseMessage(cause)
                + ")");
    }
}
