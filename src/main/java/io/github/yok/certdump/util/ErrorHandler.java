package io.github.yok.certdump.util;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Utility class that reports failures: a full SLF4J error log plus a concise line on
 * {@code System.err}.
 *
 * <p>
 * <strong>Behavior:</strong>
 * </p>
 * <ul>
 * <li>Never terminates the JVM; the extractor always exits with status 0 and reports outcomes
 * through logs and the audit table.</li>
 * <li>Builds the short exception text stored in audit entries.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class ErrorHandler {

    // Upper bound of the exception text stored in an audit entry
    static final int MAX_DETAIL_LENGTH = 2000;

    private ErrorHandler() {
        // Utility class; do not instantiate.
    }

    /**
     * Logs the given message and root cause at error level and prints a concise message to
     * {@code System.err}.
     *
     * @param message message to log
     * @param cause root cause
     */
    public static void reportFatal(String message, Throwable cause) {
        log.error("{}\n{}", message, ExceptionUtils.getStackTrace(cause));
        System.err.println("ERROR: " + message + "\n" + describe(cause));
    }

    /**
     * Returns a one-line description of an exception for audit entries: the exception message, or
     * the root cause message when the exception has none.
     *
     * @param cause exception to describe
     * @return description, abbreviated to {@value #MAX_DETAIL_LENGTH} characters
     */
    public static String describe(Throwable cause) {
        String text = cause.getMessage();
        if (StringUtils.isBlank(text)) {
            text = ExceptionUtils.getRootCauseMessage(cause);
        }
        Throwable root = ExceptionUtils.getRootCause(cause);
        if (root != null && root != cause && StringUtils.isNotBlank(root.getMessage())
                && !text.contains(root.getMessage())) {
            text = text + ": " + root.getMessage();
        }
        return StringUtils.abbreviate(StringUtils.normalizeSpace(text), MAX_DETAIL_LENGTH);
    }
}
