// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pulse.core;

/**
 * Utility that makes client-controlled text safe to put in a log line.
 *
 * <p>
 * Performs two sanitization operations:
 * <ul>
 * <li>Escapes carriage returns and line feeds so a session id or stream name
 * cannot forge additional log lines</li>
 * <li>Truncates excessively long input to keep log lines bounded</li>
 * </ul>
 */
public final class LogSanitizer {

    /**
     * Maximum length for sanitized log output. Input exceeding this will be truncated.
     */
    static final int MAX_LOG_LENGTH = 2000;

    /** Suffix appended to truncated input. */
    static final String TRUNCATION_SUFFIX = "...(truncated)";

    private LogSanitizer() {}

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        String sanitized = input;

        if (sanitized.indexOf('\r') >= 0 || sanitized.indexOf('\n') >= 0) {
            sanitized = sanitized.replace("\r", "\\r").replace("\n", "\\n");
        }

        if (sanitized.length() > MAX_LOG_LENGTH) {
            int truncateAt = Math.max(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length());
            sanitized = sanitized.substring(0, truncateAt) + TRUNCATION_SUFFIX;
        }

        return sanitized;
    }
}
