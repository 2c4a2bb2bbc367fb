// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.padic.core;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes trace lines to the {@code sh.padic.debug} logger when their
 * {@link PAdicDebug.Area} is switched on.
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("sh.padic.debug");

    /** Digit arrays of large precisions can get long; cap what reaches the log. */
    static final int MAX_LOG_LENGTH = 2000;

    static final String TRUNCATION_SUFFIX = "...(truncated)";

    private DebugLogger() {
    }

    /**
     * Formats {@code message} with {@link String#formatted} and logs it at INFO,
     * prefixed with the area, if the area is enabled.
     */
    public static void log(final PAdicDebug.Area area, final String message, final Object... args) {
        Objects.requireNonNull(area, "area");
        if (!PAdicDebug.isEnabled(area)) {
            return;
        }
        final String formatted = (args == null || args.length == 0) ? message : message.formatted(args);
        LOG.info(truncate("[" + area + "] " + formatted));
    }

    static String truncate(final String input) {
        if (input == null) {
            return "null";
        }
        if (input.length() <= MAX_LOG_LENGTH) {
            return input;
        }
        final int cut = Math.max(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length());
        return input.substring(0, cut) + TRUNCATION_SUFFIX;
    }
}
