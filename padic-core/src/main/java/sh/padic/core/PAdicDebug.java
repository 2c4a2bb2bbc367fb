// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.padic.core;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Switches for tracing p-adic computations through {@link DebugLogger}.
 *
 * <p>The initial state comes from the {@value #DEBUG_PROPERTY} system property: a
 * comma-separated list of {@link Area} names, {@code all}, or {@code none}. For
 * example {@code -Dpadic.debug=conversion} traces every digit expansion.
 */
public final class PAdicDebug {

    public static final String DEBUG_PROPERTY = "padic.debug";

    private static final Logger LOG = LoggerFactory.getLogger(PAdicDebug.class);

    /**
     * What a trace line is about.
     */
    public enum Area {
        /** Rational to digit-series expansion. */
        CONVERSION,
        /** Results of add, subtract, multiply and divide. */
        ARITHMETIC
    }

    private static volatile Set<Area> enabled = initialAreas();

    private PAdicDebug() {
    }

    public static boolean isEnabled(final Area area) {
        return enabled.contains(area);
    }

    /**
     * Turns every area on or off.
     */
    public static synchronized void setEnabled(final boolean on) {
        enabled = on ? Collections.unmodifiableSet(EnumSet.allOf(Area.class)) : Collections.emptySet();
    }

    public static synchronized void setEnabled(final Area area, final boolean on) {
        final EnumSet<Area> next = enabled.isEmpty() ? EnumSet.noneOf(Area.class) : EnumSet.copyOf(enabled);
        if (on) {
            next.add(area);
        } else {
            next.remove(area);
        }
        enabled = Collections.unmodifiableSet(next);
    }

    /**
     * Reads a {@value #DEBUG_PROPERTY} value: comma-separated area names in any case,
     * {@code all} or {@code none}. Null or blank means none.
     *
     * @throws IllegalArgumentException if a name is not an area
     */
    static Set<Area> parse(final String areas) {
        if (areas == null || areas.isBlank()) {
            return Collections.emptySet();
        }
        final EnumSet<Area> result = EnumSet.noneOf(Area.class);
        for (String raw : areas.split(",")) {
            final String name = raw.trim().toUpperCase(Locale.ROOT);
            if (name.isEmpty() || name.equals("NONE")) {
                continue;
            }
            if (name.equals("ALL")) {
                result.addAll(EnumSet.allOf(Area.class));
                continue;
            }
            try {
                result.add(Area.valueOf(name));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown debug area '" + raw.trim() + "' in: " + areas, e);
            }
        }
        return Collections.unmodifiableSet(result);
    }

    private static Set<Area> initialAreas() {
        final String property = System.getProperty(DEBUG_PROPERTY);
        try {
            return parse(property);
        } catch (IllegalArgumentException e) {
            LOG.warn("Ignoring {}={}: {}", DEBUG_PROPERTY, property, e.getMessage());
            return Collections.emptySet();
        }
    }
}
