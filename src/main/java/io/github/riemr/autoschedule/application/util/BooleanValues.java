package io.github.riemr.autoschedule.application.util;

import java.util.Locale;
import java.util.Set;

public final class BooleanValues {
    private static final Set<String> TRUE_VALUES = Set.of("true", "yes", "t", "y", "1");

    private BooleanValues() {}

    /** Lenient attribute boolean: true/yes/t/y/1 (any case), everything else is false. */
    public static boolean asBoolean(String value) {
        if (value == null) return false;
        return TRUE_VALUES.contains(value.trim().toLowerCase(Locale.ROOT));
    }
}
