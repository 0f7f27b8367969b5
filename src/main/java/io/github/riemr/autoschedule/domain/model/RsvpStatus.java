package io.github.riemr.autoschedule.domain.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Response a person gave (or has not yet given) to a scheduled attendance.
 */
public enum RsvpStatus {
    YES,
    NO,
    MAYBE,
    UNKNOWN;

    private static final Set<RsvpStatus> UNDECIDED = EnumSet.of(MAYBE, UNKNOWN);

    /** MAYBE or UNKNOWN: the person has not committed either way. */
    public boolean isUndecided() {
        return UNDECIDED.contains(this);
    }
}
