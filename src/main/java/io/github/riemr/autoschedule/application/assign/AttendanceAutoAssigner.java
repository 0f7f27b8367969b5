package io.github.riemr.autoschedule.application.assign;

import io.github.riemr.autoschedule.domain.model.SchedulerIdentity;

import java.util.List;

/**
 * Assignment engine that schedules people onto occurrences.
 * Callers bound the size of {@code occurrenceIds} and own the surrounding transaction.
 */
public interface AttendanceAutoAssigner {
    /**
     * @param occurrenceIds occurrences in precedence order
     * @return number of attendance records created
     */
    int assign(List<Long> occurrenceIds, SchedulerIdentity scheduler);
}
