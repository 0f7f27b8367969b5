package io.github.riemr.autoschedule.domain.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Identity of an attendance occurrence. At most one occurrence exists per key.
 */
public record OccurrenceKey(LocalDate occurrenceDate, Long groupId, Long locationId, Long scheduleId) {
    public OccurrenceKey {
        Objects.requireNonNull(occurrenceDate, "occurrenceDate");
        Objects.requireNonNull(groupId, "groupId");
        Objects.requireNonNull(locationId, "locationId");
        Objects.requireNonNull(scheduleId, "scheduleId");
    }
}
