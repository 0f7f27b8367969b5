package io.github.riemr.autoschedule.application.repository;

import io.github.riemr.autoschedule.domain.model.OccurrenceKey;
import io.github.riemr.autoschedule.infrastructure.persistence.entity.AttendanceOccurrence;

import java.util.List;

public interface AttendanceOccurrenceRepository {
    /**
     * Returns the occurrence for the key, creating it when absent. Calling it again with the
     * same key, from this or a concurrent run, returns the same occurrence.
     */
    AttendanceOccurrence getOrAdd(OccurrenceKey key);

    List<AttendanceOccurrence> findByIds(List<Long> ids);
}
