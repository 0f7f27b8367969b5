package io.github.riemr.autoschedule.infrastructure.repository;

import io.github.riemr.autoschedule.application.repository.AttendanceOccurrenceRepository;
import io.github.riemr.autoschedule.domain.model.OccurrenceKey;
import io.github.riemr.autoschedule.infrastructure.mapper.AttendanceOccurrenceMapper;
import io.github.riemr.autoschedule.infrastructure.persistence.entity.AttendanceOccurrence;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public class AttendanceOccurrenceRepositoryImpl implements AttendanceOccurrenceRepository {
    private final AttendanceOccurrenceMapper mapper;
    public AttendanceOccurrenceRepositoryImpl(AttendanceOccurrenceMapper mapper) { this.mapper = mapper; }

    @Override
    public AttendanceOccurrence getOrAdd(OccurrenceKey key) {
        mapper.insertIfAbsent(key.occurrenceDate(), key.groupId(), key.locationId(), key.scheduleId());
        AttendanceOccurrence occurrence = mapper.selectByKey(key.occurrenceDate(), key.groupId(), key.locationId(), key.scheduleId());
        if (occurrence == null) {
            throw new IllegalStateException("Occurrence not found after insert: date=" + key.occurrenceDate()
                    + ", group=" + key.groupId() + ", location=" + key.locationId() + ", schedule=" + key.scheduleId());
        }
        return occurrence;
    }

    @Override
    public List<AttendanceOccurrence> findByIds(List<Long> ids) {
        if (ids == null || ids.isEmpty()) return List.of();
        return mapper.selectByIds(ids);
    }
}
