package io.github.riemr.autoschedule.infrastructure.repository;

import io.github.riemr.autoschedule.application.repository.AttendanceRepository;
import io.github.riemr.autoschedule.infrastructure.mapper.AttendanceMapper;
import io.github.riemr.autoschedule.infrastructure.persistence.entity.Attendance;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

@Repository
@RequiredArgsConstructor
public class AttendanceRepositoryImpl implements AttendanceRepository {
    private final AttendanceMapper mapper;
    private final Clock clock;

    @Override
    public List<Attendance> findByOccurrenceId(Long occurrenceId) {
        return mapper.selectByOccurrenceId(occurrenceId);
    }

    @Override
    public void confirmScheduled(Long attendanceId) {
        int updated = mapper.confirmScheduled(attendanceId, LocalDateTime.now(clock));
        if (updated == 0) {
            throw new IllegalStateException("Attendance not found: " + attendanceId);
        }
    }

    @Override
    public boolean addIfAbsent(Attendance attendance) {
        if (attendance.getCreatedAt() == null) attendance.setCreatedAt(LocalDateTime.now(clock));
        return mapper.insertIfAbsent(attendance) > 0;
    }

    @Override
    public boolean isRequestedOn(Long personId, LocalDate occurrenceDate, Long scheduleId) {
        return mapper.countRequestedForPerson(personId, occurrenceDate, scheduleId) > 0;
    }
}
