package io.github.riemr.autoschedule.application.repository;

import io.github.riemr.autoschedule.infrastructure.persistence.entity.Attendance;

import java.time.LocalDate;
import java.util.List;

public interface AttendanceRepository {
    List<Attendance> findByOccurrenceId(Long occurrenceId);

    /** Marks a scheduled attendance as confirmed (RSVP yes). */
    void confirmScheduled(Long attendanceId);

    /** @return false when the person already has an attendance on that occurrence */
    boolean addIfAbsent(Attendance attendance);

    boolean isRequestedOn(Long personId, LocalDate occurrenceDate, Long scheduleId);
}
