package io.github.riemr.autoschedule.infrastructure.mapper;

import io.github.riemr.autoschedule.infrastructure.persistence.entity.Attendance;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

@Mapper
public interface AttendanceMapper {
    @Select("SELECT id, occurrence_id, person_alias_id, rsvp, requested_to_attend, scheduled_to_attend, " +
            "did_attend, scheduled_by_person_alias_id, rsvp_date_time, created_at " +
            "FROM attendance WHERE occurrence_id = #{occurrenceId} ORDER BY id")
    List<Attendance> selectByOccurrenceId(@Param("occurrenceId") Long occurrenceId);

    @Update("UPDATE attendance SET rsvp = 'YES', scheduled_to_attend = TRUE, rsvp_date_time = #{confirmedAt} " +
            "WHERE id = #{id}")
    int confirmScheduled(@Param("id") Long id, @Param("confirmedAt") LocalDateTime confirmedAt);

    @Insert("INSERT INTO attendance (occurrence_id, person_alias_id, rsvp, requested_to_attend, " +
            "scheduled_to_attend, did_attend, scheduled_by_person_alias_id, created_at) " +
            "VALUES (#{occurrenceId}, #{personAliasId}, #{rsvp}, #{requestedToAttend}, " +
            "#{scheduledToAttend}, #{didAttend}, #{scheduledByPersonAliasId}, #{createdAt}) " +
            "ON CONFLICT (occurrence_id, person_alias_id) DO NOTHING")
    int insertIfAbsent(Attendance row);

    @Select("SELECT COUNT(*) FROM attendance a " +
            "JOIN attendance_occurrence o ON o.id = a.occurrence_id " +
            "JOIN person_alias pa ON pa.id = a.person_alias_id " +
            "WHERE pa.person_id = #{personId} AND o.occurrence_date = #{occurrenceDate} " +
            "AND o.schedule_id = #{scheduleId} AND a.requested_to_attend = TRUE")
    int countRequestedForPerson(@Param("personId") Long personId,
                                @Param("occurrenceDate") LocalDate occurrenceDate,
                                @Param("scheduleId") Long scheduleId);
}
