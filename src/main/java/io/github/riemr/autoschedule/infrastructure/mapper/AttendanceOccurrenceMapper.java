package io.github.riemr.autoschedule.infrastructure.mapper;

import io.github.riemr.autoschedule.infrastructure.persistence.entity.AttendanceOccurrence;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.time.LocalDate;
import java.util.List;

@Mapper
public interface AttendanceOccurrenceMapper {
    /** Relies on uq_attendance_occurrence_key; a concurrent insert of the same key is a no-op. */
    @Insert("INSERT INTO attendance_occurrence (occurrence_date, group_id, location_id, schedule_id) " +
            "VALUES (#{occurrenceDate}, #{groupId}, #{locationId}, #{scheduleId}) " +
            "ON CONFLICT (occurrence_date, group_id, location_id, schedule_id) DO NOTHING")
    int insertIfAbsent(@Param("occurrenceDate") LocalDate occurrenceDate,
                       @Param("groupId") Long groupId,
                       @Param("locationId") Long locationId,
                       @Param("scheduleId") Long scheduleId);

    @Select("SELECT id, occurrence_date, group_id, location_id, schedule_id FROM attendance_occurrence " +
            "WHERE occurrence_date = #{occurrenceDate} AND group_id = #{groupId} " +
            "AND location_id = #{locationId} AND schedule_id = #{scheduleId}")
    AttendanceOccurrence selectByKey(@Param("occurrenceDate") LocalDate occurrenceDate,
                                     @Param("groupId") Long groupId,
                                     @Param("locationId") Long locationId,
                                     @Param("scheduleId") Long scheduleId);

    @Select("<script>" +
            "SELECT id, occurrence_date, group_id, location_id, schedule_id FROM attendance_occurrence " +
            "WHERE id IN <foreach item='id' collection='ids' open='(' separator=',' close=')'>#{id}</foreach>" +
            "</script>")
    List<AttendanceOccurrence> selectByIds(@Param("ids") List<Long> ids);
}
