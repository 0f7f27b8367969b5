package io.github.riemr.autoschedule.infrastructure.mapper;

import io.github.riemr.autoschedule.infrastructure.persistence.entity.Schedule;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.Collection;
import java.util.List;

@Mapper
public interface ScheduleMapper {
    @Select("<script>" +
            "SELECT id, name, cron_expression, weekly_day_of_week, weekly_time_of_day, " +
            "effective_start_date, effective_end_date, is_active AS active " +
            "FROM schedule WHERE id IN " +
            "<foreach item='id' collection='ids' open='(' separator=',' close=')'>#{id}</foreach> " +
            "ORDER BY id" +
            "</script>")
    List<Schedule> selectByIds(@Param("ids") Collection<Long> ids);
}
