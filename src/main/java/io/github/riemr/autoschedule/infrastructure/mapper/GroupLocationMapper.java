package io.github.riemr.autoschedule.infrastructure.mapper;

import io.github.riemr.autoschedule.infrastructure.persistence.entity.GroupLocation;
import io.github.riemr.autoschedule.infrastructure.persistence.entity.GroupLocationSchedule;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

@Mapper
public interface GroupLocationMapper {
    @Select("<script>" +
            "SELECT gl.id, gl.group_id, gl.location_id, l.name AS location_name, gl.display_order " +
            "FROM group_location gl JOIN location l ON l.id = gl.location_id " +
            "WHERE gl.group_id IN " +
            "<foreach item='id' collection='groupIds' open='(' separator=',' close=')'>#{id}</foreach> " +
            "ORDER BY gl.display_order, l.name, gl.id" +
            "</script>")
    List<GroupLocation> selectByGroupIds(@Param("groupIds") List<Long> groupIds);

    @Select("<script>" +
            "SELECT group_location_id, schedule_id FROM group_location_schedule " +
            "WHERE group_location_id IN " +
            "<foreach item='id' collection='groupLocationIds' open='(' separator=',' close=')'>#{id}</foreach> " +
            "ORDER BY group_location_id, schedule_id" +
            "</script>")
    List<GroupLocationSchedule> selectScheduleBindings(@Param("groupLocationIds") List<Long> groupLocationIds);
}
