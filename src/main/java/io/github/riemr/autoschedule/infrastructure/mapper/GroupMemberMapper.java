package io.github.riemr.autoschedule.infrastructure.mapper;

import io.github.riemr.autoschedule.infrastructure.persistence.entity.GroupMember;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

@Mapper
public interface GroupMemberMapper {
    @Select("SELECT gm.id, gm.group_id, gm.person_id, pa.id AS person_alias_id, gm.is_active AS active, " +
            "gm.preferred_schedule_id, gm.preferred_location_id " +
            "FROM group_member gm " +
            "JOIN person_alias pa ON pa.person_id = gm.person_id AND pa.is_primary = TRUE " +
            "WHERE gm.group_id = #{groupId} AND gm.is_active = TRUE " +
            "ORDER BY gm.id")
    List<GroupMember> selectActiveByGroupId(@Param("groupId") Long groupId);
}
