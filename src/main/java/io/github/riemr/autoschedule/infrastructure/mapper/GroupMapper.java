package io.github.riemr.autoschedule.infrastructure.mapper;

import io.github.riemr.autoschedule.infrastructure.persistence.entity.Group;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Result;
import org.apache.ibatis.annotations.Results;
import org.apache.ibatis.annotations.Select;

import java.util.List;

@Mapper
public interface GroupMapper {
    @Select("SELECT g.id, CAST(g.guid AS VARCHAR) AS guid, g.group_type_id, g.parent_group_id, g.name, " +
            "g.is_active, g.is_archived, g.disable_scheduling, gt.is_scheduling_enabled " +
            "FROM group_master g JOIN group_type gt ON gt.id = g.group_type_id " +
            "WHERE g.group_type_id = #{groupTypeId} ORDER BY g.id")
    @Results({
        @Result(property = "id", column = "id"),
        @Result(property = "guid", column = "guid"),
        @Result(property = "groupTypeId", column = "group_type_id"),
        @Result(property = "parentGroupId", column = "parent_group_id"),
        @Result(property = "name", column = "name"),
        @Result(property = "active", column = "is_active"),
        @Result(property = "archived", column = "is_archived"),
        @Result(property = "disableScheduling", column = "disable_scheduling"),
        @Result(property = "groupTypeSchedulingEnabled", column = "is_scheduling_enabled")
    })
    List<Group> selectByGroupTypeId(@Param("groupTypeId") Long groupTypeId);

    /**
     * Group attribute value, falling back to the attribute's default when the group has none.
     * Attributes qualified by a group type win over unqualified ones.
     */
    @Select("SELECT COALESCE(av.value, a.default_value) " +
            "FROM attribute a " +
            "LEFT JOIN attribute_value av ON av.attribute_id = a.id AND av.entity_id = #{groupId} " +
            "WHERE a.entity_type = 'GROUP' AND a.attribute_key = #{attributeKey} " +
            "AND (a.group_type_id IS NULL OR a.group_type_id = #{groupTypeId}) " +
            "ORDER BY a.group_type_id NULLS LAST LIMIT 1")
    String selectAttributeValue(@Param("groupId") Long groupId,
                                @Param("groupTypeId") Long groupTypeId,
                                @Param("attributeKey") String attributeKey);
}
