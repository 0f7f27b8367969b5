package io.github.riemr.autoschedule.infrastructure.mapper;

import io.github.riemr.autoschedule.infrastructure.persistence.entity.GroupType;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface GroupTypeMapper {
    @Select("SELECT id, CAST(guid AS VARCHAR) AS guid, name, is_scheduling_enabled AS scheduling_enabled " +
            "FROM group_type WHERE guid = CAST(#{guid} AS UUID)")
    GroupType selectByGuid(@Param("guid") String guid);
}
