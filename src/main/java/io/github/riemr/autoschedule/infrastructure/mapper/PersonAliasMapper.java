package io.github.riemr.autoschedule.infrastructure.mapper;

import io.github.riemr.autoschedule.infrastructure.persistence.entity.PersonAlias;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface PersonAliasMapper {
    /** Primary alias of the person who owns the alias with the given guid. */
    @Select("SELECT p.id, CAST(p.guid AS VARCHAR) AS guid, p.person_id, p.is_primary AS primary_alias " +
            "FROM person_alias a " +
            "JOIN person_alias p ON p.person_id = a.person_id AND p.is_primary = TRUE " +
            "WHERE a.guid = CAST(#{guid} AS UUID) " +
            "ORDER BY p.id LIMIT 1")
    PersonAlias selectPrimaryByAliasGuid(@Param("guid") String guid);
}
