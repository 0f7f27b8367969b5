package io.github.riemr.autoschedule.application.repository;

import io.github.riemr.autoschedule.infrastructure.persistence.entity.Group;
import io.github.riemr.autoschedule.infrastructure.persistence.entity.GroupLocation;
import io.github.riemr.autoschedule.infrastructure.persistence.entity.GroupType;
import io.github.riemr.autoschedule.infrastructure.persistence.entity.Schedule;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read-only access to groups, their locations and the schedules bound to them.
 */
public interface GroupCatalogRepository {
    Optional<GroupType> findGroupTypeByGuid(UUID guid);

    List<Group> findGroupsByGroupType(Long groupTypeId);

    /** Raw attribute value (or the attribute default); empty when the attribute does not exist. */
    Optional<String> findGroupAttributeValue(Group group, String attributeKey);

    /** Group locations with their bound schedule ids populated. */
    List<GroupLocation> findGroupLocations(Collection<Long> groupIds);

    List<Schedule> findSchedules(Collection<Long> scheduleIds);
}
