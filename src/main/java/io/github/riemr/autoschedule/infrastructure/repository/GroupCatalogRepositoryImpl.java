package io.github.riemr.autoschedule.infrastructure.repository;

import io.github.riemr.autoschedule.application.repository.GroupCatalogRepository;
import io.github.riemr.autoschedule.infrastructure.mapper.GroupLocationMapper;
import io.github.riemr.autoschedule.infrastructure.mapper.GroupMapper;
import io.github.riemr.autoschedule.infrastructure.mapper.GroupTypeMapper;
import io.github.riemr.autoschedule.infrastructure.mapper.ScheduleMapper;
import io.github.riemr.autoschedule.infrastructure.persistence.entity.Group;
import io.github.riemr.autoschedule.infrastructure.persistence.entity.GroupLocation;
import io.github.riemr.autoschedule.infrastructure.persistence.entity.GroupLocationSchedule;
import io.github.riemr.autoschedule.infrastructure.persistence.entity.GroupType;
import io.github.riemr.autoschedule.infrastructure.persistence.entity.Schedule;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

@Repository
@RequiredArgsConstructor
public class GroupCatalogRepositoryImpl implements GroupCatalogRepository {
    private final GroupTypeMapper groupTypeMapper;
    private final GroupMapper groupMapper;
    private final GroupLocationMapper groupLocationMapper;
    private final ScheduleMapper scheduleMapper;

    @Override
    public Optional<GroupType> findGroupTypeByGuid(UUID guid) {
        if (guid == null) return Optional.empty();
        return Optional.ofNullable(groupTypeMapper.selectByGuid(guid.toString()));
    }

    @Override
    public List<Group> findGroupsByGroupType(Long groupTypeId) {
        return groupMapper.selectByGroupTypeId(groupTypeId);
    }

    @Override
    public Optional<String> findGroupAttributeValue(Group group, String attributeKey) {
        return Optional.ofNullable(groupMapper.selectAttributeValue(group.getId(), group.getGroupTypeId(), attributeKey));
    }

    @Override
    public List<GroupLocation> findGroupLocations(Collection<Long> groupIds) {
        if (groupIds == null || groupIds.isEmpty()) return List.of();
        List<GroupLocation> rows = groupLocationMapper.selectByGroupIds(new ArrayList<>(groupIds));
        if (rows.isEmpty()) return rows;

        List<Long> groupLocationIds = rows.stream().map(GroupLocation::getId).toList();
        Map<Long, List<Long>> bindings = groupLocationMapper.selectScheduleBindings(groupLocationIds).stream()
                .collect(Collectors.groupingBy(GroupLocationSchedule::getGroupLocationId,
                        Collectors.mapping(GroupLocationSchedule::getScheduleId, Collectors.toList())));
        rows.forEach(gl -> gl.setScheduleIds(new ArrayList<>(bindings.getOrDefault(gl.getId(), List.of()))));
        return rows;
    }

    @Override
    public List<Schedule> findSchedules(Collection<Long> scheduleIds) {
        if (scheduleIds == null || scheduleIds.isEmpty()) return List.of();
        return scheduleMapper.selectByIds(scheduleIds);
    }
}
