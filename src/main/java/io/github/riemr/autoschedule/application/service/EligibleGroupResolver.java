package io.github.riemr.autoschedule.application.service;

import io.github.riemr.autoschedule.application.exception.AutoScheduleConfigurationException;
import io.github.riemr.autoschedule.application.repository.GroupCatalogRepository;
import io.github.riemr.autoschedule.application.util.BooleanValues;
import io.github.riemr.autoschedule.infrastructure.persistence.entity.Group;
import io.github.riemr.autoschedule.infrastructure.persistence.entity.GroupType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.UUID;

/**
 * Narrows the groups of a group type down to the ones that take part in auto-scheduling.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EligibleGroupResolver {
    private final GroupCatalogRepository catalog;

    /**
     * @param attributeKey optional; when set, only groups whose attribute resolves to true are kept
     * @throws AutoScheduleConfigurationException when the group type does not exist
     */
    public List<Group> resolve(UUID groupTypeGuid, String attributeKey) {
        GroupType groupType = catalog.findGroupTypeByGuid(groupTypeGuid)
                .orElseThrow(() -> new AutoScheduleConfigurationException("No group type was provided"));

        List<Group> schedulable = catalog.findGroupsByGroupType(groupType.getId()).stream()
                .filter(g -> groupType.getId().equals(g.getGroupTypeId()))
                .filter(EligibleGroupResolver::isSchedulable)
                .toList();

        if (!StringUtils.hasText(attributeKey)) {
            log.debug("Group type {}: {} schedulable groups", groupType.getName(), schedulable.size());
            return schedulable;
        }

        String key = attributeKey.trim();
        List<Group> filtered = schedulable.stream()
                .filter(g -> catalog.findGroupAttributeValue(g, key).map(BooleanValues::asBoolean).orElse(false))
                .toList();
        log.debug("Group type {}: {} of {} schedulable groups have '{}' set",
                groupType.getName(), filtered.size(), schedulable.size(), key);
        return filtered;
    }

    static boolean isSchedulable(Group g) {
        return Boolean.TRUE.equals(g.getActive())
                && !Boolean.TRUE.equals(g.getArchived())
                && g.getParentGroupId() != null
                && Boolean.TRUE.equals(g.getGroupTypeSchedulingEnabled())
                && !Boolean.TRUE.equals(g.getDisableScheduling());
    }
}
