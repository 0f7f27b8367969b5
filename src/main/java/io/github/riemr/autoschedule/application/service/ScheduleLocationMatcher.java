package io.github.riemr.autoschedule.application.service;

import io.github.riemr.autoschedule.application.dto.ScheduleLocationMatch;
import io.github.riemr.autoschedule.application.repository.GroupCatalogRepository;
import io.github.riemr.autoschedule.infrastructure.persistence.entity.Group;
import io.github.riemr.autoschedule.infrastructure.persistence.entity.GroupLocation;
import io.github.riemr.autoschedule.infrastructure.persistence.entity.Schedule;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

@Component
@RequiredArgsConstructor
public class ScheduleLocationMatcher {
    /** Earlier group locations win when several occurrences compete for the same person. */
    static final Comparator<GroupLocation> PRECEDENCE = Comparator
            .comparing(GroupLocation::getDisplayOrder, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(GroupLocation::getLocationName, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(GroupLocation::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final GroupCatalogRepository catalog;

    public ScheduleLocationMatch match(List<Group> groups) {
        if (groups.isEmpty()) return new ScheduleLocationMatch(List.of(), List.of());
        List<Long> groupIds = groups.stream().map(Group::getId).toList();
        List<GroupLocation> groupLocations = catalog.findGroupLocations(groupIds).stream()
                .sorted(PRECEDENCE)
                .toList();

        Set<Long> scheduleIds = new TreeSet<>();
        groupLocations.forEach(gl -> scheduleIds.addAll(gl.getScheduleIds()));

        List<Schedule> schedules = catalog.findSchedules(scheduleIds).stream()
                .filter(s -> Boolean.TRUE.equals(s.getActive()))
                .sorted(Comparator.comparing(Schedule::getId))
                .toList();
        return new ScheduleLocationMatch(groupLocations, schedules);
    }
}
