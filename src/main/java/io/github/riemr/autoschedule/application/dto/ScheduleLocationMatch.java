package io.github.riemr.autoschedule.application.dto;

import io.github.riemr.autoschedule.infrastructure.persistence.entity.GroupLocation;
import io.github.riemr.autoschedule.infrastructure.persistence.entity.Schedule;

import java.util.List;

/**
 * @param groupLocations in assignment precedence order (display order, then location name)
 * @param schedules      distinct active schedules bound to those locations, by id
 */
public record ScheduleLocationMatch(List<GroupLocation> groupLocations, List<Schedule> schedules) {
    public boolean isEmpty() {
        return groupLocations.isEmpty() || schedules.isEmpty();
    }
}
