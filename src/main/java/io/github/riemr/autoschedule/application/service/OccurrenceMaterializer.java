package io.github.riemr.autoschedule.application.service;

import io.github.riemr.autoschedule.application.dto.MaterializationResult;
import io.github.riemr.autoschedule.application.dto.ScheduleLocationMatch;
import io.github.riemr.autoschedule.application.repository.AttendanceOccurrenceRepository;
import io.github.riemr.autoschedule.application.util.ScheduleCalendar;
import io.github.riemr.autoschedule.domain.model.OccurrenceKey;
import io.github.riemr.autoschedule.infrastructure.persistence.entity.AttendanceOccurrence;
import io.github.riemr.autoschedule.infrastructure.persistence.entity.GroupLocation;
import io.github.riemr.autoschedule.infrastructure.persistence.entity.Schedule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Creates (or finds) one occurrence per date, group, location and schedule in the window.
 */
@Component
@Slf4j
public class OccurrenceMaterializer {
    static final int LOOKBACK_DAYS = 6;

    private final AttendanceOccurrenceRepository occurrenceRepository;
    private final boolean boundSchedulesOnly;

    public OccurrenceMaterializer(AttendanceOccurrenceRepository occurrenceRepository,
                                  @Value("${autoschedule.bound-schedules-only:false}") boolean boundSchedulesOnly) {
        this.occurrenceRepository = occurrenceRepository;
        this.boundSchedulesOnly = boundSchedulesOnly;
    }

    /**
     * A schedule whose recurrence cannot be evaluated is skipped for every date and reported once;
     * the remaining schedules are still materialized.
     */
    public MaterializationResult materialize(List<LocalDate> anchorDates, ScheduleLocationMatch match) {
        List<Long> occurrenceIds = new ArrayList<>();
        Map<Long, String> skipped = new LinkedHashMap<>();
        if (match.isEmpty()) return new MaterializationResult(occurrenceIds, List.of());

        for (LocalDate anchor : anchorDates) {
            for (DatedSchedule dated : occurrenceDates(anchor, match.schedules(), skipped)) {
                Long scheduleId = dated.schedule().getId();
                for (GroupLocation gl : match.groupLocations()) {
                    if (boundSchedulesOnly && !gl.getScheduleIds().contains(scheduleId)) continue;
                    AttendanceOccurrence occurrence = occurrenceRepository.getOrAdd(new OccurrenceKey(
                            dated.occurrenceDate(), gl.getGroupId(), gl.getLocationId(), scheduleId));
                    occurrenceIds.add(occurrence.getId());
                }
            }
            log.debug("Anchor {}: {} occurrences so far", anchor, occurrenceIds.size());
        }
        return new MaterializationResult(occurrenceIds, List.copyOf(skipped.values()));
    }

    /** Schedules with a start inside [anchor-6, anchor], ordered by that date. */
    List<DatedSchedule> occurrenceDates(LocalDate anchor, List<Schedule> schedules, Map<Long, String> skipped) {
        LocalDateTime windowStart = anchor.minusDays(LOOKBACK_DAYS).atStartOfDay();
        List<DatedSchedule> dated = new ArrayList<>();
        for (Schedule schedule : schedules) {
            if (skipped.containsKey(schedule.getId())) continue;
            Optional<LocalDateTime> next;
            try {
                next = ScheduleCalendar.nextStartOnOrAfter(schedule, windowStart);
            } catch (IllegalArgumentException | DateTimeException e) {
                String message = String.format("Schedule %d ('%s') skipped: %s",
                        schedule.getId(), schedule.getName(), e.getMessage());
                log.warn(message);
                skipped.put(schedule.getId(), message);
                continue;
            }
            next.map(LocalDateTime::toLocalDate)
                    .filter(d -> !d.isAfter(anchor))
                    .ifPresent(d -> dated.add(new DatedSchedule(d, schedule)));
        }
        dated.sort(Comparator.comparing(DatedSchedule::occurrenceDate)
                .thenComparing(ds -> ds.schedule().getId()));
        return dated;
    }

    record DatedSchedule(LocalDate occurrenceDate, Schedule schedule) {}
}
