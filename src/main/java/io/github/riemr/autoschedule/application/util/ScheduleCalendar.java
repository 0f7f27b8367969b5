package io.github.riemr.autoschedule.application.util;

import io.github.riemr.autoschedule.infrastructure.persistence.entity.Schedule;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.util.StringUtils;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.TemporalAdjusters;
import java.util.Optional;

/**
 * Start-time arithmetic for {@link Schedule} recurrences.
 */
public final class ScheduleCalendar {
    private ScheduleCalendar() {}

    /**
     * Next start date-time of the schedule at or after {@code from}, honoring the effective
     * date range. Empty when the schedule has no further start.
     *
     * @throws IllegalArgumentException when the cron expression is malformed
     */
    public static Optional<LocalDateTime> nextStartOnOrAfter(Schedule schedule, LocalDateTime from) {
        LocalDateTime start = from;
        LocalDate effectiveStart = schedule.getEffectiveStartDate();
        if (effectiveStart != null && start.isBefore(effectiveStart.atStartOfDay())) {
            start = effectiveStart.atStartOfDay();
        }

        LocalDateTime next;
        if (StringUtils.hasText(schedule.getCronExpression())) {
            CronExpression cron = CronExpression.parse(schedule.getCronExpression().trim());
            // next() is exclusive
            next = cron.next(start.minusNanos(1));
        } else if (schedule.getWeeklyDayOfWeek() != null && schedule.getWeeklyTimeOfDay() != null) {
            next = nextWeekly(DayOfWeek.of(schedule.getWeeklyDayOfWeek()), schedule, start);
        } else {
            return Optional.empty();
        }

        if (next == null) return Optional.empty();
        LocalDate effectiveEnd = schedule.getEffectiveEndDate();
        if (effectiveEnd != null && next.toLocalDate().isAfter(effectiveEnd)) return Optional.empty();
        return Optional.of(next);
    }

    private static LocalDateTime nextWeekly(DayOfWeek day, Schedule schedule, LocalDateTime start) {
        LocalDateTime candidate = start.toLocalDate()
                .with(TemporalAdjusters.nextOrSame(day))
                .atTime(schedule.getWeeklyTimeOfDay());
        return candidate.isBefore(start) ? candidate.plusWeeks(1) : candidate;
    }
}
