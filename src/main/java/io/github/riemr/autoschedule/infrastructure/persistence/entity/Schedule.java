package io.github.riemr.autoschedule.infrastructure.persistence.entity;

import lombok.Data;

import java.io.Serializable;
import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Recurrence definition. Either {@code cronExpression} (Spring 6-field cron) or the
 * weekly pair {@code weeklyDayOfWeek}/{@code weeklyTimeOfDay} is set.
 */
@Data
public class Schedule implements Serializable {
    private Long id;
    private String name;
    private String cronExpression;
    private Short weeklyDayOfWeek; // 1..7 (ISO, Mon=1)
    private LocalTime weeklyTimeOfDay;
    private LocalDate effectiveStartDate;
    private LocalDate effectiveEndDate;
    private Boolean active;
}
