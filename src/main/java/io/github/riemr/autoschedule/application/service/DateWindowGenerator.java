package io.github.riemr.autoschedule.application.service;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;

/**
 * Weekly anchor dates of a run: the boundary day of the current week, then every 7 days.
 */
@Component
public class DateWindowGenerator {
    private final DayOfWeek weekBoundaryDay;

    public DateWindowGenerator(@Value("${autoschedule.week-boundary-day:SUNDAY}") DayOfWeek weekBoundaryDay) {
        this.weekBoundaryDay = weekBoundaryDay;
    }

    public List<LocalDate> anchorDates(int weeksOut, LocalDate today) {
        if (weeksOut < 0) throw new IllegalArgumentException("weeksOut must be >= 0");
        List<LocalDate> dates = new ArrayList<>(weeksOut);
        LocalDate anchor = today.with(TemporalAdjusters.nextOrSame(weekBoundaryDay));
        for (int week = 0; week < weeksOut; week++) {
            dates.add(anchor);
            anchor = anchor.plusDays(7);
        }
        return dates;
    }
}
