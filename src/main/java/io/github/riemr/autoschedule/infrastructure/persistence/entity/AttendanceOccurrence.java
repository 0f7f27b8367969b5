package io.github.riemr.autoschedule.infrastructure.persistence.entity;

import java.io.Serializable;
import java.time.LocalDate;

public class AttendanceOccurrence implements Serializable {
    private Long id;
    private LocalDate occurrenceDate;
    private Long groupId;
    private Long locationId;
    private Long scheduleId;

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public LocalDate getOccurrenceDate() { return occurrenceDate; }
    public void setOccurrenceDate(LocalDate occurrenceDate) { this.occurrenceDate = occurrenceDate; }
    public Long getGroupId() { return groupId; }
    public void setGroupId(Long groupId) { this.groupId = groupId; }
    public Long getLocationId() { return locationId; }
    public void setLocationId(Long locationId) { this.locationId = locationId; }
    public Long getScheduleId() { return scheduleId; }
    public void setScheduleId(Long scheduleId) { this.scheduleId = scheduleId; }
}
