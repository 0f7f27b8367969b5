package io.github.riemr.autoschedule.infrastructure.persistence.entity;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

public class GroupLocation implements Serializable {
    private Long id;
    private Long groupId;
    private Long locationId;
    private String locationName; // joined from location
    private Integer displayOrder;
    private List<Long> scheduleIds = new ArrayList<>();

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public Long getGroupId() { return groupId; }
    public void setGroupId(Long groupId) { this.groupId = groupId; }
    public Long getLocationId() { return locationId; }
    public void setLocationId(Long locationId) { this.locationId = locationId; }
    public String getLocationName() { return locationName; }
    public void setLocationName(String locationName) { this.locationName = locationName; }
    public Integer getDisplayOrder() { return displayOrder; }
    public void setDisplayOrder(Integer displayOrder) { this.displayOrder = displayOrder; }
    public List<Long> getScheduleIds() { return scheduleIds; }
    public void setScheduleIds(List<Long> scheduleIds) { this.scheduleIds = scheduleIds; }
}
