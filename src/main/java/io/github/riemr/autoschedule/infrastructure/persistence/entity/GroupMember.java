package io.github.riemr.autoschedule.infrastructure.persistence.entity;

import lombok.Data;

import java.io.Serializable;

@Data
public class GroupMember implements Serializable {
    private Long id;
    private Long groupId;
    private Long personId;
    private Long personAliasId; // primary alias, joined from person_alias
    private Boolean active;
    private Long preferredScheduleId;  // null = any schedule
    private Long preferredLocationId;  // null = any location
}
