package io.github.riemr.autoschedule.infrastructure.persistence.entity;

import lombok.Data;

import java.io.Serializable;

@Data
public class Group implements Serializable {
    private Long id;
    private String guid;
    private Long groupTypeId;
    private Long parentGroupId;
    private String name;
    private Boolean active;
    private Boolean archived;
    private Boolean disableScheduling;
    // joined from group_type
    private Boolean groupTypeSchedulingEnabled;
}
