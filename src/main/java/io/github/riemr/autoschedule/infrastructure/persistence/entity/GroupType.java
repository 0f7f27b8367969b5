package io.github.riemr.autoschedule.infrastructure.persistence.entity;

import lombok.Data;

import java.io.Serializable;

@Data
public class GroupType implements Serializable {
    private Long id;
    private String guid;
    private String name;
    private Boolean schedulingEnabled;
}
