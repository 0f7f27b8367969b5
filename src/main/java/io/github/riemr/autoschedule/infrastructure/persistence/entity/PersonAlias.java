package io.github.riemr.autoschedule.infrastructure.persistence.entity;

import lombok.Data;

import java.io.Serializable;

@Data
public class PersonAlias implements Serializable {
    private Long id;
    private String guid;
    private Long personId;
    private Boolean primaryAlias;
}
