package io.github.riemr.autoschedule.infrastructure.persistence.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class GroupLocationSchedule implements Serializable {
    private Long groupLocationId;
    private Long scheduleId;
}
