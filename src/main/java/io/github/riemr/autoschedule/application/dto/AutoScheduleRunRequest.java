package io.github.riemr.autoschedule.application.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.UUID;

@Data
public class AutoScheduleRunRequest {
    @NotNull
    private UUID groupTypeGuid;

    @NotNull
    private UUID schedulerAliasGuid;

    @Min(0)
    private Integer weeksOut; // null -> autoschedule.default-weeks-out

    private String autoScheduleAttributeKey;
}
