package io.github.riemr.autoschedule.application.dto;

import java.util.UUID;

/**
 * Fully resolved input of one auto-schedule run.
 *
 * @param autoScheduleAttributeKey optional boolean group attribute a group must have set to be scheduled
 */
public record AutoScheduleCommand(
    UUID groupTypeGuid,
    UUID schedulerAliasGuid,
    int weeksOut,
    String autoScheduleAttributeKey
) {
}
