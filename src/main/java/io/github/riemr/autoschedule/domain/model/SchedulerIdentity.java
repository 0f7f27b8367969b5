package io.github.riemr.autoschedule.domain.model;

/**
 * The person on whose behalf attendances are auto-scheduled.
 * {@code personAliasId} is the person's primary alias and is stamped on every attendance created.
 */
public record SchedulerIdentity(Long personId, Long personAliasId) {
}
