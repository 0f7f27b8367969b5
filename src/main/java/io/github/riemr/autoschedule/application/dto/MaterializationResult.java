package io.github.riemr.autoschedule.application.dto;

import java.util.List;

/**
 * @param occurrenceIds every occurrence touched, new or pre-existing, in materialization order
 * @param errorMessages one entry per schedule that was skipped because its recurrence could not be evaluated
 */
public record MaterializationResult(List<Long> occurrenceIds, List<String> errorMessages) {
}
