package io.github.riemr.autoschedule.application.dto;

public record AssignmentBatchResult(
    int occurrencesConsidered,
    int chunksProcessed,
    int occurrencesAssigned,
    int attendancesCreated,
    String errorMessage
) {
    public boolean succeeded() {
        return errorMessage == null;
    }
}
