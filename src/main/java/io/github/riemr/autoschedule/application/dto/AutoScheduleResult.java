package io.github.riemr.autoschedule.application.dto;

import java.util.List;

/**
 * Summary of one run. A run always completes; {@code errorMessages} lists what went wrong, in order.
 *
 * @param aborted true when configuration errors stopped the run before any occurrence was touched
 */
public record AutoScheduleResult(
    boolean aborted,
    int occurrenceCount,
    int assignedCount,
    int chunkCount,
    int attendancesCreated,
    int confirmedCount,
    List<String> errorMessages
) {
    public static AutoScheduleResult abortedWith(List<String> errorMessages) {
        return new AutoScheduleResult(true, 0, 0, 0, 0, 0, List.copyOf(errorMessages));
    }

    public boolean hasErrors() {
        return !errorMessages.isEmpty();
    }
}
