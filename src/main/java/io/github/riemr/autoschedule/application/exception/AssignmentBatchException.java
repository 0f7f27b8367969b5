package io.github.riemr.autoschedule.application.exception;

/** Auto-assignment or its commit failed; remaining chunks are not attempted. */
public class AssignmentBatchException extends AutoScheduleException {
    public AssignmentBatchException(int chunkNumber, Throwable cause) {
        super("Auto-assignment failed in chunk " + chunkNumber + ": " + cause.getMessage(), cause);
    }
}
