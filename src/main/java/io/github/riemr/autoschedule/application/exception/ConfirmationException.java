package io.github.riemr.autoschedule.application.exception;

/** The confirmation sweep failed and was rolled back. */
public class ConfirmationException extends AutoScheduleException {
    public ConfirmationException(Throwable cause) {
        super("Attendance confirmation failed: " + cause.getMessage(), cause);
    }
}
