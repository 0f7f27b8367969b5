package io.github.riemr.autoschedule.application.exception;

/**
 * Base type of the errors an auto-schedule run reports. Never escapes the run itself.
 */
public class AutoScheduleException extends RuntimeException {
    public AutoScheduleException(String message) {
        super(message);
    }

    public AutoScheduleException(String message, Throwable cause) {
        super(message, cause);
    }
}
