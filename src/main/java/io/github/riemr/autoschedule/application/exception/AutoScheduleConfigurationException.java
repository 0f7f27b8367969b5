package io.github.riemr.autoschedule.application.exception;

/** Group type or scheduler identity could not be resolved; the run stops before touching occurrences. */
public class AutoScheduleConfigurationException extends AutoScheduleException {
    public AutoScheduleConfigurationException(String message) {
        super(message);
    }
}
