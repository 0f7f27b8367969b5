package io.github.riemr.autoschedule.application.dto;

public record ConfirmationSweepResult(int confirmed, String errorMessage) {
    public boolean succeeded() {
        return errorMessage == null;
    }
}
