package com.gt.studyplanner.model;

public record OverrideResult(boolean accepted, String message, PlanOverride override) {

    public static OverrideResult rejected(String message) {
        return new OverrideResult(false, message, null);
    }
}
