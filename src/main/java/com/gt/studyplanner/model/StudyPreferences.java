package com.gt.studyplanner.model;

import java.util.List;

// Learner supplied planning preferences. Any missing or non-positive value falls back to the planner default.
public record StudyPreferences(Double dailyHours,
                               Double intensityMultiplier,
                               boolean preferShortSessions,
                               boolean includeWeekends,
                               List<Integer> preferredHours) {

    public static StudyPreferences defaults() {
        return new StudyPreferences(null, null, false, false, List.of());
    }
}
