package com.gt.studyplanner.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;

/**
 * A manual change layered over the generated schedule. Which of the optional fields are set depends on type:
 * Schedule uses sessionId, newDate and newTime; DifficultyAdjustment uses difficultyAdjustment;
 * ReviewFrequency uses reviewFrequencyDays.
 */
public record PlanOverride(String id,
                           OverrideType type,
                           String sessionId,
                           LocalDate newDate,
                           LocalTime newTime,
                           Integer difficultyAdjustment,
                           Integer reviewFrequencyDays,
                           String reason,
                           Instant createdAt) {

    public static PlanOverride schedule(String id, String sessionId, LocalDate newDate, LocalTime newTime, String reason, Instant createdAt) {
        return new PlanOverride(id, OverrideType.Schedule, sessionId, newDate, newTime, null, null, reason, createdAt);
    }

    public static PlanOverride difficulty(String id, int adjustment, String reason, Instant createdAt) {
        return new PlanOverride(id, OverrideType.DifficultyAdjustment, null, null, null, adjustment, null, reason, createdAt);
    }

    public static PlanOverride reviewFrequency(String id, int frequencyDays, String reason, Instant createdAt) {
        return new PlanOverride(id, OverrideType.ReviewFrequency, null, null, null, null, frequencyDays, reason, createdAt);
    }
}
