package com.gt.studyplanner.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * A learner's multi-week schedule for one course. sessions holds the current revision of every slot;
 * supersededSessions keeps every earlier revision that an adaptation or override replaced. adaptationHistory and
 * overrides are append-only.
 */
public record StudyPlan(String id,
                        String learnerId,
                        String courseId,
                        PlanType planType,
                        PlanStatus status,
                        LocalDate startDate,
                        LocalDate endDate,
                        int totalWeeks,
                        StudyParameters parameters,
                        List<StudySession> sessions,
                        List<StudySession> supersededSessions,
                        List<PlanAdaptation> adaptationHistory,
                        List<PlanOverride> overrides,
                        PerformanceSnapshot baselineSnapshot,
                        PerformanceSnapshot lastEvaluatedSnapshot,
                        Instant createdAt,
                        Instant updatedAt,
                        long version) {

    public double dailyHours() {
        return parameters.dailyHours();
    }

    @JsonIgnore
    public boolean isActive() {
        return status == PlanStatus.Active;
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status == PlanStatus.Completed || status == PlanStatus.Cancelled;
    }

    public StudyPlan withStatus(PlanStatus newStatus, Instant now) {
        return new StudyPlan(id, learnerId, courseId, planType, newStatus, startDate, endDate, totalWeeks, parameters,
                sessions, supersededSessions, adaptationHistory, overrides, baselineSnapshot, lastEvaluatedSnapshot,
                createdAt, now, version);
    }

    public StudyPlan withSessions(List<StudySession> newSessions, Instant now) {
        return new StudyPlan(id, learnerId, courseId, planType, status, startDate, endDate, totalWeeks, parameters,
                newSessions, supersededSessions, adaptationHistory, overrides, baselineSnapshot, lastEvaluatedSnapshot,
                createdAt, now, version);
    }

    public StudyPlan withVersion(long newVersion) {
        return new StudyPlan(id, learnerId, courseId, planType, status, startDate, endDate, totalWeeks, parameters,
                sessions, supersededSessions, adaptationHistory, overrides, baselineSnapshot, lastEvaluatedSnapshot,
                createdAt, updatedAt, newVersion);
    }
}
