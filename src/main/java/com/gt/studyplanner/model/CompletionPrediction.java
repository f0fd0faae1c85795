package com.gt.studyplanner.model;

import java.time.LocalDate;
import java.util.List;

/**
 * Projected course completion. weeksRemaining is {@link Double#POSITIVE_INFINITY} and estimatedDate is null when the
 * learner currently masters no topics per week. anchoredOnDefaults marks a prediction made without any progress
 * history, using the configured default velocity.
 */
public record CompletionPrediction(String learnerId,
                                   String courseId,
                                   int targetMasteryLevel,
                                   int totalTopics,
                                   int topicsRemaining,
                                   double velocity,
                                   double weeksRemaining,
                                   LocalDate estimatedDate,
                                   double probability,
                                   double confidence,
                                   Trend velocityTrend,
                                   RiskLevel riskOfFallingBehind,
                                   boolean anchoredOnDefaults,
                                   List<Milestone> milestones,
                                   List<CompletionScenario> scenarios,
                                   List<String> recommendations) { }
