package com.gt.studyplanner.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Aggregated performance signals for one learner, optionally scoped to a course, over a window of days ending at
 * generatedAt. Rates and scores are percentages (0-100); learningVelocity is topics mastered per week.
 *
 * <p>Never persisted on its own. A snapshot with no underlying history is fully populated with zeros.
 */
public record PerformanceSnapshot(String learnerId,
                                  String courseId,
                                  int windowDays,
                                  Instant generatedAt,

                                  int quizAttempts,
                                  double avgQuizScore,
                                  double quizScoreConsistency,
                                  List<Double> quizScores,
                                  Map<String, Double> quizScoreByDifficulty,

                                  int totalSessions,
                                  int completedSessions,
                                  double completionRate,
                                  double totalStudyMinutes,
                                  double averageProductivity,
                                  int studyStreak,

                                  int totalReviews,
                                  double retentionRate,
                                  int cardsMastered,
                                  double averageResponseSeconds,

                                  int topicsStarted,
                                  int topicsMastered,
                                  double averageMasteryLevel,
                                  double learningVelocity,

                                  double consistencyScore,
                                  double engagementScore) {

    public static PerformanceSnapshot empty(String learnerId, String courseId, int windowDays, Instant generatedAt) {
        return new PerformanceSnapshot(learnerId, courseId, windowDays, generatedAt,
                0, 0, 0, List.of(), Map.of(),
                0, 0, 0, 0, 0, 0,
                0, 0, 0, 0,
                0, 0, 0, 0,
                0, 0);
    }

    public boolean hasQuizData() {
        return quizAttempts > 0;
    }

    public boolean hasSessionData() {
        return totalSessions > 0;
    }

    public boolean hasReviewData() {
        return totalReviews > 0;
    }

    public boolean hasProgressData() {
        return topicsStarted > 0;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return !hasQuizData() && !hasSessionData() && !hasReviewData() && !hasProgressData();
    }

    // Two snapshots carry the same signals when they differ at most in when they were generated
    public boolean sameSignalsAs(PerformanceSnapshot other) {
        return other != null && withGeneratedAt(null).equals(other.withGeneratedAt(null));
    }

    public PerformanceSnapshot withGeneratedAt(Instant newGeneratedAt) {
        return new PerformanceSnapshot(learnerId, courseId, windowDays, newGeneratedAt,
                quizAttempts, avgQuizScore, quizScoreConsistency, quizScores, quizScoreByDifficulty,
                totalSessions, completedSessions, completionRate, totalStudyMinutes, averageProductivity, studyStreak,
                totalReviews, retentionRate, cardsMastered, averageResponseSeconds,
                topicsStarted, topicsMastered, averageMasteryLevel, learningVelocity,
                consistencyScore, engagementScore);
    }
}
