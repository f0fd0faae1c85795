package com.gt.studyplanner.model;

import java.util.List;
import java.util.Map;

/**
 * Output of a performance analysis pass. componentScores holds the normalized (0-100) inputs of the overall score,
 * keyed quiz, progress, retention, completion and engagement. trends is keyed by the same metric names that were
 * tracked across the snapshot series.
 */
public record AnalysisResult(double overallScore,
                             PerformanceCategory category,
                             Map<String, Double> componentScores,
                             Map<String, Trend> trends,
                             Trend overallTrend,
                             List<String> strengths,
                             List<String> weaknesses,
                             List<Recommendation> recommendations,
                             LearningProfile learningProfile,
                             TrajectoryForecast trajectory,
                             double predictionConfidence,
                             PerformanceSnapshot latestSnapshot) { }
