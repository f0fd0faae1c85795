package com.gt.studyplanner.analysis;

import com.gt.studyplanner.metrics.Statistics;
import com.gt.studyplanner.model.ActivityFeedback;
import com.gt.studyplanner.model.AnalysisResult;
import com.gt.studyplanner.model.LearningProfile;
import com.gt.studyplanner.model.PerformanceCategory;
import com.gt.studyplanner.model.PerformanceSnapshot;
import com.gt.studyplanner.model.RecentActivity;
import com.gt.studyplanner.model.Recommendation;
import com.gt.studyplanner.model.RecommendationPriority;
import com.gt.studyplanner.model.TrajectoryForecast;
import com.gt.studyplanner.model.Trend;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.function.ToDoubleFunction;

/**
 * Turns a series of performance snapshots into scores, trends and recommendations.
 *
 * <p>The series is ordered oldest first and its last element is the learner's current state. Metrics without any
 * underlying data never count against the learner: they contribute 0 to the overall score, produce no weakness and
 * have an InsufficientData trend.
 */
@Component
public class PerformanceAnalyzer {

    public static final String QUIZ = "quiz";
    public static final String PROGRESS = "progress";
    public static final String RETENTION = "retention";
    public static final String COMPLETION = "completion";
    public static final String ENGAGEMENT = "engagement";
    public static final String STUDY_TIME = "study_time";

    private static final int HIGH_CONFIDENCE_DATA_POINTS = 12;

    private final TrendAnalyzer trendAnalyzer;
    private final Map<String, Double> weights;

    @Autowired
    public PerformanceAnalyzer(TrendAnalyzer trendAnalyzer,
                               @Value("${planner.analysis.weight.quiz:0.30}") double quizWeight,
                               @Value("${planner.analysis.weight.progress:0.25}") double progressWeight,
                               @Value("${planner.analysis.weight.retention:0.20}") double retentionWeight,
                               @Value("${planner.analysis.weight.completion:0.15}") double completionWeight,
                               @Value("${planner.analysis.weight.engagement:0.10}") double engagementWeight) {
        this.trendAnalyzer = trendAnalyzer;

        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put(QUIZ, quizWeight);
        weights.put(PROGRESS, progressWeight);
        weights.put(RETENTION, retentionWeight);
        weights.put(COMPLETION, completionWeight);
        weights.put(ENGAGEMENT, engagementWeight);
        this.weights = weights;
    }

    public AnalysisResult analyze(List<PerformanceSnapshot> snapshotSeries) {
        if (snapshotSeries == null || snapshotSeries.isEmpty()) {
            return emptyResult();
        }

        PerformanceSnapshot latest = snapshotSeries.get(snapshotSeries.size() - 1);

        Map<String, Double> components = componentScores(latest);
        double overallScore = weightedScore(components);

        Map<String, List<Double>> series = metricSeries(snapshotSeries);
        Map<String, Trend> trends = new LinkedHashMap<>();
        int dataPoints = 0;
        for (Map.Entry<String, List<Double>> entry : series.entrySet()) {
            trends.put(entry.getKey(), trendAnalyzer.trend(entry.getValue()));
            dataPoints += entry.getValue().size();
        }
        Trend overallTrend = trendAnalyzer.overallTrend(trends.values());

        List<String> strengths = new ArrayList<>();
        List<String> weaknesses = new ArrayList<>();
        identifyStrengthsAndWeaknesses(latest, strengths, weaknesses);

        return new AnalysisResult(
                Statistics.round(overallScore, 1),
                categorize(overallScore),
                components,
                trends,
                overallTrend,
                strengths,
                weaknesses,
                recommendations(overallScore, latest),
                learningProfile(latest),
                trajectory(trends, overallTrend),
                predictionConfidence(trends, dataPoints),
                latest);
    }

    // Overall score of a single snapshot, as used when comparing snapshots taken at different times
    public double overallScore(PerformanceSnapshot snapshot) {
        return weightedScore(componentScores(snapshot));
    }

    public PerformanceCategory categorize(double score) {
        if (score >= 90) {
            return PerformanceCategory.Excellent;
        } else if (score >= 80) {
            return PerformanceCategory.Good;
        } else if (score >= 70) {
            return PerformanceCategory.Average;
        } else if (score >= 50) {
            return PerformanceCategory.NeedsImprovement;
        }
        return PerformanceCategory.Poor;
    }

    public LearningProfile learningProfile(PerformanceSnapshot snapshot) {
        if (snapshot.isEmpty()) {
            return LearningProfile.Developing;
        }

        double quiz = snapshot.avgQuizScore();
        double completion = snapshot.completionRate();
        double retention = snapshot.retentionRate();

        if (quiz >= 85 && completion >= 80 && retention >= 80) {
            return LearningProfile.HighPerformer;
        } else if (quiz >= 70 && completion >= 70 && retention >= 70) {
            return LearningProfile.SteadyLearner;
        } else if (snapshot.hasSessionData() && completion < 60) {
            return LearningProfile.NeedsMotivation;
        } else if (snapshot.hasReviewData() && retention < 60) {
            return LearningProfile.NeedsRepetition;
        }
        return LearningProfile.Developing;
    }

    /**
     * Immediate feedback on a single finished activity, judged against the learner's current snapshot.
     */
    public ActivityFeedback activityFeedback(RecentActivity activity, PerformanceSnapshot current) {
        String type = activity.type() == null ? "" : activity.type();

        if (RecentActivity.QUIZ_COMPLETION.equals(type)) {
            return quizFeedback(activity, current);
        } else if (RecentActivity.STUDY_SESSION.equals(type)) {
            return sessionFeedback(activity);
        } else if (RecentActivity.FLASHCARD_REVIEW.equals(type)) {
            return flashcardFeedback(activity);
        }

        return new ActivityFeedback(type, "no_analysis", "Unknown activity type", List.of());
    }

    Map<String, Double> componentScores(PerformanceSnapshot snapshot) {
        Map<String, Double> components = new LinkedHashMap<>();
        components.put(QUIZ, normalize(snapshot.avgQuizScore()));
        components.put(PROGRESS, normalize(snapshot.averageMasteryLevel() / 5 * 100));
        components.put(RETENTION, normalize(snapshot.retentionRate()));
        components.put(COMPLETION, normalize(snapshot.completionRate()));
        components.put(ENGAGEMENT, normalize(snapshot.engagementScore()));
        return components;
    }

    private double weightedScore(Map<String, Double> components) {
        double score = 0;
        for (Map.Entry<String, Double> component : components.entrySet()) {
            score += component.getValue() * weights.getOrDefault(component.getKey(), 0.0);
        }
        return Statistics.clamp(score, 0, 100);
    }

    private static double normalize(double value) {
        if (Double.isNaN(value)) {
            return 0;
        }
        return Statistics.clamp(value, 0, 100);
    }

    private static Map<String, List<Double>> metricSeries(List<PerformanceSnapshot> snapshots) {
        Map<String, List<Double>> series = new LinkedHashMap<>();
        series.put(QUIZ, valuesWhere(snapshots, PerformanceSnapshot::hasQuizData, PerformanceSnapshot::avgQuizScore));
        series.put(RETENTION, valuesWhere(snapshots, PerformanceSnapshot::hasReviewData, PerformanceSnapshot::retentionRate));
        series.put(COMPLETION, valuesWhere(snapshots, PerformanceSnapshot::hasSessionData, PerformanceSnapshot::completionRate));
        series.put(STUDY_TIME, valuesWhere(snapshots, PerformanceSnapshot::hasSessionData, PerformanceSnapshot::totalStudyMinutes));
        series.put(ENGAGEMENT, valuesWhere(snapshots, PerformanceSnapshot::hasSessionData, PerformanceSnapshot::engagementScore));
        return series;
    }

    private static List<Double> valuesWhere(List<PerformanceSnapshot> snapshots,
                                            Predicate<PerformanceSnapshot> hasData,
                                            ToDoubleFunction<PerformanceSnapshot> metric) {
        List<Double> values = new ArrayList<>();
        for (PerformanceSnapshot snapshot : snapshots) {
            if (hasData.test(snapshot)) {
                values.add(metric.applyAsDouble(snapshot));
            }
        }
        return values;
    }

    private static void identifyStrengthsAndWeaknesses(PerformanceSnapshot snapshot, List<String> strengths, List<String> weaknesses) {
        if (snapshot.hasQuizData()) {
            if (snapshot.avgQuizScore() >= 80) {
                strengths.add("Strong quiz performance");
            } else if (snapshot.avgQuizScore() < 60) {
                weaknesses.add("Needs improvement in quiz performance");
            }
        }

        if (snapshot.hasSessionData()) {
            if (snapshot.completionRate() >= 80) {
                strengths.add("Consistent study habits");
            } else if (snapshot.completionRate() < 60) {
                weaknesses.add("Inconsistent study completion");
            }
        }

        if (snapshot.hasReviewData()) {
            if (snapshot.retentionRate() >= 80) {
                strengths.add("Excellent memory retention");
            } else if (snapshot.retentionRate() < 60) {
                weaknesses.add("Memory retention needs work");
            }
        }

        if (snapshot.hasProgressData()) {
            if (snapshot.averageMasteryLevel() >= 4) {
                strengths.add("Fast learning progression");
            } else if (snapshot.averageMasteryLevel() < 2.5) {
                weaknesses.add("Slow learning progression");
            }
        }
    }

    private static List<Recommendation> recommendations(double overallScore, PerformanceSnapshot snapshot) {
        List<Recommendation> recommendations = new ArrayList<>();

        if (snapshot.isEmpty()) {
            recommendations.add(Recommendation.of("getting_started", RecommendationPriority.Low,
                    "Build Your Study History",
                    "There is not enough activity yet for a personalized analysis",
                    "Complete a few study sessions",
                    "Take a quiz on the first topic",
                    "Review your first flashcards"));
            return recommendations;
        }

        if (overallScore < 60) {
            recommendations.add(Recommendation.of("study_strategy", RecommendationPriority.High,
                    "Adjust Study Strategy",
                    "Consider reducing session length and increasing frequency",
                    "Schedule shorter 25-30 minute sessions",
                    "Increase study frequency to daily",
                    "Focus on review and reinforcement"));
        } else if (overallScore > 85) {
            recommendations.add(Recommendation.of("challenge", RecommendationPriority.Medium,
                    "Increase Challenge Level",
                    "You're performing excellently, time for advanced content",
                    "Attempt harder practice problems",
                    "Explore advanced topics",
                    "Consider helping other students"));
        }

        if (snapshot.hasQuizData()) {
            if (snapshot.avgQuizScore() < 70) {
                recommendations.add(Recommendation.of("quiz_improvement", RecommendationPriority.High,
                        "Improve Quiz Performance",
                        "Focus on understanding concepts before testing",
                        "Review material before taking quizzes",
                        "Take practice quizzes more frequently",
                        "Analyze incorrect answers to identify patterns"));
            }

            if (snapshot.quizAttempts() >= 2 && snapshot.quizScoreConsistency() < 70) {
                recommendations.add(Recommendation.of("consistency", RecommendationPriority.Medium,
                        "Improve Consistency",
                        "Work on maintaining steady performance",
                        "Establish a regular study routine",
                        "Review previous topics before moving forward",
                        "Practice stress management during assessments"));
            }
        }

        if (snapshot.hasSessionData() && snapshot.completionRate() < 70) {
            recommendations.add(Recommendation.of("session_completion", RecommendationPriority.High,
                    "Improve Session Completion",
                    "Adjust session planning to improve completion rates",
                    "Plan shorter sessions initially",
                    "Set clear, achievable goals for each session",
                    "Eliminate distractions during study time"));
        }

        if (snapshot.hasReviewData() && snapshot.retentionRate() < 70) {
            recommendations.add(Recommendation.of("memory_improvement", RecommendationPriority.Medium,
                    "Enhance Memory Retention",
                    "Implement better memory techniques",
                    "Use spaced repetition more consistently",
                    "Create more memorable associations",
                    "Review cards more frequently initially"));
        }

        return recommendations;
    }

    private static TrajectoryForecast trajectory(Map<String, Trend> trends, Trend direction) {
        long improving = trends.values().stream().filter(trend -> trend == Trend.Improving).count();
        long declining = trends.values().stream().filter(trend -> trend == Trend.Declining).count();

        String strength;
        if (direction == Trend.Improving) {
            strength = improving >= 2 ? "strong" : "moderate";
        } else if (direction == Trend.Declining) {
            strength = declining >= 2 ? "concerning" : "moderate";
        } else {
            strength = "stable";
        }

        List<String> riskFactors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        if (trends.get(QUIZ) == Trend.Declining) {
            riskFactors.add("Quiz performance declining");
        }
        if (trends.get(ENGAGEMENT) == Trend.Declining) {
            warnings.add("Engagement levels dropping");
        }
        if (trends.get(STUDY_TIME) == Trend.Declining) {
            warnings.add("Study time decreasing");
        }

        List<Recommendation> interventions = new ArrayList<>();
        if (direction == Trend.Declining) {
            interventions.add(Recommendation.of("immediate", RecommendationPriority.High,
                    "Schedule Review Session",
                    "Schedule an immediate review of recent topics"));
        }
        if (trends.get(QUIZ) == Trend.Declining) {
            interventions.add(Recommendation.of("learning_strategy", RecommendationPriority.High,
                    "Adjust Study Strategy",
                    "Focus on active recall and practice testing"));
        }
        if (trends.get(ENGAGEMENT) == Trend.Declining) {
            interventions.add(Recommendation.of("motivation", RecommendationPriority.Medium,
                    "Re-engage with Material",
                    "Try different study methods or set new goals"));
        }

        return new TrajectoryForecast(direction, strength, riskFactors, warnings, interventions);
    }

    // 0-100: half from how much data backs the trends, half from how many of them point in a clear direction
    private static double predictionConfidence(Map<String, Trend> trends, int dataPoints) {
        if (trends.isEmpty()) {
            return 0;
        }

        long clearTrends = trends.values().stream()
                .filter(trend -> trend == Trend.Improving || trend == Trend.Declining)
                .count();

        double dataConfidence = Math.min(1.0, dataPoints / (double) HIGH_CONFIDENCE_DATA_POINTS);
        double trendConfidence = clearTrends / (double) trends.size();

        return Statistics.round((dataConfidence + trendConfidence) / 2 * 100, 1);
    }

    private static ActivityFeedback quizFeedback(RecentActivity activity, PerformanceSnapshot current) {
        double score = activity.quizScore() == null ? 0 : activity.quizScore();
        double difference = score - current.avgQuizScore();

        List<Recommendation> recommendations = new ArrayList<>();
        if (current.hasQuizData() && difference < -10) {
            recommendations.add(Recommendation.of("quiz_review", RecommendationPriority.High,
                    "Review the topics covered in this quiz",
                    "This score is well below your recent average",
                    "Consider additional practice before the next quiz"));
        } else if (current.hasQuizData() && difference > 10) {
            recommendations.add(Recommendation.of("challenge", RecommendationPriority.Low,
                    "Great improvement",
                    "Consider tackling more challenging content"));
        }

        String status = !current.hasQuizData() || score >= current.avgQuizScore() ? "good" : "below_average";
        String message = current.hasQuizData()
                ? String.format("Score %.1f against a recent average of %.1f", score, current.avgQuizScore())
                : String.format("Score %.1f, your first quiz in this period", score);

        return new ActivityFeedback(RecentActivity.QUIZ_COMPLETION, status, message, recommendations);
    }

    private static ActivityFeedback sessionFeedback(RecentActivity activity) {
        int minutes = activity.sessionMinutes() == null ? 0 : activity.sessionMinutes();

        String status;
        List<Recommendation> recommendations = new ArrayList<>();
        if (minutes < 15) {
            status = "too_short";
            recommendations.add(Recommendation.of("session_length", RecommendationPriority.Medium,
                    "Extend your sessions",
                    "Sessions under 15 minutes rarely leave time to consolidate material"));
        } else if (minutes > 120) {
            status = "too_long";
            recommendations.add(Recommendation.of("session_length", RecommendationPriority.Medium,
                    "Split long sessions",
                    "Focus drops in sessions over two hours; take breaks or split the session"));
        } else if (minutes >= 25 && minutes <= 90) {
            status = "optimal";
        } else {
            status = "acceptable";
        }

        return new ActivityFeedback(RecentActivity.STUDY_SESSION, status, minutes + " minute session", recommendations);
    }

    private static ActivityFeedback flashcardFeedback(RecentActivity activity) {
        int reviewed = activity.cardsReviewed() == null ? 0 : activity.cardsReviewed();
        int correct = activity.cardsCorrect() == null ? 0 : activity.cardsCorrect();
        double correctRate = reviewed == 0 ? 0 : (double) correct / reviewed;

        List<Recommendation> recommendations = new ArrayList<>();
        if (correctRate < 0.6) {
            recommendations.add(Recommendation.of("memory_improvement", RecommendationPriority.Medium,
                    "Increase review frequency for these cards",
                    "Less than 60% of the cards in this batch were recalled",
                    "Try creating memory associations"));
        }

        String status = correctRate >= 0.8 ? "good" : "needs_work";
        String volume = reviewed >= 10 ? "sufficient volume" : "low volume";

        return new ActivityFeedback(RecentActivity.FLASHCARD_REVIEW, status,
                String.format("%d of %d cards recalled, %s", correct, reviewed, volume), recommendations);
    }

    private AnalysisResult emptyResult() {
        Map<String, Double> components = new LinkedHashMap<>();
        for (String component : weights.keySet()) {
            components.put(component, 0.0);
        }

        Map<String, Trend> trends = new LinkedHashMap<>();
        for (String metric : List.of(QUIZ, RETENTION, COMPLETION, STUDY_TIME, ENGAGEMENT)) {
            trends.put(metric, Trend.InsufficientData);
        }

        return new AnalysisResult(
                0,
                PerformanceCategory.Poor,
                components,
                trends,
                Trend.InsufficientData,
                List.of(),
                List.of(),
                List.of(),
                LearningProfile.Developing,
                new TrajectoryForecast(Trend.InsufficientData, "stable", List.of(), List.of(), List.of()),
                0,
                null);
    }
}
