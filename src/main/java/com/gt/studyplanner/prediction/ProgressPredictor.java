package com.gt.studyplanner.prediction;

import com.gt.studyplanner.analysis.TrendAnalyzer;
import com.gt.studyplanner.course.CourseDao;
import com.gt.studyplanner.exception.NotFoundException;
import com.gt.studyplanner.history.PerformanceHistoryDao;
import com.gt.studyplanner.metrics.SnapshotService;
import com.gt.studyplanner.metrics.Statistics;
import com.gt.studyplanner.model.CompletionPrediction;
import com.gt.studyplanner.model.CompletionScenario;
import com.gt.studyplanner.model.Course;
import com.gt.studyplanner.model.Feasibility;
import com.gt.studyplanner.model.Milestone;
import com.gt.studyplanner.model.PerformanceSnapshot;
import com.gt.studyplanner.model.RiskLevel;
import com.gt.studyplanner.model.ScheduleFeasibility;
import com.gt.studyplanner.model.TopicProgress;
import com.gt.studyplanner.model.Trend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Projects when a learner will reach a target mastery level across a course, and whether a given target date is
 * realistic.
 */
@Component
public class ProgressPredictor {

    private static final Logger log = LoggerFactory.getLogger(ProgressPredictor.class);

    static final double MAX_CONFIDENCE_WITHOUT_HISTORY = 0.29;
    static final int VELOCITY_TREND_WEEKS = 4;

    private static final double WEEKS_PER_YEAR = 52;
    private static final double MIN_TIME_FACTOR = 0.3;
    private static final int FULL_DATA_TOPICS = 10;
    private static final int[] MILESTONE_PERCENTAGES = {25, 50, 75, 100};

    private static final double NOT_STARTED_HOURS = 3;
    private static final double IN_PROGRESS_HOURS = 1.5;
    private static final double MASTERED_REVIEW_HOURS = 0.5;

    private final CourseDao courseDao;
    private final PerformanceHistoryDao performanceHistoryDao;
    private final SnapshotService snapshotService;
    private final TrendAnalyzer trendAnalyzer;
    private final double defaultTopicsPerWeek;
    private final int velocityWindowDays;

    @Autowired
    public ProgressPredictor(CourseDao courseDao,
                             PerformanceHistoryDao performanceHistoryDao,
                             SnapshotService snapshotService,
                             TrendAnalyzer trendAnalyzer,
                             @Value("${planner.prediction.defaultTopicsPerWeek:1.0}") double defaultTopicsPerWeek,
                             @Value("${planner.prediction.velocityWindowDays:30}") int velocityWindowDays) {
        this.courseDao = courseDao;
        this.performanceHistoryDao = performanceHistoryDao;
        this.snapshotService = snapshotService;
        this.trendAnalyzer = trendAnalyzer;
        this.defaultTopicsPerWeek = defaultTopicsPerWeek;
        this.velocityWindowDays = velocityWindowDays;
    }

    public CompletionPrediction predictCompletion(String learnerId, String courseId, int targetMasteryLevel, Instant now) {
        Course course = loadCourse(learnerId, courseId);

        List<TopicProgress> progress = performanceHistoryDao.fetchLearningProgress(learnerId, Optional.of(courseId));
        PerformanceSnapshot snapshot = snapshotService.getSnapshot(learnerId, Optional.of(courseId), velocityWindowDays, now);

        CompletionPrediction prediction = predict(learnerId, course, progress, snapshot, targetMasteryLevel, now);
        log.debug("Predicted completion for learner {} course {}: {} topics left at {} per week",
                learnerId, courseId, prediction.topicsRemaining(), prediction.velocity());

        return prediction;
    }

    public ScheduleFeasibility assessScheduleFeasibility(String learnerId, String courseId, LocalDate targetDate,
                                                         double weeklyHours, Instant now) {
        if (targetDate == null || weeklyHours <= 0) {
            throw new IllegalArgumentException("A target date and a positive number of weekly hours are required");
        }

        Course course = loadCourse(learnerId, courseId);
        List<TopicProgress> progress = performanceHistoryDao.fetchLearningProgress(learnerId, Optional.of(courseId));

        return feasibility(totalTopics(course, progress), progress, targetDate, weeklyHours, LocalDate.ofInstant(now, ZoneOffset.UTC));
    }

    CompletionPrediction predict(String learnerId, Course course, List<TopicProgress> progress,
                                 PerformanceSnapshot snapshot, int targetMasteryLevel, Instant now) {
        int target = Math.max(1, Math.min(5, targetMasteryLevel));
        LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);

        int totalTopics = totalTopics(course, progress);
        int achieved = (int) progress.stream().filter(topic -> topic.masteryLevel() >= target).count();
        int remaining = Math.max(0, totalTopics - achieved);

        boolean anchoredOnDefaults = progress.isEmpty();
        double velocity = anchoredOnDefaults ? defaultTopicsPerWeek : snapshot.learningVelocity();
        double consistency = snapshot.consistencyScore();
        Trend velocityTrend = anchoredOnDefaults ? Trend.InsufficientData : velocityTrend(progress, now);

        double weeksRemaining;
        double probability;
        if (remaining == 0) {
            weeksRemaining = 0;
            probability = completionProbability(0, consistency);
        } else if (velocity <= 0) {
            weeksRemaining = Double.POSITIVE_INFINITY;
            probability = 0;
        } else {
            weeksRemaining = remaining / velocity;
            probability = completionProbability(weeksRemaining, consistency);
        }

        double confidence = (Math.min(1.0, progress.size() / (double) FULL_DATA_TOPICS)
                + consistency / 100
                + trendFactor(velocityTrend)) / 3;
        if (anchoredOnDefaults) {
            confidence = Math.min(confidence, MAX_CONFIDENCE_WITHOUT_HISTORY);
        }

        return new CompletionPrediction(
                learnerId,
                course.id(),
                target,
                totalTopics,
                remaining,
                Statistics.round(velocity, 2),
                Double.isInfinite(weeksRemaining) ? weeksRemaining : Statistics.round(weeksRemaining, 1),
                dateAfter(today, weeksRemaining),
                Statistics.round(probability, 2),
                Statistics.round(confidence, 2),
                velocityTrend,
                riskOfFallingBehind(probability),
                anchoredOnDefaults,
                milestones(remaining, velocity, today),
                scenarios(remaining, velocity, today),
                recommendations(weeksRemaining, velocityTrend, probability));
    }

    ScheduleFeasibility feasibility(int totalTopics, List<TopicProgress> progress, LocalDate targetDate,
                                    double weeklyHours, LocalDate today) {
        double remainingWork = remainingWorkHours(totalTopics, progress);

        double weeksAvailable = ChronoUnit.DAYS.between(today, targetDate) / 7.0;
        double availableHours = Math.max(0, weeksAvailable * weeklyHours);

        double ratio;
        if (remainingWork <= 0) {
            ratio = 1.0;
        } else {
            ratio = Math.min(1.0, availableHours / remainingWork);
        }
        double requiredDailyHours = weeksAvailable > 0 ? remainingWork / weeksAvailable / 7 : remainingWork;

        Feasibility overall;
        if (ratio >= 1.0) {
            overall = Feasibility.High;
        } else if (ratio >= 0.8) {
            overall = Feasibility.Medium;
        } else if (ratio >= 0.6) {
            overall = Feasibility.Low;
        } else {
            overall = Feasibility.VeryLow;
        }

        Feasibility daily;
        if (requiredDailyHours <= 2) {
            daily = Feasibility.High;
        } else if (requiredDailyHours <= 4) {
            daily = Feasibility.Medium;
        } else if (requiredDailyHours <= 6) {
            daily = Feasibility.Low;
        } else {
            daily = Feasibility.VeryLow;
        }

        double successProbability = ratio * 0.8;
        if (daily == Feasibility.Low || daily == Feasibility.VeryLow) {
            successProbability *= 0.7;
        }

        List<String> recommendations = new ArrayList<>();
        if (overall == Feasibility.Low || overall == Feasibility.VeryLow) {
            recommendations.add("Consider extending your target completion date");
            recommendations.add("Focus on high-priority topics first");
        }
        if (daily == Feasibility.Low || daily == Feasibility.VeryLow) {
            recommendations.add("Reduce daily study hours to maintain consistency");
            recommendations.add("Consider spreading study over more days");
        }
        if (ratio < 1.0) {
            recommendations.add("Prioritize core concepts and skip optional material");
        }

        return new ScheduleFeasibility(
                targetDate,
                Statistics.round(remainingWork, 1),
                Statistics.round(availableHours, 1),
                Statistics.round(ratio, 2),
                overall,
                Statistics.round(requiredDailyHours, 1),
                daily,
                Statistics.round(successProbability, 2),
                recommendations);
    }

    // Topics without a progress entry still need full study; mastered topics only need a review
    static double remainingWorkHours(int totalTopics, List<TopicProgress> progress) {
        int mastered = 0;
        int inProgress = 0;
        int notStarted = Math.max(0, totalTopics - progress.size());
        for (TopicProgress topic : progress) {
            if (topic.mastered()) {
                mastered++;
            } else if (topic.notStarted()) {
                notStarted++;
            } else {
                inProgress++;
            }
        }

        return notStarted * NOT_STARTED_HOURS + inProgress * IN_PROGRESS_HOURS + mastered * MASTERED_REVIEW_HOURS;
    }

    // Topics mastered per week over the last few weeks, oldest week first
    private Trend velocityTrend(List<TopicProgress> progress, Instant now) {
        List<Double> weeklyMastered = new ArrayList<>(VELOCITY_TREND_WEEKS);
        for (int week = VELOCITY_TREND_WEEKS - 1; week >= 0; week--) {
            Instant weekEnd = now.minus(Duration.ofDays(7L * week));
            Instant weekStart = weekEnd.minus(Duration.ofDays(7));
            long mastered = progress.stream()
                    .filter(TopicProgress::mastered)
                    .filter(topic -> topic.updatedAt() != null && topic.updatedAt().isAfter(weekStart) && !topic.updatedAt().isAfter(weekEnd))
                    .count();
            weeklyMastered.add((double) mastered);
        }
        return trendAnalyzer.trend(weeklyMastered);
    }

    private static int totalTopics(Course course, List<TopicProgress> progress) {
        int courseTopics = course.topics() == null ? 0 : course.topics().size();
        return Math.max(courseTopics, progress.size());
    }

    // Decays from 1.0 now to 0.3 at a year out, averaged with consistency
    static double completionProbability(double weeksRemaining, double consistency) {
        double timeFactor = Math.max(MIN_TIME_FACTOR, 1.0 - weeksRemaining / WEEKS_PER_YEAR);
        return (timeFactor + consistency / 100) / 2;
    }

    static double trendFactor(Trend trend) {
        switch (trend) {
            case Improving:
                return 0.8;
            case Stable:
                return 0.9;
            case Declining:
                return 0.6;
            case InsufficientData:
            default:
                return 0.3;
        }
    }

    static RiskLevel riskOfFallingBehind(double probability) {
        if (probability < 0.5) {
            return RiskLevel.High;
        } else if (probability < 0.7) {
            return RiskLevel.Medium;
        }
        return RiskLevel.Low;
    }

    private static List<Milestone> milestones(int remaining, double velocity, LocalDate today) {
        List<Milestone> milestones = new ArrayList<>();
        if (remaining == 0) {
            return milestones;
        }

        for (int percentage : MILESTONE_PERCENTAGES) {
            int topics = remaining * percentage / 100;
            double weeks = velocity > 0 ? topics / velocity : Double.POSITIVE_INFINITY;
            double confidence = Double.isInfinite(weeks) ? 0.1 : Math.max(0.1, 0.9 - weeks / WEEKS_PER_YEAR);

            milestones.add(new Milestone(percentage, topics,
                    Double.isInfinite(weeks) ? weeks : Statistics.round(weeks, 1),
                    dateAfter(today, weeks),
                    Statistics.round(confidence, 2)));
        }
        return milestones;
    }

    private static List<CompletionScenario> scenarios(int remaining, double velocity, LocalDate today) {
        List<CompletionScenario> scenarios = new ArrayList<>();
        scenarios.add(scenario("optimistic", remaining, velocity * 1.2, 0.3, today));
        scenarios.add(scenario("realistic", remaining, velocity, 0.5, today));
        scenarios.add(scenario("pessimistic", remaining, velocity * 0.8, 0.2, today));
        return scenarios;
    }

    private static CompletionScenario scenario(String name, int remaining, double velocity, double probability, LocalDate today) {
        double weeks = velocity > 0 ? Math.max(1, remaining / velocity) : Double.POSITIVE_INFINITY;
        return new CompletionScenario(name, Statistics.round(velocity, 2),
                Double.isInfinite(weeks) ? weeks : Statistics.round(weeks, 1),
                dateAfter(today, weeks), probability);
    }

    private static List<String> recommendations(double weeksRemaining, Trend velocityTrend, double probability) {
        List<String> recommendations = new ArrayList<>();

        if (weeksRemaining > 26) {
            recommendations.add("Consider increasing study intensity to complete sooner");
        }

        if (velocityTrend == Trend.Declining) {
            recommendations.add("Your learning pace is slowing, consider reviewing study methods");
        } else if (velocityTrend == Trend.Improving) {
            recommendations.add("Great progress! You might be able to complete ahead of schedule");
        }

        if (probability < 0.7) {
            recommendations.add("Consider adjusting your study plan to improve completion chances");
        }

        return recommendations;
    }

    private static LocalDate dateAfter(LocalDate today, double weeks) {
        if (Double.isInfinite(weeks) || Double.isNaN(weeks)) {
            return null;
        }
        return today.plusDays((long) Math.ceil(weeks * 7));
    }

    private Course loadCourse(String learnerId, String courseId) {
        if (!courseDao.learnerExists(learnerId)) {
            throw new NotFoundException("Learner " + learnerId + " does not exist");
        }
        return courseDao.loadCourse(courseId)
                .orElseThrow(() -> new NotFoundException("Course " + courseId + " does not exist"));
    }
}
