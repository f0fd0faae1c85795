package com.gt.studyplanner.plan;

import com.gt.studyplanner.analysis.PerformanceAnalyzer;
import com.gt.studyplanner.metrics.Statistics;
import com.gt.studyplanner.model.Course;
import com.gt.studyplanner.model.CourseTopic;
import com.gt.studyplanner.model.Difficulty;
import com.gt.studyplanner.model.DifficultyAdaptation;
import com.gt.studyplanner.model.GeneratedPlan;
import com.gt.studyplanner.model.LearningProfile;
import com.gt.studyplanner.model.PerformanceSnapshot;
import com.gt.studyplanner.model.PlanStatus;
import com.gt.studyplanner.model.PlanType;
import com.gt.studyplanner.model.StudyParameters;
import com.gt.studyplanner.model.StudyPlan;
import com.gt.studyplanner.model.StudyPreferences;
import com.gt.studyplanner.model.StudySession;
import com.gt.studyplanner.model.StudyTask;
import com.gt.studyplanner.model.TaskType;
import com.gt.studyplanner.model.TimeSlot;
import com.gt.studyplanner.timeslot.ProductivityProfile;
import com.gt.studyplanner.timeslot.TimeSlotOptimizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a multi-week study plan from a learner's current performance and productivity profile. Generation is
 * deterministic: the same inputs on the same day give the same sessions, with the same ids.
 */
@Component
public class StudyPlanGenerator {

    private static final Logger log = LoggerFactory.getLogger(StudyPlanGenerator.class);

    static final int READING_TASK_MINUTES = 30;
    static final int PRACTICE_TASK_MINUTES = 15;

    private static final int MIN_SESSION_LENGTH = 15;
    private static final int MAX_SESSION_LENGTH = 120;
    private static final double MIN_DAILY_HOURS = 0.5;
    private static final double MAX_DAILY_HOURS = 6.0;
    private static final int MAX_SESSIONS_PER_DAY = 4;
    private static final int WEEKDAYS = 5;
    private static final int ALL_DAYS = 7;

    private final PerformanceAnalyzer performanceAnalyzer;
    private final TimeSlotOptimizer timeSlotOptimizer;
    private final CognitiveLoadEstimator cognitiveLoadEstimator;
    private final double defaultDailyHours;
    private final int defaultWeeks;

    @Autowired
    public StudyPlanGenerator(PerformanceAnalyzer performanceAnalyzer,
                              TimeSlotOptimizer timeSlotOptimizer,
                              CognitiveLoadEstimator cognitiveLoadEstimator,
                              @Value("${planner.plan.defaultDailyHours:2.0}") double defaultDailyHours,
                              @Value("${planner.plan.defaultWeeks:12}") int defaultWeeks) {
        this.performanceAnalyzer = performanceAnalyzer;
        this.timeSlotOptimizer = timeSlotOptimizer;
        this.cognitiveLoadEstimator = cognitiveLoadEstimator;
        this.defaultDailyHours = defaultDailyHours;
        this.defaultWeeks = defaultWeeks;
    }

    public GeneratedPlan generate(String planId,
                                  String learnerId,
                                  Course course,
                                  PlanType planType,
                                  LocalDate targetDate,
                                  StudyPreferences preferences,
                                  PerformanceSnapshot snapshot,
                                  ProductivityProfile productivityProfile,
                                  Instant now) {
        StudyPreferences prefs = preferences != null ? preferences : StudyPreferences.defaults();
        if (planType == PlanType.ExamPrep && targetDate == null) {
            throw new IllegalArgumentException("An exam_prep plan needs a target date");
        }

        double performanceScore = performanceAnalyzer.overallScore(snapshot);
        LearningProfile learningProfile = performanceAnalyzer.learningProfile(snapshot);
        StudyParameters parameters = deriveParameters(performanceScore, snapshot, prefs, productivityProfile);

        LocalDate startDate = LocalDate.ofInstant(now, ZoneOffset.UTC);
        int totalWeeks;
        LocalDate endDate;
        if (targetDate != null && targetDate.isAfter(startDate)) {
            // a partial last week still counts as a week
            totalWeeks = (int) Math.max(1, (ChronoUnit.DAYS.between(startDate, targetDate) + 6) / 7);
            endDate = targetDate;
        } else {
            totalWeeks = Math.max(1, defaultWeeks);
            endDate = startDate.plusWeeks(totalWeeks).minusDays(1);
        }

        List<StudySession> sessions = buildSchedule(course, parameters, prefs, productivityProfile, startDate, endDate, totalWeeks);

        StudyPlan plan = new StudyPlan(
                planId,
                learnerId,
                course.id(),
                planType != null ? planType : PlanType.Weekly,
                PlanStatus.Active,
                startDate,
                endDate,
                totalWeeks,
                parameters,
                sessions,
                List.of(),
                List.of(),
                List.of(),
                snapshot,
                null,
                now,
                now,
                0);

        LocalDate estimatedCompletion = sessions.stream()
                .map(StudySession::date)
                .max(LocalDate::compareTo)
                .orElse(startDate);

        log.info("Generated plan {} for learner {} course {}: {} weeks, {} sessions, score {}",
                planId, learnerId, course.id(), totalWeeks, sessions.size(), performanceScore);

        return new GeneratedPlan(
                plan,
                recommendations(performanceScore, learningProfile, productivityProfile),
                learningProfile,
                cognitiveLoadEstimator.loadDistribution(sessions),
                estimatedCompletion);
    }

    /**
     * Weaker performance gets more, shorter sessions and more hours; strong performance gets fewer, longer
     * sessions. Preferences are applied on top and the result is kept within sane bounds.
     */
    public StudyParameters deriveParameters(double performanceScore,
                                            PerformanceSnapshot snapshot,
                                            StudyPreferences preferences,
                                            ProductivityProfile productivityProfile) {
        double hoursMultiplier;
        double lengthMultiplier;
        int sessionsPerDay;
        if (performanceScore < 60) {
            hoursMultiplier = 1.3;
            lengthMultiplier = 0.8;
            sessionsPerDay = 3;
        } else if (performanceScore > 85) {
            hoursMultiplier = 0.9;
            lengthMultiplier = 1.2;
            sessionsPerDay = 1;
        } else {
            hoursMultiplier = 1.0;
            lengthMultiplier = 1.0;
            sessionsPerDay = 2;
        }

        if (preferences.intensityMultiplier() != null && preferences.intensityMultiplier() > 0) {
            hoursMultiplier *= preferences.intensityMultiplier();
        }
        if (preferences.preferShortSessions()) {
            lengthMultiplier *= 0.8;
            sessionsPerDay = Math.min(MAX_SESSIONS_PER_DAY, sessionsPerDay + 1);
        }

        double baseHours = preferences.dailyHours() != null && preferences.dailyHours() > 0
                ? preferences.dailyHours()
                : defaultDailyHours;
        double dailyHours = Statistics.clamp(baseHours * hoursMultiplier, MIN_DAILY_HOURS, MAX_DAILY_HOURS);
        int sessionLength = (int) Statistics.clamp(productivityProfile.sessionLengthMinutes() * lengthMultiplier,
                MIN_SESSION_LENGTH, MAX_SESSION_LENGTH);

        DifficultyAdaptation difficultyAdaptation;
        if (performanceScore < 60) {
            difficultyAdaptation = DifficultyAdaptation.Easier;
        } else if (performanceScore > 85) {
            difficultyAdaptation = DifficultyAdaptation.Harder;
        } else {
            difficultyAdaptation = DifficultyAdaptation.Maintain;
        }

        int reviewFrequencyDays;
        if (snapshot.retentionRate() < 60) {
            reviewFrequencyDays = 1;
        } else if (snapshot.retentionRate() < 80) {
            reviewFrequencyDays = 2;
        } else {
            reviewFrequencyDays = 3;
        }

        int breakFrequency;
        if (sessionLength >= 60) {
            breakFrequency = 15;
        } else if (sessionLength >= 30) {
            breakFrequency = 25;
        } else {
            breakFrequency = 0;
        }

        return new StudyParameters(
                Math.round(dailyHours * 100) / 100.0,
                sessionLength,
                sessionsPerDay,
                preferences.includeWeekends() ? ALL_DAYS : WEEKDAYS,
                difficultyAdaptation,
                reviewFrequencyDays,
                breakFrequency);
    }

    private List<StudySession> buildSchedule(Course course,
                                             StudyParameters parameters,
                                             StudyPreferences preferences,
                                             ProductivityProfile productivityProfile,
                                             LocalDate startDate,
                                             LocalDate endDate,
                                             int totalWeeks) {
        List<CourseTopic> topics = course.topics() == null ? List.of() : course.topics();
        List<StudySession> sessions = new ArrayList<>();

        for (int week = 1; week <= totalWeeks; week++) {
            LocalDate weekStart = startDate.plusWeeks(week - 1);
            if (weekStart.isAfter(endDate)) {
                break;
            }

            Map<DayOfWeek, LocalDate> studyDates = new HashMap<>();
            List<DayOfWeek> studyDays = new ArrayList<>();
            for (int offset = 0; offset < 7; offset++) {
                LocalDate date = weekStart.plusDays(offset);
                if (!date.isAfter(endDate) && (preferences.includeWeekends() || !isWeekend(date))) {
                    studyDates.put(date.getDayOfWeek(), date);
                    studyDays.add(date.getDayOfWeek());
                }
            }
            if (studyDays.isEmpty()) {
                continue;
            }

            List<TimeSlot> slots = timeSlotOptimizer.optimalSlots(productivityProfile,
                    parameters.dailyHours() * studyDays.size(), studyDays,
                    parameters.sessionLengthMinutes(), parameters.sessionsPerDay());
            slots = new ArrayList<>(slots);
            slots.sort((a, b) -> {
                int byDate = studyDates.get(a.day()).compareTo(studyDates.get(b.day()));
                return byDate != 0 ? byDate : a.startTime().compareTo(b.startTime());
            });

            List<CourseTopic> weekTopics = partition(topics, week - 1, totalWeeks);
            for (int i = 0; i < slots.size(); i++) {
                TimeSlot slot = slots.get(i);
                List<CourseTopic> sessionTopics = partition(weekTopics, i, slots.size());

                sessions.add(cognitiveLoadEstimator.newSession(
                        "w" + week + "-s" + (i + 1),
                        week,
                        studyDates.get(slot.day()),
                        slot.startTime(),
                        slot.durationMinutes(),
                        sessionTopics.isEmpty() ? "Review" : sessionTopics.get(0).title(),
                        tasksFor(sessionTopics, slot.durationMinutes(), parameters.difficultyAdaptation())));
            }
        }

        return cognitiveLoadEstimator.flagOverloadedDays(sessions);
    }

    static List<StudyTask> tasksFor(List<CourseTopic> topics, int sessionMinutes, DifficultyAdaptation difficultyAdaptation) {
        if (topics.isEmpty()) {
            return List.of(new StudyTask(null, "Review previous material", TaskType.Review, Difficulty.Medium, sessionMinutes, false));
        }

        List<StudyTask> tasks = new ArrayList<>();
        for (CourseTopic topic : topics) {
            Difficulty difficulty = topic.difficulty() != null ? topic.difficulty() : Difficulty.Medium;
            tasks.add(new StudyTask(topic.id(), "Read: " + topic.title(), TaskType.Reading, difficulty,
                    READING_TASK_MINUTES, false));
            tasks.add(new StudyTask(topic.id(), "Practice exercises for " + topic.title(), TaskType.Practice,
                    shift(difficulty, difficultyAdaptation), PRACTICE_TASK_MINUTES, true));
        }
        return tasks;
    }

    // Practice difficulty follows the plan's difficulty adaptation, one level at most
    static Difficulty shift(Difficulty difficulty, DifficultyAdaptation difficultyAdaptation) {
        if (difficultyAdaptation == DifficultyAdaptation.Easier) {
            return difficulty == Difficulty.Hard ? Difficulty.Medium : Difficulty.Easy;
        } else if (difficultyAdaptation == DifficultyAdaptation.Harder) {
            return difficulty == Difficulty.Easy ? Difficulty.Medium : Difficulty.Hard;
        }
        return difficulty;
    }

    // index-th of count even, contiguous parts of items
    static <T> List<T> partition(List<T> items, int index, int count) {
        if (count <= 0 || items.isEmpty()) {
            return List.of();
        }

        int from = (int) ((long) items.size() * index / count);
        int to = (int) ((long) items.size() * (index + 1) / count);
        return items.subList(from, to);
    }

    private static List<String> recommendations(double performanceScore,
                                                LearningProfile learningProfile,
                                                ProductivityProfile productivityProfile) {
        List<String> recommendations = new ArrayList<>();

        if (performanceScore < 70) {
            recommendations.add("Consider scheduling shorter, more frequent study sessions");
            recommendations.add("Focus on review and reinforcement activities");
        }

        if (learningProfile == LearningProfile.HighPerformer) {
            recommendations.add("Challenge yourself with advanced practice problems");
            recommendations.add("Consider peer tutoring to reinforce learning");
        }

        recommendations.add("Schedule your most challenging topics around " + productivityProfile.peakHour() + ":00");

        return recommendations;
    }

    private static boolean isWeekend(LocalDate date) {
        return date.getDayOfWeek() == DayOfWeek.SATURDAY || date.getDayOfWeek() == DayOfWeek.SUNDAY;
    }
}
