package com.gt.studyplanner.metrics;

import com.gt.studyplanner.history.LearnerHistory;
import com.gt.studyplanner.history.PerformanceHistoryDao;
import com.gt.studyplanner.model.FlashcardReview;
import com.gt.studyplanner.model.PerformanceSnapshot;
import com.gt.studyplanner.model.QuizAttempt;
import com.gt.studyplanner.model.SessionRecord;
import com.gt.studyplanner.model.SessionStatus;
import com.gt.studyplanner.model.TopicProgress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reduces a learner's raw history into {@link PerformanceSnapshot}s. All reads go through
 * {@link PerformanceHistoryDao}; everything after the read is plain arithmetic over the returned records.
 */
@Component
public class MetricsAggregator {

    private static final Logger log = LoggerFactory.getLogger(MetricsAggregator.class);

    public static final int SERIES_STEP_DAYS = 7;

    private static final int MASTERED_CARD_QUALITY = 4;
    private static final int MASTERED_CARD_REVIEWS = 3;
    private static final int STREAK_NORMALIZATION_DAYS = 30;
    private static final double MAX_SESSIONS_PER_DAY = 3.0;

    private final PerformanceHistoryDao performanceHistoryDao;

    @Autowired
    public MetricsAggregator(PerformanceHistoryDao performanceHistoryDao) {
        this.performanceHistoryDao = performanceHistoryDao;
    }

    public PerformanceSnapshot aggregate(String learnerId, Optional<String> courseId, int windowDays, Instant now) {
        int window = Math.max(1, windowDays);
        LearnerHistory history = loadHistory(learnerId, courseId, now.minus(Duration.ofDays(window)));

        return summarize(learnerId, courseId.orElse(null), window, now, history);
    }

    /**
     * Builds points snapshots of the same window length whose windows end one week apart, oldest first. The last
     * snapshot covers the window ending at now. History is read once for the whole span.
     */
    public List<PerformanceSnapshot> aggregateSeries(String learnerId, Optional<String> courseId, int windowDays, int points, Instant now) {
        int window = Math.max(1, windowDays);
        int count = Math.max(1, points);
        Instant earliestStart = now.minus(Duration.ofDays(window + (long) (count - 1) * SERIES_STEP_DAYS));

        LearnerHistory history = loadHistory(learnerId, courseId, earliestStart);

        List<PerformanceSnapshot> series = new ArrayList<>(count);
        for (int i = count - 1; i >= 0; i--) {
            Instant windowEnd = now.minus(Duration.ofDays((long) i * SERIES_STEP_DAYS));
            series.add(summarize(learnerId, courseId.orElse(null), window, windowEnd, history));
        }

        return series;
    }

    public LearnerHistory loadHistory(String learnerId, Optional<String> courseId, Instant since) {
        LearnerHistory history = new LearnerHistory(
                performanceHistoryDao.fetchQuizAttempts(learnerId, courseId, since),
                performanceHistoryDao.fetchStudySessions(learnerId, courseId, since),
                performanceHistoryDao.fetchFlashcardReviews(learnerId, courseId, since),
                performanceHistoryDao.fetchLearningProgress(learnerId, courseId));

        log.debug("Loaded history for learner {}: {} quiz attempts, {} sessions, {} reviews, {} topics",
                learnerId, history.quizAttempts().size(), history.sessions().size(), history.reviews().size(), history.progress().size());

        return history;
    }

    /**
     * Computes the snapshot for the window (windowEnd - windowDays, windowEnd] from already loaded history. Records
     * outside the window are ignored.
     */
    public PerformanceSnapshot summarize(String learnerId, String courseId, int windowDays, Instant windowEnd, LearnerHistory history) {
        Instant windowStart = windowEnd.minus(Duration.ofDays(windowDays));

        List<QuizAttempt> quizAttempts = history.quizAttempts().stream()
                .filter(attempt -> inWindow(attempt.startedAt(), windowStart, windowEnd))
                .sorted(Comparator.comparing(QuizAttempt::startedAt))
                .toList();
        List<SessionRecord> sessions = history.sessions().stream()
                .filter(session -> inWindow(session.effectiveStart(), windowStart, windowEnd))
                .toList();
        List<FlashcardReview> reviews = history.reviews().stream()
                .filter(review -> inWindow(review.createdAt(), windowStart, windowEnd))
                .sorted(Comparator.comparing(FlashcardReview::createdAt))
                .toList();
        List<TopicProgress> progress = history.progress().stream()
                .filter(entry -> entry.updatedAt() == null || !entry.updatedAt().isAfter(windowEnd))
                .toList();

        List<Double> quizScores = quizAttempts.stream().map(QuizAttempt::score).toList();

        List<SessionRecord> completedSessions = sessions.stream()
                .filter(session -> session.status() == SessionStatus.Completed)
                .toList();
        double completionRate = sessions.isEmpty() ? 0 : completedSessions.size() * 100.0 / sessions.size();
        int studyStreak = studyStreak(completedSessions, windowEnd);

        long successfulReviews = reviews.stream().filter(FlashcardReview::successful).count();
        double retentionRate = reviews.isEmpty() ? 0 : successfulReviews * 100.0 / reviews.size();

        long masteredInWindow = progress.stream()
                .filter(entry -> entry.mastered() && inWindow(entry.updatedAt(), windowStart, windowEnd))
                .count();

        return new PerformanceSnapshot(
                learnerId,
                courseId,
                windowDays,
                windowEnd,

                quizAttempts.size(),
                Statistics.mean(quizScores),
                Statistics.consistency(quizScores, true),
                quizScores,
                scoreByDifficulty(quizAttempts),

                sessions.size(),
                completedSessions.size(),
                completionRate,
                completedSessions.stream().mapToDouble(session -> session.actualDuration().toMinutes()).sum(),
                averageProductivity(sessions),
                studyStreak,

                reviews.size(),
                retentionRate,
                cardsMastered(reviews),
                reviews.stream().mapToDouble(FlashcardReview::responseTimeSeconds).average().orElse(0),

                progress.size(),
                (int) progress.stream().filter(TopicProgress::mastered).count(),
                progress.stream().mapToInt(TopicProgress::masteryLevel).average().orElse(0),
                masteredInWindow * 7.0 / windowDays,

                studyConsistency(completedSessions, windowDays, windowEnd),
                engagementScore(sessions.size(), completionRate, studyStreak, windowDays));
    }

    private static boolean inWindow(Instant instant, Instant windowStart, Instant windowEnd) {
        return instant != null && instant.isAfter(windowStart) && !instant.isAfter(windowEnd);
    }

    private static Map<String, Double> scoreByDifficulty(List<QuizAttempt> quizAttempts) {
        Map<String, List<Double>> scores = new LinkedHashMap<>();
        for (QuizAttempt attempt : quizAttempts) {
            if (attempt.quizDifficulty() != null) {
                scores.computeIfAbsent(attempt.quizDifficulty().getWireName(), key -> new ArrayList<>()).add(attempt.score());
            }
        }

        Map<String, Double> averages = new LinkedHashMap<>();
        for (Map.Entry<String, List<Double>> entry : scores.entrySet()) {
            averages.put(entry.getKey(), Statistics.mean(entry.getValue()));
        }
        return averages;
    }

    private static double averageProductivity(List<SessionRecord> sessions) {
        return sessions.stream()
                .filter(session -> session.productivityRating() != null)
                .mapToInt(SessionRecord::productivityRating)
                .average()
                .orElse(0);
    }

    // Consecutive days with a completed session, counting back from the window's last day. A streak that ended
    // yesterday is still running.
    static int studyStreak(List<SessionRecord> completedSessions, Instant windowEnd) {
        Set<LocalDate> studyDays = completedSessions.stream()
                .map(session -> LocalDate.ofInstant(session.effectiveStart(), ZoneOffset.UTC))
                .collect(Collectors.toCollection(HashSet::new));

        LocalDate day = LocalDate.ofInstant(windowEnd, ZoneOffset.UTC);
        if (!studyDays.contains(day)) {
            day = day.minusDays(1);
        }

        int streak = 0;
        while (studyDays.contains(day)) {
            streak++;
            day = day.minusDays(1);
        }
        return streak;
    }

    // A card counts as mastered once its three most recent reviews were all recalled easily
    private static int cardsMastered(List<FlashcardReview> chronologicalReviews) {
        Map<String, List<Integer>> qualitiesByCard = new HashMap<>();
        for (FlashcardReview review : chronologicalReviews) {
            qualitiesByCard.computeIfAbsent(review.cardId(), key -> new ArrayList<>()).add(review.qualityResponse());
        }

        int mastered = 0;
        for (List<Integer> qualities : qualitiesByCard.values()) {
            if (qualities.size() >= MASTERED_CARD_REVIEWS
                    && qualities.subList(qualities.size() - MASTERED_CARD_REVIEWS, qualities.size())
                                .stream().allMatch(quality -> quality >= MASTERED_CARD_QUALITY)) {
                mastered++;
            }
        }
        return mastered;
    }

    // Consistency of the number of completed sessions per day, over every day of the window
    private static double studyConsistency(List<SessionRecord> completedSessions, int windowDays, Instant windowEnd) {
        if (windowDays < 7) {
            return 0;
        }

        LocalDate lastDay = LocalDate.ofInstant(windowEnd, ZoneOffset.UTC);
        LocalDate firstDay = lastDay.minusDays(windowDays - 1);

        Map<LocalDate, Double> sessionsPerDay = new HashMap<>();
        for (SessionRecord session : completedSessions) {
            LocalDate day = LocalDate.ofInstant(session.effectiveStart(), ZoneOffset.UTC);
            if (!day.isBefore(firstDay) && !day.isAfter(lastDay)) {
                sessionsPerDay.merge(day, 1.0, Double::sum);
            }
        }

        List<Double> dailyCounts = new ArrayList<>(windowDays);
        for (LocalDate day = firstDay; !day.isAfter(lastDay); day = day.plusDays(1)) {
            dailyCounts.add(sessionsPerDay.getOrDefault(day, 0.0));
        }

        return Statistics.consistency(dailyCounts, false);
    }

    /**
     * Engagement on a 0-100 scale: session frequency (saturating at three sessions a day) weighted 30%,
     * completion rate 40% and the current streak (saturating at 30 days) 30%.
     */
    static double engagementScore(int sessionCount, double completionRate, int studyStreak, int windowDays) {
        if (sessionCount == 0) {
            return 0;
        }

        double frequencyScore = Math.min(1.0, sessionCount / (double) windowDays / MAX_SESSIONS_PER_DAY) * 100;
        double streakScore = Math.min(1.0, studyStreak / (double) STREAK_NORMALIZATION_DAYS) * 100;

        return Math.min(100, frequencyScore * 0.3 + completionRate * 0.4 + streakScore * 0.3);
    }
}
