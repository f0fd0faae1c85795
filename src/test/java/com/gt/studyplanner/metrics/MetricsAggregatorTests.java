package com.gt.studyplanner.metrics;

import com.gt.studyplanner.history.PerformanceHistoryDao;
import com.gt.studyplanner.model.Difficulty;
import com.gt.studyplanner.model.FlashcardReview;
import com.gt.studyplanner.model.PerformanceSnapshot;
import com.gt.studyplanner.model.QuizAttempt;
import com.gt.studyplanner.model.SessionRecord;
import com.gt.studyplanner.model.SessionStatus;
import com.gt.studyplanner.model.TopicProgress;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(SpringExtension.class)
public class MetricsAggregatorTests {

    private static final String TEST_LEARNER_ID = "learner-1";
    private static final String TEST_COURSE_ID = "course-1";
    private static final Instant TEST_NOW = Instant.parse("2024-03-04T10:00:00Z");

    @Mock private PerformanceHistoryDao performanceHistoryDao;

    private MetricsAggregator metricsAggregator;

    @BeforeEach
    public void before() {
        metricsAggregator = new MetricsAggregator(performanceHistoryDao);

        when(performanceHistoryDao.fetchQuizAttempts(anyString(), any(), any(Instant.class))).thenReturn(List.of());
        when(performanceHistoryDao.fetchStudySessions(anyString(), any(), any(Instant.class))).thenReturn(List.of());
        when(performanceHistoryDao.fetchFlashcardReviews(anyString(), any(), any(Instant.class))).thenReturn(List.of());
        when(performanceHistoryDao.fetchLearningProgress(anyString(), any())).thenReturn(List.of());
    }

    @Test
    public void testAggregateWithoutHistory() {
        PerformanceSnapshot snapshot = metricsAggregator.aggregate(TEST_LEARNER_ID, Optional.of(TEST_COURSE_ID), 30, TEST_NOW);

        assertTrue(snapshot.isEmpty());
        assertEquals(TEST_LEARNER_ID, snapshot.learnerId());
        assertEquals(TEST_COURSE_ID, snapshot.courseId());
        assertEquals(0, snapshot.avgQuizScore());
        assertEquals(0, snapshot.completionRate());
        assertEquals(0, snapshot.retentionRate());
        assertEquals(0, snapshot.learningVelocity());
        assertEquals(0, snapshot.consistencyScore());
        assertEquals(0, snapshot.engagementScore());
        assertEquals(0, snapshot.studyStreak());
    }

    @Test
    public void testAggregate() {
        when(performanceHistoryDao.fetchQuizAttempts(eq(TEST_LEARNER_ID), eq(Optional.of(TEST_COURSE_ID)), any(Instant.class))).thenReturn(List.of(
                new QuizAttempt("quiz-2", 90, daysAgo(1), Difficulty.Hard),
                new QuizAttempt("quiz-1", 80, daysAgo(2), Difficulty.Medium),
                new QuizAttempt("quiz-0", 20, daysAgo(40), Difficulty.Easy)));
        when(performanceHistoryDao.fetchStudySessions(eq(TEST_LEARNER_ID), eq(Optional.of(TEST_COURSE_ID)), any(Instant.class))).thenReturn(List.of(
                completedSession(Instant.parse("2024-03-04T08:00:00Z"), 45, 3),
                completedSession(daysAgo(1), 60, 4),
                completedSession(daysAgo(2), 30, 2),
                new SessionRecord(daysAgo(3), daysAgo(3).plus(Duration.ofHours(1)), null, null, SessionStatus.Skipped, null)));
        when(performanceHistoryDao.fetchFlashcardReviews(eq(TEST_LEARNER_ID), eq(Optional.of(TEST_COURSE_ID)), any(Instant.class))).thenReturn(List.of(
                new FlashcardReview("card-1", 5, 4, daysAgo(1)),
                new FlashcardReview("card-1", 4, 6, daysAgo(2)),
                new FlashcardReview("card-2", 2, 8, daysAgo(3)),
                new FlashcardReview("card-2", 3, 2, daysAgo(4))));
        when(performanceHistoryDao.fetchLearningProgress(TEST_LEARNER_ID, Optional.of(TEST_COURSE_ID))).thenReturn(List.of(
                new TopicProgress("topic-1", 4, 100, daysAgo(5)),
                new TopicProgress("topic-2", 2, 40, daysAgo(1))));

        PerformanceSnapshot snapshot = metricsAggregator.aggregate(TEST_LEARNER_ID, Optional.of(TEST_COURSE_ID), 30, TEST_NOW);

        assertEquals(2, snapshot.quizAttempts());
        assertEquals(85, snapshot.avgQuizScore(), 0.0001);
        assertEquals(List.of(80.0, 90.0), snapshot.quizScores());
        assertEquals(80, snapshot.quizScoreByDifficulty().get("medium"), 0.0001);
        assertEquals(90, snapshot.quizScoreByDifficulty().get("hard"), 0.0001);

        assertEquals(4, snapshot.totalSessions());
        assertEquals(3, snapshot.completedSessions());
        assertEquals(75, snapshot.completionRate(), 0.0001);
        assertEquals(135, snapshot.totalStudyMinutes(), 0.0001);
        assertEquals(3, snapshot.averageProductivity(), 0.0001);
        assertEquals(3, snapshot.studyStreak());

        assertEquals(4, snapshot.totalReviews());
        assertEquals(75, snapshot.retentionRate(), 0.0001);
        assertEquals(5, snapshot.averageResponseSeconds(), 0.0001);

        assertEquals(2, snapshot.topicsStarted());
        assertEquals(1, snapshot.topicsMastered());
        assertEquals(3, snapshot.averageMasteryLevel(), 0.0001);
        assertEquals(7.0 / 30, snapshot.learningVelocity(), 0.0001);

        // frequency 4 / 30 / 3 -> 4.44, completion 75, streak 3 / 30 -> 10
        assertEquals(4.4444 * 0.3 + 75 * 0.4 + 10 * 0.3, snapshot.engagementScore(), 0.01);
        assertTrue(snapshot.consistencyScore() >= 0 && snapshot.consistencyScore() <= 100);
    }

    @Test
    public void testAggregateSeries() {
        when(performanceHistoryDao.fetchQuizAttempts(anyString(), any(), any(Instant.class))).thenReturn(List.of(
                new QuizAttempt("quiz-3", 90, daysAgo(1), Difficulty.Medium),
                new QuizAttempt("quiz-2", 70, daysAgo(8), Difficulty.Medium),
                new QuizAttempt("quiz-1", 50, daysAgo(15), Difficulty.Medium)));

        List<PerformanceSnapshot> series = metricsAggregator.aggregateSeries(TEST_LEARNER_ID, Optional.empty(), 7, 3, TEST_NOW);

        assertEquals(3, series.size());
        assertEquals(List.of(50.0, 70.0, 90.0), series.stream().map(PerformanceSnapshot::avgQuizScore).toList());
        assertEquals(TEST_NOW, series.get(2).generatedAt());
        assertEquals(daysAgo(14), series.get(0).generatedAt());
        assertNull(series.get(0).courseId());

        verify(performanceHistoryDao, times(1)).fetchQuizAttempts(TEST_LEARNER_ID, Optional.empty(), daysAgo(21));
    }

    @Test
    public void testStudyStreak() {
        List<SessionRecord> sessions = List.of(
                completedSession(daysAgo(1), 30, null),
                completedSession(daysAgo(2), 30, null),
                completedSession(daysAgo(4), 30, null));

        // nothing today yet, the streak that ended yesterday still counts
        assertEquals(2, MetricsAggregator.studyStreak(sessions, TEST_NOW));
        assertEquals(0, MetricsAggregator.studyStreak(sessions, daysAgo(-3)));
    }

    @Test
    public void testEngagementScore() {
        assertEquals(0, MetricsAggregator.engagementScore(0, 0, 0, 30));
        assertEquals(100, MetricsAggregator.engagementScore(200, 100, 45, 30), 0.0001);
    }

    private static Instant daysAgo(int days) {
        return TEST_NOW.minus(Duration.ofDays(days));
    }

    private static SessionRecord completedSession(Instant start, int minutes, Integer rating) {
        Instant end = start.plus(Duration.ofMinutes(minutes));
        return new SessionRecord(start, end, start, end, SessionStatus.Completed, rating);
    }
}
