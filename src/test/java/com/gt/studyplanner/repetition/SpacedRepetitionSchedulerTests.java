package com.gt.studyplanner.repetition;

import com.gt.studyplanner.model.Difficulty;
import com.gt.studyplanner.model.Flashcard;
import com.gt.studyplanner.model.FlashcardReview;
import com.gt.studyplanner.model.ReviewItem;
import com.gt.studyplanner.model.ReviewState;
import com.gt.studyplanner.model.StudyLoad;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class SpacedRepetitionSchedulerTests {

    private static final String TEST_CARD_ID = "card-1";
    private static final Instant TEST_NOW = Instant.parse("2024-03-04T10:00:00Z");

    private SpacedRepetitionScheduler scheduler;

    @BeforeEach
    public void before() {
        scheduler = new SpacedRepetitionScheduler();
    }

    @Test
    public void testAdvanceFirstSuccessfulReview() {
        ReviewState next = scheduler.advance(ReviewState.initial(TEST_CARD_ID, TEST_NOW), 4, TEST_NOW);

        assertEquals(1, next.repetitionCount());
        assertEquals(1, next.intervalDays());
        // quality 4 is neutral for the ease factor
        assertEquals(2.5, next.easeFactor(), 0.0001);
        assertEquals(TEST_NOW.plus(Duration.ofDays(1)), next.nextDueAt());
        assertEquals(TEST_NOW, next.lastReviewedAt());
        assertEquals(1, next.totalReviews());
        assertEquals(1, next.successfulReviews());
    }

    @Test
    public void testAdvancePerfectReviewRaisesEase() {
        ReviewState next = scheduler.advance(ReviewState.initial(TEST_CARD_ID, TEST_NOW), 5, TEST_NOW);

        assertEquals(2.6, next.easeFactor(), 0.0001);
    }

    @Test
    public void testAdvanceFailureResets() {
        ReviewState state = new ReviewState(TEST_CARD_ID, 2.5, 6, 2, TEST_NOW, TEST_NOW.minus(Duration.ofDays(6)), 2, 2, 3);

        ReviewState next = scheduler.advance(state, 1, TEST_NOW);

        assertEquals(0, next.repetitionCount());
        assertEquals(1, next.intervalDays());
        assertEquals(2.3, next.easeFactor(), 0.0001);
        assertEquals(3, next.totalReviews());
        assertEquals(2, next.successfulReviews());
        assertEquals(3, next.version());
    }

    @Test
    public void testAdvanceFirstTwoIntervals() {
        for (double easeFactor : List.of(1.3, 2.5, 5.0)) {
            ReviewState state = new ReviewState(TEST_CARD_ID, easeFactor, 1, 0, TEST_NOW, null, 0, 0, 0);

            ReviewState first = scheduler.advance(state, 3, TEST_NOW);
            ReviewState second = scheduler.advance(first, 3, TEST_NOW);

            assertEquals(1, first.intervalDays());
            assertEquals(6, second.intervalDays());
        }
    }

    @Test
    public void testAdvanceGrowsIntervalByEase() {
        ReviewState state = new ReviewState(TEST_CARD_ID, 2.5, 6, 2, TEST_NOW, null, 2, 2, 0);

        ReviewState next = scheduler.advance(state, 5, TEST_NOW);

        assertEquals(15, next.intervalDays());
        assertEquals(3, next.repetitionCount());
    }

    @Test
    public void testAdvanceClampsQuality() {
        ReviewState initial = ReviewState.initial(TEST_CARD_ID, TEST_NOW);

        assertEquals(scheduler.advance(initial, 5, TEST_NOW), scheduler.advance(initial, 9, TEST_NOW));
        assertEquals(scheduler.advance(initial, 0, TEST_NOW), scheduler.advance(initial, -4, TEST_NOW));
    }

    @Test
    public void testAdvanceStaysInBounds() {
        Random random = new Random(42);

        for (int run = 0; run < 50; run++) {
            ReviewState state = ReviewState.initial(TEST_CARD_ID, TEST_NOW);
            for (int i = 0; i < 40; i++) {
                state = scheduler.advance(state, random.nextInt(6), TEST_NOW);

                assertTrue(state.easeFactor() >= SpacedRepetitionScheduler.MIN_EASE_FACTOR);
                assertTrue(state.easeFactor() <= SpacedRepetitionScheduler.MAX_EASE_FACTOR);
                assertTrue(state.intervalDays() >= 1);
            }
        }
    }

    @Test
    public void testAdvanceIsDeterministic() {
        ReviewState state = new ReviewState(TEST_CARD_ID, 2.1, 12, 4, TEST_NOW, null, 5, 4, 7);

        assertEquals(scheduler.advance(state, 3, TEST_NOW), scheduler.advance(state, 3, TEST_NOW));
    }

    @Test
    public void testAdjustIntervalForDifficulty() {
        assertEquals(12, scheduler.adjustIntervalForDifficulty(10, Difficulty.Easy));
        assertEquals(10, scheduler.adjustIntervalForDifficulty(10, Difficulty.Medium));
        assertEquals(8, scheduler.adjustIntervalForDifficulty(10, Difficulty.Hard));
        assertEquals(1, scheduler.adjustIntervalForDifficulty(1, Difficulty.Hard));
    }

    @Test
    public void testRetentionRate() {
        List<FlashcardReview> reviews = List.of(
                new FlashcardReview(TEST_CARD_ID, 5, 3, TEST_NOW.minus(Duration.ofDays(1))),
                new FlashcardReview(TEST_CARD_ID, 3, 3, TEST_NOW.minus(Duration.ofDays(2))),
                new FlashcardReview(TEST_CARD_ID, 1, 3, TEST_NOW.minus(Duration.ofDays(3))),
                new FlashcardReview(TEST_CARD_ID, 2, 3, TEST_NOW.minus(Duration.ofDays(4))),
                new FlashcardReview(TEST_CARD_ID, 1, 3, TEST_NOW.minus(Duration.ofDays(40))));

        assertEquals(0.5, scheduler.retentionRate(reviews, 30, TEST_NOW), 0.0001);
        assertEquals(0, scheduler.retentionRate(List.of(), 30, TEST_NOW));
    }

    @Test
    public void testPrioritize() {
        ReviewItem onTime = item("on-time", Difficulty.Easy, false, ReviewState.initial("on-time", TEST_NOW));
        ReviewItem starred = item("starred", Difficulty.Easy, true, ReviewState.initial("starred", TEST_NOW));
        ReviewItem overdue = item("overdue", Difficulty.Easy, false,
                new ReviewState("overdue", 2.5, 6, 2, TEST_NOW.minus(Duration.ofDays(3)), null, 2, 2, 2));
        ReviewItem hard = item("hard", Difficulty.Hard, false, ReviewState.initial("hard", TEST_NOW));

        List<ReviewItem> prioritized = scheduler.prioritize(List.of(onTime, hard, starred, overdue), TEST_NOW);

        assertEquals(List.of("overdue", "starred", "hard", "on-time"),
                prioritized.stream().map(i -> i.flashcard().id()).toList());
        assertEquals(30, prioritized.get(0).priority(), 0.0001);
        assertEquals(15, prioritized.get(1).priority(), 0.0001);
    }

    @Test
    public void testPrioritizeKeepsOrderOfEqualItems() {
        ReviewItem first = item("first", Difficulty.Medium, false, ReviewState.initial("first", TEST_NOW));
        ReviewItem second = item("second", Difficulty.Medium, false, ReviewState.initial("second", TEST_NOW));
        ReviewItem third = item("third", Difficulty.Medium, false, ReviewState.initial("third", TEST_NOW));

        List<ReviewItem> prioritized = scheduler.prioritize(List.of(first, second, third), TEST_NOW);

        assertEquals(List.of("first", "second", "third"), prioritized.stream().map(i -> i.flashcard().id()).toList());
    }

    @Test
    public void testStudyLoad() {
        ReviewItem newCard = item("new", Difficulty.Easy, false, ReviewState.initial("new", TEST_NOW));
        ReviewItem overdue = item("overdue", Difficulty.Hard, false,
                new ReviewState("overdue", 2.5, 6, 2, TEST_NOW.minus(Duration.ofDays(2)), null, 2, 2, 2));
        ReviewItem mastered = item("mastered", Difficulty.Medium, false,
                new ReviewState("mastered", 2.5, 30, 5, TEST_NOW.plus(Duration.ofDays(20)), null, 5, 5, 5));

        StudyLoad load = scheduler.studyLoad(List.of(newCard, overdue, mastered), TEST_NOW);

        assertEquals(3, load.totalCards());
        assertEquals(1, load.overdue());
        assertEquals(2, load.dueToday());
        assertEquals(2, load.dueThisWeek());
        assertEquals(1, load.difficultyDistribution().get("hard"));
        assertEquals(1, load.masteryDistribution().get("new"));
        assertEquals(1, load.masteryDistribution().get("reviewing"));
        assertEquals(1, load.masteryDistribution().get("mastered"));
        assertEquals(2, load.estimatedMinutes());
    }

    @Test
    public void testOptimalBatchSize() {
        assertEquals(20, scheduler.optimalBatchSize(20, 30));
        assertEquals(10, scheduler.optimalBatchSize(40, 5));
        assertEquals(50, scheduler.optimalBatchSize(200, 120));
        assertEquals(1, scheduler.optimalBatchSize(0, 30));
    }

    private static ReviewItem item(String cardId, Difficulty difficulty, boolean starred, ReviewState state) {
        return new ReviewItem(new Flashcard(cardId, "learner-1", "course-1", difficulty, starred), state, 0);
    }
}
