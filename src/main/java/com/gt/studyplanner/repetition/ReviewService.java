package com.gt.studyplanner.repetition;

import com.gt.studyplanner.exception.ConflictException;
import com.gt.studyplanner.exception.NotFoundException;
import com.gt.studyplanner.history.PerformanceHistoryDao;
import com.gt.studyplanner.model.Flashcard;
import com.gt.studyplanner.model.FlashcardReview;
import com.gt.studyplanner.model.Recommendation;
import com.gt.studyplanner.model.ReviewItem;
import com.gt.studyplanner.model.ReviewState;
import com.gt.studyplanner.model.StudyLoad;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

@Component
public class ReviewService {

    private static final Logger log = LoggerFactory.getLogger(ReviewService.class);

    private static final int MAX_WRITE_ATTEMPTS = 2;

    private final ReviewStateDao reviewStateDao;
    private final PerformanceHistoryDao performanceHistoryDao;
    private final SpacedRepetitionScheduler scheduler;

    @Autowired
    public ReviewService(ReviewStateDao reviewStateDao,
                         PerformanceHistoryDao performanceHistoryDao,
                         SpacedRepetitionScheduler scheduler) {
        this.reviewStateDao = reviewStateDao;
        this.performanceHistoryDao = performanceHistoryDao;
        this.scheduler = scheduler;
    }

    /**
     * Records one review of a card and returns its new state. The state write is a compare-and-swap on the stored
     * version; a lost race is retried once against the fresh state before giving up with a ConflictException.
     */
    public ReviewState reviewItem(String cardId, int quality, double responseTimeSeconds, Instant now) {
        Flashcard flashcard = reviewStateDao.loadFlashcard(cardId)
                .orElseThrow(() -> new NotFoundException("Flashcard " + cardId + " does not exist"));

        for (int attempt = 1; attempt <= MAX_WRITE_ATTEMPTS; attempt++) {
            ReviewState current = reviewStateDao.loadReviewState(cardId).orElse(ReviewState.initial(cardId, now));
            ReviewState next = withDifficultyAdjustment(scheduler.advance(current, quality, now), flashcard, now);
            ReviewState toSave = withVersion(next, current.version() + 1);

            if (reviewStateDao.saveReviewState(toSave, current.version())) {
                performanceHistoryDao.recordFlashcardReview(flashcard.learnerId(),
                        new FlashcardReview(cardId, Math.max(0, Math.min(5, quality)), responseTimeSeconds, now));

                log.info("Reviewed card {} with quality {}: interval {} days, ease {}",
                        cardId, quality, toSave.intervalDays(), toSave.easeFactor());
                return toSave;
            }

            log.warn("Review state of card {} changed concurrently (attempt {})", cardId, attempt);
        }

        throw new ConflictException("Unable to record review of card " + cardId + " due to concurrent updates");
    }

    // Returns the learner's cards for a course that are due by now, most urgent first
    public List<ReviewItem> dueItems(String learnerId, String courseId, int limit, Instant now) {
        List<ReviewItem> due = loadReviewItems(learnerId, courseId, now)
                .stream()
                .filter(item -> item.state().nextDueAt() == null || !item.state().nextDueAt().isAfter(now))
                .toList();

        List<ReviewItem> prioritized = scheduler.prioritize(due, now);
        return limit > 0 && prioritized.size() > limit ? prioritized.subList(0, limit) : prioritized;
    }

    public StudyLoad getStudyLoad(String learnerId, String courseId, Instant now) {
        return scheduler.studyLoad(loadReviewItems(learnerId, courseId, now), now);
    }

    public List<Recommendation> getReviewRecommendations(String learnerId, String courseId, Instant now) {
        List<ReviewItem> items = loadReviewItems(learnerId, courseId, now);
        Instant lastReviewedAt = items.stream()
                .map(item -> item.state().lastReviewedAt())
                .filter(Objects::nonNull)
                .max(Comparator.naturalOrder())
                .orElse(null);

        return scheduler.reviewRecommendations(scheduler.studyLoad(items, now), lastReviewedAt, now);
    }

    public int getOptimalBatchSize(String learnerId, String courseId, int availableMinutes, Instant now) {
        return scheduler.optimalBatchSize(dueItems(learnerId, courseId, 0, now).size(), availableMinutes);
    }

    private List<ReviewItem> loadReviewItems(String learnerId, String courseId, Instant now) {
        List<Flashcard> flashcards = reviewStateDao.loadFlashcards(learnerId, courseId);
        Map<String, ReviewState> states = reviewStateDao.loadReviewStates(flashcards.stream().map(Flashcard::id).toList())
                .stream()
                .collect(Collectors.toMap(ReviewState::cardId, Function.identity()));

        List<ReviewItem> items = new ArrayList<>(flashcards.size());
        for (Flashcard flashcard : flashcards) {
            ReviewState state = states.getOrDefault(flashcard.id(), ReviewState.initial(flashcard.id(), now));
            items.add(new ReviewItem(flashcard, state, 0));
        }

        return items;
    }

    // The first two learning steps (1 and 6 days) are fixed; only grown intervals are scaled by card difficulty
    private ReviewState withDifficultyAdjustment(ReviewState state, Flashcard flashcard, Instant now) {
        if (state.repetitionCount() <= 2) {
            return state;
        }

        int adjustedInterval = scheduler.adjustIntervalForDifficulty(state.intervalDays(), flashcard.difficulty());
        return new ReviewState(state.cardId(), state.easeFactor(), adjustedInterval, state.repetitionCount(),
                now.plus(Duration.ofDays(adjustedInterval)), state.lastReviewedAt(), state.totalReviews(),
                state.successfulReviews(), state.version());
    }

    private static ReviewState withVersion(ReviewState state, long version) {
        return new ReviewState(state.cardId(), state.easeFactor(), state.intervalDays(), state.repetitionCount(),
                state.nextDueAt(), state.lastReviewedAt(), state.totalReviews(), state.successfulReviews(), version);
    }
}
