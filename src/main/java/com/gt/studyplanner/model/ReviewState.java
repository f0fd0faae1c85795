package com.gt.studyplanner.model;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * SM-2 memory state of a single flashcard. version is bumped on every persisted write and is used for
 * compare-and-swap updates.
 */
public record ReviewState(String cardId,
                          double easeFactor,
                          int intervalDays,
                          int repetitionCount,
                          Instant nextDueAt,
                          Instant lastReviewedAt,
                          int totalReviews,
                          int successfulReviews,
                          long version) {

    public static final double INITIAL_EASE_FACTOR = 2.5;

    public static ReviewState initial(String cardId, Instant now) {
        return new ReviewState(cardId, INITIAL_EASE_FACTOR, 1, 0, now, null, 0, 0, 0);
    }

    public double successRate() {
        return totalReviews > 0 ? (double) successfulReviews / totalReviews : 0;
    }

    public long overdueDays(Instant now) {
        if (nextDueAt == null || !nextDueAt.isBefore(now)) {
            return 0;
        }
        return ChronoUnit.DAYS.between(nextDueAt, now);
    }
}
