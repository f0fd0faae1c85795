package com.gt.studyplanner.repetition;

import com.gt.studyplanner.model.Difficulty;
import com.gt.studyplanner.model.Flashcard;
import com.gt.studyplanner.model.FlashcardReview;
import com.gt.studyplanner.model.Recommendation;
import com.gt.studyplanner.model.RecommendationPriority;
import com.gt.studyplanner.model.ReviewItem;
import com.gt.studyplanner.model.ReviewState;
import com.gt.studyplanner.model.StudyLoad;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * SM-2 scheduling for flashcards. Every method is a pure function of its arguments.
 */
@Component
public class SpacedRepetitionScheduler {

    public static final double MIN_EASE_FACTOR = 1.3;
    public static final double MAX_EASE_FACTOR = 5.0;
    public static final int PASSING_QUALITY = 3;

    private static final int SECONDS_PER_CARD = 30;
    private static final int MAX_BATCH_SIZE = 50;

    /**
     * Applies one review of the given quality (clamped to 0-5) to state. The returned state keeps the input version;
     * the persistence layer assigns the next one.
     */
    public ReviewState advance(ReviewState state, int quality, Instant now) {
        int clampedQuality = Math.max(0, Math.min(5, quality));

        double easeFactor = state.easeFactor();
        int intervalDays;
        int repetitionCount;

        if (clampedQuality >= PASSING_QUALITY) {
            if (state.repetitionCount() == 0) {
                intervalDays = 1;
            } else if (state.repetitionCount() == 1) {
                intervalDays = 6;
            } else {
                intervalDays = (int) Math.round(state.intervalDays() * easeFactor);
            }
            repetitionCount = state.repetitionCount() + 1;

            int miss = 5 - clampedQuality;
            easeFactor += 0.1 - miss * (0.08 + miss * 0.02);
        } else {
            repetitionCount = 0;
            intervalDays = 1;
            easeFactor -= 0.2;
        }

        easeFactor = clampEaseFactor(easeFactor);
        intervalDays = Math.max(1, intervalDays);

        return new ReviewState(
                state.cardId(),
                easeFactor,
                intervalDays,
                repetitionCount,
                now.plus(Duration.ofDays(intervalDays)),
                now,
                state.totalReviews() + 1,
                state.successfulReviews() + (clampedQuality >= PASSING_QUALITY ? 1 : 0),
                state.version());
    }

    // Easy cards wait longer between reviews, hard cards come back sooner
    public int adjustIntervalForDifficulty(int intervalDays, Difficulty difficulty) {
        double multiplier;
        switch (difficulty) {
            case Easy:
                multiplier = 1.2;
                break;
            case Hard:
                multiplier = 0.8;
                break;
            default:
                multiplier = 1.0;
        }

        return Math.max(1, (int) (intervalDays * multiplier));
    }

    /**
     * Fraction (0-1) of the reviews created within windowDays of now that were successful recalls. 0 when there are
     * none.
     */
    public double retentionRate(List<FlashcardReview> reviews, int windowDays, Instant now) {
        Instant since = now.minus(Duration.ofDays(windowDays));

        int total = 0;
        int successful = 0;
        for (FlashcardReview review : reviews) {
            if (review.createdAt() != null && !review.createdAt().isBefore(since) && !review.createdAt().isAfter(now)) {
                total++;
                if (review.successful()) {
                    successful++;
                }
            }
        }

        return total == 0 ? 0 : (double) successful / total;
    }

    /**
     * Orders cards most urgent first. Equal priorities keep their input order.
     */
    public List<ReviewItem> prioritize(List<ReviewItem> items, Instant now) {
        List<ReviewItem> scored = new ArrayList<>(items.size());
        for (ReviewItem item : items) {
            scored.add(new ReviewItem(item.flashcard(), item.state(), priorityScore(item.flashcard(), item.state(), now)));
        }

        scored.sort(Comparator.comparingDouble(ReviewItem::priority).reversed());
        return scored;
    }

    double priorityScore(Flashcard flashcard, ReviewState state, Instant now) {
        double score = 0;

        score += state.overdueDays(now) * 10;

        if (state.totalReviews() > 0) {
            score += (1 - state.successRate()) * 20;
        }

        if (flashcard.difficulty() == Difficulty.Hard) {
            score += 5;
        } else if (flashcard.difficulty() == Difficulty.Medium) {
            score += 2;
        }

        if (flashcard.starred()) {
            score += 15;
        }

        if (state.easeFactor() < 2.0) {
            score += (2.0 - state.easeFactor()) * 10;
        }

        return score;
    }

    public StudyLoad studyLoad(List<ReviewItem> items, Instant now) {
        LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);
        LocalDate endOfWeek = today.plusDays(7);

        int dueToday = 0;
        int overdue = 0;
        int dueThisWeek = 0;
        Map<String, Integer> difficultyDistribution = new LinkedHashMap<>();
        for (Difficulty difficulty : Difficulty.values()) {
            difficultyDistribution.put(difficulty.getWireName(), 0);
        }
        Map<String, Integer> masteryDistribution = new LinkedHashMap<>();
        for (String bucket : List.of("new", "learning", "reviewing", "mastered")) {
            masteryDistribution.put(bucket, 0);
        }

        for (ReviewItem item : items) {
            ReviewState state = item.state();
            if (state.nextDueAt() != null) {
                LocalDate dueDate = LocalDate.ofInstant(state.nextDueAt(), ZoneOffset.UTC);
                if (state.nextDueAt().isBefore(now)) {
                    overdue++;
                }
                if (!dueDate.isAfter(today)) {
                    dueToday++;
                }
                if (!dueDate.isAfter(endOfWeek)) {
                    dueThisWeek++;
                }
            }

            difficultyDistribution.merge(item.flashcard().difficulty().getWireName(), 1, Integer::sum);
            masteryDistribution.merge(masteryBucket(state), 1, Integer::sum);
        }

        // overdue cards take half again as long as a card reviewed on time
        double estimatedMinutes = (dueToday - overdue) * SECONDS_PER_CARD / 60.0 + overdue * SECONDS_PER_CARD * 1.5 / 60.0;
        double studyPressure = items.isEmpty()
                ? 0
                : Math.min(100, (overdue * 2.0 + dueToday) / items.size() * 100);

        return new StudyLoad(items.size(), dueToday, overdue, dueThisWeek, difficultyDistribution, masteryDistribution,
                (int) Math.ceil(estimatedMinutes), studyPressure);
    }

    public List<Recommendation> reviewRecommendations(StudyLoad load, Instant lastReviewedAt, Instant now) {
        List<Recommendation> recommendations = new ArrayList<>();

        if (load.overdue() > 0) {
            recommendations.add(Recommendation.of("overdue_cards", RecommendationPriority.High, "Review overdue cards",
                    "You have " + load.overdue() + " overdue cards. Review them to maintain your progress.",
                    "review_overdue"));
        }

        if (load.dueToday() > 0) {
            recommendations.add(Recommendation.of("due_cards", RecommendationPriority.Medium, "Cards due today",
                    "You have " + load.dueToday() + " cards due for review today.",
                    "start_review_session"));
        }

        if (load.studyPressure() > 70) {
            recommendations.add(Recommendation.of("high_workload", RecommendationPriority.High, "High review workload",
                    "Your study workload is high. Consider increasing daily review time or reducing new cards.",
                    "adjust_settings"));
        }

        if (lastReviewedAt != null && Duration.between(lastReviewedAt, now).toDays() > 2) {
            recommendations.add(Recommendation.of("study_gap", RecommendationPriority.Medium, "Resume reviewing",
                    "You haven't reviewed in a while. Regular practice is key to retention.",
                    "resume_studying"));
        }

        int hour = now.atZone(ZoneOffset.UTC).getHour();
        if (hour >= 9 && hour <= 11) {
            recommendations.add(Recommendation.of("optimal_time", RecommendationPriority.Low, "Good time to study",
                    "Morning is a great time for focused studying.",
                    "start_morning_session"));
        }

        return recommendations;
    }

    public int optimalBatchSize(int totalDue, int availableMinutes) {
        int fitsInTime = availableMinutes * 60 / SECONDS_PER_CARD;
        return Math.max(1, Math.min(MAX_BATCH_SIZE, Math.min(totalDue, fitsInTime)));
    }

    private static String masteryBucket(ReviewState state) {
        if (state.totalReviews() == 0) {
            return "new";
        } else if (state.repetitionCount() < 2) {
            return "learning";
        } else if (state.intervalDays() < 21) {
            return "reviewing";
        }
        return "mastered";
    }

    private static double clampEaseFactor(double easeFactor) {
        return Math.max(MIN_EASE_FACTOR, Math.min(MAX_EASE_FACTOR, easeFactor));
    }
}
