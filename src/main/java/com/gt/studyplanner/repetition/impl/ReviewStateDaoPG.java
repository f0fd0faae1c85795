package com.gt.studyplanner.repetition.impl;

import com.gt.studyplanner.model.Difficulty;
import com.gt.studyplanner.model.Flashcard;
import com.gt.studyplanner.model.ReviewState;
import com.gt.studyplanner.repetition.ReviewStateDao;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class ReviewStateDaoPG implements ReviewStateDao {

    private static final String FLASHCARD_COLUMNS = "SELECT id, learner_id, course_id, difficulty, starred FROM flashcard ";

    private static final String GET_FLASHCARD_SQL =
            FLASHCARD_COLUMNS +
            "WHERE id = :cardId";

    private static final String GET_LEARNER_COURSE_FLASHCARDS_SQL =
            FLASHCARD_COLUMNS +
            "WHERE learner_id = :learnerId AND course_id = :courseId " +
            "ORDER BY id";

    private static final String REVIEW_STATE_COLUMNS =
            "SELECT card_id, ease_factor, interval_days, repetition_count, next_due_at, last_reviewed_at, " +
            "       total_reviews, successful_reviews, version " +
            "FROM review_state ";

    private static final String GET_REVIEW_STATE_SQL =
            REVIEW_STATE_COLUMNS +
            "WHERE card_id = :cardId";

    private static final String GET_REVIEW_STATES_SQL =
            REVIEW_STATE_COLUMNS +
            "WHERE card_id IN (:cardIds)";

    private static final String INSERT_REVIEW_STATE_SQL =
            "INSERT INTO review_state " +
            "(card_id, ease_factor, interval_days, repetition_count, next_due_at, last_reviewed_at, total_reviews, successful_reviews, version) " +
            "VALUES (:cardId, :easeFactor, :intervalDays, :repetitionCount, :nextDueAt, :lastReviewedAt, :totalReviews, :successfulReviews, 1) " +
            "ON CONFLICT (card_id) DO NOTHING";

    private static final String UPDATE_REVIEW_STATE_SQL =
            "UPDATE review_state " +
            "SET ease_factor = :easeFactor, interval_days = :intervalDays, repetition_count = :repetitionCount, " +
            "    next_due_at = :nextDueAt, last_reviewed_at = :lastReviewedAt, total_reviews = :totalReviews, " +
            "    successful_reviews = :successfulReviews, version = :expectedVersion + 1 " +
            "WHERE card_id = :cardId AND version = :expectedVersion";

    private final NamedParameterJdbcTemplate template;

    public ReviewStateDaoPG(NamedParameterJdbcTemplate template) {
        this.template = template;
    }

    @Override
    public Optional<Flashcard> loadFlashcard(String cardId) {
        return template.query(GET_FLASHCARD_SQL, Map.of("cardId", cardId), ReviewStateDaoPG::mapFlashcard)
                .stream()
                .findFirst();
    }

    @Override
    public List<Flashcard> loadFlashcards(String learnerId, String courseId) {
        return template.query(GET_LEARNER_COURSE_FLASHCARDS_SQL,
                Map.of("learnerId", learnerId, "courseId", courseId),
                ReviewStateDaoPG::mapFlashcard);
    }

    @Override
    public Optional<ReviewState> loadReviewState(String cardId) {
        return template.query(GET_REVIEW_STATE_SQL, Map.of("cardId", cardId), ReviewStateDaoPG::mapReviewState)
                .stream()
                .findFirst();
    }

    @Override
    public List<ReviewState> loadReviewStates(List<String> cardIds) {
        if (cardIds == null || cardIds.isEmpty()) {
            return List.of();
        }

        return template.query(GET_REVIEW_STATES_SQL, Map.of("cardIds", cardIds), ReviewStateDaoPG::mapReviewState);
    }

    @Override
    public boolean saveReviewState(ReviewState state, long expectedVersion) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        params.addValue("cardId", state.cardId());
        params.addValue("easeFactor", state.easeFactor());
        params.addValue("intervalDays", state.intervalDays());
        params.addValue("repetitionCount", state.repetitionCount());
        params.addValue("nextDueAt", toTimestamp(state.nextDueAt()));
        params.addValue("lastReviewedAt", toTimestamp(state.lastReviewedAt()));
        params.addValue("totalReviews", state.totalReviews());
        params.addValue("successfulReviews", state.successfulReviews());
        params.addValue("expectedVersion", expectedVersion);

        String sql = expectedVersion == 0 ? INSERT_REVIEW_STATE_SQL : UPDATE_REVIEW_STATE_SQL;
        return template.update(sql, params) == 1;
    }

    private static Flashcard mapFlashcard(ResultSet rs, int rowNum) throws SQLException {
        String difficulty = rs.getString("difficulty");
        return new Flashcard(
                rs.getString("id"),
                rs.getString("learner_id"),
                rs.getString("course_id"),
                difficulty == null ? Difficulty.Medium : Difficulty.fromWireName(difficulty),
                rs.getBoolean("starred"));
    }

    private static ReviewState mapReviewState(ResultSet rs, int rowNum) throws SQLException {
        return new ReviewState(
                rs.getString("card_id"),
                rs.getDouble("ease_factor"),
                rs.getInt("interval_days"),
                rs.getInt("repetition_count"),
                toInstant(rs.getTimestamp("next_due_at")),
                toInstant(rs.getTimestamp("last_reviewed_at")),
                rs.getInt("total_reviews"),
                rs.getInt("successful_reviews"),
                rs.getLong("version"));
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
