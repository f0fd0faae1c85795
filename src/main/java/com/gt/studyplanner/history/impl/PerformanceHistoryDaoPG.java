package com.gt.studyplanner.history.impl;

import com.gt.studyplanner.history.PerformanceHistoryDao;
import com.gt.studyplanner.model.Difficulty;
import com.gt.studyplanner.model.FlashcardReview;
import com.gt.studyplanner.model.QuizAttempt;
import com.gt.studyplanner.model.SessionRecord;
import com.gt.studyplanner.model.SessionStatus;
import com.gt.studyplanner.model.TopicProgress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public class PerformanceHistoryDaoPG implements PerformanceHistoryDao {

    private static final Logger log = LoggerFactory.getLogger(PerformanceHistoryDaoPG.class);

    private static final String QUIZ_ATTEMPT_COLUMNS = "SELECT quiz_id, score, started_at, quiz_difficulty FROM quiz_attempt ";

    private static final String GET_QUIZ_ATTEMPTS_SQL =
            QUIZ_ATTEMPT_COLUMNS +
            "WHERE learner_id = :learnerId AND started_at >= :since " +
            "ORDER BY started_at ASC";

    private static final String GET_COURSE_QUIZ_ATTEMPTS_SQL =
            QUIZ_ATTEMPT_COLUMNS +
            "WHERE learner_id = :learnerId AND course_id = :courseId AND started_at >= :since " +
            "ORDER BY started_at ASC";

    private static final String SESSION_COLUMNS =
            "SELECT scheduled_start, scheduled_end, actual_start, actual_end, status, productivity_rating FROM study_session_log ";

    private static final String GET_STUDY_SESSIONS_SQL =
            SESSION_COLUMNS +
            "WHERE learner_id = :learnerId AND scheduled_start >= :since " +
            "ORDER BY scheduled_start ASC";

    private static final String GET_COURSE_STUDY_SESSIONS_SQL =
            SESSION_COLUMNS +
            "WHERE learner_id = :learnerId AND course_id = :courseId AND scheduled_start >= :since " +
            "ORDER BY scheduled_start ASC";

    private static final String REVIEW_COLUMNS =
            "SELECT r.card_id, r.quality_response, r.response_time_seconds, r.created_at " +
            "FROM flashcard_review r JOIN flashcard f ON r.card_id = f.id ";

    private static final String GET_FLASHCARD_REVIEWS_SQL =
            REVIEW_COLUMNS +
            "WHERE r.learner_id = :learnerId AND r.created_at >= :since " +
            "ORDER BY r.created_at ASC";

    private static final String GET_COURSE_FLASHCARD_REVIEWS_SQL =
            REVIEW_COLUMNS +
            "WHERE r.learner_id = :learnerId AND f.course_id = :courseId AND r.created_at >= :since " +
            "ORDER BY r.created_at ASC";

    private static final String PROGRESS_COLUMNS =
            "SELECT identifier, mastery_level, completion_percentage, updated_at FROM learning_progress ";

    private static final String GET_LEARNING_PROGRESS_SQL =
            PROGRESS_COLUMNS +
            "WHERE learner_id = :learnerId " +
            "ORDER BY identifier";

    private static final String GET_COURSE_LEARNING_PROGRESS_SQL =
            PROGRESS_COLUMNS +
            "WHERE learner_id = :learnerId AND course_id = :courseId " +
            "ORDER BY identifier";

    private static final String INSERT_FLASHCARD_REVIEW_SQL =
            "INSERT INTO flashcard_review (card_id, learner_id, quality_response, response_time_seconds, created_at) " +
            "VALUES (:cardId, :learnerId, :qualityResponse, :responseTimeSeconds, :createdAt)";

    private final NamedParameterJdbcTemplate template;

    public PerformanceHistoryDaoPG(NamedParameterJdbcTemplate template) {
        this.template = template;
    }

    @Override
    public List<QuizAttempt> fetchQuizAttempts(String learnerId, Optional<String> courseId, Instant since) {
        return template.query(
                courseId.isPresent() ? GET_COURSE_QUIZ_ATTEMPTS_SQL : GET_QUIZ_ATTEMPTS_SQL,
                historyParams(learnerId, courseId, since),
                PerformanceHistoryDaoPG::mapQuizAttempt);
    }

    @Override
    public List<SessionRecord> fetchStudySessions(String learnerId, Optional<String> courseId, Instant since) {
        return template.query(
                courseId.isPresent() ? GET_COURSE_STUDY_SESSIONS_SQL : GET_STUDY_SESSIONS_SQL,
                historyParams(learnerId, courseId, since),
                PerformanceHistoryDaoPG::mapSessionRecord);
    }

    @Override
    public List<FlashcardReview> fetchFlashcardReviews(String learnerId, Optional<String> courseId, Instant since) {
        return template.query(
                courseId.isPresent() ? GET_COURSE_FLASHCARD_REVIEWS_SQL : GET_FLASHCARD_REVIEWS_SQL,
                historyParams(learnerId, courseId, since),
                PerformanceHistoryDaoPG::mapFlashcardReview);
    }

    @Override
    public List<TopicProgress> fetchLearningProgress(String learnerId, Optional<String> courseId) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        params.addValue("learnerId", learnerId);
        courseId.ifPresent(id -> params.addValue("courseId", id));

        return template.query(
                courseId.isPresent() ? GET_COURSE_LEARNING_PROGRESS_SQL : GET_LEARNING_PROGRESS_SQL,
                params,
                PerformanceHistoryDaoPG::mapTopicProgress);
    }

    @Override
    public void recordFlashcardReview(String learnerId, FlashcardReview review) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        params.addValue("cardId", review.cardId());
        params.addValue("learnerId", learnerId);
        params.addValue("qualityResponse", review.qualityResponse());
        params.addValue("responseTimeSeconds", review.responseTimeSeconds());
        params.addValue("createdAt", Timestamp.from(review.createdAt()));

        int rows = template.update(INSERT_FLASHCARD_REVIEW_SQL, params);
        log.debug("Recorded review of card {} for learner {} ({} row)", review.cardId(), learnerId, rows);
    }

    private static MapSqlParameterSource historyParams(String learnerId, Optional<String> courseId, Instant since) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        params.addValue("learnerId", learnerId);
        params.addValue("since", Timestamp.from(since));
        courseId.ifPresent(id -> params.addValue("courseId", id));

        return params;
    }

    private static QuizAttempt mapQuizAttempt(ResultSet rs, int rowNum) throws SQLException {
        String difficulty = rs.getString("quiz_difficulty");
        return new QuizAttempt(
                rs.getString("quiz_id"),
                rs.getDouble("score"),
                toInstant(rs.getTimestamp("started_at")),
                difficulty == null ? Difficulty.Medium : Difficulty.fromWireName(difficulty));
    }

    private static SessionRecord mapSessionRecord(ResultSet rs, int rowNum) throws SQLException {
        int productivity = rs.getInt("productivity_rating");
        Integer productivityRating = rs.wasNull() ? null : productivity;

        return new SessionRecord(
                toInstant(rs.getTimestamp("scheduled_start")),
                toInstant(rs.getTimestamp("scheduled_end")),
                toInstant(rs.getTimestamp("actual_start")),
                toInstant(rs.getTimestamp("actual_end")),
                SessionStatus.fromWireName(rs.getString("status")),
                productivityRating);
    }

    private static FlashcardReview mapFlashcardReview(ResultSet rs, int rowNum) throws SQLException {
        return new FlashcardReview(
                rs.getString("card_id"),
                rs.getInt("quality_response"),
                rs.getDouble("response_time_seconds"),
                toInstant(rs.getTimestamp("created_at")));
    }

    private static TopicProgress mapTopicProgress(ResultSet rs, int rowNum) throws SQLException {
        return new TopicProgress(
                rs.getString("identifier"),
                rs.getInt("mastery_level"),
                rs.getDouble("completion_percentage"),
                toInstant(rs.getTimestamp("updated_at")));
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
