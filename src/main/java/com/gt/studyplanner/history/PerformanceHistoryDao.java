package com.gt.studyplanner.history;

import com.gt.studyplanner.model.FlashcardReview;
import com.gt.studyplanner.model.QuizAttempt;
import com.gt.studyplanner.model.SessionRecord;
import com.gt.studyplanner.model.TopicProgress;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

// Read access to a learner's raw history. An empty courseId means all of the learner's courses.
public interface PerformanceHistoryDao {

    List<QuizAttempt> fetchQuizAttempts(String learnerId, Optional<String> courseId, Instant since);

    List<SessionRecord> fetchStudySessions(String learnerId, Optional<String> courseId, Instant since);

    List<FlashcardReview> fetchFlashcardReviews(String learnerId, Optional<String> courseId, Instant since);

    List<TopicProgress> fetchLearningProgress(String learnerId, Optional<String> courseId);

    void recordFlashcardReview(String learnerId, FlashcardReview review);
}
