package com.gt.studyplanner.history;

import com.gt.studyplanner.model.FlashcardReview;
import com.gt.studyplanner.model.QuizAttempt;
import com.gt.studyplanner.model.SessionRecord;
import com.gt.studyplanner.model.TopicProgress;

import java.util.List;

// Raw records loaded for one learner in a single pass over the repository
public record LearnerHistory(List<QuizAttempt> quizAttempts,
                             List<SessionRecord> sessions,
                             List<FlashcardReview> reviews,
                             List<TopicProgress> progress) {

    public static LearnerHistory empty() {
        return new LearnerHistory(List.of(), List.of(), List.of(), List.of());
    }
}
