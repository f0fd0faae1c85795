package com.gt.studyplanner.model;

/**
 * An activity that just finished, reported alongside an adaptation request. type is one of quiz_completion,
 * study_session or flashcard_review and decides which of the other fields are read.
 */
public record RecentActivity(String type,
                             Double quizScore,
                             Integer sessionMinutes,
                             Integer cardsReviewed,
                             Integer cardsCorrect) {

    public static final String QUIZ_COMPLETION = "quiz_completion";
    public static final String STUDY_SESSION = "study_session";
    public static final String FLASHCARD_REVIEW = "flashcard_review";
}
