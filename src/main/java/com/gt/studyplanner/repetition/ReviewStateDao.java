package com.gt.studyplanner.repetition;

import com.gt.studyplanner.model.Flashcard;
import com.gt.studyplanner.model.ReviewState;

import java.util.List;
import java.util.Optional;

public interface ReviewStateDao {

    Optional<Flashcard> loadFlashcard(String cardId);

    List<Flashcard> loadFlashcards(String learnerId, String courseId);

    Optional<ReviewState> loadReviewState(String cardId);

    List<ReviewState> loadReviewStates(List<String> cardIds);

    // Writes state only if the stored version still equals expectedVersion (0 = not yet stored). The stored
    // version becomes expectedVersion + 1.
    boolean saveReviewState(ReviewState state, long expectedVersion);
}
