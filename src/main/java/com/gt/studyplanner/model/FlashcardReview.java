package com.gt.studyplanner.model;

import java.time.Instant;

public record FlashcardReview(String cardId,
                              int qualityResponse,
                              double responseTimeSeconds,
                              Instant createdAt) {

    public boolean successful() {
        return qualityResponse >= 3;
    }
}
