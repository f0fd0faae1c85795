package com.gt.studyplanner.model;

import java.time.Duration;
import java.time.Instant;

// A logged study session. productivityRating is the learner's 1-5 self rating and may be absent.
public record SessionRecord(Instant scheduledStart,
                            Instant scheduledEnd,
                            Instant actualStart,
                            Instant actualEnd,
                            SessionStatus status,
                            Integer productivityRating) {

    public Instant effectiveStart() {
        return actualStart != null ? actualStart : scheduledStart;
    }

    public Duration actualDuration() {
        if (actualStart == null || actualEnd == null || actualEnd.isBefore(actualStart)) {
            return Duration.ZERO;
        }
        return Duration.between(actualStart, actualEnd);
    }
}
