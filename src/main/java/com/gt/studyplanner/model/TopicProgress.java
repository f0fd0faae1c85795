package com.gt.studyplanner.model;

import java.time.Instant;

public record TopicProgress(String identifier,
                            int masteryLevel,
                            double completionPercentage,
                            Instant updatedAt) {

    public static final int MASTERED_LEVEL = 4;

    public TopicProgress {
        masteryLevel = Math.max(0, Math.min(5, masteryLevel));
        completionPercentage = Math.max(0, Math.min(100, completionPercentage));
    }

    public boolean mastered() {
        return masteryLevel >= MASTERED_LEVEL;
    }

    public boolean notStarted() {
        return completionPercentage == 0 && masteryLevel <= 1;
    }
}
