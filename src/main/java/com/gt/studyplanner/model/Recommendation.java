package com.gt.studyplanner.model;

import java.util.List;

public record Recommendation(String type,
                             RecommendationPriority priority,
                             String title,
                             String description,
                             List<String> actionItems) {

    public static Recommendation of(String type, RecommendationPriority priority, String title, String description, String... actionItems) {
        return new Recommendation(type, priority, title, description, List.of(actionItems));
    }
}
