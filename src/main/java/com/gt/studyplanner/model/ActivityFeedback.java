package com.gt.studyplanner.model;

import java.util.List;

public record ActivityFeedback(String activityType,
                               String status,
                               String message,
                               List<Recommendation> recommendations) { }
