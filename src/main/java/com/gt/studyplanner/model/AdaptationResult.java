package com.gt.studyplanner.model;

import java.util.List;

public record AdaptationResult(String planId,
                               List<PlanAdaptation> adaptations,
                               List<StudySession> updatedSchedule,
                               ActivityFeedback activityFeedback) { }
