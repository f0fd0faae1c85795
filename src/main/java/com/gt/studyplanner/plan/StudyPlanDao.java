package com.gt.studyplanner.plan;

import com.gt.studyplanner.model.StudyPlan;

import java.util.List;
import java.util.Optional;

public interface StudyPlanDao {

    Optional<StudyPlan> loadPlan(String planId);

    Optional<StudyPlan> loadActivePlan(String learnerId, String courseId);

    List<String> loadActivePlanIds();

    void createPlan(StudyPlan plan);

    // Writes plan only if the stored version still equals expectedVersion. The stored version becomes
    // expectedVersion + 1.
    boolean savePlan(StudyPlan plan, long expectedVersion);
}
