package com.gt.studyplanner.model;

import java.util.Map;

// Summary of the flashcard review backlog for one learner and course
public record StudyLoad(int totalCards,
                        int dueToday,
                        int overdue,
                        int dueThisWeek,
                        Map<String, Integer> difficultyDistribution,
                        Map<String, Integer> masteryDistribution,
                        int estimatedMinutes,
                        double studyPressure) { }
