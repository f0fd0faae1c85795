package com.gt.studyplanner.model;

import java.time.LocalDate;
import java.util.List;

public record GeneratedPlan(StudyPlan plan,
                            List<String> recommendations,
                            LearningProfile learningProfile,
                            LoadDistribution loadDistribution,
                            LocalDate estimatedCompletion) { }
