package com.gt.studyplanner.model;

public record Flashcard(String id,
                        String learnerId,
                        String courseId,
                        Difficulty difficulty,
                        boolean starred) { }
