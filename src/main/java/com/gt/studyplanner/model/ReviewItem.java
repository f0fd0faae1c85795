package com.gt.studyplanner.model;

// A flashcard paired with its current review state and its computed priority
public record ReviewItem(Flashcard flashcard, ReviewState state, double priority) { }
