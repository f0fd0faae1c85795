package com.gt.studyplanner.model;

public record CourseTopic(String id, String title, Difficulty difficulty) { }
