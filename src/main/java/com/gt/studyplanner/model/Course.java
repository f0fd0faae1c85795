package com.gt.studyplanner.model;

import java.util.List;

public record Course(String id, String name, List<CourseTopic> topics) { }
