package com.gt.studyplanner.course;

import com.gt.studyplanner.model.Course;

import java.util.Optional;

public interface CourseDao {

    Optional<Course> loadCourse(String courseId);

    boolean learnerExists(String learnerId);
}
