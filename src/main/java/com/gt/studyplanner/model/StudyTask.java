package com.gt.studyplanner.model;

public record StudyTask(String topicId,
                        String title,
                        TaskType type,
                        Difficulty difficulty,
                        int durationMinutes,
                        boolean optional) {

    public StudyTask withDurationMinutes(int newDurationMinutes) {
        return new StudyTask(topicId, title, type, difficulty, newDurationMinutes, optional);
    }

    public StudyTask asOptional() {
        return new StudyTask(topicId, title, type, difficulty, durationMinutes, true);
    }
}
